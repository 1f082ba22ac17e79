package db.qexec.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.qexec.Fixtures;
import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.DataType;
import db.qexec.catalog.TableSchema;
import db.qexec.exec.ComparisonPredicate.Op;

public class FilterOperatorTest {
    private static final TableSchema STUDENTS = new TableSchema("students", List.of(
        ColumnSchema.of("id", DataType.INT),
        new ColumnSchema("name", DataType.VARCHAR, 50),
        ColumnSchema.of("active", DataType.BOOLEAN)
    ));

    @TempDir
    Path tmp;

    @Test
    void filtersRowsByPredicate() {
        try (ExecContext ctx = Fixtures.context(tmp, 2, 3)) {
            Operator scan = Fixtures.scan(ctx, STUDENTS, List.of(
                List.of(1, "A", true), List.of(2, "B", false), List.of(3, "C", true), List.of(4, "D", false)));
            // WHERE active = true OR id < 2
            Predicate pred = CompoundPredicate.or(
                ComparisonPredicate.forColumnName(STUDENTS.columns(), "active", Op.EQ, true),
                ComparisonPredicate.forColumnName(STUDENTS.columns(), "id", Op.LT, 2));
            List<Row> rows = Fixtures.collect(new FilterOperator(scan, pred));
            // (1,A,true) matches both predicates but is emitted once
            assertEquals(2, rows.size());
            assertEquals(1, rows.get(0).get(0));
            assertEquals(3, rows.get(1).get(0));
        }
    }

    @Test
    void nullNeverSatisfiesAComparison() {
        try (ExecContext ctx = Fixtures.context(tmp, 2, 3)) {
            Operator scan = Fixtures.scan(ctx, STUDENTS, List.of(
                Arrays.asList(null, "N", true), List.of(5, "E", true), List.of(6, "F", true)));
            Predicate pred = ComparisonPredicate.forColumnName(STUDENTS.columns(), "id", Op.NE, 5);
            List<Row> rows = Fixtures.collect(new FilterOperator(scan, pred));
            assertEquals(1, rows.size());
            assertEquals(6, rows.get(0).get(0));
        }
    }

    @Test
    void andCombinesRangeBounds() {
        try (ExecContext ctx = Fixtures.context(tmp, 2, 3)) {
            Operator scan = Fixtures.scan(ctx, STUDENTS, List.of(
                List.of(1, "A", true), List.of(5, "E", true), List.of(7, "G", false), List.of(9, "I", true)));
            Predicate pred = CompoundPredicate.and(
                ComparisonPredicate.forColumnName(STUDENTS.columns(), "id", Op.GTE, 5),
                ComparisonPredicate.forColumnName(STUDENTS.columns(), "id", Op.LTE, 8L));
            List<Row> rows = Fixtures.collect(new FilterOperator(scan, pred));
            assertEquals(List.of(5, 7), rows.stream().map(r -> r.get(0)).toList());
        }
    }

    @Test
    void conjunctionOfCollectedConditions() {
        List<Predicate> conditions = List.of(
            ComparisonPredicate.forColumnName(STUDENTS.columns(), "active", Op.EQ, true),
            CompoundPredicate.not(ComparisonPredicate.forColumnName(STUDENTS.columns(), "id", Op.EQ, 3)));
        try (ExecContext ctx = Fixtures.context(tmp, 2, 3)) {
            Operator scan = Fixtures.scan(ctx, STUDENTS, List.of(
                List.of(1, "A", true), List.of(2, "B", false), List.of(3, "C", true), List.of(4, "D", true)));
            FilterOperator filter = new FilterOperator(scan, CompoundPredicate.allOf(conditions));
            List<Row> rows = Fixtures.collect(filter);
            assertEquals(List.of(1, 4), rows.stream().map(r -> r.get(0)).toList());
            assertEquals(4, filter.rowsIn());
            assertEquals(2, filter.rowsOut());
        }
    }

    @Test
    void allOfDegenerateCases() {
        Row row = Row.of(List.of(1, "A", true), STUDENTS.columns());
        assertTrue(CompoundPredicate.allOf(List.of()).test(row));
        Predicate single = ComparisonPredicate.forColumnName(STUDENTS.columns(), "id", Op.EQ, 1);
        assertSame(single, CompoundPredicate.allOf(List.of(single)));
        assertThrows(IllegalArgumentException.class, () -> CompoundPredicate.and(single));
    }
}
