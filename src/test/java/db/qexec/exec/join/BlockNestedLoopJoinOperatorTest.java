package db.qexec.exec.join;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.qexec.Fixtures;
import db.qexec.catalog.TableSchema;
import db.qexec.error.ConfigurationException;
import db.qexec.exec.BlockScanOperator;
import db.qexec.exec.ColumnComparison;
import db.qexec.exec.ComparisonPredicate.Op;
import db.qexec.exec.ExecContext;
import db.qexec.exec.Row;
import db.qexec.storage.IoStats;
import db.qexec.storage.MemoryBlockSource;

public class BlockNestedLoopJoinOperatorTest {
    private static final TableSchema L = Fixtures.schema("l", "k", "v");
    private static final TableSchema R = Fixtures.schema("r", "rk", "w");

    @TempDir
    Path tmp;

    @Test
    void resultIsIndependentOfMemoryBudget() {
        Random rnd = new Random(11);
        List<List<Object>> left = Fixtures.randomRows(rnd, 37, 8);
        List<List<Object>> right = Fixtures.randomRows(rnd, 23, 8);
        Map<List<Object>, Integer> expected = Fixtures.expectedEquiJoin(left, right);
        for (int m : new int[] {3, 4, 7, 50}) {
            try (ExecContext ctx = Fixtures.context(tmp, 3, m)) {
                BlockNestedLoopJoinOperator join = new BlockNestedLoopJoinOperator(
                    Fixtures.scan(ctx, L, left), Fixtures.scan(ctx, R, right), ColumnComparison.equi(0, 0), m, ctx);
                assertEquals(expected, Fixtures.multiset(Fixtures.collect(join)), "budget " + m);
            }
        }
    }

    @Test
    void innerBlockReadsFollowTheCostFormula() {
        List<List<Object>> left = Fixtures.randomRows(new Random(1), 20, 5);  // 10 blocks of 2
        List<List<Object>> right = Fixtures.randomRows(new Random(2), 6, 5);  // 3 blocks of 2
        try (ExecContext ctx = Fixtures.context(tmp, 2, 5)) {
            IoStats innerStats = new IoStats();
            MemoryBlockSource inner = MemoryBlockSource.ofValues(R, right, 2, innerStats);
            BlockNestedLoopJoinOperator join = new BlockNestedLoopJoinOperator(
                Fixtures.scan(ctx, L, left), new BlockScanOperator(inner), null, 5, ctx);
            List<Row> rows = Fixtures.collect(join);
            assertEquals(20 * 6, rows.size()); // cross product
            // ceil(10 / (5 - 2)) * 3
            assertEquals(4, join.innerScans());
            assertEquals(12, innerStats.blocksRead());
        }
    }

    @Test
    void thetaPredicateEmitsEverySatisfyingPair() {
        try (ExecContext ctx = Fixtures.context(tmp, 2, 3)) {
            List<List<Object>> left = List.of(List.of(1, 0), List.of(3, 0), List.of(5, 0));
            List<List<Object>> right = List.of(List.of(2, 0), List.of(4, 0), List.of(4, 1));
            BlockNestedLoopJoinOperator join = new BlockNestedLoopJoinOperator(
                Fixtures.scan(ctx, L, left), Fixtures.scan(ctx, R, right),
                ColumnComparison.forColumnNames(L.columns(), "k", Op.LT, R.columns(), "rk"), 3, ctx);
            List<Row> rows = Fixtures.collect(join);
            // 1<2, 1<4 (x2), 3<4 (x2)
            assertEquals(5, rows.size());
            List<Object> first = new ArrayList<>(rows.get(0).values());
            assertEquals(4, first.size());
            assertEquals("rk", join.schema().get(2).name());
        }
    }

    @Test
    void duplicatesAreNotCollapsed() {
        try (ExecContext ctx = Fixtures.context(tmp, 1, 3)) {
            List<List<Object>> left = List.of(List.of(7, 0), List.of(7, 0));
            List<List<Object>> right = List.of(List.of(7, 1), List.of(7, 1), List.of(7, 1));
            BlockNestedLoopJoinOperator join = new BlockNestedLoopJoinOperator(
                Fixtures.scan(ctx, L, left), Fixtures.scan(ctx, R, right), ColumnComparison.equi(0, 0), 3, ctx);
            assertEquals(6, Fixtures.collect(join).size());
        }
    }

    @Test
    void budgetBelowThreeBlocksIsRejected() {
        try (ExecContext ctx = Fixtures.context(tmp, 2, 3)) {
            assertThrows(ConfigurationException.class, () -> new BlockNestedLoopJoinOperator(
                Fixtures.scan(ctx, L, List.of()), Fixtures.scan(ctx, R, List.of()), null, 2, ctx));
        }
    }
}
