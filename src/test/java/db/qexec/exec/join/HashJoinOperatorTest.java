package db.qexec.exec.join;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.qexec.Fixtures;
import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.DataType;
import db.qexec.catalog.TableSchema;
import db.qexec.config.ExecConfig;
import db.qexec.error.TypeMismatchException;
import db.qexec.exec.ExecContext;
import db.qexec.exec.Row;

public class HashJoinOperatorTest {
    private static final TableSchema L = new TableSchema("l", List.of(
        ColumnSchema.of("id", DataType.INT), new ColumnSchema("tag", DataType.VARCHAR, 5)));
    private static final TableSchema R = new TableSchema("r", List.of(
        ColumnSchema.of("rid", DataType.INT), new ColumnSchema("label", DataType.VARCHAR, 5)));
    private static final TableSchema KL = Fixtures.schema("kl", "k", "v");
    private static final TableSchema KR = Fixtures.schema("kr", "rk", "w");

    @TempDir
    Path tmp;

    private ExecContext context(int blockCapacity, int memoryBlocks, int maxHashDepth) {
        return new ExecContext(new ExecConfig(blockCapacity, memoryBlocks, tmp.toString(), maxHashDepth, true));
    }

    @Test
    void spilledJoinOfTheReferenceRelations() {
        List<List<Object>> left = List.of(List.of(1, "a"), List.of(1, "b"), List.of(2, "c"));
        List<List<Object>> right = List.of(List.of(1, "x"), List.of(2, "y"), List.of(2, "z"));
        try (ExecContext ctx = Fixtures.context(tmp, 1, 3)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, L, left), Fixtures.scan(ctx, R, right), "id", "rid", 3, ctx);
            List<Row> rows = Fixtures.collect(join);
            assertTrue(join.spilled());
            assertEquals(Map.of(
                List.of(1, "a", 1, "x"), 1,
                List.of(1, "b", 1, "x"), 1,
                List.of(2, "c", 2, "y"), 1,
                List.of(2, "c", 2, "z"), 1), Fixtures.multiset(rows));
            assertEquals(0, ctx.partitions().liveCount());
        }
    }

    @Test
    void smallLeftInputJoinsInMemory() {
        try (ExecContext ctx = Fixtures.context(tmp, 4, 4)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, KL, List.of(List.of(1, 10), List.of(2, 20))),
                Fixtures.scan(ctx, KR, Fixtures.randomRows(new Random(1), 40, 4)), "k", "rk", 4, ctx);
            Fixtures.collect(join);
            assertFalse(join.spilled());
            assertEquals(-1, join.maxDepthReached());
            assertEquals(0, ctx.stats().partitionsCreated());
        }
    }

    @Test
    void leftInputFillingTheBuildBudgetExactlyStaysInMemory() {
        // (M - 2) * cap = 4 rows
        List<List<Object>> left = List.of(List.of(1, 10), List.of(2, 20), List.of(3, 30), List.of(1, 40));
        List<List<Object>> right = Fixtures.randomRows(new Random(2), 20, 5);
        try (ExecContext ctx = Fixtures.context(tmp, 2, 4)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, KL, left), Fixtures.scan(ctx, KR, right), "k", "rk", 4, ctx);
            List<Row> rows = Fixtures.collect(join);
            assertFalse(join.spilled());
            assertEquals(0, ctx.stats().partitionsCreated());
            assertEquals(Fixtures.expectedEquiJoin(left, right), Fixtures.multiset(rows));
        }
    }

    @Test
    void oneRowPastTheBuildBudgetPartitionsBothInputs() {
        List<List<Object>> left = List.of(List.of(1, 10), List.of(2, 20), List.of(3, 30), List.of(1, 40), List.of(4, 50));
        List<List<Object>> right = Fixtures.randomRows(new Random(2), 20, 5);
        try (ExecContext ctx = Fixtures.context(tmp, 2, 4)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, KL, left), Fixtures.scan(ctx, KR, right), "k", "rk", 4, ctx);
            List<Row> rows = Fixtures.collect(join);
            assertTrue(join.spilled());
            assertTrue(join.maxDepthReached() >= 0);
            assertEquals(Fixtures.expectedEquiJoin(left, right), Fixtures.multiset(rows));
            assertEquals(0, ctx.partitions().liveCount());
        }
    }

    @Test
    void recursivePartitioningMatchesUnconstrainedResult() {
        Random rnd = new Random(17);
        List<List<Object>> left = Fixtures.randomRows(rnd, 300, 80);
        List<List<Object>> right = Fixtures.randomRows(rnd, 200, 80);

        List<Row> unconstrained;
        try (ExecContext ctx = context(2, 400, 8)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, KL, left), Fixtures.scan(ctx, KR, right), "k", "rk", 400, ctx);
            unconstrained = Fixtures.collect(join);
            assertFalse(join.spilled());
        }
        try (ExecContext ctx = context(2, 4, 8)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, KL, left), Fixtures.scan(ctx, KR, right), "k", "rk", 4, ctx);
            List<Row> constrained = Fixtures.collect(join);
            assertTrue(join.maxDepthReached() >= 1, "expected at least two partitioning levels");
            assertEquals(Fixtures.multiset(unconstrained), Fixtures.multiset(constrained));
            assertEquals(Fixtures.expectedEquiJoin(left, right), Fixtures.multiset(constrained));
            assertEquals(0, ctx.partitions().liveCount());
        }
    }

    @Test
    void singleKeyBucketFallsBackToNestedLoop() {
        List<List<Object>> left = new ArrayList<>();
        List<List<Object>> right = new ArrayList<>();
        for (int i = 0; i < 20; i++) left.add(List.of(7, i));
        for (int i = 0; i < 10; i++) right.add(List.of(7, i));
        try (ExecContext ctx = Fixtures.context(tmp, 2, 3)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, KL, left), Fixtures.scan(ctx, KR, right), "k", "rk", 3, ctx);
            List<Row> rows = Fixtures.collect(join);
            assertEquals(200, rows.size());
            assertEquals(1, join.degeneratePairs());
            assertEquals(0, join.maxDepthReached(), "a single-key bucket must not be repartitioned");
            assertEquals(0, ctx.partitions().liveCount());
        }
    }

    @Test
    void depthLimitFallsBackToNestedLoop() {
        Random rnd = new Random(23);
        List<List<Object>> left = Fixtures.randomRows(rnd, 80, 20);
        List<List<Object>> right = Fixtures.randomRows(rnd, 80, 20);
        try (ExecContext ctx = context(2, 3, 1)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, KL, left), Fixtures.scan(ctx, KR, right), "k", "rk", 3, ctx);
            List<Row> rows = Fixtures.collect(join);
            assertEquals(0, join.maxDepthReached());
            assertTrue(join.degeneratePairs() > 0);
            assertEquals(Fixtures.expectedEquiJoin(left, right), Fixtures.multiset(rows));
        }
    }

    @Test
    void outputKeepsLeftColumnsFirstWhenBuildingOnTheRight() {
        List<List<Object>> left = new ArrayList<>();
        for (int i = 0; i < 50; i++) left.add(List.of(i % 5, 1000 + i));
        List<List<Object>> right = List.of(List.of(3, -1));
        try (ExecContext ctx = Fixtures.context(tmp, 2, 3)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, KL, left), Fixtures.scan(ctx, KR, right), "k", "rk", 3, ctx);
            List<Row> rows = Fixtures.collect(join);
            assertTrue(join.spilled());
            assertEquals(10, rows.size());
            for (Row r : rows) {
                assertEquals(3, r.get(0));
                assertTrue((Integer) r.get(1) >= 1000);
                assertEquals(-1, r.get(3));
            }
            assertEquals("rk", join.schema().get(2).name());
        }
    }

    @Test
    void nullKeysNeverMatch() {
        List<List<Object>> left = List.of(Arrays.asList(null, 1), Arrays.asList(null, 2), List.of(4, 3));
        List<List<Object>> right = List.of(Arrays.asList(null, 5), List.of(4, 6));
        for (int m : new int[] {3, 10}) {
            try (ExecContext ctx = Fixtures.context(tmp, 1, m)) {
                List<Row> rows = Fixtures.collect(new HashJoinOperator(
                    Fixtures.scan(ctx, KL, left), Fixtures.scan(ctx, KR, right), "k", "rk", m, ctx));
                assertEquals(1, rows.size());
                assertEquals(List.of(4, 3, 4, 6), rows.get(0).values());
            }
        }
    }

    @Test
    void integralFloatKeysMatchIntegers() {
        TableSchema floats = new TableSchema("f", List.of(ColumnSchema.of("fk", DataType.FLOAT), ColumnSchema.of("w", DataType.INT)));
        try (ExecContext ctx = Fixtures.context(tmp, 1, 3)) {
            List<Row> rows = Fixtures.collect(new HashJoinOperator(
                Fixtures.scan(ctx, KL, List.of(List.of(2, 0), List.of(3, 0), List.of(3, 1))),
                Fixtures.scan(ctx, floats, List.of(List.of(3.0, 9), List.of(2.5, 9))), "k", "fk", 3, ctx));
            assertEquals(2, rows.size());
        }
    }

    @Test
    void abandoningMidwayReleasesEveryPartition() {
        Random rnd = new Random(29);
        try (ExecContext ctx = Fixtures.context(tmp, 2, 3)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, KL, Fixtures.randomRows(rnd, 100, 10)),
                Fixtures.scan(ctx, KR, Fixtures.randomRows(rnd, 100, 10)), "k", "rk", 3, ctx);
            join.open();
            for (int i = 0; i < 5; i++) assertNotNull(join.next());
            assertTrue(ctx.partitions().liveCount() > 0);
            join.close();
            assertEquals(0, ctx.partitions().liveCount());
        }
    }

    @Test
    void incomparableKeyTypesFailAtOpen() {
        try (ExecContext ctx = Fixtures.context(tmp, 1, 3)) {
            HashJoinOperator join = new HashJoinOperator(
                Fixtures.scan(ctx, L, List.of(List.of(1, "a"))), Fixtures.scan(ctx, R, List.of(List.of(1, "x"))),
                "id", "label", 3, ctx);
            assertThrows(TypeMismatchException.class, join::open);
            join.close();
            assertEquals(0, ctx.partitions().liveCount());
        }
    }
}
