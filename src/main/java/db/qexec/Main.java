package db.qexec;

import java.nio.file.Paths;
import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.DataType;
import db.qexec.catalog.TableSchema;
import db.qexec.cli.TablePrinter;
import db.qexec.config.ExecConfig;
import db.qexec.exec.BlockScanOperator;
import db.qexec.exec.ColumnComparison;
import db.qexec.exec.ComparisonPredicate;
import db.qexec.exec.ExecContext;
import db.qexec.exec.Operator;
import db.qexec.exec.ProjectionOperator;
import db.qexec.exec.Row;
import db.qexec.exec.aggr.AggregateCall;
import db.qexec.exec.aggr.AggregateOperator;
import db.qexec.exec.join.BlockNestedLoopJoinOperator;
import db.qexec.exec.join.HashJoinOperator;
import db.qexec.exec.join.SortMergeJoinOperator;
import db.qexec.query.QueryExecutor;
import db.qexec.storage.MemoryBlockSource;

/**
 * Runs every join algorithm and the aggregation over two small relations with a tiny block
 * capacity, so the spilling paths are exercised, and prints the results.
 */
public class Main {
    public static void main(String[] args) {
        ExecConfig base = args.length > 0 ? ExecConfig.load(Paths.get(args[0])) : ExecConfig.fromResource();
        ExecConfig config = new ExecConfig(1, 3, base.tempDir().toString(), base.maxHashDepth(), base.mergeGroupSpill());
        System.out.println("Config: " + config + "\n");

        TableSchema l = new TableSchema("l", List.of(
            ColumnSchema.of("id", DataType.INT),
            new ColumnSchema("tag", DataType.VARCHAR, 10)
        ));
        TableSchema r = new TableSchema("r", List.of(
            ColumnSchema.of("rid", DataType.INT),
            new ColumnSchema("label", DataType.VARCHAR, 10)
        ));
        TableSchema kv = new TableSchema("kv", List.of(
            ColumnSchema.of("k", DataType.INT),
            ColumnSchema.of("v", DataType.INT)
        ));

        QueryExecutor executor = new QueryExecutor();
        try (ExecContext ctx = new ExecContext(config)) {
            MemoryBlockSource left = MemoryBlockSource.ofValues(l, List.of(
                List.of(1, "a"), List.of(1, "b"), List.of(2, "c")), config.blockCapacity(), ctx.stats());
            MemoryBlockSource right = MemoryBlockSource.ofValues(r, List.of(
                List.of(1, "x"), List.of(2, "y"), List.of(2, "z")), config.blockCapacity(), ctx.stats());
            int m = config.numMemoryBlocks();

            run(executor, ctx, "Block nested-loop join ON l.id = r.rid",
                new BlockNestedLoopJoinOperator(new BlockScanOperator(left), new BlockScanOperator(right),
                    ColumnComparison.forColumnNames(l.columns(), "id", ComparisonPredicate.Op.EQ, r.columns(), "rid"), m, ctx));
            run(executor, ctx, "Sort-merge join ON l.id = r.rid",
                new SortMergeJoinOperator(new BlockScanOperator(left), new BlockScanOperator(right), "id", "rid", m, ctx));
            run(executor, ctx, "Hash join ON l.id = r.rid, projected to (id, tag, label)",
                new ProjectionOperator(
                    new HashJoinOperator(new BlockScanOperator(left), new BlockScanOperator(right), "id", "rid", m, ctx),
                    new int[] {0, 1, 3}));

            MemoryBlockSource rows = MemoryBlockSource.ofValues(kv, List.of(
                List.of(1, 5), List.of(1, 5), List.of(1, 3), List.of(2, 7)), config.blockCapacity(), ctx.stats());
            run(executor, ctx, "SELECT k, SUM(v), MIN(DISTINCT v) FROM kv GROUP BY k",
                new AggregateOperator(new BlockScanOperator(rows), List.of("k"),
                    List.of(AggregateCall.sum("v"), AggregateCall.min("v").distinct()), m, ctx));
        }
    }

    private static void run(QueryExecutor executor, ExecContext ctx, String title, Operator op) {
        System.out.println(title);
        ctx.stats().reset();
        List<Row> rows = executor.collect(op);
        TablePrinter.print(System.out, op.schema(), rows);
        System.out.println(ctx.stats() + ", live partitions=" + ctx.partitions().liveCount() + "\n");
    }
}
