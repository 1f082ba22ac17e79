package db.qexec.bench;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import db.qexec.catalog.ColumnSchema;
import db.qexec.catalog.DataType;
import db.qexec.catalog.TableSchema;
import db.qexec.config.ExecConfig;
import db.qexec.exec.BlockScanOperator;
import db.qexec.exec.ColumnComparison;
import db.qexec.exec.ExecContext;
import db.qexec.exec.Operator;
import db.qexec.exec.aggr.AggregateCall;
import db.qexec.exec.aggr.AggregateOperator;
import db.qexec.exec.join.BlockNestedLoopJoinOperator;
import db.qexec.exec.join.HashJoinOperator;
import db.qexec.exec.join.SortMergeJoinOperator;
import db.qexec.query.QueryExecutor;
import db.qexec.query.RowStream;
import db.qexec.storage.IoStats;
import db.qexec.storage.MemoryBlockSource;

/**
 * Times each join algorithm and the aggregation over generated relations at several memory
 * budgets and writes a JSON report under {@code benchdata/results}.
 */
public class PerfBench {
    private static final TableSchema LEFT = new TableSchema("bench_left", List.of(
            ColumnSchema.of("k", DataType.INT), ColumnSchema.of("v", DataType.INT)));
    private static final TableSchema RIGHT = new TableSchema("bench_right", List.of(
            ColumnSchema.of("rk", DataType.INT), ColumnSchema.of("rv", DataType.INT)));

    public static void main(String[] args) throws Exception {
        Path root = Paths.get("benchdata");
        Files.createDirectories(root);
        System.out.println("Benchmark root: " + root.toAbsolutePath());

        BenchmarkConfig cfg = BenchmarkConfig.fromArgs(root, args);
        System.out.println("Generating left=" + cfg.rowsLeft + ", right=" + cfg.rowsRight + " rows over "
                + cfg.keyRange + " keys");
        DataPool pool = new DataPool(cfg.keyRange, cfg.seed);
        List<List<Object>> leftRows = pool.rows(cfg.rowsLeft);
        List<List<Object>> rightRows = pool.rows(cfg.rowsRight);

        Map<String, String> descriptions = Map.of(
            "bnlj", "Block nested-loop join left.k = right.rk",
            "merge_join", "Sort-merge join left.k = right.rk",
            "hash_join", "External hash join left.k = right.rk",
            "aggr", "GROUP BY k with COUNT(*), SUM(v), MAX(v)",
            "aggr_distinct", "GROUP BY k with COUNT(DISTINCT v), SUM(v)"
        );
        Map<String, ReportWriter.Measurement> results = new LinkedHashMap<>();

        for (int budget : cfg.memoryBudgets) {
            ExecConfig exec = new ExecConfig(cfg.blockCapacity, budget, root.resolve("tmp").toString(),
                    ExecConfig.DEFAULT_MAX_HASH_DEPTH, true);
            for (String w : cfg.workloads) {
                ReportWriter.Measurement m = new ReportWriter.Measurement();
                for (int i = 0; i < cfg.warmup; i++) runOnce(exec, w, leftRows, rightRows);
                for (int i = 0; i < cfg.runs; i++) {
                    IoStats stats = new IoStats();
                    long t0 = System.nanoTime();
                    long rows = runOnce(exec, w, leftRows, rightRows, stats);
                    long t1 = System.nanoTime();
                    m.nanos.add(t1 - t0);
                    m.rows.add(rows);
                    m.blocksRead.add(stats.blocksRead());
                    m.blocksWritten.add(stats.blocksWritten());
                    m.partitions.add(stats.partitionsCreated());
                }
                results.put(w + "@" + budget, m);
                System.out.printf(Locale.ROOT,
                    "%s @%d blocks -> rows=%d mean=%.2fms median=%.3fms read=%d written=%d partitions=%d%n",
                    w, budget, m.rows.median(), m.nanos.mean() / 1_000_000.0, m.nanos.median() / 1_000_000.0,
                    m.blocksRead.median(), m.blocksWritten.median(), m.partitions.median());
            }
        }

        ReportWriter writer = new ReportWriter(root.resolve("results"));
        Path json = writer.writeJson(results, descriptions, cfg);
        System.out.println("Wrote JSON to: " + json.toAbsolutePath());
    }

    private static long runOnce(ExecConfig exec, String workload, List<List<Object>> leftRows,
                                List<List<Object>> rightRows) {
        return runOnce(exec, workload, leftRows, rightRows, new IoStats());
    }

    static long runOnce(ExecConfig exec, String workload, List<List<Object>> leftRows,
                        List<List<Object>> rightRows, IoStats stats) {
        try (ExecContext ctx = new ExecContext(exec, stats)) {
            int cap = exec.blockCapacity();
            int m = exec.numMemoryBlocks();
            BlockScanOperator left = new BlockScanOperator(MemoryBlockSource.ofValues(LEFT, leftRows, cap, stats));
            BlockScanOperator right = new BlockScanOperator(MemoryBlockSource.ofValues(RIGHT, rightRows, cap, stats));
            Operator op;
            switch (workload) {
                case "bnlj":
                    op = new BlockNestedLoopJoinOperator(left, right, ColumnComparison.equi(0, 0), m, ctx);
                    break;
                case "merge_join":
                    op = new SortMergeJoinOperator(left, right, "k", "rk", m, ctx);
                    break;
                case "hash_join":
                    op = new HashJoinOperator(left, right, "k", "rk", m, ctx);
                    break;
                case "aggr":
                    op = new AggregateOperator(left, List.of("k"),
                            List.of(AggregateCall.countStar(), AggregateCall.sum("v"), AggregateCall.max("v")), m, ctx);
                    break;
                case "aggr_distinct":
                    op = new AggregateOperator(left, List.of("k"),
                            List.of(AggregateCall.count("v").distinct(), AggregateCall.sum("v")), m, ctx);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown workload: " + workload);
            }
            return countRows(new QueryExecutor().stream(op));
        }
    }

    private static long countRows(RowStream rows) {
        long c = 0;
        try (rows) {
            while (rows.hasNext()) { rows.next(); c++; }
        }
        return c;
    }
}
