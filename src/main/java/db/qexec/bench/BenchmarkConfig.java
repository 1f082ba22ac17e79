package db.qexec.bench;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class BenchmarkConfig {
    public static final List<String> ALL_WORKLOADS = List.of("bnlj", "merge_join", "hash_join", "aggr", "aggr_distinct");

    public final int rowsLeft;
    public final int rowsRight;
    public final int keyRange;
    public final int runs;
    public final int warmup;
    public final long seed;
    public final int blockCapacity;
    public final List<Integer> memoryBudgets;
    public final Path benchRoot;
    public final List<String> workloads;

    public BenchmarkConfig(int rowsLeft,
                           int rowsRight,
                           int keyRange,
                           int runs,
                           int warmup,
                           long seed,
                           int blockCapacity,
                           List<Integer> memoryBudgets,
                           Path benchRoot,
                           List<String> workloads) {
        this.rowsLeft = rowsLeft;
        this.rowsRight = rowsRight;
        this.keyRange = keyRange;
        this.runs = runs;
        this.warmup = warmup;
        this.seed = seed;
        this.blockCapacity = blockCapacity;
        this.memoryBudgets = memoryBudgets;
        this.benchRoot = benchRoot;
        this.workloads = workloads;
    }

    public static BenchmarkConfig defaultConfig(Path benchRoot) {
        return fromArgs(benchRoot, new String[0]);
    }

    public static BenchmarkConfig fromArgs(Path benchRoot, String[] args) {
        int rowsLeft = 5_000;
        int rowsRight = -1;
        int keyRange = -1;
        int runs = 10;
        int warmup = 2;
        long seed = 42L;
        int blockCapacity = 64;
        List<Integer> budgets = Arrays.asList(4, 8, 32);
        List<String> workloads = ALL_WORKLOADS;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            try {
                if (s.startsWith("--rows=")) {
                    rowsLeft = Integer.parseInt(s.substring("--rows=".length()));
                } else if (s.startsWith("--right-rows=")) {
                    rowsRight = Integer.parseInt(s.substring("--right-rows=".length()));
                } else if (s.startsWith("--keys=")) {
                    keyRange = Integer.parseInt(s.substring("--keys=".length()));
                } else if (s.startsWith("--runs=")) {
                    runs = Integer.parseInt(s.substring("--runs=".length()));
                } else if (s.startsWith("--warmup=")) {
                    warmup = Integer.parseInt(s.substring("--warmup=".length()));
                } else if (s.startsWith("--seed=")) {
                    seed = Long.parseLong(s.substring("--seed=".length()));
                } else if (s.startsWith("--block=")) {
                    blockCapacity = Integer.parseInt(s.substring("--block=".length()));
                } else if (s.startsWith("--budgets=")) {
                    budgets = new ArrayList<>();
                    for (String b : s.substring("--budgets=".length()).split(",")) budgets.add(Integer.parseInt(b.trim()));
                } else if (s.startsWith("--workloads=")) {
                    workloads = Arrays.asList(s.substring("--workloads=".length()).split(","));
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad benchmark option: " + s, e);
            }
        }

        // Right side defaults to 0.1x left, keys to the left size
        if (rowsRight < 0) rowsRight = Math.max(1, rowsLeft / 10);
        if (keyRange < 0) keyRange = Math.max(1, rowsLeft);
        return new BenchmarkConfig(rowsLeft, rowsRight, keyRange, runs, warmup, seed, blockCapacity,
                budgets, benchRoot, workloads);
    }
}
