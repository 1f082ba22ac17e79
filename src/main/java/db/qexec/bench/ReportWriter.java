package db.qexec.bench;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public class ReportWriter {
    private final Path outDir;

    public ReportWriter(Path outDir) {
        this.outDir = outDir;
    }

    /** Measurements of one workload at one memory budget. */
    public static final class Measurement {
        final StatsAggregator nanos = new StatsAggregator();
        final StatsAggregator rows = new StatsAggregator();
        final StatsAggregator blocksRead = new StatsAggregator();
        final StatsAggregator blocksWritten = new StatsAggregator();
        final StatsAggregator partitions = new StatsAggregator();
    }

    // Write a JSON report keyed "<workload>@<budget>" with timings in milliseconds
    public Path writeJson(Map<String, Measurement> results,
                          Map<String, String> descriptions,
                          BenchmarkConfig cfg) throws IOException {
        if (!Files.exists(outDir)) Files.createDirectories(outDir);
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        Path json = outDir.resolve("bench_" + ts + ".json");
        Files.writeString(json, toJson(results, descriptions, cfg));
        return json;
    }

    String toJson(Map<String, Measurement> results, Map<String, String> descriptions, BenchmarkConfig cfg) {
        Map<String, Object> root = new LinkedHashMap<>();
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("rows_left", cfg.rowsLeft);
        config.put("rows_right", cfg.rowsRight);
        config.put("key_range", cfg.keyRange);
        config.put("block_capacity", cfg.blockCapacity);
        config.put("memory_budgets", cfg.memoryBudgets);
        config.put("runs", cfg.runs);
        config.put("warmup", cfg.warmup);
        config.put("seed", cfg.seed);
        root.put("config", config);

        Map<String, Object> workloads = new LinkedHashMap<>();
        for (Map.Entry<String, Measurement> e : results.entrySet()) {
            String key = e.getKey();
            Measurement m = e.getValue();
            String workload = key.contains("@") ? key.substring(0, key.indexOf('@')) : key;
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("description", descriptions.getOrDefault(workload, ""));
            // Round to sensible decimals (mean/stddev 2dp, others 3dp)
            entry.put("mean_ms", Math.round(m.nanos.mean() / 1_000_000.0 * 100.0) / 100.0);
            entry.put("median_ms", Math.round(m.nanos.median() / 1_000_000.0 * 1000.0) / 1000.0);
            entry.put("p95_ms", Math.round(m.nanos.percentile(95) / 1_000_000.0 * 1000.0) / 1000.0);
            entry.put("min_ms", Math.round(m.nanos.min() / 1_000_000.0 * 1000.0) / 1000.0);
            entry.put("max_ms", Math.round(m.nanos.max() / 1_000_000.0 * 1000.0) / 1000.0);
            entry.put("stddev_ms", Math.round(m.nanos.stddev() / 1_000_000.0 * 100.0) / 100.0);
            // Deterministic per run, so the median is representative
            entry.put("rows", m.rows.median());
            entry.put("blocks_read", m.blocksRead.median());
            entry.put("blocks_written", m.blocksWritten.median());
            entry.put("partitions", m.partitions.median());
            workloads.put(key, entry);
        }
        root.put("workloads", workloads);

        Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();
        return gson.toJson(root);
    }
}
