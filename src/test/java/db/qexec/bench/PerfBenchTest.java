package db.qexec.bench;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import db.qexec.config.ExecConfig;
import db.qexec.storage.IoStats;

public class PerfBenchTest {
    @TempDir
    Path tmp;

    @Test
    void joinWorkloadsProduceTheSameRowCount() {
        DataPool pool = new DataPool(30, 4L);
        List<List<Object>> left = pool.rows(200);
        List<List<Object>> right = pool.rows(60);
        ExecConfig exec = new ExecConfig(8, 3, tmp.toString(), ExecConfig.DEFAULT_MAX_HASH_DEPTH, true);

        long bnlj = PerfBench.runOnce(exec, "bnlj", left, right, new IoStats());
        IoStats hashStats = new IoStats();
        long hash = PerfBench.runOnce(exec, "hash_join", left, right, hashStats);
        long merge = PerfBench.runOnce(exec, "merge_join", left, right, new IoStats());
        assertEquals(bnlj, hash);
        assertEquals(bnlj, merge);
        assertTrue(hashStats.partitionsCreated() > 0);
        assertTrue(hashStats.blocksWritten() > 0);
    }

    @Test
    void aggregationWorkloadsProduceOneRowPerKey() {
        DataPool pool = new DataPool(10, 5L);
        List<List<Object>> left = pool.rows(150);
        long keys = left.stream().map(r -> r.get(0)).distinct().count();
        ExecConfig exec = new ExecConfig(4, 3, tmp.toString(), ExecConfig.DEFAULT_MAX_HASH_DEPTH, true);
        assertEquals(keys, PerfBench.runOnce(exec, "aggr", left, List.of(), new IoStats()));
        assertEquals(keys, PerfBench.runOnce(exec, "aggr_distinct", left, List.of(), new IoStats()));
    }

    @Test
    void unknownWorkloadIsRejected() {
        ExecConfig exec = new ExecConfig(4, 3, tmp.toString(), ExecConfig.DEFAULT_MAX_HASH_DEPTH, true);
        assertThrows(IllegalArgumentException.class,
            () -> PerfBench.runOnce(exec, "index_join", List.of(), List.of(), new IoStats()));
    }

    @Test
    void reportContainsConfigAndMediansPerWorkload() throws Exception {
        BenchmarkConfig cfg = BenchmarkConfig.fromArgs(tmp, new String[] {"--rows=10", "--budgets=3"});
        ReportWriter.Measurement m = new ReportWriter.Measurement();
        for (long n : new long[] {3_000_000, 1_000_000, 2_000_000}) {
            m.nanos.add(n);
            m.rows.add(42);
            m.blocksRead.add(7);
            m.blocksWritten.add(2);
            m.partitions.add(1);
        }
        ReportWriter writer = new ReportWriter(tmp.resolve("results"));
        Path file = writer.writeJson(Map.of("hash_join@3", m), Map.of("hash_join", "hash"), cfg);

        JsonObject root = JsonParser.parseString(Files.readString(file)).getAsJsonObject();
        assertEquals(10, root.getAsJsonObject("config").get("rows_left").getAsInt());
        JsonObject entry = root.getAsJsonObject("workloads").getAsJsonObject("hash_join@3");
        assertEquals("hash", entry.get("description").getAsString());
        assertEquals(2.0, entry.get("median_ms").getAsDouble(), 1e-9);
        assertEquals(2.0, entry.get("mean_ms").getAsDouble(), 1e-9);
        assertEquals(42, entry.get("rows").getAsLong());
        assertEquals(7, entry.get("blocks_read").getAsLong());
    }
}
