package db.qexec.bench;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;

public class BenchmarkConfigTest {
    private static final Path ROOT = Paths.get("benchdata");

    @Test
    void defaultsDeriveRightSizeAndKeysFromLeft() {
        BenchmarkConfig cfg = BenchmarkConfig.defaultConfig(ROOT);
        assertEquals(5_000, cfg.rowsLeft);
        assertEquals(500, cfg.rowsRight);
        assertEquals(5_000, cfg.keyRange);
        assertEquals(List.of(4, 8, 32), cfg.memoryBudgets);
        assertEquals(BenchmarkConfig.ALL_WORKLOADS, cfg.workloads);
    }

    @Test
    void parsesOptions() {
        BenchmarkConfig cfg = BenchmarkConfig.fromArgs(ROOT, new String[] {
            "--rows=100", "--right-rows=40", "--keys=7", "--runs=3", "--warmup=0", "--seed=9",
            "--block=16", "--budgets=3, 5", "--workloads=hash_join,aggr"});
        assertEquals(100, cfg.rowsLeft);
        assertEquals(40, cfg.rowsRight);
        assertEquals(7, cfg.keyRange);
        assertEquals(3, cfg.runs);
        assertEquals(0, cfg.warmup);
        assertEquals(9L, cfg.seed);
        assertEquals(16, cfg.blockCapacity);
        assertEquals(List.of(3, 5), cfg.memoryBudgets);
        assertEquals(List.of("hash_join", "aggr"), cfg.workloads);
    }

    @Test
    void rejectsMalformedNumbers() {
        assertThrows(IllegalArgumentException.class,
            () -> BenchmarkConfig.fromArgs(ROOT, new String[] {"--budgets=4,x"}));
    }
}
