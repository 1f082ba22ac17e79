package db.qexec.bench;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class StatsAggregatorTest {

    @Test
    void emptyAggregatorReportsZeros() {
        StatsAggregator s = new StatsAggregator();
        assertEquals(0, s.count());
        assertEquals(0L, s.median());
        assertEquals(0.0, s.mean());
        assertEquals(0.0, s.stddev());
    }

    @Test
    void summaryStatistics() {
        StatsAggregator s = new StatsAggregator();
        for (long v : new long[] {9, 1, 5, 3, 7}) s.add(v);
        assertEquals(5, s.count());
        assertEquals(1L, s.min());
        assertEquals(9L, s.max());
        assertEquals(5.0, s.mean(), 1e-9);
        assertEquals(10.0, s.variance(), 1e-9);
        assertEquals(5L, s.median());
    }

    @Test
    void nearestRankPercentile() {
        StatsAggregator s = new StatsAggregator();
        for (long v = 1; v <= 20; v++) s.add(v);
        assertEquals(10L, s.median());
        assertEquals(19L, s.percentile(95));
        assertEquals(20L, s.percentile(100));
        assertEquals(1L, s.percentile(0));
    }
}
