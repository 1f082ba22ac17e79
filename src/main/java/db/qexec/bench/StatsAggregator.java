package db.qexec.bench;

import java.util.Arrays;

/**
 * Samples of one measured quantity (nanoseconds, rows or blocks).
 * Mean and variance are kept running (Welford); order statistics sort a copy on demand.
 */
public class StatsAggregator {
    private long[] samples = new long[16];
    private int count;
    private double mean;
    private double m2;
    private long[] sorted;

    public void add(long sample) {
        if (count == samples.length) samples = Arrays.copyOf(samples, count * 2);
        samples[count++] = sample;
        double delta = sample - mean;
        mean += delta / count;
        m2 += delta * (sample - mean);
        sorted = null;
    }

    public int count() { return count; }

    public long min() { return count == 0 ? 0 : sorted()[0]; }
    public long max() { return count == 0 ? 0 : sorted()[count - 1]; }

    public double mean() { return mean; }

    // Sample variance (n-1 denominator)
    public double variance() {
        return count < 2 ? 0.0 : m2 / (count - 1);
    }

    public double stddev() {
        return Math.sqrt(variance());
    }

    public long median() {
        return percentile(50);
    }

    /** Nearest-rank percentile, {@code p} in [0, 100]. */
    public long percentile(double p) {
        if (count == 0) return 0L;
        int rank = (int) Math.ceil(p / 100.0 * count);
        return sorted()[Math.max(0, Math.min(count - 1, rank - 1))];
    }

    private long[] sorted() {
        if (sorted == null) {
            sorted = Arrays.copyOf(samples, count);
            Arrays.sort(sorted);
        }
        return sorted;
    }
}
