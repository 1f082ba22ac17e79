package db.qexec.bench;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded generator of benchmark rows: a key drawn from a fixed pool plus a payload column.
 */
public class DataPool {
    private final int[] keys;
    private final Random rnd;

    public DataPool(int poolSize, long seed) {
        this.keys = new int[poolSize];
        this.rnd = new Random(seed);
        // Keys from a wide range to avoid trivial sequences; duplicates possible by sampling
        for (int i = 0; i < poolSize; i++) {
            keys[i] = 1 + rnd.nextInt(1_000_000_000);
        }
    }

    public int randomKey() {
        return keys[rnd.nextInt(keys.length)];
    }

    /** {@code count} rows of (key INT, payload INT). */
    public List<List<Object>> rows(int count) {
        List<List<Object>> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            rows.add(List.of(randomKey(), rnd.nextInt(100)));
        }
        return rows;
    }
}
