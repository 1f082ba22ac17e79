package db.qexec.exec;

import java.time.LocalDateTime;

import db.qexec.error.TypeMismatchException;

/**
 * Value comparison, coercion and hashing shared by every key-based operator.
 * INT, BIGINT and FLOAT compare numerically with each other; other types only with themselves.
 * Hashes agree with {@link #compare}: values comparing equal hash equal.
 */
public final class Values {
    private Values() {}

    /**
     * Total order used by sorting: null first, then by value.
     * @throws TypeMismatchException when the two values cannot be compared
     */
    public static int compare(Object a, Object b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        if (a instanceof Number x && b instanceof Number y) return compareNumbers(x, y);
        if (a instanceof String x && b instanceof String y) return x.compareTo(y);
        if (a instanceof Boolean x && b instanceof Boolean y) return Boolean.compare(x, y);
        if (a instanceof LocalDateTime x && b instanceof LocalDateTime y) return x.compareTo(y);
        throw new TypeMismatchException(a, b);
    }

    /** SQL equality: null is never equal to anything. */
    public static boolean sqlEquals(Object a, Object b) {
        if (a == null || b == null) return false;
        return compare(a, b) == 0;
    }

    private static int compareNumbers(Number x, Number y) {
        boolean xi = isIntegral(x);
        boolean yi = isIntegral(y);
        if (xi && yi) return Long.compare(x.longValue(), y.longValue());
        if (xi) return compareLongDouble(x.longValue(), y.doubleValue());
        if (yi) return -compareLongDouble(y.longValue(), x.doubleValue());
        double dx = x.doubleValue();
        double dy = y.doubleValue();
        if (dx == dy) return 0; // 0.0 and -0.0
        return Double.compare(dx, dy);
    }

    /** Exact order of a long and a double, without rounding the long. NaN sorts after every number. */
    private static int compareLongDouble(long l, double d) {
        if (Double.isNaN(d) || d >= 0x1p63) return -1;
        if (d < -0x1p63) return 1;
        long whole = (long) d; // exact once the fraction is dropped
        if (l != whole) return Long.compare(l, whole);
        double fraction = d - whole;
        return fraction > 0 ? -1 : fraction < 0 ? 1 : 0;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    /**
     * Canonical form for hashing and grouping: integral numbers (including integral doubles) become Long,
     * other numbers Double, -0.0 becomes 0.
     */
    public static Object canonical(Object v) {
        if (v instanceof Number n) {
            if (isIntegral(n)) return n.longValue();
            double d = n.doubleValue();
            if (d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63) return (long) d;
            return d;
        }
        return v;
    }

    public static int hash(Object v) {
        Object c = canonical(v);
        return c == null ? 0 : c.hashCode();
    }

    /**
     * Hash scrambled with a seed, so that each partitioning level spreads rows differently.
     * Result is non-negative.
     */
    public static int hash(Object v, int seed) {
        int x = hash(v) ^ (seed * 0x9E3779B9);
        x = ((x >>> 16) ^ x) * 0x45d9f3b;
        x = ((x >>> 16) ^ x) * 0x45d9f3b;
        x = (x >>> 16) ^ x;
        return x & 0x7fffffff;
    }
}
