package db.qexec.exec.aggr;

import db.qexec.exec.Values;

/**
 * Running state of one aggregate over one group. Null inputs are ignored except by COUNT(*).
 */
public interface Accumulator {
    void add(Object value);

    /** Final value; null for an aggregate that saw no input, except COUNT which yields 0. */
    Object result();

    final class Count implements Accumulator {
        private final boolean countNulls;
        private long count;

        Count(boolean countNulls) { this.countNulls = countNulls; }

        @Override
        public void add(Object value) {
            if (value != null || countNulls) count++;
        }

        @Override
        public Object result() { return count; }
    }

    final class Sum implements Accumulator {
        private final boolean floating;
        private long longSum;
        private double doubleSum;
        private boolean seen;

        Sum(boolean floating) { this.floating = floating; }

        @Override
        public void add(Object value) {
            if (value == null) return;
            Number n = (Number) value;
            if (floating) doubleSum += n.doubleValue();
            else longSum = Math.addExact(longSum, n.longValue());
            seen = true;
        }

        @Override
        public Object result() {
            if (!seen) return null;
            return floating ? (Object) doubleSum : (Object) longSum;
        }
    }

    final class Avg implements Accumulator {
        private double sum;
        private long count;

        @Override
        public void add(Object value) {
            if (value == null) return;
            sum += ((Number) value).doubleValue();
            count++;
        }

        @Override
        public Object result() { return count == 0 ? null : sum / count; }
    }

    final class Extremum implements Accumulator {
        private final boolean max;
        private Object best;

        Extremum(boolean max) { this.max = max; }

        @Override
        public void add(Object value) {
            if (value == null) return;
            if (best == null) {
                best = value;
                return;
            }
            int c = Values.compare(value, best);
            if (max ? c > 0 : c < 0) best = value;
        }

        @Override
        public Object result() { return best; }
    }

    /** Population standard deviation, Welford's method. */
    final class StdDevPop implements Accumulator {
        private long count;
        private double mean;
        private double m2;

        @Override
        public void add(Object value) {
            if (value == null) return;
            double x = ((Number) value).doubleValue();
            count++;
            double delta = x - mean;
            mean += delta / count;
            m2 += delta * (x - mean);
        }

        @Override
        public Object result() { return count == 0 ? null : Math.sqrt(m2 / count); }
    }
}
