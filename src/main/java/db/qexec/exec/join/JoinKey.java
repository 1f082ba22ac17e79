package db.qexec.exec.join;

import java.util.Arrays;

import db.qexec.exec.KeyExtractor;
import db.qexec.exec.Row;
import db.qexec.exec.Values;

/**
 * Hash-map key for equi-joins: the canonical form of a row's join columns, so that keys equal under
 * numeric coercion (1, 1L, 1.0) are equal here too. Never built from a key containing null.
 */
final class JoinKey {
    private final Object[] values;
    private final int hash;

    private JoinKey(Object[] values) {
        this.values = values;
        this.hash = Arrays.hashCode(values);
    }

    static JoinKey of(KeyExtractor extractor, Row row) {
        Object[] raw = extractor.extract(row);
        for (int i = 0; i < raw.length; i++) raw[i] = Values.canonical(raw[i]);
        return new JoinKey(raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JoinKey k)) return false;
        if (k.hash != hash || k.values.length != values.length) return false;
        for (int i = 0; i < values.length; i++) {
            if (Values.compare(values[i], k.values[i]) != 0) return false;
        }
        return true;
    }

    @Override
    public int hashCode() { return hash; }

    @Override
    public String toString() { return Arrays.toString(values); }
}
