package db.qexec.exec.aggr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import db.qexec.exec.Row;
import db.qexec.exec.Values;

/**
 * Canonical encoding of a row's GROUP BY values. Unlike join keys, nulls group together.
 */
public final class GroupKey {
    private final List<Object> values;
    private final int hash;

    private GroupKey(List<Object> values) {
        this.values = values;
        int h = 1;
        for (Object v : values) h = 31 * h + Values.hash(v);
        this.hash = h;
    }

    public static GroupKey of(Row row, int[] indexes) {
        List<Object> vals = new ArrayList<>(indexes.length);
        for (int i : indexes) vals.add(Values.canonical(row.get(i)));
        return new GroupKey(vals);
    }

    public List<Object> values() { return Collections.unmodifiableList(values); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupKey k)) return false;
        if (k.hash != hash || k.values.size() != values.size()) return false;
        for (int i = 0; i < values.size(); i++) {
            if (Values.compare(values.get(i), k.values.get(i)) != 0) return false;
        }
        return true;
    }

    @Override
    public int hashCode() { return hash; }

    @Override
    public String toString() { return values.toString(); }
}
