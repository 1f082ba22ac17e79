package db.qexec.exec.sort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import db.qexec.exec.Row;
import db.qexec.exec.Values;

/**
 * Orders rows by a list of columns, each ascending or descending. Nulls sort first in ascending order.
 */
public final class RowComparator implements Comparator<Row> {
    private final int[] indexes;
    private final boolean[] descending;

    public RowComparator(int[] indexes, boolean[] descending) {
        if (indexes.length != descending.length) throw new IllegalArgumentException("indexes and directions differ in length");
        this.indexes = indexes.clone();
        this.descending = descending.clone();
    }

    public static RowComparator ascending(int... indexes) {
        return new RowComparator(indexes, new boolean[indexes.length]);
    }

    /** Every column of a schema of the given width, ascending: total order on whole rows. */
    public static RowComparator allColumns(int width) {
        int[] idx = new int[width];
        for (int i = 0; i < width; i++) idx[i] = i;
        return ascending(idx);
    }

    /** This order followed by the remaining columns, so rows comparing equal are identical. */
    public RowComparator thenAllColumns(int width) {
        List<Integer> extra = new ArrayList<>();
        outer:
        for (int c = 0; c < width; c++) {
            for (int i : indexes) if (i == c) continue outer;
            extra.add(c);
        }
        int[] idx = new int[indexes.length + extra.size()];
        boolean[] desc = new boolean[idx.length];
        System.arraycopy(indexes, 0, idx, 0, indexes.length);
        System.arraycopy(descending, 0, desc, 0, descending.length);
        for (int i = 0; i < extra.size(); i++) idx[indexes.length + i] = extra.get(i);
        return new RowComparator(idx, desc);
    }

    @Override
    public int compare(Row a, Row b) {
        for (int i = 0; i < indexes.length; i++) {
            int c = Values.compare(a.get(indexes[i]), b.get(indexes[i]));
            if (c != 0) return descending[i] ? -c : c;
        }
        return 0;
    }
}
