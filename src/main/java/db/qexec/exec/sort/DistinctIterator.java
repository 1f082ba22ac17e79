package db.qexec.exec.sort;

import java.util.Comparator;
import java.util.NoSuchElementException;

import db.qexec.exec.Row;
import db.qexec.exec.RowIterator;

/**
 * Drops each row that compares equal to the row before it. Over sorted input this yields
 * every distinct row exactly once.
 */
public final class DistinctIterator implements RowIterator {
    private final RowIterator input;
    private final Comparator<Row> equality;
    private Row previous;
    private Row pending;

    public DistinctIterator(RowIterator input, Comparator<Row> equality) {
        this.input = input;
        this.equality = equality;
    }

    @Override
    public boolean hasNext() {
        while (pending == null && input.hasNext()) {
            Row r = input.next();
            if (previous == null || equality.compare(previous, r) != 0) pending = r;
        }
        return pending != null;
    }

    @Override
    public Row next() {
        if (!hasNext()) throw new NoSuchElementException();
        previous = pending;
        pending = null;
        return previous;
    }

    @Override
    public void close() { input.close(); }
}
