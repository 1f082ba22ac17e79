package db.qexec.exec;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Single-pass row iterator that holds resources (file handles, partitions) until closed.
 */
public interface RowIterator extends Iterator<Row>, AutoCloseable {
    @Override
    void close();

    static RowIterator of(Iterator<Row> rows) {
        return new RowIterator() {
            @Override public boolean hasNext() { return rows.hasNext(); }
            @Override public Row next() { return rows.next(); }
            @Override public void close() {}
        };
    }

    static RowIterator empty() { return of(Collections.emptyIterator()); }

    /** Adapts an already opened operator; closing the iterator leaves the operator open. */
    static RowIterator drain(Operator op) {
        return new RowIterator() {
            private Row pending;
            @Override public boolean hasNext() {
                if (pending == null) pending = op.next();
                return pending != null;
            }
            @Override public Row next() {
                if (!hasNext()) throw new NoSuchElementException();
                Row r = pending;
                pending = null;
                return r;
            }
            @Override public void close() {}
        };
    }
}
