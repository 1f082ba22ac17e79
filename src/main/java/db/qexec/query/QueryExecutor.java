package db.qexec.query;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import db.qexec.exec.Operator;
import db.qexec.exec.Row;

/**
 * Executes a planned operator pipeline via streaming
 */
public class QueryExecutor {
    /**
     * Streaming interface: returns a stream that opens the operator on first use and closes it
     * when exhausted, when an error escapes, or when the caller closes the stream early.
     * Rows are pulled one at a time, no intermediate list is built.
     */
    public RowStream stream(Operator op) {
        return new RowStream() {
            private boolean opened = false;
            private Row next = null;
            private boolean finished = false;

            private void ensureOpen() {
                if (!opened && !finished) {
                    opened = true;
                    try {
                        op.open();
                    } catch (RuntimeException e) {
                        close();
                        throw e;
                    }
                    advance();
                }
            }

            private void advance() {
                if (finished) return;
                try {
                    next = op.next();
                } catch (RuntimeException e) {
                    close();
                    throw e;
                }
                if (next == null) close();
            }

            @Override
            public boolean hasNext() {
                ensureOpen();
                return !finished;
            }

            @Override
            public Row next() {
                if (!hasNext()) throw new NoSuchElementException();
                Row current = next;
                advance();
                return current;
            }

            @Override
            public void close() {
                if (finished) return;
                finished = true;
                next = null;
                if (opened) op.close();
            }
        };
    }

    /** Runs the operator to completion and returns every row. */
    public List<Row> collect(Operator op) {
        List<Row> rows = new ArrayList<>();
        try (RowStream stream = stream(op)) {
            while (stream.hasNext()) rows.add(stream.next());
        }
        return rows;
    }
}
