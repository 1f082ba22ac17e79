package db.qexec.exec;

import java.util.ArrayList;
import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.storage.Block;

/**
 * Minimal physical operator interface: a single-pass, pull-based producer of rows.
 * close() must release every resource the operator holds, whether the rows were
 * exhausted, abandoned early or an error was raised. Reopening after close() restarts
 * the operator from scratch.
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    /**
     * Optional schema metadata for produced rows. Operators that can supply it should override.
     * Returning null means schema unknown/not propagated.
     */
    default List<ColumnSchema> schema() { return null; }

    /** Bulk variant for block-at-a-time consumers; null when exhausted. */
    default Block nextBlock(int capacity) {
        List<Row> rows = new ArrayList<>(capacity);
        Row r;
        while (rows.size() < capacity && (r = next()) != null) rows.add(r);
        return rows.isEmpty() ? null : new Block(rows, capacity);
    }
}
