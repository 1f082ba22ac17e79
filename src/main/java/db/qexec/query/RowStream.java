package db.qexec.query;

import java.util.Iterator;

import db.qexec.exec.Row;

/**
 * Result rows of one operator tree. Closing the stream before it is exhausted abandons the query
 * and releases everything the operators hold.
 */
public interface RowStream extends Iterator<Row>, AutoCloseable {
    @Override
    void close();
}
