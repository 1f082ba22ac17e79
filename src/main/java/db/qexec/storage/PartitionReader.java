package db.qexec.storage;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

import db.qexec.catalog.ColumnSchema;
import db.qexec.error.ResourceException;
import db.qexec.exec.Row;
import db.qexec.exec.RowIterator;

/**
 * One read pass over a sealed partition, one block resident at a time.
 * Closes its file handle on exhaustion, on close() and when the partition is deleted.
 */
public class PartitionReader implements RowIterator {
    private final Partition partition;
    private final List<ColumnSchema> schema;
    private final IoStats stats;
    private final Deque<Row> current = new ArrayDeque<>();
    private DataInputStream in;
    private boolean closed;

    PartitionReader(Partition partition, Path file, IoStats stats) {
        this.partition = partition;
        this.schema = partition.schema();
        this.stats = stats;
        if (file == null) {
            closed = true;
            return;
        }
        try {
            this.in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)));
        } catch (IOException e) {
            throw new ResourceException("Failed opening partition " + partition.name(), e);
        }
    }

    @Override
    public boolean hasNext() {
        if (!current.isEmpty()) return true;
        if (closed) return false;
        loadBlock();
        return !current.isEmpty();
    }

    @Override
    public Row next() {
        if (!hasNext()) throw new NoSuchElementException();
        return current.pollFirst();
    }

    /** Read the next block; closes the reader at end of file. */
    private void loadBlock() {
        try {
            int count;
            try {
                count = in.readInt();
            } catch (EOFException eof) {
                close();
                return;
            }
            for (int i = 0; i < count; i++) {
                byte[] bytes = new byte[in.readInt()];
                in.readFully(bytes);
                current.addLast(Row.of(Record.fromBytes(bytes, schema), schema));
            }
            stats.recordRead();
        } catch (IOException e) {
            close();
            throw new ResourceException("Failed reading partition " + partition.name(), e);
        }
    }

    boolean isClosed() { return closed; }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        current.clear();
        partition.readerClosed(this);
        try {
            in.close();
        } catch (IOException e) {
            throw new ResourceException("Failed closing partition reader " + partition.name(), e);
        }
    }
}
