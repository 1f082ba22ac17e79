package db.qexec.storage;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import db.qexec.catalog.ColumnSchema;
import db.qexec.error.ResourceException;
import db.qexec.exec.Row;

/**
 * Temporary, disk-backed, append-only sequence of rows.
 * Appends are buffered one block at a time; reading seals the partition against further writes.
 * The file is opened only while a block is being written, so idle partitions hold no descriptor.
 * Closing a partition deletes it.
 *
 * File layout: repeated blocks of [int rowCount][rowCount x (int length, record bytes)].
 */
public class Partition implements AutoCloseable {
    private final PartitionStore store;
    private final long id;
    private final String name;
    private final Path file;
    private final List<ColumnSchema> schema;
    private final int blockCapacity;

    private final List<Row> buffer;
    private final List<PartitionReader> openReaders = new ArrayList<>();
    private long rowCount;
    private long blockCount;
    private boolean sealed;
    private boolean deleted;

    Partition(PartitionStore store, long id, String name, Path file, List<ColumnSchema> schema) {
        this.store = store;
        this.id = id;
        this.name = name;
        this.file = file;
        this.schema = schema;
        this.blockCapacity = store.blockCapacity();
        this.buffer = new ArrayList<>(blockCapacity);
    }

    long id() { return id; }
    public String name() { return name; }
    public Path file() { return file; }
    public List<ColumnSchema> schema() { return schema; }
    public long rowCount() { return rowCount; }
    /** Blocks this partition occupies once flushed. */
    public long blockCount() { return Block.blocksFor(rowCount, blockCapacity); }
    public int bufferedRows() { return buffer.size(); }
    public boolean isDeleted() { return deleted; }

    public void append(Row row) {
        checkWritable();
        if (row.size() != schema.size()) {
            throw new IllegalArgumentException("Arity mismatch for partition " + name + ": expected " + schema.size() + " values, got " + row.size());
        }
        buffer.add(row);
        rowCount++;
        if (buffer.size() >= blockCapacity) writeBlock();
    }

    /** Write out any buffered rows as a (possibly partial) block. */
    public void flush() {
        if (deleted) throw new IllegalStateException("Partition already deleted: " + name);
        if (!buffer.isEmpty()) writeBlock();
    }

    private void writeBlock() {
        StandardOpenOption mode = blockCount == 0 ? StandardOpenOption.TRUNCATE_EXISTING : StandardOpenOption.APPEND;
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(
                Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode)))) {
            out.writeInt(buffer.size());
            for (Row r : buffer) {
                byte[] bytes = r.record().toBytes(schema);
                out.writeInt(bytes.length);
                out.write(bytes);
            }
        } catch (IOException e) {
            throw new ResourceException("Failed writing partition " + name, e);
        }
        buffer.clear();
        blockCount++;
        store.stats().recordWrite();
    }

    /**
     * Seal the partition and stream its rows in append order. May be called repeatedly;
     * each call is a separate read pass.
     */
    public PartitionReader readAll() {
        if (deleted) throw new IllegalStateException("Partition already deleted: " + name);
        if (!sealed) {
            flush();
            sealed = true;
        }
        PartitionReader reader = new PartitionReader(this, blockCount == 0 ? null : file, store.stats());
        if (!reader.isClosed()) openReaders.add(reader);
        return reader;
    }

    void readerClosed(PartitionReader reader) { openReaders.remove(reader); }

    private void checkWritable() {
        if (deleted) throw new IllegalStateException("Partition already deleted: " + name);
        if (sealed) throw new IllegalStateException("Partition is sealed for reading: " + name);
    }

    /** Release buffers, open readers and the backing file. Idempotent. */
    public void delete() {
        if (deleted) return;
        deleted = true;
        buffer.clear();
        for (PartitionReader r : new ArrayList<>(openReaders)) r.close();
        store.unregister(this);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new ResourceException("Failed deleting partition " + name, e);
        }
    }

    @Override
    public void close() { delete(); }

    @Override
    public String toString() {
        return "Partition{" + name + ", rows=" + rowCount + ", blocks=" + blockCount() + "}";
    }
}
