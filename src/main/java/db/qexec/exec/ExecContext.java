package db.qexec.exec;

import db.qexec.config.ExecConfig;
import db.qexec.error.ConfigurationException;
import db.qexec.storage.IoStats;
import db.qexec.storage.PartitionStore;

/**
 * Per-statement execution scope: configuration plus the partition store every operator spills into.
 * Closing the context reclaims any partition an operator left behind.
 */
public class ExecContext implements AutoCloseable {
    private final ExecConfig config;
    private final PartitionStore store;

    public ExecContext(ExecConfig config) {
        this(config, new IoStats());
    }

    public ExecContext(ExecConfig config, IoStats stats) {
        this.config = config;
        this.store = new PartitionStore(config.tempDir(), config.blockCapacity(), stats);
    }

    public ExecConfig config() { return config; }
    public PartitionStore partitions() { return store; }
    public IoStats stats() { return store.stats(); }
    public int blockCapacity() { return config.blockCapacity(); }

    /** Fail fast when an operator is handed fewer blocks than it needs. */
    public static void requireBlocks(String operator, int memoryBlocks, int minimum) {
        if (memoryBlocks < minimum) {
            throw new ConfigurationException(operator + " needs at least " + minimum + " memory blocks, got " + memoryBlocks);
        }
    }

    @Override
    public void close() { store.close(); }
}
