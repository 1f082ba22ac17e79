package db.qexec.storage;

/**
 * Block-level I/O counters. Single-threaded execution, so plain fields.
 */
public final class IoStats {
    private long blocksRead;
    private long blocksWritten;
    private long partitionsCreated;

    public void recordRead() { blocksRead++; }
    public void recordWrite() { blocksWritten++; }
    void recordPartitionCreated() { partitionsCreated++; }

    public long blocksRead() { return blocksRead; }
    public long blocksWritten() { return blocksWritten; }
    public long partitionsCreated() { return partitionsCreated; }

    public void reset() {
        blocksRead = 0;
        blocksWritten = 0;
        partitionsCreated = 0;
    }

    @Override
    public String toString() {
        return "IoStats{read=" + blocksRead + ", written=" + blocksWritten + ", partitions=" + partitionsCreated + "}";
    }
}
