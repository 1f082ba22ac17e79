package db.qexec.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.qexec.catalog.ColumnSchema;
import db.qexec.error.ResourceException;

/**
 * Allocates, tracks and reclaims the scratch files that hold spilled rows.
 * Every partition created through a store is deleted at the latest when the store is closed.
 */
public class PartitionStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PartitionStore.class);

    private final Path tempDir;
    private final int blockCapacity;
    private final IoStats stats;
    private final Map<Long, Partition> live = new LinkedHashMap<>();
    private long nextId;
    private boolean dirReady;

    public PartitionStore(Path tempDir, int blockCapacity, IoStats stats) {
        if (blockCapacity <= 0) throw new IllegalArgumentException("blockCapacity must be positive");
        this.tempDir = tempDir;
        this.blockCapacity = blockCapacity;
        this.stats = stats;
    }

    public PartitionStore(Path tempDir, int blockCapacity) {
        this(tempDir, blockCapacity, new IoStats());
    }

    /**
     * Create an empty partition for rows of the given schema. The name only serves debugging;
     * file names are made unique by the store.
     */
    public Partition createPartition(String name, List<ColumnSchema> schema) {
        if (schema == null) throw new IllegalArgumentException("Partition requires a schema: " + name);
        ensureDir();
        long id = nextId++;
        Path file = tempDir.resolve(sanitize(name) + "-" + id + ".part");
        Partition p = new Partition(this, id, name, file, schema);
        live.put(id, p);
        stats.recordPartitionCreated();
        return p;
    }

    private void ensureDir() {
        if (dirReady) return;
        try {
            Files.createDirectories(tempDir);
        } catch (IOException e) {
            throw new ResourceException("Cannot create temp directory " + tempDir, e);
        }
        dirReady = true;
    }

    void unregister(Partition p) { live.remove(p.id()); }

    public int blockCapacity() { return blockCapacity; }

    public IoStats stats() { return stats; }

    public Path tempDir() { return tempDir; }

    /** Number of partitions created and not yet deleted. */
    public int liveCount() { return live.size(); }

    /** Delete every partition still allocated. */
    @Override
    public void close() {
        if (live.isEmpty()) return;
        logger.debug("Reclaiming {} leftover partition(s) in {}", live.size(), tempDir);
        ResourceException first = null;
        for (Partition p : new ArrayList<>(live.values())) {
            try {
                p.delete();
            } catch (ResourceException e) {
                logger.warn("Failed to delete partition {}", p.name(), e);
                if (first == null) first = e;
            }
        }
        live.clear();
        if (first != null) throw first;
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9_.-]", "_");
    }
}
