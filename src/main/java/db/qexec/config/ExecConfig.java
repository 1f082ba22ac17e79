package db.qexec.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import db.qexec.error.ConfigurationException;

/**
 * Execution settings: block size, memory budget, scratch directory and spill policy knobs.
 * Loaded from JSON with Gson; missing fields keep their defaults.
 */
public final class ExecConfig {
    private static final Logger logger = LoggerFactory.getLogger(ExecConfig.class);

    public static final String RESOURCE_NAME = "qexec.json";

    public static final int DEFAULT_BLOCK_CAPACITY = 64;
    public static final int DEFAULT_NUM_MEMORY_BLOCKS = 10;
    public static final String DEFAULT_TEMP_DIR = "tmp/qexec";
    public static final int DEFAULT_MAX_HASH_DEPTH = 4;

    // non-final so Gson can populate them; never mutated after validate()
    private int blockCapacity = DEFAULT_BLOCK_CAPACITY;
    private int numMemoryBlocks = DEFAULT_NUM_MEMORY_BLOCKS;
    private String tempDir = DEFAULT_TEMP_DIR;
    private int maxHashDepth = DEFAULT_MAX_HASH_DEPTH;
    private boolean mergeGroupSpill = true;

    private ExecConfig() {}

    public ExecConfig(int blockCapacity, int numMemoryBlocks, String tempDir, int maxHashDepth, boolean mergeGroupSpill) {
        this.blockCapacity = blockCapacity;
        this.numMemoryBlocks = numMemoryBlocks;
        this.tempDir = tempDir;
        this.maxHashDepth = maxHashDepth;
        this.mergeGroupSpill = mergeGroupSpill;
        validate();
    }

    public static ExecConfig defaults() { return new ExecConfig(); }

    /** Same settings with another scratch directory. */
    public ExecConfig withTempDir(Path dir) {
        return new ExecConfig(blockCapacity, numMemoryBlocks, dir.toString(), maxHashDepth, mergeGroupSpill);
    }

    public ExecConfig withMergeGroupSpill(boolean spill) {
        return new ExecConfig(blockCapacity, numMemoryBlocks, tempDir, maxHashDepth, spill);
    }

    public static ExecConfig load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed loading config file: " + file, e);
        }
    }

    /** Load {@value #RESOURCE_NAME} from the classpath, or defaults when absent. */
    public static ExecConfig fromResource() {
        InputStream in = ExecConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME);
        if (in == null) {
            logger.debug("No {} on classpath, using defaults", RESOURCE_NAME);
            return defaults();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, RESOURCE_NAME);
        } catch (IOException e) {
            throw new ConfigurationException("Failed loading config resource: " + RESOURCE_NAME, e);
        }
    }

    private static ExecConfig parse(Reader reader, String origin) {
        ExecConfig cfg;
        try {
            cfg = new Gson().fromJson(reader, ExecConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed config " + origin + ": " + e.getMessage(), e);
        }
        if (cfg == null) cfg = defaults();
        cfg.validate();
        logger.debug("Loaded {} from {}", cfg, origin);
        return cfg;
    }

    private void validate() {
        if (blockCapacity <= 0) throw new ConfigurationException("blockCapacity must be positive, got " + blockCapacity);
        if (numMemoryBlocks < 3) {
            throw new ConfigurationException("numMemoryBlocks must be at least 3, got " + numMemoryBlocks);
        }
        if (maxHashDepth < 1) throw new ConfigurationException("maxHashDepth must be at least 1, got " + maxHashDepth);
        if (tempDir == null || tempDir.isBlank()) throw new ConfigurationException("tempDir must be set");
    }

    public int blockCapacity() { return blockCapacity; }
    public int numMemoryBlocks() { return numMemoryBlocks; }
    public Path tempDir() { return Paths.get(tempDir); }
    public int maxHashDepth() { return maxHashDepth; }
    public boolean mergeGroupSpill() { return mergeGroupSpill; }

    @Override
    public String toString() {
        return "ExecConfig{blockCapacity=" + blockCapacity + ", numMemoryBlocks=" + numMemoryBlocks
                + ", tempDir=" + tempDir + ", maxHashDepth=" + maxHashDepth + ", mergeGroupSpill=" + mergeGroupSpill + "}";
    }
}
