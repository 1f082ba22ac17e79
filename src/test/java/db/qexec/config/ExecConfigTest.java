package db.qexec.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.qexec.error.ConfigurationException;

public class ExecConfigTest {
    @TempDir
    Path tmp;

    @Test
    void defaultsAreSensible() {
        ExecConfig cfg = ExecConfig.defaults();
        assertEquals(64, cfg.blockCapacity());
        assertEquals(10, cfg.numMemoryBlocks());
        assertEquals(4, cfg.maxHashDepth());
        assertTrue(cfg.mergeGroupSpill());
        assertEquals(Path.of("tmp/qexec"), cfg.tempDir());
    }

    @Test
    void loadsPartialJsonKeepingDefaults() throws Exception {
        Path file = tmp.resolve("cfg.json");
        Files.writeString(file, "{ \"blockCapacity\": 8, \"mergeGroupSpill\": false }");
        ExecConfig cfg = ExecConfig.load(file);
        assertEquals(8, cfg.blockCapacity());
        assertEquals(10, cfg.numMemoryBlocks());
        assertFalse(cfg.mergeGroupSpill());
    }

    @Test
    void invalidBudgetIsRejected() throws Exception {
        Path file = tmp.resolve("bad.json");
        Files.writeString(file, "{ \"numMemoryBlocks\": 2 }");
        assertThrows(ConfigurationException.class, () -> ExecConfig.load(file));
        assertThrows(ConfigurationException.class, () -> new ExecConfig(0, 10, "x", 4, true));
        assertThrows(ConfigurationException.class, () -> new ExecConfig(8, 10, " ", 4, true));
        assertThrows(ConfigurationException.class, () -> new ExecConfig(8, 10, "x", 0, true));
    }

    @Test
    void malformedJsonIsAConfigurationError() throws Exception {
        Path file = tmp.resolve("broken.json");
        Files.writeString(file, "{ \"blockCapacity\": ");
        assertThrows(ConfigurationException.class, () -> ExecConfig.load(file));
    }

    @Test
    void missingFileIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> ExecConfig.load(tmp.resolve("absent.json")));
    }

    @Test
    void classpathResourceIsLoaded() {
        ExecConfig cfg = ExecConfig.fromResource();
        assertEquals(64, cfg.blockCapacity());
        assertEquals(10, cfg.numMemoryBlocks());
    }

    @Test
    void withersKeepOtherSettings() {
        ExecConfig cfg = new ExecConfig(16, 5, "a", 3, true).withTempDir(tmp).withMergeGroupSpill(false);
        assertEquals(16, cfg.blockCapacity());
        assertEquals(5, cfg.numMemoryBlocks());
        assertEquals(3, cfg.maxHashDepth());
        assertEquals(tmp, cfg.tempDir());
        assertFalse(cfg.mergeGroupSpill());
    }
}
