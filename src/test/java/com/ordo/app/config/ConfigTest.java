package com.ordo.app.config;

import java.nio.file.Path;
import java.time.ZoneId;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("ordo.scanThreads");
        System.clearProperty("ordo.preferredPaths");
        System.clearProperty("ordo.failureThreshold");
    }

    @Test
    void builderDerivesDirectoriesFromDataDir(@TempDir Path tmp) {
        Config c = Config.builder().dataDir(tmp.resolve("data")).build();

        Path data = tmp.resolve("data").toAbsolutePath().normalize();
        assertEquals(data, c.getDataDir());
        assertEquals(data.resolve("canonical"), c.getCanonicalRoot());
        assertEquals(data.resolve("quarantine"), c.getQuarantineDir());
        assertEquals(data.resolve("quarantine").resolve("Trash"), c.getTrashDir());
        assertTrue(c.getDbUrl().startsWith("jdbc:sqlite:"));
        assertTrue(c.getDbUrl().endsWith(c.getDbFilePath().toString()));
        assertFalse(c.isUseAccessTime(), "access time is off unless configured");
        assertTrue(data.toFile().isDirectory(), "build() creates the data directory");
    }

    @Test
    void loadReadsSystemProperties() {
        // ordo.dataDir e ordo.timezone vêm do Surefire
        System.setProperty("ordo.scanThreads", "3");
        System.setProperty("ordo.preferredPaths", "/a/keep; /b/keep");
        System.setProperty("ordo.failureThreshold", "0.25");

        Config c = Config.load();

        assertEquals(3, c.getScanThreads());
        assertEquals(2, c.getPreferredPaths().size());
        assertEquals("/b/keep", c.getPreferredPaths().get(1));
        assertEquals(0.25, c.getFailureThreshold(), 1e-9);
        assertEquals(ZoneId.of("UTC"), c.getZone());
    }

    @Test
    void invalidNumberFallsBackToDefault() {
        System.setProperty("ordo.scanThreads", "many");
        assertEquals(8, Config.load().getScanThreads());
    }
}
