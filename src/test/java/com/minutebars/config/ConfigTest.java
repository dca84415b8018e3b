package com.minutebars.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigTest {

    @TempDir
    Path workDir;

    @Test
    void laterSourcesShouldWinOverEarlierOnes() throws Exception {
        Files.writeString(workDir.resolve(Config.FILE_NAME),
                "db.host=file-host\ndb.name=bars\nbackfill.initial_days=10\n", StandardCharsets.UTF_8);

        Config config = Config.load(workDir, null, Map.of("DB_HOST", "env-host", "UNRELATED", "x"));
        config.override("backfill.initial_days", "5");

        assertEquals("env-host", config.getString("db.host"));
        assertEquals("env", config.sourceOf("db.host"));
        assertEquals("bars", config.getString("db.name"));
        assertEquals("file", config.sourceOf("db.name"));
        assertEquals(5, config.getInt("backfill.initial_days", 30));
        assertEquals("override", config.sourceOf("backfill.initial_days"));
        assertEquals("America/New_York", config.getString("backfill.market_zone"));
        assertEquals("resource", config.sourceOf("backfill.market_zone"));
        assertEquals("default", config.sourceOf("backfill.symbols"));
    }

    @Test
    void explicitFileShouldReplaceTheLocalFile() throws Exception {
        Files.writeString(workDir.resolve(Config.FILE_NAME), "db.host=local\n", StandardCharsets.UTF_8);
        Path other = workDir.resolve("prod.properties");
        Files.writeString(other, "db.host=prod\n", StandardCharsets.UTF_8);

        Config config = Config.load(workDir, other, Map.of());

        assertEquals("prod", config.getString("db.host"));
    }

    @Test
    void missingExplicitFileShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Config.load(workDir, workDir.resolve("absent.properties"), Map.of()));
    }

    @Test
    void typedGettersShouldFallBackOnBadValues() {
        Config config = Config.of(Map.of(
                "a.int", "x",
                "a.bool", "yes",
                "a.list", " aapl, msft;nvda  amd ,"
        ));

        assertEquals(7, config.getInt("a.int", 7));
        assertEquals(true, config.getBoolean("a.bool", false));
        assertEquals(false, config.getBoolean("a.missing", false));
        assertEquals(List.of("aapl", "msft", "nvda", "amd"), config.getList("a.list"));
        assertEquals("", config.getString("a.missing"));
        assertNull(config.getRaw("a.missing"));
    }
}
