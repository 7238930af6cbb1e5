package com.gamearr;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises Config's file parsing and fallback behavior without relying on process env mutation.
 */
class ConfigInternalTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void cleanup() throws Exception {
        resetConfig();
    }

    @Test
    void loadsDotEnvAndStripsQuotes() throws Exception {
        resetConfig();

        Path envFile = tempDir.resolve(".env");
        Files.writeString(
                envFile,
                """
                        # indexer
                        PROWLARR_URL="http://prowlarr:9696"
                        PROWLARR_API_KEY='abc'
                        export QBITTORRENT_HOST=http://qbit:8080
                        PORT=9999
                        """,
                StandardCharsets.UTF_8
        );

        invokePrivate("loadFromDotEnvIfPresent", new Class<?>[]{Path.class}, new Object[]{envFile});
        setInitialized(true);

        assertEquals("http://prowlarr:9696", Config.getProwlarrUrl());
        assertEquals("abc", Config.getProwlarrApiKey());
        assertEquals("http://qbit:8080", Config.getQBittorrentHost());
        assertEquals(9999, Config.getPort());
        assertTrue(Config.hasProwlarr());
        assertEquals(List.of(envFile.toString()), Config.loadedSources());
    }

    @Test
    void loadsPropertiesFileWhenPresent() throws Exception {
        resetConfig();

        Path props = tempDir.resolve("config.properties");
        Files.writeString(
                props,
                """
                        DRY_RUN=false
                        AUTO_GRAB_MIN_SCORE=140
                        PROWLARR_CATEGORIES=4050, 4000, nope
                        UPDATE_CHECK_SCHEDULE=weekly
                        """,
                StandardCharsets.UTF_8
        );

        invokePrivate("loadFromPropertiesIfPresent", new Class<?>[]{Path.class}, new Object[]{props});
        setInitialized(true);

        assertFalse(Config.isDryRun());
        assertEquals(140, Config.getAutoGrabMinScore());
        assertEquals(List.of(4050, 4000), Config.getProwlarrCategories());
        assertEquals("weekly", Config.getUpdateCheckSchedule());
    }

    @Test
    void defaultsApplyWhenNothingIsConfigured() throws Exception {
        resetConfig();
        setInitialized(true);

        assertTrue(Config.isDryRun());
        assertEquals(1000, Config.getDedupMaxProcessed());
        assertEquals(24, Config.getDedupMaxAgeHours());
        assertEquals("gamearr", Config.getQBittorrentCategory());
        assertEquals(Path.of("data/catalog.json"), Config.getCatalogFile());
        assertTrue(Config.isJobEnabled("rss-sync"));
    }

    @Test
    void jobSwitchUsesUpperSnakeKey() throws Exception {
        resetConfig();
        Map<String, String> cache = getStatic("cache");
        cache.put("RELEASE_SEARCH_ENABLED", "off");
        setInitialized(true);

        assertFalse(Config.isJobEnabled("release-search"));
    }

    @Test
    void portFallsBackToDefaultOnInvalidValue() throws Exception {
        resetConfig();
        Map<String, String> cache = getStatic("cache");
        cache.put("PORT", "not-a-number");
        setInitialized(true);

        assertEquals(8787, Config.getPort());
    }

    @SuppressWarnings("unchecked")
    private static <T> T getStatic(String fieldName) throws Exception {
        Field f = Config.class.getDeclaredField(fieldName);
        f.setAccessible(true);
        return (T) f.get(null);
    }

    private static void setInitialized(boolean value) throws Exception {
        Field f = Config.class.getDeclaredField("initialized");
        f.setAccessible(true);
        f.setBoolean(null, value);
    }

    private static void resetConfig() throws Exception {
        Map<String, String> cache = getStatic("cache");
        cache.clear();
        List<String> sources = getStatic("loadedSources");
        sources.clear();
        setInitialized(false);
    }

    private static Object invokePrivate(String name, Class<?>[] paramTypes, Object[] args) throws Exception {
        Method m = Config.class.getDeclaredMethod(name, paramTypes);
        m.setAccessible(true);
        return m.invoke(null, args);
    }
}
