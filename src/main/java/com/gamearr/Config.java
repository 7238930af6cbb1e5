package com.gamearr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Static configuration lookup.
 * <p>
 * Sources in increasing precedence: {@code config.properties}, {@code .env}, process environment.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private static final Map<String, String> cache = new ConcurrentHashMap<>();
    private static final List<String> loadedSources = new ArrayList<>();
    private static volatile boolean initialized = false;

    private static final int DEFAULT_PORT = 8787;

    private Config() {}

    private static synchronized void loadIfNeeded() {
        if (initialized) return;
        Path workDir = Path.of(System.getProperty("user.dir", "."));
        loadFromPropertiesIfPresent(workDir.resolve("config.properties"));
        loadFromDotEnvIfPresent(workDir.resolve(".env"));
        initialized = true;
    }

    private static void loadFromPropertiesIfPresent(Path file) {
        if (!Files.isRegularFile(file)) return;
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return;
        }
        for (String name : props.stringPropertyNames()) {
            String value = props.getProperty(name);
            if (value != null) {
                cache.put(name.trim(), value.trim());
            }
        }
        loadedSources.add(file.toString());
    }

    private static void loadFromDotEnvIfPresent(Path file) {
        if (!Files.isRegularFile(file)) return;
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return;
        }
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring(7).trim();
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = line.substring(0, eq).trim();
            String value = stripQuotes(line.substring(eq + 1).trim());
            cache.put(key, value);
        }
        loadedSources.add(file.toString());
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    static String get(String key) {
        loadIfNeeded();
        String env = System.getenv(key);
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        String v = cache.get(key);
        return (v == null || v.isBlank()) ? null : v;
    }

    static String getOrDefault(String key, String fallback) {
        String v = get(key);
        return v != null ? v : fallback;
    }

    static int getInt(String key, int fallback) {
        String v = get(key);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: '{}', using {}", key, v, fallback);
            return fallback;
        }
    }

    static boolean getBoolean(String key, boolean fallback) {
        String v = get(key);
        if (v == null) return fallback;
        String t = v.trim().toLowerCase(Locale.ROOT);
        if (t.equals("true") || t.equals("1") || t.equals("yes") || t.equals("on")) return true;
        if (t.equals("false") || t.equals("0") || t.equals("no") || t.equals("off")) return false;
        return fallback;
    }

    // =========================================================================
    // Server
    // =========================================================================

    public static int getPort() {
        int port = getInt("PORT", DEFAULT_PORT);
        return (port < 0 || port > 65535) ? DEFAULT_PORT : port;
    }

    // =========================================================================
    // Collaborators
    // =========================================================================

    public static String getProwlarrUrl() {
        return get("PROWLARR_URL");
    }

    public static String getProwlarrApiKey() {
        return get("PROWLARR_API_KEY");
    }

    public static List<Integer> getProwlarrCategories() {
        String raw = getOrDefault("PROWLARR_CATEGORIES", "4050");
        List<Integer> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            try {
                out.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                log.debug("Skipping invalid Prowlarr category '{}'", part);
            }
        }
        return out;
    }

    public static String getQBittorrentHost() {
        return get("QBITTORRENT_HOST");
    }

    public static String getQBittorrentUsername() {
        return get("QBITTORRENT_USERNAME");
    }

    public static String getQBittorrentPassword() {
        return get("QBITTORRENT_PASSWORD");
    }

    public static String getQBittorrentCategory() {
        return getOrDefault("QBITTORRENT_CATEGORY", "gamearr");
    }

    public static String getRedisHost() {
        return get("REDIS_HOST");
    }

    public static int getRedisPort() {
        return getInt("REDIS_PORT", 6379);
    }

    public static String getRedisPassword() {
        return get("REDIS_PASSWORD");
    }

    public static Path getCatalogFile() {
        return Path.of(getOrDefault("CATALOG_FILE", "data/catalog.json"));
    }

    // =========================================================================
    // Engine
    // =========================================================================

    public static boolean isDryRun() {
        return getBoolean("DRY_RUN", true);
    }

    public static int getAutoGrabMinScore() {
        return getInt("AUTO_GRAB_MIN_SCORE", EngineSettings.DEFAULT_MIN_SCORE);
    }

    public static int getAutoGrabMinSeeders() {
        return getInt("AUTO_GRAB_MIN_SEEDERS", EngineSettings.DEFAULT_MIN_SEEDERS);
    }

    public static int getRssSyncIntervalMinutes() {
        return getInt("RSS_SYNC_INTERVAL_MINUTES", EngineSettings.DEFAULT_INTERVAL_MINUTES);
    }

    public static int getSearchIntervalMinutes() {
        return getInt("SEARCH_INTERVAL_MINUTES", EngineSettings.DEFAULT_INTERVAL_MINUTES);
    }

    public static int getDownloadMonitorIntervalSeconds() {
        return getInt("DOWNLOAD_MONITOR_INTERVAL_SECONDS", 30);
    }

    public static String getUpdateCheckSchedule() {
        return getOrDefault("UPDATE_CHECK_SCHEDULE", "daily");
    }

    public static boolean isJobEnabled(String jobName) {
        String key = jobName.toUpperCase(Locale.ROOT).replace('-', '_') + "_ENABLED";
        return getBoolean(key, true);
    }

    public static int getDedupMaxProcessed() {
        return getInt("DEDUP_MAX_PROCESSED", 1000);
    }

    public static int getDedupMaxAgeHours() {
        return getInt("DEDUP_MAX_AGE_HOURS", 24);
    }

    public static boolean hasProwlarr() {
        return getProwlarrUrl() != null && getProwlarrApiKey() != null;
    }

    public static boolean hasQBittorrent() {
        return getQBittorrentHost() != null;
    }

    public static void printStatus() {
        loadIfNeeded();
        log.info("Configuration sources: {}", loadedSources.isEmpty() ? "environment only" : String.join(", ", loadedSources));
        log.info("Prowlarr: {}", hasProwlarr() ? "configured" : "not configured");
        log.info("qBittorrent: {}", hasQBittorrent() ? "configured" : "not configured");
        log.info("Redis: {}", getRedisHost() != null ? getRedisHost() + ":" + getRedisPort() : "not configured");
        log.info("Dry run: {}", isDryRun());
    }

    static List<String> loadedSources() {
        return List.copyOf(loadedSources);
    }
}
