package com.gamearr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime-adjustable engine settings. Jobs read these at the start of every pass, so a
 * change takes effect on the next tick. Out-of-range values are clamped.
 */
public class EngineSettings {

    private static final Logger log = LoggerFactory.getLogger(EngineSettings.class);

    public static final int DEFAULT_MIN_SCORE = 100;
    public static final int DEFAULT_MIN_SEEDERS = 5;
    public static final int DEFAULT_INTERVAL_MINUTES = 15;

    static final int MIN_INTERVAL_MINUTES = 5;
    static final int MAX_INTERVAL_MINUTES = 1440;
    static final int MAX_SCORE = 500;
    static final int MAX_SEEDERS = 100;

    public enum UpdateSchedule {
        HOURLY(Duration.ofHours(1)),
        DAILY(Duration.ofDays(1)),
        WEEKLY(Duration.ofDays(7));

        private final Duration interval;

        UpdateSchedule(Duration interval) {
            this.interval = interval;
        }

        public Duration interval() {
            return interval;
        }

        public static UpdateSchedule parse(String value) {
            if (value == null || value.isBlank()) return DAILY;
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown update check schedule '{}', using daily", value);
                return DAILY;
            }
        }
    }

    private volatile int minScore = DEFAULT_MIN_SCORE;
    private volatile int minSeeders = DEFAULT_MIN_SEEDERS;
    private volatile boolean dryRun = true;
    private volatile int rssIntervalMinutes = DEFAULT_INTERVAL_MINUTES;
    private volatile int searchIntervalMinutes = DEFAULT_INTERVAL_MINUTES;
    private volatile UpdateSchedule updateSchedule = UpdateSchedule.DAILY;
    private final Map<String, Boolean> jobEnabled = new ConcurrentHashMap<>();

    public static EngineSettings fromConfig() {
        EngineSettings s = new EngineSettings();
        s.setMinScore(Config.getAutoGrabMinScore());
        s.setMinSeeders(Config.getAutoGrabMinSeeders());
        s.setDryRun(Config.isDryRun());
        s.setRssIntervalMinutes(Config.getRssSyncIntervalMinutes());
        s.setSearchIntervalMinutes(Config.getSearchIntervalMinutes());
        s.setUpdateSchedule(UpdateSchedule.parse(Config.getUpdateCheckSchedule()));
        return s;
    }

    public int minScore() {
        return minScore;
    }

    public void setMinScore(int value) {
        this.minScore = clamp(value, 0, MAX_SCORE);
    }

    public int minSeeders() {
        return minSeeders;
    }

    public void setMinSeeders(int value) {
        this.minSeeders = clamp(value, 0, MAX_SEEDERS);
    }

    public boolean dryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public int rssIntervalMinutes() {
        return rssIntervalMinutes;
    }

    public void setRssIntervalMinutes(int minutes) {
        this.rssIntervalMinutes = clampInterval(minutes);
    }

    public int searchIntervalMinutes() {
        return searchIntervalMinutes;
    }

    public void setSearchIntervalMinutes(int minutes) {
        this.searchIntervalMinutes = clampInterval(minutes);
    }

    public UpdateSchedule updateSchedule() {
        return updateSchedule;
    }

    public void setUpdateSchedule(UpdateSchedule schedule) {
        this.updateSchedule = schedule == null ? UpdateSchedule.DAILY : schedule;
    }

    /**
     * Jobs are enabled unless switched off here or through {@code <JOB>_ENABLED}.
     */
    public boolean isJobEnabled(String jobName) {
        return jobEnabled.computeIfAbsent(jobName, Config::isJobEnabled);
    }

    public void setJobEnabled(String jobName, boolean enabled) {
        jobEnabled.put(jobName, enabled);
    }

    public static int clampInterval(int minutes) {
        return clamp(minutes, MIN_INTERVAL_MINUTES, MAX_INTERVAL_MINUTES);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
