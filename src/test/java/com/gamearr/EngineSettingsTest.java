package com.gamearr;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineSettingsTest {

    @Test
    void defaultsAreConservative() {
        EngineSettings s = new EngineSettings();
        assertTrue(s.dryRun());
        assertEquals(100, s.minScore());
        assertEquals(5, s.minSeeders());
        assertEquals(15, s.rssIntervalMinutes());
        assertEquals(EngineSettings.UpdateSchedule.DAILY, s.updateSchedule());
    }

    @Test
    void valuesAreClamped() {
        EngineSettings s = new EngineSettings();
        s.setRssIntervalMinutes(1);
        s.setSearchIntervalMinutes(5000);
        s.setMinScore(-10);
        s.setMinSeeders(1000);

        assertEquals(5, s.rssIntervalMinutes());
        assertEquals(1440, s.searchIntervalMinutes());
        assertEquals(0, s.minScore());
        assertEquals(100, s.minSeeders());
    }

    @Test
    void parsesSchedules() {
        assertEquals(EngineSettings.UpdateSchedule.HOURLY, EngineSettings.UpdateSchedule.parse("Hourly"));
        assertEquals(EngineSettings.UpdateSchedule.WEEKLY, EngineSettings.UpdateSchedule.parse(" weekly "));
        assertEquals(EngineSettings.UpdateSchedule.DAILY, EngineSettings.UpdateSchedule.parse("fortnightly"));
        assertEquals(EngineSettings.UpdateSchedule.DAILY, EngineSettings.UpdateSchedule.parse(null));
        assertEquals(Duration.ofDays(7), EngineSettings.UpdateSchedule.WEEKLY.interval());
    }

    @Test
    void jobSwitchOverridesConfig() {
        EngineSettings s = new EngineSettings();
        s.setJobEnabled("rss-sync", false);
        assertFalse(s.isJobEnabled("rss-sync"));
    }
}
