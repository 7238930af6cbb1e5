package com.gamearr.jobs;

import com.gamearr.EngineSettings;
import com.gamearr.TestClock;
import com.gamearr.fakes.FakeDownloadClient;
import com.gamearr.fakes.FakeReleaseFeed;
import com.gamearr.fakes.InMemoryCatalog;
import com.gamearr.integration.IntegrationException;
import com.gamearr.model.CatalogEntry;
import com.gamearr.model.CatalogStatus;
import com.gamearr.release.ReleaseMatcher;
import com.gamearr.scheduler.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static com.gamearr.fakes.Releases.release;
import static org.junit.jupiter.api.Assertions.*;

class ReleaseSearchJobTest {

    private final TestClock clock = new TestClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final FakeReleaseFeed feed = new FakeReleaseFeed();
    private final FakeDownloadClient downloads = new FakeDownloadClient();
    private final InMemoryCatalog catalog = new InMemoryCatalog();
    private final EngineSettings settings = new EngineSettings();
    private ReleaseSearchJob job;

    @BeforeEach
    void setUp() {
        settings.setDryRun(false);
        settings.setJobEnabled(JobNames.RELEASE_SEARCH, true);
        AcquisitionService acquisition = new AcquisitionService(downloads, catalog, settings, "gamearr");
        job = new ReleaseSearchJob(feed, catalog, acquisition, new ReleaseMatcher(clock), settings, clock);
    }

    @Test
    void grabsFirstQualifyingResultNotTheHighestScoring() {
        catalog.add(CatalogEntry.wanted(1, "Hades", null));
        Instant now = clock.instant();
        feed.byQuery.put("Hades", List.of(
                release("a", "Hades-GOG", 2, now),
                release("b", "Hades Repack", 10, now),
                release("c", "Hades GOG", 50, now)));

        RunSummary summary = job.run();

        assertEquals(1, summary.grabbed());
        assertEquals(List.of("Hades Repack"), summary.grabbedTitles());
        assertEquals("magnet:?xt=urn:btih:b", downloads.submitted.get(0).downloadUrl());
        assertEquals(CatalogStatus.ACQUIRING, catalog.entries.get(1L).status());
    }

    @Test
    void additionalContentIsSkippedForBaseGameGrab() {
        catalog.add(CatalogEntry.wanted(1, "Game Name", null));
        Instant now = clock.instant();
        feed.byQuery.put("Game Name", List.of(
                release("dlc", "Game Name - Blood and Wine", 50, now),
                release("base", "Game Name Repack", 10, now)));

        RunSummary summary = job.run();

        assertEquals(List.of("Game Name Repack"), summary.grabbedTitles());
        assertEquals(1, downloads.submitted.size());
        assertEquals("magnet:?xt=urn:btih:base", downloads.submitted.get(0).downloadUrl());
    }

    @Test
    void queryDropsApostrophesAndUsesDigitsForNumerals() {
        catalog.add(CatalogEntry.wanted(1, "Baldur's Gate III", null));

        job.run();

        assertEquals(List.of("Baldurs Gate 3"), feed.queries);
    }

    @Test
    void lowConfidenceResultsAreIgnored() {
        catalog.add(CatalogEntry.wanted(1, "Hades", null));
        feed.byQuery.put("Hades", List.of(release("x", "Celeste GOG", 99, clock.instant())));

        RunSummary summary = job.run();

        assertEquals(1, summary.processed());
        assertEquals(0, summary.matched());
        assertTrue(downloads.submitted.isEmpty());
    }

    @Test
    void failureForOneEntryDoesNotStopOthers() {
        catalog.add(CatalogEntry.wanted(1, "Hades", null)).add(CatalogEntry.wanted(2, "Celeste", null));
        feed.queryFailures.put("Hades", IntegrationException.connection("Prowlarr", new IOException("timeout")));
        feed.byQuery.put("Celeste", List.of(release("c", "Celeste GOG", 40, clock.instant())));

        RunSummary summary = job.run();

        assertEquals(2, summary.processed());
        assertEquals(1, summary.errors().size());
        assertEquals(List.of("Celeste GOG"), summary.grabbedTitles());
    }

    @Test
    void unconfiguredFeedAbortsThePass() {
        catalog.add(CatalogEntry.wanted(1, "Hades", null));
        feed.configured = false;

        IntegrationException e = assertThrows(IntegrationException.class, job::run);

        assertTrue(e.isNotConfigured());
        assertTrue(feed.queries.isEmpty());
    }

    @Test
    void noWantedEntriesMeansNoQueries() {
        catalog.add(CatalogEntry.acquired(1, "Hades", "1.0", "GOG"));

        RunSummary summary = job.run();

        assertEquals(0, summary.processed());
        assertTrue(feed.queries.isEmpty());
    }
}
