package com.gamearr.jobs;

import com.gamearr.EngineSettings;
import com.gamearr.TestClock;
import com.gamearr.fakes.FakeDownloadClient;
import com.gamearr.fakes.InMemoryCatalog;
import com.gamearr.integration.IntegrationException;
import com.gamearr.model.ActiveDownload;
import com.gamearr.model.CatalogEntry;
import com.gamearr.model.CatalogStatus;
import com.gamearr.model.DownloadState;
import com.gamearr.model.PendingAcquisition;
import com.gamearr.model.ReleaseInfo;
import com.gamearr.scheduler.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DownloadMonitorJobTest {

    private static final String RELEASE_TITLE = "Baldurs.Gate.3.v4.1.1-GOG";

    private final TestClock clock = new TestClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final FakeDownloadClient downloads = new FakeDownloadClient();
    private final InMemoryCatalog catalog = new InMemoryCatalog();
    private final EngineSettings settings = new EngineSettings();
    private DownloadMonitorJob job;

    @BeforeEach
    void setUp() {
        settings.setJobEnabled(JobNames.DOWNLOAD_MONITOR, true);
        catalog.add(CatalogEntry.wanted(1, "Baldur's Gate 3", 2023));
        catalog.markAcquiring(1, new ReleaseInfo(RELEASE_TITLE, "4.1.1", "GOG", "idx", "magnet:?xt=1"));
        job = new DownloadMonitorJob(downloads, catalog, settings, "gamearr", clock);
    }

    @Test
    void completedTransferMarksEntryAcquired() {
        downloads.downloads = List.of(new ActiveDownload("h1", RELEASE_TITLE, 1.0, DownloadState.COMPLETED, "gamearr", 1L));

        RunSummary summary = job.run();

        CatalogEntry entry = catalog.entries.get(1L);
        assertEquals(CatalogStatus.ACQUIRED, entry.status());
        assertEquals("4.1.1", entry.installedVersion());
        assertEquals("GOG", entry.installedQuality());
        assertTrue(catalog.pending.isEmpty());
        assertEquals(1, summary.matched());
    }

    @Test
    void erroredTransferSendsEntryBackToWanted() {
        downloads.downloads = List.of(new ActiveDownload("h1", RELEASE_TITLE, 0.4, DownloadState.FAILED, "gamearr", 1L));

        RunSummary summary = job.run();

        assertEquals(CatalogStatus.WANTED, catalog.entries.get(1L).status());
        assertEquals(List.of(1L), catalog.failed);
        assertTrue(summary.errors().isEmpty());
    }

    @Test
    void inProgressTransferLeavesEntryAlone() {
        downloads.downloads = List.of(new ActiveDownload("h1", RELEASE_TITLE, 0.5, DownloadState.DOWNLOADING, "gamearr", 1L));

        job.run();

        assertEquals(CatalogStatus.ACQUIRING, catalog.entries.get(1L).status());
        assertEquals(1, catalog.pending.size());
    }

    @Test
    void untaggedTransferIsFoundByTitlePrefix() {
        PendingAcquisition pending = catalog.listPendingAcquisitions().get(0);
        ActiveDownload otherEntry = new ActiveDownload("h0", RELEASE_TITLE, 1.0, DownloadState.COMPLETED, "gamearr", 9L);
        ActiveDownload untagged = new ActiveDownload("h1", "[GOG] Baldurs.Gate.3.v4.1.1-GOG", 0.2, DownloadState.DOWNLOADING, "gamearr", null);

        assertEquals("h1", DownloadMonitorJob.findTransfer(pending, List.of(otherEntry, untagged)).orElseThrow().handle());
        assertTrue(DownloadMonitorJob.findTransfer(pending, List.of(otherEntry)).isEmpty());
    }

    @Test
    void clientOutageIsReportedAndTracked() {
        downloads.failure = IntegrationException.connection("qBittorrent", new IOException("refused"));

        RunSummary summary = job.run();

        assertEquals(1, summary.errors().size());
        assertFalse(job.isConnected());

        downloads.failure = null;
        job.run();
        assertTrue(job.isConnected());
    }

    @Test
    void nothingPendingSkipsTheClient() {
        catalog.pending.clear();
        downloads.failure = new IllegalStateException("should not be called");

        RunSummary summary = job.run();

        assertTrue(summary.errors().isEmpty());
    }

    @Test
    void unconfiguredClientAbortsThePass() {
        downloads.configured = false;
        IntegrationException e = assertThrows(IntegrationException.class, job::run);
        assertTrue(e.isNotConfigured());
    }
}
