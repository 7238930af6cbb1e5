package com.gamearr.jobs;

import com.gamearr.EngineSettings;
import com.gamearr.integration.CatalogStore;
import com.gamearr.integration.DownloadClient;
import com.gamearr.integration.IntegrationException;
import com.gamearr.model.ActiveDownload;
import com.gamearr.model.DownloadState;
import com.gamearr.model.PendingAcquisition;
import com.gamearr.scheduler.ConnectionFailureTracker;
import com.gamearr.scheduler.RunSummary;
import com.gamearr.scheduler.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Syncs pending acquisitions with the download client. Completed transfers mark the
 * entry acquired; errored ones send it back to wanted.
 */
public class DownloadMonitorJob implements ScheduledJob {

    private static final Logger log = LoggerFactory.getLogger(DownloadMonitorJob.class);
    private static final int TITLE_PREFIX_LENGTH = 20;

    private final DownloadClient downloadClient;
    private final CatalogStore catalog;
    private final EngineSettings settings;
    private final String category;
    private final Clock clock;
    private final ConnectionFailureTracker connection;

    public DownloadMonitorJob(DownloadClient downloadClient, CatalogStore catalog, EngineSettings settings,
                              String category, Clock clock) {
        this(downloadClient, catalog, settings, category, clock,
                new ConnectionFailureTracker("qBittorrent", ConnectionFailureTracker.DEFAULT_QUIET_WINDOW, clock));
    }

    DownloadMonitorJob(DownloadClient downloadClient, CatalogStore catalog, EngineSettings settings,
                       String category, Clock clock, ConnectionFailureTracker connection) {
        this.downloadClient = downloadClient;
        this.catalog = catalog;
        this.settings = settings;
        this.category = category;
        this.clock = clock;
        this.connection = connection;
    }

    @Override
    public String name() {
        return JobNames.DOWNLOAD_MONITOR;
    }

    @Override
    public RunSummary run() {
        RunSummary.Builder summary = RunSummary.builder(name(), clock.instant());
        if (!settings.isJobEnabled(name())) {
            return summary.build(clock.instant());
        }
        if (!downloadClient.isConfigured()) {
            throw IntegrationException.notConfigured("qBittorrent");
        }
        List<PendingAcquisition> pending = catalog.listPendingAcquisitions();
        if (pending.isEmpty()) {
            return summary.build(clock.instant());
        }

        List<ActiveDownload> downloads;
        try {
            downloads = downloadClient.listDownloads(category);
            connection.recordSuccess();
        } catch (IntegrationException e) {
            if (e.isConnectionFailure()) {
                connection.recordFailure(e.getMessage());
            } else {
                log.error("Download monitor sync failed: {}", e.getMessage());
            }
            summary.error("download client: " + e.getMessage());
            return summary.build(clock.instant());
        }

        for (PendingAcquisition p : pending) {
            summary.processed();
            try {
                Optional<ActiveDownload> transfer = findTransfer(p, downloads);
                if (transfer.isEmpty()) {
                    continue;
                }
                ActiveDownload d = transfer.get();
                if (d.isComplete()) {
                    catalog.markAcquired(p.entryId(), p.release());
                    summary.matched();
                    log.info("Download completed: {}", p.release().title());
                } else if (d.state() == DownloadState.FAILED) {
                    catalog.markFailed(p.entryId());
                    log.warn("Download failed, entry {} returned to wanted: {}", p.entryId(), p.release().title());
                }
            } catch (RuntimeException e) {
                log.warn("Failed to sync download for entry {}: {}", p.entryId(), e.getMessage());
                summary.error("entry " + p.entryId() + ": " + e.getMessage());
            }
        }
        return summary.build(clock.instant());
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    static Optional<ActiveDownload> findTransfer(PendingAcquisition pending, List<ActiveDownload> downloads) {
        for (ActiveDownload d : downloads) {
            if (d.entryId() != null && d.entryId() == pending.entryId()) {
                return Optional.of(d);
            }
        }
        String title = pending.release() == null ? null : pending.release().title();
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String lower = title.toLowerCase(Locale.ROOT);
        String prefix = lower.substring(0, Math.min(TITLE_PREFIX_LENGTH, lower.length()));
        for (ActiveDownload d : downloads) {
            if (d.entryId() == null && d.name() != null && d.name().toLowerCase(Locale.ROOT).contains(prefix)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
