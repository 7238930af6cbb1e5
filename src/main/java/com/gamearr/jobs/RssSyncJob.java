package com.gamearr.jobs;

import com.gamearr.EngineSettings;
import com.gamearr.dedup.DedupStore;
import com.gamearr.dedup.ProcessedGuidSnapshotStore;
import com.gamearr.integration.CatalogStore;
import com.gamearr.integration.IntegrationException;
import com.gamearr.integration.ReleaseFeedClient;
import com.gamearr.model.CatalogEntry;
import com.gamearr.model.MatchConfidence;
import com.gamearr.model.MatchResult;
import com.gamearr.model.ReleaseCandidate;
import com.gamearr.release.AutoGrabPolicy;
import com.gamearr.release.ReleaseMatcher;
import com.gamearr.scheduler.ConnectionFailureTracker;
import com.gamearr.scheduler.RunSummary;
import com.gamearr.scheduler.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Passive feed watcher. New releases are matched against every wanted entry; the best
 * non-low match is grabbed when it clears the auto-grab thresholds.
 */
public class RssSyncJob implements ScheduledJob {

    private static final Logger log = LoggerFactory.getLogger(RssSyncJob.class);

    private final ReleaseFeedClient feed;
    private final CatalogStore catalog;
    private final AcquisitionService acquisition;
    private final ReleaseMatcher matcher;
    private final DedupStore dedup;
    private final ProcessedGuidSnapshotStore snapshots;
    private final EngineSettings settings;
    private final Clock clock;
    private final ConnectionFailureTracker feedConnection;

    private boolean restored;
    private Instant lastSyncAt;

    public RssSyncJob(ReleaseFeedClient feed,
                      CatalogStore catalog,
                      AcquisitionService acquisition,
                      ReleaseMatcher matcher,
                      DedupStore dedup,
                      ProcessedGuidSnapshotStore snapshots,
                      EngineSettings settings,
                      Clock clock) {
        this.feed = feed;
        this.catalog = catalog;
        this.acquisition = acquisition;
        this.matcher = matcher;
        this.dedup = dedup;
        this.snapshots = snapshots;
        this.settings = settings;
        this.clock = clock;
        this.feedConnection = new ConnectionFailureTracker("Release feed", ConnectionFailureTracker.DEFAULT_QUIET_WINDOW, clock);
    }

    @Override
    public String name() {
        return JobNames.RSS_SYNC;
    }

    @Override
    public RunSummary run() {
        Instant started = clock.instant();
        RunSummary.Builder summary = RunSummary.builder(name(), started);
        if (!settings.isJobEnabled(name())) {
            log.debug("RSS sync disabled, skipping");
            return summary.build(clock.instant());
        }
        if (!feed.isConfigured()) {
            throw IntegrationException.notConfigured("Release feed");
        }
        acquisition.requireReady();

        if (!restored) {
            dedup.restore(snapshots.load());
            restored = true;
        }
        int purged = dedup.purgeStale(started);
        if (purged > 0) {
            log.debug("Purged {} stale processed releases", purged);
        }

        List<CatalogEntry> remaining = new ArrayList<>(catalog.listMonitoredWanted());
        if (remaining.isEmpty()) {
            log.debug("No wanted entries, skipping RSS sync");
            return summary.build(clock.instant());
        }

        List<ReleaseCandidate> releases;
        try {
            releases = feed.fetchRecentReleases(Optional.ofNullable(lastSyncAt));
            feedConnection.recordSuccess();
        } catch (IntegrationException e) {
            if (e.isNotConfigured()) {
                throw e;
            }
            if (e.kind() == IntegrationException.Kind.CONNECTION) {
                feedConnection.recordFailure(e.getMessage());
            } else {
                log.warn("RSS fetch failed: {}", e.getMessage());
            }
            summary.error("feed: " + e.getMessage());
            return summary.build(clock.instant());
        }

        int minScore = settings.minScore();
        int minSeeders = settings.minSeeders();
        String prefix = acquisition.isDryRun() ? "[DRY-RUN] " : "";

        for (ReleaseCandidate release : releases) {
            if (remaining.isEmpty()) {
                break;
            }
            if (release.guid() == null || dedup.has(release.guid())) {
                continue;
            }
            summary.processed();
            try {
                Optional<MatchResult> best = bestMatch(release, remaining);
                if (best.isPresent()) {
                    MatchResult match = best.get();
                    summary.matched();
                    if (AutoGrabPolicy.qualifies(match, minScore, minSeeders)) {
                        acquisition.grab(match);
                        summary.grabbed(release.title());
                        remaining.remove(match.entry());
                        log.info("{}Auto-grabbed from feed: {} -> {}", prefix, release.title(), match.entry().title());
                    } else {
                        log.debug("Feed match below auto-grab threshold: {} -> {} (score {}, seeders {}, dlc {})",
                                release.title(), match.entry().title(), match.score(), match.seeders(), match.additionalContent());
                    }
                }
                dedup.markSeen(release.guid());
            } catch (RuntimeException e) {
                log.warn("Failed to process release '{}': {}", release.title(), e.getMessage());
                summary.error(release.title() + ": " + e.getMessage());
            }
        }

        lastSyncAt = started;
        snapshots.save(dedup.snapshot());
        return summary.build(clock.instant());
    }

    public void clearProcessed() {
        dedup.clear();
        log.info("Cleared processed release cache");
    }

    public int processedCount() {
        return dedup.size();
    }

    private Optional<MatchResult> bestMatch(ReleaseCandidate release, List<CatalogEntry> entries) {
        MatchResult best = null;
        for (CatalogEntry entry : entries) {
            MatchResult match = matcher.match(release, entry);
            if (match.confidence() == MatchConfidence.LOW) {
                continue;
            }
            if (best == null || match.score() > best.score()) {
                best = match;
            }
        }
        return Optional.ofNullable(best);
    }
}
