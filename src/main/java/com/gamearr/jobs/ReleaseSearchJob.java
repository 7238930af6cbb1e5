package com.gamearr.jobs;

import com.gamearr.EngineSettings;
import com.gamearr.integration.CatalogStore;
import com.gamearr.integration.IntegrationException;
import com.gamearr.integration.ReleaseFeedClient;
import com.gamearr.model.CatalogEntry;
import com.gamearr.model.MatchConfidence;
import com.gamearr.model.MatchResult;
import com.gamearr.model.ReleaseCandidate;
import com.gamearr.release.AutoGrabPolicy;
import com.gamearr.release.ReleaseMatcher;
import com.gamearr.release.TitleNormalizer;
import com.gamearr.scheduler.ConnectionFailureTracker;
import com.gamearr.scheduler.RunSummary;
import com.gamearr.scheduler.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Active search: queries the indexer for each wanted entry and grabs the first release,
 * in result order, that clears the thresholds.
 */
public class ReleaseSearchJob implements ScheduledJob {

    private static final Logger log = LoggerFactory.getLogger(ReleaseSearchJob.class);

    private final ReleaseFeedClient feed;
    private final CatalogStore catalog;
    private final AcquisitionService acquisition;
    private final ReleaseMatcher matcher;
    private final EngineSettings settings;
    private final Clock clock;
    private final ConnectionFailureTracker feedConnection;

    public ReleaseSearchJob(ReleaseFeedClient feed, CatalogStore catalog, AcquisitionService acquisition,
                            ReleaseMatcher matcher, EngineSettings settings, Clock clock) {
        this.feed = feed;
        this.catalog = catalog;
        this.acquisition = acquisition;
        this.matcher = matcher;
        this.settings = settings;
        this.clock = clock;
        this.feedConnection = new ConnectionFailureTracker("Indexer search", ConnectionFailureTracker.DEFAULT_QUIET_WINDOW, clock);
    }

    @Override
    public String name() {
        return JobNames.RELEASE_SEARCH;
    }

    @Override
    public RunSummary run() {
        RunSummary.Builder summary = RunSummary.builder(name(), clock.instant());
        if (!settings.isJobEnabled(name())) {
            log.debug("Release search disabled, skipping");
            return summary.build(clock.instant());
        }
        if (!feed.isConfigured()) {
            throw IntegrationException.notConfigured("Release feed");
        }
        acquisition.requireReady();

        List<CatalogEntry> wanted = catalog.listMonitoredWanted();
        if (wanted.isEmpty()) {
            log.debug("No wanted entries to search for");
            return summary.build(clock.instant());
        }
        log.info("Searching releases for {} wanted entries", wanted.size());

        int minScore = settings.minScore();
        int minSeeders = settings.minSeeders();
        for (CatalogEntry entry : wanted) {
            summary.processed();
            try {
                Optional<MatchResult> pick = searchEntry(entry, minScore, minSeeders);
                if (pick.isEmpty()) {
                    continue;
                }
                summary.matched();
                acquisition.grab(pick.get());
                summary.grabbed(pick.get().release().title());
            } catch (IntegrationException e) {
                if (e.isNotConfigured()) {
                    throw e;
                }
                if (e.kind() == IntegrationException.Kind.CONNECTION) {
                    feedConnection.recordFailure(e.getMessage());
                } else {
                    log.warn("Search for '{}' failed: {}", entry.title(), e.getMessage());
                }
                summary.error(entry.title() + ": " + e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Search for '{}' failed: {}", entry.title(), e.getMessage());
                summary.error(entry.title() + ": " + e.getMessage());
            }
        }
        return summary.build(clock.instant());
    }

    Optional<MatchResult> searchEntry(CatalogEntry entry, int minScore, int minSeeders) {
        String query = TitleNormalizer.toSearchQuery(entry.title());
        List<ReleaseCandidate> releases = feed.fetchConfiguredQueryReleases(query);
        feedConnection.recordSuccess();

        List<MatchResult> matches = releases.stream()
                .map(r -> matcher.match(r, entry))
                .filter(m -> m.confidence() != MatchConfidence.LOW)
                .toList();
        Optional<MatchResult> pick = AutoGrabPolicy.selectFirstQualifying(matches, minScore, minSeeders);
        if (pick.isEmpty()) {
            log.debug("No release for '{}' meets auto-grab criteria ({} candidates)", entry.title(), releases.size());
        }
        return pick;
    }
}
