package com.gamearr.jobs;

import com.gamearr.EngineSettings;
import com.gamearr.integration.CatalogStore;
import com.gamearr.integration.IntegrationException;
import com.gamearr.integration.MetadataClient;
import com.gamearr.integration.ReleaseFeedClient;
import com.gamearr.model.CatalogEntry;
import com.gamearr.model.MatchConfidence;
import com.gamearr.model.MatchResult;
import com.gamearr.model.MetadataCandidate;
import com.gamearr.model.ReleaseCandidate;
import com.gamearr.model.UpdateCandidate;
import com.gamearr.model.UpdateType;
import com.gamearr.release.MatchScorer;
import com.gamearr.release.QualityClassifier;
import com.gamearr.release.ReleaseMatcher;
import com.gamearr.release.TitleNormalizer;
import com.gamearr.release.VersionComparator;
import com.gamearr.scheduler.RunSummary;
import com.gamearr.scheduler.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Looks for newer versions, add-on content and better-sourced releases of acquired entries.
 */
public class UpdateCheckJob implements ScheduledJob {

    private static final Logger log = LoggerFactory.getLogger(UpdateCheckJob.class);

    private final ReleaseFeedClient feed;
    private final CatalogStore catalog;
    private final MetadataClient metadata;
    private final ReleaseMatcher matcher;
    private final EngineSettings settings;
    private final Clock clock;

    public UpdateCheckJob(ReleaseFeedClient feed, CatalogStore catalog, MetadataClient metadata,
                          ReleaseMatcher matcher, EngineSettings settings, Clock clock) {
        this.feed = feed;
        this.catalog = catalog;
        this.metadata = metadata == null ? MetadataClient.DISABLED : metadata;
        this.matcher = matcher;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public String name() {
        return JobNames.UPDATE_CHECK;
    }

    @Override
    public RunSummary run() {
        RunSummary.Builder summary = RunSummary.builder(name(), clock.instant());
        if (!settings.isJobEnabled(name())) {
            log.debug("Update check disabled, skipping");
            return summary.build(clock.instant());
        }
        if (!feed.isConfigured()) {
            throw IntegrationException.notConfigured("Release feed");
        }

        List<CatalogEntry> toCheck = catalog.listAcquired().stream()
                .filter(e -> !e.ignoreUpdates())
                .toList();
        log.info("Checking {} acquired entries for updates", toCheck.size());

        Map<CatalogEntry, List<UpdateCandidate>> found = new LinkedHashMap<>();
        for (CatalogEntry entry : toCheck) {
            summary.processed();
            try {
                List<UpdateCandidate> updates = checkEntry(entry);
                if (!updates.isEmpty()) {
                    found.put(entry, updates);
                }
            } catch (IntegrationException e) {
                if (e.isNotConfigured()) {
                    throw e;
                }
                log.warn("Update check for '{}' failed: {}", entry.title(), e.getMessage());
                summary.error(entry.title() + ": " + e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Update check for '{}' failed: {}", entry.title(), e.getMessage());
                summary.error(entry.title() + ": " + e.getMessage());
            }
        }

        confirmVersionUpdates(found, summary);

        for (Map.Entry<CatalogEntry, List<UpdateCandidate>> e : found.entrySet()) {
            if (e.getValue().isEmpty()) {
                continue;
            }
            try {
                catalog.recordUpdates(e.getKey().id(), e.getValue());
                summary.matched();
                log.info("Found {} updates for '{}'", e.getValue().size(), e.getKey().title());
            } catch (RuntimeException ex) {
                log.warn("Failed to record updates for '{}': {}", e.getKey().title(), ex.getMessage());
                summary.error(e.getKey().title() + ": " + ex.getMessage());
            }
        }
        return summary.build(clock.instant());
    }

    List<UpdateCandidate> checkEntry(CatalogEntry entry) {
        List<ReleaseCandidate> releases = feed.fetchConfiguredQueryReleases(TitleNormalizer.toSearchQuery(entry.title()));

        Set<String> seenLocators = new HashSet<>();
        Set<String> seenTitles = new HashSet<>();
        for (UpdateCandidate existing : catalog.listUpdates(entry.id())) {
            if (existing.downloadUrl() != null) seenLocators.add(existing.downloadUrl());
            seenTitles.add(existing.title());
        }

        List<UpdateCandidate> updates = new ArrayList<>();
        for (ReleaseCandidate release : releases) {
            if (release.downloadUrl() != null && seenLocators.contains(release.downloadUrl())) {
                continue;
            }
            if (seenTitles.contains(release.title())) {
                continue;
            }
            MatchResult match = matcher.match(release, entry);
            if (match.confidence() == MatchConfidence.LOW) {
                continue;
            }
            Optional<UpdateType> type = classify(match, entry);
            if (type.isEmpty()) {
                continue;
            }
            updates.add(UpdateCandidate.of(entry, release, type.get(), match.version(), match.quality()));
            if (release.downloadUrl() != null) seenLocators.add(release.downloadUrl());
            seenTitles.add(release.title());
            log.debug("Found {} update for '{}': {}", type.get(), entry.title(), release.title());
        }
        return updates;
    }

    /**
     * Add-on content wins over a version bump, which wins over a better source.
     */
    static Optional<UpdateType> classify(MatchResult match, CatalogEntry entry) {
        if (match.additionalContent()) {
            return Optional.of(UpdateType.DLC);
        }
        String version = match.version();
        if (version != null) {
            if (entry.installedVersion() == null || VersionComparator.isNewer(version, entry.installedVersion())) {
                return Optional.of(UpdateType.VERSION);
            }
        }
        if (QualityClassifier.isBetterQuality(match.quality(), entry.installedQuality())) {
            return Optional.of(UpdateType.BETTER_RELEASE);
        }
        return Optional.empty();
    }

    /**
     * Drops version candidates for titles the metadata source cannot confirm. Skipped
     * entirely when no metadata source is configured. When the lookup itself fails the
     * version candidates are held back for this run and reported as errors; nothing is
     * recorded for them, so the next run finds them again.
     */
    private void confirmVersionUpdates(Map<CatalogEntry, List<UpdateCandidate>> found, RunSummary.Builder summary) {
        if (!metadata.isConfigured()) {
            return;
        }
        List<CatalogEntry> needConfirmation = found.entrySet().stream()
                .filter(e -> e.getValue().stream().anyMatch(u -> u.type() == UpdateType.VERSION))
                .map(Map.Entry::getKey)
                .toList();
        if (needConfirmation.isEmpty()) {
            return;
        }
        List<String> queries = needConfirmation.stream().map(CatalogEntry::title).distinct().toList();
        Map<String, List<MetadataCandidate>> results;
        try {
            results = metadata.searchBatch(queries,
                    (done, total) -> log.debug("Metadata confirmation {}/{}", done, total));
        } catch (IntegrationException e) {
            if (e.isNotConfigured()) {
                log.debug("Metadata source not configured, skipping confirmation");
                return;
            }
            log.warn("Metadata confirmation failed: {}", e.getMessage());
            needConfirmation.forEach(entry -> holdBackVersionUpdates(entry, found, summary, e.getMessage()));
            return;
        } catch (RuntimeException e) {
            log.warn("Metadata confirmation failed: {}", e.getMessage());
            needConfirmation.forEach(entry -> holdBackVersionUpdates(entry, found, summary, e.getMessage()));
            return;
        }

        for (CatalogEntry entry : needConfirmation) {
            List<MetadataCandidate> candidates = results.get(entry.title());
            if (candidates == null) {
                holdBackVersionUpdates(entry, found, summary, "metadata lookup failed");
                continue;
            }
            if (isConfirmed(entry, candidates)) {
                continue;
            }
            log.info("Version updates for '{}' not confirmed by metadata, dropping them", entry.title());
            found.put(entry, withoutVersionUpdates(found.get(entry)));
        }
    }

    private static void holdBackVersionUpdates(CatalogEntry entry, Map<CatalogEntry, List<UpdateCandidate>> found,
                                               RunSummary.Builder summary, String reason) {
        found.put(entry, withoutVersionUpdates(found.get(entry)));
        summary.error(entry.title() + ": version confirmation failed: " + reason);
    }

    private static List<UpdateCandidate> withoutVersionUpdates(List<UpdateCandidate> updates) {
        return updates.stream().filter(u -> u.type() != UpdateType.VERSION).toList();
    }

    static boolean isConfirmed(CatalogEntry entry, List<MetadataCandidate> candidates) {
        String normalizedCatalog = TitleNormalizer.normalize(entry.title());
        for (MetadataCandidate c : candidates) {
            String normalizedCandidate = TitleNormalizer.normalize(c.title());
            if (MatchScorer.score(normalizedCandidate, normalizedCatalog).confidence() == MatchConfidence.HIGH) {
                return true;
            }
        }
        return false;
    }
}
