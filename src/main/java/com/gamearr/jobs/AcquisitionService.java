package com.gamearr.jobs;

import com.gamearr.EngineSettings;
import com.gamearr.integration.CatalogStore;
import com.gamearr.integration.DownloadClient;
import com.gamearr.integration.IntegrationException;
import com.gamearr.model.AcquisitionRequest;
import com.gamearr.model.MatchResult;
import com.gamearr.model.ReleaseCandidate;
import com.gamearr.model.ReleaseInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Hands a chosen release to the download client and moves the entry to acquiring.
 * In dry-run mode only the decision is logged.
 */
public class AcquisitionService {

    private static final Logger log = LoggerFactory.getLogger(AcquisitionService.class);
    static final String APP_TAG = "gamearr";

    public enum Outcome { SUBMITTED, DRY_RUN }

    private final DownloadClient downloadClient;
    private final CatalogStore catalog;
    private final EngineSettings settings;
    private final String category;

    public AcquisitionService(DownloadClient downloadClient, CatalogStore catalog, EngineSettings settings, String category) {
        this.downloadClient = downloadClient;
        this.catalog = catalog;
        this.settings = settings;
        this.category = category;
    }

    /**
     * Fails the whole pass up front when grabs would go nowhere.
     */
    public void requireReady() {
        if (!settings.dryRun() && !downloadClient.isConfigured()) {
            throw IntegrationException.notConfigured("qBittorrent");
        }
    }

    public boolean isDryRun() {
        return settings.dryRun();
    }

    public Outcome grab(MatchResult match) {
        ReleaseCandidate release = match.release();
        long entryId = match.entry().id();
        if (release.downloadUrl() == null || release.downloadUrl().isBlank()) {
            throw new IllegalArgumentException("Release has no download locator: " + release.title());
        }

        if (settings.dryRun()) {
            log.info("[DRY-RUN] Would grab release for '{}': {} (indexer={}, quality={}, size={} GB, seeders={}, score={}, confidence={}, url={})",
                    match.entry().title(), release.title(), release.indexer(),
                    match.quality() == null ? "unknown" : match.quality(),
                    String.format(Locale.ROOT, "%.2f", release.sizeInGb()),
                    release.seeders() == null ? "n/a" : release.seeders(),
                    match.score(), match.confidence().label(), release.downloadUrl());
            return Outcome.DRY_RUN;
        }

        if (!downloadClient.isConfigured()) {
            throw IntegrationException.notConfigured("qBittorrent");
        }
        AcquisitionRequest request = new AcquisitionRequest(release.downloadUrl(), category,
                List.of(APP_TAG, "game-" + entryId), false);
        String ack = downloadClient.submit(request);
        catalog.markAcquiring(entryId, ReleaseInfo.from(match));
        log.info("Grabbed '{}' for '{}' from {} ({})", release.title(), match.entry().title(), release.indexer(), ack);
        return Outcome.SUBMITTED;
    }
}
