package com.gamearr.integration;

import com.gamearr.model.ReleaseCandidate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Source of release candidates, returned in feed order.
 */
public interface ReleaseFeedClient {

    boolean isConfigured();

    /**
     * Lightweight reachability probe for health reporting. Never throws.
     */
    default boolean testConnection() {
        return isConfigured();
    }

    List<ReleaseCandidate> fetchRecentReleases(Optional<Instant> since);

    List<ReleaseCandidate> fetchConfiguredQueryReleases(String query);
}
