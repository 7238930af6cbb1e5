package com.gamearr.model;

import java.time.Instant;

/**
 * One release observed in a feed or search result. Seeder and peer counts are
 * null for protocols that do not report them.
 */
public record ReleaseCandidate(
        String guid,
        String title,
        long size,
        Integer seeders,
        Integer peers,
        String indexer,
        Instant publishedAt,
        String downloadUrl
) {

    public int seedersOrZero() {
        return seeders == null ? 0 : seeders;
    }

    public double sizeInGb() {
        return size / (1024.0 * 1024.0 * 1024.0);
    }
}
