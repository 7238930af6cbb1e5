package com.gamearr.model;

/**
 * The release an entry was (or is being) acquired from.
 */
public record ReleaseInfo(
        String title,
        String version,
        String quality,
        String indexer,
        String downloadUrl
) {

    public static ReleaseInfo from(MatchResult match) {
        ReleaseCandidate r = match.release();
        return new ReleaseInfo(r.title(), match.version(), match.quality(), r.indexer(), r.downloadUrl());
    }
}
