package com.gamearr.model;

/**
 * Scored pairing of a release with a catalog entry. Confidence is fixed at
 * construction from the final score and the word match ratio.
 */
public record MatchResult(
        ReleaseCandidate release,
        CatalogEntry entry,
        String normalizedReleaseTitle,
        String normalizedCatalogTitle,
        int score,
        double wordMatchRatio,
        MatchConfidence confidence,
        String version,
        String quality,
        boolean additionalContent
) {

    public MatchResult(ReleaseCandidate release,
                       CatalogEntry entry,
                       String normalizedReleaseTitle,
                       String normalizedCatalogTitle,
                       int score,
                       double wordMatchRatio,
                       String version,
                       String quality,
                       boolean additionalContent) {
        this(release, entry, normalizedReleaseTitle, normalizedCatalogTitle, score, wordMatchRatio,
                MatchConfidence.classify(score, wordMatchRatio), version, quality, additionalContent);
    }

    public int seeders() {
        return release == null ? 0 : release.seedersOrZero();
    }
}
