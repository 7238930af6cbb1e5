package com.gamearr.release;

import com.gamearr.model.CatalogEntry;
import com.gamearr.model.MatchResult;
import com.gamearr.model.ReleaseCandidate;
import com.gamearr.model.TitleScore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Full evaluation of a release against one catalog entry: title score plus
 * year, quality, availability, age and size adjustments.
 */
public class ReleaseMatcher {

    private static final Duration STALE_AGE = Duration.ofDays(365 * 2);
    private static final double MIN_SIZE_GB = 0.1;
    private static final double MAX_SIZE_GB = 200;

    private final Clock clock;

    public ReleaseMatcher() {
        this(Clock.systemUTC());
    }

    public ReleaseMatcher(Clock clock) {
        this.clock = clock;
    }

    public MatchResult match(ReleaseCandidate release, CatalogEntry entry) {
        String rawTitle = release.title() == null ? "" : release.title();
        String normRelease = TitleNormalizer.normalize(rawTitle);
        String normCatalog = TitleNormalizer.normalize(entry.title());

        TitleScore titleScore = MatchScorer.score(normRelease, normCatalog);
        int score = titleScore.score();

        if (entry.year() != null && rawTitle.contains(String.valueOf(entry.year()))) {
            score += 20;
        }

        String quality = QualityClassifier.classify(rawTitle).orElse(null);
        score += QualityClassifier.scoreBonus(quality);

        // Protocols without swarm data get no availability adjustment.
        if (release.seeders() != null) {
            if (release.seeders() < 5) {
                score -= 30;
            } else if (release.seeders() >= 20) {
                score += 10;
            }
        }

        Instant published = release.publishedAt();
        if (published != null && published.isBefore(clock.instant().minus(STALE_AGE))) {
            score -= 20;
        }

        if (release.size() > 0) {
            double gb = release.sizeInGb();
            if (gb < MIN_SIZE_GB || gb > MAX_SIZE_GB) {
                score -= 50;
            }
        }

        String version = VersionParser.parse(rawTitle).orElse(null);
        boolean dlc = DlcHeuristic.isAdditionalContent(rawTitle, entry.title());

        return new MatchResult(release, entry, normRelease, normCatalog, score,
                titleScore.wordMatchRatio(), version, quality, dlc);
    }
}
