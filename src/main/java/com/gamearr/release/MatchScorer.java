package com.gamearr.release;

import com.gamearr.model.TitleScore;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Title-only scoring of a normalized release title against a normalized catalog title.
 */
public final class MatchScorer {

    public static final int BASE_SCORE = 100;
    static final int CONTAINMENT_BONUS = 50;
    static final int STRONG_OVERLAP_BONUS = 30;
    static final int PARTIAL_OVERLAP_BONUS = 15;
    static final int WEAK_OVERLAP_PENALTY = 60;

    private MatchScorer() {}

    public static TitleScore score(String normalizedRelease, String normalizedCatalog) {
        if (normalizedCatalog == null || normalizedCatalog.isBlank()) {
            return new TitleScore(0, 0.0);
        }
        String release = normalizedRelease == null ? "" : normalizedRelease;
        double ratio = wordMatchRatio(release, normalizedCatalog);

        if (containsPhrase(release, normalizedCatalog)) {
            return new TitleScore(BASE_SCORE + CONTAINMENT_BONUS, ratio);
        }
        int score = BASE_SCORE;
        if (ratio >= 0.8) {
            score += STRONG_OVERLAP_BONUS;
        } else if (ratio >= 0.5) {
            score += PARTIAL_OVERLAP_BONUS;
        } else {
            score -= WEAK_OVERLAP_PENALTY;
        }
        return new TitleScore(score, ratio);
    }

    /**
     * Fraction of significant catalog words (longer than two characters) present as whole
     * words in the release. Short titles made only of short words fall back to every word.
     */
    public static double wordMatchRatio(String normalizedRelease, String normalizedCatalog) {
        List<String> catalogWords = TitleNormalizer.words(normalizedCatalog);
        List<String> significant = catalogWords.stream().filter(w -> w.length() > 2).toList();
        List<String> considered = significant.isEmpty() ? catalogWords : significant;
        if (considered.isEmpty()) {
            return 0.0;
        }
        Set<String> releaseWords = new HashSet<>(TitleNormalizer.words(normalizedRelease));
        long matched = considered.stream().filter(releaseWords::contains).count();
        return (double) matched / considered.size();
    }

    private static boolean containsPhrase(String release, String catalog) {
        return (" " + release + " ").contains(" " + catalog + " ");
    }
}
