package com.gamearr.release;

import com.gamearr.model.MatchResult;

import java.util.List;
import java.util.Optional;

/**
 * Threshold gate for grabbing without confirmation. Selection is first-fit in feed
 * order: the first release clearing both thresholds is taken even if a later one scores higher.
 */
public final class AutoGrabPolicy {

    private AutoGrabPolicy() {}

    public static boolean shouldAutoGrab(int score, int seeders, int minScore, int minSeeders) {
        return score >= minScore && seeders >= minSeeders;
    }

    public static boolean qualifies(MatchResult match, int minScore, int minSeeders) {
        return !match.additionalContent()
                && shouldAutoGrab(match.score(), match.seeders(), minScore, minSeeders);
    }

    public static Optional<MatchResult> selectFirstQualifying(List<MatchResult> inFeedOrder, int minScore, int minSeeders) {
        if (inFeedOrder == null) {
            return Optional.empty();
        }
        for (MatchResult match : inFeedOrder) {
            if (qualifies(match, minScore, minSeeders)) {
                return Optional.of(match);
            }
        }
        return Optional.empty();
    }
}
