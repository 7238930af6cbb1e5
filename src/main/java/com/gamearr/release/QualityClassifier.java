package com.gamearr.release;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Classifies a release title into a coarse provenance tier.
 */
public final class QualityClassifier {

    public static final String GOG = "GOG";
    public static final String DRM_FREE = "DRM-Free";
    public static final String REPACK = "Repack";
    public static final String SCENE = "Scene";

    /** Ascending preference; a higher index beats a lower one. */
    public static final List<String> RANKING = List.of(SCENE, REPACK, DRM_FREE, GOG);

    private QualityClassifier() {}

    public static Optional<String> classify(String title) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String lower = title.toLowerCase(Locale.ROOT);
        if (lower.contains("gog")) return Optional.of(GOG);
        if (lower.contains("drm free") || lower.contains("drm-free")) return Optional.of(DRM_FREE);
        if (lower.contains("repack")) return Optional.of(REPACK);
        if (lower.contains("scene")) return Optional.of(SCENE);
        return Optional.empty();
    }

    /**
     * Unknown tiers rank below every known tier, so they only win over an absent current value.
     */
    public static boolean isBetterQuality(String newQuality, String currentQuality) {
        if (newQuality == null) return false;
        if (currentQuality == null) return true;
        return rank(newQuality) > rank(currentQuality);
    }

    public static int rank(String quality) {
        return quality == null ? -1 : RANKING.indexOf(quality);
    }

    public static int scoreBonus(String quality) {
        if (quality == null) return 0;
        return switch (quality) {
            case GOG -> 50;
            case DRM_FREE -> 40;
            case REPACK -> 20;
            case SCENE -> 10;
            default -> 0;
        };
    }
}
