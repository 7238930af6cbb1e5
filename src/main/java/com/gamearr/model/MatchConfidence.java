package com.gamearr.model;

import java.util.Locale;

public enum MatchConfidence {
    HIGH,
    MEDIUM,
    LOW;

    public static MatchConfidence classify(int score, double wordMatchRatio) {
        if (score >= 150) {
            return HIGH;
        }
        if (wordMatchRatio >= 0.8 && score > 100) {
            return HIGH;
        }
        if (score < 80) {
            return LOW;
        }
        return MEDIUM;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
