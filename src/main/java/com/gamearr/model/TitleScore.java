package com.gamearr.model;

public record TitleScore(int score, double wordMatchRatio) {

    public MatchConfidence confidence() {
        return MatchConfidence.classify(score, wordMatchRatio);
    }
}
