package com.draftlens.models;

import java.util.List;

/**
 * How one character's surrounding language changes across chapters.
 */
public record LanguageDrift(String characterName, List<Metrics> metrics, Summary summary) {

    public LanguageDrift {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    /**
     * All values are normalized to [0, 1].
     */
    public record Metrics(
            int chapter,
            double pronounI,
            double pronounWe,
            double modalMust,
            double modalChoice,
            double emotionalDensity,
            double avgSentenceLength,
            double certaintyScore) {
    }

    public record Summary(
            String pronounShift,
            String modalShift,
            String emotionalTrend,
            String sentenceTrend,
            String certaintyTrend) {
    }
}
