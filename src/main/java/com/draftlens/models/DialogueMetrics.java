package com.draftlens.models;

import java.util.List;

public record DialogueMetrics(
        int qualityScore,
        int segmentCount,
        int fillerCount,
        int repetitionScore,
        int tagVariety,
        List<String> monotonyIssues,
        List<String> predictablePhrases,
        int expositionCount,
        int pacingScore,
        boolean hasConflict) {

    public static final DialogueMetrics EMPTY =
            new DialogueMetrics(0, 0, 0, 0, 0, List.of(), List.of(), 0, 0, false);

    public DialogueMetrics {
        monotonyIssues = monotonyIssues == null ? List.of() : List.copyOf(monotonyIssues);
        predictablePhrases = predictablePhrases == null ? List.of() : List.copyOf(predictablePhrases);
    }
}
