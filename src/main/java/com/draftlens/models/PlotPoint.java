package com.draftlens.models;

/**
 * A detected or expected structural beat. {@code suggestedImprovement} is null for beats found in the text.
 */
public record PlotPoint(
        String type,
        int wordPosition,
        double percentagePosition,
        double tensionLevel,
        String description,
        String analysisQuestion,
        String suggestedImprovement,
        boolean screenplayPoint) {
}
