package com.draftlens.models;

import java.util.List;

/**
 * Timeline of what a character believes, why, and what pushes against it.
 */
public record BeliefShiftMatrix(String characterName, List<BeliefEntry> entries) {

    public BeliefShiftMatrix {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public record BeliefEntry(
            int chapter,
            int chapterPage,
            String coreBelief,
            String evidence,
            String counterpressure) {
    }
}
