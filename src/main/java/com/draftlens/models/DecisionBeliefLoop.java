package com.draftlens.models;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Per-character cycle of pressure, belief, decision, outcome and belief shift, one entry per chapter.
 */
public record DecisionBeliefLoop(String characterName, List<LoopEntry> entries, ArcQuality arcQuality) {

    public DecisionBeliefLoop {
        entries = entries == null ? List.of() : List.copyOf(entries);
        if (arcQuality == null) {
            arcQuality = assess(entries);
        }
    }

    public static DecisionBeliefLoop of(String characterName, List<LoopEntry> entries) {
        return new DecisionBeliefLoop(characterName, entries, null);
    }

    public record LoopEntry(
            int chapter,
            int chapterPage,
            String pressure,
            String beliefInPlay,
            String decision,
            String outcome,
            String beliefShift) {
    }

    public enum ArcQuality {
        INSUFFICIENT("Insufficient Data"),
        FLAT("Flat Arc - Beliefs unchanging"),
        DEVELOPING("Developing Arc - Some changes"),
        EVOLVING("Evolving Arc - Clear pattern change");

        private final String label;

        ArcQuality(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    static ArcQuality assess(List<LoopEntry> entries) {
        if (entries.size() < 2) {
            return ArcQuality.INSUFFICIENT;
        }
        Set<String> beliefs = new HashSet<>();
        Set<String> shifts = new HashSet<>();
        for (LoopEntry entry : entries) {
            beliefs.add(normalize(entry.beliefInPlay()));
            shifts.add(normalize(entry.beliefShift()));
        }
        if (beliefs.size() == 1 && shifts.size() <= 1) {
            return ArcQuality.FLAT;
        }
        if (beliefs.size() >= 2 && shifts.size() >= 2) {
            return ArcQuality.EVOLVING;
        }
        return ArcQuality.DEVELOPING;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
