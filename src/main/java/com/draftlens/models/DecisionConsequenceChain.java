package com.draftlens.models;

import java.util.List;

/**
 * Timeline of a character's decisions with their immediate outcome and longer-term effect.
 */
public record DecisionConsequenceChain(String characterName, List<ChainEntry> entries) {

    public DecisionConsequenceChain {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public record ChainEntry(
            int chapter,
            int chapterPage,
            String decision,
            String immediateOutcome,
            String longTermEffect) {
    }
}
