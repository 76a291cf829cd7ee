package com.draftlens.models;

import java.util.List;

/**
 * Co-appearance of two characters across fixed-size text sections.
 * {@code relationshipStrength} is the share of sections where both appear.
 */
public record CharacterInteraction(
        String character1,
        String character2,
        int coAppearances,
        List<Integer> sections,
        double relationshipStrength) {

    public CharacterInteraction {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}
