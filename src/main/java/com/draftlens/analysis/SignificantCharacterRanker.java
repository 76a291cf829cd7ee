package com.draftlens.analysis;

import com.draftlens.models.CharacterInteraction;
import com.draftlens.models.CharacterPresence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caps the cast shown downstream. Works from presence totals when there are any, otherwise from
 * co-appearance totals, and needs nothing beyond those two result lists.
 */
public final class SignificantCharacterRanker {

    public static final int PRESENCE_THRESHOLD = 3;
    public static final int INTERACTION_THRESHOLD = 2;
    public static final int MIN_KEPT = 5;
    public static final int MAX_KEPT = 15;

    private SignificantCharacterRanker() {
    }

    public static List<String> rank(List<CharacterPresence> presence, List<CharacterInteraction> interactions) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        int threshold;
        if (hasPresenceData(presence)) {
            threshold = PRESENCE_THRESHOLD;
            for (CharacterPresence entry : presence) {
                scores.merge(entry.characterName(), entry.totalMentions(), Integer::sum);
            }
        } else {
            threshold = INTERACTION_THRESHOLD;
            if (interactions != null) {
                for (CharacterInteraction interaction : interactions) {
                    scores.merge(interaction.character1(), interaction.coAppearances(), Integer::sum);
                    scores.merge(interaction.character2(), interaction.coAppearances(), Integer::sum);
                }
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(scores.entrySet());
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        List<String> kept = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : ranked) {
            if (kept.size() >= MAX_KEPT) {
                break;
            }
            if (entry.getValue() >= threshold || kept.size() < MIN_KEPT) {
                kept.add(entry.getKey());
            }
        }
        return kept;
    }

    private static boolean hasPresenceData(List<CharacterPresence> presence) {
        if (presence == null) {
            return false;
        }
        for (CharacterPresence entry : presence) {
            if (entry.totalMentions() > 0) {
                return true;
            }
        }
        return false;
    }
}
