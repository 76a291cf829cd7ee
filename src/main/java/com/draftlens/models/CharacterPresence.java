package com.draftlens.models;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mentions per chapter for one character. Chapters without a mention are absent.
 */
public record CharacterPresence(String characterName, Map<Integer, Integer> chapterPresence) {

    public CharacterPresence {
        chapterPresence = chapterPresence == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(chapterPresence));
    }

    public int totalMentions() {
        int total = 0;
        for (int count : chapterPresence.values()) {
            total += count;
        }
        return total;
    }
}
