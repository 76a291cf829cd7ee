package com.draftlens.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Guesses character names from recurring capitalized words. Only used when the caller opts in and
 * supplies neither a registry nor names.
 */
public final class CharacterNameExtractor {

    static final int MIN_OCCURRENCES = 3;
    static final int MAX_NAMES = 10;

    private static final Set<String> EXCLUDED = Set.of(
            "The", "A", "An", "He", "She", "They", "I", "We", "You",
            "But", "And", "Or", "If", "When", "Where", "Why", "How",
            "Chapter", "Part", "Section", "Act",
            "Pressure", "Belief", "Beliefs", "Decision", "Decisions", "Outcome", "Outcomes",
            "Consequence", "Consequences", "Shift", "Shifts", "Evidence", "Counterpressure",
            "Framework", "Loop", "Loops", "Matrix", "Matrices", "Arc", "Arcs",
            "His", "Her", "Their", "Its", "My", "Our", "Your",
            "It", "As", "At", "In", "On", "To", "From", "With",
            "This", "That", "These", "Those", "What", "Which", "Who",
            "All", "Some", "Any", "No", "Not", "Yes");

    private CharacterNameExtractor() {
    }

    public static List<String> extract(String text) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String word : TextSegmenter.tokenizeWords(text)) {
            String cleaned = TextSegmenter.stripPunctuation(word);
            if (cleaned.length() >= 2 && Character.isUpperCase(cleaned.charAt(0)) && !EXCLUDED.contains(cleaned)) {
                counts.merge(cleaned, 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> frequent = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() >= MIN_OCCURRENCES) {
                frequent.add(entry);
            }
        }
        frequent.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : frequent) {
            if (names.size() >= MAX_NAMES) {
                break;
            }
            names.add(entry.getKey());
        }
        return names;
    }
}
