package com.draftlens.analysis;

import com.draftlens.models.CharacterInteraction;
import com.draftlens.models.CharacterPresence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mentions per chapter and pairwise co-appearance per fixed-size word section.
 */
public final class CharacterPresenceAnalyzer {

    public static final int WORDS_PER_SECTION = 1000;

    private CharacterPresenceAnalyzer() {
    }

    public static List<CharacterPresence> presence(List<Chapter> chapters, List<CharacterAliases> characters) {
        List<CharacterPresence> presence = new ArrayList<>();
        for (CharacterAliases character : characters) {
            Map<Integer, Integer> byChapter = new LinkedHashMap<>();
            for (Chapter chapter : chapters) {
                int mentions = character.count(chapter.text());
                if (mentions > 0) {
                    byChapter.put(chapter.number(), mentions);
                }
            }
            presence.add(new CharacterPresence(character.key(), byChapter));
        }
        return presence;
    }

    /**
     * Pairs that share at least one section, most co-appearances first. Section indexes are 0-based.
     */
    public static List<CharacterInteraction> interactions(String text, List<CharacterAliases> characters) {
        List<String> sections = sections(text, WORDS_PER_SECTION);
        List<CharacterInteraction> interactions = new ArrayList<>();
        for (int i = 0; i < characters.size(); i++) {
            for (int j = i + 1; j < characters.size(); j++) {
                CharacterAliases first = characters.get(i);
                CharacterAliases second = characters.get(j);
                List<Integer> shared = new ArrayList<>();
                for (int s = 0; s < sections.size(); s++) {
                    String section = sections.get(s);
                    if (first.matches(section) && second.matches(section)) {
                        shared.add(s);
                    }
                }
                if (!shared.isEmpty()) {
                    interactions.add(new CharacterInteraction(first.key(), second.key(), shared.size(), shared,
                            (double) shared.size() / sections.size()));
                }
            }
        }
        interactions.sort(Comparator.comparingInt(CharacterInteraction::coAppearances).reversed());
        return interactions;
    }

    static List<String> sections(String text, int wordsPerSection) {
        List<String> sections = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String word : TextSegmenter.tokenizeWords(text)) {
            current.add(word);
            if (current.size() >= wordsPerSection) {
                sections.add(String.join(" ", current));
                current.clear();
            }
        }
        if (!current.isEmpty()) {
            sections.add(String.join(" ", current));
        }
        return sections;
    }
}
