package com.draftlens.analysis;

import com.draftlens.context.CharacterRegistry;
import com.draftlens.context.InMemoryCharacterRegistry;
import com.draftlens.models.CharacterInteraction;
import com.draftlens.models.CharacterPresence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CharacterPresenceAnalyzerTest {

    private final CharacterRegistry registry = InMemoryCharacterRegistry.builder()
            .character("Mara", "Mar")
            .character("Jonah")
            .character("Pell")
            .build();

    @Test
    void countsMentionsPerChapterIncludingAliases() {
        String text = "Chapter 1\nMara met Jonah. Mar laughed.\nChapter 2\nJonah was alone.";
        List<Chapter> chapters = ChapterSplitter.split(text, List.of());
        List<CharacterPresence> presence = CharacterPresenceAnalyzer.presence(chapters,
                CharacterAliases.forAll(List.of("Mara", "Jonah", "Pell"), registry));

        assertEquals(3, presence.size());
        assertEquals(Map.of(1, 2), presence.get(0).chapterPresence());
        assertEquals(Map.of(1, 1, 2, 1), presence.get(1).chapterPresence());
        assertTrue(presence.get(2).chapterPresence().isEmpty());
        assertEquals(0, presence.get(2).totalMentions());
    }

    @Test
    void interactionsAreCountedPerSection() {
        StringBuilder text = new StringBuilder("Mara and Jonah ");
        text.append("filler ".repeat(CharacterPresenceAnalyzer.WORDS_PER_SECTION));
        text.append("filler ".repeat(CharacterPresenceAnalyzer.WORDS_PER_SECTION));
        text.append("Jonah saw Mara and Pell");

        List<CharacterInteraction> interactions = CharacterPresenceAnalyzer.interactions(text.toString(),
                CharacterAliases.forAll(List.of("Mara", "Jonah", "Pell"), registry));

        assertEquals(3, interactions.size());
        CharacterInteraction strongest = interactions.get(0);
        assertEquals("Mara", strongest.character1());
        assertEquals("Jonah", strongest.character2());
        assertEquals(2, strongest.coAppearances());
        assertEquals(List.of(0, 2), strongest.sections());
        assertEquals(2.0 / 3.0, strongest.relationshipStrength(), 1e-9);
        assertEquals(1, interactions.get(1).coAppearances());
    }

    @Test
    void pairsThatNeverMeetAreOmitted() {
        List<CharacterInteraction> interactions = CharacterPresenceAnalyzer.interactions("Mara walked alone.",
                CharacterAliases.forAll(List.of("Mara", "Jonah"), registry));
        assertTrue(interactions.isEmpty());
    }

    @Test
    void sectionsHoldFixedWordCounts() {
        List<String> sections = CharacterPresenceAnalyzer.sections("a b c d e", 2);
        assertEquals(List.of("a b", "c d", "e"), sections);
        assertTrue(CharacterPresenceAnalyzer.sections("", 2).isEmpty());
    }
}
