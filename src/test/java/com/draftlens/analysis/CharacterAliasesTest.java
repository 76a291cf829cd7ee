package com.draftlens.analysis;

import com.draftlens.context.CharacterRegistry;
import com.draftlens.context.InMemoryCharacterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CharacterAliasesTest {

    private final CharacterRegistry registry = InMemoryCharacterRegistry.builder()
            .character("Elizabeth", "Liz", "Lizzie Bennet")
            .character("Ann")
            .build();

    @Test
    void keyComesFirstThenAliases() {
        CharacterAliases liz = CharacterAliases.of("Elizabeth", registry);
        assertEquals("Elizabeth", liz.key());
        assertEquals(List.of("Elizabeth", "Liz", "Lizzie Bennet"), liz.names());
    }

    @Test
    void matchesAreWordBoundedAndCaseInsensitive() {
        CharacterAliases ann = CharacterAliases.of("Ann", registry);
        assertTrue(ann.matches("Then ANN left."));
        assertFalse(ann.matches("Annabel and Joanne waited."));
        assertFalse(ann.matches(null));
    }

    @Test
    void longerAliasCountsOnce() {
        CharacterAliases liz = CharacterAliases.of("Elizabeth", registry);
        assertEquals(1, liz.count("Lizzie Bennet smiled."));
        assertEquals(3, liz.count("Liz, Elizabeth, and liz again."));
        assertEquals(0, liz.count(""));
    }

    @Test
    void firstIndexFindsEarliestAlias() {
        CharacterAliases liz = CharacterAliases.of("Elizabeth", registry);
        assertEquals(4, liz.firstIndexIn("Dad Liz Elizabeth"));
        assertEquals(-1, liz.firstIndexIn("nobody here"));
    }

    @Test
    void regexCharactersInNamesAreQuoted() {
        CharacterAliases odd = CharacterAliases.of("Mr. T", CharacterRegistry.empty());
        assertTrue(odd.matches("Then Mr. T arrived."));
        assertFalse(odd.matches("Then Mrx T arrived."));
    }

    @Test
    void forAllKeepsOrder() {
        List<CharacterAliases> all = CharacterAliases.forAll(List.of("Ann", "Elizabeth"), registry);
        assertEquals("Ann", all.get(0).key());
        assertEquals("Elizabeth", all.get(1).key());
    }
    @Test
    void registryReturningNullAliasesIsTolerated() {
        CharacterRegistry sloppy = new CharacterRegistry() {
            @Override
            public List<String> canonicalKeys() {
                return List.of("Mara");
            }

            @Override
            public List<String> aliasesFor(String key) {
                return null;
            }
        };
        CharacterAliases mara = CharacterAliases.of("Mara", sloppy);

        assertEquals(List.of("Mara"), mara.names());
        assertTrue(mara.matches("Mara waited."));
    }

    @Test
    void blankKeyMatchesNothing() {
        CharacterAliases blank = CharacterAliases.of("  ", CharacterRegistry.empty());

        assertTrue(blank.names().isEmpty());
        assertFalse(blank.matches("Anything at all."));
        assertEquals(0, blank.count("Anything at all."));
        assertEquals(-1, blank.firstIndexIn("Anything at all."));
    }
}
