package com.draftlens.context;

import com.draftlens.models.OutlineEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCharacterRegistryTest {

    @Test
    void keysKeepInsertionOrder() {
        CharacterRegistry registry = InMemoryCharacterRegistry.builder()
                .character("Mara", "Mar")
                .character("Jonah")
                .character("Pell")
                .build();

        assertEquals(List.of("Mara", "Jonah", "Pell"), registry.canonicalKeys());
        assertFalse(registry.isEmpty());
    }

    @Test
    void aliasesAreTrimmedDedupedAndExcludeTheKey() {
        CharacterRegistry registry = InMemoryCharacterRegistry.builder()
                .character(" Mara ", Arrays.asList(" Mar ", "Mar", "mara", "", null, "Captain Voss"))
                .build();

        assertEquals(List.of("Mara"), registry.canonicalKeys());
        assertEquals(List.of("Mar", "Captain Voss"), registry.aliasesFor("Mara"));
    }

    @Test
    void repeatedKeyMergesAliases() {
        CharacterRegistry registry = InMemoryCharacterRegistry.builder()
                .character("Jonah", "Jo")
                .character("Jonah", "Jonny", "Jo")
                .build();

        assertEquals(List.of("Jonah"), registry.canonicalKeys());
        assertEquals(List.of("Jo", "Jonny"), registry.aliasesFor("Jonah"));
    }

    @Test
    void unknownOrNullKeyHasNoAliases() {
        CharacterRegistry registry = InMemoryCharacterRegistry.builder().character("Mara").build();

        assertTrue(registry.aliasesFor("Jonah").isEmpty());
        assertTrue(registry.aliasesFor(null).isEmpty());
        assertTrue(registry.aliasesFor("Mara").isEmpty());
    }

    @Test
    void blankKeyIsRejected() {
        InMemoryCharacterRegistry.Builder builder = InMemoryCharacterRegistry.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.character("  "));
        assertThrows(IllegalArgumentException.class, () -> builder.character(null, List.of("x")));
    }

    @Test
    void builtRegistryIsASnapshot() {
        InMemoryCharacterRegistry.Builder builder = InMemoryCharacterRegistry.builder().character("Mara");
        CharacterRegistry registry = builder.build();
        builder.character("Jonah");

        assertEquals(List.of("Mara"), registry.canonicalKeys());
        assertThrows(UnsupportedOperationException.class, () -> registry.canonicalKeys().add("Pell"));
    }

    @Test
    void emptyRegistry() {
        assertTrue(CharacterRegistry.empty().isEmpty());
        assertTrue(CharacterRegistry.empty().canonicalKeys().isEmpty());
    }

    @Test
    void outlineProviderCopiesEntries() {
        List<OutlineEntry> entries = new ArrayList<>();
        entries.add(new OutlineEntry("Chapter 1", 1, 0, 100));
        OutlineProvider provider = OutlineProvider.of(entries);
        entries.add(new OutlineEntry("Chapter 2", 1, 100, 200));

        assertEquals(1, provider.outlineEntries().size());
        assertTrue(OutlineProvider.of(null).outlineEntries().isEmpty());
        assertTrue(OutlineProvider.none().outlineEntries().isEmpty());
    }
}
