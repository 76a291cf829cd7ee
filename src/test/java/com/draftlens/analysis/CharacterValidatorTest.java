package com.draftlens.analysis;

import com.draftlens.context.CharacterRegistry;
import com.draftlens.context.InMemoryCharacterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CharacterValidatorTest {

    private final CharacterRegistry registry = InMemoryCharacterRegistry.builder()
            .character("Mara")
            .character("Jonah", "Jo")
            .build();

    @Test
    void registryWithoutCandidatesReturnsAllKeys() {
        assertEquals(List.of("Mara", "Jonah"), CharacterValidator.validate(registry, List.of()));
    }

    @Test
    void candidatesAreMappedToCanonicalKeysAndUnknownsDropped() {
        List<String> validated = CharacterValidator.validate(registry,
                Arrays.asList(" jonah ", "Stranger", null, "MARA", "Jonah"));
        assertEquals(List.of("Jonah", "Mara"), validated);
    }

    @Test
    void withoutRegistryCandidatesAreTrimmedAndDeduplicated() {
        List<String> validated = CharacterValidator.validate(CharacterRegistry.empty(),
                Arrays.asList(" Ada ", "Ada", "", null, "Bo"));
        assertEquals(List.of("Ada", "Bo"), validated);
    }

    @Test
    void nothingSuppliedMeansNoNames() {
        assertTrue(CharacterValidator.validate(null, null).isEmpty());
    }
    @Test
    void nullAndBlankRegistryKeysAreIgnored() {
        CharacterRegistry sloppy = new CharacterRegistry() {
            @Override
            public List<String> canonicalKeys() {
                return Arrays.asList("Mara", null, " ", "Jonah");
            }

            @Override
            public List<String> aliasesFor(String key) {
                return null;
            }
        };

        assertEquals(List.of("Mara", "Jonah"), CharacterValidator.validate(sloppy, List.of()));
        assertEquals(List.of("Jonah"), CharacterValidator.validate(sloppy, List.of("jonah", " ")));
    }
}
