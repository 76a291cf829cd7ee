package com.draftlens.context;

import java.util.List;

/**
 * Read-only source of the character names analysis is allowed to report on.
 */
public interface CharacterRegistry {

    /**
     * Canonical character keys in display order.
     */
    List<String> canonicalKeys();

    /**
     * Alternate names (nicknames, surnames) for a canonical key, excluding the key itself.
     * Unknown keys yield an empty list.
     */
    List<String> aliasesFor(String key);

    default boolean isEmpty() {
        List<String> keys = canonicalKeys();
        return keys == null || keys.isEmpty();
    }

    static CharacterRegistry empty() {
        return InMemoryCharacterRegistry.builder().build();
    }
}
