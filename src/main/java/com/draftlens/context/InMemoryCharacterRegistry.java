package com.draftlens.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry snapshot built from caller data, e.g. the characters block of an analysis request.
 */
public final class InMemoryCharacterRegistry implements CharacterRegistry {

    private final Map<String, List<String>> aliasesByKey;

    private InMemoryCharacterRegistry(Map<String, List<String>> aliasesByKey) {
        this.aliasesByKey = aliasesByKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<String> canonicalKeys() {
        return List.copyOf(aliasesByKey.keySet());
    }

    @Override
    public List<String> aliasesFor(String key) {
        if (key == null) {
            return List.of();
        }
        List<String> aliases = aliasesByKey.get(key);
        return aliases != null ? aliases : List.of();
    }

    public static final class Builder {
        private final Map<String, Set<String>> entries = new LinkedHashMap<>();

        public Builder character(String key, String... aliases) {
            return character(key, aliases == null ? List.of() : List.of(aliases));
        }

        public Builder character(String key, List<String> aliases) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Character key must not be blank");
            }
            String canonical = key.trim();
            Set<String> values = entries.computeIfAbsent(canonical, k -> new LinkedHashSet<>());
            if (aliases != null) {
                for (String alias : aliases) {
                    if (alias == null) {
                        continue;
                    }
                    String trimmed = alias.trim();
                    if (!trimmed.isEmpty() && !trimmed.equalsIgnoreCase(canonical)) {
                        values.add(trimmed);
                    }
                }
            }
            return this;
        }

        public InMemoryCharacterRegistry build() {
            Map<String, List<String>> frozen = new LinkedHashMap<>();
            for (Map.Entry<String, Set<String>> entry : entries.entrySet()) {
                frozen.put(entry.getKey(), List.copyOf(new ArrayList<>(entry.getValue())));
            }
            return new InMemoryCharacterRegistry(Collections.unmodifiableMap(frozen));
        }
    }
}
