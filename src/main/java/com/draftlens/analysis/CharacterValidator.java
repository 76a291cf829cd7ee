package com.draftlens.analysis;

import com.draftlens.context.CharacterRegistry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides which character names analysis may report on. A non-empty registry is authoritative.
 */
public final class CharacterValidator {

    private CharacterValidator() {
    }

    /**
     * With a registry, candidates are matched case-insensitively to canonical keys and unknown names are
     * dropped; no candidates means every registry key. Null or blank registry keys are ignored. Without a
     * registry, trimmed candidates are kept as given.
     */
    public static List<String> validate(CharacterRegistry registry, List<String> candidates) {
        List<String> requested = candidates == null ? List.of() : candidates;
        if (registry != null && !registry.isEmpty()) {
            List<String> keys = new ArrayList<>();
            List<String> canonicalKeys = registry.canonicalKeys();
            for (String key : canonicalKeys == null ? List.<String>of() : canonicalKeys) {
                if (key != null && !key.isBlank() && !keys.contains(key)) {
                    keys.add(key);
                }
            }
            if (requested.isEmpty()) {
                return keys;
            }
            Map<String, String> canonicalByNormalized = new HashMap<>();
            for (String key : keys) {
                canonicalByNormalized.putIfAbsent(normalize(key), key);
            }
            Set<String> out = new LinkedHashSet<>();
            for (String name : requested) {
                if (name == null) {
                    continue;
                }
                String canonical = canonicalByNormalized.get(normalize(name));
                if (canonical != null) {
                    out.add(canonical);
                }
            }
            return new ArrayList<>(out);
        }
        Set<String> out = new LinkedHashSet<>();
        for (String name : requested) {
            if (name != null && !name.isBlank()) {
                out.add(name.trim());
            }
        }
        return new ArrayList<>(out);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
