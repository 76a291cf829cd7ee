package com.draftlens.analysis;

import com.draftlens.context.CharacterRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A character's canonical key plus every registry alias, compiled into one
 * case-insensitive, word-bounded alternation with the longest alias tried first.
 */
public final class CharacterAliases {

    private static final Pattern NEVER = Pattern.compile("(?!)");

    private final String key;
    private final List<String> names;
    private final Pattern pattern;

    private CharacterAliases(String key, List<String> names) {
        this.key = key;
        this.names = List.copyOf(names);
        List<String> longestFirst = new ArrayList<>(names);
        longestFirst.sort(Comparator.comparingInt(String::length).reversed());
        StringBuilder alternation = new StringBuilder();
        for (String name : longestFirst) {
            if (alternation.length() > 0) {
                alternation.append('|');
            }
            alternation.append(Pattern.quote(name));
        }
        this.pattern = alternation.length() == 0
                ? NEVER
                : Pattern.compile("(?<![\\p{L}\\p{N}_])(?:" + alternation + ")(?![\\p{L}\\p{N}_])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * Null or blank names from the registry are skipped; a character left with no names matches nothing.
     */
    public static CharacterAliases of(String key, CharacterRegistry registry) {
        Set<String> names = new LinkedHashSet<>();
        if (key != null && !key.isBlank()) {
            names.add(key.trim());
        }
        List<String> aliases = registry == null ? null : registry.aliasesFor(key);
        if (aliases != null) {
            for (String alias : aliases) {
                if (alias != null && !alias.isBlank()) {
                    names.add(alias.trim());
                }
            }
        }
        return new CharacterAliases(key, new ArrayList<>(names));
    }

    public static List<CharacterAliases> forAll(List<String> keys, CharacterRegistry registry) {
        List<CharacterAliases> all = new ArrayList<>();
        for (String key : keys) {
            all.add(of(key, registry));
        }
        return all;
    }

    public String key() {
        return key;
    }

    public List<String> names() {
        return names;
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }

    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Matcher m = pattern.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    /**
     * Offset of the first alias match, or -1.
     */
    public int firstIndexIn(String text) {
        if (text == null) {
            return -1;
        }
        Matcher m = pattern.matcher(text);
        return m.find() ? m.start() : -1;
    }
}
