package com.draftlens.poetry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Splits a poem into body lines and stanzas, dropping a short title/author header.
 */
public final class PoemSegmenter {

    static final int MAX_HEADER_LINES = 3;
    static final int HEADER_SEARCH_LINES = 5;
    static final int MAX_HEADER_LENGTH = 80;
    static final int MAX_BARE_HEADER_LENGTH = 60;
    static final int MIN_BODY_FOR_BARE_HEADER = 8;

    private static final String HEADER_PUNCTUATION = ".,;:!?";

    private PoemSegmenter() {
    }

    /**
     * Body lines with blank lines kept, so stanza breaks survive. Line endings are normalized first.
     * A header is 1 to 3 short punctuation-free lines, either closed by a blank line within the first
     * lines or, when no blank line is near the top, sitting above a body of at least 8.
     */
    public static List<String> bodyLines(String text) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = new ArrayList<>(Arrays.asList(normalized.split("\n", -1)));

        int firstBlank = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).isBlank()) {
                firstBlank = i;
                break;
            }
        }
        boolean blankNearTop = firstBlank >= 0 && firstBlank <= HEADER_SEARCH_LINES;
        if (firstBlank > 0 && blankNearTop) {
            int headerCount = 0;
            boolean shortLines = true;
            for (int i = 0; i < firstBlank; i++) {
                String trimmed = lines.get(i).trim();
                if (!trimmed.isEmpty()) {
                    headerCount++;
                    shortLines &= trimmed.length() <= MAX_HEADER_LENGTH && !hasHeaderPunctuation(trimmed);
                }
            }
            if (headerCount >= 1 && headerCount <= MAX_HEADER_LINES && shortLines) {
                lines.subList(0, firstBlank + 1).clear();
            }
        }
        if (blankNearTop) {
            return lines;
        }

        int nonEmpty = 0;
        for (String line : lines) {
            if (!line.isBlank()) {
                nonEmpty++;
            }
        }
        if (nonEmpty >= MIN_BODY_FOR_BARE_HEADER) {
            int lastHeader = -1;
            int headerCount = 0;
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.isBlank()) {
                    continue;
                }
                if (headerCount < MAX_HEADER_LINES && isBareHeader(line)) {
                    lastHeader = i;
                    headerCount++;
                    continue;
                }
                break;
            }
            if (lastHeader >= 0) {
                lines.subList(0, lastHeader + 1).clear();
            }
        }
        return lines;
    }

    /**
     * Groups contiguous non-blank lines. A blank line always closes the current stanza.
     */
    public static List<List<String>> stanzas(List<String> bodyLines) {
        List<List<String>> stanzas = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String line : bodyLines) {
            if (line.isBlank()) {
                if (!current.isEmpty()) {
                    stanzas.add(current);
                    current = new ArrayList<>();
                }
                continue;
            }
            current.add(line);
        }
        if (!current.isEmpty()) {
            stanzas.add(current);
        }
        return stanzas;
    }

    /**
     * Lower-cased runs of letters and apostrophes.
     */
    public static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        String lower = line.toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetter(c) || c == '\'') {
                current.append(c);
            } else if (current.length() > 0) {
                tokens.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static boolean isBareHeader(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_BARE_HEADER_LENGTH) {
            return false;
        }
        return !hasHeaderPunctuation(trimmed);
    }

    private static boolean hasHeaderPunctuation(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (HEADER_PUNCTUATION.indexOf(line.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
