package com.draftlens.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pulls spoken lines out of prose (quoted runs) or screenplay text (blocks under a character cue).
 */
public final class DialogueExtractor {

    public static final int MAX_CUE_LENGTH = 40;

    private static final Pattern SCENE_HEADING = Pattern.compile("^(INT\\.|EXT\\.|INT/EXT|EXT/INT|INT\\s|EXT\\s)");
    private static final Pattern CUE_CHARACTERS = Pattern.compile("^[A-Z0-9 .()'\"-]+$");
    private static final Pattern HAS_LETTER = Pattern.compile("[A-Z]");

    private static final List<String> TRANSITION_PREFIXES = List.of(
            "CUT TO", "FADE IN", "FADE OUT", "SMASH CUT", "DISSOLVE TO",
            "MATCH CUT", "JUMP CUT", "WIPE TO", "FADE TO", "BACK TO");

    private DialogueExtractor() {
    }

    /**
     * Screenplay blocks first when {@code screenplay} is set, falling back to quoted runs when none are found.
     */
    public static List<String> extract(String text, boolean screenplay) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        if (screenplay) {
            List<String> segments = extractScreenplay(text);
            if (!segments.isEmpty()) {
                return segments;
            }
        }
        return extractQuoted(text);
    }

    /**
     * Each straight or curly quote toggles dialogue state; a closing quote emits the trimmed run.
     * An unclosed trailing run is dropped.
     */
    public static List<String> extractQuoted(String text) {
        List<String> segments = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return segments;
        }
        StringBuilder current = new StringBuilder();
        boolean inDialogue = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isQuote(c)) {
                if (inDialogue) {
                    String trimmed = current.toString().trim();
                    if (!trimmed.isEmpty()) {
                        segments.add(trimmed);
                    }
                    current.setLength(0);
                }
                inDialogue = !inDialogue;
            } else if (inDialogue) {
                current.append(c);
            }
        }
        return segments;
    }

    public static List<String> extractScreenplay(String text) {
        List<String> segments = new ArrayList<>();
        List<String> lines = trimTrailingBlankLines(TextSegmenter.splitLines(text));
        int index = 0;
        while (index < lines.size()) {
            String line = lines.get(index).trim();
            if (!isCharacterCue(line)) {
                index++;
                continue;
            }
            index++;
            List<String> buffer = new ArrayList<>();
            while (index < lines.size()) {
                String trimmed = lines.get(index).trim();
                if (trimmed.isEmpty()) {
                    index++;
                    break;
                }
                if (isCharacterCue(trimmed) || isSceneHeading(trimmed) || isTransition(trimmed)) {
                    break;
                }
                buffer.add(trimmed);
                index++;
            }
            String combined = String.join(" ", buffer).trim();
            if (!combined.isEmpty()) {
                segments.add(combined);
            }
        }
        return segments;
    }

    public static boolean isSceneHeading(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        return SCENE_HEADING.matcher(trimmed.toUpperCase(Locale.ROOT)).find();
    }

    public static boolean isTransition(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.endsWith(":")) {
            return true;
        }
        for (String prefix : TRANSITION_PREFIXES) {
            if (upper.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isCharacterCue(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (!upper.equals(trimmed)) {
            return false;
        }
        if (isSceneHeading(upper) || isTransition(upper)) {
            return false;
        }
        if (upper.length() > MAX_CUE_LENGTH || upper.contains(":")) {
            return false;
        }
        if (!HAS_LETTER.matcher(upper).find()) {
            return false;
        }
        return CUE_CHARACTERS.matcher(upper).matches();
    }

    static List<String> trimTrailingBlankLines(List<String> lines) {
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isBlank()) {
            end--;
        }
        return new ArrayList<>(lines.subList(0, end));
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '“' || c == '”';
    }
}
