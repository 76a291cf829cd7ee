package com.draftlens.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Word, sentence and paragraph splitting shared by every analyzer.
 */
public final class TextSegmenter {

    public static final int LONG_PARAGRAPH_WORDS = 150;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private TextSegmenter() {
    }

    public static List<String> tokenizeWords(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return words;
        }
        for (String piece : WHITESPACE.split(text)) {
            if (!piece.isEmpty()) {
                words.add(piece);
            }
        }
        return words;
    }

    public static int countWords(String text) {
        return tokenizeWords(text).size();
    }

    /**
     * Raw sentence fragments between terminal punctuation, blank ones dropped. Fragments are not trimmed.
     */
    public static List<String> splitSentences(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return sentences;
        }
        for (String fragment : SENTENCE_BREAK.split(text, -1)) {
            if (!fragment.isBlank()) {
                sentences.add(fragment);
            }
        }
        return sentences;
    }

    public static int countSentences(String text) {
        return splitSentences(text).size();
    }

    public static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null) {
            return lines;
        }
        for (String line : LINE_BREAK.split(text, -1)) {
            lines.add(line);
        }
        return lines;
    }

    /**
     * Every non-blank line is a paragraph.
     */
    public static List<String> splitParagraphs(String text) {
        List<String> paragraphs = new ArrayList<>();
        for (String line : splitLines(text)) {
            if (!line.isBlank()) {
                paragraphs.add(line);
            }
        }
        return paragraphs;
    }

    public static ParagraphStats paragraphStats(String text) {
        List<String> paragraphs = splitParagraphs(text);
        List<Integer> longOnes = new ArrayList<>();
        int totalWords = 0;
        for (int i = 0; i < paragraphs.size(); i++) {
            int words = countWords(paragraphs.get(i));
            totalWords += words;
            if (words > LONG_PARAGRAPH_WORDS) {
                longOnes.add(i + 1);
            }
        }
        int average = paragraphs.isEmpty() ? 0 : totalWords / paragraphs.size();
        return new ParagraphStats(paragraphs.size(), average, longOnes);
    }

    /**
     * Strips leading and trailing punctuation and symbols, keeping inner apostrophes and hyphens.
     */
    public static String stripPunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && !Character.isLetterOrDigit(token.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    public record ParagraphStats(int count, int averageLength, List<Integer> longParagraphs) {

        public ParagraphStats {
            longParagraphs = List.copyOf(longParagraphs);
        }
    }
}
