package com.draftlens.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Syllable, grade-level, sentence-variety, page and dialogue-share metrics.
 */
public final class ReadabilityMetrics {

    public static final String NO_GRADE = "--";
    static final double MAX_GRADE = 18.0;
    static final double VARIETY_FULL_STDEV = 5.0;
    static final int SCREENPLAY_LINES_PER_PAGE = 55;
    static final int MANUSCRIPT_WORDS_PER_PAGE = 250;

    private static final String VOWELS = "aeiouy";

    private ReadabilityMetrics() {
    }

    /**
     * Vowel groups, less one for a trailing silent e, never below one.
     */
    public static int syllables(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        int count = 0;
        boolean previousVowel = false;
        for (int i = 0; i < lower.length(); i++) {
            boolean vowel = VOWELS.indexOf(lower.charAt(i)) >= 0;
            if (vowel && !previousVowel) {
                count++;
            }
            previousVowel = vowel;
        }
        if (lower.endsWith("e") && count > 1) {
            count--;
        }
        return Math.max(1, count);
    }

    public static String readingLevel(List<String> words, int sentenceCount) {
        if (words.isEmpty() || sentenceCount == 0) {
            return NO_GRADE;
        }
        int syllables = 0;
        for (String word : words) {
            syllables += syllables(word);
        }
        double grade = 0.39 * ((double) words.size() / sentenceCount)
                + 11.8 * ((double) syllables / words.size())
                - 15.59;
        grade = Math.max(0.0, Math.min(MAX_GRADE, grade));
        return "Grade " + (int) grade;
    }

    public static SentenceVariety sentenceVariety(String text) {
        List<String> sentences = TextSegmenter.splitSentences(text);
        if (sentences.size() < 2) {
            return new SentenceVariety(0, List.of());
        }
        List<Integer> lengths = new ArrayList<>();
        for (String sentence : sentences) {
            lengths.add(TextSegmenter.countWords(sentence));
        }
        double stdev = populationStdDev(lengths);
        int score = Math.min(100, (int) (stdev / VARIETY_FULL_STDEV * 100));
        return new SentenceVariety(score, lengths);
    }

    /**
     * An explicit override wins; otherwise screenplay pages from lines, manuscript pages from words.
     */
    public static int pageCount(String text, int wordCount, boolean screenplay, int override) {
        if (override > 0) {
            return override;
        }
        if (wordCount <= 0) {
            return 0;
        }
        if (screenplay) {
            int lines = Math.max(1, DialogueExtractor.trimTrailingBlankLines(TextSegmenter.splitLines(text)).size());
            return Math.max(1, (int) Math.ceil(lines / (double) SCREENPLAY_LINES_PER_PAGE));
        }
        return Math.max(1, (wordCount + MANUSCRIPT_WORDS_PER_PAGE - 1) / MANUSCRIPT_WORDS_PER_PAGE);
    }

    public static int dialoguePercentage(List<String> segments, int totalWords) {
        if (totalWords <= 0 || segments.isEmpty()) {
            return 0;
        }
        int dialogueWords = 0;
        for (String segment : segments) {
            dialogueWords += TextSegmenter.countWords(segment);
        }
        return Math.min(100, (int) ((double) dialogueWords / totalWords * 100));
    }

    static double populationStdDev(List<Integer> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (int value : values) {
            sum += value;
        }
        double mean = sum / values.size();
        double variance = 0;
        for (int value : values) {
            variance += (value - mean) * (value - mean);
        }
        return Math.sqrt(variance / values.size());
    }

    public record SentenceVariety(int score, List<Integer> sentenceLengths) {

        public SentenceVariety {
            sentenceLengths = List.copyOf(sentenceLengths);
        }
    }
}
