package com.draftlens.analysis;

import com.draftlens.models.DetectorResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexicon and regex scans over prose. Each detector counts every match and keeps
 * at most {@link #MAX_EXAMPLES} distinct lowercase examples.
 */
public final class PatternDetectors {

    public static final int MAX_EXAMPLES = 10;

    private static final String TO_BE = "\\b(?:am|is|are|was|were|be|been|being)\\b";

    private static final List<Pattern> PASSIVE_VOICE = List.of(
            Pattern.compile(TO_BE + "\\s+\\w+ed\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile(TO_BE + "\\s+being\\s+\\w+ed\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile(TO_BE + "\\s+(?:" + String.join("|", ProseLexicon.PASSIVE_IRREGULAR_PARTICIPLES) + ")\\b",
                    Pattern.CASE_INSENSITIVE));

    private static final Pattern SENSORY = Pattern.compile(
            "\\b(" + String.join("|", ProseLexicon.SENSORY_WORDS) + ")\\w*\\b", Pattern.CASE_INSENSITIVE);

    private PatternDetectors() {
    }

    public static DetectorResult passiveVoice(String text) {
        if (text == null || text.isEmpty()) {
            return DetectorResult.EMPTY;
        }
        int count = 0;
        List<String> examples = new ArrayList<>();
        for (Pattern pattern : PASSIVE_VOICE) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                count++;
                addExample(examples, m.group().toLowerCase(Locale.ROOT));
            }
        }
        return new DetectorResult(count, examples);
    }

    public static DetectorResult adverbs(List<String> words) {
        int count = 0;
        List<String> examples = new ArrayList<>();
        for (String word : words) {
            String clean = clean(word);
            if (clean.length() > 2 && clean.endsWith("ly") && !ProseLexicon.ADVERB_EXCEPTIONS.contains(clean)) {
                count++;
                addExample(examples, clean);
            }
        }
        return new DetectorResult(count, examples);
    }

    public static DetectorResult weakVerbs(List<String> words) {
        return membership(words, ProseLexicon.WEAK_VERBS);
    }

    public static DetectorResult filterWords(List<String> words) {
        return membership(words, ProseLexicon.FILTER_WORDS);
    }

    /**
     * Counts distinct cliché phrases present anywhere in the text.
     */
    public static DetectorResult cliches(String text) {
        if (text == null || text.isEmpty()) {
            return DetectorResult.EMPTY;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int count = 0;
        List<String> examples = new ArrayList<>();
        for (String cliche : ProseLexicon.CLICHES) {
            if (lower.contains(cliche)) {
                count++;
                addExample(examples, cliche);
            }
        }
        return new DetectorResult(count, examples);
    }

    public static int sensoryWordCount(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Matcher m = SENSORY.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    /**
     * Fewer than one sensory word per fifty words, with a floor of one.
     */
    public static boolean missingSensoryDetail(int wordCount, int sensoryCount) {
        int minimum = Math.max(1, wordCount / 50);
        return wordCount > 0 && sensoryCount < minimum;
    }

    private static DetectorResult membership(List<String> words, Set<String> lexicon) {
        int count = 0;
        List<String> examples = new ArrayList<>();
        for (String word : words) {
            String clean = clean(word);
            if (lexicon.contains(clean)) {
                count++;
                addExample(examples, clean);
            }
        }
        return new DetectorResult(count, examples);
    }

    private static String clean(String word) {
        return TextSegmenter.stripPunctuation(word).toLowerCase(Locale.ROOT);
    }

    private static void addExample(List<String> examples, String example) {
        if (examples.size() >= MAX_EXAMPLES) {
            return;
        }
        for (String existing : examples) {
            if (existing.equalsIgnoreCase(example)) {
                return;
            }
        }
        examples.add(example);
    }
}
