package com.draftlens.analysis;

import com.draftlens.models.DialogueMetrics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ten-point craft score for a list of dialogue segments. Each check that passes is worth 10.
 */
public final class DialogueQualityScorer {

    static final int MAX_POINTS = 10;
    static final int DEPTH_MIN_AVERAGE_LENGTH = 50;
    static final int REPETITION_MIN_SEGMENTS = 5;
    static final int REPETITION_MIN_OCCURRENCES = 3;
    static final double FILLER_MAX_RATIO = 0.2;
    static final int TAG_VARIETY_MIN = 5;
    static final int PREDICTABLE_MAX = 3;
    static final int PREDICTABLE_CAP = 5;
    static final int GROWTH_MIN_SEGMENTS = 10;
    static final int EXPOSITION_MIN_LENGTH = 100;
    static final double EXPOSITION_MAX_RATIO = 0.2;
    static final double CONFLICT_MIN_RATIO = 0.2;
    static final double PACING_FULL_STDEV = 30.0;
    static final int PACING_MIN_SCORE = 60;
    static final int MONOTONY_MIN_OCCURRENCES = 3;
    static final int MONOTONY_CAP = 3;

    private DialogueQualityScorer() {
    }

    /**
     * @param segments extracted dialogue, in document order
     * @param fullText the whole analyzed text, scanned for attribution tags
     */
    public static DialogueMetrics score(List<String> segments, String fullText) {
        if (segments == null || segments.isEmpty()) {
            return DialogueMetrics.EMPTY;
        }
        int points = 0;

        int totalLength = 0;
        for (String segment : segments) {
            totalLength += segment.length();
        }
        if (totalLength / segments.size() > DEPTH_MIN_AVERAGE_LENGTH) {
            points++;
        }

        int repetitions = repeatedPhraseCount(segments);
        int repetitionScore = Math.min(100, repetitions * 100 / segments.size());
        if (repetitions == 0) {
            points++;
        }

        int fillerCount = fillerSegmentCount(segments);
        if ((double) fillerCount / segments.size() < FILLER_MAX_RATIO) {
            points++;
        }

        int tagVariety = tagVariety(fullText);
        if (tagVariety > TAG_VARIETY_MIN) {
            points++;
        }

        List<String> predictable = predictablePhrases(segments);
        if (predictable.size() < PREDICTABLE_MAX) {
            points++;
        }

        if (segments.size() > GROWTH_MIN_SEGMENTS && vocabularyGrows(segments)) {
            points++;
        }

        int expositionCount = expositionCount(segments);
        if ((double) expositionCount / segments.size() < EXPOSITION_MAX_RATIO) {
            points++;
        }

        boolean hasConflict = hasConflict(segments);
        if (hasConflict) {
            points++;
        }

        if (hasEmotionalVariety(segments)) {
            points++;
        }

        int pacingScore = pacingScore(segments);
        if (pacingScore > PACING_MIN_SCORE) {
            points++;
        }

        return new DialogueMetrics(
                points * 100 / MAX_POINTS,
                segments.size(),
                fillerCount,
                repetitionScore,
                tagVariety,
                monotonyIssues(segments),
                predictable,
                expositionCount,
                pacingScore,
                hasConflict);
    }

    /**
     * Distinct normalized segments occurring at least three times. Zero at or below the minimum segment count.
     */
    static int repeatedPhraseCount(List<String> segments) {
        if (segments.size() <= REPETITION_MIN_SEGMENTS) {
            return 0;
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String segment : segments) {
            counts.merge(TextSegmenter.stripPunctuation(segment.toLowerCase(Locale.ROOT)), 1, Integer::sum);
        }
        int repetitions = 0;
        for (int count : counts.values()) {
            if (count >= REPETITION_MIN_OCCURRENCES) {
                repetitions++;
            }
        }
        return repetitions;
    }

    static int fillerSegmentCount(List<String> segments) {
        int count = 0;
        for (String segment : segments) {
            if (containsAny(segment.toLowerCase(Locale.ROOT), ProseLexicon.DIALOGUE_FILLERS)) {
                count++;
            }
        }
        return count;
    }

    static int tagVariety(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int found = 0;
        for (String tag : ProseLexicon.DIALOGUE_TAGS) {
            if (lower.contains(tag)) {
                found++;
            }
        }
        return found;
    }

    static List<String> predictablePhrases(List<String> segments) {
        List<String> found = new ArrayList<>();
        for (String segment : segments) {
            String lower = segment.toLowerCase(Locale.ROOT);
            for (String phrase : ProseLexicon.PREDICTABLE_DIALOGUE) {
                if (lower.contains(phrase) && !found.contains(phrase)) {
                    found.add(phrase);
                    if (found.size() >= PREDICTABLE_CAP) {
                        return found;
                    }
                }
            }
        }
        return found;
    }

    /**
     * The later half of the dialogue uses more distinct words than the earlier half.
     */
    static boolean vocabularyGrows(List<String> segments) {
        int half = segments.size() / 2;
        Set<String> first = vocabulary(segments.subList(0, half));
        Set<String> second = vocabulary(segments.subList(segments.size() - half, segments.size()));
        return second.size() > first.size();
    }

    static int expositionCount(List<String> segments) {
        int count = 0;
        for (String segment : segments) {
            if (segment.length() > EXPOSITION_MIN_LENGTH && !segment.contains("?") && !segment.contains("!")) {
                count++;
            }
        }
        return count;
    }

    static boolean hasConflict(List<String> segments) {
        int conflicted = 0;
        for (String segment : segments) {
            for (String word : TextSegmenter.tokenizeWords(segment.toLowerCase(Locale.ROOT))) {
                if (ProseLexicon.CONFLICT_WORDS.contains(TextSegmenter.stripPunctuation(word))) {
                    conflicted++;
                    break;
                }
            }
        }
        return (double) conflicted / segments.size() > CONFLICT_MIN_RATIO;
    }

    static boolean hasEmotionalVariety(List<String> segments) {
        boolean exclamation = false;
        boolean question = false;
        boolean ellipsis = false;
        for (String segment : segments) {
            exclamation |= segment.contains("!");
            question |= segment.contains("?");
            ellipsis |= segment.contains("...") || segment.contains("…");
        }
        int kinds = (exclamation ? 1 : 0) + (question ? 1 : 0) + (ellipsis ? 1 : 0);
        return kinds >= 2;
    }

    /**
     * Population standard deviation of segment lengths, scaled so {@value #PACING_FULL_STDEV} chars is 100.
     */
    static int pacingScore(List<String> segments) {
        if (segments.size() < 2) {
            return 0;
        }
        List<Integer> lengths = new ArrayList<>();
        for (String segment : segments) {
            lengths.add(segment.length());
        }
        double stdev = ReadabilityMetrics.populationStdDev(lengths);
        return Math.min(100, (int) (stdev / PACING_FULL_STDEV * 100));
    }

    static List<String> monotonyIssues(List<String> segments) {
        Map<String, Integer> openings = new LinkedHashMap<>();
        for (String segment : segments) {
            List<String> words = TextSegmenter.tokenizeWords(segment);
            if (words.isEmpty()) {
                continue;
            }
            String opening = TextSegmenter.stripPunctuation(words.get(0)).toLowerCase(Locale.ROOT);
            if (!opening.isEmpty()) {
                openings.merge(opening, 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> repeated = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : openings.entrySet()) {
            if (entry.getValue() >= MONOTONY_MIN_OCCURRENCES) {
                repeated.add(entry);
            }
        }
        repeated.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<String> issues = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : repeated) {
            if (issues.size() >= MONOTONY_CAP) {
                break;
            }
            issues.add(entry.getValue() + " lines open with \"" + entry.getKey() + "\"");
        }
        return issues;
    }

    private static Set<String> vocabulary(List<String> segments) {
        Set<String> words = new HashSet<>();
        for (String segment : segments) {
            for (String word : TextSegmenter.tokenizeWords(segment)) {
                String clean = TextSegmenter.stripPunctuation(word).toLowerCase(Locale.ROOT);
                if (!clean.isEmpty()) {
                    words.add(clean);
                }
            }
        }
        return words;
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
