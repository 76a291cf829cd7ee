package com.draftlens.analysis;

import com.draftlens.models.CharacterAlignment;
import com.draftlens.models.CharacterAlignment.DataPoint;
import com.draftlens.models.CharacterAlignment.GapTrend;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Compares what a character feels inside (sentences with interior verbs) with how they act
 * (sentences with outward action or speech verbs). Both sides are valence scores mapped to [0, 1].
 */
public final class AlignmentAnalyzer {

    static final double NEUTRAL = 0.5;
    static final double TREND_DELTA = 0.15;
    static final double FLUCTUATION_STDEV = 0.2;
    static final double COLLAPSE_LEVEL = 0.35;

    private static final Set<String> INTERIOR_WORDS = Set.of(
            "thought", "felt", "wanted", "feared", "knew", "wondered", "hoped", "believed", "realized",
            "remembered", "wished", "dreaded", "longed", "worried", "doubted", "sensed", "imagined");

    private static final Set<String> OUTWARD_WORDS = Set.of(
            "said", "walked", "smiled", "nodded", "told", "went", "took", "ran", "answered", "laughed",
            "shrugged", "turned", "looked", "replied", "grabbed", "opened", "stood", "left", "shouted", "asked");

    private AlignmentAnalyzer() {
    }

    /**
     * Characters with no chapter mentions are left out.
     */
    public static List<CharacterAlignment> analyze(List<Chapter> chapters, List<CharacterAliases> characters) {
        List<CharacterAlignment> alignments = new ArrayList<>();
        List<Integer> sampled = ChapterSplitter.sampleIndices(chapters.size(),
                CharacterNarrativeAnalyzer.MAX_SAMPLED_CHAPTERS);
        for (CharacterAliases character : characters) {
            List<DataPoint> points = new ArrayList<>();
            for (int index : sampled) {
                Chapter chapter = chapters.get(index);
                if (!character.matches(chapter.text())) {
                    continue;
                }
                double innerSum = 0;
                int innerCount = 0;
                double outerSum = 0;
                int outerCount = 0;
                for (String sentence : new SentenceEvidence(chapter.text()).mentioning(character)) {
                    Double valence = valence(sentence);
                    boolean interior = containsAny(sentence, INTERIOR_WORDS);
                    boolean outward = containsAny(sentence, OUTWARD_WORDS);
                    double score = valence == null ? NEUTRAL : (valence + 1) / 2;
                    if (interior) {
                        innerSum += score;
                        innerCount++;
                    }
                    if (outward) {
                        outerSum += score;
                        outerCount++;
                    }
                }
                double inner = innerCount == 0 ? NEUTRAL : innerSum / innerCount;
                double outer = outerCount == 0 ? NEUTRAL : outerSum / outerCount;
                points.add(new DataPoint(chapter.number(), inner, outer, label(inner), label(outer)));
            }
            if (!points.isEmpty()) {
                alignments.add(new CharacterAlignment(character.key(), points, trend(points)));
            }
        }
        return alignments;
    }

    /**
     * Compares the mean gap of the earlier half with the later half. A closing gap where both sides
     * end low reads as collapse rather than integration.
     */
    static GapTrend trend(List<DataPoint> points) {
        if (points.size() < 2) {
            return GapTrend.STABILIZING;
        }
        int half = points.size() / 2;
        double early = meanGap(points.subList(0, half));
        double late = meanGap(points.subList(points.size() - half, points.size()));
        double delta = late - early;
        if (delta > TREND_DELTA) {
            return GapTrend.WIDENING;
        }
        if (delta < -TREND_DELTA) {
            DataPoint last = points.get(points.size() - 1);
            if (last.innerTruth() < COLLAPSE_LEVEL && last.outerBehavior() < COLLAPSE_LEVEL) {
                return GapTrend.COLLAPSING;
            }
            return GapTrend.CLOSING;
        }
        double mean = meanGap(points);
        double squared = 0;
        for (DataPoint point : points) {
            squared += (point.gap() - mean) * (point.gap() - mean);
        }
        if (Math.sqrt(squared / points.size()) > FLUCTUATION_STDEV) {
            return GapTrend.FLUCTUATING;
        }
        return GapTrend.STABILIZING;
    }

    static String label(double score) {
        if (score >= 0.6) {
            return "Positive";
        }
        if (score <= 0.4) {
            return "Negative";
        }
        return "Neutral";
    }

    /**
     * Mean valence of the sentence's emotion words, or null when it has none.
     */
    static Double valence(String sentence) {
        double sum = 0;
        int count = 0;
        for (String word : TextSegmenter.tokenizeWords(sentence)) {
            Double value = ProseLexicon.SENTIMENT.get(TextSegmenter.stripPunctuation(word).toLowerCase(Locale.ROOT));
            if (value != null) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    private static double meanGap(List<DataPoint> points) {
        double sum = 0;
        for (DataPoint point : points) {
            sum += point.gap();
        }
        return points.isEmpty() ? 0 : sum / points.size();
    }

    private static boolean containsAny(String sentence, Set<String> words) {
        for (String word : TextSegmenter.tokenizeWords(sentence)) {
            if (words.contains(TextSegmenter.stripPunctuation(word).toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
