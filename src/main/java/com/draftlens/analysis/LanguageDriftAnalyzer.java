package com.draftlens.analysis;

import com.draftlens.models.LanguageDrift;
import com.draftlens.models.LanguageDrift.Metrics;
import com.draftlens.models.LanguageDrift.Summary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tracks how the language around a character changes chapter to chapter: self versus group
 * pronouns, obligation versus choice, emotional load, sentence length and certainty.
 */
public final class LanguageDriftAnalyzer {

    static final double SHIFT_THRESHOLD = 0.1;
    static final double MAX_SENTENCE_WORDS = 40.0;
    static final String STABLE = "Stable";
    static final String INSUFFICIENT = "Insufficient data";

    private static final Set<String> FIRST_SINGULAR = Set.of("i", "me", "my", "mine", "myself");
    private static final Set<String> FIRST_PLURAL = Set.of("we", "us", "our", "ours", "ourselves");
    private static final Set<String> OBLIGATION = Set.of(
            "must", "should", "ought", "need", "needed", "needs", "cannot", "can't", "mustn't", "required");
    private static final Set<String> CHOICE = Set.of(
            "can", "could", "might", "may", "choose", "chose", "want", "wanted", "will", "would", "decide", "decided");
    private static final Set<String> CERTAIN = Set.of(
            "always", "never", "definitely", "certainly", "sure", "know", "knew", "absolutely", "clearly", "certain");
    private static final Set<String> HEDGED = Set.of(
            "maybe", "perhaps", "possibly", "probably", "seemed", "seems", "unsure", "wondered", "guess", "almost");

    private LanguageDriftAnalyzer() {
    }

    /**
     * Characters with no chapter mentions are left out.
     */
    public static List<LanguageDrift> analyze(List<Chapter> chapters, List<CharacterAliases> characters) {
        List<LanguageDrift> drifts = new ArrayList<>();
        List<Integer> sampled = ChapterSplitter.sampleIndices(chapters.size(),
                CharacterNarrativeAnalyzer.MAX_SAMPLED_CHAPTERS);
        for (CharacterAliases character : characters) {
            List<Metrics> metrics = new ArrayList<>();
            for (int index : sampled) {
                Chapter chapter = chapters.get(index);
                List<String> sentences = new SentenceEvidence(chapter.text()).mentioning(character);
                if (!sentences.isEmpty()) {
                    metrics.add(measure(chapter.number(), sentences));
                }
            }
            if (!metrics.isEmpty()) {
                drifts.add(new LanguageDrift(character.key(), metrics, summarize(metrics)));
            }
        }
        return drifts;
    }

    static Metrics measure(int chapter, List<String> sentences) {
        int words = 0;
        int singular = 0;
        int plural = 0;
        int obligation = 0;
        int choice = 0;
        int emotional = 0;
        int certain = 0;
        int hedged = 0;
        for (String sentence : sentences) {
            for (String token : TextSegmenter.tokenizeWords(sentence)) {
                String word = TextSegmenter.stripPunctuation(token).toLowerCase(Locale.ROOT);
                if (word.isEmpty()) {
                    continue;
                }
                words++;
                singular += FIRST_SINGULAR.contains(word) ? 1 : 0;
                plural += FIRST_PLURAL.contains(word) ? 1 : 0;
                obligation += OBLIGATION.contains(word) ? 1 : 0;
                choice += CHOICE.contains(word) ? 1 : 0;
                certain += CERTAIN.contains(word) ? 1 : 0;
                hedged += HEDGED.contains(word) ? 1 : 0;
                if (ProseLexicon.SENTIMENT.containsKey(word) || ProseLexicon.INTENSITY_WORDS.contains(word)) {
                    emotional++;
                }
            }
        }
        double total = Math.max(1, words);
        double certainty = certain + hedged == 0 ? 0.5 : (double) certain / (certain + hedged);
        return new Metrics(
                chapter,
                scaled(singular / total, 10),
                scaled(plural / total, 10),
                scaled(obligation / total, 20),
                scaled(choice / total, 20),
                scaled(emotional / total, 10),
                Math.min(1.0, words / (double) sentences.size() / MAX_SENTENCE_WORDS),
                certainty);
    }

    static Summary summarize(List<Metrics> metrics) {
        if (metrics.size() < 2) {
            return new Summary(INSUFFICIENT, INSUFFICIENT, INSUFFICIENT, INSUFFICIENT, INSUFFICIENT);
        }
        Metrics first = metrics.get(0);
        Metrics last = metrics.get(metrics.size() - 1);
        return new Summary(
                shift(last.pronounI() - first.pronounI(), last.pronounWe() - first.pronounWe(), "I to We", "We to I"),
                shift(last.modalMust() - first.modalMust(), last.modalChoice() - first.modalChoice(),
                        "Obligation to Choice", "Choice to Obligation"),
                trend(last.emotionalDensity() - first.emotionalDensity(), "Rising", "Falling"),
                trend(last.avgSentenceLength() - first.avgSentenceLength(), "Lengthening", "Shortening"),
                trend(last.certaintyScore() - first.certaintyScore(), "Growing certainty", "Growing doubt"));
    }

    /**
     * Reports a move from the first measure to the second when one falls while the other rises.
     */
    private static String shift(double firstDelta, double secondDelta, String towardSecond, String towardFirst) {
        if (firstDelta < -SHIFT_THRESHOLD / 2 && secondDelta > SHIFT_THRESHOLD / 2) {
            return towardSecond;
        }
        if (firstDelta > SHIFT_THRESHOLD / 2 && secondDelta < -SHIFT_THRESHOLD / 2) {
            return towardFirst;
        }
        return STABLE;
    }

    private static String trend(double delta, String rising, String falling) {
        if (delta > SHIFT_THRESHOLD) {
            return rising;
        }
        if (delta < -SHIFT_THRESHOLD) {
            return falling;
        }
        return STABLE;
    }

    private static double scaled(double rate, double factor) {
        return Math.min(1.0, rate * factor);
    }
}
