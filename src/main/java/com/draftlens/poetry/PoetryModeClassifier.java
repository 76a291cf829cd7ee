package com.draftlens.poetry;

import com.draftlens.models.PoetryInsights.PoetryMode;

import java.util.List;

/**
 * Leans a poem toward narrative, contemplative, lyric or hybrid from event cues versus
 * address, question and idea cues. Common verbs alone should not make a reflective poem narrative.
 */
public final class PoetryModeClassifier {

    static final int DOMINANCE_MARGIN = 10;
    static final int LYRIC_MARGIN = 4;
    static final int MAX_QUOTE_BONUS = 6;
    static final int MAX_PAST_TENSE_BONUS = 8;

    public record Classification(PoetryMode mode, String rationale) {
    }

    private PoetryModeClassifier() {
    }

    public static Classification classify(List<String> lines, List<List<String>> tokensByLine) {
        int action = 0;
        int reflection = 0;
        int address = 0;
        int pastTense = 0;
        for (List<String> tokens : tokensByLine) {
            for (String token : tokens) {
                action += PoetryLexicon.SEQUENCE_AND_ACTION.contains(token) ? 1 : 0;
                address += PoetryLexicon.ADDRESS.contains(token) ? 1 : 0;
                reflection += PoetryLexicon.CONTEMPLATION.contains(token) ? 1 : 0;
                reflection += PoetryLexicon.ABSTRACTIONS.contains(token) ? 1 : 0;
                if (token.endsWith("ed") && token.length() > 3) {
                    pastTense++;
                }
            }
        }
        int quotedLines = 0;
        int questionLines = 0;
        for (String line : lines) {
            quotedLines += line.contains("\"") ? 1 : 0;
            questionLines += line.contains("?") ? 1 : 0;
        }
        action += Math.min(MAX_QUOTE_BONUS, quotedLines) + Math.min(MAX_PAST_TENSE_BONUS, pastTense);
        int contemplation = reflection + address / 2 + questionLines * 2;

        if (action >= contemplation + DOMINANCE_MARGIN) {
            return new Classification(PoetryMode.NARRATIVE,
                    "Leans narrative: sequence and action cues dominate, so events or scenes are implied.");
        }
        if (contemplation >= action + DOMINANCE_MARGIN) {
            return new Classification(PoetryMode.CONTEMPLATIVE,
                    "Leans contemplative: address, questions and ideas outweigh event cues. The plot may stay "
                            + "still; what moves is the speaker's stance or understanding.");
        }
        if (reflection + address >= action + LYRIC_MARGIN) {
            return new Classification(PoetryMode.LYRIC,
                    "Leans lyric: voice and interior pressure outweigh event cues.");
        }
        return new Classification(PoetryMode.HYBRID, "Hybrid: voice cues and event cues are both present.");
    }
}
