package com.draftlens.analysis;

import com.draftlens.models.DialogueMetrics;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DialogueQualityScorerTest {

    @Test
    void noSegmentsScoresZero() {
        DialogueMetrics metrics = DialogueQualityScorer.score(List.of(), "Narration only.");
        assertEquals(DialogueMetrics.EMPTY, metrics);
        assertEquals(0, metrics.qualityScore());
        assertFalse(metrics.hasConflict());
    }

    @Test
    void scoreIsTenPointsPerCheck() {
        List<String> segments = List.of("Yes.", "No.");
        DialogueMetrics metrics = DialogueQualityScorer.score(segments, "\"Yes.\" \"No.\"");
        assertEquals(0, metrics.qualityScore() % 10);
        assertTrue(metrics.qualityScore() >= 0 && metrics.qualityScore() <= 100);
        assertEquals(2, metrics.segmentCount());
    }

    @Test
    void repeatedSegmentsNeedMoreThanFiveLines() {
        List<String> few = List.of("Go.", "Go.", "Go.", "Stop.", "Wait.");
        assertEquals(0, DialogueQualityScorer.repeatedPhraseCount(few));

        List<String> many = List.of("Go.", "go", "Go!", "Stop.", "Wait.", "Run.");
        assertEquals(1, DialogueQualityScorer.repeatedPhraseCount(many));
    }

    @Test
    void fillersAndPredictablePhrases() {
        List<String> segments = List.of("Um, I can explain.", "Trust me, it's complicated.", "Fine.");
        assertEquals(1, DialogueQualityScorer.fillerSegmentCount(List.of("Um, okay.", "Sure.")));
        List<String> predictable = DialogueQualityScorer.predictablePhrases(segments);
        assertEquals(List.of("i can explain", "trust me", "it's complicated"), predictable);
    }

    @Test
    void tagVarietyScansWholeText() {
        String text = "she said. he asked. they replied. I whispered. you shouted. we muttered.";
        assertEquals(6, DialogueQualityScorer.tagVariety(text));
    }

    @Test
    void conflictNeedsMoreThanAFifthOfSegments() {
        List<String> calm = List.of("Nice day.", "Lovely.", "Indeed.", "Quite.", "No.");
        assertFalse(DialogueQualityScorer.hasConflict(calm));
        List<String> tense = List.of("That's wrong.", "You're a liar!", "Fine.", "Okay.");
        assertTrue(DialogueQualityScorer.hasConflict(tense));
    }

    @Test
    void conflictWordsMatchWholeWordsOnly() {
        assertFalse(DialogueQualityScorer.hasConflict(List.of("Nothing noted.", "Butter, please.")));
    }

    @Test
    void emotionalVarietyNeedsTwoKinds() {
        assertFalse(DialogueQualityScorer.hasEmotionalVariety(List.of("Stop!", "Now!")));
        assertTrue(DialogueQualityScorer.hasEmotionalVariety(List.of("Stop!", "Why?")));
        assertTrue(DialogueQualityScorer.hasEmotionalVariety(List.of("Well...", "Why?")));
    }

    @Test
    void expositionIsLongFlatSpeech() {
        String lecture = "word ".repeat(30).trim() + ".";
        assertEquals(1, DialogueQualityScorer.expositionCount(List.of(lecture, lecture + "?", "Short.")));
    }

    @Test
    void pacingRewardsVariedLengths() {
        assertEquals(0, DialogueQualityScorer.pacingScore(List.of("Same.", "Same.")));
        assertEquals(100, DialogueQualityScorer.pacingScore(List.of("Hi.", "x".repeat(80))));
    }

    @Test
    void vocabularyGrowthComparesHalves() {
        List<String> segments = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            segments.add("Yes.");
        }
        for (int i = 0; i < 6; i++) {
            segments.add("Another fresh sentence number " + i + ".");
        }
        assertTrue(DialogueQualityScorer.vocabularyGrows(segments));
    }

    @Test
    void monotonyReportsRepeatedOpenings() {
        List<String> segments = List.of("Well, fine.", "Well now.", "Well!", "I see.", "I know.", "I do.", "So.");
        List<String> issues = DialogueQualityScorer.monotonyIssues(segments);
        assertEquals(2, issues.size());
        assertTrue(issues.contains("3 lines open with \"well\""));
        assertTrue(issues.contains("3 lines open with \"i\""));
    }
}
