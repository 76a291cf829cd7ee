package com.draftlens.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ReadabilityMetricsTest {

    private static final Pattern GRADE = Pattern.compile("Grade (\\d+)");

    @Test
    void syllablesCountVowelGroups() {
        assertEquals(1, ReadabilityMetrics.syllables("cat"));
        assertEquals(1, ReadabilityMetrics.syllables("make"));
        assertEquals(3, ReadabilityMetrics.syllables("beautiful"));
        assertEquals(1, ReadabilityMetrics.syllables("rhythm"));
        assertEquals(1, ReadabilityMetrics.syllables("123"));
    }

    @Test
    void readingLevelIsDashWithoutWordsOrSentences() {
        assertEquals(ReadabilityMetrics.NO_GRADE, ReadabilityMetrics.readingLevel(List.of(), 3));
        assertEquals(ReadabilityMetrics.NO_GRADE, ReadabilityMetrics.readingLevel(List.of("word"), 0));
    }

    @Test
    void readingLevelIsClampedToRange() {
        List<String> simple = TextSegmenter.tokenizeWords("The cat sat. The dog ran.");
        assertEquals("Grade 0", ReadabilityMetrics.readingLevel(simple, 2));

        String dense = "Incomprehensibility characterizes institutionalized bureaucratic interdepartmental "
                .repeat(20);
        String grade = ReadabilityMetrics.readingLevel(TextSegmenter.tokenizeWords(dense), 1);
        assertEquals("Grade 18", grade);
    }

    @Test
    void readingLevelForOrdinaryProseIsInRange() {
        String text = "The committee postponed its decision. Everyone waited anxiously for the announcement.";
        String grade = ReadabilityMetrics.readingLevel(TextSegmenter.tokenizeWords(text),
                TextSegmenter.countSentences(text));
        Matcher m = GRADE.matcher(grade);
        assertTrue(m.matches());
        int n = Integer.parseInt(m.group(1));
        assertTrue(n >= 0 && n <= 18);
    }

    @Test
    void sentenceVarietyNeedsTwoSentences() {
        ReadabilityMetrics.SentenceVariety single = ReadabilityMetrics.sentenceVariety("Just one sentence here.");
        assertEquals(0, single.score());
        assertTrue(single.sentenceLengths().isEmpty());
    }

    @Test
    void sentenceVarietyScalesStandardDeviation() {
        ReadabilityMetrics.SentenceVariety uniform = ReadabilityMetrics.sentenceVariety("A b c. D e f. G h i.");
        assertEquals(0, uniform.score());
        assertEquals(List.of(3, 3, 3), uniform.sentenceLengths());

        ReadabilityMetrics.SentenceVariety varied = ReadabilityMetrics.sentenceVariety(
                "Go. " + "word ".repeat(20).trim() + ".");
        assertEquals(100, varied.score());
        assertEquals(List.of(1, 20), varied.sentenceLengths());
    }

    @Test
    void pageCountPrefersOverrideThenFormat() {
        assertEquals(7, ReadabilityMetrics.pageCount("anything", 1, false, 7));
        assertEquals(0, ReadabilityMetrics.pageCount("", 0, false, 0));
        assertEquals(1, ReadabilityMetrics.pageCount("one two", 2, false, 0));
        assertEquals(2, ReadabilityMetrics.pageCount("x", 251, false, 0));
        assertEquals(1, ReadabilityMetrics.pageCount("   ", 3, false, 0));
        assertEquals(1, ReadabilityMetrics.pageCount("\n\n", 3, true, 0));

        String screenplay = "LINE\n".repeat(56) + "\n\n";
        assertEquals(2, ReadabilityMetrics.pageCount(screenplay, 56, true, 0));
    }

    @Test
    void dialoguePercentageIsTruncated() {
        assertEquals(0, ReadabilityMetrics.dialoguePercentage(List.of("hello there"), 0));
        assertEquals(0, ReadabilityMetrics.dialoguePercentage(List.of(), 10));
        assertEquals(66, ReadabilityMetrics.dialoguePercentage(List.of("one two"), 3));
    }
}
