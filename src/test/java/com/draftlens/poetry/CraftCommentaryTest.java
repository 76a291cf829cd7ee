package com.draftlens.poetry;

import com.draftlens.models.PoetryInsights;
import com.draftlens.models.PoetryInsights.CraftBucket;
import com.draftlens.models.PoetryInsights.FormContext;
import com.draftlens.models.PoetryInsights.FormalTechnical;
import com.draftlens.models.PoetryInsights.PoetryMode;
import com.draftlens.models.PoetryInsights.WritersAnalysis;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CraftCommentaryTest {

    private static final String[] QUATRAIN = {
            "We walked out at the end of day,", "the harbor bright with falling light;",
            "and gulls kept calling through the day", "and you were gone before the night."};

    @Test
    void alternatingQuatrains() {
        assertTrue(CraftCommentary.isAlternatingQuatrain("ABAB"));
        assertTrue(CraftCommentary.isAlternatingQuatrain("ABCB"));
        assertFalse(CraftCommentary.isAlternatingQuatrain("AABB"));
        assertFalse(CraftCommentary.isAlternatingQuatrain("AB-B"));
        assertFalse(CraftCommentary.isAlternatingQuatrain("ABA"));
        assertFalse(CraftCommentary.isAlternatingQuatrain("AAAA"));
    }

    @Test
    void endingMoveReadsFinalPunctuationFirst() {
        assertEquals("Ends in suspension (question).", CraftCommentary.endingMove("Why? ", List.of(1.0)));
        assertEquals("Ends with a surge (exclamation).", CraftCommentary.endingMove("Now!", List.of(-1.0)));
        assertEquals("Ends in refusal or suspension (dash).", CraftCommentary.endingMove("and then—", List.of()));
    }

    @Test
    void endingMoveFallsBackToTailAffect() {
        assertEquals("Ends with emotional lift.",
                CraftCommentary.endingMove("home", List.of(-1.0, 0.5, 0.5, 0.5)));
        assertEquals("Ends darkening, in unease.", CraftCommentary.endingMove("gone", List.of(-0.5, -0.5)));
        assertEquals("Ends without clear resolution (steady state).", CraftCommentary.endingMove("", List.of()));
    }

    @Test
    void regularStanzasAreStanzaic() {
        List<List<String>> stanzas = stanzas(3, QUATRAIN);
        assertEquals(FormContext.STANZAIC_LYRIC,
                CraftCommentary.formContext(PoetryMode.LYRIC, stanzas, formal(stanzas)));
    }

    @Test
    void longBalladLikePoemIsStanzaicNarrative() {
        List<List<String>> stanzas = stanzas(CraftCommentary.LONG_POEM_STANZAS, QUATRAIN);
        FormalTechnical formal = formal(stanzas);

        assertEquals(FormContext.STANZAIC_NARRATIVE, CraftCommentary.formContext(PoetryMode.HYBRID, stanzas, formal));
        assertEquals(FormContext.STANZAIC_LYRIC, CraftCommentary.formContext(PoetryMode.LYRIC, stanzas, formal));
    }

    @Test
    void fewIrregularStanzasAreOpenForm() {
        List<List<String>> stanzas = stanzas(2, "one.", "two.", "three.");
        assertEquals(FormContext.OPEN_FORM, CraftCommentary.formContext(PoetryMode.LYRIC, stanzas, formal(stanzas)));
    }

    @Test
    void irregularClosedStanzasAreMixed() {
        List<List<String>> stanzas = stanzas(3, "one.", "two.", "three.");
        assertEquals(FormContext.MIXED, CraftCommentary.formContext(PoetryMode.LYRIC, stanzas, formal(stanzas)));
    }

    @Test
    void everyBucketGetsAnObservation() {
        PoetryInsights insights = PoetryAnalyzer.analyze(String.join("\n", QUATRAIN) + "\n\n"
                + "But still the harbor holds the light,\nand still I hear you on the stair—");
        WritersAnalysis writers = insights.writers();

        for (CraftBucket bucket : CraftBucket.values()) {
            assertFalse(writers.observationsFor(bucket).isEmpty(), bucket.name());
        }
        assertTrue(writers.observationsFor(CraftBucket.EMOTIONAL_ARC)
                .contains("Ends in refusal or suspension (dash)."));
        assertTrue(writers.observationsFor(CraftBucket.LINE_ENERGY).contains(
                "Candidate turn: line 5. Tightening the syntax just before it sharpens the pivot."));
        assertFalse(writers.modeRationale().isEmpty());
    }

    @Test
    void commentaryIsDeterministic() {
        String poem = String.join("\n", QUATRAIN);
        assertEquals(PoetryAnalyzer.analyze(poem).writers(), PoetryAnalyzer.analyze(poem).writers());
    }

    private static List<List<String>> stanzas(int count, String... lines) {
        List<List<String>> stanzas = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            stanzas.add(List.of(lines));
        }
        return stanzas;
    }

    private static FormalTechnical formal(List<List<String>> stanzas) {
        List<String> lines = new ArrayList<>();
        List<List<String>> tokens = new ArrayList<>();
        for (List<String> stanza : stanzas) {
            for (String line : stanza) {
                lines.add(line);
                tokens.add(PoemSegmenter.tokenize(line));
            }
        }
        return PoetryAnalyzer.formal(stanzas, lines, tokens);
    }
}
