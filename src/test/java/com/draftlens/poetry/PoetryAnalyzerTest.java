package com.draftlens.poetry;

import com.draftlens.models.PoetryInsights;
import com.draftlens.models.PoetryInsights.CountedItem;
import com.draftlens.models.PoetryInsights.EmotionalTrajectory;
import com.draftlens.models.PoetryInsights.ImagerySensory;
import com.draftlens.models.PoetryInsights.MacroStructure;
import com.draftlens.models.PoetryInsights.Sense;
import com.draftlens.models.PoetryInsights.ThemeMotif;
import com.draftlens.models.PoetryInsights.VoiceRhetoric;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PoetryAnalyzerTest {

    private static final String POEM = "Harbor\n\n"
            + "We walked out at the end of day,\n"
            + "the harbor bright with falling light;\n"
            + "and gulls kept calling through the day\n"
            + "and you were gone before the night.\n"
            + "\n"
            + "But still the harbor holds the light,\n"
            + "and still I hear you on the stair—\n"
            + "so very cold, so dark, so bright,\n"
            + "the harbor opens into air";

    @Test
    void fewerThanTwoLinesIsInsufficient() {
        assertNull(PoetryAnalyzer.analyze("one line"));
        assertNull(PoetryAnalyzer.analyze(""));
    }

    @Test
    void analyzesFormAfterDroppingTitle() {
        PoetryInsights insights = PoetryAnalyzer.analyze(POEM);

        assertNotNull(insights);
        assertEquals(8, insights.formal().lineCount());
        assertEquals(2, insights.formal().stanzaCount());
        assertEquals(List.of("ABAB", "ABAB"), insights.formal().rhymeSchemeByStanza());
        assertEquals(List.of(4, 4), insights.structure().stanzaLineCounts());
        assertEquals(Integer.valueOf(5), insights.voice().candidateVoltaLine());
        assertEquals(new CountedItem("harbor", 3), insights.motif().topMotifs().get(0));
        assertNotNull(insights.writers());
    }

    @Test
    void rhymeKeysUseLastLetters() {
        assertEquals("rld", PoetryAnalyzer.rhymeKey("Hello, World!"));
        assertEquals("sea", PoetryAnalyzer.rhymeKey("to the sea"));
        assertEquals("", PoetryAnalyzer.rhymeKey("   "));
    }

    @Test
    void rhymeSchemeLettersInOrderOfFirstUse() {
        assertEquals("ABAB", PoetryAnalyzer.rhymeScheme(List.of(
                "The end of day", "The fall of night", "We walk away today", "Into the light")));
        assertEquals("-", PoetryAnalyzer.rhymeScheme(List.of("----")));
        assertEquals("AA-", PoetryAnalyzer.rhymeScheme(List.of("stay", "stay", "42")));
    }

    @Test
    void enjambmentAndCaesura() {
        assertEquals(1.0 / 3.0, PoetryAnalyzer.enjambmentRate(List.of("open line", "closed line.", "quoted”")), 1e-9);
        assertEquals(0.5, PoetryAnalyzer.caesuraRate(List.of("Stop, and listen to the rain", "no pause here at all")),
                1e-9);
        assertEquals(0.0, PoetryAnalyzer.enjambmentRate(List.of()), 1e-9);
    }

    @Test
    void alliterationReportsLongestRun() {
        List<String> examples = PoetryAnalyzer.alliteration(List.of("Big bold bears", "no run here"), 6);
        assertEquals(List.of("Line 1: repeated initial 'b' (3×)"), examples);
    }

    @Test
    void lineScoresAreClamped() {
        assertEquals(1.0, PoetryAnalyzer.lineScore("love and light", PoemSegmenter.tokenize("love and light")), 1e-9);
        assertEquals(-1.0, PoetryAnalyzer.lineScore("dark!", PoemSegmenter.tokenize("dark!")), 1e-9);
        assertEquals(1.0, PoetryAnalyzer.lineScore("so warm", PoemSegmenter.tokenize("so warm")), 1e-9);
        String mixed = "very warm, cold, dark";
        assertEquals(-0.35, PoetryAnalyzer.lineScore(mixed, PoemSegmenter.tokenize(mixed)), 1e-9);
        assertEquals(0.0, PoetryAnalyzer.lineScore("stone", PoemSegmenter.tokenize("stone")), 1e-9);
    }

    @Test
    void emotionTracksSwingsAndExtremes() {
        List<String> lines = List.of("love", "dark", "love");
        EmotionalTrajectory emotion = PoetryAnalyzer.emotion(lines, tokens(lines), List.of(3), null);

        assertEquals(List.of(1.0, -1.0, 1.0), emotion.lineScores());
        assertEquals(Integer.valueOf(1), emotion.peakLine());
        assertEquals(Integer.valueOf(2), emotion.troughLine());
        assertEquals(2.0, emotion.volatility(), 1e-9);
        assertEquals(List.of(1, 2), emotion.notableShiftLines());
        assertEquals(1, emotion.stanzaScores().size());
        assertTrue(emotion.notableShiftStanzas().isEmpty());
    }

    @Test
    void voltaLineIsAlwaysANotableShift() {
        List<String> lines = List.of("stone", "stone", "stone", "stone");
        EmotionalTrajectory emotion = PoetryAnalyzer.emotion(lines, tokens(lines), List.of(2, 2), 3);

        assertEquals(List.of(1, 2, 3), emotion.notableShiftLines());
        assertEquals(List.of(1, 2), emotion.notableShiftStanzas());
    }

    @Test
    void voltaIsAddedBesideTheThreeLargestSwings() {
        List<String> lines = List.of("love", "love", "dark", "dark", "love", "stone");
        EmotionalTrajectory emotion = PoetryAnalyzer.emotion(lines, tokens(lines), List.of(6), 1);

        assertEquals(List.of(2, 4, 5), PoetryAnalyzer.largestShifts(List.of(0.0, 2.0, 0.0, 2.0, 1.0)));
        assertEquals(List.of(1, 2, 4, 5), emotion.notableShiftLines());
    }

    @Test
    void flatPoemStillReportsThreeTransitions() {
        assertEquals(List.of(1, 2, 3), PoetryAnalyzer.largestShifts(List.of(0.0, 0.0, 0.0, 0.0)));
        assertEquals(List.of(1), PoetryAnalyzer.largestShifts(List.of(0.0)));
        assertTrue(PoetryAnalyzer.largestShifts(List.of()).isEmpty());
    }

    @Test
    void imageryCountsFirstMatchingSense() {
        ImagerySensory imagery = PoetryAnalyzer.imagery(List.of(List.of("light", "bright", "sound", "stone")));

        assertEquals(Integer.valueOf(2), imagery.countsBySense().get(Sense.VISUAL));
        assertEquals(Integer.valueOf(1), imagery.countsBySense().get(Sense.AUDITORY));
        assertEquals(Integer.valueOf(0), imagery.countsBySense().get(Sense.GUSTATORY));
        assertEquals(List.of(Sense.VISUAL, Sense.AUDITORY), imagery.dominantSenses());
        assertEquals("bright", imagery.topSensoryTokens().get(0).text());
    }

    @Test
    void voiceAddressModes() {
        List<String> address = List.of("You and your heart", "the sea");
        assertEquals("Address (speaker to you)", PoetryAnalyzer.voice(address, tokens(address)).likelyAddressMode());

        List<String> stance = List.of("I keep the sea", "but you go");
        VoiceRhetoric voice = PoetryAnalyzer.voice(stance, tokens(stance));
        assertEquals("First-person stance (speaker-centered)", voice.likelyAddressMode());
        assertEquals(Integer.valueOf(2), voice.candidateVoltaLine());

        List<String> plain = List.of("the stone", "the tree?");
        VoiceRhetoric observed = PoetryAnalyzer.voice(plain, tokens(plain));
        assertEquals("Observational / descriptive", observed.likelyAddressMode());
        assertEquals(1, observed.questions());
        assertNull(observed.candidateVoltaLine());
    }

    @Test
    void motifsNeedTwoOccurrences() {
        ThemeMotif motif = PoetryAnalyzer.motifs(List.of(List.of("sea", "sea", "stone"), List.of("sea", "stone", "the")));

        assertEquals(List.of(new CountedItem("sea", 3), new CountedItem("stone", 2)), motif.topMotifs());
        assertEquals(List.of(new CountedItem("sea stone", 2)), motif.repeatedPhrases());
    }

    @Test
    void structureIndexesAreZeroBased() {
        MacroStructure structure = PoetryAnalyzer.structure(List.of(4, 2, 6));
        assertEquals(Integer.valueOf(2), structure.longestStanzaIndex());
        assertEquals(Integer.valueOf(1), structure.shortestStanzaIndex());
    }

    @Test
    void topCountedBreaksTiesAlphabetically() {
        Map<String, Integer> counts = new HashMap<>();
        counts.put("pear", 2);
        counts.put("apple", 2);
        counts.put("fig", 5);
        counts.put("kiwi", 1);
        List<CountedItem> top = PoetryAnalyzer.topCounted(counts, 2, 2);
        assertEquals(List.of(new CountedItem("fig", 5), new CountedItem("apple", 2)), top);
        assertEquals("fig (5×)", top.get(0).describe());
    }

    @Test
    void sampleStdDevUsesNMinusOne() {
        assertEquals(Math.sqrt(2.0), PoetryAnalyzer.sampleStdDev(List.of(1.0, 3.0)), 1e-9);
        assertEquals(0.0, PoetryAnalyzer.sampleStdDev(List.of(4.0)), 1e-9);
    }

    private static List<List<String>> tokens(List<String> lines) {
        List<List<String>> tokens = new ArrayList<>();
        for (String line : lines) {
            tokens.add(PoemSegmenter.tokenize(line));
        }
        return tokens;
    }
}
