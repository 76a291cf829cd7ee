package com.draftlens.poetry;

import com.draftlens.models.PoetryInsights.PoetryMode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoetryModeClassifierTest {

    @Test
    void sequenceAndActionReadAsNarrative() {
        assertEquals(PoetryMode.NARRATIVE, classify(
                "Then she walked to the river and then she ran",
                "After that she came back, then she went away",
                "Later she said goodbye and took the train"));
    }

    @Test
    void questionsAndIdeasReadAsContemplative() {
        assertEquals(PoetryMode.CONTEMPLATIVE, classify(
                "Do you know the truth?",
                "Do you remember time?",
                "What is the meaning of silence?"));
    }

    @Test
    void addressWithoutEventsReadsAsLyric() {
        assertEquals(PoetryMode.LYRIC, classify("O my soul", "you and your mind"));
    }

    @Test
    void noCuesIsHybrid() {
        PoetryModeClassifier.Classification result = PoetryModeClassifier.classify(
                List.of("the stone", "the tree"), tokens(List.of("the stone", "the tree")));
        assertEquals(PoetryMode.HYBRID, result.mode());
        assertFalse(result.rationale().isEmpty());
    }

    private static PoetryMode classify(String... lines) {
        List<String> list = List.of(lines);
        return PoetryModeClassifier.classify(list, tokens(list)).mode();
    }

    private static List<List<String>> tokens(List<String> lines) {
        List<List<String>> tokens = new ArrayList<>();
        for (String line : lines) {
            tokens.add(PoemSegmenter.tokenize(line));
        }
        return tokens;
    }
}
