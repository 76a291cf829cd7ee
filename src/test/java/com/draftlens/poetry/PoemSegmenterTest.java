package com.draftlens.poetry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoemSegmenterTest {

    @Test
    void titleAndAuthorAboveBlankLineAreDropped() {
        List<String> body = PoemSegmenter.bodyLines("Harbor\nby Ada Writer\n\nline one\nline two\n\nline three");
        assertEquals(Arrays.asList("line one", "line two", "", "line three"), body);
    }

    @Test
    void punctuatedOpeningCoupletIsKept() {
        String poem = "I wandered lonely as a cloud,\nThat floats on high o'er vales and hills.\n\n"
                + "When all at once I saw a crowd,\nA host of golden daffodils.";
        List<String> body = PoemSegmenter.bodyLines(poem);

        assertEquals(5, body.size());
        assertEquals("I wandered lonely as a cloud,", body.get(0));
        assertEquals(2, PoemSegmenter.stanzas(body).size());
        assertEquals(4, PoetryAnalyzer.analyze(poem).formal().lineCount());
    }

    @Test
    void headerWithOnePunctuatedLineIsKept() {
        List<String> body = PoemSegmenter.bodyLines("Harbor\nby A. Writer\n\nline one\nline two");
        assertEquals(Arrays.asList("Harbor", "by A. Writer", "", "line one", "line two"), body);
    }

    @Test
    void tooManyHeaderLinesAreKept() {
        String text = "one\ntwo\nthree\nfour\n\nfive";
        assertEquals(Arrays.asList("one", "two", "three", "four", "", "five"), PoemSegmenter.bodyLines(text));
    }

    @Test
    void overlongHeaderLineIsKept() {
        String longLine = "x".repeat(PoemSegmenter.MAX_HEADER_LENGTH + 1);
        List<String> body = PoemSegmenter.bodyLines(longLine + "\n\nbody");
        assertEquals(longLine, body.get(0));
    }

    @Test
    void leadingBlankLineLeavesTextAlone() {
        assertEquals(Arrays.asList("", "line a", "line b"), PoemSegmenter.bodyLines("\nline a\nline b"));
    }

    @Test
    void bareTitleIsDroppedAboveLongBody() {
        List<String> lines = new ArrayList<>();
        lines.add("Night Crossing");
        for (int i = 0; i < PoemSegmenter.MIN_BODY_FOR_BARE_HEADER; i++) {
            lines.add("the water turns again,");
        }
        List<String> body = PoemSegmenter.bodyLines(String.join("\n", lines));

        assertEquals(PoemSegmenter.MIN_BODY_FOR_BARE_HEADER, body.size());
        assertEquals("the water turns again,", body.get(0));
    }

    @Test
    void shortPoemWithoutBlankKeepsFirstLine() {
        List<String> body = PoemSegmenter.bodyLines("Night Crossing\nthe water turns,\nthe oars rest.");
        assertEquals(3, body.size());
        assertEquals("Night Crossing", body.get(0));
    }

    @Test
    void windowsLineEndingsAreNormalized() {
        assertEquals(Arrays.asList("a", "b", "c"), PoemSegmenter.bodyLines("a\r\nb\rc"));
        assertTrue(PoemSegmenter.bodyLines("").isEmpty());
        assertTrue(PoemSegmenter.bodyLines(null).isEmpty());
    }

    @Test
    void blankLinesSeparateStanzas() {
        List<List<String>> stanzas = PoemSegmenter.stanzas(Arrays.asList("a", "b", "", "  ", "c", ""));
        assertEquals(2, stanzas.size());
        assertEquals(List.of("a", "b"), stanzas.get(0));
        assertEquals(List.of("c"), stanzas.get(1));
    }

    @Test
    void tokensAreLowercaseLetterRuns() {
        assertEquals(List.of("don't", "stop", "the", "night's", "owls"),
                PoemSegmenter.tokenize("Don't stop—the NIGHT's 3 owls!"));
        assertTrue(PoemSegmenter.tokenize("  42 ... ").isEmpty());
    }
}
