package com.draftlens.analysis;

import com.draftlens.context.CharacterRegistry;
import com.draftlens.models.CharacterAlignment;
import com.draftlens.models.CharacterAlignment.DataPoint;
import com.draftlens.models.CharacterAlignment.GapTrend;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlignmentAnalyzerTest {

    @Test
    void innerAndOuterScoresFollowSentiment() {
        String text = "Chapter 1\nMara felt happy. Mara smiled.\nChapter 2\nMara felt despair. Mara smiled.";
        List<CharacterAlignment> alignments = AlignmentAnalyzer.analyze(ChapterSplitter.split(text, List.of()),
                CharacterAliases.forAll(List.of("Mara", "Jonah"), CharacterRegistry.empty()));

        assertEquals(1, alignments.size());
        CharacterAlignment mara = alignments.get(0);
        assertEquals(2, mara.dataPoints().size());

        DataPoint first = mara.dataPoints().get(0);
        assertEquals(0.85, first.innerTruth(), 1e-9);
        assertEquals(0.8, first.outerBehavior(), 1e-9);
        assertEquals("Positive", first.innerLabel());

        DataPoint second = mara.dataPoints().get(1);
        assertEquals(0.05, second.innerTruth(), 1e-9);
        assertEquals("Negative", second.innerLabel());
        assertEquals(GapTrend.WIDENING, mara.gapTrend());
    }

    @Test
    void sentencesWithoutVerbsOfEitherKindStayNeutral() {
        String text = "Mara was happy.";
        CharacterAlignment mara = AlignmentAnalyzer.analyze(ChapterSplitter.split(text, List.of()),
                CharacterAliases.forAll(List.of("Mara"), CharacterRegistry.empty())).get(0);
        DataPoint point = mara.dataPoints().get(0);
        assertEquals(AlignmentAnalyzer.NEUTRAL, point.innerTruth(), 1e-9);
        assertEquals(AlignmentAnalyzer.NEUTRAL, point.outerBehavior(), 1e-9);
        assertEquals(GapTrend.STABILIZING, mara.gapTrend());
    }

    @Test
    void closingAndCollapsingGaps() {
        List<DataPoint> closing = List.of(point(1, 0.9, 0.1), point(2, 0.6, 0.6));
        assertEquals(GapTrend.CLOSING, AlignmentAnalyzer.trend(closing));

        List<DataPoint> collapsing = List.of(point(1, 0.9, 0.1), point(2, 0.2, 0.2));
        assertEquals(GapTrend.COLLAPSING, AlignmentAnalyzer.trend(collapsing));
    }

    @Test
    void unevenGapsFluctuate() {
        List<DataPoint> points = new ArrayList<>();
        double[] gaps = {0.0, 0.8, 0.0, 0.8, 0.0};
        for (int i = 0; i < gaps.length; i++) {
            points.add(point(i + 1, 0.1 + gaps[i], 0.1));
        }
        assertEquals(GapTrend.FLUCTUATING, AlignmentAnalyzer.trend(points));
    }

    @Test
    void labelsAndValence() {
        assertEquals("Positive", AlignmentAnalyzer.label(0.6));
        assertEquals("Neutral", AlignmentAnalyzer.label(0.5));
        assertEquals("Negative", AlignmentAnalyzer.label(0.4));
        assertNull(AlignmentAnalyzer.valence("Nothing to feel here."));
        assertEquals(0.0, AlignmentAnalyzer.valence("happy and sad").doubleValue(), 0.11);
    }

    private static DataPoint point(int chapter, double inner, double outer) {
        return new DataPoint(chapter, inner, outer, AlignmentAnalyzer.label(inner), AlignmentAnalyzer.label(outer));
    }
}
