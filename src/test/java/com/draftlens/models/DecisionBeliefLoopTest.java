package com.draftlens.models;

import com.draftlens.models.DecisionBeliefLoop.ArcQuality;
import com.draftlens.models.DecisionBeliefLoop.LoopEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionBeliefLoopTest {

    private static LoopEntry entry(int chapter, String belief, String shift) {
        return new LoopEntry(chapter, 0, "pressure", belief, "decision", "outcome", shift);
    }

    @Test
    void fewerThanTwoEntriesIsInsufficient() {
        assertEquals(ArcQuality.INSUFFICIENT, DecisionBeliefLoop.of("Mara", List.of()).arcQuality());
        assertEquals(ArcQuality.INSUFFICIENT,
                DecisionBeliefLoop.of("Mara", List.of(entry(1, "fear", "none"))).arcQuality());
    }

    @Test
    void sameBeliefAndShiftIsFlat() {
        DecisionBeliefLoop loop = DecisionBeliefLoop.of("Mara",
                List.of(entry(1, "Fear", "none"), entry(2, " fear ", "NONE")));

        assertEquals(ArcQuality.FLAT, loop.arcQuality());
    }

    @Test
    void changingBeliefWithOneShiftIsDeveloping() {
        DecisionBeliefLoop loop = DecisionBeliefLoop.of("Mara",
                List.of(entry(1, "fear", "none"), entry(2, "hope", "none")));

        assertEquals(ArcQuality.DEVELOPING, loop.arcQuality());
    }

    @Test
    void changingBeliefsAndShiftsIsEvolving() {
        DecisionBeliefLoop loop = DecisionBeliefLoop.of("Mara",
                List.of(entry(1, "fear", "none"), entry(2, "hope", "doubts her father")));

        assertEquals(ArcQuality.EVOLVING, loop.arcQuality());
        assertEquals("Evolving Arc - Clear pattern change", loop.arcQuality().getLabel());
    }

    @Test
    void explicitQualityIsKept() {
        DecisionBeliefLoop loop = new DecisionBeliefLoop("Mara",
                List.of(entry(1, "fear", "none"), entry(2, "fear", "none")), ArcQuality.EVOLVING);

        assertEquals(ArcQuality.EVOLVING, loop.arcQuality());
    }
}
