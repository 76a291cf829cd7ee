package com.draftlens.models;

import java.util.List;

/**
 * Inner truth against outer behavior for one character, chapter by chapter.
 */
public record CharacterAlignment(String characterName, List<DataPoint> dataPoints, GapTrend gapTrend) {

    public CharacterAlignment {
        dataPoints = dataPoints == null ? List.of() : List.copyOf(dataPoints);
    }

    /**
     * Both scores lie in [0, 1].
     */
    public record DataPoint(int chapter, double innerTruth, double outerBehavior,
                            String innerLabel, String outerLabel) {

        public double gap() {
            return Math.abs(innerTruth - outerBehavior);
        }
    }

    public enum GapTrend {
        WIDENING("Widening (Denial/Repression)"),
        STABILIZING("Stabilizing (Coping)"),
        CLOSING("Closing (Integration)"),
        COLLAPSING("Closing (Collapse)"),
        FLUCTUATING("Fluctuating");

        private final String label;

        GapTrend(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
