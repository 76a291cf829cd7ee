package com.draftlens.models;

public record StructuralIssue(
        Severity severity,
        Category category,
        String description,
        String suggestion,
        double rangeStart,
        double rangeEnd) {

    public enum Severity {
        MINOR(3),
        MODERATE(7),
        MAJOR(12);

        private final int penalty;

        Severity(int penalty) {
            this.penalty = penalty;
        }

        public int getPenalty() {
            return penalty;
        }
    }

    public enum Category {
        EXCESSIVE_INERTIA("Excessive Inertia"),
        LATE_PLOT_IGNITION("Late Plot Ignition"),
        THEMATIC_DIFFUSION("Thematic Diffusion"),
        REPETITIVE_SCENES("Repetitive Scenes"),
        PASSIVE_PROTAGONIST("Passive Protagonist"),
        MIDPOINT_SAG("Midpoint Sag"),
        PACE_PROBLEMS("Pacing Problems");

        private final String label;

        Category(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
