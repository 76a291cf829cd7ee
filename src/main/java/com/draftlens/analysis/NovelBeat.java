package com.draftlens.analysis;

/**
 * Architectural beats of a novel, in story order, with where each is expected to land.
 */
public enum NovelBeat {
    OPENING_STATE("Opening State", 0.02,
            "What worldview and tonal contract does this establish?",
            "Weak or unclear tonal contract with the reader"),
    INCITING_DISRUPTION("Inciting Disruption", 0.12,
            "Does this force a choice, not just reveal information?",
            "Late plot ignition or passive discovery"),
    FIRST_COMMITMENT("First Commitment", 0.25,
            "Is this a clear turn where the protagonist acts?",
            "Hesitation without commitment"),
    PROGRESSIVE_COMPLICATIONS("Progressive Complications", 0.35,
            "What changes internally in this span?",
            "Excessive inertia or over-indulgent introspection"),
    MIDPOINT_REVERSAL("Midpoint Reversal", 0.50,
            "Does this change what success looks like?",
            "Thematic diffusion, no redefinition of success"),
    ESCALATING_COSTS("Escalating Costs", 0.62,
            "Does every gain create a new, worse problem?",
            "Moral complexity doesn't increase"),
    CRISIS("Crisis / Lowest Point", 0.75,
            "Is this unfixable by the old belief?",
            "Crisis could be solved by old belief"),
    FINAL_CHOICE("Final Choice", 0.85,
            "Is there internal reconciliation with belief?",
            "No internal reconciliation"),
    CLIMAX("Climax", 0.92,
            "Does meaning crystallize here?",
            "Meaning doesn't crystallize"),
    AFTERMATH("Aftermath", 0.98,
            "Does this echo and transform the opening state?",
            "No resonance with opening");

    private final String label;
    private final double expectedPosition;
    private final String analysisQuestion;
    private final String failureDescription;

    NovelBeat(String label, double expectedPosition, String analysisQuestion, String failureDescription) {
        this.label = label;
        this.expectedPosition = expectedPosition;
        this.analysisQuestion = analysisQuestion;
        this.failureDescription = failureDescription;
    }

    public String getLabel() {
        return label;
    }

    public double getExpectedPosition() {
        return expectedPosition;
    }

    public String getAnalysisQuestion() {
        return analysisQuestion;
    }

    public String getFailureDescription() {
        return failureDescription;
    }

    public static NovelBeat at(double position) {
        if (position < 0.05) {
            return OPENING_STATE;
        } else if (position < 0.18) {
            return INCITING_DISRUPTION;
        } else if (position < 0.30) {
            return FIRST_COMMITMENT;
        } else if (position < 0.45) {
            return PROGRESSIVE_COMPLICATIONS;
        } else if (position < 0.55) {
            return MIDPOINT_REVERSAL;
        } else if (position < 0.70) {
            return ESCALATING_COSTS;
        } else if (position < 0.82) {
            return CRISIS;
        } else if (position < 0.90) {
            return FINAL_CHOICE;
        } else if (position < 0.96) {
            return CLIMAX;
        }
        return AFTERMATH;
    }
}
