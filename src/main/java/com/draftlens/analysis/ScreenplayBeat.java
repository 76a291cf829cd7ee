package com.draftlens.analysis;

/**
 * Mechanical beats of a feature screenplay, positioned against a 120-page script.
 */
public enum ScreenplayBeat {
    OPENING_IMAGE("Opening Image", 0.01,
            "Is there a visible contradiction or unease?",
            "No visual hook or contradiction"),
    INCITING_INCIDENT("Inciting Incident", 0.10,
            "Is this external, observable, and does it change the situation?",
            "Internal/invisible inciting incident"),
    LOCK_IN("Lock In (End Act I)", 0.25,
            "Does the protagonist clearly act, not just decide?",
            "Passive protagonist, no clear action"),
    FIRST_SEQUENCE("First Sequence", 0.30,
            "Does each scene advance plot, escalate stakes, and end with a turn?",
            "Scenes without visible turns"),
    RISING_COMPLICATIONS("Rising Complications", 0.40,
            "Does each scene have a visible objective and turn?",
            "Repetitive scenes without escalation"),
    MIDPOINT_REVERSAL("Midpoint Reversal", 0.50,
            "Is this a visible reversal (victory to defeat, safety to danger)?",
            "Midpoint sag, no power shift"),
    BAD_GUYS_CLOSE_IN("Bad Guys Close In", 0.60,
            "Are options visibly narrowing?",
            "Stakes remain static"),
    ALL_IS_LOST("All Is Lost", 0.75,
            "Is the protagonist situationally trapped or stripped of power?",
            "Protagonist not truly trapped"),
    DARK_NIGHT("Dark Night of Soul", 0.80,
            "Is there a moment of reflection before action?",
            "Missing emotional beat"),
    THIRD_ACT_BREAK("Third Act Break", 0.85,
            "Is there a decisive action under pressure?",
            "Third-act solution not earned visually"),
    FINALE("Finale", 0.95,
            "Is there clear physical or strategic resolution?",
            "Invisible stakes in resolution"),
    CLOSING_IMAGE("Closing Image", 0.99,
            "Does this mirror the opening with changed behavior?",
            "No visual bookend");

    static final int REFERENCE_PAGES = 120;

    private final String label;
    private final double expectedPosition;
    private final String analysisQuestion;
    private final String failureDescription;

    ScreenplayBeat(String label, double expectedPosition, String analysisQuestion, String failureDescription) {
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

    public int getExpectedPage() {
        return (int) (expectedPosition * REFERENCE_PAGES);
    }

    public String getAnalysisQuestion() {
        return analysisQuestion;
    }

    public String getFailureDescription() {
        return failureDescription;
    }

    public static ScreenplayBeat at(double position) {
        if (position < 0.05) {
            return OPENING_IMAGE;
        } else if (position < 0.15) {
            return INCITING_INCIDENT;
        } else if (position < 0.28) {
            return LOCK_IN;
        } else if (position < 0.38) {
            return FIRST_SEQUENCE;
        } else if (position < 0.48) {
            return RISING_COMPLICATIONS;
        } else if (position < 0.55) {
            return MIDPOINT_REVERSAL;
        } else if (position < 0.68) {
            return BAD_GUYS_CLOSE_IN;
        } else if (position < 0.78) {
            return ALL_IS_LOST;
        } else if (position < 0.83) {
            return DARK_NIGHT;
        } else if (position < 0.90) {
            return THIRD_ACT_BREAK;
        } else if (position < 0.97) {
            return FINALE;
        }
        return CLOSING_IMAGE;
    }
}
