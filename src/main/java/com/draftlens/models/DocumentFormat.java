package com.draftlens.models;

public enum DocumentFormat {
    NOVEL("Novel", "Novel structure prioritizes meaning over motion, with elastic units and interior change."),
    SCREENPLAY("Screenplay", "Screenplay structure prioritizes motion that creates meaning, with fixed units and visual causality.");

    private final String label;
    private final String description;

    DocumentFormat(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }
}
