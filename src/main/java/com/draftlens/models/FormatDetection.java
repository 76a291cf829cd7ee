package com.draftlens.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of a format detector: the chosen format and a confidence in [0, 1].
 */
public record FormatDetection(DocumentFormat format, double confidence) {

    public static FormatDetection undecided() {
        return new FormatDetection(DocumentFormat.NOVEL, 0.5);
    }

    @JsonIgnore
    public boolean isScreenplay() {
        return format == DocumentFormat.SCREENPLAY;
    }
}
