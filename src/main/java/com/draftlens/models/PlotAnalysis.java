package com.draftlens.models;

import java.util.List;

/**
 * Tension curve, structural beats and format-specific scores for a novel or screenplay.
 * Novel-only scores are 0 for screenplays and vice versa.
 */
public record PlotAnalysis(
        DocumentFormat documentFormat,
        double formatConfidence,
        List<PlotPoint> plotPoints,
        List<TensionPoint> tensionCurve,
        int structureScore,
        List<String> missingPoints,
        List<StructuralIssue> structuralIssues,
        int internalChangeScore,
        int thematicResonance,
        int narrativeMomentum,
        int visualCausalityScore,
        int sceneEfficiency,
        int pacingScore,
        int estimatedRuntime) {

    public PlotAnalysis {
        plotPoints = plotPoints == null ? List.of() : List.copyOf(plotPoints);
        tensionCurve = tensionCurve == null ? List.of() : List.copyOf(tensionCurve);
        missingPoints = missingPoints == null ? List.of() : List.copyOf(missingPoints);
        structuralIssues = structuralIssues == null ? List.of() : List.copyOf(structuralIssues);
    }
}
