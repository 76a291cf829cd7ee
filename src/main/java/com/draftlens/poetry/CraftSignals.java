package com.draftlens.poetry;

import com.draftlens.models.PoetryInsights.EmotionalTrajectory;
import com.draftlens.models.PoetryInsights.FormalTechnical;
import com.draftlens.models.PoetryInsights.ImagerySensory;
import com.draftlens.models.PoetryInsights.ThemeMotif;
import com.draftlens.models.PoetryInsights.VoiceRhetoric;

import java.util.List;

/**
 * Everything the craft commentary reads. Lines and tokens are aligned by index.
 */
public record CraftSignals(
        List<String> lines,
        List<List<String>> stanzas,
        List<List<String>> tokensByLine,
        FormalTechnical formal,
        ImagerySensory imagery,
        VoiceRhetoric voice,
        EmotionalTrajectory emotion,
        ThemeMotif motif,
        PoetryModeClassifier.Classification classification) {

    public CraftSignals {
        lines = List.copyOf(lines);
        stanzas = List.copyOf(stanzas);
        tokensByLine = List.copyOf(tokensByLine);
    }
}
