package com.draftlens.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Structural, sensory, rhetorical and emotional reading of a poem, plus writer-facing commentary.
 * Line and stanza numbers are 1-based; stanza indexes in {@link MacroStructure} are 0-based.
 */
public record PoetryInsights(
        FormalTechnical formal,
        ImagerySensory imagery,
        VoiceRhetoric voice,
        EmotionalTrajectory emotion,
        ThemeMotif motif,
        MacroStructure structure,
        WritersAnalysis writers) {

    public record CountedItem(String text, int count) {

        public String describe() {
            return text + " (" + count + "×)";
        }
    }

    public record FormalTechnical(
            int lineCount,
            int stanzaCount,
            int averageLineLength,
            double lineLengthStdDev,
            double enjambmentRate,
            double caesuraRate,
            List<String> rhymeSchemeByStanza,
            List<CountedItem> notableRepetitions,
            List<CountedItem> notableAnaphora,
            List<String> alliterationExamples) {

        public FormalTechnical {
            rhymeSchemeByStanza = copy(rhymeSchemeByStanza);
            notableRepetitions = copy(notableRepetitions);
            notableAnaphora = copy(notableAnaphora);
            alliterationExamples = copy(alliterationExamples);
        }
    }

    public enum Sense {
        VISUAL("Visual"),
        AUDITORY("Auditory"),
        TACTILE("Tactile"),
        OLFACTORY("Olfactory"),
        GUSTATORY("Gustatory"),
        KINESTHETIC("Kinesthetic");

        private final String label;

        Sense(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    public record ImagerySensory(
            Map<Sense, Integer> countsBySense,
            List<Sense> dominantSenses,
            List<CountedItem> topSensoryTokens) {

        public ImagerySensory {
            EnumMap<Sense, Integer> counts = new EnumMap<>(Sense.class);
            if (countsBySense != null) {
                counts.putAll(countsBySense);
            }
            countsBySense = Collections.unmodifiableMap(counts);
            dominantSenses = copy(dominantSenses);
            topSensoryTokens = copy(topSensoryTokens);
        }
    }

    /**
     * @param candidateVoltaLine first line carrying a turn cue, or null
     */
    public record VoiceRhetoric(
            int firstPersonPronouns,
            int secondPersonPronouns,
            int thirdPersonPronouns,
            int questions,
            int exclamations,
            List<CountedItem> hedges,
            List<CountedItem> modality,
            String likelyAddressMode,
            Integer candidateVoltaLine) {

        public VoiceRhetoric {
            hedges = copy(hedges);
            modality = copy(modality);
        }
    }

    /**
     * @param notableShiftLines 1-based lines where the three largest line-to-line swings start, plus the
     *                          volta line when one was found
     * @param notableShiftStanzas the same for stanza averages, plus the stanza holding the volta
     */
    public record EmotionalTrajectory(
            List<Double> lineScores,
            List<Double> stanzaScores,
            Integer peakLine,
            Integer troughLine,
            Integer peakStanza,
            Integer troughStanza,
            double volatility,
            List<Integer> notableShiftLines,
            List<Integer> notableShiftStanzas) {

        public EmotionalTrajectory {
            lineScores = copy(lineScores);
            stanzaScores = copy(stanzaScores);
            notableShiftLines = copy(notableShiftLines);
            notableShiftStanzas = copy(notableShiftStanzas);
        }
    }

    public record ThemeMotif(List<CountedItem> topMotifs, List<CountedItem> repeatedPhrases) {

        public ThemeMotif {
            topMotifs = copy(topMotifs);
            repeatedPhrases = copy(repeatedPhrases);
        }
    }

    public record MacroStructure(List<Integer> stanzaLineCounts, Integer longestStanzaIndex, Integer shortestStanzaIndex) {

        public MacroStructure {
            stanzaLineCounts = copy(stanzaLineCounts);
        }
    }

    public enum PoetryMode {
        LYRIC("Lyric"),
        CONTEMPLATIVE("Contemplative"),
        NARRATIVE("Narrative"),
        HYBRID("Hybrid");

        private final String label;

        PoetryMode(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    public enum FormContext {
        STANZAIC_NARRATIVE,
        STANZAIC_LYRIC,
        OPEN_FORM,
        MIXED
    }

    public enum CraftBucket {
        PRESSURE_POINTS,
        LINE_ENERGY,
        IMAGE_LOGIC,
        VOICE_MANAGEMENT,
        EMOTIONAL_ARC,
        COMPRESSION_CHOICES,
        ENDING_STRATEGY
    }

    public record CraftObservation(CraftBucket bucket, String text) {
    }

    public record WritersAnalysis(
            PoetryMode mode,
            String modeRationale,
            FormContext formContext,
            List<CraftObservation> observations) {

        public WritersAnalysis {
            observations = copy(observations);
        }

        public List<String> observationsFor(CraftBucket bucket) {
            List<String> texts = new ArrayList<>();
            for (CraftObservation observation : observations) {
                if (observation.bucket() == bucket) {
                    texts.add(observation.text());
                }
            }
            return texts;
        }
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
