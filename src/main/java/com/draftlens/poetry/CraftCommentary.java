package com.draftlens.poetry;

import com.draftlens.models.PoetryInsights.CountedItem;
import com.draftlens.models.PoetryInsights.CraftBucket;
import com.draftlens.models.PoetryInsights.CraftObservation;
import com.draftlens.models.PoetryInsights.EmotionalTrajectory;
import com.draftlens.models.PoetryInsights.FormContext;
import com.draftlens.models.PoetryInsights.FormalTechnical;
import com.draftlens.models.PoetryInsights.ImagerySensory;
import com.draftlens.models.PoetryInsights.PoetryMode;
import com.draftlens.models.PoetryInsights.Sense;
import com.draftlens.models.PoetryInsights.ThemeMotif;
import com.draftlens.models.PoetryInsights.VoiceRhetoric;
import com.draftlens.models.PoetryInsights.WritersAnalysis;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Writer-facing observations derived from the poem's measured signals. Pure: the same signals
 * always produce the same commentary.
 *
 * <p>The inferred form context tempers claims that the form itself explains, e.g. low
 * enjambment in regular quatrains is expected rather than a stylistic choice.
 */
public final class CraftCommentary {

    static final double STANZAIC_RATIO = 0.60;
    static final double BALLAD_QUATRAIN_RATIO = 0.25;
    static final int LONG_POEM_LINES = 80;
    static final int LONG_POEM_STANZAS = 10;
    static final double HIGH_ENJAMBMENT = 0.6;
    static final double LOW_ENJAMBMENT = 0.3;
    static final double OPEN_FORM_ENJAMBMENT = 0.55;
    static final double FREQUENT_CAESURA = 0.25;
    static final double VARIED_LINE_LENGTH = 0.35;
    static final double ENDING_LIFT = 0.2;
    static final double ECHO_OVERLAP = 0.18;
    static final int SHORT_LINE = 35;
    static final int LONG_LINE = 70;
    static final int EXCERPT_LENGTH = 80;

    private CraftCommentary() {
    }

    public static WritersAnalysis build(CraftSignals signals) {
        List<String> lines = signals.lines();
        FormalTechnical formal = signals.formal();
        VoiceRhetoric voice = signals.voice();
        EmotionalTrajectory emotion = signals.emotion();
        ThemeMotif motif = signals.motif();
        PoetryMode mode = signals.classification().mode();
        FormContext context = formContext(mode, signals.stanzas(), formal);
        boolean stanzaic = context == FormContext.STANZAIC_NARRATIVE || context == FormContext.STANZAIC_LYRIC;

        List<CraftObservation> notes = new ArrayList<>();

        // pressure points
        String contextNote = contextNote(context);
        if (contextNote != null) {
            add(notes, CraftBucket.PRESSURE_POINTS, contextNote);
        }
        if (formal.enjambmentRate() >= HIGH_ENJAMBMENT) {
            add(notes, CraftBucket.PRESSURE_POINTS, "High enjambment (" + percent(formal.enjambmentRate())
                    + "): the poem keeps deferring closure, which can carry tension without explaining it.");
        } else if (formal.enjambmentRate() <= LOW_ENJAMBMENT) {
            if (stanzaic) {
                add(notes, CraftBucket.PRESSURE_POINTS, "Low enjambment (" + percent(formal.enjambmentRate())
                        + "): expected where rhyme and stanza reward clean landings. A few run-on lines can add "
                        + "propulsion if pacing needs it.");
            } else {
                add(notes, CraftBucket.PRESSURE_POINTS, "Low enjambment (" + percent(formal.enjambmentRate())
                        + "): lines land cleanly. A few deliberate run-on lines would change breath and urgency.");
            }
        } else {
            add(notes, CraftBucket.PRESSURE_POINTS, "Mixed closure (enjambment " + percent(formal.enjambmentRate())
                    + "): tightening or loosening line endings controls when the reader learns something.");
        }
        if (formal.caesuraRate() >= FREQUENT_CAESURA) {
            add(notes, CraftBucket.PRESSURE_POINTS, "Frequent mid-line pauses (caesura " + percent(formal.caesuraRate())
                    + "): internal pivots suit reversals and second thoughts.");
        }
        if (formal.averageLineLength() > 0) {
            double variability = formal.lineLengthStdDev() / formal.averageLineLength();
            if (variability >= VARIED_LINE_LENGTH) {
                add(notes, CraftBucket.PRESSURE_POINTS, String.format(Locale.ROOT,
                        "Line lengths vary widely (deviation/mean %.2f): the form already modulates emphasis.",
                        variability));
            }
        }
        if (!formal.notableAnaphora().isEmpty()) {
            String top = joinCounted(formal.notableAnaphora(), 2);
            if (context == FormContext.STANZAIC_NARRATIVE) {
                add(notes, CraftBucket.PRESSURE_POINTS, "Refrain signal: " + top
                        + ". In ballad-like narration repetition is often the engine; vary the refrain slightly "
                        + "at the turning point rather than dropping it.");
            } else {
                add(notes, CraftBucket.PRESSURE_POINTS, "Line openings set up a pattern: " + top
                        + ". Breaking it once can mark emphasis.");
            }
        }

        // line energy
        int openBreaks = 0;
        int hardStops = 0;
        int dashEndings = 0;
        int questionEndings = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            switch (trimmed.charAt(trimmed.length() - 1)) {
                case '?':
                    questionEndings++;
                    hardStops++;
                    break;
                case '!':
                case '.':
                case ',':
                case ';':
                case ':':
                    hardStops++;
                    break;
                case '—':
                case '–':
                    dashEndings++;
                    break;
                default:
                    openBreaks++;
            }
        }
        int totalLines = Math.max(1, lines.size());
        add(notes, CraftBucket.LINE_ENERGY, "Open line breaks: " + percent((double) openBreaks / totalLines)
                + "; hard stops: " + percent((double) hardStops / totalLines) + ". Line breaks set the poem's timing.");
        if (dashEndings > 0) {
            add(notes, CraftBucket.LINE_ENERGY, "Dash endings (" + dashEndings
                    + ") hold meaning open and can force a reread.");
        }
        if (questionEndings > 0) {
            add(notes, CraftBucket.LINE_ENERGY, "Questions (" + questionEndings
                    + ") add uncertainty, pressure without plot.");
        }
        if (voice.candidateVoltaLine() != null) {
            if (context == FormContext.STANZAIC_NARRATIVE) {
                add(notes, CraftBucket.LINE_ENERGY, "Candidate turn: line " + voice.candidateVoltaLine()
                        + ". In stanzaic narrative a turn often lands on a stanza boundary or a repeated line; "
                        + "a plainer sentence can mark it.");
            } else {
                add(notes, CraftBucket.LINE_ENERGY, "Candidate turn: line " + voice.candidateVoltaLine()
                        + ". Tightening the syntax just before it sharpens the pivot.");
            }
        }

        // image logic
        List<List<String>> tokens = signals.tokensByLine();
        if (!lines.isEmpty()) {
            int third = Math.max(1, lines.size() / 3);
            int middleEnd = Math.min(tokens.size(), third * 2);
            int lastStart = Math.max(0, tokens.size() - Math.max(1, lines.size() - 2 * third));
            add(notes, CraftBucket.IMAGE_LOGIC, "Dominant sensory cues from start to middle to end: "
                    + dominantSenses(tokens.subList(0, Math.min(third, tokens.size()))) + " / "
                    + dominantSenses(tokens.subList(Math.min(third, tokens.size()), middleEnd)) + " / "
                    + dominantSenses(tokens.subList(lastStart, tokens.size())) + ".");
        }
        ImagerySensory imagery = signals.imagery();
        if (!imagery.dominantSenses().isEmpty()) {
            add(notes, CraftBucket.IMAGE_LOGIC, "Overall dominant sensory cues: " + senseLabels(imagery.dominantSenses())
                    + ".");
        }
        if (!motif.topMotifs().isEmpty()) {
            add(notes, CraftBucket.IMAGE_LOGIC, "Recurring image words: " + joinCounted(motif.topMotifs(), 6)
                    + ". Their order can escalate, soften or turn them strange.");
        }

        // voice management
        add(notes, CraftBucket.VOICE_MANAGEMENT, "Address mode: " + voice.likelyAddressMode()
                + ". Pronouns (1st/2nd/3rd): " + voice.firstPersonPronouns() + "/" + voice.secondPersonPronouns()
                + "/" + voice.thirdPersonPronouns() + ".");
        if (context == FormContext.STANZAIC_NARRATIVE) {
            add(notes, CraftBucket.VOICE_MANAGEMENT, "Framed address is common in ballad-like poems; read the "
                    + "pronoun balance as a delivery stance, not a persona.");
        }
        if (!voice.modality().isEmpty()) {
            add(notes, CraftBucket.VOICE_MANAGEMENT, "Modality pressure: " + joinCounted(voice.modality(), 4)
                    + ". Certainty builds authority; removing it exposes vulnerability.");
        }
        if (!voice.hedges().isEmpty()) {
            add(notes, CraftBucket.VOICE_MANAGEMENT, "Hedges: " + joinCounted(voice.hedges(), 4)
                    + ". Strategic hedging can imply fear or self-protection.");
        }
        if (voice.questions() == 0 && voice.exclamations() == 0) {
            add(notes, CraftBucket.VOICE_MANAGEMENT, "No lines end in ? or !: the tone reads controlled, and restraint "
                    + "can intensify hard content.");
        }

        // emotional arc
        if (mode == PoetryMode.NARRATIVE || context == FormContext.STANZAIC_NARRATIVE) {
            add(notes, CraftBucket.EMOTIONAL_ARC, "The affect curve is a word-based estimate; in narrative poems it "
                    + "tends to follow event intensity more than the speaker's mood.");
        }
        boolean longPoem = lines.size() >= LONG_POEM_LINES || signals.stanzas().size() >= LONG_POEM_STANZAS;
        if (longPoem && !emotion.stanzaScores().isEmpty()) {
            if (emotion.peakStanza() != null) {
                add(notes, CraftBucket.EMOTIONAL_ARC, "Peak intensity around stanza " + emotion.peakStanza() + ".");
            }
            if (emotion.troughStanza() != null) {
                add(notes, CraftBucket.EMOTIONAL_ARC, "Lowest point around stanza " + emotion.troughStanza() + ".");
            }
            if (!emotion.notableShiftStanzas().isEmpty()) {
                add(notes, CraftBucket.EMOTIONAL_ARC, "Major turns by stanza: "
                        + joinNumbers(emotion.notableShiftStanzas()) + ".");
            }
            String peak = excerpt(lines, emotion.peakLine());
            if (peak != null) {
                add(notes, CraftBucket.EMOTIONAL_ARC, "Near the peak (line " + emotion.peakLine() + "): \"" + peak
                        + "\"");
            }
            String trough = excerpt(lines, emotion.troughLine());
            if (trough != null) {
                add(notes, CraftBucket.EMOTIONAL_ARC, "Near the low point (line " + emotion.troughLine() + "): \""
                        + trough + "\"");
            }
        } else {
            if (emotion.peakLine() != null) {
                add(notes, CraftBucket.EMOTIONAL_ARC, "Peak intensity around line " + emotion.peakLine() + ".");
            }
            if (emotion.troughLine() != null) {
                add(notes, CraftBucket.EMOTIONAL_ARC, "Lowest point around line " + emotion.troughLine() + ".");
            }
            if (!emotion.notableShiftLines().isEmpty()) {
                add(notes, CraftBucket.EMOTIONAL_ARC, "Notable turns near lines: "
                        + joinNumbers(emotion.notableShiftLines()) + ".");
            }
            String peak = excerpt(lines, emotion.peakLine());
            if (peak != null) {
                add(notes, CraftBucket.EMOTIONAL_ARC, "Near the peak: \"" + peak + "\"");
            }
        }
        String lastLine = lastNonBlank(lines);
        add(notes, CraftBucket.EMOTIONAL_ARC, endingMove(lastLine, emotion.lineScores()));

        // compression choices
        int explanations = 0;
        for (List<String> lineTokens : tokens) {
            for (String token : lineTokens) {
                explanations += PoetryLexicon.EXPOSITION_MARKERS.contains(token) ? 1 : 0;
            }
        }
        if (explanations <= 1) {
            add(notes, CraftBucket.COMPRESSION_CHOICES, "Few explanation markers: the poem works by implication more "
                    + "than by reasoning.");
        } else if (context == FormContext.STANZAIC_NARRATIVE) {
            add(notes, CraftBucket.COMPRESSION_CHOICES, "Explanation markers (" + explanations + "). In ballad and "
                    + "parable modes explicit causality can be part of the point; if a passage drags, fold one aside "
                    + "into a repeated line instead of cutting it.");
        } else {
            add(notes, CraftBucket.COMPRESSION_CHOICES, "Explanation markers (" + explanations + "). If the poem feels "
                    + "over-explained, compress one causal bridge and keep the logic.");
        }
        int average = formal.averageLineLength();
        if (average > 0 && average <= SHORT_LINE) {
            add(notes, CraftBucket.COMPRESSION_CHOICES, "Short lines (average " + average
                    + " chars) concentrate meaning; white space is already working.");
        } else if (average >= LONG_LINE) {
            add(notes, CraftBucket.COMPRESSION_CHOICES, "Long lines (average " + average
                    + " chars) read closer to prose; strategic cuts would raise the pressure.");
        }

        // ending strategy
        String firstLine = lines.isEmpty() ? "" : lines.get(0);
        Set<String> opening = contentWords(PoemSegmenter.tokenize(firstLine));
        Set<String> closing = contentWords(PoemSegmenter.tokenize(lastLine));
        Set<String> union = new HashSet<>(opening);
        union.addAll(closing);
        Set<String> shared = new HashSet<>(opening);
        shared.retainAll(closing);
        double overlap = (double) shared.size() / Math.max(1, union.size());
        if (overlap >= ECHO_OVERLAP) {
            add(notes, CraftBucket.ENDING_STRATEGY, "The ending echoes the opening (keyword overlap "
                    + percent(overlap) + "), which invites a reread.");
        } else {
            add(notes, CraftBucket.ENDING_STRATEGY, "The ending resists the opening (little keyword overlap) and can "
                    + "reframe the first line without mirroring it.");
        }
        if (lastLine.toLowerCase(Locale.ROOT).split(" is ", -1).length - 1 >= 2) {
            add(notes, CraftBucket.ENDING_STRATEGY, "The ending turns aphoristic (repeated \"is\" claims), which can "
                    + "override the motifs.");
        }
        List<String> endingMotifs = endingMotifs(motif, signals.stanzas());
        if (!endingMotifs.isEmpty()) {
            add(notes, CraftBucket.ENDING_STRATEGY, "The ending brings back established motifs: "
                    + String.join(", ", endingMotifs) + ".");
        }
        for (String token : PoemSegmenter.tokenize(lastLine)) {
            if (PoetryLexicon.DIRECTION_WORDS.contains(token)) {
                add(notes, CraftBucket.ENDING_STRATEGY, "The last line points somewhere; directional endings often "
                        + "land harder than concluding ones.");
                break;
            }
        }

        return new WritersAnalysis(mode, signals.classification().rationale(), context, notes);
    }

    /**
     * Long, mostly quatrain/sextet poems with alternating-rhyme quatrains read as ballad-like
     * narrative; other regular stanzas as stanzaic lyric; few stanzas or heavy enjambment as open form.
     */
    static FormContext formContext(PoetryMode mode, List<List<String>> stanzas, FormalTechnical formal) {
        if (stanzas.isEmpty()) {
            return FormContext.MIXED;
        }
        int regular = 0;
        for (List<String> stanza : stanzas) {
            if (stanza.size() == 4 || stanza.size() == 6) {
                regular++;
            }
        }
        double stanzaicRatio = (double) regular / stanzas.size();

        int quatrains = 0;
        int balladQuatrains = 0;
        for (String scheme : formal.rhymeSchemeByStanza()) {
            if (scheme.length() == 4) {
                quatrains++;
                if (isAlternatingQuatrain(scheme)) {
                    balladQuatrains++;
                }
            }
        }
        double balladRatio = quatrains == 0 ? 0.0 : (double) balladQuatrains / quatrains;

        boolean longPoem = formal.lineCount() >= LONG_POEM_LINES || formal.stanzaCount() >= LONG_POEM_STANZAS;
        if (longPoem && stanzaicRatio >= STANZAIC_RATIO
                && (mode == PoetryMode.NARRATIVE || mode == PoetryMode.HYBRID)
                && balladRatio >= BALLAD_QUATRAIN_RATIO) {
            return FormContext.STANZAIC_NARRATIVE;
        }
        if (stanzaicRatio >= STANZAIC_RATIO) {
            return FormContext.STANZAIC_LYRIC;
        }
        if (formal.stanzaCount() <= 2 || formal.enjambmentRate() >= OPEN_FORM_ENJAMBMENT) {
            return FormContext.OPEN_FORM;
        }
        return FormContext.MIXED;
    }

    /**
     * ABAB or ABCB. Lines without a rhyme key never match.
     */
    static boolean isAlternatingQuatrain(String scheme) {
        if (scheme.length() != 4 || scheme.indexOf('-') >= 0) {
            return false;
        }
        char a = scheme.charAt(0);
        char b = scheme.charAt(1);
        char c = scheme.charAt(2);
        char d = scheme.charAt(3);
        if (a == c && b == d && a != b) {
            return true;
        }
        return b == d && a != b && c != b;
    }

    static String endingMove(String lastLine, List<Double> lineScores) {
        String trimmed = lastLine.trim();
        char last = trimmed.isEmpty() ? ' ' : trimmed.charAt(trimmed.length() - 1);
        switch (last) {
            case '?':
                return "Ends in suspension (question).";
            case '!':
                return "Ends with a surge (exclamation).";
            case '—':
            case '–':
                return "Ends in refusal or suspension (dash).";
            default:
                break;
        }
        int from = Math.max(0, lineScores.size() - 3);
        double sum = 0;
        for (int i = from; i < lineScores.size(); i++) {
            sum += lineScores.get(i);
        }
        double tail = lineScores.size() == from ? 0.0 : sum / (lineScores.size() - from);
        if (tail >= ENDING_LIFT) {
            return "Ends with emotional lift.";
        }
        if (tail <= -ENDING_LIFT) {
            return "Ends darkening, in unease.";
        }
        return "Ends without clear resolution (steady state).";
    }

    private static String contextNote(FormContext context) {
        switch (context) {
            case STANZAIC_NARRATIVE:
                return "Form context: likely stanzaic narrative (ballad-like). Quatrain and sextet structure explains "
                        + "much of the line-ending behavior, so read those numbers as constraints before choices.";
            case STANZAIC_LYRIC:
                return "Form context: stanzaic. Regular stanzas give lines natural landing places, which skews "
                        + "line-ending numbers toward closure.";
            case OPEN_FORM:
                return "Form context: open form. Line breaks carry more of the meaning here, so enjambment is more "
                        + "likely a deliberate choice.";
            default:
                return null;
        }
    }

    private static List<String> endingMotifs(ThemeMotif motif, List<List<String>> stanzas) {
        List<String> found = new ArrayList<>();
        if (stanzas.isEmpty()) {
            return found;
        }
        Set<String> lastStanza = new HashSet<>();
        for (String line : stanzas.get(stanzas.size() - 1)) {
            lastStanza.addAll(contentWords(PoemSegmenter.tokenize(line)));
        }
        List<CountedItem> top = motif.topMotifs();
        for (int i = 0; i < top.size() && i < 6 && found.size() < 3; i++) {
            if (lastStanza.contains(top.get(i).text())) {
                found.add(top.get(i).text());
            }
        }
        return found;
    }

    private static String dominantSenses(List<List<String>> tokens) {
        List<Sense> dominant = PoetryAnalyzer.imagery(tokens).dominantSenses();
        return dominant.isEmpty() ? "(none detected)" : senseLabels(dominant);
    }

    private static String senseLabels(List<Sense> senses) {
        List<String> labels = new ArrayList<>();
        for (Sense sense : senses) {
            labels.add(sense.getLabel());
        }
        return String.join(", ", labels);
    }

    private static Set<String> contentWords(List<String> tokens) {
        Set<String> words = new HashSet<>();
        for (String token : tokens) {
            if (PoetryLexicon.isContentWord(token)) {
                words.add(token);
            }
        }
        return words;
    }

    private static String excerpt(List<String> lines, Integer lineNumber) {
        if (lineNumber == null || lineNumber < 1 || lineNumber > lines.size()) {
            return null;
        }
        String raw = lines.get(lineNumber - 1).trim();
        if (raw.isEmpty()) {
            return null;
        }
        return raw.length() <= EXCERPT_LENGTH ? raw : raw.substring(0, EXCERPT_LENGTH) + "…";
    }

    private static String lastNonBlank(List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (!lines.get(i).isBlank()) {
                return lines.get(i);
            }
        }
        return "";
    }

    private static String joinCounted(List<CountedItem> items, int limit) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < items.size() && i < limit; i++) {
            parts.add(items.get(i).describe());
        }
        return String.join(", ", parts);
    }

    private static String joinNumbers(List<Integer> numbers) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < numbers.size() && i < 6; i++) {
            parts.add(String.valueOf(numbers.get(i)));
        }
        return String.join(", ", parts);
    }

    private static String percent(double value) {
        return "about " + Math.round(value * 100) + "%";
    }

    private static void add(List<CraftObservation> notes, CraftBucket bucket, String text) {
        notes.add(new CraftObservation(bucket, text));
    }
}
