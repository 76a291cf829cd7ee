package com.draftlens.poetry;

import com.draftlens.models.PoetryInsights;
import com.draftlens.models.PoetryInsights.CountedItem;
import com.draftlens.models.PoetryInsights.EmotionalTrajectory;
import com.draftlens.models.PoetryInsights.FormalTechnical;
import com.draftlens.models.PoetryInsights.ImagerySensory;
import com.draftlens.models.PoetryInsights.MacroStructure;
import com.draftlens.models.PoetryInsights.Sense;
import com.draftlens.models.PoetryInsights.ThemeMotif;
import com.draftlens.models.PoetryInsights.VoiceRhetoric;
import com.draftlens.models.PoetryInsights.WritersAnalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Structural, sensory, rhetorical and emotional reading of a poem.
 *
 * <p>Everything here is lexical: rhyme is approximated by end-word suffixes and affect by two
 * small sentiment lists. Line numbers in the output are 1-based.
 */
public final class PoetryAnalyzer {

    public static final int MIN_LINES = 2;

    static final int RHYME_KEY_LENGTH = 3;
    static final int REPETITION_LIMIT = 8;
    static final int ANAPHORA_LIMIT = 6;
    static final int ALLITERATION_LIMIT = 6;
    static final int SENSORY_TOKEN_LIMIT = 8;
    static final int COUNTED_LIMIT = 6;
    static final int MOTIF_LIMIT = 10;
    static final int NOTABLE_SHIFTS = 3;
    static final double EXCLAMATION_BOOST = 1.15;
    static final double INTENSIFIER_STEP = 0.05;
    static final double MAX_INTENSIFIER_BOOST = 0.25;

    private static final String CLOSING_PUNCTUATION = ".,;:!?\"'”)»—–";
    private static final String CAESURA_MARKS = "—:;,";

    private PoetryAnalyzer() {
    }

    /**
     * Returns null when the body has fewer than {@link #MIN_LINES} lines.
     */
    public static PoetryInsights analyze(String text) {
        List<List<String>> stanzas = PoemSegmenter.stanzas(PoemSegmenter.bodyLines(text));
        List<String> lines = new ArrayList<>();
        for (List<String> stanza : stanzas) {
            lines.addAll(stanza);
        }
        if (lines.size() < MIN_LINES) {
            return null;
        }
        List<List<String>> tokensByLine = new ArrayList<>();
        for (String line : lines) {
            tokensByLine.add(PoemSegmenter.tokenize(line));
        }
        List<Integer> stanzaLineCounts = new ArrayList<>();
        for (List<String> stanza : stanzas) {
            stanzaLineCounts.add(stanza.size());
        }

        FormalTechnical formal = formal(stanzas, lines, tokensByLine);
        ImagerySensory imagery = imagery(tokensByLine);
        VoiceRhetoric voice = voice(lines, tokensByLine);
        EmotionalTrajectory emotion = emotion(lines, tokensByLine, stanzaLineCounts, voice.candidateVoltaLine());
        ThemeMotif motif = motifs(tokensByLine);
        MacroStructure structure = structure(stanzaLineCounts);

        CraftSignals signals = new CraftSignals(lines, stanzas, tokensByLine, formal, imagery, voice, emotion, motif,
                PoetryModeClassifier.classify(lines, tokensByLine));
        WritersAnalysis writers = CraftCommentary.build(signals);
        return new PoetryInsights(formal, imagery, voice, emotion, motif, structure, writers);
    }

    static FormalTechnical formal(List<List<String>> stanzas, List<String> lines, List<List<String>> tokensByLine) {
        int totalLength = 0;
        List<Double> lengths = new ArrayList<>();
        for (String line : lines) {
            int length = line.trim().length();
            totalLength += length;
            lengths.add((double) length);
        }
        int averageLength = lines.isEmpty() ? 0 : (int) Math.round((double) totalLength / lines.size());

        List<String> schemes = new ArrayList<>();
        for (List<String> stanza : stanzas) {
            schemes.add(rhymeScheme(stanza));
        }

        Map<String, Integer> wordCounts = new HashMap<>();
        Map<String, Integer> openings = new HashMap<>();
        for (List<String> tokens : tokensByLine) {
            List<String> leading = new ArrayList<>();
            for (String token : tokens) {
                if (PoetryLexicon.isContentWord(token)) {
                    wordCounts.merge(token, 1, Integer::sum);
                }
                if (!PoetryLexicon.STOPWORDS.contains(token)) {
                    leading.add(token);
                }
            }
            if (!leading.isEmpty()) {
                openings.merge(leading.get(0), 1, Integer::sum);
            }
            if (leading.size() >= 2) {
                openings.merge(leading.get(0) + " " + leading.get(1), 1, Integer::sum);
            }
        }

        return new FormalTechnical(
                lines.size(),
                stanzas.size(),
                averageLength,
                sampleStdDev(lengths),
                enjambmentRate(lines),
                caesuraRate(lines),
                schemes,
                topCounted(wordCounts, REPETITION_LIMIT, 2),
                topCounted(openings, ANAPHORA_LIMIT, 2),
                alliteration(lines, ALLITERATION_LIMIT));
    }

    /**
     * Last letters of the line's final word, or "" when it has none.
     */
    static String rhymeKey(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String[] pieces = trimmed.split("\\s+");
        String cleaned = pieces[pieces.length - 1].toLowerCase(Locale.ROOT).replaceAll("[^a-z']", "");
        if (cleaned.length() <= RHYME_KEY_LENGTH) {
            return cleaned;
        }
        return cleaned.substring(cleaned.length() - RHYME_KEY_LENGTH);
    }

    /**
     * One letter per line, A for the first key, B for the next new key and so on; "-" for lines
     * without a usable end word.
     */
    static String rhymeScheme(List<String> stanza) {
        Map<String, Character> letters = new HashMap<>();
        char next = 'A';
        StringBuilder scheme = new StringBuilder();
        for (String line : stanza) {
            String key = rhymeKey(line);
            if (key.isEmpty()) {
                scheme.append('-');
                continue;
            }
            Character letter = letters.get(key);
            if (letter == null) {
                letter = next++;
                letters.put(key, letter);
            }
            scheme.append(letter);
        }
        return scheme.toString();
    }

    static double enjambmentRate(List<String> lines) {
        if (lines.isEmpty()) {
            return 0.0;
        }
        int open = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && CLOSING_PUNCTUATION.indexOf(trimmed.charAt(trimmed.length() - 1)) < 0) {
                open++;
            }
        }
        return (double) open / lines.size();
    }

    /**
     * A caesura is a pause mark in the first half of the line with more than two characters of
     * content after the midpoint.
     */
    static double caesuraRate(List<String> lines) {
        if (lines.isEmpty()) {
            return 0.0;
        }
        int count = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int mid = trimmed.length() / 2;
            String left = trimmed.substring(0, mid);
            String right = trimmed.substring(mid).trim();
            boolean paused = false;
            for (int i = 0; i < left.length(); i++) {
                if (CAESURA_MARKS.indexOf(left.charAt(i)) >= 0) {
                    paused = true;
                    break;
                }
            }
            if (paused && right.length() > 2) {
                count++;
            }
        }
        return (double) count / lines.size();
    }

    /**
     * Per line, the longest run of consecutive words sharing an initial letter, when it is at least 2.
     */
    static List<String> alliteration(List<String> lines, int limit) {
        List<String> examples = new ArrayList<>();
        for (int i = 0; i < lines.size() && examples.size() < limit; i++) {
            Character runLetter = null;
            int runLength = 0;
            Character bestLetter = null;
            int bestLength = 1;
            for (String word : lines.get(i).trim().split("\\s+")) {
                String cleaned = word.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
                if (cleaned.isEmpty()) {
                    continue;
                }
                char initial = cleaned.charAt(0);
                if (runLetter != null && runLetter == initial) {
                    runLength++;
                } else {
                    runLetter = initial;
                    runLength = 1;
                }
                if (runLength > bestLength) {
                    bestLetter = runLetter;
                    bestLength = runLength;
                }
            }
            if (bestLetter != null) {
                examples.add(String.format("Line %d: repeated initial '%c' (%d×)", i + 1, bestLetter, bestLength));
            }
        }
        return examples;
    }

    static ImagerySensory imagery(List<List<String>> tokensByLine) {
        Map<Sense, Integer> counts = new EnumMap<>(Sense.class);
        for (Sense sense : Sense.values()) {
            counts.put(sense, 0);
        }
        Map<String, Integer> tokenCounts = new HashMap<>();
        for (List<String> tokens : tokensByLine) {
            for (String token : tokens) {
                for (Map.Entry<Sense, Set<String>> entry : PoetryLexicon.SENSES.entrySet()) {
                    if (entry.getValue().contains(token)) {
                        counts.merge(entry.getKey(), 1, Integer::sum);
                        tokenCounts.merge(token, 1, Integer::sum);
                        break;
                    }
                }
            }
        }
        List<Sense> ranked = new ArrayList<>(counts.keySet());
        ranked.sort(Comparator.comparing((Sense s) -> counts.get(s)).reversed()
                .thenComparing(Sense::getLabel));
        List<Sense> dominant = new ArrayList<>();
        for (Sense sense : ranked) {
            if (counts.get(sense) > 0 && dominant.size() < 2) {
                dominant.add(sense);
            }
        }
        return new ImagerySensory(counts, dominant, topCounted(tokenCounts, SENSORY_TOKEN_LIMIT, 1));
    }

    static VoiceRhetoric voice(List<String> lines, List<List<String>> tokensByLine) {
        int first = 0;
        int second = 0;
        int third = 0;
        int questions = 0;
        int exclamations = 0;
        int narrativeVerbs = 0;
        int quotedLines = 0;
        Map<String, Integer> hedges = new HashMap<>();
        Map<String, Integer> modality = new HashMap<>();
        Integer volta = null;

        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            if (trimmed.endsWith("?")) {
                questions++;
            }
            if (trimmed.endsWith("!")) {
                exclamations++;
            }
            if (trimmed.contains("\"") || trimmed.contains("“") || trimmed.contains("”")) {
                quotedLines++;
            }
            boolean hasCue = false;
            for (String token : tokensByLine.get(i)) {
                first += PoetryLexicon.FIRST_PERSON.contains(token) ? 1 : 0;
                second += PoetryLexicon.SECOND_PERSON.contains(token) ? 1 : 0;
                third += PoetryLexicon.THIRD_PERSON.contains(token) ? 1 : 0;
                narrativeVerbs += PoetryLexicon.NARRATIVE_VERBS.contains(token) ? 1 : 0;
                if (PoetryLexicon.HEDGES.contains(token)) {
                    hedges.merge(token, 1, Integer::sum);
                }
                if (PoetryLexicon.MODALITY.contains(token)) {
                    modality.merge(token, 1, Integer::sum);
                }
                hasCue |= PoetryLexicon.VOLTA_CUES.contains(token);
            }
            if (volta == null && hasCue) {
                volta = i + 1;
            }
        }

        String addressMode;
        if (second > first && second > 0) {
            addressMode = "Address (speaker to you)";
        } else if (third > Math.max(first, second) && (narrativeVerbs >= 6 || quotedLines >= 2)) {
            addressMode = "Narrative voice (speaker to scene)";
        } else if (first > 0) {
            addressMode = "First-person stance (speaker-centered)";
        } else {
            addressMode = "Observational / descriptive";
        }

        return new VoiceRhetoric(first, second, third, questions, exclamations,
                topCounted(hedges, COUNTED_LIMIT, 1), topCounted(modality, COUNTED_LIMIT, 1), addressMode, volta);
    }

    /**
     * Notable shifts name the line (or stanza) a large swing lands on. The volta line and its
     * stanza are always included.
     */
    static EmotionalTrajectory emotion(List<String> lines, List<List<String>> tokensByLine,
                                       List<Integer> stanzaLineCounts, Integer voltaLine) {
        List<Double> scores = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            scores.add(lineScore(lines.get(i), tokensByLine.get(i)));
        }

        List<Double> stanzaScores = new ArrayList<>();
        int cursor = 0;
        for (int count : stanzaLineCounts) {
            if (count <= 0) {
                continue;
            }
            if (cursor >= scores.size()) {
                break;
            }
            int end = Math.min(scores.size(), cursor + count);
            stanzaScores.add(mean(scores.subList(cursor, end)));
            cursor = end;
        }

        List<Double> deltas = absoluteDeltas(scores);
        double volatility = deltas.isEmpty() ? 0.0 : mean(deltas);

        List<Integer> shiftLines = largestShifts(deltas);
        if (voltaLine != null && !shiftLines.contains(voltaLine)) {
            shiftLines.add(voltaLine);
            Collections.sort(shiftLines);
        }

        List<Integer> shiftStanzas = largestShifts(absoluteDeltas(stanzaScores));
        if (voltaLine != null) {
            int lineCursor = 0;
            for (int s = 0; s < stanzaLineCounts.size(); s++) {
                int count = stanzaLineCounts.get(s);
                if (voltaLine > lineCursor && voltaLine <= lineCursor + count) {
                    if (!shiftStanzas.contains(s + 1)) {
                        shiftStanzas.add(s + 1);
                        Collections.sort(shiftStanzas);
                    }
                    break;
                }
                lineCursor += count;
            }
        }

        return new EmotionalTrajectory(
                scores,
                stanzaScores,
                oneBased(argMax(scores)),
                oneBased(argMin(scores)),
                oneBased(argMax(stanzaScores)),
                oneBased(argMin(stanzaScores)),
                volatility,
                shiftLines,
                shiftStanzas);
    }

    static double lineScore(String line, List<String> tokens) {
        int positive = 0;
        int negative = 0;
        int amplifiers = 0;
        for (String token : tokens) {
            positive += PoetryLexicon.POSITIVE.contains(token) ? 1 : 0;
            negative += PoetryLexicon.NEGATIVE.contains(token) ? 1 : 0;
            amplifiers += PoetryLexicon.INTENSIFIERS.contains(token) ? 1 : 0;
        }
        double score = (double) (positive - negative) / Math.max(1, positive + negative);
        if (line.trim().endsWith("!")) {
            score = clamp(score * EXCLAMATION_BOOST);
        }
        if (amplifiers > 0) {
            score = clamp(score * (1.0 + Math.min(MAX_INTENSIFIER_BOOST, amplifiers * INTENSIFIER_STEP)));
        }
        return score;
    }

    static ThemeMotif motifs(List<List<String>> tokensByLine) {
        Map<String, Integer> counts = new HashMap<>();
        Map<String, Integer> bigrams = new HashMap<>();
        for (List<String> tokens : tokensByLine) {
            List<String> content = new ArrayList<>();
            for (String token : tokens) {
                if (PoetryLexicon.isContentWord(token)) {
                    content.add(token);
                    counts.merge(token, 1, Integer::sum);
                }
            }
            for (int i = 0; i + 1 < content.size(); i++) {
                bigrams.merge(content.get(i) + " " + content.get(i + 1), 1, Integer::sum);
            }
        }
        return new ThemeMotif(topCounted(counts, MOTIF_LIMIT, 2), topCounted(bigrams, COUNTED_LIMIT, 2));
    }

    static MacroStructure structure(List<Integer> stanzaLineCounts) {
        List<Double> counts = new ArrayList<>();
        for (int count : stanzaLineCounts) {
            counts.add((double) count);
        }
        return new MacroStructure(stanzaLineCounts, argMax(counts), argMin(counts));
    }

    /**
     * Entries with at least {@code minCount}, by count descending then alphabetically.
     */
    static List<CountedItem> topCounted(Map<String, Integer> counts, int limit, int minCount) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() >= minCount) {
                entries.add(entry);
            }
        }
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()));
        List<CountedItem> items = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : entries) {
            if (items.size() >= limit) {
                break;
            }
            items.add(new CountedItem(entry.getKey(), entry.getValue()));
        }
        return items;
    }

    static double sampleStdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return Math.sqrt(sum / (values.size() - 1));
    }

    /**
     * The three largest swings, each named by the 1-based line (or stanza) the swing leaves, in order.
     * Ties keep the earlier transition.
     */
    static List<Integer> largestShifts(List<Double> deltas) {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < deltas.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparing((Integer i) -> deltas.get(i)).reversed());
        List<Integer> shifts = new ArrayList<>();
        for (int i = 0; i < order.size() && i < NOTABLE_SHIFTS; i++) {
            shifts.add(order.get(i) + 1);
        }
        Collections.sort(shifts);
        return shifts;
    }

    private static List<Double> absoluteDeltas(List<Double> values) {
        List<Double> deltas = new ArrayList<>();
        for (int i = 1; i < values.size(); i++) {
            deltas.add(Math.abs(values.get(i) - values.get(i - 1)));
        }
        return deltas;
    }

    private static Integer argMax(List<Double> values) {
        Integer best = null;
        for (int i = 0; i < values.size(); i++) {
            if (best == null || values.get(i) > values.get(best)) {
                best = i;
            }
        }
        return best;
    }

    private static Integer argMin(List<Double> values) {
        Integer best = null;
        for (int i = 0; i < values.size(); i++) {
            if (best == null || values.get(i) < values.get(best)) {
                best = i;
            }
        }
        return best;
    }

    private static Integer oneBased(Integer index) {
        return index == null ? null : index + 1;
    }

    private static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double clamp(double score) {
        return Math.max(-1.0, Math.min(1.0, score));
    }
}
