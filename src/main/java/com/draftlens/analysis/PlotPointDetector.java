package com.draftlens.analysis;

import com.draftlens.models.DocumentFormat;
import com.draftlens.models.FormatDetection;
import com.draftlens.models.PlotAnalysis;
import com.draftlens.models.PlotPoint;
import com.draftlens.models.StructuralIssue;
import com.draftlens.models.StructuralIssue.Category;
import com.draftlens.models.StructuralIssue.Severity;
import com.draftlens.models.TensionPoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a word-window tension curve and reads story beats, structural issues and
 * format-specific scores off it.
 */
public final class PlotPointDetector {

    static final int WINDOW_WORDS = 100;
    static final int MIN_CURVE_POINTS = 6;
    static final double NOVEL_PEAK_MIN = 0.4;
    static final double NOVEL_VALLEY_CLIMB = 0.25;
    static final double SCREENPLAY_PEAK_MIN = 0.45;
    static final double SCREENPLAY_REVERSAL_DELTA = 0.3;
    static final double LOW_TENSION = 0.2;
    static final double FLAT_DELTA = 0.05;
    static final int SCREENPLAY_WORDS_PER_MINUTE = 165;
    static final int NOVEL_WORDS_PER_MINUTE = 225;

    private static final Set<String> TENSION_WORDS = Set.of(
            "danger", "threat", "fear", "scared", "terrified", "panic",
            "urgent", "desperate", "crisis", "disaster", "catastrophe",
            "attack", "fight", "battle", "conflict", "struggle",
            "death", "dying", "killed", "murder", "blood",
            "trapped", "cornered", "helpless", "doomed",
            "explode", "explosion", "crash", "collide",
            "scream", "yell", "shout", "cry",
            "chase", "pursue", "flee", "escape", "run");

    private static final Set<String> ACTION_VERBS = Set.of(
            "grabbed", "lunged", "attacked", "struck", "hit",
            "ran", "raced", "sprinted", "dashed", "rushed",
            "jumped", "leaped", "dove", "ducked",
            "threw", "hurled", "smashed", "crashed",
            "fired", "shot", "aimed", "pulled");

    private static final Set<String> REVELATION_WORDS = Set.of(
            "realized", "discovered", "understood", "revealed",
            "truth", "secret", "hidden", "concealed",
            "betrayal", "lie", "deception", "trick");

    private static final Set<String> INTERNAL_CHANGE_WORDS = Set.of(
            "believed", "understood", "realized", "accepted", "rejected",
            "forgave", "regretted", "doubted", "trusted", "feared",
            "hoped", "despaired", "resolved", "questioned", "embraced",
            "abandoned", "confronted", "acknowledged", "denied");

    private static final Set<String> THEMATIC_WORDS = Set.of(
            "meaning", "purpose", "truth", "justice", "love", "loss",
            "identity", "freedom", "power", "sacrifice", "redemption",
            "betrayal", "loyalty", "honor", "duty", "choice");

    private static final Set<String> VISUAL_ACTION_WORDS = Set.of(
            "sees", "watches", "looks", "stares", "glances",
            "enters", "exits", "walks", "runs", "stands",
            "grabs", "throws", "pushes", "pulls", "slams",
            "opens", "closes", "turns", "moves", "stops");

    private static final Pattern SCENE_HEADING = Pattern.compile("(?i)(INT\\.|EXT\\.|INT/EXT\\.)");

    private static final List<NovelBeat> NOVEL_KEY_BEATS = List.of(
            NovelBeat.INCITING_DISRUPTION, NovelBeat.MIDPOINT_REVERSAL, NovelBeat.CRISIS, NovelBeat.CLIMAX);

    private static final List<ScreenplayBeat> SCREENPLAY_KEY_BEATS = List.of(
            ScreenplayBeat.OPENING_IMAGE, ScreenplayBeat.INCITING_INCIDENT, ScreenplayBeat.LOCK_IN,
            ScreenplayBeat.MIDPOINT_REVERSAL, ScreenplayBeat.ALL_IS_LOST, ScreenplayBeat.FINALE,
            ScreenplayBeat.CLOSING_IMAGE);

    private PlotPointDetector() {
    }

    public static PlotAnalysis analyze(String text, FormatDetection detection) {
        FormatDetection format = detection != null ? detection : FormatDetection.undecided();
        boolean screenplay = format.isScreenplay();
        List<String> words = TextSegmenter.tokenizeWords(text);
        List<TensionPoint> curve = tensionCurve(words, screenplay);

        List<PlotPoint> points;
        List<String> missing;
        List<StructuralIssue> issues;
        int internalChange = 0;
        int thematic = 0;
        int momentum = 0;
        int visualCausality = 0;
        int sceneEfficiency = 0;
        int pacing = 0;
        int runtime = 0;
        if (screenplay) {
            points = screenplayPlotPoints(curve);
            missing = missingScreenplayBeats(points);
            issues = screenplayIssues(points, curve, words.size());
            visualCausality = visualCausality(words);
            sceneEfficiency = sceneEfficiency(text, words.size());
            pacing = screenplayPacing(curve);
            runtime = estimateRuntime(words.size(), true);
        } else {
            points = novelPlotPoints(curve);
            missing = missingNovelBeats(points);
            issues = novelIssues(points, curve);
            internalChange = Math.min(100, countMembers(words, INTERNAL_CHANGE_WORDS) * 2);
            thematic = thematicResonance(words);
            momentum = narrativeMomentum(curve);
        }
        int structureScore = structureScore(points, missing, issues, screenplay);
        return new PlotAnalysis(format.format(), format.confidence(), points, curve, structureScore, missing, issues,
                internalChange, thematic, momentum, visualCausality, sceneEfficiency, pacing, runtime);
    }

    /**
     * Samples a trailing {@value #WINDOW_WORDS}-word window at a format-dependent interval and at the last word.
     */
    static List<TensionPoint> tensionCurve(List<String> words, boolean screenplay) {
        List<TensionPoint> curve = new ArrayList<>();
        int total = words.size();
        if (total == 0) {
            return curve;
        }
        int interval = screenplay
                ? Math.max(50, Math.min(200, total / 20))
                : Math.max(100, Math.min(500, total / 10));
        LinkedList<String> window = new LinkedList<>();
        for (int i = 0; i < total; i++) {
            window.addLast(words.get(i).toLowerCase(Locale.ROOT));
            if (window.size() > WINDOW_WORDS) {
                window.removeFirst();
            }
            int seen = i + 1;
            if (seen % interval == 0 || seen == total) {
                curve.add(new TensionPoint((double) seen / total, windowTension(window, screenplay), seen));
            }
        }
        return curve;
    }

    static double windowTension(List<String> window, boolean screenplay) {
        double score = 0;
        for (String word : window) {
            String clean = TextSegmenter.stripPunctuation(word);
            if (TENSION_WORDS.contains(clean)) {
                score += 0.3;
            }
            if (ACTION_VERBS.contains(clean)) {
                score += 0.2;
            }
            if (REVELATION_WORDS.contains(clean)) {
                score += 0.25;
            }
            if (screenplay ? VISUAL_ACTION_WORDS.contains(clean) : INTERNAL_CHANGE_WORDS.contains(clean)) {
                score += 0.15;
            }
        }
        return Math.min(1.0, score / 3.0);
    }

    static List<PlotPoint> novelPlotPoints(List<TensionPoint> curve) {
        List<PlotPoint> points = new ArrayList<>();
        if (curve.size() < MIN_CURVE_POINTS) {
            return points;
        }
        for (int i = 1; i < curve.size() - 1; i++) {
            TensionPoint prev = curve.get(i - 1);
            TensionPoint current = curve.get(i);
            TensionPoint next = curve.get(i + 1);
            if (current.tensionLevel() > prev.tensionLevel()
                    && current.tensionLevel() > next.tensionLevel()
                    && current.tensionLevel() > NOVEL_PEAK_MIN) {
                NovelBeat beat = NovelBeat.at(current.position());
                points.add(novelPoint(beat, current, beat.getAnalysisQuestion(), null));
            }
            if (current.tensionLevel() < prev.tensionLevel()
                    && next.tensionLevel() - current.tensionLevel() > NOVEL_VALLEY_CLIMB) {
                points.add(novelPoint(NovelBeat.at(current.position()), current, "Setup before tension increase", null));
            }
        }
        Set<String> found = types(points);
        for (NovelBeat beat : NOVEL_KEY_BEATS) {
            if (!found.contains(beat.getLabel())) {
                TensionPoint closest = closest(curve, beat.getExpectedPosition());
                points.add(novelPoint(beat, closest, "Expected " + beat.getLabel(), beat.getFailureDescription()));
            }
        }
        points.sort(Comparator.comparingInt(PlotPoint::wordPosition));
        return points;
    }

    static List<PlotPoint> screenplayPlotPoints(List<TensionPoint> curve) {
        List<PlotPoint> points = new ArrayList<>();
        if (curve.size() < MIN_CURVE_POINTS) {
            return points;
        }
        for (int i = 1; i < curve.size() - 1; i++) {
            TensionPoint prev = curve.get(i - 1);
            TensionPoint current = curve.get(i);
            TensionPoint next = curve.get(i + 1);
            boolean peak = current.tensionLevel() > prev.tensionLevel()
                    && current.tensionLevel() > next.tensionLevel()
                    && current.tensionLevel() > SCREENPLAY_PEAK_MIN;
            boolean reversal = Math.abs(current.tensionLevel() - prev.tensionLevel()) > SCREENPLAY_REVERSAL_DELTA
                    || Math.abs(next.tensionLevel() - current.tensionLevel()) > SCREENPLAY_REVERSAL_DELTA;
            if (peak || reversal) {
                ScreenplayBeat beat = ScreenplayBeat.at(current.position());
                points.add(screenplayPoint(beat, current, beat.getAnalysisQuestion(), null));
            }
        }
        Set<String> found = types(points);
        for (ScreenplayBeat beat : SCREENPLAY_KEY_BEATS) {
            if (!found.contains(beat.getLabel())) {
                TensionPoint closest = closest(curve, beat.getExpectedPosition());
                points.add(screenplayPoint(beat, closest,
                        "Expected at ~" + beat.getExpectedPage() + " pages", beat.getFailureDescription()));
            }
        }
        points.sort(Comparator.comparingInt(PlotPoint::wordPosition));
        return points;
    }

    static List<String> missingNovelBeats(List<PlotPoint> points) {
        Set<String> found = types(points);
        List<String> missing = new ArrayList<>();
        for (NovelBeat beat : NovelBeat.values()) {
            if (!found.contains(beat.getLabel())) {
                missing.add(beat.getLabel());
            }
        }
        return missing;
    }

    static List<String> missingScreenplayBeats(List<PlotPoint> points) {
        Set<String> found = types(points);
        List<String> missing = new ArrayList<>();
        for (ScreenplayBeat beat : ScreenplayBeat.values()) {
            if (!found.contains(beat.getLabel())) {
                missing.add(beat.getLabel());
            }
        }
        return missing;
    }

    static List<StructuralIssue> novelIssues(List<PlotPoint> points, List<TensionPoint> curve) {
        List<StructuralIssue> issues = new ArrayList<>();

        int lowStreak = 0;
        double streakStart = 0;
        for (TensionPoint point : curve) {
            if (point.tensionLevel() < LOW_TENSION) {
                if (lowStreak == 0) {
                    streakStart = point.position();
                }
                lowStreak++;
                continue;
            }
            if (lowStreak > 5) {
                issues.add(new StructuralIssue(
                        lowStreak > 10 ? Severity.MAJOR : Severity.MODERATE,
                        Category.EXCESSIVE_INERTIA,
                        "Extended low-tension passage detected. Beautiful but potentially stagnant.",
                        "Consider adding micro-conflicts, revelations, or thematic tensions to maintain reader engagement.",
                        streakStart, point.position()));
            }
            lowStreak = 0;
        }

        for (PlotPoint point : points) {
            if (point.tensionLevel() > NOVEL_PEAK_MIN) {
                if (point.percentagePosition() > 0.20) {
                    issues.add(new StructuralIssue(
                            point.percentagePosition() > 0.30 ? Severity.MAJOR : Severity.MODERATE,
                            Category.LATE_PLOT_IGNITION,
                            "Plot ignition appears late at " + (int) (point.percentagePosition() * 100) + "%.",
                            "Consider introducing the inciting disruption earlier to hook readers.",
                            0, point.percentagePosition()));
                }
                break;
            }
        }

        List<Double> midpoint = new ArrayList<>();
        for (TensionPoint point : curve) {
            if (point.position() >= 0.45 && point.position() <= 0.55) {
                midpoint.add(point.tensionLevel());
            }
        }
        if (!midpoint.isEmpty() && variance(midpoint) < 0.02) {
            issues.add(new StructuralIssue(
                    Severity.MODERATE,
                    Category.THEMATIC_DIFFUSION,
                    "Midpoint lacks clear reversal or redefinition of success.",
                    "The midpoint should change what victory looks like for the protagonist.",
                    0.45, 0.55));
        }
        return issues;
    }

    static List<StructuralIssue> screenplayIssues(List<PlotPoint> points, List<TensionPoint> curve, int wordCount) {
        List<StructuralIssue> issues = new ArrayList<>();

        int flatStreak = 0;
        double streakStart = 0;
        for (int i = 1; i < curve.size(); i++) {
            double diff = Math.abs(curve.get(i).tensionLevel() - curve.get(i - 1).tensionLevel());
            if (diff < FLAT_DELTA) {
                if (flatStreak == 0) {
                    streakStart = curve.get(i - 1).position();
                }
                flatStreak++;
                continue;
            }
            if (flatStreak > 3) {
                issues.add(new StructuralIssue(
                        flatStreak > 6 ? Severity.MAJOR : Severity.MODERATE,
                        Category.REPETITIVE_SCENES,
                        "Sequence of scenes without visible turns detected.",
                        "Each scene must turn: someone gains or loses leverage. Would cutting these scenes break causality?",
                        streakStart, curve.get(i).position()));
            }
            flatStreak = 0;
        }

        double before = averageTension(curve, 0.40, 0.50, false);
        double after = averageTension(curve, 0.50, 0.60, true);
        if (before >= 0 && after >= 0 && after < before * 0.9) {
            issues.add(new StructuralIssue(
                    Severity.MAJOR,
                    Category.MIDPOINT_SAG,
                    "Tension decreases after midpoint instead of escalating.",
                    "Midpoint should be a visible reversal that raises stakes and accelerates toward the climax.",
                    0.50, 0.60));
        }

        int actionBeats = 0;
        for (PlotPoint point : points) {
            if (point.tensionLevel() > 0.5) {
                actionBeats++;
            }
        }
        if (actionBeats < 3) {
            issues.add(new StructuralIssue(
                    Severity.MODERATE,
                    Category.PASSIVE_PROTAGONIST,
                    "Few high-tension action beats detected.",
                    "Protagonist must make visible choices under pressure. Actions reveal character; dialogue alone cannot.",
                    0, 1));
        }

        int minutes = estimateRuntime(wordCount, true);
        if (minutes < 85 || minutes > 130) {
            issues.add(new StructuralIssue(
                    minutes < 70 || minutes > 150 ? Severity.MAJOR : Severity.MINOR,
                    Category.PACE_PROBLEMS,
                    "Estimated runtime: ~" + minutes + " minutes. Feature films typically run 90-120 minutes.",
                    minutes < 85
                            ? "Consider expanding sequences or adding subplots."
                            : "Consider tightening scenes; each must justify its screen time.",
                    0, 1));
        }
        return issues;
    }

    static int thematicResonance(List<String> words) {
        Map<String, Integer> occurrences = new HashMap<>();
        for (String word : words) {
            String clean = TextSegmenter.stripPunctuation(word.toLowerCase(Locale.ROOT));
            if (THEMATIC_WORDS.contains(clean)) {
                occurrences.merge(clean, 1, Integer::sum);
            }
        }
        int recurring = 0;
        for (int count : occurrences.values()) {
            if (count >= 3) {
                recurring++;
            }
        }
        return Math.min(100, recurring * 15);
    }

    static int narrativeMomentum(List<TensionPoint> curve) {
        if (curve.size() <= 2) {
            return 50;
        }
        int increases = 0;
        int decreases = 0;
        for (int i = 1; i < curve.size(); i++) {
            if (curve.get(i).tensionLevel() > curve.get(i - 1).tensionLevel()) {
                increases++;
            } else {
                decreases++;
            }
        }
        double ratio = (double) increases / (increases + decreases);
        int variationBonus = increases > 0 && decreases > 0 ? 10 : 0;
        return Math.min(100, (int) (ratio * 80) + variationBonus);
    }

    static int visualCausality(List<String> words) {
        int actions = countMembers(words, VISUAL_ACTION_WORDS);
        double wordsPerAction = words.size() / (double) Math.max(1, actions);
        if (wordsPerAction < 20) {
            return 100;
        } else if (wordsPerAction < 50) {
            return 80;
        } else if (wordsPerAction < 100) {
            return 60;
        }
        return 40;
    }

    static int sceneEfficiency(String text, int wordCount) {
        Matcher m = SCENE_HEADING.matcher(text);
        int scenes = 0;
        while (m.find()) {
            scenes++;
        }
        if (scenes == 0) {
            return 50;
        }
        int wordsPerScene = wordCount / scenes;
        if (wordsPerScene >= 100 && wordsPerScene <= 300) {
            return 90;
        } else if (wordsPerScene < 100) {
            return 60;
        } else if (wordsPerScene <= 500) {
            return 70;
        }
        return 40;
    }

    static int screenplayPacing(List<TensionPoint> curve) {
        if (curve.size() < MIN_CURVE_POINTS) {
            return 50;
        }
        int score = 50;
        TensionPoint actOneBreak = firstBetween(curve, 0.23, 0.27);
        if (actOneBreak != null && actOneBreak.tensionLevel() > 0.4) {
            score += 15;
        }
        TensionPoint actTwoBreak = firstBetween(curve, 0.73, 0.77);
        if (actTwoBreak != null && actTwoBreak.tensionLevel() > 0.6) {
            score += 15;
        }
        double finalStretch = averageTension(curve, 0.75, Double.MAX_VALUE, true);
        if (finalStretch > 0.6) {
            score += 20;
        }
        return Math.min(100, score);
    }

    /**
     * Screen minutes at one page a minute, or reading minutes for prose.
     */
    static int estimateRuntime(int wordCount, boolean screenplay) {
        return Math.max(1, wordCount / (screenplay ? SCREENPLAY_WORDS_PER_MINUTE : NOVEL_WORDS_PER_MINUTE));
    }

    static int structureScore(List<PlotPoint> points, List<String> missing, List<StructuralIssue> issues,
                              boolean screenplay) {
        int score = 100 - missing.size() * (screenplay ? 8 : 6);
        for (StructuralIssue issue : issues) {
            score -= issue.severity().getPenalty();
        }
        if (points.size() > 2) {
            List<Double> tensions = new ArrayList<>();
            for (PlotPoint point : points) {
                tensions.add(point.tensionLevel());
            }
            if (variance(tensions) > 0.05) {
                score += 10;
            }
        }
        return Math.max(0, Math.min(100, score));
    }

    static double variance(List<Double> values) {
        if (values.size() < 2) {
            return 0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        double mean = sum / values.size();
        double squared = 0;
        for (double value : values) {
            squared += (value - mean) * (value - mean);
        }
        return squared / values.size();
    }

    private static PlotPoint novelPoint(NovelBeat beat, TensionPoint at, String description, String suggestion) {
        return new PlotPoint(beat.getLabel(), at.wordPosition(), at.position(), at.tensionLevel(),
                description, beat.getAnalysisQuestion(), suggestion, false);
    }

    private static PlotPoint screenplayPoint(ScreenplayBeat beat, TensionPoint at, String description, String suggestion) {
        return new PlotPoint(beat.getLabel(), at.wordPosition(), at.position(), at.tensionLevel(),
                description, beat.getAnalysisQuestion(), suggestion, true);
    }

    private static Set<String> types(List<PlotPoint> points) {
        Set<String> types = new HashSet<>();
        for (PlotPoint point : points) {
            types.add(point.type());
        }
        return types;
    }

    private static TensionPoint closest(List<TensionPoint> curve, double position) {
        TensionPoint best = curve.get(0);
        for (TensionPoint point : curve) {
            if (Math.abs(point.position() - position) < Math.abs(best.position() - position)) {
                best = point;
            }
        }
        return best;
    }

    private static TensionPoint firstBetween(List<TensionPoint> curve, double from, double to) {
        for (TensionPoint point : curve) {
            if (point.position() >= from && point.position() <= to) {
                return point;
            }
        }
        return null;
    }

    /**
     * Mean tension over {@code [from, to)} or {@code [from, to]}; -1 when no sample falls inside.
     */
    private static double averageTension(List<TensionPoint> curve, double from, double to, boolean inclusiveEnd) {
        double sum = 0;
        int count = 0;
        for (TensionPoint point : curve) {
            double p = point.position();
            if (p >= from && (inclusiveEnd ? p <= to : p < to)) {
                sum += point.tensionLevel();
                count++;
            }
        }
        return count == 0 ? -1 : sum / count;
    }

    private static int countMembers(List<String> words, Set<String> lexicon) {
        int count = 0;
        for (String word : words) {
            if (lexicon.contains(TextSegmenter.stripPunctuation(word.toLowerCase(Locale.ROOT)))) {
                count++;
            }
        }
        return count;
    }
}
