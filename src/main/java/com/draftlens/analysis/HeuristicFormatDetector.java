package com.draftlens.analysis;

import com.draftlens.context.FormatDetector;
import com.draftlens.models.DocumentFormat;
import com.draftlens.models.FormatDetection;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weighs layout evidence (sluglines, cues, transitions) against prose evidence (chapter headings,
 * interior thought, long paragraphs) and picks a format once one side clearly dominates.
 */
public class HeuristicFormatDetector implements FormatDetector {

    static final int MIN_TEXT_LENGTH = 500;
    static final double SCREENPLAY_THRESHOLD = 0.6;
    static final double NOVEL_THRESHOLD = 0.4;

    private static final List<WeightedPattern> SCREENPLAY_PATTERNS = List.of(
            weighted("(?m)^(INT\\.|EXT\\.|INT/EXT\\.|I/E\\.)", 3.0),
            weighted("(?m)^(INTERIOR|EXTERIOR)", 2.5),
            weighted("(?m)^[A-Z][A-Z\\s]+\\s*-\\s*(DAY|NIGHT|CONTINUOUS|LATER|MORNING|EVENING|DAWN|DUSK)", 3.0),
            weighted("(?m)^\\s{20,}[A-Z][A-Z\\s]+\\s*$", 2.0),
            weighted("(?m)^[A-Z]{2,}\\s*\\(V\\.O\\.\\)|\\(O\\.S\\.\\)|\\(CONT'D\\)", 3.0),
            weighted("(?m)^\\s*\\([a-z][^)]+\\)\\s*$", 2.0),
            weighted("(?m)^(FADE IN:|FADE OUT\\.|FADE TO:|CUT TO:|DISSOLVE TO:|SMASH CUT:|MATCH CUT:)", 3.0),
            weighted("(?m)^[A-Z][^.!?]{10,80}[.!?]\\s*$", 0.5),
            weighted("\\n{2,}", 0.3));

    private static final List<WeightedPattern> NOVEL_PATTERNS = List.of(
            weighted("(?i)chapter\\s+\\d+|chapter\\s+[a-z]+", 2.5),
            weighted("(?i)^part\\s+(one|two|three|four|five|\\d+)", 2.0),
            weighted("(?m)^[A-Z][^\\n]{200,}", 2.0),
            weighted("(?i)\\b(thought|wondered|realized|felt|believed|remembered|imagined)\\b", 1.5),
            weighted("(?i)\\b(she thought|he thought|I thought)\\b", 2.0),
            weighted("(?i)\\b(said|asked|replied|whispered|shouted|murmured)\\b\\s*,", 1.5),
            weighted("(?i)\\b(the\\s+\\w+\\s+was|it\\s+was\\s+a)\\b", 0.5),
            weighted("(?i)\\b(his|her)\\s+(eyes|face|voice|heart|hands)\\s+(were|was|seemed)", 1.5),
            weighted("(?i)\\b(the next morning|hours later|days passed|years ago|that night)\\b", 1.5));

    @Override
    public FormatDetection detect(String text) {
        if (text == null || text.length() <= MIN_TEXT_LENGTH) {
            return FormatDetection.undecided();
        }
        double screenplayScore = score(text, SCREENPLAY_PATTERNS);
        double novelScore = score(text, NOVEL_PATTERNS);

        int paragraphCount = 0;
        int paragraphChars = 0;
        for (String paragraph : text.split("\n\n", -1)) {
            if (!paragraph.isBlank()) {
                paragraphCount++;
                paragraphChars += paragraph.length();
            }
        }
        if (paragraphCount > 0) {
            int averageParagraph = paragraphChars / paragraphCount;
            if (averageParagraph < 150) {
                screenplayScore += 3.0;
            } else if (averageParagraph > 300) {
                novelScore += 3.0;
            }
        }

        int lineCount = 0;
        int lineChars = 0;
        for (String line : text.split("\n", -1)) {
            if (!line.isEmpty()) {
                lineCount++;
                lineChars += line.length();
            }
        }
        if (lineCount > 0) {
            int averageLine = lineChars / lineCount;
            if (averageLine < 60) {
                screenplayScore += 2.0;
            } else if (averageLine > 80) {
                novelScore += 2.0;
            }
        }

        int estimatedPages = paragraphCount > 0 ? Math.max(1, text.length() / 3000) : 1;
        int wordsPerPage = TextSegmenter.countWords(text) / estimatedPages;
        if (wordsPerPage < 220) {
            screenplayScore += 2.0;
        } else if (wordsPerPage > 240) {
            novelScore += 2.0;
        }

        double total = screenplayScore + novelScore;
        if (total <= 0) {
            return FormatDetection.undecided();
        }
        double screenplayProbability = screenplayScore / total;
        if (screenplayProbability > SCREENPLAY_THRESHOLD) {
            return new FormatDetection(DocumentFormat.SCREENPLAY, Math.min(1.0, screenplayProbability));
        }
        if (screenplayProbability < NOVEL_THRESHOLD) {
            return new FormatDetection(DocumentFormat.NOVEL, Math.min(1.0, 1.0 - screenplayProbability));
        }
        return FormatDetection.undecided();
    }

    private static double score(String text, List<WeightedPattern> patterns) {
        double score = 0;
        for (WeightedPattern weighted : patterns) {
            Matcher m = weighted.pattern().matcher(text);
            int matches = 0;
            while (m.find()) {
                matches++;
            }
            score += matches * weighted.weight();
        }
        return score;
    }

    private static WeightedPattern weighted(String regex, double weight) {
        return new WeightedPattern(Pattern.compile(regex), weight);
    }

    private record WeightedPattern(Pattern pattern, double weight) {
    }
}
