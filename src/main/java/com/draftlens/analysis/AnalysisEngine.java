package com.draftlens.analysis;

import com.draftlens.AppLogger;
import com.draftlens.context.CharacterRegistry;
import com.draftlens.models.AnalysisResults;
import com.draftlens.models.CharacterInteraction;
import com.draftlens.models.CharacterPresence;
import com.draftlens.models.DocumentFormat;
import com.draftlens.models.DocumentStyle;
import com.draftlens.models.FormatDetection;
import com.draftlens.models.PoetryInsights;
import com.draftlens.poetry.PoetryAnalyzer;

import java.util.List;

/**
 * Single entry point of the analyzer: one call, one immutable {@link AnalysisResults}.
 *
 * <p>Text longer than the configured maximum is cut before scanning and the result is flagged
 * as truncated; the word total still counts the whole input. Poetry documents skip plot
 * analysis and get poetry insights instead.
 */
public class AnalysisEngine {

    public AnalysisResults analyze(String text, AnalysisOptions options) {
        long started = System.currentTimeMillis();
        AnalysisOptions opts = options != null ? options : AnalysisOptions.defaults();
        String source = text == null ? "" : text;

        boolean truncated = source.length() > opts.getMaxAnalysisLength();
        String analyzed = truncated ? truncate(source, opts.getMaxAnalysisLength()) : source;
        AppLogger logger = AppLogger.get();
        if (truncated && logger != null) {
            logger.warn("Analysis input truncated from " + source.length() + " to " + analyzed.length() + " chars");
        }

        int wordCount = TextSegmenter.countWords(source);
        List<String> words = TextSegmenter.tokenizeWords(analyzed);
        TextSegmenter.ParagraphStats paragraphs = TextSegmenter.paragraphStats(analyzed);
        int sentenceCount = TextSegmenter.countSentences(analyzed);
        ReadabilityMetrics.SentenceVariety variety = ReadabilityMetrics.sentenceVariety(analyzed);
        int sensory = PatternDetectors.sensoryWordCount(analyzed);

        DocumentStyle style = opts.getStyle();
        boolean poetry = style == DocumentStyle.POETRY;
        FormatDetection detection = detectFormat(analyzed, style, opts);
        boolean screenplay = detection.isScreenplay();

        List<String> segments = DialogueExtractor.extract(analyzed, screenplay);

        AnalysisResults.Builder results = AnalysisResults.builder()
                .wordCount(wordCount)
                .sentenceCount(sentenceCount)
                .paragraphCount(paragraphs.count())
                .averageParagraphLength(paragraphs.averageLength())
                .longParagraphs(paragraphs.longParagraphs())
                .pageCount(ReadabilityMetrics.pageCount(analyzed, wordCount, screenplay, opts.getPageCountOverride()))
                .readingLevel(ReadabilityMetrics.readingLevel(words, sentenceCount))
                .passiveVoice(PatternDetectors.passiveVoice(analyzed))
                .adverbs(PatternDetectors.adverbs(words))
                .weakVerbs(PatternDetectors.weakVerbs(words))
                .cliches(PatternDetectors.cliches(analyzed))
                .filterWords(PatternDetectors.filterWords(words))
                .sensoryDetailCount(sensory)
                .missingSensoryDetail(PatternDetectors.missingSensoryDetail(words.size(), sensory))
                .sentenceVarietyScore(variety.score())
                .sentenceLengths(variety.sentenceLengths())
                .dialoguePercentage(ReadabilityMetrics.dialoguePercentage(segments, words.size()))
                .dialogue(DialogueQualityScorer.score(segments, analyzed))
                .documentFormat(detection.format())
                .truncated(truncated)
                .analyzedLength(analyzed.length());

        if (poetry) {
            PoetryInsights insights = PoetryAnalyzer.analyze(analyzed);
            results.poetryInsights(insights).poetryInsufficientContent(insights == null);
        } else if (!words.isEmpty()) {
            results.plotAnalysis(PlotPointDetector.analyze(analyzed, detection));
        }

        List<String> names = characterNames(analyzed, opts);
        int chapterCount = 0;
        if (!names.isEmpty()) {
            List<Chapter> chapters = ChapterSplitter.split(analyzed, opts.getOutline().outlineEntries());
            chapterCount = chapters.size();
            List<CharacterAliases> characters = CharacterAliases.forAll(names, opts.getRegistry());
            List<CharacterInteraction> interactions = CharacterPresenceAnalyzer.interactions(analyzed, characters);
            results.characterPresence(CharacterPresenceAnalyzer.presence(chapters, characters))
                    .characterInteractions(interactions)
                    .beliefShiftMatrices(CharacterNarrativeAnalyzer.beliefShiftMatrices(
                            chapters, characters, opts.getPageMapping()))
                    .decisionConsequenceChains(CharacterNarrativeAnalyzer.decisionConsequenceChains(
                            chapters, characters, opts.getPageMapping()))
                    .decisionBeliefLoops(DecisionBeliefLoopAnalyzer.analyze(chapters, characters, opts.getPageMapping()))
                    .relationshipEvolution(RelationshipEvolutionAnalyzer.analyze(chapters, characters, interactions))
                    .internalExternalAlignment(AlignmentAnalyzer.analyze(chapters, characters))
                    .languageDrift(LanguageDriftAnalyzer.analyze(chapters, characters));
        }

        AnalysisResults built = results.build();
        if (logger != null) {
            logger.info(String.format("Analyzed %d words (%s, style %s, %d characters, %d chapters) in %d ms",
                    wordCount, detection.format().getLabel(), style, names.size(), chapterCount,
                    System.currentTimeMillis() - started));
        }
        return built;
    }

    /**
     * Names worth ranking for display, strongest first.
     */
    public List<String> significantCharacters(AnalysisResults results) {
        List<CharacterPresence> presence = results.getCharacterPresence();
        return SignificantCharacterRanker.rank(presence, results.getCharacterInteractions());
    }

    /**
     * Registry or caller names first; free-text guessing only when the caller opted in and
     * supplied neither.
     */
    static List<String> characterNames(String text, AnalysisOptions options) {
        CharacterRegistry registry = options.getRegistry();
        List<String> candidates = options.getCandidateNames();
        if (!registry.isEmpty() || !candidates.isEmpty()) {
            return CharacterValidator.validate(registry, candidates);
        }
        if (options.isExtractNamesFromText()) {
            return CharacterNameExtractor.extract(text);
        }
        return List.of();
    }

    private static FormatDetection detectFormat(String text, DocumentStyle style, AnalysisOptions options) {
        switch (style) {
            case SCREENPLAY:
                return new FormatDetection(DocumentFormat.SCREENPLAY, 1.0);
            case POETRY:
                return FormatDetection.undecided();
            default:
                FormatDetection detected = options.getFormatDetector().detect(text);
                return detected != null ? detected : FormatDetection.undecided();
        }
    }

    private static String truncate(String text, int maxLength) {
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
