package com.draftlens.analysis;

import com.draftlens.context.CharacterRegistry;
import com.draftlens.context.InMemoryCharacterRegistry;
import com.draftlens.models.AnalysisResults;
import com.draftlens.models.DocumentFormat;
import com.draftlens.models.DocumentStyle;
import com.draftlens.models.FormatDetection;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisEngineTest {

    private static final String STORY = "Chapter 1\nMara thought the harbor was safe. She was told to wait by Jonah. "
            + "\"We should leave,\" Jonah said. \"Not yet,\" Mara replied.\n"
            + "Chapter 2\nMara decided to stay. The decision caused a quarrel, and Jonah argued with Mara. "
            + "The storm came quickly and the boats were wrecked.\n";

    private final AnalysisEngine engine = new AnalysisEngine();

    @Test
    void emptyDocumentYieldsEmptyResults() {
        AnalysisResults results = engine.analyze("", AnalysisOptions.defaults());

        assertEquals(0, results.getWordCount());
        assertEquals(0, results.getSentenceCount());
        assertEquals(0, results.getPageCount());
        assertEquals(ReadabilityMetrics.NO_GRADE, results.getReadingLevel());
        assertNull(results.getPlotAnalysis());
        assertNull(results.getPoetryInsights());
        assertFalse(results.isTruncated());
        assertTrue(results.getCharacterPresence().isEmpty());
        assertEquals(0, results.getDialogue().qualityScore());
    }

    @Test
    void nullInputsAreTreatedAsEmpty() {
        AnalysisResults results = engine.analyze(null, null);
        assertEquals(0, results.getWordCount());
        assertEquals(0, results.getAnalyzedLength());
    }

    @Test
    void proseGetsPlotAnalysisAndPlausibleTotals() {
        AnalysisResults results = engine.analyze(STORY, AnalysisOptions.defaults());

        assertEquals(TextSegmenter.countWords(STORY), results.getWordCount());
        assertTrue(results.getPageCount() >= 1);
        assertNotNull(results.getPlotAnalysis());
        assertTrue(results.getReadingLevel().startsWith("Grade "));
        int grade = Integer.parseInt(results.getReadingLevel().substring("Grade ".length()));
        assertTrue(grade >= 0 && grade <= 18);
        assertTrue(results.getDialoguePercentage() > 0);
        assertTrue(results.getCharacterPresence().isEmpty());
    }

    @Test
    void repeatedAnalysisIsIdentical() throws Exception {
        AnalysisOptions options = AnalysisOptions.builder()
                .candidateNames(List.of("Mara", "Jonah"))
                .build();
        ObjectMapper mapper = new ObjectMapper();

        String first = mapper.writeValueAsString(engine.analyze(STORY, options));
        String second = mapper.writeValueAsString(engine.analyze(STORY, options));

        assertEquals(first, second);
    }

    @Test
    void registryDrivesCharacterAnalytics() {
        AnalysisOptions options = AnalysisOptions.builder()
                .registry(InMemoryCharacterRegistry.builder()
                        .character("Mara")
                        .character("Jonah")
                        .build())
                .build();
        AnalysisResults results = engine.analyze(STORY, options);

        assertEquals(2, results.getCharacterPresence().size());
        assertEquals(2, results.getBeliefShiftMatrices().size());
        assertEquals(2, results.getDecisionConsequenceChains().size());
        assertEquals(2, results.getDecisionBeliefLoops().size());
        assertEquals(2, results.getRelationshipEvolution().nodes().size());
        assertFalse(results.getCharacterInteractions().isEmpty());
        assertEquals(List.of("Mara", "Jonah"), engine.significantCharacters(results));
    }

    @Test
    void candidateNamesOutsideRegistryAreIgnored() {
        AnalysisOptions options = AnalysisOptions.builder()
                .registry(InMemoryCharacterRegistry.builder().character("Mara").build())
                .candidateNames(List.of("Mara", "Harbor"))
                .build();
        assertEquals(List.of("Mara"), AnalysisEngine.characterNames(STORY, options));
    }

    @Test
    void registryWithMissingAliasListsDoesNotFail() {
        CharacterRegistry registry = new CharacterRegistry() {
            @Override
            public List<String> canonicalKeys() {
                return Arrays.asList("Mara", "", "Jonah");
            }

            @Override
            public List<String> aliasesFor(String key) {
                return null;
            }
        };
        AnalysisResults results = engine.analyze(STORY, AnalysisOptions.builder().registry(registry).build());

        assertEquals(2, results.getBeliefShiftMatrices().size());
        assertEquals("Mara", results.getBeliefShiftMatrices().get(0).characterName());
    }

    @Test
    void nameExtractionIsOptIn() {
        assertTrue(AnalysisEngine.characterNames(STORY, AnalysisOptions.defaults()).isEmpty());

        AnalysisOptions optIn = AnalysisOptions.builder().extractNamesFromText(true).build();
        assertEquals(List.of("Mara", "Jonah"), AnalysisEngine.characterNames(STORY, optIn));
    }

    @Test
    void longInputIsTruncatedButWordCountCoversAll() {
        String text = "one two three four five six seven eight";
        AnalysisResults results = engine.analyze(text, AnalysisOptions.builder().maxAnalysisLength(20).build());

        assertTrue(results.isTruncated());
        assertEquals(20, results.getAnalyzedLength());
        assertEquals(8, results.getWordCount());
    }

    @Test
    void blankKeptPrefixStillCountsAPage() {
        String text = " ".repeat(30) + "word word word.";
        AnalysisResults results = engine.analyze(text, AnalysisOptions.builder().maxAnalysisLength(20).build());

        assertTrue(results.isTruncated());
        assertEquals(3, results.getWordCount());
        assertEquals(1, results.getPageCount());
    }

    @Test
    void truncationDoesNotSplitSurrogatePairs() {
        String text = "abc😀def";
        AnalysisResults results = engine.analyze(text, AnalysisOptions.builder().maxAnalysisLength(4).build());
        assertEquals(3, results.getAnalyzedLength());
    }

    @Test
    void oneLinePoemIsInsufficient() {
        AnalysisOptions poetry = AnalysisOptions.builder().style(DocumentStyle.POETRY).build();
        AnalysisResults results = engine.analyze("A single line of verse", poetry);

        assertTrue(results.isPoetryInsufficientContent());
        assertNull(results.getPoetryInsights());
        assertNull(results.getPlotAnalysis());
    }

    @Test
    void poemGetsInsightsInsteadOfPlot() {
        AnalysisOptions poetry = AnalysisOptions.builder().style(DocumentStyle.POETRY).build();
        AnalysisResults results = engine.analyze("The light falls on the day\nand the night goes on its way", poetry);

        assertFalse(results.isPoetryInsufficientContent());
        assertNotNull(results.getPoetryInsights());
        assertEquals(2, results.getPoetryInsights().formal().lineCount());
        assertNull(results.getPlotAnalysis());
    }

    @Test
    void screenplayStyleSkipsDetection() {
        AnalysisOptions options = AnalysisOptions.builder()
                .style(DocumentStyle.SCREENPLAY)
                .formatDetector(text -> new FormatDetection(DocumentFormat.NOVEL, 1.0))
                .build();
        AnalysisResults results = engine.analyze("JANE\nHello there.\n", options);

        assertEquals(DocumentFormat.SCREENPLAY, results.getDocumentFormat());
        assertEquals(1, results.getDialogue().segmentCount());
        assertEquals(1.0, results.getPlotAnalysis().formatConfidence(), 1e-9);
    }

    @Test
    void proseStyleUsesInjectedDetector() {
        AnalysisOptions options = AnalysisOptions.builder()
                .formatDetector(text -> new FormatDetection(DocumentFormat.SCREENPLAY, 0.9))
                .build();
        assertEquals(DocumentFormat.SCREENPLAY, engine.analyze(STORY, options).getDocumentFormat());
    }

    @Test
    void pageCountOverrideWins() {
        AnalysisResults results = engine.analyze(STORY, AnalysisOptions.builder().pageCountOverride(42).build());
        assertEquals(42, results.getPageCount());
    }

    @Test
    void invalidOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.builder().maxAnalysisLength(0));
        assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.builder().formatDetector(null));
    }
}
