package com.draftlens.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one analysis pass produces. Instances are immutable; build them with {@link Builder}.
 */
@JsonDeserialize(builder = AnalysisResults.Builder.class)
public final class AnalysisResults {

    private final int wordCount;
    private final int sentenceCount;
    private final int paragraphCount;
    private final int averageParagraphLength;
    private final List<Integer> longParagraphs;
    private final int pageCount;
    private final String readingLevel;

    private final DetectorResult passiveVoice;
    private final DetectorResult adverbs;
    private final DetectorResult weakVerbs;
    private final DetectorResult cliches;
    private final DetectorResult filterWords;
    private final int sensoryDetailCount;
    private final boolean missingSensoryDetail;

    private final int sentenceVarietyScore;
    private final List<Integer> sentenceLengths;
    private final int dialoguePercentage;
    private final DialogueMetrics dialogue;

    private final DocumentFormat documentFormat;
    private final PlotAnalysis plotAnalysis;

    private final List<DecisionBeliefLoop> decisionBeliefLoops;
    private final List<CharacterInteraction> characterInteractions;
    private final List<CharacterPresence> characterPresence;
    private final List<BeliefShiftMatrix> beliefShiftMatrices;
    private final List<DecisionConsequenceChain> decisionConsequenceChains;
    private final RelationshipEvolution relationshipEvolution;
    private final List<CharacterAlignment> internalExternalAlignment;
    private final List<LanguageDrift> languageDrift;

    private final PoetryInsights poetryInsights;
    private final boolean poetryInsufficientContent;
    private final boolean truncated;
    private final int analyzedLength;

    private AnalysisResults(Builder b) {
        this.wordCount = b.wordCount;
        this.sentenceCount = b.sentenceCount;
        this.paragraphCount = b.paragraphCount;
        this.averageParagraphLength = b.averageParagraphLength;
        this.longParagraphs = freeze(b.longParagraphs);
        this.pageCount = b.pageCount;
        this.readingLevel = b.readingLevel;
        this.passiveVoice = b.passiveVoice;
        this.adverbs = b.adverbs;
        this.weakVerbs = b.weakVerbs;
        this.cliches = b.cliches;
        this.filterWords = b.filterWords;
        this.sensoryDetailCount = b.sensoryDetailCount;
        this.missingSensoryDetail = b.missingSensoryDetail;
        this.sentenceVarietyScore = b.sentenceVarietyScore;
        this.sentenceLengths = freeze(b.sentenceLengths);
        this.dialoguePercentage = b.dialoguePercentage;
        this.dialogue = b.dialogue;
        this.documentFormat = b.documentFormat;
        this.plotAnalysis = b.plotAnalysis;
        this.decisionBeliefLoops = freeze(b.decisionBeliefLoops);
        this.characterInteractions = freeze(b.characterInteractions);
        this.characterPresence = freeze(b.characterPresence);
        this.beliefShiftMatrices = freeze(b.beliefShiftMatrices);
        this.decisionConsequenceChains = freeze(b.decisionConsequenceChains);
        this.relationshipEvolution = b.relationshipEvolution;
        this.internalExternalAlignment = freeze(b.internalExternalAlignment);
        this.languageDrift = freeze(b.languageDrift);
        this.poetryInsights = b.poetryInsights;
        this.poetryInsufficientContent = b.poetryInsufficientContent;
        this.truncated = b.truncated;
        this.analyzedLength = b.analyzedLength;
    }

    private static <T> List<T> freeze(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getWordCount() {
        return wordCount;
    }

    public int getSentenceCount() {
        return sentenceCount;
    }

    public int getParagraphCount() {
        return paragraphCount;
    }

    public int getAverageParagraphLength() {
        return averageParagraphLength;
    }

    /**
     * 1-based indexes of paragraphs longer than 150 words.
     */
    public List<Integer> getLongParagraphs() {
        return longParagraphs;
    }

    public int getPageCount() {
        return pageCount;
    }

    public String getReadingLevel() {
        return readingLevel;
    }

    public DetectorResult getPassiveVoice() {
        return passiveVoice;
    }

    public DetectorResult getAdverbs() {
        return adverbs;
    }

    public DetectorResult getWeakVerbs() {
        return weakVerbs;
    }

    public DetectorResult getCliches() {
        return cliches;
    }

    public DetectorResult getFilterWords() {
        return filterWords;
    }

    public int getSensoryDetailCount() {
        return sensoryDetailCount;
    }

    public boolean isMissingSensoryDetail() {
        return missingSensoryDetail;
    }

    public int getSentenceVarietyScore() {
        return sentenceVarietyScore;
    }

    public List<Integer> getSentenceLengths() {
        return sentenceLengths;
    }

    public int getDialoguePercentage() {
        return dialoguePercentage;
    }

    public DialogueMetrics getDialogue() {
        return dialogue;
    }

    public DocumentFormat getDocumentFormat() {
        return documentFormat;
    }

    /**
     * Null for poetry and for empty documents.
     */
    public PlotAnalysis getPlotAnalysis() {
        return plotAnalysis;
    }

    public List<DecisionBeliefLoop> getDecisionBeliefLoops() {
        return decisionBeliefLoops;
    }

    public List<CharacterInteraction> getCharacterInteractions() {
        return characterInteractions;
    }

    public List<CharacterPresence> getCharacterPresence() {
        return characterPresence;
    }

    public List<BeliefShiftMatrix> getBeliefShiftMatrices() {
        return beliefShiftMatrices;
    }

    public List<DecisionConsequenceChain> getDecisionConsequenceChains() {
        return decisionConsequenceChains;
    }

    public RelationshipEvolution getRelationshipEvolution() {
        return relationshipEvolution;
    }

    public List<CharacterAlignment> getInternalExternalAlignment() {
        return internalExternalAlignment;
    }

    public List<LanguageDrift> getLanguageDrift() {
        return languageDrift;
    }

    /**
     * Present only when the poetry style was requested and the poem has at least two lines.
     */
    public PoetryInsights getPoetryInsights() {
        return poetryInsights;
    }

    public boolean isPoetryInsufficientContent() {
        return poetryInsufficientContent;
    }

    /**
     * True when the input exceeded the maximum analysis length; totals other than the word count may be approximate.
     */
    public boolean isTruncated() {
        return truncated;
    }

    public int getAnalyzedLength() {
        return analyzedLength;
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private int wordCount;
        private int sentenceCount;
        private int paragraphCount;
        private int averageParagraphLength;
        private List<Integer> longParagraphs = new ArrayList<>();
        private int pageCount;
        private String readingLevel = "--";
        private DetectorResult passiveVoice = DetectorResult.EMPTY;
        private DetectorResult adverbs = DetectorResult.EMPTY;
        private DetectorResult weakVerbs = DetectorResult.EMPTY;
        private DetectorResult cliches = DetectorResult.EMPTY;
        private DetectorResult filterWords = DetectorResult.EMPTY;
        private int sensoryDetailCount;
        private boolean missingSensoryDetail;
        private int sentenceVarietyScore;
        private List<Integer> sentenceLengths = new ArrayList<>();
        private int dialoguePercentage;
        private DialogueMetrics dialogue = DialogueMetrics.EMPTY;
        private DocumentFormat documentFormat = DocumentFormat.NOVEL;
        private PlotAnalysis plotAnalysis;
        private List<DecisionBeliefLoop> decisionBeliefLoops = new ArrayList<>();
        private List<CharacterInteraction> characterInteractions = new ArrayList<>();
        private List<CharacterPresence> characterPresence = new ArrayList<>();
        private List<BeliefShiftMatrix> beliefShiftMatrices = new ArrayList<>();
        private List<DecisionConsequenceChain> decisionConsequenceChains = new ArrayList<>();
        private RelationshipEvolution relationshipEvolution = RelationshipEvolution.EMPTY;
        private List<CharacterAlignment> internalExternalAlignment = new ArrayList<>();
        private List<LanguageDrift> languageDrift = new ArrayList<>();
        private PoetryInsights poetryInsights;
        private boolean poetryInsufficientContent;
        private boolean truncated;
        private int analyzedLength;

        public Builder wordCount(int wordCount) {
            this.wordCount = wordCount;
            return this;
        }

        public Builder sentenceCount(int sentenceCount) {
            this.sentenceCount = sentenceCount;
            return this;
        }

        public Builder paragraphCount(int paragraphCount) {
            this.paragraphCount = paragraphCount;
            return this;
        }

        public Builder averageParagraphLength(int averageParagraphLength) {
            this.averageParagraphLength = averageParagraphLength;
            return this;
        }

        public Builder longParagraphs(List<Integer> longParagraphs) {
            this.longParagraphs = longParagraphs;
            return this;
        }

        public Builder pageCount(int pageCount) {
            this.pageCount = pageCount;
            return this;
        }

        public Builder readingLevel(String readingLevel) {
            this.readingLevel = readingLevel;
            return this;
        }

        public Builder passiveVoice(DetectorResult passiveVoice) {
            this.passiveVoice = passiveVoice;
            return this;
        }

        public Builder adverbs(DetectorResult adverbs) {
            this.adverbs = adverbs;
            return this;
        }

        public Builder weakVerbs(DetectorResult weakVerbs) {
            this.weakVerbs = weakVerbs;
            return this;
        }

        public Builder cliches(DetectorResult cliches) {
            this.cliches = cliches;
            return this;
        }

        public Builder filterWords(DetectorResult filterWords) {
            this.filterWords = filterWords;
            return this;
        }

        public Builder sensoryDetailCount(int sensoryDetailCount) {
            this.sensoryDetailCount = sensoryDetailCount;
            return this;
        }

        public Builder missingSensoryDetail(boolean missingSensoryDetail) {
            this.missingSensoryDetail = missingSensoryDetail;
            return this;
        }

        public Builder sentenceVarietyScore(int sentenceVarietyScore) {
            this.sentenceVarietyScore = sentenceVarietyScore;
            return this;
        }

        public Builder sentenceLengths(List<Integer> sentenceLengths) {
            this.sentenceLengths = sentenceLengths;
            return this;
        }

        public Builder dialoguePercentage(int dialoguePercentage) {
            this.dialoguePercentage = dialoguePercentage;
            return this;
        }

        public Builder dialogue(DialogueMetrics dialogue) {
            this.dialogue = dialogue;
            return this;
        }

        public Builder documentFormat(DocumentFormat documentFormat) {
            this.documentFormat = documentFormat;
            return this;
        }

        public Builder plotAnalysis(PlotAnalysis plotAnalysis) {
            this.plotAnalysis = plotAnalysis;
            return this;
        }

        public Builder decisionBeliefLoops(List<DecisionBeliefLoop> decisionBeliefLoops) {
            this.decisionBeliefLoops = decisionBeliefLoops;
            return this;
        }

        public Builder characterInteractions(List<CharacterInteraction> characterInteractions) {
            this.characterInteractions = characterInteractions;
            return this;
        }

        public Builder characterPresence(List<CharacterPresence> characterPresence) {
            this.characterPresence = characterPresence;
            return this;
        }

        public Builder beliefShiftMatrices(List<BeliefShiftMatrix> beliefShiftMatrices) {
            this.beliefShiftMatrices = beliefShiftMatrices;
            return this;
        }

        public Builder decisionConsequenceChains(List<DecisionConsequenceChain> decisionConsequenceChains) {
            this.decisionConsequenceChains = decisionConsequenceChains;
            return this;
        }

        public Builder relationshipEvolution(RelationshipEvolution relationshipEvolution) {
            this.relationshipEvolution = relationshipEvolution != null ? relationshipEvolution : RelationshipEvolution.EMPTY;
            return this;
        }

        public Builder internalExternalAlignment(List<CharacterAlignment> internalExternalAlignment) {
            this.internalExternalAlignment = internalExternalAlignment;
            return this;
        }

        public Builder languageDrift(List<LanguageDrift> languageDrift) {
            this.languageDrift = languageDrift;
            return this;
        }

        public Builder poetryInsights(PoetryInsights poetryInsights) {
            this.poetryInsights = poetryInsights;
            return this;
        }

        public Builder poetryInsufficientContent(boolean poetryInsufficientContent) {
            this.poetryInsufficientContent = poetryInsufficientContent;
            return this;
        }

        public Builder truncated(boolean truncated) {
            this.truncated = truncated;
            return this;
        }

        public Builder analyzedLength(int analyzedLength) {
            this.analyzedLength = analyzedLength;
            return this;
        }

        public AnalysisResults build() {
            return new AnalysisResults(this);
        }
    }
}
