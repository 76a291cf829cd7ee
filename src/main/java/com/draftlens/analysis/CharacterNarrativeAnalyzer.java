package com.draftlens.analysis;

import com.draftlens.models.BeliefShiftMatrix;
import com.draftlens.models.BeliefShiftMatrix.BeliefEntry;
import com.draftlens.models.DecisionConsequenceChain;
import com.draftlens.models.DecisionConsequenceChain.ChainEntry;
import com.draftlens.models.PageLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Belief-shift matrices and decision-consequence chains, pulled from sentences that name each character.
 */
public final class CharacterNarrativeAnalyzer {

    public static final int MAX_SAMPLED_CHAPTERS = 18;
    public static final int MAX_BELIEF_ENTRIES = 8;
    public static final int MAX_CHAIN_ENTRIES = 6;

    static final String DEFAULT_EVIDENCE = "Character's actions reflect this belief";
    static final String DEFAULT_COUNTERPRESSURE = "Circumstances test this perspective";
    static final String DEFAULT_BELIEF = "Belief implied by character actions";
    static final String NO_DECISION = "No explicit decision keyword found";
    static final String DEFAULT_OUTCOME = "Direct consequences unfold";
    static final String DEFAULT_EFFECT = "Character trajectory shifts";

    static final Pattern BELIEF_INDICATORS = SentenceEvidence.indicatorPattern(List.of(
            "believe", "think", "thought", "realize", "realized", "understand", "know", "trust", "faith",
            "value", "values", "principle", "principles", "convinced", "certain", "sure", "feel", "felt",
            "want", "wanted", "need", "needed", "hope", "hoped", "fear", "feared", "swore", "vowed",
            "promised", "resolved"));

    static final Pattern EVIDENCE_INDICATORS = SentenceEvidence.indicatorPattern(List.of(
            "because", "shows", "demonstrates", "proves", "revealed", "acted", "chose", "decided", "refused"));

    static final Pattern COUNTERPRESSURE_INDICATORS = SentenceEvidence.indicatorPattern(List.of(
            "but", "however", "challenged", "questioned", "opposed", "confronted", "despite", "although",
            "forced", "pressured"));

    static final Pattern DECISION_INDICATORS = SentenceEvidence.indicatorPattern(List.of(
            "decided", "chose", "choose", "selected", "agreed", "refused", "accepted", "rejected", "committed"));

    static final Pattern OUTCOME_INDICATORS = SentenceEvidence.indicatorPattern(List.of(
            "resulted", "consequence", "outcome", "happened", "led to", "caused", "as a result", "therefore",
            "thus"));

    static final Pattern EFFECT_INDICATORS = SentenceEvidence.indicatorPattern(List.of(
            "changed", "shaped", "influenced", "affected", "transformed", "learned", "realized", "became"));

    private CharacterNarrativeAnalyzer() {
    }

    /**
     * One matrix per character, in input order, even when no chapter mentions them.
     */
    public static List<BeliefShiftMatrix> beliefShiftMatrices(List<Chapter> chapters, List<CharacterAliases> characters,
                                                              List<PageLocation> pageMapping) {
        List<BeliefShiftMatrix> matrices = new ArrayList<>();
        List<Integer> sampled = ChapterSplitter.sampleIndices(chapters.size(), MAX_SAMPLED_CHAPTERS);
        for (CharacterAliases character : characters) {
            List<BeliefEntry> entries = new ArrayList<>();
            for (int index : sampled) {
                Chapter chapter = chapters.get(index);
                if (!character.matches(chapter.text())) {
                    continue;
                }
                SentenceEvidence evidence = new SentenceEvidence(chapter.text());
                String belief = evidence.aliasWithIndicatorOrAlias(character, BELIEF_INDICATORS);
                if (belief.isEmpty()) {
                    continue;
                }
                entries.add(beliefEntry(chapter, pageMapping, belief, evidence, character));
                if (entries.size() >= MAX_BELIEF_ENTRIES) {
                    break;
                }
            }
            if (entries.isEmpty()) {
                for (Chapter chapter : chapters) {
                    if (character.matches(chapter.text())) {
                        SentenceEvidence evidence = new SentenceEvidence(chapter.text());
                        String belief = evidence.aliasWithIndicatorOrAlias(character, BELIEF_INDICATORS);
                        entries.add(beliefEntry(chapter, pageMapping, belief.isEmpty() ? DEFAULT_BELIEF : belief,
                                evidence, character));
                        break;
                    }
                }
            }
            matrices.add(new BeliefShiftMatrix(character.key(), entries));
        }
        return matrices;
    }

    /**
     * One chain per character; a single placeholder entry stands in when no decision sentence is found.
     */
    public static List<DecisionConsequenceChain> decisionConsequenceChains(List<Chapter> chapters,
                                                                           List<CharacterAliases> characters,
                                                                           List<PageLocation> pageMapping) {
        List<DecisionConsequenceChain> chains = new ArrayList<>();
        List<Integer> sampled = ChapterSplitter.sampleIndices(chapters.size(), MAX_SAMPLED_CHAPTERS);
        for (CharacterAliases character : characters) {
            List<ChainEntry> entries = new ArrayList<>();
            for (int index : sampled) {
                Chapter chapter = chapters.get(index);
                if (!character.matches(chapter.text())) {
                    continue;
                }
                SentenceEvidence evidence = new SentenceEvidence(chapter.text());
                String decision = evidence.strictEvidence(character, DECISION_INDICATORS);
                if (decision.isEmpty()) {
                    continue;
                }
                String outcome = evidence.indicatedEvidence(character, OUTCOME_INDICATORS);
                String effect = evidence.indicatedEvidence(character, EFFECT_INDICATORS);
                entries.add(new ChainEntry(
                        chapter.number(),
                        ChapterSplitter.pageAt(pageMapping, chapter.start()),
                        decision,
                        outcome.isEmpty() ? DEFAULT_OUTCOME : outcome,
                        effect.isEmpty() ? DEFAULT_EFFECT : effect));
                if (entries.size() >= MAX_CHAIN_ENTRIES) {
                    break;
                }
            }
            if (entries.isEmpty()) {
                Chapter first = chapters.isEmpty() ? null : chapters.get(0);
                entries.add(new ChainEntry(
                        first == null ? 1 : first.number(),
                        first == null ? 0 : ChapterSplitter.pageAt(pageMapping, first.start()),
                        NO_DECISION,
                        DEFAULT_OUTCOME,
                        DEFAULT_EFFECT));
            }
            chains.add(new DecisionConsequenceChain(character.key(), entries));
        }
        return chains;
    }

    private static BeliefEntry beliefEntry(Chapter chapter, List<PageLocation> pageMapping, String belief,
                                           SentenceEvidence evidence, CharacterAliases character) {
        String support = evidence.bestEvidence(character, EVIDENCE_INDICATORS);
        String pressure = evidence.bestEvidence(character, COUNTERPRESSURE_INDICATORS);
        return new BeliefEntry(
                chapter.number(),
                ChapterSplitter.pageAt(pageMapping, chapter.start()),
                belief,
                support.isEmpty() ? DEFAULT_EVIDENCE : support,
                pressure.isEmpty() ? DEFAULT_COUNTERPRESSURE : pressure);
    }
}
