package com.draftlens.analysis;

import com.draftlens.models.DecisionBeliefLoop;
import com.draftlens.models.DecisionBeliefLoop.LoopEntry;
import com.draftlens.models.PageLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills one decision-belief loop entry per sampled chapter that names the character. The
 * loop reads pressure, belief, decision, outcome and shift off the same sentence
 * indicators the matrices and chains use.
 */
public final class DecisionBeliefLoopAnalyzer {

    public static final int MAX_ENTRIES = 8;

    static final String NO_PRESSURE = "No external pressure named";
    static final String NO_SHIFT = "No visible shift";

    private DecisionBeliefLoopAnalyzer() {
    }

    public static List<DecisionBeliefLoop> analyze(List<Chapter> chapters, List<CharacterAliases> characters,
                                                   List<PageLocation> pageMapping) {
        List<DecisionBeliefLoop> loops = new ArrayList<>();
        List<Integer> sampled = ChapterSplitter.sampleIndices(chapters.size(),
                CharacterNarrativeAnalyzer.MAX_SAMPLED_CHAPTERS);
        for (CharacterAliases character : characters) {
            List<LoopEntry> entries = new ArrayList<>();
            for (int index : sampled) {
                Chapter chapter = chapters.get(index);
                if (!character.matches(chapter.text())) {
                    continue;
                }
                SentenceEvidence evidence = new SentenceEvidence(chapter.text());
                String belief = evidence.aliasWithIndicatorOrAlias(character,
                        CharacterNarrativeAnalyzer.BELIEF_INDICATORS);
                String pressure = evidence.indicatedEvidence(character,
                        CharacterNarrativeAnalyzer.COUNTERPRESSURE_INDICATORS);
                String decision = evidence.strictEvidence(character, CharacterNarrativeAnalyzer.DECISION_INDICATORS);
                String outcome = evidence.indicatedEvidence(character, CharacterNarrativeAnalyzer.OUTCOME_INDICATORS);
                String shift = evidence.strictEvidence(character, CharacterNarrativeAnalyzer.EFFECT_INDICATORS);
                entries.add(new LoopEntry(
                        chapter.number(),
                        ChapterSplitter.pageAt(pageMapping, chapter.start()),
                        pressure.isEmpty() ? NO_PRESSURE : pressure,
                        belief.isEmpty() ? CharacterNarrativeAnalyzer.DEFAULT_BELIEF : belief,
                        decision.isEmpty() ? CharacterNarrativeAnalyzer.NO_DECISION : decision,
                        outcome.isEmpty() ? CharacterNarrativeAnalyzer.DEFAULT_OUTCOME : outcome,
                        shift.isEmpty() ? NO_SHIFT : shift));
                if (entries.size() >= MAX_ENTRIES) {
                    break;
                }
            }
            loops.add(DecisionBeliefLoop.of(character.key(), entries));
        }
        return loops;
    }
}
