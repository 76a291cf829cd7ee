package com.draftlens.analysis;

import com.draftlens.models.CharacterInteraction;
import com.draftlens.models.RelationshipEvolution;
import com.draftlens.models.RelationshipEvolution.Edge;
import com.draftlens.models.RelationshipEvolution.EvolutionPoint;
import com.draftlens.models.RelationshipEvolution.Node;
import com.draftlens.models.RelationshipEvolution.PowerDirection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Trust and power between interacting characters, read from sentences that name both of them.
 */
public final class RelationshipEvolutionAnalyzer {

    static final int POWER_MARGIN = 2;
    static final double TRUST_BUILDING = 0.25;
    static final double CONFLICT = -0.25;

    private static final Set<String> TRUST_WORDS = Set.of(
            "trust", "trusted", "trusts", "helped", "help", "helps", "protected", "protect", "embraced",
            "hugged", "comforted", "forgave", "thanked", "agreed", "smiled", "laughed", "together",
            "promised", "shared", "defended", "saved", "kissed", "supported", "confided");

    private static final Set<String> CONFLICT_WORDS = Set.of(
            "argued", "argue", "fought", "fight", "betrayed", "betrayal", "lied", "lie", "accused",
            "yelled", "shouted", "threatened", "hit", "struck", "refused", "blamed", "resented",
            "glared", "hated", "attacked", "abandoned", "distrusted", "snapped", "slapped");

    private static final Set<String> DOMINANCE_WORDS = Set.of(
            "ordered", "commanded", "demanded", "forced", "controlled", "dismissed", "told",
            "insisted", "warned", "threatened", "pushed", "dragged", "overruled");

    private RelationshipEvolutionAnalyzer() {
    }

    public static RelationshipEvolution analyze(List<Chapter> chapters, List<CharacterAliases> characters,
                                                List<CharacterInteraction> interactions) {
        if (characters.isEmpty()) {
            return RelationshipEvolution.EMPTY;
        }
        Map<String, CharacterAliases> byKey = new HashMap<>();
        for (CharacterAliases character : characters) {
            byKey.put(character.key(), character);
        }
        List<SentenceEvidence> chapterSentences = new ArrayList<>();
        for (Chapter chapter : chapters) {
            chapterSentences.add(new SentenceEvidence(chapter.text()));
        }

        List<Node> nodes = new ArrayList<>();
        for (CharacterAliases character : characters) {
            nodes.add(new Node(character.key(), emotionalInvestment(chapterSentences, character)));
        }

        List<Edge> edges = new ArrayList<>();
        for (CharacterInteraction interaction : interactions) {
            CharacterAliases from = byKey.get(interaction.character1());
            CharacterAliases to = byKey.get(interaction.character2());
            if (from == null || to == null) {
                continue;
            }
            List<EvolutionPoint> evolution = new ArrayList<>();
            int fromDominant = 0;
            int toDominant = 0;
            for (int i = 0; i < chapters.size(); i++) {
                int trust = 0;
                int conflict = 0;
                boolean shared = false;
                for (String sentence : chapterSentences.get(i).sentences()) {
                    int fromAt = from.firstIndexIn(sentence);
                    int toAt = to.firstIndexIn(sentence);
                    if (fromAt < 0 || toAt < 0) {
                        continue;
                    }
                    shared = true;
                    for (String word : TextSegmenter.tokenizeWords(sentence)) {
                        String clean = TextSegmenter.stripPunctuation(word).toLowerCase(Locale.ROOT);
                        if (TRUST_WORDS.contains(clean)) {
                            trust++;
                        }
                        if (CONFLICT_WORDS.contains(clean)) {
                            conflict++;
                        }
                        if (DOMINANCE_WORDS.contains(clean)) {
                            if (fromAt < toAt) {
                                fromDominant++;
                            } else {
                                toDominant++;
                            }
                        }
                    }
                }
                if (shared) {
                    double level = trust + conflict == 0 ? 0.0 : (double) (trust - conflict) / (trust + conflict);
                    evolution.add(new EvolutionPoint(chapters.get(i).number(), level, describe(level)));
                }
            }
            double overall = 0;
            for (EvolutionPoint point : evolution) {
                overall += point.trustLevel();
            }
            overall = evolution.isEmpty() ? 0 : overall / evolution.size();
            edges.add(new Edge(from.key(), to.key(), overall, power(fromDominant, toDominant), evolution));
        }
        return new RelationshipEvolution(nodes, edges);
    }

    /**
     * Share of the character's sentences that carry emotion or intensity words.
     */
    static double emotionalInvestment(List<SentenceEvidence> chapterSentences, CharacterAliases character) {
        int named = 0;
        int charged = 0;
        for (SentenceEvidence evidence : chapterSentences) {
            for (String sentence : evidence.mentioning(character)) {
                named++;
                if (isCharged(sentence)) {
                    charged++;
                }
            }
        }
        return named == 0 ? 0.0 : (double) charged / named;
    }

    static String describe(double trustLevel) {
        if (trustLevel >= TRUST_BUILDING) {
            return "Trust building";
        }
        if (trustLevel <= CONFLICT) {
            return "Conflict";
        }
        return "Neutral";
    }

    private static PowerDirection power(int fromDominant, int toDominant) {
        if (fromDominant - toDominant >= POWER_MARGIN) {
            return PowerDirection.FROM_OVER_TO;
        }
        if (toDominant - fromDominant >= POWER_MARGIN) {
            return PowerDirection.TO_OVER_FROM;
        }
        return PowerDirection.BALANCED;
    }

    private static boolean isCharged(String sentence) {
        for (String word : TextSegmenter.tokenizeWords(sentence)) {
            String clean = TextSegmenter.stripPunctuation(word).toLowerCase(Locale.ROOT);
            if (ProseLexicon.SENTIMENT.containsKey(clean) || ProseLexicon.INTENSITY_WORDS.contains(clean)) {
                return true;
            }
        }
        return false;
    }
}
