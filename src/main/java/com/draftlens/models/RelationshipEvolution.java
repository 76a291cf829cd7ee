package com.draftlens.models;

import java.util.List;

/**
 * Relationship network: one node per character and one edge per interacting pair,
 * each edge carrying its per-chapter trust trajectory.
 */
public record RelationshipEvolution(List<Node> nodes, List<Edge> edges) {

    public static final RelationshipEvolution EMPTY = new RelationshipEvolution(List.of(), List.of());

    public RelationshipEvolution {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * @param emotionalInvestment share of emotionally charged sentences naming the character, 0..1
     */
    public record Node(String character, double emotionalInvestment) {
    }

    /**
     * @param trustLevel -1 (conflict) to 1 (trust), averaged over the evolution points
     */
    public record Edge(String from, String to, double trustLevel, PowerDirection powerDirection,
                       List<EvolutionPoint> evolution) {

        public Edge {
            evolution = evolution == null ? List.of() : List.copyOf(evolution);
        }
    }

    public record EvolutionPoint(int chapter, double trustLevel, String description) {
    }

    public enum PowerDirection {
        BALANCED,
        FROM_OVER_TO,
        TO_OVER_FROM
    }
}
