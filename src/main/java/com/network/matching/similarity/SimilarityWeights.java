package com.network.matching.similarity;

/**
 * Weights of the six metrics in the composite score.
 * Weights must be non-negative and sum to 1.0, which keeps the composite in [0, 1].
 */
public record SimilarityWeights(
        double semanticWeight,
        double relationshipWeight,
        double mutualConnectionsWeight,
        double companyWeight,
        double educationWeight,
        double queryRelevanceWeight
) {
    public SimilarityWeights {
        if (semanticWeight < 0 || relationshipWeight < 0 || mutualConnectionsWeight < 0
                || companyWeight < 0 || educationWeight < 0 || queryRelevanceWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = semanticWeight + relationshipWeight + mutualConnectionsWeight
                + companyWeight + educationWeight + queryRelevanceWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: semantic .25, relationship .20, mutual .15, company .15,
     * education .10, query relevance .15.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.25, 0.20, 0.15, 0.15, 0.10, 0.15);
    }

    /**
     * Weights favoring existing relationships (interactions and shared connections).
     */
    public static SimilarityWeights relationshipFocused() {
        return new SimilarityWeights(0.15, 0.35, 0.25, 0.10, 0.05, 0.10);
    }

    /**
     * Weights favoring how well the candidate fits the query.
     */
    public static SimilarityWeights queryFocused() {
        return new SimilarityWeights(0.30, 0.10, 0.10, 0.10, 0.05, 0.35);
    }
}
