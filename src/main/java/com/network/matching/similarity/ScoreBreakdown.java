package com.network.matching.similarity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-metric scores of one requester/candidate pair together with the weighted composite.
 */
public record ScoreBreakdown(
        double semanticSimilarity,
        double relationshipStrength,
        double mutualConnections,
        double companyOverlap,
        double educationSimilarity,
        double queryRelevance,
        double compositeScore,
        SimilarityWeights weights
) {
    /**
     * Returns the scores keyed by metric name, composite first, in a stable order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("composite_score", compositeScore);
        map.put("semantic_similarity", semanticSimilarity);
        map.put("relationship_strength", relationshipStrength);
        map.put("mutual_connections", mutualConnections);
        map.put("company_overlap", companyOverlap);
        map.put("education_similarity", educationSimilarity);
        map.put("query_relevance", queryRelevance);
        return map;
    }

    @Override
    public String toString() {
        return String.format(
                "ScoreBreakdown{semantic=%.4f (w=%.2f), relationship=%.4f (w=%.2f), mutual=%.4f (w=%.2f), "
                        + "company=%.4f (w=%.2f), education=%.4f (w=%.2f), query=%.4f (w=%.2f), composite=%.4f}",
                semanticSimilarity, weights.semanticWeight(),
                relationshipStrength, weights.relationshipWeight(),
                mutualConnections, weights.mutualConnectionsWeight(),
                companyOverlap, weights.companyWeight(),
                educationSimilarity, weights.educationWeight(),
                queryRelevance, weights.queryRelevanceWeight(),
                compositeScore
        );
    }
}
