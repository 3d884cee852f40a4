package com.network.matching.similarity;

import com.network.matching.core.model.Embedding;
import com.network.matching.core.model.ParsedQuery;
import com.network.matching.core.model.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Composite scorer combining the six matching metrics with configurable weights.
 * Formula: score = w1*semantic + w2*relationship + w3*mutual + w4*company + w5*education + w6*query
 *
 * <p>The scorer holds no mutable state and can be shared between threads.</p>
 */
public class CompositeSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final CosineSimilarity semantic;
    private final ProfileSimilarity relationship;
    private final ProfileSimilarity mutualConnections;
    private final ProfileSimilarity companyOverlap;
    private final ProfileSimilarity education;
    private final QueryRelevanceScorer queryRelevance;
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarityScorer(SimilarityWeights weights) {
        this.semantic = new CosineSimilarity();
        this.relationship = new RelationshipStrength();
        this.mutualConnections = new MutualConnectionOverlap();
        this.companyOverlap = new CompanyOverlap();
        this.education = new EducationSimilarity();
        this.queryRelevance = new QueryRelevanceScorer(semantic);
        this.weights = Objects.requireNonNull(weights, "weights are required");
    }

    /**
     * Computes the composite score of {@code candidate} for {@code requester}.
     */
    public double compute(Profile requester, Profile candidate) {
        return computeWithBreakdown(requester, candidate, null, null, null, null).compositeScore();
    }

    /**
     * Computes every metric and the weighted composite.
     *
     * @param requester          the profile asking for connections
     * @param candidate          the profile being scored
     * @param requesterEmbedding requester document embedding, may be null
     * @param candidateEmbedding candidate document embedding, may be null
     * @param parsedQuery        structured query criteria; query relevance is 0 when null
     * @param queryEmbedding     query embedding, may be null
     */
    public ScoreBreakdown computeWithBreakdown(Profile requester, Profile candidate,
                                               Embedding requesterEmbedding, Embedding candidateEmbedding,
                                               ParsedQuery parsedQuery, Embedding queryEmbedding) {
        double semanticScore = semantic.compute(requesterEmbedding, candidateEmbedding);
        double relationshipScore = relationship.compute(requester, candidate);
        double mutualScore = mutualConnections.compute(requester, candidate);
        double companyScore = companyOverlap.compute(requester, candidate);
        double educationScore = education.compute(requester, candidate);
        double queryScore = parsedQuery != null
                ? queryRelevance.compute(candidate, parsedQuery, queryEmbedding, candidateEmbedding)
                : 0.0;

        double composite = weights.semanticWeight() * semanticScore
                + weights.relationshipWeight() * relationshipScore
                + weights.mutualConnectionsWeight() * mutualScore
                + weights.companyWeight() * companyScore
                + weights.educationWeight() * educationScore
                + weights.queryRelevanceWeight() * queryScore;
        // Weights sum to 1 within a tolerance, so clamp away rounding drift.
        composite = Math.max(0.0, Math.min(1.0, composite));

        ScoreBreakdown breakdown = new ScoreBreakdown(semanticScore, relationshipScore, mutualScore,
                companyScore, educationScore, queryScore, composite, weights);
        log.debug("Scores for {} vs {}: {}", requester.getId(), candidate.getId(), breakdown);
        return breakdown;
    }

    /**
     * Returns the human-readable reasons a candidate scored well, strongest signals first.
     * Never empty.
     */
    public List<String> explain(ScoreBreakdown breakdown) {
        List<String> reasons = new ArrayList<>();

        if (breakdown.semanticSimilarity() > 0.7) {
            reasons.add("Strong professional profile alignment");
        } else if (breakdown.semanticSimilarity() > 0.5) {
            reasons.add("Good professional background match");
        }

        if (breakdown.relationshipStrength() > 0.5) {
            reasons.add("Existing email communication history");
        }

        if (breakdown.mutualConnections() > 0.1) {
            reasons.add("Shared connections");
        }

        if (breakdown.companyOverlap() > 0.5) {
            reasons.add("Worked at same companies");
        } else if (breakdown.companyOverlap() > 0.0) {
            reasons.add("Some company overlap in career history");
        }

        if (breakdown.educationSimilarity() > 0.5) {
            reasons.add("Similar educational background");
        }

        if (breakdown.queryRelevance() > 0.7) {
            reasons.add("Excellent match for your specific criteria");
        } else if (breakdown.queryRelevance() > 0.4) {
            reasons.add("Good match for your requirements");
        }

        if (reasons.isEmpty()) {
            reasons.add("Potential networking opportunity");
        }
        return reasons;
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    /**
     * Creates a new scorer with updated weights.
     */
    public CompositeSimilarityScorer withWeights(SimilarityWeights newWeights) {
        return new CompositeSimilarityScorer(newWeights);
    }
}
