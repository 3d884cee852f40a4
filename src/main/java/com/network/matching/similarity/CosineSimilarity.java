package com.network.matching.similarity;

import com.network.matching.core.model.Embedding;

/**
 * Cosine similarity between two embeddings, floored at 0.0.
 * Negative cosine carries no useful meaning for profile matching, so it scores as unrelated.
 */
public class CosineSimilarity {

    /**
     * @return similarity in [0, 1]; 0.0 if either embedding is absent or has zero norm
     * @throws IllegalArgumentException if the embeddings have different dimensions
     */
    public double compute(Embedding first, Embedding second) {
        if (first == null || second == null) {
            return 0.0;
        }
        if (first.dimension() != second.dimension()) {
            throw new IllegalArgumentException("Embedding dimensions differ: "
                    + first.dimension() + " vs " + second.dimension());
        }

        double dot = 0.0;
        double normFirst = 0.0;
        double normSecond = 0.0;
        for (int i = 0; i < first.dimension(); i++) {
            double a = first.get(i);
            double b = second.get(i);
            dot += a * b;
            normFirst += a * a;
            normSecond += b * b;
        }

        double denominator = Math.sqrt(normFirst) * Math.sqrt(normSecond);
        if (denominator == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, dot / denominator));
    }
}
