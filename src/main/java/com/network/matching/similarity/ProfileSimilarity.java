package com.network.matching.similarity;

import com.network.matching.core.model.Profile;

/**
 * Pairwise metric between two profiles.
 * All implementations should return a score between 0.0 (nothing in common) and 1.0.
 */
public interface ProfileSimilarity {

    /**
     * Computes the metric for the pair.
     *
     * @param first  first profile
     * @param second second profile
     * @return score between 0.0 and 1.0
     */
    double compute(Profile first, Profile second);

    /**
     * Returns the name of this metric.
     */
    String getName();
}
