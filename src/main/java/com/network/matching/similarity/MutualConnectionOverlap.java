package com.network.matching.similarity;

import com.network.matching.core.model.Profile;

import java.util.HashSet;

/**
 * Jaccard overlap of the two profiles' connection sets.
 */
public class MutualConnectionOverlap implements ProfileSimilarity {

    private final JaccardSimilarity jaccard = new JaccardSimilarity();

    @Override
    public double compute(Profile first, Profile second) {
        return jaccard.compute(new HashSet<>(first.getConnectionIds()),
                new HashSet<>(second.getConnectionIds()));
    }

    @Override
    public String getName() {
        return "mutual_connections";
    }
}
