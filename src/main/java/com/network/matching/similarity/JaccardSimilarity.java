package com.network.matching.similarity;

import java.util.Set;

/**
 * Jaccard index of two sets: |intersection| / |union|.
 * Returns 0.0 when either set is empty.
 */
public class JaccardSimilarity {

    public double compute(Set<?> first, Set<?> second) {
        if (first == null || second == null || first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }

        Set<?> smaller = first.size() <= second.size() ? first : second;
        Set<?> larger = smaller == first ? second : first;

        // Count intersection without creating a copy
        int intersectionSize = 0;
        for (Object element : smaller) {
            if (larger.contains(element)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = first.size() + second.size() - intersectionSize;

        return (double) intersectionSize / unionSize;
    }
}
