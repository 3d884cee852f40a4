package com.network.matching.similarity;

import com.network.matching.core.model.Interaction;
import com.network.matching.core.model.Profile;

/**
 * Relationship strength from recorded interactions.
 * Interactions are directed, so both directions are checked and the stronger one wins.
 */
public class RelationshipStrength implements ProfileSimilarity {

    @Override
    public double compute(Profile first, Profile second) {
        double forward = first.getInteractionWith(second.getId())
                .map(Interaction::strength)
                .orElse(0.0);
        double backward = second.getInteractionWith(first.getId())
                .map(Interaction::strength)
                .orElse(0.0);
        return Math.max(forward, backward);
    }

    @Override
    public String getName() {
        return "relationship_strength";
    }
}
