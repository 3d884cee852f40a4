package com.network.matching.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Directed, weighted interaction record from the owning profile towards {@code targetId}.
 *
 * @param targetId    counterpart profile id
 * @param frequency   contacts per month
 * @param lastContact date of the most recent contact, may be null
 * @param strength    relationship strength in [0, 1]
 * @param type        free-form interaction label (e.g. "professional"), may be null
 */
public record Interaction(
        String targetId,
        int frequency,
        LocalDate lastContact,
        double strength,
        String type
) {
    public Interaction {
        Objects.requireNonNull(targetId, "targetId is required");
        if (frequency < 0) {
            throw new IllegalArgumentException("frequency must be >= 0");
        }
        if (strength < 0.0 || strength > 1.0 || Double.isNaN(strength)) {
            throw new IllegalArgumentException("strength must be between 0.0 and 1.0, got " + strength);
        }
    }

    public static Interaction of(String targetId, double strength) {
        return new Interaction(targetId, 0, null, strength, null);
    }
}
