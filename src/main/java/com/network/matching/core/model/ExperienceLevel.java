package com.network.matching.core.model;

import java.util.Locale;

/**
 * Seniority requested by a networking query.
 */
public enum ExperienceLevel {
    JUNIOR,
    SENIOR,
    EXECUTIVE,
    ANY;

    /**
     * Parses a level name case-insensitively. Unknown or blank values map to {@link #ANY}.
     */
    public static ExperienceLevel fromString(String value) {
        if (value == null || value.isBlank()) {
            return ANY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ANY;
        }
    }
}
