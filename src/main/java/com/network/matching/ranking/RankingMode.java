package com.network.matching.ranking;

import java.util.Locale;

/**
 * How candidates are ordered.
 */
public enum RankingMode {
    /** Composite six-metric score computed in-process. */
    LOCAL,
    /** Relevance score from the external reranker. */
    RERANK;

    /**
     * Parses a configuration value, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no mode
     */
    public static RankingMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ranking mode must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ranking mode: " + value, e);
        }
    }
}
