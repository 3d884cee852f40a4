package com.network.matching.stats;

/**
 * A value together with the number of profiles that carry it.
 */
public record RankedCount(String value, int count) {
}
