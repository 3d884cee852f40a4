package com.network.matching.core.model;

import java.util.Objects;

/**
 * Undirected connection between two profiles, supplied to the store in addition
 * to the connection lists carried by the profiles themselves.
 */
public record ConnectionEdge(String sourceId, String targetId) {

    public ConnectionEdge {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(targetId, "targetId is required");
    }
}
