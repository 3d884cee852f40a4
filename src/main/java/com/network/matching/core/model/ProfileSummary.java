package com.network.matching.core.model;

import java.util.Objects;

/**
 * Lightweight view of a profile used in match results and mutual-connection lists.
 */
public record ProfileSummary(String id, String name, String jobTitle, String company) {

    public ProfileSummary {
        Objects.requireNonNull(id, "id is required");
    }
}
