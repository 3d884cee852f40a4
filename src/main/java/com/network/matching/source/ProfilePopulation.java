package com.network.matching.source;

import com.network.matching.core.model.ConnectionEdge;
import com.network.matching.core.model.Profile;

import java.util.List;

/**
 * A population read from a {@link ProfileSource}, ready to be loaded into the store.
 */
public record ProfilePopulation(List<Profile> profiles, List<ConnectionEdge> edges) {
    public ProfilePopulation {
        profiles = profiles != null ? List.copyOf(profiles) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
