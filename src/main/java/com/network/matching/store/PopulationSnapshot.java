package com.network.matching.store;

import com.network.matching.core.model.Profile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable population published by one {@link ProfileStore} load.
 * Every read on a snapshot sees the same population, whatever loads happen meanwhile.
 */
public final class PopulationSnapshot implements ProfileLookup {

    static final PopulationSnapshot EMPTY = new PopulationSnapshot(Map.of(), 0);

    private final Map<String, Profile> profiles;
    private final int connectionCount;

    PopulationSnapshot(Map<String, Profile> profiles, int connectionCount) {
        this.profiles = profiles;
        this.connectionCount = connectionCount;
    }

    /**
     * Gets a profile by id.
     *
     * @throws ProfileNotFoundException if the id is not part of this population
     */
    public Profile get(String id) {
        Profile profile = profiles.get(id);
        if (profile == null) {
            throw new ProfileNotFoundException(id);
        }
        return profile;
    }

    @Override
    public Optional<Profile> find(String id) {
        return Optional.ofNullable(profiles.get(id));
    }

    public boolean contains(String id) {
        return profiles.containsKey(id);
    }

    /**
     * Returns every profile except {@code excludedId}, in load order.
     */
    public List<Profile> allExcept(String excludedId) {
        Collection<Profile> all = profiles.values();
        List<Profile> result = new ArrayList<>(all.size());
        for (Profile profile : all) {
            if (!profile.getId().equals(excludedId)) {
                result.add(profile);
            }
        }
        return result;
    }

    public List<Profile> all() {
        return List.copyOf(profiles.values());
    }

    public int size() {
        return profiles.size();
    }

    public int connectionCount() {
        return connectionCount;
    }
}
