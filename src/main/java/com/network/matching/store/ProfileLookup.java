package com.network.matching.store;

import com.network.matching.core.model.Profile;

import java.util.Optional;

/**
 * Resolves profiles by id.
 */
public interface ProfileLookup {

    Optional<Profile> find(String id);
}
