package com.network.matching.store;

/**
 * Runtime exception thrown when a profile id does not resolve to a loaded profile.
 */
public class ProfileNotFoundException extends RuntimeException {

    private final String profileId;

    public ProfileNotFoundException(String profileId) {
        super("Profile " + profileId + " not found");
        this.profileId = profileId;
    }

    public String getProfileId() {
        return profileId;
    }
}
