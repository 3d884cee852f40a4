package com.network.matching.health;

import com.network.matching.store.ProfileStore;

/**
 * DOWN until a population has been loaded, DEGRADED while the loaded population is empty.
 */
public class ProfileStoreHealthCheck implements HealthCheck {

    private final ProfileStore store;

    public ProfileStoreHealthCheck(ProfileStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "profileStore";
    }

    @Override
    public HealthStatus check() {
        if (!store.isLoaded()) {
            return HealthStatus.down("No population loaded");
        }
        int profiles = store.size();
        HealthStatus base = profiles == 0
                ? HealthStatus.degraded("Loaded population is empty")
                : HealthStatus.up();
        return base
                .withDetail("profiles", profiles)
                .withDetail("connections", store.connectionCount());
    }
}
