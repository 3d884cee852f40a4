package com.network.matching.health;

/**
 * A check of one component of the matcher, such as the profile store or the collaborators.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
