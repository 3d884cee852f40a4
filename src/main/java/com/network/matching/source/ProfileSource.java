package com.network.matching.source;

/**
 * Supplies a self-consistent profile population.
 */
public interface ProfileSource {

    /**
     * Reads at most {@code maxProfiles} profiles. When profiles are dropped to honour the limit,
     * connections and interactions pointing at them are dropped too.
     *
     * @throws IllegalArgumentException if {@code maxProfiles <= 0}
     * @throws ProfileSourceException   if the population cannot be read
     */
    ProfilePopulation read(int maxProfiles);

    /**
     * Short description used in logs, such as the file path.
     */
    String getDescription();
}
