package com.network.matching.stats;

import java.util.List;

/**
 * Aggregate view of the loaded network.
 *
 * @param totalProfiles    number of loaded profiles
 * @param totalConnections number of undirected connections
 * @param averageDegree    average connections per profile, rounded to one decimal
 * @param topCompanies     up to 10 most frequent current companies
 * @param topIndustries    up to 5 most frequent industries
 * @param topJobTitles     up to 10 most frequent job titles
 */
public record StatsSummary(
        int totalProfiles,
        int totalConnections,
        double averageDegree,
        List<RankedCount> topCompanies,
        List<RankedCount> topIndustries,
        List<RankedCount> topJobTitles
) {
    public StatsSummary {
        topCompanies = List.copyOf(topCompanies);
        topIndustries = List.copyOf(topIndustries);
        topJobTitles = List.copyOf(topJobTitles);
    }

    public static StatsSummary empty() {
        return new StatsSummary(0, 0, 0.0, List.of(), List.of(), List.of());
    }
}
