package com.network.matching.stats;

import com.network.matching.core.model.Profile;
import com.network.matching.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes aggregate statistics over a {@link ProfileStore}.
 * Ties in the top-N lists keep the order in which values were first seen in load order.
 */
public class NetworkStatistics {
    private static final Logger log = LoggerFactory.getLogger(NetworkStatistics.class);

    static final int TOP_COMPANIES = 10;
    static final int TOP_INDUSTRIES = 5;
    static final int TOP_JOB_TITLES = 10;

    public StatsSummary compute(ProfileStore store) {
        List<Profile> profiles = store.all();
        if (profiles.isEmpty()) {
            return StatsSummary.empty();
        }

        int degreeSum = 0;
        for (Profile profile : profiles) {
            degreeSum += profile.getConnectionIds().size();
        }
        int totalConnections = degreeSum / 2;
        double averageDegree = BigDecimal.valueOf(2.0 * totalConnections / profiles.size())
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();

        StatsSummary summary = new StatsSummary(
                profiles.size(),
                totalConnections,
                averageDegree,
                topValues(profiles, Profile::getCompany, TOP_COMPANIES),
                topValues(profiles, Profile::getIndustry, TOP_INDUSTRIES),
                topValues(profiles, Profile::getJobTitle, TOP_JOB_TITLES));
        log.debug("stats.computed profiles={} connections={}", summary.totalProfiles(), summary.totalConnections());
        return summary;
    }

    private static List<RankedCount> topValues(List<Profile> profiles,
                                               Function<Profile, Optional<String>> attribute, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Profile profile : profiles) {
            attribute.apply(profile).ifPresent(value -> counts.merge(value, 1, Integer::sum));
        }
        // Stream.sorted is stable for ordered streams, so ties keep first-seen order.
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .map(entry -> new RankedCount(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }
}
