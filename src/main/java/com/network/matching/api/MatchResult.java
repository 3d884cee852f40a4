package com.network.matching.api;

import com.network.matching.core.model.Profile;
import com.network.matching.core.model.ProfileSummary;
import com.network.matching.graph.ConnectionPath;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One ranked candidate in a {@link MatchResponse}.
 *
 * @param rank              1-based position
 * @param profile           the candidate
 * @param totalScore        score used for ranking
 * @param scoreBreakdown    per-metric scores in a stable order
 * @param mutualConnections up to five connections shared with the requester
 * @param highlights        the candidate's first five skills
 * @param connectionPath    how the requester can reach the candidate
 * @param explanation       human-readable reasons, null when explanations were not requested
 */
public record MatchResult(
        int rank,
        Profile profile,
        double totalScore,
        Map<String, Double> scoreBreakdown,
        List<ProfileSummary> mutualConnections,
        List<String> highlights,
        ConnectionPath connectionPath,
        String explanation
) {
    public MatchResult {
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1");
        }
        Objects.requireNonNull(profile, "profile is required");
        Objects.requireNonNull(connectionPath, "connectionPath is required");
        scoreBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(scoreBreakdown));
        mutualConnections = List.copyOf(mutualConnections);
        highlights = List.copyOf(highlights);
    }

    public Optional<String> getExplanation() {
        return Optional.ofNullable(explanation);
    }
}
