package com.network.matching.graph;

import com.network.matching.core.model.Profile;
import com.network.matching.core.model.ProfileSummary;
import com.network.matching.store.ProfileLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only queries over the connection graph. Connection ids are resolved through a
 * {@link ProfileLookup}: the live store, or one population snapshot.
 *
 * <p>Search never goes beyond depth two.</p>
 */
public class GraphQueries {
    private static final Logger log = LoggerFactory.getLogger(GraphQueries.class);

    public static final int MAX_MUTUAL_CONNECTIONS = 5;

    private final ProfileLookup profiles;

    public GraphQueries(ProfileLookup profiles) {
        this.profiles = Objects.requireNonNull(profiles, "profiles are required");
    }

    /**
     * Finds connections shared by both profiles, in the first profile's connection order,
     * limited to {@value #MAX_MUTUAL_CONNECTIONS}.
     */
    public List<ProfileSummary> mutualConnections(Profile first, Profile second) {
        List<String> ids = mutualConnectionIds(first, second, MAX_MUTUAL_CONNECTIONS);
        List<ProfileSummary> summaries = new ArrayList<>(ids.size());
        for (String id : ids) {
            profiles.find(id).map(Profile::toSummary).ifPresent(summaries::add);
        }
        return summaries;
    }

    /**
     * Classifies the path from {@code requester} to {@code candidate}.
     */
    public ConnectionPath classifyPath(Profile requester, Profile candidate) {
        if (requester.isConnectedTo(candidate.getId())) {
            return ConnectionPath.direct();
        }
        List<String> mutual = mutualConnectionIds(requester, candidate, 1);
        if (mutual.isEmpty()) {
            return ConnectionPath.none();
        }
        String viaId = mutual.get(0);
        String viaName = profiles.find(viaId)
                .map(Profile::getName)
                .filter(name -> name != null && !name.isBlank())
                .orElse(viaId);
        log.debug("Two-hop path {} -> {} via {}", requester.getId(), candidate.getId(), viaId);
        return ConnectionPath.twoHop(viaName);
    }

    private static List<String> mutualConnectionIds(Profile first, Profile second, int limit) {
        Set<String> secondConnections = new HashSet<>(second.getConnectionIds());
        List<String> mutual = new ArrayList<>();
        for (String id : first.getConnectionIds()) {
            if (mutual.size() >= limit) {
                break;
            }
            if (secondConnections.contains(id)) {
                mutual.add(id);
            }
        }
        return mutual;
    }
}
