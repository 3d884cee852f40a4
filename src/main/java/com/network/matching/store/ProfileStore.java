package com.network.matching.store;

import com.network.matching.core.model.ConnectionEdge;
import com.network.matching.core.model.Interaction;
import com.network.matching.core.model.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory arena of profiles keyed by id, with the undirected connection graph and
 * the directed interaction graph stored as id adjacency on each profile.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #load(Collection, Collection)} validates a complete population, inserts missing
 *       connection back-edges and publishes the result with a single atomic swap.</li>
 *   <li>A failed load throws {@link DataIntegrityException} and leaves the previous population
 *       in place. Readers never observe a partially loaded population.</li>
 *   <li>Published snapshots are immutable, so reads need no locking.</li>
 * </ul>
 */
public class ProfileStore implements ProfileLookup {
    private static final Logger log = LoggerFactory.getLogger(ProfileStore.class);

    private final AtomicReference<PopulationSnapshot> current = new AtomicReference<>(PopulationSnapshot.EMPTY);
    private final List<StoreReloadListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Replaces the whole population.
     *
     * @param profiles profiles to load, in the order they should be enumerated
     * @param edges    additional undirected connections, may be empty
     * @return counts describing the loaded population
     * @throws DataIntegrityException if ids are duplicated or any connection, edge or
     *                                interaction references a profile outside the population
     */
    public synchronized LoadResult load(Collection<Profile> profiles, Collection<ConnectionEdge> edges) {
        Objects.requireNonNull(profiles, "profiles are required");
        Collection<ConnectionEdge> extraEdges = edges != null ? edges : List.of();
        List<String> violations = new ArrayList<>();

        Map<String, Profile> byId = new LinkedHashMap<>();
        for (Profile profile : profiles) {
            if (byId.putIfAbsent(profile.getId(), profile) != null) {
                violations.add("duplicate profile id " + profile.getId());
            }
        }

        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (Profile profile : byId.values()) {
            Set<String> neighbours = new LinkedHashSet<>();
            for (String connectionId : profile.getConnectionIds()) {
                if (checkReference(profile.getId(), connectionId, "connection", byId, violations)) {
                    neighbours.add(connectionId);
                }
            }
            adjacency.put(profile.getId(), neighbours);
        }

        for (ConnectionEdge edge : extraEdges) {
            if (!byId.containsKey(edge.sourceId())) {
                violations.add("edge source " + edge.sourceId() + " is not a loaded profile");
                continue;
            }
            if (checkReference(edge.sourceId(), edge.targetId(), "edge", byId, violations)) {
                adjacency.get(edge.sourceId()).add(edge.targetId());
            }
        }

        int interactionCount = 0;
        for (Profile profile : byId.values()) {
            for (Interaction interaction : profile.getInteractions().values()) {
                checkReference(profile.getId(), interaction.targetId(), "interaction", byId, violations);
                interactionCount++;
            }
        }

        if (!violations.isEmpty()) {
            log.error("store.load.rejected violations={}", violations.size());
            throw new DataIntegrityException(violations);
        }

        int backEdgesAdded = 0;
        for (Map.Entry<String, Set<String>> entry : adjacency.entrySet()) {
            for (String neighbour : List.copyOf(entry.getValue())) {
                if (adjacency.get(neighbour).add(entry.getKey())) {
                    backEdgesAdded++;
                }
            }
        }

        Map<String, Profile> loaded = new LinkedHashMap<>();
        int degreeSum = 0;
        for (Profile profile : byId.values()) {
            Set<String> neighbours = adjacency.get(profile.getId());
            degreeSum += neighbours.size();
            loaded.put(profile.getId(), profile.toBuilder().connectionIds(neighbours).build());
        }

        PopulationSnapshot snapshot = new PopulationSnapshot(Collections.unmodifiableMap(loaded), degreeSum / 2);
        current.set(snapshot);

        LoadResult result = new LoadResult(loaded.size(), snapshot.connectionCount(),
                interactionCount, backEdgesAdded);
        log.info("store.loaded profiles={} connections={} interactions={} backEdgesAdded={}",
                result.profileCount(), result.connectionCount(), result.interactionCount(),
                result.backEdgesAdded());

        for (StoreReloadListener listener : listeners) {
            listener.onReload(result);
        }
        return result;
    }

    /**
     * Returns the current population. Callers needing several consistent reads take one
     * snapshot and read from it.
     */
    public PopulationSnapshot snapshot() {
        return current.get();
    }

    /**
     * Gets a profile by id.
     *
     * @throws ProfileNotFoundException if the id is not loaded
     */
    public Profile get(String id) {
        return current.get().get(id);
    }

    @Override
    public Optional<Profile> find(String id) {
        return current.get().find(id);
    }

    public boolean contains(String id) {
        return current.get().contains(id);
    }

    /**
     * Returns every loaded profile except {@code excludedId}, in load order.
     */
    public List<Profile> allExcept(String excludedId) {
        return current.get().allExcept(excludedId);
    }

    /**
     * Returns all loaded profiles in load order.
     */
    public List<Profile> all() {
        return current.get().all();
    }

    public int size() {
        return current.get().size();
    }

    public int connectionCount() {
        return current.get().connectionCount();
    }

    public boolean isLoaded() {
        return current.get() != PopulationSnapshot.EMPTY;
    }

    public void addReloadListener(StoreReloadListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    private static boolean checkReference(String ownerId, String referencedId, String kind,
                                          Map<String, Profile> byId, List<String> violations) {
        if (ownerId.equals(referencedId)) {
            violations.add(kind + " of " + ownerId + " references itself");
            return false;
        }
        if (!byId.containsKey(referencedId)) {
            violations.add(kind + " of " + ownerId + " references unknown profile " + referencedId);
            return false;
        }
        return true;
    }
}
