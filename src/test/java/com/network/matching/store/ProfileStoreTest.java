package com.network.matching.store;

import com.network.matching.core.model.ConnectionEdge;
import com.network.matching.core.model.Interaction;
import com.network.matching.core.model.Profile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProfileStore Tests")
class ProfileStoreTest {

    private ProfileStore store;

    @BeforeEach
    void setUp() {
        store = new ProfileStore();
    }

    private static Profile profile(String id, String... connections) {
        return Profile.builder().id(id).name("Name " + id).connectionIds(List.of(connections)).build();
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Should start empty and unloaded")
        void startsEmpty() {
            assertFalse(store.isLoaded());
            assertEquals(0, store.size());
            assertTrue(store.all().isEmpty());
        }

        @Test
        @DisplayName("Should insert missing back-edges so connections are symmetric")
        void insertsBackEdges() {
            LoadResult result = store.load(List.of(profile("a", "b"), profile("b"), profile("c")),
                    List.of(new ConnectionEdge("c", "a")));

            assertEquals(3, result.profileCount());
            assertEquals(2, result.connectionCount());
            assertEquals(2, result.backEdgesAdded());
            assertTrue(store.get("b").isConnectedTo("a"));
            assertTrue(store.get("a").isConnectedTo("c"));
            assertEquals(List.of("b", "c"), store.get("a").getConnectionIds());
        }

        @Test
        @DisplayName("Should not count already symmetric connections as back-edges")
        void symmetricInputNeedsNoBackEdges() {
            LoadResult result = store.load(List.of(profile("a", "b"), profile("b", "a")), List.of());

            assertEquals(1, result.connectionCount());
            assertEquals(0, result.backEdgesAdded());
        }

        @Test
        @DisplayName("Should count interactions")
        void countsInteractions() {
            Profile a = Profile.builder().id("a").addInteraction(Interaction.of("b", 0.8)).build();
            LoadResult result = store.load(List.of(a, profile("b")), null);

            assertEquals(1, result.interactionCount());
            assertEquals(0, result.connectionCount());
        }

        @Test
        @DisplayName("Should enumerate profiles in load order")
        void keepsLoadOrder() {
            store.load(List.of(profile("z"), profile("a"), profile("m")), List.of());

            assertEquals(List.of("z", "a", "m"), store.all().stream().map(Profile::getId).toList());
            assertEquals(List.of("z", "m"), store.allExcept("a").stream().map(Profile::getId).toList());
        }
    }

    @Nested
    @DisplayName("Integrity")
    class Integrity {

        @Test
        @DisplayName("Should reject a connection to an unknown profile")
        void rejectsUnknownConnection() {
            DataIntegrityException ex = assertThrows(DataIntegrityException.class,
                    () -> store.load(List.of(profile("a", "ghost")), List.of()));

            assertEquals(1, ex.getViolations().size());
            assertTrue(ex.getViolations().get(0).contains("ghost"));
        }

        @Test
        @DisplayName("Should reject an interaction with an unknown profile")
        void rejectsUnknownInteraction() {
            Profile a = Profile.builder().id("a").addInteraction(Interaction.of("ghost", 0.5)).build();

            assertThrows(DataIntegrityException.class, () -> store.load(List.of(a), List.of()));
        }

        @Test
        @DisplayName("Should reject duplicate ids and self references")
        void rejectsDuplicatesAndSelfReferences() {
            DataIntegrityException ex = assertThrows(DataIntegrityException.class,
                    () -> store.load(List.of(profile("a", "a"), profile("b"), profile("b")), List.of()));

            assertEquals(2, ex.getViolations().size());
        }

        @Test
        @DisplayName("Should reject edges whose source is unknown")
        void rejectsUnknownEdgeSource() {
            assertThrows(DataIntegrityException.class,
                    () -> store.load(List.of(profile("a")), List.of(new ConnectionEdge("x", "a"))));
        }

        @Test
        @DisplayName("Should keep the previous population after a rejected load")
        void keepsPreviousPopulation() {
            store.load(List.of(profile("a", "b"), profile("b")), List.of());

            assertThrows(DataIntegrityException.class,
                    () -> store.load(List.of(profile("c", "ghost")), List.of()));

            assertEquals(2, store.size());
            assertTrue(store.contains("a"));
            assertFalse(store.contains("c"));
        }

        @Test
        @DisplayName("Should cap the number of violations listed in the message")
        void capsMessage() {
            List<Profile> profiles = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                profiles.add(profile("p" + i, "missing" + i));
            }

            DataIntegrityException ex = assertThrows(DataIntegrityException.class,
                    () -> store.load(profiles, List.of()));

            assertEquals(30, ex.getViolations().size());
            assertTrue(ex.getMessage().endsWith("; ..."));
        }
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @BeforeEach
        void load() {
            store.load(List.of(profile("a", "b"), profile("b")), List.of());
        }

        @Test
        @DisplayName("Should throw ProfileNotFoundException for unknown ids")
        void unknownIdThrows() {
            ProfileNotFoundException ex = assertThrows(ProfileNotFoundException.class, () -> store.get("nope"));
            assertEquals("nope", ex.getProfileId());
        }

        @Test
        @DisplayName("Should return empty Optional from find for unknown ids")
        void findUnknown() {
            assertTrue(store.find("nope").isEmpty());
            assertTrue(store.find("a").isPresent());
        }

        @Test
        @DisplayName("Should report connection count")
        void connectionCount() {
            assertEquals(1, store.connectionCount());
            assertTrue(store.isLoaded());
        }

        @Test
        @DisplayName("A snapshot should keep its population across later loads")
        void snapshotIsStable() {
            PopulationSnapshot before = store.snapshot();

            store.load(List.of(profile("c")), List.of());

            assertEquals(2, before.size());
            assertEquals(List.of("b"), before.allExcept("a").stream().map(Profile::getId).toList());
            assertEquals("a", before.get("a").getId());
            assertThrows(ProfileNotFoundException.class, () -> before.get("c"));
            assertEquals(List.of("c"), store.snapshot().all().stream().map(Profile::getId).toList());
        }
    }

    @Test
    @DisplayName("Should notify reload listeners after a successful load only")
    void notifiesListeners() {
        List<LoadResult> seen = new ArrayList<>();
        store.addReloadListener(seen::add);

        store.load(List.of(profile("a")), List.of());
        assertThrows(DataIntegrityException.class, () -> store.load(List.of(profile("b", "x")), List.of()));

        assertEquals(1, seen.size());
        assertEquals(1, seen.get(0).profileCount());
    }
}
