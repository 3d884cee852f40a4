package com.network.matching.health;

import com.network.matching.ai.CohereClient;
import com.network.matching.ai.NoOpEmbedder;
import com.network.matching.ai.NoOpQueryParser;
import com.network.matching.ai.NoOpReranker;
import com.network.matching.core.model.Profile;
import com.network.matching.store.ProfileStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthCheckRegistry")
    class Registry {

        @Test
        @DisplayName("Should be UP without checks")
        void noChecks() {
            HealthStatus status = new HealthCheckRegistry().checkAll();

            assertTrue(status.isUp());
            assertEquals("No health checks registered", status.message());
        }

        @Test
        @DisplayName("Should report the worst status with its check name")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.up()));
            registry.register(check("b", HealthStatus.degraded("slow")));
            registry.register(check("c", HealthStatus.down("gone")));
            registry.register(null);

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            assertEquals("c: gone", status.message());
            assertEquals(3, status.details().size());
            assertEquals(3, registry.size());
        }

        @Test
        @DisplayName("Should keep per-check details")
        @SuppressWarnings("unchecked")
        void perCheckDetails() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.up().withDetail("k", 1)));

            Map<String, Object> a = (Map<String, Object>) registry.checkAll().details().get("a");

            assertEquals("UP", a.get("status"));
            assertEquals(Map.of("k", 1), a.get("details"));
        }

        private HealthCheck check(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }
    }

    @Nested
    @DisplayName("ProfileStoreHealthCheck")
    class StoreCheck {

        @Test
        @DisplayName("Should be DOWN before a load")
        void downBeforeLoad() {
            assertTrue(new ProfileStoreHealthCheck(new ProfileStore()).check().isDown());
        }

        @Test
        @DisplayName("Should be DEGRADED for an empty population")
        void degradedWhenEmpty() {
            ProfileStore store = new ProfileStore();
            store.load(List.of(), List.of());

            assertTrue(new ProfileStoreHealthCheck(store).check().isDegraded());
        }

        @Test
        @DisplayName("Should be UP with counts once loaded")
        void upWhenLoaded() {
            ProfileStore store = new ProfileStore();
            store.load(List.of(Profile.builder().id("a").connectionIds(List.of("b")).build(),
                    Profile.builder().id("b").build()), List.of());

            HealthStatus status = new ProfileStoreHealthCheck(store).check();

            assertTrue(status.isUp());
            assertEquals(2, status.details().get("profiles"));
            assertEquals(1, status.details().get("connections"));
        }
    }

    @Nested
    @DisplayName("CollaboratorHealthCheck")
    class Collaborators {

        @Test
        @DisplayName("Should be DEGRADED with no-op collaborators")
        void degradedWithNoOps() {
            HealthStatus status = new CollaboratorHealthCheck(new NoOpQueryParser(), new NoOpEmbedder(),
                    new NoOpReranker()).check();

            assertTrue(status.isDegraded());
            assertEquals("NoOp", status.details().get("queryParser"));
        }

        @Test
        @DisplayName("Should be UP with configured collaborators")
        void upWithCohere() {
            CohereClient cohere = CohereClient.builder().apiKey("key").build();

            HealthStatus status = new CollaboratorHealthCheck(cohere, cohere, cohere).check();

            assertTrue(status.isUp());
            assertEquals("Cohere", status.details().get("reranker"));
        }
    }
}
