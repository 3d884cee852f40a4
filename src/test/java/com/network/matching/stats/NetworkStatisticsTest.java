package com.network.matching.stats;

import com.network.matching.core.model.Profile;
import com.network.matching.source.JsonProfileSource;
import com.network.matching.source.ProfilePopulation;
import com.network.matching.store.ProfileStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NetworkStatistics Tests")
class NetworkStatisticsTest {

    private final NetworkStatistics statistics = new NetworkStatistics();

    @Test
    @DisplayName("Should summarize the sample network")
    void summarizesSample() {
        ProfileStore store = new ProfileStore();
        ProfilePopulation population = JsonProfileSource.fromClasspath("network-sample.json").read(100);
        store.load(population.profiles(), population.edges());

        StatsSummary summary = statistics.compute(store);

        assertEquals(6, summary.totalProfiles());
        assertEquals(5, summary.totalConnections());
        assertEquals(1.7, summary.averageDegree());
        assertEquals(new RankedCount("Stripe", 3), summary.topCompanies().get(0));
        assertEquals(new RankedCount("Google", 2), summary.topCompanies().get(1));
        assertEquals(List.of(new RankedCount("Fintech", 3), new RankedCount("Technology", 2),
                new RankedCount("Travel", 1)), summary.topIndustries());
    }

    @Test
    @DisplayName("Should return the empty summary for an empty store")
    void emptyStore() {
        assertEquals(StatsSummary.empty(), statistics.compute(new ProfileStore()));
    }

    @Test
    @DisplayName("Should round the average degree half up to one decimal")
    void roundsHalfUp() {
        List<Profile> profiles = new ArrayList<>();
        profiles.add(Profile.builder().id("a").connectionIds(List.of("b")).build());
        for (char c = 'b'; c <= 'h'; c++) {
            profiles.add(Profile.builder().id(String.valueOf(c)).build());
        }
        ProfileStore store = new ProfileStore();
        store.load(profiles, List.of());

        // 2 * 1 / 8 = 0.25
        assertEquals(0.3, statistics.compute(store).averageDegree());
    }

    @Test
    @DisplayName("Should cap top lists and keep first-seen order on ties")
    void capsAndBreaksTies() {
        List<Profile> profiles = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            profiles.add(Profile.builder().id("p" + i).company("Company" + i).industry("Industry" + (i % 7)).build());
        }
        ProfileStore store = new ProfileStore();
        store.load(profiles, List.of());

        StatsSummary summary = statistics.compute(store);

        assertEquals(10, summary.topCompanies().size());
        assertEquals("Company0", summary.topCompanies().get(0).value());
        assertEquals("Company9", summary.topCompanies().get(9).value());
        assertEquals(5, summary.topIndustries().size());
        assertEquals(List.of("Industry0", "Industry1", "Industry2", "Industry3", "Industry4"),
                summary.topIndustries().stream().map(RankedCount::value).toList());
        assertTrue(summary.topJobTitles().isEmpty());
    }

    @Test
    @DisplayName("Should be idempotent")
    void idempotent() {
        ProfileStore store = new ProfileStore();
        store.load(List.of(Profile.builder().id("a").company("X").connectionIds(List.of("b")).build(),
                Profile.builder().id("b").company("X").build()), List.of());

        assertEquals(statistics.compute(store), statistics.compute(store));
    }
}
