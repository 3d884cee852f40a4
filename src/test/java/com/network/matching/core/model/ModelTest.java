package com.network.matching.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model Tests")
class ModelTest {

    @Nested
    @DisplayName("Profile")
    class ProfileTests {

        @Test
        @DisplayName("Should deduplicate skills and connections keeping first-seen order")
        void deduplicates() {
            Profile profile = Profile.builder()
                    .id("p1")
                    .skills(Arrays.asList("Java", "Go", "Java", null))
                    .connectionIds(List.of("p3", "p2", "p3"))
                    .build();

            assertEquals(List.of("Java", "Go"), profile.getSkills());
            assertEquals(List.of("p3", "p2"), profile.getConnectionIds());
            assertTrue(profile.isConnectedTo("p2"));
        }

        @Test
        @DisplayName("Should keep the last interaction per target")
        void interactionsByTarget() {
            Profile profile = Profile.builder()
                    .id("p1")
                    .addInteraction(Interaction.of("p2", 0.2))
                    .addInteraction(Interaction.of("p2", 0.7))
                    .build();

            assertEquals(1, profile.getInteractions().size());
            assertEquals(0.7, profile.getInteractionWith("p2").orElseThrow().strength());
            assertTrue(profile.getInteractionWith("p9").isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  "})
        @DisplayName("Should reject a blank id")
        void blankId(String id) {
            assertThrows(IllegalArgumentException.class, () -> Profile.builder().id(id).build());
        }

        @Test
        @DisplayName("Should require an id")
        void missingId() {
            assertThrows(NullPointerException.class, () -> Profile.builder().name("Nobody").build());
        }

        @Test
        @DisplayName("Equality should be by id")
        void equalityById() {
            Profile first = Profile.builder().id("p1").name("Alice").build();
            Profile renamed = first.toBuilder().name("Alice Park").build();

            assertEquals(first, renamed);
            assertEquals("Alice Park", renamed.toSummary().name());
        }
    }

    @Nested
    @DisplayName("Value records")
    class ValueRecords {

        @ParameterizedTest
        @ValueSource(doubles = {-0.1, 1.5, Double.NaN})
        @DisplayName("Interaction should reject strength outside [0, 1]")
        void interactionStrength(double strength) {
            assertThrows(IllegalArgumentException.class, () -> Interaction.of("p2", strength));
        }

        @Test
        @DisplayName("Work history should reject an end date before the start date")
        void workHistoryDates() {
            LocalDate start = LocalDate.of(2020, 1, 1);

            assertThrows(IllegalArgumentException.class,
                    () -> new WorkHistoryEntry("Stripe", "Engineer", start, start.minusDays(1), false));
            assertTrue(new WorkHistoryEntry("Stripe", "Engineer", start, null, true).hasCompany());
            assertFalse(new WorkHistoryEntry(" ", null, null, null, false).hasCompany());
        }

        @Test
        @DisplayName("Parsed query should drop blank criteria")
        void parsedQueryCleaning() {
            ParsedQuery query = new ParsedQuery(Arrays.asList(" CTO ", "", null), null, List.of(), null,
                    null, null, "remote");

            assertEquals(List.of("CTO"), query.jobTitles());
            assertTrue(query.companies().isEmpty());
            assertEquals(ExperienceLevel.ANY, query.experienceLevel());
            assertTrue(query.hasCriteria());
            assertFalse(ParsedQuery.unstructured("anything").hasCriteria());
        }

        @ParameterizedTest
        @CsvSource({
                "senior, SENIOR",
                "' Executive ', EXECUTIVE",
                "principal, ANY",
                "'', ANY"
        })
        @DisplayName("Experience level parsing should fall back to ANY")
        void experienceLevel(String value, ExperienceLevel expected) {
            assertEquals(expected, ExperienceLevel.fromString(value));
        }

        @Test
        @DisplayName("Embedding should copy its input and reject empty vectors")
        void embedding() {
            float[] values = {1f, 2f};
            Embedding embedding = Embedding.of(values);
            values[0] = 9f;

            assertEquals(1f, embedding.get(0));
            assertEquals(2, embedding.dimension());
            assertEquals(embedding, Embedding.of(List.of(1, 2)));
            assertThrows(IllegalArgumentException.class, () -> Embedding.of(new float[0]));
        }
    }
}
