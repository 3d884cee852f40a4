package com.network.matching.similarity;

import com.network.matching.core.model.Education;
import com.network.matching.core.model.Embedding;
import com.network.matching.core.model.Interaction;
import com.network.matching.core.model.Profile;
import com.network.matching.core.model.WorkHistoryEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity Metric Tests")
class SimilarityMetricsTest {

    @Nested
    @DisplayName("JaccardSimilarity")
    class JaccardTests {

        private final JaccardSimilarity jaccard = new JaccardSimilarity();

        @Test
        @DisplayName("Should return 0 when either set is empty")
        void emptySets() {
            assertEquals(0.0, jaccard.compute(Set.of(), Set.of("a")));
            assertEquals(0.0, jaccard.compute(Set.of("a"), Set.of()));
            assertEquals(0.0, jaccard.compute(Set.of(), Set.of()));
        }

        @Test
        @DisplayName("Should return 1 for identical sets")
        void identicalSets() {
            assertEquals(1.0, jaccard.compute(Set.of("a", "b"), Set.of("b", "a")));
        }

        @Test
        @DisplayName("Should divide intersection by union")
        void partialOverlap() {
            assertEquals(1.0 / 3.0, jaccard.compute(Set.of("a", "b"), Set.of("b", "c")), 1e-9);
        }
    }

    @Nested
    @DisplayName("CosineSimilarity")
    class CosineTests {

        private final CosineSimilarity cosine = new CosineSimilarity();

        @Test
        @DisplayName("Should return 0 when an embedding is missing")
        void missingEmbedding() {
            assertEquals(0.0, cosine.compute(null, Embedding.of(1f, 0f)));
            assertEquals(0.0, cosine.compute(Embedding.of(1f, 0f), null));
        }

        @Test
        @DisplayName("Should return 1 for parallel vectors")
        void parallelVectors() {
            assertEquals(1.0, cosine.compute(Embedding.of(1f, 2f), Embedding.of(2f, 4f)), 1e-6);
        }

        @Test
        @DisplayName("Should clamp negative similarity to 0")
        void clampsNegative() {
            assertEquals(0.0, cosine.compute(Embedding.of(1f, 0f), Embedding.of(-1f, 0f)));
        }

        @Test
        @DisplayName("Should return 0 for a zero vector")
        void zeroVector() {
            assertEquals(0.0, cosine.compute(Embedding.of(0f, 0f), Embedding.of(1f, 1f)));
        }

        @Test
        @DisplayName("Should reject mismatched dimensions")
        void mismatchedDimensions() {
            assertThrows(IllegalArgumentException.class,
                    () -> cosine.compute(Embedding.of(1f, 0f), Embedding.of(1f, 0f, 0f)));
        }
    }

    @Nested
    @DisplayName("RelationshipStrength")
    class RelationshipTests {

        private final RelationshipStrength relationship = new RelationshipStrength();

        @Test
        @DisplayName("Should take the stronger direction")
        void takesMaxDirection() {
            Profile a = Profile.builder().id("a").addInteraction(Interaction.of("b", 0.3)).build();
            Profile b = Profile.builder().id("b").addInteraction(Interaction.of("a", 0.9)).build();

            assertEquals(0.9, relationship.compute(a, b));
            assertEquals(0.9, relationship.compute(b, a));
        }

        @Test
        @DisplayName("Should return 0 without interactions")
        void noInteractions() {
            assertEquals(0.0, relationship.compute(Profile.builder().id("a").build(),
                    Profile.builder().id("b").build()));
        }
    }

    @Nested
    @DisplayName("MutualConnectionOverlap")
    class MutualTests {

        @Test
        @DisplayName("Should compute Jaccard of connection sets")
        void jaccardOfConnections() {
            Profile a = Profile.builder().id("a").connectionIds(List.of("b", "c")).build();
            Profile d = Profile.builder().id("d").connectionIds(List.of("c", "e")).build();

            assertEquals(1.0 / 3.0, new MutualConnectionOverlap().compute(a, d), 1e-9);
        }
    }

    @Nested
    @DisplayName("CompanyOverlap")
    class CompanyTests {

        private final CompanyOverlap overlap = new CompanyOverlap();

        @Test
        @DisplayName("Should include current company and work history case-insensitively")
        void includesHistory() {
            Profile a = Profile.builder().id("a").company("Stripe")
                    .addWorkHistory(new WorkHistoryEntry("Google", "SWE", LocalDate.of(2015, 1, 1),
                            LocalDate.of(2018, 1, 1), false))
                    .build();
            Profile b = Profile.builder().id("b").company("google").build();

            assertEquals(0.5, overlap.compute(a, b));
        }

        @Test
        @DisplayName("Should return 0 when neither profile has companies")
        void noCompanies() {
            assertEquals(0.0, overlap.compute(Profile.builder().id("a").build(), Profile.builder().id("b").build()));
        }
    }

    @Nested
    @DisplayName("EducationSimilarity")
    class EducationTests {

        private final EducationSimilarity education = new EducationSimilarity();

        @ParameterizedTest(name = "{0}/{1} vs {2}/{3} = {4}")
        @CsvSource({
                "Stanford, MS, Stanford, MS, 1.0",
                "Stanford, MS, Stanford, PhD, 0.85",
                "Stanford, BS, Stanford, MS, 0.7",
                "Stanford, BS, MIT, BA, 0.15",
                "Stanford, MBA, MIT, MBA, 0.3",
                "Stanford, Diploma, MIT, Certificate, 0.0"
        })
        void scoresEducation(String uniA, String degreeA, String uniB, String degreeB, double expected) {
            assertEquals(expected, education.compute(new Education(uniA, degreeA, null),
                    new Education(uniB, degreeB, null)), 1e-9);
        }

        @Test
        @DisplayName("Should return 0 when either profile lacks education")
        void missingEducation() {
            Profile a = Profile.builder().id("a").education(new Education("MIT", "BS", "CS")).build();
            Profile b = Profile.builder().id("b").build();

            assertEquals(0.0, education.compute(a, b));
        }
    }

    @Nested
    @DisplayName("SimilarityWeights")
    class WeightsTests {

        @Test
        @DisplayName("Presets should be valid")
        void presetsAreValid() {
            assertDoesNotThrow(SimilarityWeights::defaultWeights);
            assertDoesNotThrow(SimilarityWeights::relationshipFocused);
            assertDoesNotThrow(SimilarityWeights::queryFocused);
        }

        @Test
        @DisplayName("Should reject weights that do not sum to 1")
        void rejectsBadSum() {
            assertThrows(IllegalArgumentException.class,
                    () -> new SimilarityWeights(0.5, 0.5, 0.5, 0.0, 0.0, 0.0));
        }

        @Test
        @DisplayName("Should reject negative weights")
        void rejectsNegative() {
            assertThrows(IllegalArgumentException.class,
                    () -> new SimilarityWeights(1.2, -0.2, 0.0, 0.0, 0.0, 0.0));
        }
    }
}
