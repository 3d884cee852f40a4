package com.network.matching.ai;

import com.network.matching.core.model.Embedding;
import com.network.matching.core.model.ExperienceLevel;
import com.network.matching.core.model.ParsedQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CohereClient Tests")
class CohereClientTest {

    private final CohereClient client = CohereClient.builder().apiKey("test-key").build();

    @Nested
    @DisplayName("Availability")
    class Availability {

        @Test
        @DisplayName("Should be available only with an API key")
        void availability() {
            assertTrue(client.isAvailable());
            assertFalse(CohereClient.builder().build().isAvailable());
            assertFalse(CohereClient.builder().apiKey("  ").build().isAvailable());
            assertEquals("Cohere", client.getProviderName());
        }

        @Test
        @DisplayName("Should fail calls without an API key before any request is sent")
        void failsWithoutKey() {
            CohereClient unconfigured = CohereClient.builder().build();

            CollaboratorException parse = assertThrows(CollaboratorException.class,
                    () -> unconfigured.parse("engineers at Google"));
            CollaboratorException embed = assertThrows(CollaboratorException.class,
                    () -> unconfigured.embed(List.of("text"), EmbeddingPurpose.QUERY));
            CollaboratorException rerank = assertThrows(CollaboratorException.class,
                    () -> unconfigured.rerank("q", List.of(new RerankDocument("a", "doc")), 1));

            assertEquals("parser", parse.getCollaborator());
            assertEquals("embedder", embed.getCollaborator());
            assertEquals("reranker", rerank.getCollaborator());
        }

        @Test
        @DisplayName("Should short-circuit empty inputs")
        void emptyInputs() {
            CohereClient unconfigured = CohereClient.builder().build();

            assertTrue(unconfigured.embed(List.of(), EmbeddingPurpose.DOCUMENT).isEmpty());
            assertTrue(unconfigured.rerank("q", List.of(), 5).isEmpty());
        }
    }

    @Nested
    @DisplayName("Query parsing")
    class QueryParsing {

        @Test
        @DisplayName("Prompt should embed the query and list every field")
        void prompt() {
            String prompt = CohereClient.buildParsePrompt("PMs at Stripe");

            assertTrue(prompt.contains("Query: \"PMs at Stripe\""));
            assertTrue(prompt.contains("job_titles"));
            assertTrue(prompt.contains("experience_level"));
            assertTrue(prompt.contains("other_criteria"));
        }

        @Test
        @DisplayName("Should read the JSON object inside a markdown fence")
        void readsFencedJson() {
            String text = """
                    Here you go:
                    ```json
                    {"job_titles": ["Product Manager"], "companies": ["Stripe"],
                     "skills": ["SQL"], "industries": [], "experience_level": "senior",
                     "education": ["Stanford"], "other_criteria": "remote"}
                    ```
                    """;

            ParsedQuery parsed = client.parseQueryJson(text);

            assertEquals(List.of("Product Manager"), parsed.jobTitles());
            assertEquals(List.of("Stripe"), parsed.companies());
            assertEquals(List.of("SQL"), parsed.skills());
            assertTrue(parsed.industries().isEmpty());
            assertEquals(ExperienceLevel.SENIOR, parsed.experienceLevel());
            assertEquals(List.of("Stanford"), parsed.education());
            assertEquals("remote", parsed.otherCriteria());
        }

        @Test
        @DisplayName("Should tolerate missing fields and unknown levels")
        void missingFields() {
            ParsedQuery parsed = client.parseQueryJson("{\"skills\": \"Python\", \"experience_level\": \"guru\"}");

            assertEquals(List.of("Python"), parsed.skills());
            assertTrue(parsed.jobTitles().isEmpty());
            assertEquals(ExperienceLevel.ANY, parsed.experienceLevel());
            assertNull(parsed.otherCriteria());
        }

        @Test
        @DisplayName("Should join list-valued other criteria")
        void otherCriteriaList() {
            ParsedQuery parsed = client.parseQueryJson("{\"other_criteria\": [\"remote\", \"Bay Area\"]}");

            assertEquals("remote, Bay Area", parsed.otherCriteria());
        }

        @Test
        @DisplayName("Should fail when no JSON object is present")
        void noJson() {
            CollaboratorException ex = assertThrows(CollaboratorException.class,
                    () -> client.parseQueryJson("I could not understand the query"));
            assertEquals("parser", ex.getCollaborator());
        }

        @Test
        @DisplayName("Should fail on invalid JSON")
        void invalidJson() {
            assertThrows(CollaboratorException.class, () -> client.parseQueryJson("{job_titles: [}"));
        }
    }

    @Nested
    @DisplayName("Embedding responses")
    class EmbeddingResponses {

        @Test
        @DisplayName("Should read float embeddings in input order")
        void readsFloats() {
            String body = "{\"id\":\"x\",\"embeddings\":{\"float\":[[0.1,0.2],[0.3,0.4]]},\"texts\":[\"a\",\"b\"]}";

            List<Embedding> embeddings = client.readEmbeddings(body, 2);

            assertEquals(2, embeddings.size());
            assertEquals(2, embeddings.get(0).dimension());
            assertEquals(0.3f, embeddings.get(1).get(0), 1e-6);
        }

        @Test
        @DisplayName("Should fail when the count differs from the request")
        void countMismatch() {
            String body = "{\"embeddings\":{\"float\":[[0.1,0.2]]}}";

            assertThrows(CollaboratorException.class, () -> client.readEmbeddings(body, 2));
        }

        @Test
        @DisplayName("Should fail when float embeddings are absent")
        void missingFloats() {
            assertThrows(CollaboratorException.class, () -> client.readEmbeddings("{\"embeddings\":{}}", 1));
        }
    }

    @Nested
    @DisplayName("Rerank responses")
    class RerankResponses {

        private final List<RerankDocument> documents = List.of(
                new RerankDocument("p1", "first"),
                new RerankDocument("p2", "second"),
                new RerankDocument("p3", "third"));

        @Test
        @DisplayName("Should map result indexes back to document ids and assign ranks")
        void mapsIndexes() {
            String body = "{\"results\":[{\"index\":2,\"relevance_score\":0.91},{\"index\":0,\"relevance_score\":0.42}]}";

            List<RerankResult> results = client.readRerankResults(body, documents);

            assertEquals(2, results.size());
            assertEquals("p3", results.get(0).id());
            assertEquals(0.91, results.get(0).relevanceScore());
            assertEquals(1, results.get(0).rank());
            assertEquals("p1", results.get(1).id());
            assertEquals(2, results.get(1).rank());
        }

        @Test
        @DisplayName("Should fail on an out-of-range index")
        void outOfRange() {
            String body = "{\"results\":[{\"index\":3,\"relevance_score\":0.5}]}";

            assertThrows(CollaboratorException.class, () -> client.readRerankResults(body, documents));
        }
    }
}
