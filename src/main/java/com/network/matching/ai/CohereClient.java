package com.network.matching.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.network.matching.core.model.Embedding;
import com.network.matching.core.model.ExperienceLevel;
import com.network.matching.core.model.ParsedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cohere adapter implementing query parsing (chat endpoint), embedding (embed endpoint)
 * and reranking (rerank endpoint).
 *
 * Usage:
 * <pre>
 * CohereClient cohere = CohereClient.builder()
 *     .apiKey(System.getenv("COHERE_API_KEY"))
 *     .build();
 *
 * ConnectionMatcher matcher = ConnectionMatcher.builder()
 *     .queryParser(cohere)
 *     .embedder(cohere)
 *     .reranker(cohere)
 *     .options(MatchingOptions.reranked())
 *     .build();
 * </pre>
 */
public class CohereClient implements QueryParser, Embedder, Reranker {
    private static final Logger log = LoggerFactory.getLogger(CohereClient.class);

    private static final String DEFAULT_BASE_URL = "https://api.cohere.ai";
    private static final String DEFAULT_CHAT_MODEL = "command-r-plus-08-2024";
    private static final String DEFAULT_EMBED_MODEL = "embed-v4.0";
    private static final String DEFAULT_RERANK_MODEL = "rerank-english-v3.0";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    private static final double PARSE_TEMPERATURE = 0.1;
    private static final int PARSE_MAX_TOKENS = 500;

    private final String apiKey;
    private final String baseUrl;
    private final String chatModel;
    private final String embedModel;
    private final String rerankModel;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private CohereClient(Builder builder) {
        this.apiKey = builder.apiKey;
        this.baseUrl = trimTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
        this.chatModel = builder.chatModel != null ? builder.chatModel : DEFAULT_CHAT_MODEL;
        this.embedModel = builder.embedModel != null ? builder.embedModel : DEFAULT_EMBED_MODEL;
        this.rerankModel = builder.rerankModel != null ? builder.rerankModel : DEFAULT_RERANK_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public ParsedQuery parse(String query) {
        log.info("Parsing networking query via Cohere chat model {}", chatModel);
        ChatRequest request = new ChatRequest(chatModel, buildParsePrompt(query), PARSE_TEMPERATURE, PARSE_MAX_TOKENS);
        String body = post("/v1/chat", request, "parser");
        try {
            ChatResponse response = objectMapper.readValue(body, ChatResponse.class);
            return parseQueryJson(response.text());
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("parser", "Malformed chat response", e);
        }
    }

    @Override
    public List<Embedding> embed(List<String> texts, EmbeddingPurpose purpose) {
        if (texts.isEmpty()) {
            return List.of();
        }
        log.debug("Embedding {} texts as {} with model {}", texts.size(), purpose, embedModel);
        EmbedRequest request = new EmbedRequest(embedModel, texts, inputType(purpose), List.of("float"));
        return readEmbeddings(post("/v1/embed", request, "embedder"), texts.size());
    }

    @Override
    public List<RerankResult> rerank(String query, List<RerankDocument> documents, int topN) {
        if (documents.isEmpty()) {
            return List.of();
        }
        log.debug("Reranking {} documents with model {} (top_n={})", documents.size(), rerankModel, topN);
        List<String> texts = documents.stream().map(RerankDocument::text).toList();
        RerankRequest request = new RerankRequest(rerankModel, query, texts, topN, false);
        return readRerankResults(post("/v1/rerank", request, "reranker"), documents);
    }

    @Override
    public String getProviderName() {
        return "Cohere";
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Builds the chat prompt asking for the structured query criteria as JSON.
     */
    static String buildParsePrompt(String query) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Parse this professional networking query and extract structured criteria. ");
        prompt.append("Return a JSON object with the following fields:\n");
        prompt.append("- job_titles: List of job titles mentioned (e.g., [\"AI Engineer\", \"Software Engineer\"])\n");
        prompt.append("- companies: List of companies mentioned (e.g., [\"Google\", \"Microsoft\"])\n");
        prompt.append("- skills: List of skills mentioned (e.g., [\"Python\", \"Machine Learning\"])\n");
        prompt.append("- industries: List of industries mentioned (e.g., [\"Technology\", \"Healthcare\"])\n");
        prompt.append("- experience_level: Experience level if mentioned (\"junior\", \"senior\", \"executive\", or \"any\")\n");
        prompt.append("- education: Education requirements if mentioned (e.g., [\"Stanford\", \"MIT\"] or [\"PhD\", \"Masters\"])\n");
        prompt.append("- other_criteria: Any other specific requirements\n\n");
        prompt.append("Query: \"").append(query).append("\"\n\n");
        prompt.append("Return only valid JSON:\n");
        return prompt.toString();
    }

    /**
     * Reads the JSON object the chat model produced. Text around the outermost braces
     * (such as a markdown code fence) is ignored.
     */
    ParsedQuery parseQueryJson(String text) {
        if (text == null) {
            throw new CollaboratorException("parser", "Chat response has no text");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new CollaboratorException("parser", "Chat response does not contain a JSON object");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("parser", "Chat response is not valid JSON", e);
        }
        return ParsedQuery.builder()
                .jobTitles(stringList(root.get("job_titles")))
                .companies(stringList(root.get("companies")))
                .skills(stringList(root.get("skills")))
                .industries(stringList(root.get("industries")))
                .experienceLevel(ExperienceLevel.fromString(textOrNull(root.get("experience_level"))))
                .education(stringList(root.get("education")))
                .otherCriteria(otherCriteria(root.get("other_criteria")))
                .build();
    }

    List<Embedding> readEmbeddings(String body, int expected) {
        EmbedResponse response;
        try {
            response = objectMapper.readValue(body, EmbedResponse.class);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("embedder", "Malformed embed response", e);
        }
        if (response.embeddings() == null || response.embeddings().floats() == null) {
            throw new CollaboratorException("embedder", "Embed response has no float embeddings");
        }
        List<List<Double>> vectors = response.embeddings().floats();
        if (vectors.size() != expected) {
            throw new CollaboratorException("embedder",
                    "Expected " + expected + " embeddings but received " + vectors.size());
        }
        List<Embedding> embeddings = new ArrayList<>(vectors.size());
        for (List<Double> vector : vectors) {
            embeddings.add(Embedding.of(vector));
        }
        return embeddings;
    }

    List<RerankResult> readRerankResults(String body, List<RerankDocument> documents) {
        RerankResponse response;
        try {
            response = objectMapper.readValue(body, RerankResponse.class);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("reranker", "Malformed rerank response", e);
        }
        if (response.results() == null) {
            throw new CollaboratorException("reranker", "Rerank response has no results");
        }
        List<RerankResult> results = new ArrayList<>(response.results().size());
        int rank = 1;
        for (RerankHit hit : response.results()) {
            if (hit.index() < 0 || hit.index() >= documents.size()) {
                throw new CollaboratorException("reranker", "Rerank result index " + hit.index() + " out of range");
            }
            results.add(new RerankResult(documents.get(hit.index()).id(), hit.relevanceScore(), rank++));
        }
        return results;
    }

    private String post(String path, Object payload, String collaborator) {
        if (!isAvailable()) {
            throw new CollaboratorException(collaborator, "Cohere API key is not configured");
        }
        try {
            String requestBody = objectMapper.writeValueAsString(payload);
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.error("Cohere {} returned status {}: {}", path, response.statusCode(), response.body());
                throw new CollaboratorException(collaborator, "Cohere returned status " + response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new CollaboratorException(collaborator, "Error calling Cohere " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(collaborator, "Interrupted calling Cohere " + path, e);
        }
    }

    private static String inputType(EmbeddingPurpose purpose) {
        return purpose == EmbeddingPurpose.QUERY ? "search_query" : "search_document";
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isValueNode() && !element.isNull()) {
                    values.add(element.asText());
                }
            }
        } else if (node.isValueNode()) {
            values.add(node.asText());
        }
        return values;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String otherCriteria(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<String> values = stringList(node);
            return values.isEmpty() ? null : String.join(", ", values);
        }
        String text = node.isValueNode() ? node.asText() : node.toString();
        return text.isBlank() ? null : text;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String apiKey;
        private String baseUrl;
        private String chatModel;
        private String embedModel;
        private String rerankModel;
        private Duration timeout;

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder chatModel(String chatModel) {
            this.chatModel = chatModel;
            return this;
        }

        public Builder embedModel(String embedModel) {
            this.embedModel = embedModel;
            return this;
        }

        public Builder rerankModel(String rerankModel) {
            this.rerankModel = rerankModel;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout is required");
            return this;
        }

        public CohereClient build() {
            return new CohereClient(this);
        }
    }

    // Request/Response DTOs for the Cohere API
    private record ChatRequest(
            String model,
            String message,
            double temperature,
            @JsonProperty("max_tokens") int maxTokens
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatResponse(String text) {}

    private record EmbedRequest(
            String model,
            List<String> texts,
            @JsonProperty("input_type") String inputType,
            @JsonProperty("embedding_types") List<String> embeddingTypes
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbedResponse(EmbeddingsByType embeddings) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingsByType(@JsonProperty("float") List<List<Double>> floats) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record RerankRequest(
            String model,
            String query,
            List<String> documents,
            @JsonProperty("top_n") int topN,
            @JsonProperty("return_documents") boolean returnDocuments
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RerankResponse(List<RerankHit> results) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RerankHit(
            int index,
            @JsonProperty("relevance_score") double relevanceScore
    ) {}
}
