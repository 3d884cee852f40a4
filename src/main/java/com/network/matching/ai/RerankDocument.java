package com.network.matching.ai;

import java.util.Objects;

/**
 * A candidate text submitted for reranking, tagged with the profile id it describes.
 */
public record RerankDocument(String id, String text) {
    public RerankDocument {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(text, "text is required");
    }
}
