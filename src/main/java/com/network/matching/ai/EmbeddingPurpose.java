package com.network.matching.ai;

/**
 * What an embedded text is used for. Embedding services produce different vectors for
 * search queries and for the documents being searched.
 */
public enum EmbeddingPurpose {
    DOCUMENT,
    QUERY
}
