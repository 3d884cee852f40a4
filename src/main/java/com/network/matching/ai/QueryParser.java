package com.network.matching.ai;

import com.network.matching.core.model.ParsedQuery;

/**
 * Turns a natural-language networking query into structured criteria.
 */
public interface QueryParser {

    /**
     * Parses the query.
     *
     * @param query free text such as "AI engineers who worked at a large search company"
     * @return the structured criteria, never null
     * @throws CollaboratorException if the upstream service fails or its response is malformed
     */
    ParsedQuery parse(String query);

    String getProviderName();

    boolean isAvailable();
}
