package com.network.matching.ai;

import com.network.matching.core.model.ParsedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query parser used when no parsing service is configured.
 * Extracts no criteria and keeps the raw text as other criteria.
 */
public class NoOpQueryParser implements QueryParser {
    private static final Logger log = LoggerFactory.getLogger(NoOpQueryParser.class);

    @Override
    public ParsedQuery parse(String query) {
        log.debug("NoOp query parser called for query: '{}'", query);
        return ParsedQuery.unstructured(query);
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
