package com.network.matching.store;

import java.util.List;

/**
 * Runtime exception thrown when a population cannot be loaded because it references
 * profiles that are not part of it, or is otherwise inconsistent.
 * The store keeps its previous contents when this is thrown.
 */
public class DataIntegrityException extends RuntimeException {

    private static final int MAX_LISTED = 20;

    private final List<String> violations;

    public DataIntegrityException(List<String> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        StringBuilder sb = new StringBuilder("Population failed integrity check with ")
                .append(violations.size()).append(" violation(s): ");
        sb.append(String.join("; ", violations.subList(0, Math.min(MAX_LISTED, violations.size()))));
        if (violations.size() > MAX_LISTED) {
            sb.append("; ...");
        }
        return sb.toString();
    }
}
