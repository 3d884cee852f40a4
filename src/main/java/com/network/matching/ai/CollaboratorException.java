package com.network.matching.ai;

/**
 * Runtime exception thrown when an external collaborator (query parser, embedder or reranker)
 * fails or returns a response that cannot be interpreted.
 */
public class CollaboratorException extends RuntimeException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    /**
     * Returns the collaborator kind: {@code parser}, {@code embedder} or {@code reranker}.
     */
    public String getCollaborator() {
        return collaborator;
    }
}
