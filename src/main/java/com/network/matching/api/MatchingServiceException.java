package com.network.matching.api;

/**
 * Runtime exception thrown when a match request fails because a collaborator failed.
 * The message is deliberately generic; the underlying failure is only logged.
 */
public class MatchingServiceException extends RuntimeException {

    public MatchingServiceException(String message) {
        super(message);
    }
}
