package com.network.matching.source;

/**
 * Runtime exception thrown when a profile source cannot be read or holds malformed records.
 */
public class ProfileSourceException extends RuntimeException {

    public ProfileSourceException(String message) {
        super(message);
    }

    public ProfileSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
