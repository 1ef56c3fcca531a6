package com.nikoh.matchmaking.exception;

/**
 * Upload rejected before any processing: missing file, unsupported type or oversized.
 * Results in HTTP 400 Bad Request
 */
public class InvalidDocumentException extends MatchmakingException {

    public InvalidDocumentException(String message) {
        super("INVALID_DOCUMENT", message);
    }

    public InvalidDocumentException(String message, Throwable cause) {
        super("INVALID_DOCUMENT", message, cause);
    }
}
