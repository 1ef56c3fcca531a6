package com.nikoh.matchmaking.exception;

/**
 * Base exception for the matchmaking service.
 * Carries a stable error code that is returned to API clients.
 */
public class MatchmakingException extends RuntimeException {

    private final String errorCode;

    public MatchmakingException(String message) {
        super(message);
        this.errorCode = "MATCHMAKING_ERROR";
    }

    public MatchmakingException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "MATCHMAKING_ERROR";
    }

    public MatchmakingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MatchmakingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
