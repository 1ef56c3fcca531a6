package com.nikoh.matchmaking.exception;

/**
 * Results in HTTP 400 Bad Request
 */
public class InvalidRequestException extends MatchmakingException {

    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
