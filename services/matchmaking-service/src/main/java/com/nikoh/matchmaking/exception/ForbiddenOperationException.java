package com.nikoh.matchmaking.exception;

/**
 * Caller is not allowed to act on the resource.
 * Results in HTTP 403 Forbidden
 */
public class ForbiddenOperationException extends MatchmakingException {

    public ForbiddenOperationException(String message) {
        super("FORBIDDEN", message);
    }
}
