package com.nikoh.matchmaking.exception;

/**
 * Thrown when a requested record does not exist.
 * Results in HTTP 404 Not Found
 */
public class ResourceNotFoundException extends MatchmakingException {

    public ResourceNotFoundException(String resourceName, Object id) {
        super(resourceName.toUpperCase().replace(' ', '_') + "_NOT_FOUND",
                String.format("%s not found: %s", resourceName, id));
    }
}
