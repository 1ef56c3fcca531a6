package com.nikoh.matchmaking.exception;

import com.nikoh.matchmaking.domain.VerificationStatus;

/**
 * Exception thrown when an operation is attempted on a verification in an invalid state
 * For example: cancelling an approved verification
 * Results in HTTP 409 Conflict
 */
public class InvalidVerificationStateException extends MatchmakingException {

    private final VerificationStatus currentStatus;

    public InvalidVerificationStateException(VerificationStatus currentStatus, String operation) {
        super("INVALID_VERIFICATION_STATE",
                String.format("Cannot %s verification with status '%s'",
                        operation, currentStatus.name().toLowerCase()));
        this.currentStatus = currentStatus;
    }

    public InvalidVerificationStateException(String message) {
        super("INVALID_VERIFICATION_STATE", message);
        this.currentStatus = null;
    }

    /**
     * @return the refused verification's status, or null when it changed concurrently
     */
    public VerificationStatus getCurrentStatus() {
        return currentStatus;
    }
}
