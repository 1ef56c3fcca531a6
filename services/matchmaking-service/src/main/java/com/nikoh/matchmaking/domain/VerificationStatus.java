package com.nikoh.matchmaking.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Verification lifecycle.
 *
 * <pre>
 * PENDING -> PROCESSING -> APPROVED | REJECTED | PENDING (manual review)
 * PENDING | PROCESSING -> CANCELLED (owner)
 * APPROVED -> EXPIRED (document expiry)
 * </pre>
 */
public enum VerificationStatus {
    PENDING,
    PROCESSING,
    MANUAL_REVIEW,
    APPROVED,
    REJECTED,
    EXPIRED,
    CANCELLED;

    private static final Set<VerificationStatus> CANCELLABLE = EnumSet.of(PENDING, PROCESSING);
    private static final Set<VerificationStatus> REVIEWABLE = EnumSet.of(PENDING, PROCESSING, MANUAL_REVIEW);
    private static final Set<VerificationStatus> TERMINAL = EnumSet.of(APPROVED, REJECTED, EXPIRED, CANCELLED);

    public boolean isCancellable() {
        return CANCELLABLE.contains(this);
    }

    public boolean isReviewable() {
        return REVIEWABLE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Statuses a reviewer may still decide on
     */
    public static Set<VerificationStatus> reviewable() {
        return EnumSet.copyOf(REVIEWABLE);
    }
}
