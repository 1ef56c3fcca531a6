package com.nikoh.matchmaking.service.verification;

import java.util.Map;

/**
 * Result of one passport pipeline step.
 * Anything but {@link Kind#SUCCESS} ends the pipeline in manual review with the partial data kept.
 */
final class StepOutcome<T> {

    enum Kind {
        SUCCESS,
        NEEDS_REVIEW,
        FAILURE
    }

    private final Kind kind;
    private final T value;
    private final String reason;
    private final Map<String, Object> partialData;

    private StepOutcome(Kind kind, T value, String reason, Map<String, Object> partialData) {
        this.kind = kind;
        this.value = value;
        this.reason = reason;
        this.partialData = partialData;
    }

    static <T> StepOutcome<T> success(T value) {
        return new StepOutcome<>(Kind.SUCCESS, value, null, null);
    }

    static <T> StepOutcome<T> needsReview(String reason, Map<String, Object> partialData) {
        return new StepOutcome<>(Kind.NEEDS_REVIEW, null, reason, partialData);
    }

    /**
     * A dependency was missing or crashed; handled exactly like a review outcome
     */
    static <T> StepOutcome<T> failure(String reason, Map<String, Object> partialData) {
        return new StepOutcome<>(Kind.FAILURE, null, reason, partialData);
    }

    boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    Kind kind() {
        return kind;
    }

    T value() {
        return value;
    }

    String reason() {
        return reason;
    }

    Map<String, Object> partialData() {
        return partialData;
    }
}
