package com.nikoh.matchmaking.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Error body of the verification, selfie and matching APIs.
 * Never carries stack traces or extracted document data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Stable code clients branch on, e.g. VERIFICATION_NOT_FOUND or INVALID_VERIFICATION_STATE
     */
    private String errorCode;

    /**
     * Message shown to the user, e.g. the rejection reason length rule
     */
    private String message;

    /**
     * What the client can do about it, when there is anything
     */
    private String details;

    private int status;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    private String path;

    /**
     * Status the verification was in when a state transition was refused (409 only)
     */
    private String currentStatus;

    /**
     * Bean validation failures on request bodies and parameters
     */
    private List<FieldError> fieldErrors;

    /**
     * Correlation id of the request, matches the X-Correlation-ID response header
     */
    private String traceId;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldError {
        private String field;
        private String rejectedValue;
        private String message;
    }
}
