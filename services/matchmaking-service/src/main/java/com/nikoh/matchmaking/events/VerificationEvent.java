package com.nikoh.matchmaking.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Verification decision event
 *
 * Event types:
 * - VERIFICATION_APPROVED
 * - VERIFICATION_REJECTED
 * - VERIFICATION_MANUAL_REVIEW
 * - VERIFICATION_CANCELLED
 * - VERIFICATION_EXPIRED
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String APPROVED = "VERIFICATION_APPROVED";
    public static final String REJECTED = "VERIFICATION_REJECTED";
    public static final String MANUAL_REVIEW = "VERIFICATION_MANUAL_REVIEW";
    public static final String CANCELLED = "VERIFICATION_CANCELLED";
    public static final String EXPIRED = "VERIFICATION_EXPIRED";

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("correlation_id")
    private String correlationId;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("version")
    private String version;

    @JsonProperty("verification_id")
    private String verificationId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("document_type")
    private String documentType;

    @JsonProperty("status")
    private String status;

    @JsonProperty("verification_method")
    private String verificationMethod;

    @JsonProperty("face_match_score")
    private Double faceMatchScore;

    @JsonProperty("reason")
    private String reason;
}
