package com.nikoh.matchmaking.service.verification;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of an automatic verification attempt
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AutoVerificationResult {

    boolean autoVerified;

    double confidence;

    Map<String, Object> extractedData;

    String failureReason;

    @Builder.Default
    boolean needsManualReview = true;

    /**
     * Present only when a passport face was compared with the selfie
     */
    Double faceMatchScore;

    static AutoVerificationResult notProcessed(String reason) {
        return AutoVerificationResult.builder()
                .failureReason(reason)
                .build();
    }
}
