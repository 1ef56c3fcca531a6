package com.nikoh.matchmaking.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * Reviewer approval carrying the data read off the document
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApproveVerificationRequest {

    @NotNull(message = "Extracted data is required")
    private Map<String, Object> extractedData;

    private LocalDate documentExpiryDate;
}
