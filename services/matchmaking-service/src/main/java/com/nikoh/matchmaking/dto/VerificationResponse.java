package com.nikoh.matchmaking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nikoh.matchmaking.domain.DocumentType;
import com.nikoh.matchmaking.domain.Verification;
import com.nikoh.matchmaking.domain.VerificationMethod;
import com.nikoh.matchmaking.domain.VerificationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for a document verification.
 * File path and reviewer are only filled in for the admin view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResponse {

    private UUID id;

    private UUID userId;

    private DocumentType documentType;

    private String documentCountry;

    private VerificationStatus status;

    private String rejectionReason;

    private Map<String, Object> extractedData;

    private LocalDate documentExpiryDate;

    private String originalFilename;

    private String mimeType;

    private Long fileSize;

    private VerificationMethod verificationMethod;

    private LocalDateTime createdAt;

    private LocalDateTime submittedAt;

    private LocalDateTime verifiedAt;

    private String filePath;

    private UUID verifiedBy;

    public static VerificationResponse from(Verification verification) {
        return VerificationResponse.builder()
                .id(verification.getId())
                .userId(verification.getUserId())
                .documentType(verification.getDocumentType())
                .documentCountry(verification.getDocumentCountry())
                .status(verification.getStatus())
                .rejectionReason(verification.getRejectionReason())
                .extractedData(verification.getExtractedData())
                .documentExpiryDate(verification.getDocumentExpiryDate())
                .originalFilename(verification.getOriginalFilename())
                .mimeType(verification.getMimeType())
                .fileSize(verification.getFileSize())
                .verificationMethod(verification.getVerificationMethod())
                .createdAt(verification.getCreatedAt())
                .submittedAt(verification.getSubmittedAt())
                .verifiedAt(verification.getVerifiedAt())
                .build();
    }

    public static VerificationResponse forAdmin(Verification verification) {
        VerificationResponse response = from(verification);
        response.setFilePath(verification.getFilePath());
        response.setVerifiedBy(verification.getVerifiedBy());
        return response;
    }
}
