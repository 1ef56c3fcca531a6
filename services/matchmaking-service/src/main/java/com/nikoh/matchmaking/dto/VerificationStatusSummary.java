package com.nikoh.matchmaking.dto;

import com.nikoh.matchmaking.domain.DocumentType;
import com.nikoh.matchmaking.domain.UserVerificationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Overview of a user's verified, pending and missing documents
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationStatusSummary {

    private UserVerificationStatus overallStatus;

    private List<DocumentType> verifiedDocuments;

    private List<DocumentType> pendingDocuments;

    private List<DocumentType> missingRequiredDocuments;

    private LocalDateTime verificationExpiresAt;
}
