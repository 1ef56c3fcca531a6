package com.nikoh.matchmaking.domain;

/**
 * Supported identity and status documents.
 * Only passports are eligible for automatic approval.
 */
public enum DocumentType {
    PASSPORT,
    RESIDENCE_PERMIT,
    DIVORCE_CERTIFICATE,
    DIPLOMA,
    EMPLOYMENT_PROOF;

    public boolean supportsAutoApproval() {
        return this == PASSPORT;
    }
}
