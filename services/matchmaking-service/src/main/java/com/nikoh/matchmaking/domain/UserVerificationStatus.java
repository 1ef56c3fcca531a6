package com.nikoh.matchmaking.domain;

/**
 * Overall verification state of a user account
 */
public enum UserVerificationStatus {
    UNVERIFIED,
    PARTIAL,
    VERIFIED,
    EXPIRED
}
