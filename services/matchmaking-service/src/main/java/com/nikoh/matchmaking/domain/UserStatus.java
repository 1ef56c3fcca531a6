package com.nikoh.matchmaking.domain;

/**
 * Account lifecycle status
 */
public enum UserStatus {
    PENDING,
    ACTIVE,
    SUSPENDED,
    DELETED
}
