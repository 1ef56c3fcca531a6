package com.nikoh.matchmaking.domain;

/**
 * How a verification decision was reached
 */
public enum VerificationMethod {
    AUTOMATED,
    MANUAL
}
