package com.nikoh.matchmaking.domain;

public enum SelfieStatus {
    PENDING,
    PROCESSED,
    FAILED
}
