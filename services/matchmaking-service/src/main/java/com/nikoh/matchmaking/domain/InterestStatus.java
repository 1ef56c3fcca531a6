package com.nikoh.matchmaking.domain;

public enum InterestStatus {
    PENDING,
    ACCEPTED,
    DECLINED,
    EXPIRED,
    CANCELLED
}
