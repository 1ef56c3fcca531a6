package com.nikoh.matchmaking.domain;

public enum MatchStatus {
    ACTIVE,
    UNMATCHED
}
