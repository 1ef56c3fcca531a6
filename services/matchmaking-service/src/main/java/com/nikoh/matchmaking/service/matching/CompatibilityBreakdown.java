package com.nikoh.matchmaking.service.matching;

import lombok.Builder;
import lombok.Value;

/**
 * Points awarded for a single compatibility factor
 */
@Value
@Builder
public class CompatibilityBreakdown {

    boolean match;

    int score;

    int maxScore;

    String detail;

    static CompatibilityBreakdown of(boolean match, int maxScore, String detail) {
        return CompatibilityBreakdown.builder()
                .match(match)
                .score(match ? maxScore : 0)
                .maxScore(maxScore)
                .detail(detail)
                .build();
    }
}
