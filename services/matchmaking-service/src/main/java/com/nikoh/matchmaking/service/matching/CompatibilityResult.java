package com.nikoh.matchmaking.service.matching;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Total score with its per-factor breakdown, in scoring order
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompatibilityResult {

    int score;

    Map<String, CompatibilityBreakdown> breakdown;

    boolean mutual;

    /**
     * Points from the mutual factor, absent when the check did not award any
     */
    Integer mutualScore;
}
