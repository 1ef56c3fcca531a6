package com.nikoh.matchmaking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A ranked candidate as shown in suggestion lists
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchSuggestion {

    private UUID profileId;

    private UUID userId;

    private String displayName;

    private Integer age;

    private String city;

    private String country;

    private int compatibilityScore;

    private boolean mutualMatch;

    private boolean verified;
}
