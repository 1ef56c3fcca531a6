package com.nikoh.matchmaking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Profiles are omitted for viewers who are not verified; they only see the count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WhoLikesMeResponse {

    private List<MatchSuggestion> profiles;

    private long totalCount;

    private boolean verifiedUser;
}
