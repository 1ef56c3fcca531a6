package com.nikoh.matchmaking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Top suggestions plus how many candidates were considered in total
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionPage {

    @Builder.Default
    private List<MatchSuggestion> suggestions = new ArrayList<>();

    private int totalAvailable;

    public static SuggestionPage empty() {
        return SuggestionPage.builder().build();
    }
}
