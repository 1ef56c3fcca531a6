package com.nikoh.matchmaking.controller;

import com.nikoh.matchmaking.dto.SuggestionPage;
import com.nikoh.matchmaking.dto.WhoLikesMeResponse;
import com.nikoh.matchmaking.service.matching.CompatibilityResult;
import com.nikoh.matchmaking.service.matching.SuggestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST controller for match suggestions and compatibility
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/matching")
@RequiredArgsConstructor
@Validated
@Tag(name = "Matching", description = "Match suggestion and compatibility APIs")
public class MatchingController {

    private final SuggestionService suggestionService;

    @GetMapping("/suggestions")
    @Operation(summary = "Get ranked match suggestions")
    public ResponseEntity<SuggestionPage> getSuggestions(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestParam(defaultValue = "10") @Min(1) @Max(50) int limit) {

        log.debug("Fetching {} suggestions for user {}", limit, userId);
        return ResponseEntity.ok(suggestionService.getSuggestions(userId, limit));
    }

    @GetMapping("/who-likes-me")
    @Operation(summary = "Users whose preferences match the caller",
            description = "Unverified users only receive the count")
    public ResponseEntity<WhoLikesMeResponse> getWhoLikesMe(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {

        if (!suggestionService.isViewerVerified(userId)) {
            return ResponseEntity.ok(WhoLikesMeResponse.builder()
                    .totalCount(suggestionService.countWhoLikesMe(userId))
                    .verifiedUser(false)
                    .build());
        }

        SuggestionPage page = suggestionService.getWhoLikesMe(userId, limit);
        return ResponseEntity.ok(WhoLikesMeResponse.builder()
                .profiles(page.getSuggestions())
                .totalCount(page.getTotalAvailable())
                .verifiedUser(true)
                .build());
    }

    @GetMapping("/compatibility/{profileId}")
    @Operation(summary = "Compatibility with a specific profile")
    public ResponseEntity<CompatibilityResult> getCompatibility(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID profileId) {

        return ResponseEntity.ok(suggestionService.getCompatibility(userId, profileId));
    }
}
