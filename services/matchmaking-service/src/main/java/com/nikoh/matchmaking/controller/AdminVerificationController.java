package com.nikoh.matchmaking.controller;

import com.nikoh.matchmaking.dto.ApproveVerificationRequest;
import com.nikoh.matchmaking.dto.RejectVerificationRequest;
import com.nikoh.matchmaking.dto.VerificationResponse;
import com.nikoh.matchmaking.service.verification.VerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Manual review of verifications. The caller must be an admin.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/verifications")
@RequiredArgsConstructor
@Tag(name = "Verification Review", description = "Manual verification review APIs")
public class AdminVerificationController {

    private final VerificationService verificationService;

    @GetMapping("/pending")
    @Operation(summary = "List verifications awaiting review")
    public ResponseEntity<Page<VerificationResponse>> listPending(
            @RequestHeader("X-User-Id") UUID adminId,
            Pageable pageable) {

        return ResponseEntity.ok(verificationService.listPendingReview(adminId, pageable));
    }

    @GetMapping("/{verificationId}")
    @Operation(summary = "Get verification details including file path")
    public ResponseEntity<VerificationResponse> getVerification(
            @RequestHeader("X-User-Id") UUID adminId,
            @PathVariable UUID verificationId) {

        return ResponseEntity.ok(verificationService.getVerification(verificationId, adminId));
    }

    @PostMapping("/{verificationId}/approve")
    @Operation(summary = "Approve a verification and copy its data to the profile")
    public ResponseEntity<VerificationResponse> approve(
            @RequestHeader("X-User-Id") UUID adminId,
            @PathVariable UUID verificationId,
            @Valid @RequestBody ApproveVerificationRequest request) {

        log.info("Admin {} approving verification {}", adminId, verificationId);
        return ResponseEntity.ok(verificationService.approve(verificationId, adminId, request));
    }

    @PostMapping("/{verificationId}/reject")
    @Operation(summary = "Reject a verification with a reason")
    public ResponseEntity<VerificationResponse> reject(
            @RequestHeader("X-User-Id") UUID adminId,
            @PathVariable UUID verificationId,
            @Valid @RequestBody RejectVerificationRequest request) {

        log.info("Admin {} rejecting verification {}", adminId, verificationId);
        return ResponseEntity.ok(verificationService.reject(verificationId, adminId, request));
    }

    @PostMapping("/{verificationId}/reprocess")
    @Operation(summary = "Run automatic verification again")
    public ResponseEntity<VerificationResponse> reprocess(
            @RequestHeader("X-User-Id") UUID adminId,
            @PathVariable UUID verificationId) {

        return ResponseEntity.accepted().body(verificationService.reprocess(verificationId, adminId));
    }
}
