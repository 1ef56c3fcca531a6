package com.nikoh.matchmaking.controller;

import com.nikoh.matchmaking.domain.DocumentType;
import com.nikoh.matchmaking.domain.VerificationStatus;
import com.nikoh.matchmaking.dto.PrerequisiteCheckResponse;
import com.nikoh.matchmaking.dto.VerificationResponse;
import com.nikoh.matchmaking.dto.VerificationStatusSummary;
import com.nikoh.matchmaking.service.verification.VerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

/**
 * REST controller for document verification owned by the calling user
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/verifications")
@RequiredArgsConstructor
@Validated
@Tag(name = "Verifications", description = "Identity and document verification APIs")
public class VerificationController {

    private final VerificationService verificationService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a document for verification",
            description = "Passports are verified automatically against the user's selfie; other documents go to manual review")
    public ResponseEntity<VerificationResponse> uploadDocument(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestParam("file") MultipartFile file,
            @RequestParam("documentType") DocumentType documentType,
            @RequestParam("documentCountry") @NotBlank @Size(max = 100) String documentCountry) {

        log.info("Document upload by user {}: {}", userId, documentType);
        VerificationResponse response = verificationService.upload(userId, documentType, documentCountry, file);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    @Operation(summary = "List the user's verifications")
    public ResponseEntity<Page<VerificationResponse>> listVerifications(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestParam(required = false) VerificationStatus status,
            Pageable pageable) {

        return ResponseEntity.ok(verificationService.listUserVerifications(userId, status, pageable));
    }

    @GetMapping("/status")
    @Operation(summary = "Get verification status summary")
    public ResponseEntity<VerificationStatusSummary> getStatusSummary(@RequestHeader("X-User-Id") UUID userId) {
        return ResponseEntity.ok(verificationService.getStatusSummary(userId));
    }

    @GetMapping("/prerequisites")
    @Operation(summary = "Check whether a document type can be verified automatically")
    public ResponseEntity<PrerequisiteCheckResponse> checkPrerequisites(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestParam DocumentType documentType) {

        return ResponseEntity.ok(verificationService.checkPrerequisites(userId, documentType));
    }

    @GetMapping("/{verificationId}")
    @Operation(summary = "Get a verification")
    public ResponseEntity<VerificationResponse> getVerification(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID verificationId) {

        return ResponseEntity.ok(verificationService.getVerification(verificationId, userId));
    }

    @PostMapping("/{verificationId}/cancel")
    @Operation(summary = "Cancel a pending verification")
    public ResponseEntity<VerificationResponse> cancelVerification(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID verificationId) {

        log.info("User {} cancelling verification {}", userId, verificationId);
        return ResponseEntity.ok(verificationService.cancel(verificationId, userId));
    }
}
