package com.nikoh.matchmaking.controller;

import com.nikoh.matchmaking.dto.SelfieResponse;
import com.nikoh.matchmaking.service.selfie.SelfieService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/selfies")
@RequiredArgsConstructor
@Tag(name = "Selfies", description = "Reference selfie for passport face comparison")
public class SelfieController {

    private final SelfieService selfieService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload or replace the user's selfie")
    public ResponseEntity<SelfieResponse> uploadSelfie(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestParam("file") MultipartFile file) {

        log.info("Selfie upload by user {}", userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(selfieService.upload(userId, file));
    }

    @GetMapping
    @Operation(summary = "Get the user's selfie status")
    public ResponseEntity<SelfieResponse> getSelfie(@RequestHeader("X-User-Id") UUID userId) {
        return ResponseEntity.ok(selfieService.getSelfie(userId));
    }

    @DeleteMapping
    @Operation(summary = "Delete the user's selfie")
    public ResponseEntity<Void> deleteSelfie(@RequestHeader("X-User-Id") UUID userId) {
        selfieService.deleteSelfie(userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/reprocess")
    @Operation(summary = "Extract the face embedding again")
    public ResponseEntity<SelfieResponse> reprocessSelfie(@RequestHeader("X-User-Id") UUID userId) {
        return ResponseEntity.ok(selfieService.reprocess(userId));
    }
}
