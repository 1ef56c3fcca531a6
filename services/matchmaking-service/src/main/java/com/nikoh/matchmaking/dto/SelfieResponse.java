package com.nikoh.matchmaking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nikoh.matchmaking.domain.Selfie;
import com.nikoh.matchmaking.domain.SelfieStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SelfieResponse {

    private UUID id;

    private UUID userId;

    private SelfieStatus status;

    private String errorMessage;

    private String originalFilename;

    private String mimeType;

    private Long fileSize;

    private boolean hasFaceEmbedding;

    private LocalDateTime createdAt;

    private LocalDateTime processedAt;

    public static SelfieResponse from(Selfie selfie) {
        return SelfieResponse.builder()
                .id(selfie.getId())
                .userId(selfie.getUserId())
                .status(selfie.getStatus())
                .errorMessage(selfie.getErrorMessage())
                .originalFilename(selfie.getOriginalFilename())
                .mimeType(selfie.getMimeType())
                .fileSize(selfie.getFileSize())
                .hasFaceEmbedding(selfie.hasEmbedding())
                .createdAt(selfie.getCreatedAt())
                .processedAt(selfie.getProcessedAt())
                .build();
    }
}
