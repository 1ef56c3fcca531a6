package com.nikoh.matchmaking.service.selfie;

import com.nikoh.matchmaking.config.VerificationProperties;
import com.nikoh.matchmaking.domain.Selfie;
import com.nikoh.matchmaking.domain.SelfieStatus;
import com.nikoh.matchmaking.dto.SelfieResponse;
import com.nikoh.matchmaking.exception.InvalidDocumentException;
import com.nikoh.matchmaking.exception.ResourceNotFoundException;
import com.nikoh.matchmaking.repository.SelfieRepository;
import com.nikoh.matchmaking.service.face.FaceEmbedding;
import com.nikoh.matchmaking.service.face.FaceExtraction;
import com.nikoh.matchmaking.service.face.FaceService;
import com.nikoh.matchmaking.service.storage.DocumentStorageService;
import com.nikoh.matchmaking.service.storage.UploadValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SelfieService Tests")
class SelfieServiceTest {

    private static final Path SELFIE_IMAGE = Path.of("/data/selfies/selfie.jpg");

    @Mock
    private SelfieRepository selfieRepository;

    @Mock
    private FaceService faceService;

    @Mock
    private DocumentStorageService storageService;

    private SelfieService selfieService;
    private UUID userId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        selfieService = new SelfieService(selfieRepository, faceService, storageService, new UploadValidator(),
                new VerificationProperties(), clock);
        userId = UUID.randomUUID();
    }

    private static FaceEmbedding embedding() {
        float[] values = new float[FaceEmbedding.DIMENSION];
        Arrays.fill(values, 0.25f);
        return FaceEmbedding.of(values);
    }

    private Selfie storedSelfie() {
        return Selfie.builder().userId(userId).filePath("selfies/" + userId + "/selfie.jpg").build();
    }

    private void givenFaceResult(FaceExtraction extraction) {
        when(storageService.exists(anyString())).thenReturn(true);
        when(faceService.isAvailable()).thenReturn(true);
        when(storageService.locate(anyString())).thenReturn(SELFIE_IMAGE);
        when(faceService.extractFace(SELFIE_IMAGE)).thenReturn(extraction);
    }

    @Nested
    @DisplayName("Upload")
    class Upload {

        @Test
        @DisplayName("Should store the selfie and save its embedding")
        void shouldStoreAndProcess() {
            // Given
            MockMultipartFile file = new MockMultipartFile("file", "me.png", "image/png", new byte[]{9, 9});
            when(storageService.store("selfies/" + userId, "selfie.png", new byte[]{9, 9}))
                    .thenReturn("selfies/" + userId + "/selfie.png");
            when(selfieRepository.findByUserId(userId)).thenReturn(Optional.empty());
            when(selfieRepository.save(any(Selfie.class))).thenAnswer(invocation -> invocation.getArgument(0));
            givenFaceResult(FaceExtraction.found(embedding(), 1, 0.9));

            // When
            SelfieResponse response = selfieService.upload(userId, file);

            // Then
            assertThat(response.getStatus()).isEqualTo(SelfieStatus.PROCESSED);
            assertThat(response.isHasFaceEmbedding()).isTrue();
            assertThat(response.getErrorMessage()).isNull();
            assertThat(response.getProcessedAt()).isEqualTo(LocalDateTime.of(2026, 3, 1, 10, 0));
            assertThat(response.getMimeType()).isEqualTo("image/png");
        }

        @Test
        @DisplayName("Should delete the previous file when the extension changes")
        void shouldReplacePreviousFile() {
            // Given
            Selfie existing = storedSelfie();
            existing.setFaceEmbedding(embedding().toBytes());
            existing.setStatus(SelfieStatus.PROCESSED);
            MockMultipartFile file = new MockMultipartFile("file", "me.png", "image/png", new byte[]{1});
            when(storageService.store(anyString(), eq("selfie.png"), any())).thenReturn("selfies/" + userId + "/selfie.png");
            when(selfieRepository.findByUserId(userId)).thenReturn(Optional.of(existing));
            when(selfieRepository.save(existing)).thenReturn(existing);
            givenFaceResult(FaceExtraction.noFace());

            // When
            SelfieResponse response = selfieService.upload(userId, file);

            // Then
            verify(storageService).delete("selfies/" + userId + "/selfie.jpg");
            assertThat(response.getStatus()).isEqualTo(SelfieStatus.FAILED);
            assertThat(response.getErrorMessage()).isEqualTo(SelfieService.NO_FACE);
            assertThat(existing.getFaceEmbedding()).isNull();
        }

        @Test
        @DisplayName("Should reject PDF selfies")
        void shouldRejectPdf() {
            MockMultipartFile pdf = new MockMultipartFile("file", "me.pdf", "application/pdf", new byte[]{1});

            assertThatThrownBy(() -> selfieService.upload(userId, pdf))
                    .isInstanceOf(InvalidDocumentException.class)
                    .hasMessage("Invalid file type. Please upload a JPEG or PNG image.");
            verifyNoInteractions(storageService, selfieRepository);
        }
    }

    @Nested
    @DisplayName("Processing")
    class Processing {

        @Test
        @DisplayName("Should fail selfies with more than one face")
        void shouldFailMultipleFaces() {
            // Given
            Selfie selfie = storedSelfie();
            givenFaceResult(FaceExtraction.found(embedding(), 2, 0.95));

            // When
            selfieService.process(selfie);

            // Then
            assertThat(selfie.getStatus()).isEqualTo(SelfieStatus.FAILED);
            assertThat(selfie.getErrorMessage()).isEqualTo(SelfieService.MULTIPLE_FACES);
            assertThat(selfie.hasEmbedding()).isFalse();
        }

        @Test
        @DisplayName("Should fail selfies below the quality floor")
        void shouldFailLowQuality() {
            // Given
            Selfie selfie = storedSelfie();
            givenFaceResult(FaceExtraction.found(embedding(), 1, 0.2));

            // When
            selfieService.process(selfie);

            // Then
            assertThat(selfie.getStatus()).isEqualTo(SelfieStatus.FAILED);
            assertThat(selfie.getErrorMessage()).isEqualTo(SelfieService.LOW_QUALITY);
        }

        @Test
        @DisplayName("Should fail without touching the engine when it is unavailable")
        void shouldFailWhenUnavailable() {
            // Given
            Selfie selfie = storedSelfie();
            when(storageService.exists(selfie.getFilePath())).thenReturn(true);
            when(faceService.isAvailable()).thenReturn(false);

            // When
            selfieService.process(selfie);

            // Then
            assertThat(selfie.getErrorMessage()).isEqualTo(SelfieService.NOT_AVAILABLE);
            verify(faceService, never()).extractFace(any());
        }

        @Test
        @DisplayName("Should fail when the stored file is gone")
        void shouldFailWhenFileMissing() {
            // Given
            Selfie selfie = storedSelfie();
            when(storageService.exists(selfie.getFilePath())).thenReturn(false);

            // When
            selfieService.process(selfie);

            // Then
            assertThat(selfie.getStatus()).isEqualTo(SelfieStatus.FAILED);
            assertThat(selfie.getErrorMessage()).isEqualTo("File not found");
            verifyNoInteractions(faceService);
        }

        @Test
        @DisplayName("Should store a 2048 byte embedding for a good selfie")
        void shouldStoreEmbedding() {
            // Given
            Selfie selfie = storedSelfie();
            givenFaceResult(FaceExtraction.found(embedding(), 1, 0.8));

            // When
            selfieService.process(selfie);

            // Then
            assertThat(selfie.getStatus()).isEqualTo(SelfieStatus.PROCESSED);
            assertThat(selfie.getFaceEmbedding()).hasSize(2048);
            assertThat(FaceEmbedding.fromBytes(selfie.getFaceEmbedding())).isEqualTo(embedding());
        }
    }

    @Nested
    @DisplayName("Lookup and removal")
    class LookupAndRemoval {

        @Test
        @DisplayName("Should report a missing selfie as not found")
        void shouldReportMissingSelfie() {
            when(selfieRepository.findByUserId(userId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> selfieService.getSelfie(userId))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining("Selfie not found");
        }

        @Test
        @DisplayName("Should delete file and record")
        void shouldDeleteSelfie() {
            // Given
            Selfie selfie = storedSelfie();
            when(selfieRepository.findByUserId(userId)).thenReturn(Optional.of(selfie));

            // When
            selfieService.deleteSelfie(userId);

            // Then
            verify(storageService).delete(selfie.getFilePath());
            verify(selfieRepository).delete(selfie);
        }
    }
}
