package com.nikoh.matchmaking.service.face;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FaceService Tests")
class FaceServiceTest {

    @Mock
    private FaceEngine faceEngine;

    @TempDir
    Path tempDir;

    private FaceService faceService;
    private Path image;

    @BeforeEach
    void setUp() throws IOException {
        faceService = new FaceService(faceEngine);
        image = Files.write(tempDir.resolve("selfie.jpg"), new byte[]{1, 2, 3});
    }

    private static DetectedFace face(int size, double score, long seed) {
        return DetectedFace.builder()
                .x(10).y(10).width(size).height(size)
                .score(score)
                .embedding(FaceComparatorTest.randomEmbedding(seed))
                .build();
    }

    @Test
    @DisplayName("Should report unavailable when engine is not loaded")
    void shouldReportUnavailable() throws IOException {
        // Given
        when(faceEngine.isAvailable()).thenReturn(false);

        // When
        FaceExtraction result = faceService.extractFace(image);

        // Then
        assertThat(result.getStatus()).isEqualTo(FaceExtraction.Status.UNAVAILABLE);
        assertThat(result.getMessage()).isEqualTo("Face recognition service not available");
        verify(faceEngine, never()).analyze(any());
    }

    @Test
    @DisplayName("Should pick the largest face and report the face count")
    void shouldPickLargestFace() throws IOException {
        // Given
        DetectedFace small = face(60, 0.99, 1);
        DetectedFace large = face(300, 0.9, 2);
        when(faceEngine.isAvailable()).thenReturn(true);
        when(faceEngine.analyze(image)).thenReturn(FaceAnalysis.builder()
                .imageWidth(1000).imageHeight(1000)
                .face(small).face(large)
                .build());

        // When
        FaceExtraction result = faceService.extractFace(image);

        // Then
        assertThat(result.isFound()).isTrue();
        assertThat(result.getFaceCount()).isEqualTo(2);
        assertThat(result.getEmbedding()).isEqualTo(large.getEmbedding());
        assertThat(result.getQuality()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    @DisplayName("Should report no face when detector finds nothing")
    void shouldReportNoFace() throws IOException {
        // Given
        when(faceEngine.isAvailable()).thenReturn(true);
        when(faceEngine.analyze(image)).thenReturn(FaceAnalysis.builder().imageWidth(640).imageHeight(480).build());

        // When
        FaceExtraction result = faceService.extractFace(image);

        // Then
        assertThat(result.getStatus()).isEqualTo(FaceExtraction.Status.NO_FACE);
        assertThat(result.getEmbedding()).isNull();
    }

    @Test
    @DisplayName("Should turn decoding errors into a failed extraction")
    void shouldReportFailureOnDecodeError() throws IOException {
        // Given
        when(faceEngine.isAvailable()).thenReturn(true);
        when(faceEngine.analyze(image)).thenThrow(new IOException("Could not decode image"));

        // When
        FaceExtraction result = faceService.extractFace(image);

        // Then
        assertThat(result.getStatus()).isEqualTo(FaceExtraction.Status.FAILED);
        assertThat(result.getMessage()).contains("Could not decode image");
    }

    @Test
    @DisplayName("Should fail for a missing image file")
    void shouldFailForMissingFile() {
        // Given
        when(faceEngine.isAvailable()).thenReturn(true);

        // When
        FaceExtraction result = faceService.extractFace(tempDir.resolve("missing.jpg"));

        // Then
        assertThat(result.getStatus()).isEqualTo(FaceExtraction.Status.FAILED);
        assertThat(result.getMessage()).isEqualTo("Image not found");
    }

    @Test
    @DisplayName("Should penalise faces that are too small or fill the frame")
    void shouldPenaliseFaceSize() {
        FaceAnalysis frame = FaceAnalysis.builder().imageWidth(1000).imageHeight(1000).build();

        // 1% of the frame
        assertThat(faceService.qualityScore(face(100, 0.8, 1), frame)).isCloseTo(0.4, within(1e-9));
        // 81% of the frame
        assertThat(faceService.qualityScore(face(900, 0.8, 1), frame)).isCloseTo(0.64, within(1e-9));
        // 25% of the frame
        assertThat(faceService.qualityScore(face(500, 0.8, 1), frame)).isCloseTo(0.8, within(1e-9));
    }
}
