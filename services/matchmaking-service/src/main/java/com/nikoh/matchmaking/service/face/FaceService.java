package com.nikoh.matchmaking.service.face;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Face extraction shared by selfie processing and passport verification.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FaceService {

    static final double SMALL_FACE_RATIO = 0.05;
    static final double LARGE_FACE_RATIO = 0.6;
    static final double SMALL_FACE_PENALTY = 0.5;
    static final double LARGE_FACE_PENALTY = 0.8;

    private final FaceEngine faceEngine;

    public boolean isAvailable() {
        return faceEngine.isAvailable();
    }

    /**
     * Embedding of the largest face in the image. Never throws.
     */
    public FaceExtraction extractFace(Path image) {
        if (!faceEngine.isAvailable()) {
            return FaceExtraction.unavailable();
        }
        if (!Files.isRegularFile(image)) {
            return FaceExtraction.failed("Image not found");
        }

        FaceAnalysis analysis;
        try {
            analysis = faceEngine.analyze(image);
        } catch (IOException | RuntimeException e) {
            log.warn("Face analysis failed for {}: {}", image.getFileName(), e.getMessage());
            return FaceExtraction.failed("Processing error: " + e.getMessage());
        }

        return analysis.primaryFace()
                .map(face -> FaceExtraction.found(face.getEmbedding(), analysis.getFaces().size(),
                        qualityScore(face, analysis)))
                .orElseGet(FaceExtraction::noFace);
    }

    /**
     * Detector confidence reduced for faces that fill too little or too much of the frame.
     */
    public double qualityScore(DetectedFace face, FaceAnalysis analysis) {
        double quality = face.getScore();
        long imageArea = analysis.imageArea();
        if (imageArea <= 0) {
            return 0.0;
        }
        double ratio = (double) face.area() / imageArea;
        if (ratio < SMALL_FACE_RATIO) {
            quality *= SMALL_FACE_PENALTY;
        } else if (ratio > LARGE_FACE_RATIO) {
            quality *= LARGE_FACE_PENALTY;
        }
        return quality;
    }
}
