package com.nikoh.matchmaking.service.face;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Primary face of an image together with what the caller needs to judge it.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FaceExtraction {

    public enum Status {
        FOUND,
        NO_FACE,
        UNAVAILABLE,
        FAILED
    }

    private final Status status;
    private final FaceEmbedding embedding;
    private final int faceCount;
    private final double quality;
    private final String message;

    public static FaceExtraction found(FaceEmbedding embedding, int faceCount, double quality) {
        return new FaceExtraction(Status.FOUND, embedding, faceCount, quality, null);
    }

    public static FaceExtraction noFace() {
        return new FaceExtraction(Status.NO_FACE, null, 0, 0.0, "No face detected in image");
    }

    public static FaceExtraction unavailable() {
        return new FaceExtraction(Status.UNAVAILABLE, null, 0, 0.0, "Face recognition service not available");
    }

    public static FaceExtraction failed(String message) {
        return new FaceExtraction(Status.FAILED, null, 0, 0.0, message);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
