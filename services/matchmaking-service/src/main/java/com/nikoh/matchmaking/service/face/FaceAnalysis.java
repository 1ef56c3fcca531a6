package com.nikoh.matchmaking.service.face;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * All faces found in one image
 */
@Value
@Builder
public class FaceAnalysis {

    int imageWidth;
    int imageHeight;

    @Singular
    List<DetectedFace> faces;

    /**
     * The face with the largest bounding box, assumed to be the subject closest to the camera
     */
    public Optional<DetectedFace> primaryFace() {
        return faces.stream().max(Comparator.comparingLong(DetectedFace::area));
    }

    public long imageArea() {
        return (long) imageWidth * imageHeight;
    }
}
