package com.nikoh.matchmaking.service.face;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DetectedFace {

    int x;
    int y;
    int width;
    int height;

    /**
     * Detector confidence in [0, 1]
     */
    double score;

    FaceEmbedding embedding;

    public long area() {
        return (long) width * height;
    }
}
