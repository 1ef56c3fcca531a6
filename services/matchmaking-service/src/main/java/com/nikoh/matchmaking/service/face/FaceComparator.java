package com.nikoh.matchmaking.service.face;

import org.springframework.stereotype.Component;

/**
 * Cosine similarity of normalised embeddings mapped from [-1, 1] onto [0, 1].
 */
@Component
public class FaceComparator {

    /**
     * @return similarity in [0, 1]; 0.0 when either side is missing or a zero vector
     */
    public double similarity(FaceEmbedding first, FaceEmbedding second) {
        if (first == null || second == null) {
            return 0.0;
        }
        double firstNorm = first.norm();
        double secondNorm = second.norm();
        if (firstNorm == 0.0 || secondNorm == 0.0) {
            return 0.0;
        }
        double cosine = first.dot(second) / (firstNorm * secondNorm);
        double similarity = (cosine + 1.0) / 2.0;
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    public boolean matches(FaceEmbedding first, FaceEmbedding second, double threshold) {
        return similarity(first, second) >= threshold;
    }
}
