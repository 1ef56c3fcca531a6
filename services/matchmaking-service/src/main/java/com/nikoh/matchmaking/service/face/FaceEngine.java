package com.nikoh.matchmaking.service.face;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Face detection plus embedding model.
 */
public interface FaceEngine {

    /**
     * False when the native runtime or model files are missing; callers then skip face steps
     */
    boolean isAvailable();

    /**
     * @throws IOException when the image cannot be decoded
     * @throws IllegalStateException when called while unavailable
     */
    FaceAnalysis analyze(Path image) throws IOException;
}
