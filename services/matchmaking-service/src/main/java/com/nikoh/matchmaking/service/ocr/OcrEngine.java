package com.nikoh.matchmaking.service.ocr;

import java.nio.file.Path;

/**
 * Optical character recognition over image files.
 * Implementations never throw for unreadable images or a missing runtime.
 */
public interface OcrEngine {

    boolean isAvailable();

    /**
     * General document text in the configured languages
     */
    TextExtraction extractText(Path image);

    /**
     * Text read with the character set restricted to the machine readable zone alphabet
     */
    TextExtraction extractMrzText(Path image);
}
