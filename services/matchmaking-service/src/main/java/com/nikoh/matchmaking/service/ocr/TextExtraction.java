package com.nikoh.matchmaking.service.ocr;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of an OCR attempt. Expected failures are values, not exceptions.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TextExtraction {

    public enum Status {
        EXTRACTED,
        EMPTY,
        UNAVAILABLE,
        FAILED
    }

    private final Status status;
    private final String text;
    private final String reason;

    public static TextExtraction extracted(String text) {
        if (text == null || text.isBlank()) {
            return empty();
        }
        return new TextExtraction(Status.EXTRACTED, text.strip(), null);
    }

    public static TextExtraction empty() {
        return new TextExtraction(Status.EMPTY, "", "No text recognised");
    }

    public static TextExtraction unavailable() {
        return new TextExtraction(Status.UNAVAILABLE, "", "OCR engine not available");
    }

    public static TextExtraction failed(String reason) {
        return new TextExtraction(Status.FAILED, "", reason);
    }

    public boolean hasText() {
        return status == Status.EXTRACTED;
    }

    /**
     * Text cut to at most {@code limit} characters, or null when nothing was read
     */
    public String truncated(int limit) {
        if (!hasText()) {
            return null;
        }
        return text.length() <= limit ? text : text.substring(0, limit);
    }
}
