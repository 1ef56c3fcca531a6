package com.nikoh.matchmaking.service.mrz;

import com.nikoh.matchmaking.service.ocr.OcrEngine;
import com.nikoh.matchmaking.service.ocr.TextExtraction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the machine readable zone of a passport image.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MrzExtractor {

    private final OcrEngine ocrEngine;
    private final MrzParser mrzParser;

    public MrzExtraction extract(Path image) {
        if (!ocrEngine.isAvailable()) {
            log.warn("OCR engine unavailable, skipping MRZ extraction for {}", image.getFileName());
            return MrzExtraction.unavailable();
        }

        TextExtraction text = ocrEngine.extractMrzText(image);
        if (text.getStatus() == TextExtraction.Status.UNAVAILABLE) {
            return MrzExtraction.unavailable();
        }
        if (!text.hasText()) {
            log.info("No MRZ text recognised in {}", image.getFileName());
            return MrzExtraction.notFound();
        }

        Optional<IdentityRecord> record = mrzParser.parseOcrText(text.getText());
        if (record.isEmpty()) {
            log.info("No MRZ found in {}", image.getFileName());
            return MrzExtraction.notFound();
        }

        log.info("MRZ decoded from {} (checksums {})",
                image.getFileName(), record.get().isValid() ? "valid" : "invalid");
        return MrzExtraction.found(record.get());
    }
}
