package com.nikoh.matchmaking.service.ocr;

import com.nikoh.matchmaking.config.RecognitionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.TessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Tess4J backed OCR. The native library is probed once on first use; a
 * missing library or tessdata directory leaves the engine unavailable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TesseractOcrEngine implements OcrEngine {

    static final String MRZ_WHITELIST = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789<";

    private final RecognitionProperties properties;

    private volatile Boolean available;

    // Tesseract handles are not thread safe
    private final ThreadLocal<Tesseract> textReader = ThreadLocal.withInitial(this::createTextReader);
    private final ThreadLocal<Tesseract> mrzReader = ThreadLocal.withInitial(this::createMrzReader);

    @Override
    public boolean isAvailable() {
        Boolean result = available;
        if (result == null) {
            synchronized (this) {
                result = available;
                if (result == null) {
                    result = probe();
                    available = result;
                }
            }
        }
        return result;
    }

    @Override
    public TextExtraction extractText(Path image) {
        return read(textReader, image);
    }

    @Override
    public TextExtraction extractMrzText(Path image) {
        return read(mrzReader, image);
    }

    private TextExtraction read(ThreadLocal<Tesseract> reader, Path image) {
        if (!isAvailable()) {
            return TextExtraction.unavailable();
        }
        if (!Files.isRegularFile(image)) {
            return TextExtraction.failed("Image not found: " + image.getFileName());
        }
        try {
            return TextExtraction.extracted(reader.get().doOCR(image.toFile()));
        } catch (TesseractException e) {
            log.warn("OCR failed for {}: {}", image.getFileName(), e.getMessage());
            return TextExtraction.failed(e.getMessage());
        }
    }

    private boolean probe() {
        Path dataPath = Paths.get(properties.getTesseract().getDataPath());
        if (!Files.isDirectory(dataPath)) {
            log.warn("Tesseract data directory {} not found, OCR disabled", dataPath);
            return false;
        }
        try {
            String version = TessAPI.INSTANCE.TessVersion();
            log.info("Tesseract {} initialised with data path {}", version, dataPath);
            return true;
        } catch (LinkageError e) {
            log.warn("Tesseract native library not available, OCR disabled: {}", e.getMessage());
            return false;
        }
    }

    private Tesseract createTextReader() {
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(properties.getTesseract().getDataPath());
        tesseract.setLanguage(properties.getTesseract().getLanguages());
        tesseract.setPageSegMode(ITessAPI.TessPageSegMode.PSM_AUTO);
        return tesseract;
    }

    private Tesseract createMrzReader() {
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(properties.getTesseract().getDataPath());
        tesseract.setLanguage(properties.getTesseract().getMrzLanguage());
        tesseract.setPageSegMode(ITessAPI.TessPageSegMode.PSM_SINGLE_BLOCK);
        tesseract.setVariable("tessedit_char_whitelist", MRZ_WHITELIST);
        tesseract.setVariable("load_system_dawg", "0");
        tesseract.setVariable("load_freq_dawg", "0");
        return tesseract;
    }
}
