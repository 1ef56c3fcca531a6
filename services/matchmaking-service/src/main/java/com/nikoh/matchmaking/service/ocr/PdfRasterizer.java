package com.nikoh.matchmaking.service.ocr;

import com.nikoh.matchmaking.config.VerificationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders PDF pages to PNG files so image based OCR and face detection can read them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfRasterizer {

    /**
     * Receives one rendered page; the image is deleted as soon as the callback returns.
     */
    @FunctionalInterface
    public interface PageHandler {
        void accept(int pageIndex, Path image);
    }

    private final VerificationProperties properties;

    public static boolean isPdf(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(".pdf");
    }

    /**
     * Renders the first page. The caller owns the returned image and must close it.
     */
    public TemporaryImage renderFirstPage(Path pdf) throws IOException {
        try (PDDocument document = PDDocument.load(pdf.toFile())) {
            if (document.getNumberOfPages() == 0) {
                throw new IOException("PDF has no pages: " + pdf.getFileName());
            }
            return render(new PDFRenderer(document), 0);
        }
    }

    /**
     * Renders up to {@code maxPages} pages one at a time.
     *
     * @return number of pages rendered
     */
    public int forEachPage(Path pdf, int maxPages, PageHandler handler) throws IOException {
        try (PDDocument document = PDDocument.load(pdf.toFile())) {
            PDFRenderer renderer = new PDFRenderer(document);
            int pages = Math.min(document.getNumberOfPages(), maxPages);
            for (int i = 0; i < pages; i++) {
                try (TemporaryImage image = render(renderer, i)) {
                    handler.accept(i, image.path());
                }
            }
            return pages;
        }
    }

    private TemporaryImage render(PDFRenderer renderer, int pageIndex) throws IOException {
        BufferedImage image = renderer.renderImageWithDPI(pageIndex, properties.getPdfRenderDpi(), ImageType.RGB);
        Path file = Files.createTempFile("nikoh-page-" + pageIndex + "-", ".png");
        TemporaryImage temporary = new TemporaryImage(file);
        try {
            if (!ImageIO.write(image, "png", file.toFile())) {
                throw new IOException("No PNG writer available");
            }
        } catch (IOException | RuntimeException e) {
            temporary.close();
            throw e;
        }
        log.debug("Rendered PDF page {} at {} dpi to {}", pageIndex, properties.getPdfRenderDpi(), file);
        return temporary;
    }
}
