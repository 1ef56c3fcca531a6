package com.nikoh.matchmaking.service.ocr;

import com.nikoh.matchmaking.domain.DocumentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text extraction and keyword heuristics for identity and status documents.
 * Keyword lists cover English and Russian, the primary languages of issued documents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentTextService {

    static final int MAX_PDF_PAGES = 10;

    // Checked in order; the first list with a hit wins
    private static final Map<DocumentType, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(DocumentType.PASSPORT, List.of(
                "passport", "pasport", "паспорт", "nationality", "гражданство",
                "date of birth", "дата рождения", "mrz", "p<"));
        KEYWORDS.put(DocumentType.RESIDENCE_PERMIT, List.of(
                "residence permit", "вид на жительство", "permanent resident",
                "временное проживание", "разрешение на проживание"));
        KEYWORDS.put(DocumentType.DIVORCE_CERTIFICATE, List.of(
                "divorce", "развод", "расторжение брака",
                "свидетельство о расторжении", "dissolution of marriage"));
        KEYWORDS.put(DocumentType.DIPLOMA, List.of(
                "diploma", "диплом", "degree", "степень", "university", "университет",
                "bachelor", "master", "бакалавр", "магистр"));
        KEYWORDS.put(DocumentType.EMPLOYMENT_PROOF, List.of(
                "employment", "трудовой", "справка с места работы",
                "certificate of employment", "работодатель", "employer"));
    }

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("\\d{2}[./]\\d{2}[./]\\d{4}"),
            Pattern.compile("\\d{4}[./]\\d{2}[./]\\d{2}"),
            Pattern.compile("\\d{1,2}\\s+\\p{L}+\\s+\\d{4}"));

    private static final String NAME_LETTERS = "([A-Za-zА-Яа-яЁёЎўҚқҒғҲҳ]+)";

    private static final List<Pattern> FIRST_NAME_PATTERNS = List.of(
            Pattern.compile("(?<!\\p{L})(?:given\\s+names?|name|имя|исм)[:\\s]+" + NAME_LETTERS,
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));

    private static final List<Pattern> LAST_NAME_PATTERNS = List.of(
            Pattern.compile("(?<!\\p{L})(?:surname|фамилияси|фамилия)[:\\s]+" + NAME_LETTERS,
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));

    private final OcrEngine ocrEngine;
    private final PdfRasterizer pdfRasterizer;

    public boolean isAvailable() {
        return ocrEngine.isAvailable();
    }

    /**
     * Reads an image directly or every page of a PDF, joining pages with a space.
     */
    public TextExtraction extractText(Path file) {
        if (!ocrEngine.isAvailable()) {
            return TextExtraction.unavailable();
        }
        if (!PdfRasterizer.isPdf(file)) {
            return ocrEngine.extractText(file);
        }

        List<String> pages = new ArrayList<>();
        try {
            pdfRasterizer.forEachPage(file, MAX_PDF_PAGES, (index, image) -> {
                TextExtraction page = ocrEngine.extractText(image);
                if (page.hasText()) {
                    pages.add(page.getText());
                }
            });
        } catch (IOException e) {
            log.warn("Could not render PDF {}: {}", file.getFileName(), e.getMessage());
            return pages.isEmpty()
                    ? TextExtraction.failed("PDF could not be rendered: " + e.getMessage())
                    : TextExtraction.extracted(String.join(" ", pages));
        }
        return TextExtraction.extracted(String.join(" ", pages));
    }

    /**
     * Best guess of the document type from its text, used as a cross-check of the declared type
     */
    public Optional<DocumentType> detectDocumentType(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return KEYWORDS.entrySet().stream()
                .filter(entry -> entry.getValue().stream().anyMatch(lower::contains))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /**
     * Date-like fragments in order of appearance per pattern, without duplicates
     */
    public List<String> extractDates(String text) {
        Set<String> dates = new LinkedHashSet<>();
        if (text == null) {
            return new ArrayList<>();
        }
        for (Pattern pattern : DATE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                dates.add(matcher.group());
            }
        }
        return new ArrayList<>(dates);
    }

    /**
     * Labelled name fields; keys {@code first_name} and {@code last_name}, values may be null
     */
    public Map<String, String> extractNames(String text) {
        Map<String, String> names = new LinkedHashMap<>();
        names.put("first_name", firstMatch(FIRST_NAME_PATTERNS, text));
        names.put("last_name", firstMatch(LAST_NAME_PATTERNS, text));
        return names;
    }

    private static String firstMatch(List<Pattern> patterns, String text) {
        if (text == null) {
            return null;
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }
}
