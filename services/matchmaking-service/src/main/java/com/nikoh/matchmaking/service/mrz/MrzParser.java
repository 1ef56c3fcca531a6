package com.nikoh.matchmaking.service.mrz;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decoder for the two line TD3 machine readable zone printed in passports.
 *
 * <pre>
 * Line 1: P T CCC SURNAME&lt;&lt;GIVEN&lt;NAMES&lt;&lt;&lt;...
 * Line 2: NNNNNNNNN c NNN YYMMDD c S YYMMDD c PPPPPPPPPPPPPP c C
 * </pre>
 *
 * Records whose check digits fail are still returned, flagged invalid, as long as
 * a name could be decoded.
 */
@Slf4j
@Component
public class MrzParser {

    public static final char FILLER = '<';
    public static final int TD3_LINE_LENGTH = 44;

    /**
     * Two digit years up to and including this value belong to the 2000s
     */
    static final int CENTURY_PIVOT = 30;

    private static final int MIN_CANDIDATE_LENGTH = 30;

    /**
     * Locates a TD3 zone in free OCR text and decodes it.
     */
    public Optional<IdentityRecord> parseOcrText(String ocrText) {
        return locateTd3Lines(ocrText).flatMap(lines -> parse(lines.get(0), lines.get(1)));
    }

    /**
     * Decodes a raw two line zone. Unlike {@link #parseOcrText(String)} only checksum
     * verified results are returned.
     */
    public Optional<IdentityRecord> parseMrzString(String mrz) {
        List<String> lines = splitLines(mrz);
        if (lines.size() < 2) {
            return Optional.empty();
        }
        Optional<IdentityRecord> record = parse(lines.get(0), lines.get(1));
        if (record.isPresent() && !record.get().isValid()) {
            log.warn("MRZ string failed checksum validation");
            return Optional.empty();
        }
        return record;
    }

    public boolean validateChecksums(String mrz) {
        List<String> lines = splitLines(mrz);
        if (lines.size() < 2) {
            return false;
        }
        return parse(lines.get(0), lines.get(1)).map(IdentityRecord::isValid).orElse(false);
    }

    /**
     * Finds the line starting with the passport marker and the line following it,
     * both normalised to 44 characters.
     */
    public Optional<List<String>> locateTd3Lines(String ocrText) {
        if (ocrText == null || ocrText.isBlank()) {
            return Optional.empty();
        }
        List<String> candidates = Arrays.stream(ocrText.split("\\R"))
                .map(MrzParser::cleanLine)
                .filter(line -> line.length() >= MIN_CANDIDATE_LENGTH)
                .collect(Collectors.toList());

        // the second line may legitimately contain no filler at all
        for (int i = 0; i < candidates.size() - 1; i++) {
            String line = candidates.get(i);
            if (isPassportMarker(line) && line.indexOf(FILLER) >= 0) {
                List<String> lines = new ArrayList<>(2);
                lines.add(normalize(line));
                lines.add(normalize(candidates.get(i + 1)));
                return Optional.of(lines);
            }
        }
        return Optional.empty();
    }

    /**
     * Decodes two TD3 lines. Lines shorter or longer than 44 characters are normalised first.
     */
    public Optional<IdentityRecord> parse(String firstLine, String secondLine) {
        if (firstLine == null || secondLine == null) {
            return Optional.empty();
        }
        String line1 = normalize(cleanLine(firstLine));
        String line2 = normalize(cleanLine(secondLine));

        String issuingCountry = stripFiller(line1.substring(2, 5));
        String[] names = splitNames(line1.substring(5));

        String documentNumberField = line2.substring(0, 9);
        char documentNumberCheck = toDigit(line2.charAt(9));
        String nationality = stripFiller(line2.substring(10, 13));
        String birthField = toDigits(line2.substring(13, 19));
        char birthCheck = toDigit(line2.charAt(19));
        char sex = line2.charAt(20);
        String expiryField = toDigits(line2.substring(21, 27));
        char expiryCheck = toDigit(line2.charAt(27));
        String personalNumberField = line2.substring(28, 42);
        char personalNumberCheck = line2.charAt(42) == FILLER ? FILLER : toDigit(line2.charAt(42));
        char compositeCheck = toDigit(line2.charAt(43));

        String composite = documentNumberField + documentNumberCheck
                + birthField + birthCheck
                + expiryField + expiryCheck
                + personalNumberField + personalNumberCheck;

        boolean valid = MrzCheckDigit.matches(documentNumberField, documentNumberCheck)
                && MrzCheckDigit.matches(birthField, birthCheck)
                && MrzCheckDigit.matches(expiryField, expiryCheck)
                && MrzCheckDigit.matchesOptional(personalNumberField, personalNumberCheck)
                && MrzCheckDigit.matches(composite, compositeCheck);
        LocalDate birthDate = parseDate(birthField);
        LocalDate expiryDate = parseDate(expiryField);
        // both dates must decode for a verified record
        valid = valid && birthDate != null && expiryDate != null;

        IdentityRecord record = IdentityRecord.builder()
                .valid(valid)
                .lastName(cleanName(names[0]))
                .firstName(cleanName(names[1]))
                .birthDate(birthDate)
                .expiryDate(expiryDate)
                .nationality(nationality)
                .documentNumber(stripFiller(documentNumberField))
                .sex(sex == FILLER ? "X" : String.valueOf(sex))
                .issuingCountry(issuingCountry)
                .rawMrzText(line1 + "\n" + line2)
                .build();

        if (!valid && !record.hasName()) {
            log.debug("Discarding MRZ candidate without checksums or name data");
            return Optional.empty();
        }
        return Optional.of(record);
    }

    /**
     * YYMMDD to a date; years up to {@value #CENTURY_PIVOT} fall in the 2000s.
     *
     * @return null when the field is not a calendar date
     */
    public static LocalDate parseDate(String yymmdd) {
        if (yymmdd == null) {
            return null;
        }
        String digits = yymmdd.replaceAll("\\D", "");
        if (digits.length() < 6) {
            return null;
        }
        int twoDigitYear = Integer.parseInt(digits.substring(0, 2));
        int month = Integer.parseInt(digits.substring(2, 4));
        int day = Integer.parseInt(digits.substring(4, 6));
        int year = twoDigitYear <= CENTURY_PIVOT ? 2000 + twoDigitYear : 1900 + twoDigitYear;
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            log.debug("Invalid MRZ date {}", yymmdd);
            return null;
        }
    }

    /**
     * Fillers become spaces, runs of spaces collapse, words are title cased.
     */
    public static String cleanName(String raw) {
        if (raw == null) {
            return "";
        }
        String spaced = raw.replace(FILLER, ' ').trim();
        if (spaced.isEmpty()) {
            return "";
        }
        return Arrays.stream(spaced.split("\\s+"))
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT)
                        + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    static String normalize(String line) {
        if (line.length() >= TD3_LINE_LENGTH) {
            return line.substring(0, TD3_LINE_LENGTH);
        }
        StringBuilder padded = new StringBuilder(TD3_LINE_LENGTH).append(line);
        while (padded.length() < TD3_LINE_LENGTH) {
            padded.append(FILLER);
        }
        return padded.toString();
    }

    private static boolean isPassportMarker(String line) {
        if (line.length() < 2 || line.charAt(0) != 'P') {
            return false;
        }
        char type = line.charAt(1);
        return type == FILLER || (type >= 'A' && type <= 'Z');
    }

    private static String[] splitNames(String nameField) {
        String trimmed = trimTrailingFiller(nameField);
        int separator = trimmed.indexOf("" + FILLER + FILLER);
        if (separator < 0) {
            return new String[]{trimmed, ""};
        }
        return new String[]{trimmed.substring(0, separator), trimmed.substring(separator + 2)};
    }

    private static String cleanLine(String raw) {
        String upper = raw.toUpperCase(Locale.ROOT)
                .replace("«", "<<")
                .replace('‹', FILLER);
        StringBuilder cleaned = new StringBuilder(upper.length());
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if ((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == FILLER) {
                cleaned.append(c);
            }
        }
        return cleaned.toString();
    }

    private static List<String> splitLines(String mrz) {
        if (mrz == null) {
            return List.of();
        }
        return Arrays.stream(mrz.split("\\R"))
                .map(MrzParser::cleanLine)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
    }

    private static String stripFiller(String field) {
        return field.replace(String.valueOf(FILLER), "");
    }

    private static String trimTrailingFiller(String field) {
        int end = field.length();
        while (end > 0 && field.charAt(end - 1) == FILLER) {
            end--;
        }
        return field.substring(0, end);
    }

    // OCR commonly confuses these letters with digits in numeric positions
    private static String toDigits(String field) {
        StringBuilder digits = new StringBuilder(field.length());
        for (int i = 0; i < field.length(); i++) {
            digits.append(toDigit(field.charAt(i)));
        }
        return digits.toString();
    }

    private static char toDigit(char c) {
        switch (c) {
            case 'O':
            case 'Q':
            case 'D':
                return '0';
            case 'I':
            case 'L':
                return '1';
            case 'Z':
                return '2';
            case 'S':
                return '5';
            case 'G':
                return '6';
            case 'B':
                return '8';
            default:
                return c;
        }
    }
}
