package com.nikoh.matchmaking.service.verification;

import com.nikoh.matchmaking.service.mrz.CountryCodes;
import com.nikoh.matchmaking.service.mrz.IdentityRecord;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keys of {@code Verification.extractedData}. Passport data is keyed like the
 * profile fields it feeds; OCR-only documents carry raw text and heuristics.
 */
public final class ExtractedData {

    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";
    public static final String BIRTH_DATE = "birth_date";
    public static final String BIRTH_PLACE = "birth_place";
    public static final String EXPIRY_DATE = "expiry_date";
    public static final String NATIONALITY = "nationality";
    public static final String DOCUMENT_NUMBER = "document_number";
    public static final String SEX = "sex";
    public static final String COUNTRY = "country";
    public static final String STATUS = "status";
    public static final String DEGREE = "degree";
    public static final String MRZ_VALID = "mrz_valid";

    public static final String RAW_TEXT = "raw_text";
    public static final String MRZ_DATA = "mrz_data";
    public static final String DETECTED_TYPE = "detected_type";
    public static final String TYPE_MATCHES_DECLARED = "type_matches_declared";
    public static final String FOUND_DATES = "found_dates";
    public static final String FOUND_NAMES = "found_names";

    private ExtractedData() {
    }

    /**
     * Passport fields with country codes expanded to names and dates in ISO format
     */
    public static Map<String, Object> fromIdentity(IdentityRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(FIRST_NAME, record.getFirstName());
        data.put(LAST_NAME, record.getLastName());
        data.put(BIRTH_DATE, isoDate(record.getBirthDate()));
        data.put(EXPIRY_DATE, isoDate(record.getExpiryDate()));
        data.put(NATIONALITY, CountryCodes.nameOf(record.getNationality()));
        data.put(DOCUMENT_NUMBER, record.getDocumentNumber());
        data.put(SEX, record.getSex());
        data.put(COUNTRY, CountryCodes.nameOf(record.getIssuingCountry()));
        data.put(MRZ_VALID, record.isValid());
        return data;
    }

    /**
     * Reads a date stored either as ISO text or as a {@link LocalDate}; anything else reads as null
     */
    public static LocalDate dateValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return LocalDate.parse(((String) value).trim());
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    public static String stringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value == null ? null : value.toString();
    }

    private static String isoDate(LocalDate date) {
        return date == null ? null : date.toString();
    }
}
