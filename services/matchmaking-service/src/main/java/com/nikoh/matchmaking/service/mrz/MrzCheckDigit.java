package com.nikoh.matchmaking.service.mrz;

/**
 * ICAO 9303 check digit: weights 7, 3, 1 repeating; digits keep their value,
 * letters map A=10 to Z=35 and the filler counts as zero.
 */
public final class MrzCheckDigit {

    private static final int[] WEIGHTS = {7, 3, 1};

    private MrzCheckDigit() {
    }

    public static int compute(CharSequence field) {
        int sum = 0;
        for (int i = 0; i < field.length(); i++) {
            sum += valueOf(field.charAt(i)) * WEIGHTS[i % WEIGHTS.length];
        }
        return sum % 10;
    }

    /**
     * Mandatory check digit: the check character must be a digit.
     */
    public static boolean matches(CharSequence field, char checkDigit) {
        return checkDigit >= '0' && checkDigit <= '9' && compute(field) == checkDigit - '0';
    }

    /**
     * Check digit of an optional field. A filler is accepted only when the field itself is empty.
     */
    public static boolean matchesOptional(CharSequence field, char checkDigit) {
        if (checkDigit == MrzParser.FILLER) {
            return isEmpty(field);
        }
        return matches(field, checkDigit);
    }

    private static boolean isEmpty(CharSequence field) {
        for (int i = 0; i < field.length(); i++) {
            if (field.charAt(i) != MrzParser.FILLER) {
                return false;
            }
        }
        return true;
    }

    static int valueOf(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'Z') {
            return c - 'A' + 10;
        }
        return 0;
    }
}
