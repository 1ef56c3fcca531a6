package com.nikoh.matchmaking.service.mrz;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MrzCheckDigit Tests")
class MrzCheckDigitTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "L898902C3, 6",
            "740812, 2",
            "120415, 9",
            "FA1234567, 3",
            "950321, 6",
            "300115, 6"
    })
    @DisplayName("Should compute ICAO check digits")
    void shouldComputeCheckDigit(String field, int expected) {
        assertThat(MrzCheckDigit.compute(field)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should accept a filler check digit only for an empty optional field")
    void shouldAcceptFillerForEmptyOptionalField() {
        assertThat(MrzCheckDigit.matchesOptional("<<<<<<<<<<<<<<", '<')).isTrue();
        assertThat(MrzCheckDigit.matchesOptional("ZE184226B<<<<<", '<')).isFalse();
        assertThat(MrzCheckDigit.matchesOptional("ZE184226B<<<<<", '1')).isTrue();
    }

    @Test
    @DisplayName("Should never accept a filler for a mandatory check digit")
    void shouldRejectFillerForMandatoryField() {
        assertThat(MrzCheckDigit.matches("<<<<<<<<<", '<')).isFalse();
        assertThat(MrzCheckDigit.matches("<<<<<<", '<')).isFalse();
    }

    @Test
    @DisplayName("Should reject a non digit check character")
    void shouldRejectNonDigit() {
        assertThat(MrzCheckDigit.matches("740812", 'X')).isFalse();
        assertThat(MrzCheckDigit.matches("740812", '3')).isFalse();
        assertThat(MrzCheckDigit.matches("740812", '2')).isTrue();
    }

    @Test
    @DisplayName("Should map letters from ten upwards")
    void shouldMapLetterValues() {
        assertThat(MrzCheckDigit.valueOf('A')).isEqualTo(10);
        assertThat(MrzCheckDigit.valueOf('Z')).isEqualTo(35);
        assertThat(MrzCheckDigit.valueOf('<')).isZero();
        assertThat(MrzCheckDigit.valueOf('7')).isEqualTo(7);
    }
}
