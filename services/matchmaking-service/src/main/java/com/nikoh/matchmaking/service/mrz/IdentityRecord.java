package com.nikoh.matchmaking.service.mrz;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Identity data decoded from a passport machine readable zone.
 * {@code valid} is false when check digits failed; such records need human review.
 */
@Value
@Builder(toBuilder = true)
public class IdentityRecord {

    boolean valid;
    String firstName;
    String lastName;
    LocalDate birthDate;
    LocalDate expiryDate;
    /**
     * ISO 3166 alpha-3 code as printed in the zone
     */
    String nationality;
    String documentNumber;
    String sex;
    String issuingCountry;
    String rawMrzText;

    public boolean hasName() {
        return (firstName != null && !firstName.isEmpty()) || (lastName != null && !lastName.isEmpty());
    }
}
