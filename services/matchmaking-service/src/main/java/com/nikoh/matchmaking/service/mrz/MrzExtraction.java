package com.nikoh.matchmaking.service.mrz;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class MrzExtraction {

    public enum Status {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }

    private final Status status;
    private final IdentityRecord record;

    public static MrzExtraction found(IdentityRecord record) {
        return new MrzExtraction(Status.FOUND, record);
    }

    public static MrzExtraction notFound() {
        return new MrzExtraction(Status.NOT_FOUND, null);
    }

    public static MrzExtraction unavailable() {
        return new MrzExtraction(Status.UNAVAILABLE, null);
    }

    /**
     * Only checksum verified zones may drive an automatic decision
     */
    public boolean isValid() {
        return status == Status.FOUND && record.isValid();
    }
}
