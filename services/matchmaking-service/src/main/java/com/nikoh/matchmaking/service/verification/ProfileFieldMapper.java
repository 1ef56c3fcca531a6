package com.nikoh.matchmaking.service.verification;

import com.nikoh.matchmaking.domain.DocumentType;
import com.nikoh.matchmaking.domain.Profile;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.BiConsumer;

import static com.nikoh.matchmaking.service.verification.ExtractedData.*;

/**
 * Copies approved document data onto the verified profile fields.
 * One mapping per document type, shared by automatic and manual approval.
 */
@Component
public class ProfileFieldMapper {

    static final String DIVORCED_ONCE = "divorced_once";

    private final Map<DocumentType, BiConsumer<Profile, Map<String, Object>>> mappings =
            new EnumMap<>(DocumentType.class);

    public ProfileFieldMapper() {
        mappings.put(DocumentType.PASSPORT, ProfileFieldMapper::applyPassport);
        mappings.put(DocumentType.RESIDENCE_PERMIT, ProfileFieldMapper::applyResidencePermit);
        mappings.put(DocumentType.DIVORCE_CERTIFICATE, (profile, data) -> profile.setVerifiedMaritalStatus(DIVORCED_ONCE));
        mappings.put(DocumentType.DIPLOMA, ProfileFieldMapper::applyDiploma);
        // Employment proof only confirms the self-declared profession
        mappings.put(DocumentType.EMPLOYMENT_PROOF, (profile, data) -> { });
    }

    public void apply(Profile profile, DocumentType documentType, Map<String, Object> extractedData) {
        Map<String, Object> data = extractedData != null ? extractedData : Collections.emptyMap();
        mappings.get(documentType).accept(profile, data);
    }

    private static void applyPassport(Profile profile, Map<String, Object> data) {
        if (data.containsKey(FIRST_NAME)) {
            profile.setVerifiedFirstName(stringValue(data, FIRST_NAME));
        }
        if (data.containsKey(LAST_NAME)) {
            String lastName = stringValue(data, LAST_NAME);
            profile.setVerifiedLastInitial(lastName == null || lastName.isBlank()
                    ? null : lastName.strip().substring(0, 1).toUpperCase());
        }
        if (data.containsKey(BIRTH_DATE)) {
            profile.setVerifiedBirthDate(dateValue(data, BIRTH_DATE));
        }
        if (data.containsKey(BIRTH_PLACE)) {
            String birthPlace = stringValue(data, BIRTH_PLACE);
            if (birthPlace != null && birthPlace.contains(",")) {
                int comma = birthPlace.lastIndexOf(',');
                profile.setVerifiedBirthplaceCity(birthPlace.substring(0, comma).strip());
                profile.setVerifiedBirthplaceCountry(birthPlace.substring(comma + 1).strip());
            } else {
                profile.setVerifiedBirthplaceCity(birthPlace);
            }
        }
        if (data.containsKey(NATIONALITY)) {
            profile.setVerifiedNationality(stringValue(data, NATIONALITY));
        }
    }

    private static void applyResidencePermit(Profile profile, Map<String, Object> data) {
        if (data.containsKey(COUNTRY)) {
            profile.setVerifiedResidenceCountry(stringValue(data, COUNTRY));
        }
        if (data.containsKey(STATUS)) {
            profile.setVerifiedResidenceStatus(stringValue(data, STATUS));
        }
    }

    private static void applyDiploma(Profile profile, Map<String, Object> data) {
        if (data.containsKey(DEGREE)) {
            profile.setVerifiedEducationLevel(stringValue(data, DEGREE));
        }
    }
}
