package com.nikoh.matchmaking.service.matching;

import com.nikoh.matchmaking.domain.Profile;
import com.nikoh.matchmaking.domain.SearchPreference;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Weighted compatibility between a viewer and a candidate profile.
 *
 * <p>Factors and their maximum points:
 * <ul>
 *   <li>age 15, location 15, ethnicity 10, religion 15, education 5</li>
 *   <li>marital status 10, height 5, lifestyle 10 (partial credit)</li>
 *   <li>verification 10, mutual 5</li>
 * </ul>
 *
 * <p>Ages come from verified birth dates only and are taken on the current date of the
 * injected clock; a candidate without one fails the age factor.
 */
@Component
@RequiredArgsConstructor
public class CompatibilityScorer {

    public static final String AGE = "age";
    public static final String LOCATION = "location";
    public static final String ETHNICITY = "ethnicity";
    public static final String RELIGION = "religion";
    public static final String EDUCATION = "education";
    public static final String MARITAL_STATUS = "marital_status";
    public static final String HEIGHT = "height";
    public static final String LIFESTYLE = "lifestyle";
    public static final String VERIFICATION = "verification";
    public static final String MUTUAL = "mutual";

    static final int AGE_POINTS = 15;
    static final int LOCATION_POINTS = 15;
    static final int ETHNICITY_POINTS = 10;
    static final int RELIGION_POINTS = 15;
    static final int EDUCATION_POINTS = 5;
    static final int MARITAL_STATUS_POINTS = 10;
    static final int HEIGHT_POINTS = 5;
    static final int LIFESTYLE_POINTS = 10;
    static final int VERIFICATION_POINTS = 10;
    static final int MUTUAL_POINTS = 5;

    private final Clock clock;

    public CompatibilityResult score(Profile viewer, SearchPreference viewerPreferences,
                                     Profile candidate, SearchPreference candidatePreferences) {
        SearchPreference preferences = viewerPreferences != null ? viewerPreferences : SearchPreference.defaults();
        LocalDate today = LocalDate.now(clock);

        Map<String, CompatibilityBreakdown> breakdown = new LinkedHashMap<>();
        breakdown.put(AGE, scoreAge(preferences, candidate.ageOn(today)));
        breakdown.put(LOCATION, scoreLocation(preferences, candidate));
        breakdown.put(ETHNICITY, scoreList(preferences.getPreferredEthnicities(), candidate.getEthnicity(),
                ETHNICITY_POINTS, "Ethnicity compatible", "Ethnicity not in preferences"));
        breakdown.put(RELIGION, scoreList(preferences.getPreferredReligiousPractices(),
                candidate.getReligiousPractice(), RELIGION_POINTS,
                "Religious practice compatible", "Religious practice not in preferences"));
        breakdown.put(EDUCATION, scoreList(preferences.getPreferredEducationLevels(),
                candidate.getVerifiedEducationLevel(), EDUCATION_POINTS,
                "Education compatible", "Education level not in preferences"));
        breakdown.put(MARITAL_STATUS, scoreList(preferences.getPreferredMaritalStatuses(),
                candidate.getVerifiedMaritalStatus(), MARITAL_STATUS_POINTS,
                "Marital status compatible", "Marital status not in preferences"));
        breakdown.put(HEIGHT, scoreHeight(preferences, candidate.getHeightCm()));
        breakdown.put(LIFESTYLE, scoreLifestyle(preferences, candidate));
        breakdown.put(VERIFICATION, scoreVerification(candidate));

        boolean mutual = isMutual(viewer, candidatePreferences, today);
        breakdown.put(MUTUAL, CompatibilityBreakdown.of(mutual, MUTUAL_POINTS,
                mutual ? "Mutual match potential" : "Not a mutual match"));

        int total = breakdown.values().stream().mapToInt(CompatibilityBreakdown::getScore).sum();

        return CompatibilityResult.builder()
                .score(total)
                .breakdown(breakdown)
                .mutual(mutual)
                .mutualScore(mutual ? MUTUAL_POINTS : null)
                .build();
    }

    /**
     * An empty or missing preference list accepts anything, including a missing value;
     * otherwise the value must be present and match one entry ignoring case.
     */
    public static boolean matchesList(List<String> preferred, String value) {
        if (preferred == null || preferred.isEmpty()) {
            return true;
        }
        if (value == null || value.isEmpty()) {
            return false;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        for (String option : preferred) {
            if (option != null && option.toLowerCase(Locale.ROOT).equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    private CompatibilityBreakdown scoreAge(SearchPreference preferences, Integer candidateAge) {
        if (candidateAge == null) {
            return CompatibilityBreakdown.of(false, AGE_POINTS, "Age not verified");
        }
        if (candidateAge < preferences.getMinAge()) {
            return CompatibilityBreakdown.of(false, AGE_POINTS,
                    String.format("Too young (%d < %d)", candidateAge, preferences.getMinAge()));
        }
        if (candidateAge > preferences.getMaxAge()) {
            return CompatibilityBreakdown.of(false, AGE_POINTS,
                    String.format("Too old (%d > %d)", candidateAge, preferences.getMaxAge()));
        }
        return CompatibilityBreakdown.of(true, AGE_POINTS, "Age " + candidateAge + " within range");
    }

    private CompatibilityBreakdown scoreLocation(SearchPreference preferences, Profile candidate) {
        String detail = "Location compatible";
        if (!isEmpty(preferences.getPreferredCountries())) {
            if (!matchesList(preferences.getPreferredCountries(), candidate.locationCountry())) {
                return CompatibilityBreakdown.of(false, LOCATION_POINTS, "Country not in preferences");
            }
            detail = "Country matches preference";
        }
        if (!matchesList(preferences.getPreferredCities(), candidate.getCurrentCity())) {
            return CompatibilityBreakdown.of(false, LOCATION_POINTS, "City not in preferences");
        }
        return CompatibilityBreakdown.of(true, LOCATION_POINTS, detail);
    }

    private CompatibilityBreakdown scoreList(List<String> preferred, String value, int points,
                                             String matchDetail, String mismatchDetail) {
        boolean match = matchesList(preferred, value);
        return CompatibilityBreakdown.of(match, points, match ? matchDetail : mismatchDetail);
    }

    private CompatibilityBreakdown scoreHeight(SearchPreference preferences, Integer heightCm) {
        if (heightCm == null) {
            return CompatibilityBreakdown.of(true, HEIGHT_POINTS, "Height not specified");
        }
        if (preferences.getMinHeightCm() != null && heightCm < preferences.getMinHeightCm()) {
            return CompatibilityBreakdown.of(false, HEIGHT_POINTS, "Too short (" + heightCm + "cm)");
        }
        if (preferences.getMaxHeightCm() != null && heightCm > preferences.getMaxHeightCm()) {
            return CompatibilityBreakdown.of(false, HEIGHT_POINTS, "Too tall (" + heightCm + "cm)");
        }
        return CompatibilityBreakdown.of(true, HEIGHT_POINTS, "Height compatible");
    }

    private CompatibilityBreakdown scoreLifestyle(SearchPreference preferences, Profile candidate) {
        List<Boolean> checks = new ArrayList<>();
        if (!isEmpty(preferences.getPreferredSmoking())) {
            checks.add(matchesList(preferences.getPreferredSmoking(), candidate.getSmoking()));
        }
        if (!isEmpty(preferences.getPreferredAlcohol())) {
            checks.add(matchesList(preferences.getPreferredAlcohol(), candidate.getAlcohol()));
        }
        if (!isEmpty(preferences.getPreferredDiet())) {
            checks.add(matchesList(preferences.getPreferredDiet(), candidate.getDiet()));
        }

        if (checks.isEmpty()) {
            return CompatibilityBreakdown.of(true, LIFESTYLE_POINTS, "No lifestyle preferences set");
        }

        int matched = (int) checks.stream().filter(Boolean::booleanValue).count();
        int considered = checks.size();
        return CompatibilityBreakdown.builder()
                .match(matched == considered)
                .score(matched * LIFESTYLE_POINTS / considered)
                .maxScore(LIFESTYLE_POINTS)
                .detail(matched + "/" + considered + " lifestyle preferences match")
                .build();
    }

    private CompatibilityBreakdown scoreVerification(Profile candidate) {
        boolean verified = candidate.getUser() != null && candidate.getUser().isVerified();
        return CompatibilityBreakdown.of(verified, VERIFICATION_POINTS, verified ? "Verified profile" : "Not verified");
    }

    /**
     * Whether the candidate's own preferences accept the viewer. Only the age range (when the
     * viewer's age is known) and the country list are checked; no preferences means no objection.
     */
    private boolean isMutual(Profile viewer, SearchPreference candidatePreferences, LocalDate today) {
        if (candidatePreferences == null) {
            return true;
        }
        Integer viewerAge = viewer.ageOn(today);
        if (viewerAge != null && !candidatePreferences.acceptsAge(viewerAge)) {
            return false;
        }
        return matchesList(candidatePreferences.getPreferredCountries(), viewer.locationCountry());
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}
