package com.nikoh.matchmaking.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Desired-partner filters. An empty list accepts any value.
 */
@Entity
@Table(name = "search_preferences", indexes = {
    @Index(name = "idx_search_preferences_user", columnList = "user_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchPreference {

    public static final int DEFAULT_MIN_AGE = 18;
    public static final int DEFAULT_MAX_AGE = 99;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true)
    private UUID userId;

    @Column(name = "min_age", nullable = false)
    @Builder.Default
    private int minAge = DEFAULT_MIN_AGE;

    @Column(name = "max_age", nullable = false)
    @Builder.Default
    private int maxAge = DEFAULT_MAX_AGE;

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_countries", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> preferredCountries = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_cities", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> preferredCities = new ArrayList<>();

    @Column(name = "willing_to_relocate", nullable = false)
    @Builder.Default
    private boolean willingToRelocate = false;

    @Convert(converter = StringListConverter.class)
    @Column(name = "relocation_countries", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> relocationCountries = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_ethnicities", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> preferredEthnicities = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_marital_statuses", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> preferredMaritalStatuses = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_education_levels", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> preferredEducationLevels = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_religious_practices", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> preferredReligiousPractices = new ArrayList<>();

    @Column(name = "min_height_cm")
    private Integer minHeightCm;

    @Column(name = "max_height_cm")
    private Integer maxHeightCm;

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_smoking", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> preferredSmoking = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_alcohol", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> preferredAlcohol = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_diet", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> preferredDiet = new ArrayList<>();

    @Column(name = "must_be_verified", nullable = false)
    @Builder.Default
    private boolean mustBeVerified = true;

    @Column(name = "has_children_acceptable", nullable = false)
    @Builder.Default
    private boolean hasChildrenAcceptable = true;

    @Column(name = "children_preference", length = 30)
    private String childrenPreference;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Permissive preferences applied when a user has not stored any.
     */
    public static SearchPreference defaults() {
        return SearchPreference.builder().build();
    }

    public boolean acceptsAge(int age) {
        return age >= minAge && age <= maxAge;
    }
}
