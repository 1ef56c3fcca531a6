package com.nikoh.matchmaking.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.util.UUID;

/**
 * Dating profile. Fields prefixed {@code verified} are only ever written from
 * an approved identity document; the rest are self-declared.
 */
@Entity
@Table(name = "profiles", indexes = {
    @Index(name = "idx_profiles_user", columnList = "user_id", unique = true),
    @Index(name = "idx_profiles_gender_visible", columnList = "gender, is_visible")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Profile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, unique = true)
    private User user;

    // Document-backed fields
    @Column(name = "verified_first_name", length = 100)
    private String verifiedFirstName;

    @Column(name = "verified_last_initial", length = 1)
    private String verifiedLastInitial;

    @Column(name = "verified_birth_date")
    private LocalDate verifiedBirthDate;

    @Column(name = "verified_birthplace_country", length = 100)
    private String verifiedBirthplaceCountry;

    @Column(name = "verified_birthplace_city", length = 100)
    private String verifiedBirthplaceCity;

    @Column(name = "verified_nationality", length = 100)
    private String verifiedNationality;

    @Column(name = "verified_residence_country", length = 100)
    private String verifiedResidenceCountry;

    @Column(name = "verified_residence_status", length = 50)
    private String verifiedResidenceStatus;

    @Column(name = "verified_marital_status", length = 50)
    private String verifiedMaritalStatus;

    @Column(name = "verified_education_level", length = 100)
    private String verifiedEducationLevel;

    // Self-declared fields
    @Enumerated(EnumType.STRING)
    @Column(name = "gender", length = 10)
    private Gender gender;

    @Enumerated(EnumType.STRING)
    @Column(name = "seeking_gender", length = 10)
    private Gender seekingGender;

    @Column(name = "current_city", length = 100)
    private String currentCity;

    @Column(name = "height_cm")
    private Integer heightCm;

    @Column(name = "ethnicity", length = 50)
    private String ethnicity;

    @Column(name = "religious_practice", length = 50)
    private String religiousPractice;

    @Column(name = "smoking", length = 30)
    private String smoking;

    @Column(name = "alcohol", length = 30)
    private String alcohol;

    @Column(name = "diet", length = 30)
    private String diet;

    @Column(name = "profession", length = 100)
    private String profession;

    @Column(name = "is_visible", nullable = false)
    @Builder.Default
    private boolean visible = true;

    @Column(name = "is_complete", nullable = false)
    @Builder.Default
    private boolean complete = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Age in whole years on {@code today}, or null when no verified birth date exists.
     */
    public Integer ageOn(LocalDate today) {
        if (verifiedBirthDate == null) {
            return null;
        }
        return Period.between(verifiedBirthDate, today).getYears();
    }

    /**
     * Country used for location matching: nationality first, then residence.
     */
    public String locationCountry() {
        return verifiedNationality != null ? verifiedNationality : verifiedResidenceCountry;
    }

    /**
     * Public display name such as "Aziza K.", null until a first name has been verified.
     */
    public String displayName() {
        if (verifiedFirstName == null) {
            return null;
        }
        return verifiedLastInitial != null
                ? verifiedFirstName + " " + verifiedLastInitial + "."
                : verifiedFirstName;
    }
}
