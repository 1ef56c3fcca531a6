package com.nikoh.matchmaking.repository;

import com.nikoh.matchmaking.domain.Gender;
import com.nikoh.matchmaking.domain.Profile;
import com.nikoh.matchmaking.domain.UserStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for dating profiles
 */
@Repository
public interface ProfileRepository extends JpaRepository<Profile, UUID> {

    @Query("SELECT p FROM Profile p JOIN FETCH p.user u WHERE u.id = :userId")
    Optional<Profile> findByUserId(@Param("userId") UUID userId);

    @Query("SELECT p FROM Profile p JOIN FETCH p.user u WHERE p.id = :profileId")
    Optional<Profile> findWithUserById(@Param("profileId") UUID profileId);

    /**
     * Visible profiles of active users with the given gender, oldest first
     */
    @Query("SELECT p FROM Profile p JOIN FETCH p.user u " +
           "WHERE p.visible = true " +
           "AND u.status = :userStatus " +
           "AND u.id <> :viewerId " +
           "AND p.gender = :gender " +
           "ORDER BY p.createdAt ASC, p.id ASC")
    List<Profile> findVisibleCandidatesByGender(
            @Param("viewerId") UUID viewerId,
            @Param("gender") Gender gender,
            @Param("userStatus") UserStatus userStatus);

    /**
     * Visible profiles of active users regardless of gender, oldest first
     */
    @Query("SELECT p FROM Profile p JOIN FETCH p.user u " +
           "WHERE p.visible = true " +
           "AND u.status = :userStatus " +
           "AND u.id <> :viewerId " +
           "ORDER BY p.createdAt ASC, p.id ASC")
    List<Profile> findVisibleCandidates(
            @Param("viewerId") UUID viewerId,
            @Param("userStatus") UserStatus userStatus);

    /**
     * Profiles of active users who are looking for the given gender
     */
    @Query("SELECT p FROM Profile p JOIN FETCH p.user u " +
           "WHERE u.status = :userStatus " +
           "AND u.id <> :viewerId " +
           "AND p.seekingGender = :gender " +
           "ORDER BY p.createdAt ASC, p.id ASC")
    List<Profile> findSeekingGender(
            @Param("viewerId") UUID viewerId,
            @Param("gender") Gender gender,
            @Param("userStatus") UserStatus userStatus);
}
