package com.nikoh.matchmaking.repository;

import com.nikoh.matchmaking.domain.User;
import com.nikoh.matchmaking.domain.UserVerificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByEmail(String email);

    /**
     * Users whose verification lapsed before {@code now} but still show as verified
     */
    @Query("SELECT u FROM User u " +
           "WHERE u.verificationStatus = :status " +
           "AND u.verificationExpiresAt IS NOT NULL " +
           "AND u.verificationExpiresAt < :now")
    List<User> findWithVerificationExpiredBefore(
            @Param("status") UserVerificationStatus status,
            @Param("now") LocalDateTime now);
}
