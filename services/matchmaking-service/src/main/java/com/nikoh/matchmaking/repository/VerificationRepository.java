package com.nikoh.matchmaking.repository;

import com.nikoh.matchmaking.domain.DocumentType;
import com.nikoh.matchmaking.domain.Verification;
import com.nikoh.matchmaking.domain.VerificationStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for document verifications
 */
@Repository
public interface VerificationRepository extends JpaRepository<Verification, UUID> {

    Page<Verification> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    Page<Verification> findByUserIdAndStatusOrderByCreatedAtDesc(
            UUID userId, VerificationStatus status, Pageable pageable);

    List<Verification> findByUserId(UUID userId);

    boolean existsByUserIdAndDocumentTypeAndStatusIn(
            UUID userId, DocumentType documentType, Collection<VerificationStatus> statuses);

    /**
     * Review queue, oldest submission first
     */
    Page<Verification> findByStatusInOrderByCreatedAtAsc(
            Collection<VerificationStatus> statuses, Pageable pageable);

    /**
     * Approved verifications whose underlying document has expired
     */
    @Query("SELECT v FROM Verification v " +
           "WHERE v.status = com.nikoh.matchmaking.domain.VerificationStatus.APPROVED " +
           "AND v.documentExpiryDate IS NOT NULL " +
           "AND v.documentExpiryDate < :today")
    List<Verification> findApprovedWithDocumentExpiredBefore(@Param("today") LocalDate today);
}
