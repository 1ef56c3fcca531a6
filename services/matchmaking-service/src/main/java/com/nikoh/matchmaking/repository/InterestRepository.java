package com.nikoh.matchmaking.repository;

import com.nikoh.matchmaking.domain.Interest;
import com.nikoh.matchmaking.domain.InterestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Read side of interests, used for suggestion exclusions
 */
@Repository
public interface InterestRepository extends JpaRepository<Interest, UUID> {

    @Query("SELECT i.toUserId FROM Interest i WHERE i.fromUserId = :userId")
    List<UUID> findRecipientIdsBySender(@Param("userId") UUID userId);

    @Query("SELECT i.fromUserId FROM Interest i WHERE i.toUserId = :userId")
    List<UUID> findSenderIdsByRecipient(@Param("userId") UUID userId);

    @Query("SELECT i.fromUserId FROM Interest i " +
           "WHERE i.toUserId = :userId AND i.status = :status")
    List<UUID> findSenderIdsByRecipientAndStatus(
            @Param("userId") UUID userId,
            @Param("status") InterestStatus status);
}
