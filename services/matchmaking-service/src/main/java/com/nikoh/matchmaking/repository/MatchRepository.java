package com.nikoh.matchmaking.repository;

import com.nikoh.matchmaking.domain.Match;
import com.nikoh.matchmaking.domain.MatchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MatchRepository extends JpaRepository<Match, UUID> {

    @Query("SELECT m FROM Match m " +
           "WHERE (m.userAId = :userId OR m.userBId = :userId) " +
           "AND m.status = :status")
    List<Match> findByParticipantAndStatus(
            @Param("userId") UUID userId,
            @Param("status") MatchStatus status);
}
