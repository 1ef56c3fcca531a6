package com.nikoh.matchmaking.repository;

import com.nikoh.matchmaking.domain.Selfie;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SelfieRepository extends JpaRepository<Selfie, UUID> {

    Optional<Selfie> findByUserId(UUID userId);
}
