package com.nikoh.matchmaking.repository;

import com.nikoh.matchmaking.domain.SearchPreference;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SearchPreferenceRepository extends JpaRepository<SearchPreference, UUID> {

    Optional<SearchPreference> findByUserId(UUID userId);

    List<SearchPreference> findByUserIdIn(Collection<UUID> userIds);
}
