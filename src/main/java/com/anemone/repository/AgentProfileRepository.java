package com.anemone.repository;

import com.anemone.entity.AgentProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AgentProfileRepository extends JpaRepository<AgentProfile, UUID> {

    /**
     * The agent keeps a single active profile: the most recently updated one.
     */
    Optional<AgentProfile> findFirstByOrderByUpdatedAtDesc();
}
