package com.anemone.repository;

import com.anemone.entity.AgentWallet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AgentWalletRepository extends JpaRepository<AgentWallet, UUID> {

    Optional<AgentWallet> findFirstByOrderByCreatedAtDesc();

    Optional<AgentWallet> findByAddress(String address);
}
