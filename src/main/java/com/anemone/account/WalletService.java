package com.anemone.account;

import com.anemone.entity.AgentWallet;
import com.anemone.repository.AgentWalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Stores the wallet address linked to the agent. Keys are never handled here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    private final AgentWalletRepository walletRepository;

    @Transactional(readOnly = true)
    public Optional<WalletInfo> getWalletInfo() {
        return walletRepository.findFirstByOrderByCreatedAtDesc().map(WalletInfo::from);
    }

    @Transactional
    public WalletInfo registerWallet(String address) {
        if (!StringUtils.hasText(address) || !address.trim().startsWith("0x")) {
            throw new IllegalArgumentException("Invalid Sui address: " + address);
        }
        String normalized = address.trim();
        AgentWallet wallet = walletRepository.findByAddress(normalized)
                .orElseGet(() -> {
                    log.info("Registering wallet {}.", normalized);
                    return walletRepository.saveAndFlush(AgentWallet.builder().address(normalized).build());
                });
        return WalletInfo.from(wallet);
    }
}
