package com.anemone.account;

import com.anemone.entity.AgentWallet;

import java.time.OffsetDateTime;

public record WalletInfo(
        String address,
        OffsetDateTime createdAt
) {

    static WalletInfo from(AgentWallet wallet) {
        return new WalletInfo(wallet.getAddress(), wallet.getCreatedAt());
    }
}
