package com.anemone.account;

import com.anemone.chain.TokenBalance;
import com.anemone.chain.TokenSummary;
import com.anemone.events.AgentEventType;
import com.anemone.events.EventBus;
import com.anemone.orchestration.api.TokenBalanceClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class TokenService {

    public static final String SUI_COIN_TYPE = "0x2::sui::SUI";

    private final TokenBalanceClient tokenBalanceClient;
    private final WalletService walletService;
    private final EventBus eventBus;

    public List<TokenBalance> getTokenBalances(String address) {
        if (address == null || !address.startsWith("0x")) {
            throw new IllegalArgumentException("Invalid Sui address: " + address);
        }
        List<TokenBalance> balances = tokenBalanceClient.getAccountBalance(address);
        eventBus.publish(AgentEventType.BLOCKCHAIN_DATA_FETCHED, Map.of(
                "type", "account_balance",
                "address", address,
                "tokensCount", balances.size()));
        return balances;
    }

    public TokenSummary getTokensSummary(String address) {
        return summarize(getTokenBalances(address));
    }

    public List<TokenBalance> getWalletTokenBalances() {
        return getTokenBalances(requireWalletAddress());
    }

    public TokenSummary getWalletTokensSummary() {
        return getTokensSummary(requireWalletAddress());
    }

    static TokenSummary summarize(List<TokenBalance> balances) {
        BigDecimal totalUsd = BigDecimal.ZERO;
        BigDecimal suiBalance = BigDecimal.ZERO;
        BigDecimal suiUsd = BigDecimal.ZERO;
        for (TokenBalance token : balances) {
            if (token.balanceUsd() != null) {
                totalUsd = totalUsd.add(token.balanceUsd());
            }
            if (SUI_COIN_TYPE.equals(token.coinType())) {
                suiBalance = token.balance() == null ? BigDecimal.ZERO : token.balance();
                suiUsd = token.balanceUsd() == null ? BigDecimal.ZERO : token.balanceUsd();
            }
        }
        return new TokenSummary(totalUsd, suiBalance, suiUsd, balances.size());
    }

    private String requireWalletAddress() {
        return walletService.getWalletInfo()
                .map(WalletInfo::address)
                .orElseThrow(() -> new IllegalStateException("No wallet registered"));
    }
}
