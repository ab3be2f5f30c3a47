package com.anemone.chain;

import java.math.BigDecimal;

public record TokenSummary(
        BigDecimal totalUsdValue,
        BigDecimal suiBalance,
        BigDecimal suiUsdValue,
        int tokensCount
) {
}
