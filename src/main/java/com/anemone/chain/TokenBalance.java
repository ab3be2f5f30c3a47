package com.anemone.chain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenBalance(
        String coinType,
        String coinName,
        String coinSymbol,
        BigDecimal balance,
        BigDecimal balanceUsd,
        Integer decimals,
        BigDecimal coinPrice
) {
}
