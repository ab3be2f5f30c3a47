package com.anemone.orchestration.api;

import com.anemone.chain.TokenBalance;

import java.util.List;

public interface TokenBalanceClient {

    List<TokenBalance> getAccountBalance(String address);
}
