package com.anemone.chain;

import com.anemone.config.AgentProperties;
import com.anemone.orchestration.api.TokenBalanceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Token balances from the Blockberry indexer. Errors propagate so callers can report them.
 */
@Component
@Slf4j
public class BlockberryTokenClient implements TokenBalanceClient {

    private static final ParameterizedTypeReference<List<TokenBalance>> BALANCE_LIST = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;

    public BlockberryTokenClient(RestClient.Builder restClientBuilder, AgentProperties properties) {
        AgentProperties.ChainConfig chain = properties.getChain();
        if (!StringUtils.hasText(chain.getBlockberryApiKey())) {
            log.warn("No Blockberry API key configured. Token balance requests will probably be rejected.");
        }
        this.restClient = restClientBuilder
                .baseUrl(chain.getBlockberryBaseUrl())
                .defaultHeader("x-api-key", chain.getBlockberryApiKey() == null ? "" : chain.getBlockberryApiKey())
                .build();
    }

    @Override
    public List<TokenBalance> getAccountBalance(String address) {
        log.info("Fetching token balances for {}.", address);
        List<TokenBalance> balances = restClient.get()
                .uri("/sui/v1/accounts/{address}/balance", address)
                .accept(MediaType.ALL)
                .retrieve()
                .body(BALANCE_LIST);
        return balances == null ? List.of() : balances;
    }
}
