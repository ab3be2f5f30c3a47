package com.anemone.orchestration.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Data-fetch commands the agent can run. The token is the wire name used by the model.
 */
public enum Command {
    QUERY_ROLE_DATA("queryRoleData", "role data",
            "Queries role data from the blockchain, including health, balance and the skill id list. Use when the user asks about role status, health, role balance or general role information."),
    QUERY_SKILL_DETAILS("querySkillDetails", "skill details",
            "Gets detailed information about all skills the role has. Use when the user asks about skills or their capabilities."),
    GET_PROFILE("getProfile", "profile configuration",
            "Gets profile configuration information. Use when the user asks about profile settings or configuration."),
    GET_WALLET("getWallet", "wallet information",
            "Retrieves the wallet address and information. Use when the user asks about the wallet address or general wallet information."),
    GET_TOKENS("getTokens", "detailed token list",
            "Gets a detailed list of all tokens in the wallet with their amounts and values. Use when the user asks for detailed token information or specific token balances."),
    GET_TOKENS_SUMMARY("getTokensSummary", "token balance summary",
            "Gets a summary of tokens in the wallet, including total USD value and SUI balance. Use when the user asks about total or general wallet balance."),
    NONE("none", "no data",
            "Do not execute any command. Use when the user is just chatting or asking general questions that need no data retrieval.");

    private final String token;
    private final String label;
    private final String description;

    Command(String token, String label, String description) {
        this.token = token;
        this.label = label;
        this.description = description;
    }

    public String token() {
        return token;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public boolean isTokenQuery() {
        return this == GET_TOKENS || this == GET_TOKENS_SUMMARY;
    }

    /**
     * Resolves a wire token. Matching is exact except for {@code none}, which is case-insensitive.
     */
    public static Optional<Command> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String trimmed = token.trim();
        if (NONE.token.equalsIgnoreCase(trimmed)) {
            return Optional.of(NONE);
        }
        return Arrays.stream(values())
                .filter(command -> command.token.equals(trimmed))
                .findFirst();
    }
}
