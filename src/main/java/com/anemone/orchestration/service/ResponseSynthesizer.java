package com.anemone.orchestration.service;

import com.anemone.orchestration.api.CompletionProvider;
import com.anemone.orchestration.model.ChatTurn;
import com.anemone.orchestration.model.Command;
import com.anemone.orchestration.model.FreeTextResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

import static com.anemone.orchestration.OrchestrationConstants.COMMAND_FAILED_PREFIX;
import static com.anemone.orchestration.OrchestrationConstants.EXECUTION_FAILED_PREFIX;
import static com.anemone.orchestration.OrchestrationConstants.FALLBACK_REPLY;
import static com.anemone.orchestration.OrchestrationConstants.LABEL_ROLE_DATA;
import static com.anemone.orchestration.OrchestrationConstants.LABEL_TOKENS;
import static com.anemone.orchestration.OrchestrationConstants.LABEL_TOKENS_SUMMARY;
import static com.anemone.orchestration.OrchestrationConstants.LOW_CONFIDENCE_DISCLAIMER;
import static com.anemone.orchestration.OrchestrationConstants.NO_COMMAND_RESULT;
import static com.anemone.orchestration.OrchestrationConstants.NONE_RESULT;
import static com.anemone.orchestration.OrchestrationConstants.NO_RESULTS;
import static com.anemone.orchestration.OrchestrationConstants.RESULT_FORMATTING_PROMPT_TEMPLATE;
import static com.anemone.orchestration.OrchestrationConstants.RETRY_PROMPT_TEMPLATE;
import static com.anemone.orchestration.OrchestrationConstants.SYSTEM_PROMPT;
import static com.anemone.orchestration.OrchestrationConstants.UNBACKED_FIGURES_REPLY;
import static com.anemone.orchestration.OrchestrationConstants.UNKNOWN_COMMAND_PREFIX;
import static com.anemone.orchestration.OrchestrationConstants.UNVERIFIED_DATA_WARNING;

/**
 * Produces the user-facing reply. Every completion call has a deterministic fallback.
 */
@Slf4j
public class ResponseSynthesizer {

    static final String ROLE_BALANCE_NOTE =
            "Role balance: taken from the on-chain role object (queryRoleData).";
    static final String WALLET_BALANCE_NOTE =
            "Wallet balance: taken from the token balances of the wallet address (getTokens / getTokensSummary).";

    private static final String NO_COMMAND_PREFIX = NO_COMMAND_RESULT.substring(0, NO_COMMAND_RESULT.indexOf("%s"));

    private final CompletionProvider completionProvider;
    private final FabricationGuard fabricationGuard;
    private final CommandMarkerParser markerParser;
    private final OrchestrationMetricsService metricsService;
    private final int maxAttempts;

    public ResponseSynthesizer(CompletionProvider completionProvider, FabricationGuard fabricationGuard,
                               CommandMarkerParser markerParser, OrchestrationMetricsService metricsService,
                               int maxAttempts) {
        this.completionProvider = completionProvider;
        this.fabricationGuard = fabricationGuard;
        this.markerParser = markerParser;
        this.metricsService = metricsService;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Folds command results into a reply. When the provider fails the reply is built from the results directly
     * and carries a low-confidence disclaimer. A reply stating figures while no command returned data is
     * replaced by {@link com.anemone.orchestration.OrchestrationConstants#UNBACKED_FIGURES_REPLY}.
     */
    public String synthesize(String message, String commandResults, List<ChatTurn> history) {
        String prompt = RESULT_FORMATTING_PROMPT_TEMPLATE.formatted(message, commandResults);
        String reply = null;
        try {
            metricsService.recordLlmRequest("synthesis");
            reply = completionProvider.generateChatResponse(SYSTEM_PROMPT, history, prompt);
        } catch (RuntimeException ex) {
            log.warn("Completion provider failed during synthesis: {}", ex.getMessage());
        }
        if (StringUtils.hasText(reply)) {
            if (!hasFetchedData(resultParts(commandResults)) && fabricationGuard.containsNumericClaim(reply)) {
                log.warn("Synthesized reply states figures although no data was fetched. Replacing it.");
                metricsService.recordDegradedReply("unbacked figures");
                return UNBACKED_FIGURES_REPLY;
            }
            return reply.trim();
        }
        metricsService.recordDegradedReply("synthesis");
        return degradedReply(commandResults);
    }

    /**
     * Marker path: asks the model to answer directly, re-prompting until the answer carries a command marker.
     * A numeric claim without a marker is treated as fabricated and coerced to {@link Command#NONE}.
     */
    public FreeTextResponse respondFreeText(String message, List<ChatTurn> history) {
        String last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String text = attempt(message, history, attempt);
            if (!StringUtils.hasText(text)) {
                log.info("Attempt {}/{} returned no text.", attempt, maxAttempts);
                continue;
            }
            last = text;
            List<Command> commands = markerParser.parse(text);
            if (!commands.isEmpty()) {
                log.info("Attempt {}/{} selected {}.", attempt, maxAttempts, commands);
                return new FreeTextResponse(text, commands, attempt, false);
            }
            if (fabricationGuard.containsNumericClaim(text)) {
                log.warn("Attempt {}/{} stated figures without fetching them. Coercing to none.", attempt, maxAttempts);
                return new FreeTextResponse(text, List.of(Command.NONE), attempt, false);
            }
            log.info("Attempt {}/{} contained no command marker.", attempt, maxAttempts);
        }

        metricsService.recordDegradedReply("no actionable completion");
        String degraded = last == null ? FALLBACK_REPLY : UNVERIFIED_DATA_WARNING + last;
        return new FreeTextResponse(degraded, List.of(), maxAttempts, true);
    }

    @Nullable
    private String attempt(String message, List<ChatTurn> history, int attempt) {
        try {
            metricsService.recordLlmRequest(attempt == 1 ? "free-text" : "free-text-retry");
            if (attempt == 1) {
                return completionProvider.generateChatResponse(SYSTEM_PROMPT, history, message);
            }
            return completionProvider.generateChatResponse(SYSTEM_PROMPT, history, RETRY_PROMPT_TEMPLATE.formatted(message));
        } catch (RuntimeException ex) {
            log.warn("Completion provider failed on attempt {}: {}", attempt, ex.getMessage());
            return null;
        }
    }

    String degradedReply(String commandResults) {
        List<String> dataParts = resultParts(commandResults);
        boolean roleBalance = dataParts.stream().anyMatch(part -> part.startsWith(LABEL_ROLE_DATA));
        boolean walletBalance = dataParts.stream()
                .anyMatch(part -> part.startsWith(LABEL_TOKENS) || part.startsWith(LABEL_TOKENS_SUMMARY));

        StringBuilder sb = new StringBuilder(LOW_CONFIDENCE_DISCLAIMER).append("\n\n");
        if (dataParts.isEmpty()) {
            return sb.append(NO_RESULTS).toString();
        }
        if (roleBalance) {
            sb.append(ROLE_BALANCE_NOTE).append('\n');
        }
        if (walletBalance) {
            sb.append(WALLET_BALANCE_NOTE).append('\n');
        }
        if (roleBalance || walletBalance) {
            sb.append('\n');
        }
        sb.append(String.join("\n\n", dataParts));
        return sb.toString();
    }

    // command outputs, without bookkeeping and "none" entries
    private static List<String> resultParts(String commandResults) {
        List<String> parts = new ArrayList<>();
        for (String part : commandResults.split("\n\n")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(NO_COMMAND_PREFIX) || trimmed.equals(NONE_RESULT)) {
                continue;
            }
            parts.add(trimmed);
        }
        return parts;
    }

    private static boolean hasFetchedData(List<String> parts) {
        return parts.stream().anyMatch(part -> !part.startsWith(EXECUTION_FAILED_PREFIX)
                && !part.startsWith(COMMAND_FAILED_PREFIX)
                && !part.startsWith(UNKNOWN_COMMAND_PREFIX));
    }
}
