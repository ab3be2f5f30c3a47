package com.anemone.orchestration.service;

import com.anemone.orchestration.api.CommandClassifier;
import com.anemone.orchestration.api.CompletionProvider;
import com.anemone.orchestration.model.ChatTurn;
import com.anemone.orchestration.model.Command;
import com.anemone.orchestration.model.CommandSelection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.anemone.orchestration.OrchestrationConstants.CLASSIFIER_PROMPT_TEMPLATE;

/**
 * Asks the completion provider for a structured command selection. When the answer is not valid JSON the
 * marker parser gets a chance to read it.
 */
@RequiredArgsConstructor
@Slf4j
public class LlmCommandClassifier implements CommandClassifier {

    private static final String PURPOSE = "command-selection";

    private final CompletionProvider completionProvider;
    private final JsonProcessingService jsonProcessingService;
    private final CommandMarkerParser markerParser;
    private final OrchestrationMetricsService metricsService;

    @Override
    public List<Command> classify(String message, List<ChatTurn> history) {
        String prompt = CLASSIFIER_PROMPT_TEMPLATE.formatted(describeCommands(), renderHistory(history), message);
        metricsService.recordLlmRequest(PURPOSE);
        String raw = completionProvider.generateChatResponse(List.of(), prompt);
        if (!StringUtils.hasText(raw)) {
            throw new IllegalStateException("Completion provider returned no command selection");
        }

        CommandSelection selection = jsonProcessingService.parseJsonResponse(PURPOSE, raw, CommandSelection.class);
        if (selection == null || selection.commands() == null) {
            List<Command> fromMarkers = markerParser.parse(raw);
            log.info("Command selection was not JSON; marker fallback found {}.", fromMarkers);
            return fromMarkers;
        }

        List<Command> commands = new ArrayList<>();
        for (String token : selection.commands()) {
            Optional<Command> command = Command.fromToken(token);
            if (command.isPresent()) {
                commands.add(command.get());
            } else {
                log.warn("Classifier proposed unknown command {}. Ignoring it.", token);
            }
        }
        log.info("Selected commands: {}. Reasoning: {}", commands, selection.reasoning());
        return commands;
    }

    private static String describeCommands() {
        return Arrays.stream(Command.values())
                .map(command -> "- " + command.token() + ": " + command.description())
                .collect(Collectors.joining("\n"));
    }

    private static String renderHistory(List<ChatTurn> history) {
        if (history.isEmpty()) {
            return "(none)";
        }
        return history.stream()
                .map(turn -> (turn.role() == ChatTurn.Role.USER ? "User: " : "Assistant: ") + turn.content())
                .collect(Collectors.joining("\n"));
    }
}
