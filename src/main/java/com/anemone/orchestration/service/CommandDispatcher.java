package com.anemone.orchestration.service;

import com.anemone.orchestration.api.CommandExecutor;
import com.anemone.orchestration.model.Command;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.anemone.orchestration.OrchestrationConstants.COMMAND_FAILED_PREFIX;
import static com.anemone.orchestration.OrchestrationConstants.NONE_RESULT;
import static com.anemone.orchestration.OrchestrationConstants.UNKNOWN_COMMAND_PREFIX;

/**
 * Maps command tokens to registered handlers. Never throws: unknown tokens and handler failures come back
 * as result strings.
 */
@Slf4j
public class CommandDispatcher implements CommandExecutor {

    private final Map<Command, Registration> handlers = new EnumMap<>(Command.class);
    private final JsonProcessingService jsonProcessingService;

    public CommandDispatcher(JsonProcessingService jsonProcessingService) {
        this.jsonProcessingService = jsonProcessingService;
    }

    /**
     * @param label human-readable heading written in front of the JSON result
     */
    public CommandDispatcher register(Command command, String label, CommandHandler handler) {
        if (command == Command.NONE) {
            throw new IllegalArgumentException("The none command is built in and cannot be registered");
        }
        Registration previous = handlers.put(command, new Registration(label, handler));
        if (previous != null) {
            log.warn("Handler for command {} was replaced.", command.token());
        }
        return this;
    }

    public boolean isRegistered(Command command) {
        return command == Command.NONE || handlers.containsKey(command);
    }

    @Override
    public String executeCommand(String command, String userId) {
        Optional<Command> resolved = Command.fromToken(command);
        if (resolved.isEmpty()) {
            log.warn("Unknown command {} requested for user {}.", command, userId);
            return UNKNOWN_COMMAND_PREFIX + command;
        }
        if (resolved.get() == Command.NONE) {
            return NONE_RESULT;
        }
        Registration registration = handlers.get(resolved.get());
        if (registration == null) {
            log.warn("No handler registered for command {}.", command);
            return UNKNOWN_COMMAND_PREFIX + command;
        }

        try {
            Object value = registration.handler().handle(userId);
            return registration.label() + ":\n" + jsonProcessingService.toResultJson(value);
        } catch (Exception ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Command {} failed for user {}: {}", command, userId, message, ex);
            return COMMAND_FAILED_PREFIX + message;
        }
    }

    private record Registration(String label, CommandHandler handler) {
    }
}
