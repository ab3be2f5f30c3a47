package com.anemone.orchestration.service;

import com.anemone.orchestration.api.CommandClassifier;
import com.anemone.orchestration.api.TaskPlanner;
import com.anemone.orchestration.model.ChatTurn;
import com.anemone.orchestration.model.Command;
import com.anemone.orchestration.model.TaskPlan;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.anemone.orchestration.OrchestrationConstants.BALANCE_KEYWORDS;
import static com.anemone.orchestration.OrchestrationConstants.TASK_FETCH_PREFIX;
import static com.anemone.orchestration.OrchestrationConstants.TASK_FINAL_REPLY;
import static com.anemone.orchestration.OrchestrationConstants.TASK_INTEGRATE_RESULTS;
import static com.anemone.orchestration.OrchestrationConstants.TASK_INTERPRET_INTENT;

/**
 * Turns an inbound message into a task plan. Command selection is delegated to a {@link CommandClassifier};
 * any classifier failure degrades to {@link Command#NONE}.
 */
@Slf4j
public class LlmTaskPlanner implements TaskPlanner {

    private final CommandClassifier classifier;
    private final OrchestrationMetricsService metricsService;
    private final Clock clock;

    public LlmTaskPlanner(CommandClassifier classifier, OrchestrationMetricsService metricsService) {
        this(classifier, metricsService, Clock.systemUTC());
    }

    public LlmTaskPlanner(CommandClassifier classifier, OrchestrationMetricsService metricsService, Clock clock) {
        this.classifier = classifier;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Override
    public TaskPlan createPlan(String userId, String message, List<ChatTurn> recentHistory) {
        List<Command> selected;
        try {
            selected = classifier.classify(message, recentHistory);
        } catch (RuntimeException ex) {
            log.warn("Command classification failed for user {}: {}. Falling back to none.", userId, ex.getMessage());
            selected = List.of();
        }
        if (selected == null || selected.isEmpty()) {
            selected = List.of(Command.NONE);
        }
        return createPlan(userId, message, selected, true);
    }

    @Override
    public TaskPlan createPlan(String userId, String message, List<Command> commands, boolean applyBalanceRule) {
        List<Command> finalCommands = new ArrayList<>(commands);
        if (finalCommands.isEmpty()) {
            finalCommands.add(Command.NONE);
        }
        if (applyBalanceRule && isBalanceQuestion(message)) {
            enforceBalanceCommands(finalCommands);
        }

        TaskPlan plan = new TaskPlan(userId, message, clock);
        plan.addTask(TASK_INTERPRET_INTENT);
        for (Command command : finalCommands) {
            plan.addTask(TASK_FETCH_PREFIX + command.label(), command);
        }
        plan.addTask(TASK_INTEGRATE_RESULTS);
        plan.addTask(TASK_FINAL_REPLY);

        metricsService.recordPlanCreated(plan);
        log.debug("Plan {} for user {}:\n{}", plan.getPlanId(), userId, plan.toMarkdown());
        return plan;
    }

    static boolean isBalanceQuestion(String message) {
        String text = message.toLowerCase(Locale.ROOT);
        return BALANCE_KEYWORDS.stream().anyMatch(text::contains);
    }

    private static void enforceBalanceCommands(List<Command> commands) {
        boolean added = false;
        if (!commands.contains(Command.QUERY_ROLE_DATA)) {
            commands.add(Command.QUERY_ROLE_DATA);
            added = true;
        }
        if (commands.stream().noneMatch(Command::isTokenQuery)) {
            commands.add(Command.GET_TOKENS_SUMMARY);
            added = true;
        }
        if (added) {
            commands.removeIf(command -> command == Command.NONE);
            log.info("Balance question detected. Commands adjusted to {}.", commands);
        }
    }
}
