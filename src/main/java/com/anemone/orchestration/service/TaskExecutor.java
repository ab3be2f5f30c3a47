package com.anemone.orchestration.service;

import com.anemone.events.AgentEventType;
import com.anemone.events.EventBus;
import com.anemone.orchestration.api.CommandExecutor;
import com.anemone.orchestration.model.Task;
import com.anemone.orchestration.model.TaskPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.anemone.orchestration.OrchestrationConstants.EXECUTION_FAILED_PREFIX;
import static com.anemone.orchestration.OrchestrationConstants.NO_COMMAND_RESULT;

/**
 * Drains a plan one task at a time. A failing task is recorded as FAILED and execution moves on.
 */
@RequiredArgsConstructor
@Slf4j
public class TaskExecutor {

    private final CommandExecutor commandExecutor;
    private final EventBus eventBus;
    private final OrchestrationMetricsService metricsService;

    public String executePlan(TaskPlan plan) {
        log.info("Executing plan {} with {} tasks.", plan.getPlanId(), plan.getTasks().size());
        eventBus.publish(AgentEventType.TASK_PLAN_STARTED, planPayload(plan));

        List<String> results = new ArrayList<>();
        Optional<Task> next = plan.nextPendingTask();
        while (next.isPresent()) {
            Task task = next.get();
            results.add(executeTask(plan, task));
            eventBus.publish(AgentEventType.TASK_PLAN_UPDATED, planPayload(plan));
            next = plan.nextPendingTask();
        }

        log.info("Plan {} finished. Completed={}.", plan.getPlanId(), plan.isCompleted());
        return String.join("\n\n", results);
    }

    private String executeTask(TaskPlan plan, Task task) {
        plan.startTask(task);
        eventBus.publish(AgentEventType.TASK_STARTED, taskPayload(plan, task, null, null));
        try {
            String result;
            if (task.hasCommand()) {
                log.info("Task {} of plan {} runs command {}.", task.getId(), plan.getPlanId(), task.getCommand().token());
                result = commandExecutor.executeCommand(task.getCommand().token(), plan.getUserId());
            } else {
                result = NO_COMMAND_RESULT.formatted(task.getDescription());
            }
            plan.completeTask(task, result);
            eventBus.publish(AgentEventType.TASK_COMPLETED, taskPayload(plan, task, result, null));
            return result;
        } catch (RuntimeException ex) {
            String error = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.warn("Task {} of plan {} failed: {}", task.getId(), plan.getPlanId(), error);
            plan.failTask(task, error);
            metricsService.recordTaskFailed();
            eventBus.publish(AgentEventType.TASK_FAILED, taskPayload(plan, task, null, error));
            return EXECUTION_FAILED_PREFIX + error;
        }
    }

    private static Map<String, Object> planPayload(TaskPlan plan) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("planId", plan.getPlanId());
        payload.put("userId", plan.getUserId());
        payload.put("markdown", plan.toMarkdown());
        return payload;
    }

    private static Map<String, Object> taskPayload(TaskPlan plan, Task task, String result, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", task.getId());
        payload.put("planId", plan.getPlanId());
        payload.put("userId", plan.getUserId());
        payload.put("description", task.getDescription());
        if (task.getCommand() != null) {
            payload.put("command", task.getCommand().token());
        }
        if (result != null) {
            payload.put("result", result);
        }
        if (error != null) {
            payload.put("error", error);
        }
        return payload;
    }
}
