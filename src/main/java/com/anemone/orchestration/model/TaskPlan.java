package com.anemone.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Ordered task list built for one inbound message.
 * <p>
 * Tasks can only be added while the whole plan is still pending. Once execution starts the plan is
 * fixed: tasks are never removed or reordered, only their status and result change.
 */
public class TaskPlan {

    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int RESULT_PREVIEW_LENGTH = 100;

    private final String planId;
    private final String userId;
    private final String userMessage;
    private final Instant createdAt;
    private final Clock clock;
    private final List<Task> tasks = new ArrayList<>();

    public TaskPlan(String userId, String userMessage) {
        this(userId, userMessage, Clock.systemUTC());
    }

    public TaskPlan(String userId, String userMessage, Clock clock) {
        this.clock = clock;
        this.createdAt = clock.instant();
        this.planId = "plan-" + createdAt.toEpochMilli() + "-" + randomSuffix();
        this.userId = userId;
        this.userMessage = userMessage;
    }

    public Task addTask(String description) {
        return addTask(description, null);
    }

    public Task addTask(String description, @Nullable Command command) {
        if (tasks.stream().anyMatch(task -> task.getStatus() != TaskStatus.PENDING)) {
            throw new IllegalStateException("Plan " + planId + " is already executing; tasks can no longer be added");
        }
        Task task = new Task("task-" + (tasks.size() + 1), description, command);
        tasks.add(task);
        return task;
    }

    /**
     * First pending task in insertion order.
     */
    public Optional<Task> nextPendingTask() {
        return tasks.stream()
                .filter(task -> task.getStatus() == TaskStatus.PENDING)
                .findFirst();
    }

    public void startTask(Task task) {
        owned(task).start(clock.instant());
    }

    public void completeTask(Task task, @Nullable String result) {
        owned(task).complete(result, clock.instant());
    }

    public void failTask(Task task, String error) {
        owned(task).fail(error, clock.instant());
    }

    public boolean isCompleted() {
        return tasks.stream().allMatch(task -> task.getStatus().isTerminal());
    }

    public List<Task> getTasks() {
        return Collections.unmodifiableList(tasks);
    }

    public List<Command> getCommands() {
        return tasks.stream()
                .map(Task::getCommand)
                .filter(Objects::nonNull)
                .toList();
    }

    public String getPlanId() {
        return planId;
    }

    public String getUserId() {
        return userId;
    }

    public String getUserMessage() {
        return userMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String toMarkdown() {
        StringBuilder sb = new StringBuilder();
        sb.append("## Task list [Plan ID: ").append(planId).append("]\n\n");
        sb.append("* User message: \"").append(userMessage).append("\"\n");
        sb.append("* Created at: ").append(createdAt).append("\n\n");
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            String checkbox = task.getStatus() == TaskStatus.COMPLETED ? "[x]" : "[ ]";
            sb.append(i + 1).append(". ").append(checkbox).append(' ')
                    .append(statusMarker(task.getStatus())).append(' ')
                    .append(task.getDescription()).append('\n');
            if (task.getCommand() != null) {
                sb.append("   - Command: `").append(task.getCommand().token()).append("`\n");
            }
            if (task.getResult() != null) {
                sb.append("   - Result: ").append(preview(task.getResult())).append('\n');
            }
            if (task.getStartedAt() != null) {
                sb.append("   - Started: ").append(task.getStartedAt()).append('\n');
            }
            if (task.getEndedAt() != null) {
                sb.append("   - Ended: ").append(task.getEndedAt()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private Task owned(Task task) {
        if (!tasks.contains(task)) {
            throw new IllegalArgumentException("Task " + task.getId() + " does not belong to plan " + planId);
        }
        return task;
    }

    private static String preview(String result) {
        if (result.length() <= RESULT_PREVIEW_LENGTH) {
            return result;
        }
        return result.substring(0, RESULT_PREVIEW_LENGTH) + "...";
    }

    private static String statusMarker(TaskStatus status) {
        return switch (status) {
            case PENDING -> "⏳";
            case RUNNING -> "🔄";
            case COMPLETED -> "✅";
            case FAILED -> "❌";
        };
    }

    private static String randomSuffix() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}
