package com.anemone.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * One unit of work inside a {@link TaskPlan}. Status only moves forward:
 * PENDING, then RUNNING, then COMPLETED or FAILED.
 */
public class Task {

    private final String id;
    private final String description;
    @Nullable
    private final Command command;
    private TaskStatus status = TaskStatus.PENDING;
    @Nullable
    private String result;
    @Nullable
    private Instant startedAt;
    @Nullable
    private Instant endedAt;

    Task(String id, String description, @Nullable Command command) {
        this.id = id;
        this.description = description;
        this.command = command;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    @Nullable
    public Command getCommand() {
        return command;
    }

    public boolean hasCommand() {
        return command != null;
    }

    public TaskStatus getStatus() {
        return status;
    }

    @Nullable
    public String getResult() {
        return result;
    }

    @Nullable
    public Instant getStartedAt() {
        return startedAt;
    }

    @Nullable
    public Instant getEndedAt() {
        return endedAt;
    }

    void start(Instant now) {
        requireStatus(TaskStatus.PENDING, TaskStatus.RUNNING);
        status = TaskStatus.RUNNING;
        startedAt = now;
    }

    void complete(@Nullable String output, Instant now) {
        requireStatus(TaskStatus.RUNNING, TaskStatus.COMPLETED);
        status = TaskStatus.COMPLETED;
        result = output;
        endedAt = now;
    }

    void fail(String error, Instant now) {
        requireStatus(TaskStatus.RUNNING, TaskStatus.FAILED);
        status = TaskStatus.FAILED;
        result = error;
        endedAt = now;
    }

    private void requireStatus(TaskStatus expected, TaskStatus target) {
        if (status != expected) {
            throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + target);
        }
    }
}
