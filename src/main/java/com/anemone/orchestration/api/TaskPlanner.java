package com.anemone.orchestration.api;

import com.anemone.orchestration.model.ChatTurn;
import com.anemone.orchestration.model.Command;
import com.anemone.orchestration.model.TaskPlan;

import java.util.List;

public interface TaskPlanner {

    /**
     * Builds the task plan for an inbound message, selecting commands from the message and recent history.
     */
    TaskPlan createPlan(String userId, String message, List<ChatTurn> recentHistory);

    /**
     * Builds a task plan around commands that were already selected elsewhere.
     */
    TaskPlan createPlan(String userId, String message, List<Command> commands, boolean applyBalanceRule);
}
