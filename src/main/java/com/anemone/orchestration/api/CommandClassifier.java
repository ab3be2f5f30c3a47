package com.anemone.orchestration.api;

import com.anemone.orchestration.model.ChatTurn;
import com.anemone.orchestration.model.Command;

import java.util.List;

/**
 * Decides which commands a user message needs.
 */
public interface CommandClassifier {

    /**
     * @return the selected commands in execution order; duplicates are allowed. Implementations may throw
     *         when the underlying model is unavailable.
     */
    List<Command> classify(String message, List<ChatTurn> history);
}
