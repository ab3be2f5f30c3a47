package com.anemone.orchestration.api;

/**
 * Runs a single command token for a user and renders its result as text.
 */
public interface CommandExecutor {

    String executeCommand(String command, String userId);
}
