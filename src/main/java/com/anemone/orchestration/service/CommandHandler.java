package com.anemone.orchestration.service;

import org.springframework.lang.Nullable;

/**
 * One registered capability of the {@link CommandDispatcher}. The returned value is serialized to JSON.
 */
@FunctionalInterface
public interface CommandHandler {

    @Nullable
    Object handle(String userId) throws Exception;
}
