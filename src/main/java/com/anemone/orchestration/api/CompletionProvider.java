package com.anemone.orchestration.api;

import com.anemone.orchestration.model.ChatTurn;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Chat completion backend. Treated as unreliable: callers must handle a {@code null} or blank answer.
 */
public interface CompletionProvider {

    /**
     * Generates a reply to {@code message} in the context of {@code history}.
     *
     * @param systemPrompt optional system instructions
     * @param history prior turns, oldest first
     * @param message the new user message
     * @return the completion text, or {@code null} when the provider produced nothing
     */
    @Nullable
    String generateChatResponse(@Nullable String systemPrompt, List<ChatTurn> history, String message);

    @Nullable
    default String generateChatResponse(List<ChatTurn> history, String message) {
        return generateChatResponse(null, history, message);
    }
}
