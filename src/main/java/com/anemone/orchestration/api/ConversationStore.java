package com.anemone.orchestration.api;

import com.anemone.orchestration.model.ChatTurn;
import org.springframework.lang.Nullable;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Conversation history persistence consumed by the orchestration layer.
 */
public interface ConversationStore {

    /**
     * @param messageId id of the inbound message, set for user messages
     * @param relatedMessageId id of the user message an assistant reply answers
     */
    StoredMessage saveMessage(String userId, ChatTurn.Role role, String content, int round,
                              @Nullable String messageId, @Nullable String relatedMessageId);

    /**
     * Most recent messages of a user, returned oldest first.
     */
    List<StoredMessage> getConversationHistory(String userId, int limit, @Nullable OffsetDateTime before);

    /**
     * All messages of the last {@code rounds} conversation rounds, oldest first.
     */
    List<ChatTurn> getMessagesByRounds(String userId, int rounds);

    int getNextConversationRound(String userId);

    /**
     * Latest assistant reply that answers the given user message.
     */
    Optional<StoredMessage> findLatestReply(String userId, String messageId);

    record StoredMessage(
            UUID id,
            String userId,
            ChatTurn.Role role,
            String content,
            Integer conversationRound,
            String messageId,
            String relatedMessageId,
            OffsetDateTime createdAt
    ) {
    }
}
