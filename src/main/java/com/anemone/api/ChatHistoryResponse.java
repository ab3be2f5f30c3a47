package com.anemone.api;

import com.anemone.orchestration.api.ConversationStore.StoredMessage;

import java.time.OffsetDateTime;
import java.util.List;

public record ChatHistoryResponse(
        String userId,
        List<MessageView> messages
) {

    public record MessageView(
            String role,
            String content,
            Integer conversationRound,
            String messageId,
            String relatedMessageId,
            OffsetDateTime createdAt
    ) {
    }

    public static ChatHistoryResponse from(String userId, List<StoredMessage> messages) {
        return new ChatHistoryResponse(userId, messages.stream()
                .map(message -> new MessageView(
                        message.role().name().toLowerCase(),
                        message.content(),
                        message.conversationRound(),
                        message.messageId(),
                        message.relatedMessageId(),
                        message.createdAt()))
                .toList());
    }
}
