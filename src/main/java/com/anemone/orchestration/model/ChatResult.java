package com.anemone.orchestration.model;

import org.springframework.lang.Nullable;

public record ChatResult(
        boolean success,
        @Nullable String text,
        String userId,
        @Nullable String roleId,
        String messageId,
        String timestamp,
        boolean pending,
        @Nullable String error
) {

    public static ChatResult reply(String text, String userId, @Nullable String roleId, String messageId, String timestamp) {
        return new ChatResult(true, text, userId, roleId, messageId, timestamp, false, null);
    }

    public static ChatResult pending(String text, String userId, @Nullable String roleId, String messageId, String timestamp) {
        return new ChatResult(true, text, userId, roleId, messageId, timestamp, true, null);
    }

    public static ChatResult failure(String error, String userId, @Nullable String roleId, String messageId, String timestamp) {
        return new ChatResult(false, null, userId, roleId, messageId, timestamp, false, error);
    }
}
