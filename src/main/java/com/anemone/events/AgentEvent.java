package com.anemone.events;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

public record AgentEvent(
        AgentEventType type,
        Instant timestamp,
        Map<String, Object> data
) {

    @Nullable
    public String stringValue(String key) {
        Object value = data.get(key);
        return value == null ? null : value.toString();
    }
}
