package com.anemone.events;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Admission record for one inbound message. Immutable; completion produces a new instance.
 */
public record ProcessingStatus(
        String messageId,
        String userId,
        String processor,
        Instant startTime,
        boolean completed,
        @Nullable Instant completedTime
) {

    public static ProcessingStatus started(String messageId, String userId, String processor, Instant now) {
        return new ProcessingStatus(messageId, userId, processor, now, false, null);
    }

    public ProcessingStatus complete(Instant now) {
        return new ProcessingStatus(messageId, userId, processor, startTime, true, now);
    }

    public boolean isActive() {
        return !completed;
    }

    public boolean isOlderThan(Duration retention, Instant now) {
        return startTime.plus(retention).isBefore(now);
    }

    public Duration processingTime() {
        return completedTime == null ? Duration.ZERO : Duration.between(startTime, completedTime);
    }
}
