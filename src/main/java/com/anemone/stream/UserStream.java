package com.anemone.stream;

import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Replay buffer and connected sessions of one user's plan stream.
 */
class UserStream {
    private final String userId;
    private final Deque<StreamEvent> buffer = new ArrayDeque<>();
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private long sequence;
    private volatile Instant lastUpdated;

    UserStream(String userId, Instant now) {
        this.userId = userId;
        this.lastUpdated = now;
    }

    String userId() {
        return userId;
    }

    Map<String, WebSocketSession> sessions() {
        return sessions;
    }

    synchronized StreamEvent addEvent(String type, Object data, Instant now, int maxBufferSize) {
        StreamEvent event = new StreamEvent(++sequence, now, type, data);
        buffer.addLast(event);
        while (buffer.size() > maxBufferSize) {
            buffer.removeFirst();
        }
        lastUpdated = now;
        return event;
    }

    synchronized List<StreamEvent> snapshotSince(long sinceId) {
        return buffer.stream()
                .filter(event -> event.id() > sinceId)
                .toList();
    }

    boolean isIdleSince(Instant cutoff) {
        return sessions.isEmpty() && lastUpdated.isBefore(cutoff);
    }
}
