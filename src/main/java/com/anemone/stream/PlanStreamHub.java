package com.anemone.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user plan streams. Events are buffered so a client connecting late, or reconnecting with {@code since},
 * still sees the plan's progress.
 */
@Component
public class PlanStreamHub {
    private static final Logger log = LoggerFactory.getLogger(PlanStreamHub.class);
    static final int MAX_BUFFER_SIZE = 500;
    static final Duration IDLE_TTL = Duration.ofMinutes(30);
    private static final String USER_ATTRIBUTE = "userId";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, UserStream> streams = new ConcurrentHashMap<>();

    @Autowired
    public PlanStreamHub(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    PlanStreamHub(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void registerSession(String userId, WebSocketSession session, long sinceId) {
        cleanupIdleStreams();
        UserStream stream = stream(userId);
        stream.sessions().put(session.getId(), session);
        session.getAttributes().put(USER_ATTRIBUTE, userId);
        for (StreamEvent event : stream.snapshotSince(sinceId)) {
            send(session, event);
        }
    }

    public void removeSession(WebSocketSession session) {
        Object userId = session.getAttributes().get(USER_ATTRIBUTE);
        if (userId == null) {
            return;
        }
        UserStream stream = streams.get(userId.toString());
        if (stream != null) {
            stream.sessions().remove(session.getId());
        }
    }

    public void emit(String userId, String type, Object data) {
        cleanupIdleStreams();
        UserStream stream = stream(userId);
        StreamEvent event = stream.addEvent(type, data, clock.instant(), MAX_BUFFER_SIZE);
        stream.sessions().values().forEach(session -> send(session, event));
    }

    List<StreamEvent> bufferedEvents(String userId) {
        UserStream stream = streams.get(userId);
        return stream == null ? List.of() : stream.snapshotSince(0);
    }

    int streamCount() {
        return streams.size();
    }

    void cleanupIdleStreams() {
        Instant cutoff = clock.instant().minus(IDLE_TTL);
        streams.values().removeIf(stream -> stream.isIdleSince(cutoff));
    }

    private UserStream stream(String userId) {
        return streams.computeIfAbsent(userId, id -> new UserStream(id, clock.instant()));
    }

    private void send(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to send plan stream event: {}", ex.getMessage());
        }
    }
}
