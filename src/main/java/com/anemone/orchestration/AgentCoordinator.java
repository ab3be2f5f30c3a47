package com.anemone.orchestration;

import com.anemone.config.AgentProperties;
import com.anemone.events.AgentEvent;
import com.anemone.events.AgentEventHandler;
import com.anemone.events.AgentEventType;
import com.anemone.events.EventBus;
import com.anemone.orchestration.api.ConversationStore;
import com.anemone.orchestration.api.ConversationStore.StoredMessage;
import com.anemone.orchestration.model.ChatResult;
import com.anemone.orchestration.model.ChatTurn;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.anemone.orchestration.OrchestrationConstants.FALLBACK_REPLY;
import static com.anemone.orchestration.OrchestrationConstants.PENDING_REPLY;

/**
 * Entry point for chat messages. Stores the message, hands it to the orchestration pipeline through the event
 * bus and waits for the reply.
 */
@Service
@Slf4j
public class AgentCoordinator {

    private final EventBus eventBus;
    private final ConversationStore conversationStore;
    private final AgentProperties properties;
    private final Clock clock;
    private final AgentEventHandler planCompletedHandler = this::onPlanCompleted;

    @Autowired
    public AgentCoordinator(EventBus eventBus, ConversationStore conversationStore, AgentProperties properties) {
        this(eventBus, conversationStore, properties, Clock.systemUTC());
    }

    AgentCoordinator(EventBus eventBus, ConversationStore conversationStore, AgentProperties properties, Clock clock) {
        this.eventBus = eventBus;
        this.conversationStore = conversationStore;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void subscribe() {
        eventBus.subscribe(AgentEventType.TASK_PLAN_COMPLETED, planCompletedHandler);
    }

    @PreDestroy
    public void unsubscribe() {
        eventBus.unsubscribe(AgentEventType.TASK_PLAN_COMPLETED, planCompletedHandler);
    }

    public ChatResult processChat(String message, String userId, @Nullable String roleId) {
        if (!StringUtils.hasText(message)) {
            throw new IllegalArgumentException("message must not be empty");
        }
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId must not be empty");
        }

        String messageId = UUID.randomUUID().toString();
        String timestamp = clock.instant().toString();
        int round = conversationStore.getNextConversationRound(userId);
        conversationStore.saveMessage(userId, ChatTurn.Role.USER, message, round, messageId, null);
        log.info("Received message {} from user {} (round {}).", messageId, userId, round);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        payload.put("roleId", roleId);
        payload.put("message", message);
        payload.put("messageId", messageId);
        payload.put("conversationRound", round);
        payload.put("timestamp", timestamp);
        eventBus.publish(AgentEventType.MESSAGE_RECEIVED, payload);

        long timeoutMs = properties.getProcessing().getWaitTimeout().toMillis();
        boolean completed = eventBus.waitForProcessingCompleted(messageId, userId, timeoutMs);
        if (!completed) {
            log.info("No reply to message {} within {} ms. Returning a pending response.", messageId, timeoutMs);
            return ChatResult.pending(PENDING_REPLY, userId, roleId, messageId, timestamp);
        }

        Optional<StoredMessage> reply = conversationStore.findLatestReply(userId, messageId);
        if (reply.isEmpty()) {
            log.warn("Message {} completed but no reply was stored.", messageId);
            return ChatResult.failure(FALLBACK_REPLY, userId, roleId, messageId, timestamp);
        }
        return ChatResult.reply(reply.get().content(), userId, roleId, messageId, timestamp);
    }

    public List<StoredMessage> getChatHistory(String userId, int limit, @Nullable OffsetDateTime before) {
        return conversationStore.getConversationHistory(userId, limit, before);
    }

    private void onPlanCompleted(AgentEvent event) {
        String userId = event.stringValue("userId");
        String messageId = event.stringValue("messageId");
        Object results = event.data().get("results");
        Object reply = results instanceof Map<?, ?> map ? map.get("finalResponse") : null;
        String finalResponse = reply == null ? null : reply.toString();
        if (userId == null || messageId == null || !StringUtils.hasText(finalResponse)) {
            log.warn("Plan completion event without a reply: {}", event.data());
            return;
        }
        int round = event.data().get("conversationRound") instanceof Number number
                ? number.intValue()
                : Math.max(1, conversationStore.getNextConversationRound(userId) - 1);
        conversationStore.saveMessage(userId, ChatTurn.Role.ASSISTANT, finalResponse, round, null, messageId);
        log.info("Stored reply to message {} of user {} (plan {}).", messageId, userId, event.stringValue("planId"));
    }
}
