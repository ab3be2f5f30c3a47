package com.anemone.orchestration;

import com.anemone.config.AgentProperties;
import com.anemone.events.AgentEvent;
import com.anemone.events.AgentEventHandler;
import com.anemone.events.AgentEventType;
import com.anemone.events.EventBus;
import com.anemone.orchestration.api.ConversationStore;
import com.anemone.orchestration.api.TaskPlanner;
import com.anemone.orchestration.model.ChatTurn;
import com.anemone.orchestration.model.FreeTextResponse;
import com.anemone.orchestration.model.TaskPlan;
import com.anemone.orchestration.service.OrchestrationMetricsService;
import com.anemone.orchestration.service.ResponseSynthesizer;
import com.anemone.orchestration.service.TaskExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.anemone.orchestration.OrchestrationConstants.FALLBACK_REPLY;
import static com.anemone.orchestration.OrchestrationConstants.LOW_CONFIDENCE_DISCLAIMER;
import static com.anemone.orchestration.OrchestrationConstants.PROCESSOR_PLANNING;

/**
 * Runs the plan, execute and synthesize pipeline for every received message. Each message is claimed on the
 * event bus first, so a redelivered message is processed once.
 */
@Service
@Slf4j
public class PlanningService {

    private final EventBus eventBus;
    private final TaskPlanner taskPlanner;
    private final TaskExecutor taskExecutor;
    private final ResponseSynthesizer responseSynthesizer;
    private final ConversationStore conversationStore;
    private final OrchestrationMetricsService metricsService;
    private final AgentProperties properties;
    private final Executor orchestrationExecutor;
    private final AgentEventHandler messageHandler = this::onMessageReceived;

    public PlanningService(EventBus eventBus,
                           TaskPlanner taskPlanner,
                           TaskExecutor taskExecutor,
                           ResponseSynthesizer responseSynthesizer,
                           ConversationStore conversationStore,
                           OrchestrationMetricsService metricsService,
                           AgentProperties properties,
                           @Qualifier("orchestrationExecutor") Executor orchestrationExecutor) {
        this.eventBus = eventBus;
        this.taskPlanner = taskPlanner;
        this.taskExecutor = taskExecutor;
        this.responseSynthesizer = responseSynthesizer;
        this.conversationStore = conversationStore;
        this.metricsService = metricsService;
        this.properties = properties;
        this.orchestrationExecutor = orchestrationExecutor;
    }

    @PostConstruct
    public void subscribe() {
        eventBus.subscribe(AgentEventType.MESSAGE_RECEIVED, messageHandler);
        log.info("Planning service listening for received messages.");
    }

    @PreDestroy
    public void shutdown() {
        eventBus.unsubscribe(AgentEventType.MESSAGE_RECEIVED, messageHandler);
        metricsService.logSummary();
    }

    private void onMessageReceived(AgentEvent event) {
        String userId = event.stringValue("userId");
        String messageId = event.stringValue("messageId");
        String message = event.stringValue("message");
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(messageId) || message == null) {
            log.warn("Ignoring malformed {} event: {}", event.type(), event.data());
            return;
        }
        if (!eventBus.startMessageProcessing(messageId, userId, PROCESSOR_PLANNING)) {
            log.info("Message {} of user {} is already being handled. Skipping.", messageId, userId);
            return;
        }
        Object round = event.data().get("conversationRound");
        CompletableFuture.runAsync(() -> process(userId, messageId, message, round), orchestrationExecutor)
                .exceptionally(ex -> {
                    log.error("Orchestration of message {} could not run: {}", messageId, ex.getMessage(), ex);
                    eventBus.completeMessageProcessing(messageId, userId, PROCESSOR_PLANNING);
                    return null;
                });
    }

    void process(String userId, String messageId, String message, @Nullable Object round) {
        TaskPlan plan = null;
        String commandResults = "";
        String finalResponse;
        try {
            List<ChatTurn> history = recentHistory(userId, message);
            String directReply = null;
            if (properties.getPlanner().getMode() == AgentProperties.PlannerMode.FREE_TEXT) {
                FreeTextResponse freeText = responseSynthesizer.respondFreeText(message, history);
                if (freeText.degraded()) {
                    directReply = freeText.text();
                    plan = taskPlanner.createPlan(userId, message, List.of(), false);
                } else {
                    plan = taskPlanner.createPlan(userId, message, freeText.commands(), true);
                }
            } else {
                plan = taskPlanner.createPlan(userId, message, history);
            }

            commandResults = taskExecutor.executePlan(plan);
            finalResponse = directReply != null
                    ? directReply
                    : responseSynthesizer.synthesize(message, commandResults, history);
        } catch (RuntimeException ex) {
            log.error("Orchestration failed for message {} of user {}: {}", messageId, userId, ex.getMessage(), ex);
            metricsService.recordDegradedReply("orchestration failure");
            finalResponse = LOW_CONFIDENCE_DISCLAIMER + "\n\n" + FALLBACK_REPLY;
        }

        try {
            eventBus.publish(AgentEventType.TASK_PLAN_COMPLETED,
                    completionPayload(userId, messageId, message, round, plan, commandResults, finalResponse));
        } finally {
            eventBus.completeMessageProcessing(messageId, userId, PROCESSOR_PLANNING);
        }
    }

    private List<ChatTurn> recentHistory(String userId, String message) {
        List<ChatTurn> history = new ArrayList<>(
                conversationStore.getMessagesByRounds(userId, properties.getPlanner().getHistoryRounds()));
        // the inbound message is already stored as the newest turn
        if (!history.isEmpty()) {
            ChatTurn last = history.get(history.size() - 1);
            if (last.role() == ChatTurn.Role.USER && last.content().equals(message)) {
                history.remove(history.size() - 1);
            }
        }
        return history;
    }

    private static Map<String, Object> completionPayload(String userId, String messageId, String message,
                                                         @Nullable Object round, @Nullable TaskPlan plan,
                                                         String commandResults, String finalResponse) {
        Map<String, Object> results = new LinkedHashMap<>();
        results.put("commandResults", commandResults);
        results.put("finalResponse", finalResponse);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("planId", plan != null ? plan.getPlanId() : null);
        payload.put("userId", userId);
        payload.put("message", message);
        payload.put("messageId", messageId);
        payload.put("conversationRound", round);
        payload.put("markdown", plan != null ? plan.toMarkdown() : null);
        payload.put("results", results);
        return payload;
    }
}
