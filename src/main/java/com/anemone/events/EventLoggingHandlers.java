package com.anemone.events;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Logs the lifecycle of plans, tasks and message processing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventLoggingHandlers {

    private final EventBus eventBus;
    private final Map<AgentEventType, AgentEventHandler> registered = new EnumMap<>(AgentEventType.class);

    @PostConstruct
    public void register() {
        registered.put(AgentEventType.TASK_PLAN_STARTED,
                event -> log.info("Plan {} started for user {}.", event.stringValue("planId"), event.stringValue("userId")));
        registered.put(AgentEventType.TASK_PLAN_UPDATED,
                event -> log.debug("Plan {} updated:\n{}", event.stringValue("planId"), event.stringValue("markdown")));
        registered.put(AgentEventType.TASK_PLAN_COMPLETED,
                event -> log.info("Plan {} completed for message {}.", event.stringValue("planId"), event.stringValue("messageId")));
        registered.put(AgentEventType.TASK_STARTED,
                event -> log.debug("Task {} of plan {} started: {}", event.stringValue("taskId"), event.stringValue("planId"),
                        event.stringValue("description")));
        registered.put(AgentEventType.TASK_COMPLETED,
                event -> log.debug("Task {} of plan {} completed.", event.stringValue("taskId"), event.stringValue("planId")));
        registered.put(AgentEventType.TASK_FAILED,
                event -> log.warn("Task {} of plan {} failed: {}", event.stringValue("taskId"), event.stringValue("planId"),
                        event.stringValue("error")));
        registered.put(AgentEventType.MESSAGE_PROCESSING_STARTED,
                event -> log.debug("Processing of message {} claimed by {}.", event.stringValue("messageId"),
                        event.stringValue("processor")));
        registered.put(AgentEventType.MESSAGE_PROCESSING_COMPLETED,
                event -> log.debug("Processing of message {} finished in {} ms.", event.stringValue("messageId"),
                        event.stringValue("processingTime")));
        registered.put(AgentEventType.PROFILE_UPDATED,
                event -> log.info("Profile updated: role {}.", event.stringValue("roleId")));
        registered.put(AgentEventType.BLOCKCHAIN_DATA_FETCHED,
                event -> log.debug("Fetched {} for {}.", event.stringValue("type"), event.stringValue("address")));
        registered.forEach(eventBus::subscribe);
    }

    @PreDestroy
    public void unregister() {
        registered.forEach(eventBus::unsubscribe);
        registered.clear();
    }
}
