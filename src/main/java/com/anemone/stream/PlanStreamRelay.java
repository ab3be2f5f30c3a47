package com.anemone.stream;

import com.anemone.events.AgentEvent;
import com.anemone.events.AgentEventHandler;
import com.anemone.events.AgentEventType;
import com.anemone.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Forwards plan and task events from the event bus to the owning user's stream.
 */
@Component
public class PlanStreamRelay {

    static final Set<AgentEventType> RELAYED = EnumSet.of(
            AgentEventType.TASK_PLAN_STARTED,
            AgentEventType.TASK_PLAN_UPDATED,
            AgentEventType.TASK_PLAN_COMPLETED,
            AgentEventType.TASK_STARTED,
            AgentEventType.TASK_COMPLETED,
            AgentEventType.TASK_FAILED);

    private final EventBus eventBus;
    private final PlanStreamHub hub;
    private final AgentEventHandler handler = this::relay;

    public PlanStreamRelay(EventBus eventBus, PlanStreamHub hub) {
        this.eventBus = eventBus;
        this.hub = hub;
    }

    @PostConstruct
    public void subscribe() {
        RELAYED.forEach(type -> eventBus.subscribe(type, handler));
    }

    @PreDestroy
    public void unsubscribe() {
        RELAYED.forEach(type -> eventBus.unsubscribe(type, handler));
    }

    private void relay(AgentEvent event) {
        String userId = event.stringValue("userId");
        if (userId == null) {
            return;
        }
        hub.emit(userId, streamType(event.type()), event.data());
    }

    // TASK_PLAN_UPDATED -> task-plan-updated
    static String streamType(AgentEventType type) {
        return type.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
