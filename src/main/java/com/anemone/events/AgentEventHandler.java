package com.anemone.events;

@FunctionalInterface
public interface AgentEventHandler {

    void handle(AgentEvent event);
}
