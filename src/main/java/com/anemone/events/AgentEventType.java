package com.anemone.events;

public enum AgentEventType {
    MESSAGE_RECEIVED,
    PROFILE_UPDATED,
    BLOCKCHAIN_DATA_FETCHED,

    TASK_PLAN_STARTED,
    TASK_PLAN_UPDATED,
    TASK_PLAN_COMPLETED,

    TASK_STARTED,
    TASK_COMPLETED,
    TASK_FAILED,

    MESSAGE_PROCESSING_STARTED,
    MESSAGE_PROCESSING_COMPLETED
}
