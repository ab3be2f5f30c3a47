package com.anemone.orchestration.service;

import com.anemone.orchestration.model.TaskPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final AtomicLong planCount = new AtomicLong();
    private final AtomicLong commandTaskCount = new AtomicLong();
    private final AtomicLong failedTaskCount = new AtomicLong();
    private final AtomicLong degradedReplyCount = new AtomicLong();

    public void recordLlmRequest(String purpose) {
        long count = llmRequestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}).", count, purpose);
    }

    public void recordPlanCreated(TaskPlan plan) {
        long plans = planCount.incrementAndGet();
        int commands = plan.getCommands().size();
        long totalCommands = commandTaskCount.addAndGet(commands);
        log.info("Plan {} created with {} tasks ({} commands). Total plans={}, total command tasks={}.",
                plan.getPlanId(), plan.getTasks().size(), commands, plans, totalCommands);
    }

    public void recordTaskFailed() {
        failedTaskCount.incrementAndGet();
    }

    public void recordDegradedReply(String reason) {
        long count = degradedReplyCount.incrementAndGet();
        log.warn("Degraded reply #{} produced ({}).", count, reason);
    }

    public long llmRequests() {
        return llmRequestCount.get();
    }

    public long failedTasks() {
        return failedTaskCount.get();
    }

    public long degradedReplies() {
        return degradedReplyCount.get();
    }

    public void logSummary() {
        log.info("Orchestration stats: llmRequests={}, plans={}, commandTasks={}, failedTasks={}, degradedReplies={}.",
                llmRequestCount.get(), planCount.get(), commandTaskCount.get(), failedTaskCount.get(),
                degradedReplyCount.get());
    }
}
