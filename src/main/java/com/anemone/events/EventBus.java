package com.anemone.events;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Typed publish/subscribe bus shared by the orchestration components.
 * <p>
 * Besides plain pub/sub it keeps a registry of {@link ProcessingStatus} records so that only one
 * orchestration run owns a given inbound message, and lets callers block until that run reports
 * completion.
 * <p>
 * Handlers run synchronously on the publishing thread. Handler lists are copy-on-write, so a handler
 * may publish, subscribe or unsubscribe while it is being invoked.
 */
@Slf4j
public class EventBus implements AutoCloseable {

    public static final Duration DEFAULT_RETENTION = Duration.ofMinutes(30);

    private final Map<AgentEventType, List<AgentEventHandler>> handlers = new EnumMap<>(AgentEventType.class);
    private final Map<Key, ProcessingStatus> processingStatus = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timeoutScheduler;
    private final Clock clock;
    private final Duration retention;

    public EventBus() {
        this(Clock.systemUTC(), DEFAULT_RETENTION);
    }

    public EventBus(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
        for (AgentEventType type : AgentEventType.values()) {
            handlers.put(type, new CopyOnWriteArrayList<>());
        }
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "event-bus-timeouts");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void subscribe(AgentEventType type, AgentEventHandler handler) {
        handlers.get(type).add(handler);
    }

    public void unsubscribe(AgentEventType type, AgentEventHandler handler) {
        handlers.get(type).remove(handler);
    }

    public int subscriberCount(AgentEventType type) {
        return handlers.get(type).size();
    }

    public void publish(AgentEventType type, Map<String, Object> data) {
        AgentEvent event = new AgentEvent(type, clock.instant(), Collections.unmodifiableMap(new LinkedHashMap<>(data)));
        for (AgentEventHandler handler : handlers.get(type)) {
            try {
                handler.handle(event);
            } catch (RuntimeException ex) {
                log.error("Event handler failed for {}: {}", type, ex.getMessage(), ex);
            }
        }
    }

    /**
     * Claims a message for a processor.
     *
     * @return {@code false} when another processor holds an active claim on the same message
     */
    public boolean startMessageProcessing(String messageId, String userId, String processor) {
        Key key = new Key(messageId, userId);
        Instant now = clock.instant();
        AtomicBoolean admitted = new AtomicBoolean();
        ProcessingStatus current = processingStatus.compute(key, (k, existing) -> {
            if (existing != null && existing.isActive()) {
                return existing;
            }
            admitted.set(true);
            return ProcessingStatus.started(messageId, userId, processor, now);
        });
        if (!admitted.get()) {
            log.info("Message {} is already being processed by {}. {} will ignore it.",
                    messageId, current.processor(), processor);
            return false;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("messageId", messageId);
        payload.put("userId", userId);
        payload.put("processor", processor);
        payload.put("timestamp", now.toString());
        publish(AgentEventType.MESSAGE_PROCESSING_STARTED, payload);
        log.info("{} started processing message {}.", processor, messageId);
        return true;
    }

    /**
     * Marks a claim completed. Only the processor that made the claim can complete it.
     */
    public void completeMessageProcessing(String messageId, String userId, String processor) {
        Key key = new Key(messageId, userId);
        Instant now = clock.instant();
        AtomicReference<ProcessingStatus> completed = new AtomicReference<>();
        processingStatus.computeIfPresent(key, (k, existing) -> {
            if (!existing.processor().equals(processor) || existing.completed()) {
                return existing;
            }
            ProcessingStatus done = existing.complete(now);
            completed.set(done);
            return done;
        });

        ProcessingStatus status = completed.get();
        if (status == null) {
            log.warn("{} cannot complete message {}: no active claim held by this processor.", processor, messageId);
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("messageId", messageId);
        payload.put("userId", userId);
        payload.put("processor", processor);
        payload.put("startTime", status.startTime().toString());
        payload.put("completedTime", now.toString());
        payload.put("processingTime", status.processingTime().toMillis());
        publish(AgentEventType.MESSAGE_PROCESSING_COMPLETED, payload);
        log.info("{} completed processing message {} in {} ms.", processor, messageId,
                status.processingTime().toMillis());

        cleanupStaleEntries();
    }

    public Optional<ProcessingStatus> getMessageProcessingStatus(String messageId, String userId) {
        return Optional.ofNullable(processingStatus.get(new Key(messageId, userId)));
    }

    public boolean waitForProcessingCompleted(String messageId, String userId, long timeoutMs) {
        return awaitProcessingCompleted(messageId, userId, timeoutMs).join();
    }

    /**
     * Resolves {@code true} once the message's processing completes, {@code false} on timeout or when
     * nothing is processing the message. Exactly one of completion or timeout performs the teardown.
     */
    public CompletableFuture<Boolean> awaitProcessingCompleted(String messageId, String userId, long timeoutMs) {
        ProcessingStatus status = processingStatus.get(new Key(messageId, userId));
        if (status == null) {
            return CompletableFuture.completedFuture(false);
        }
        if (status.completed()) {
            return CompletableFuture.completedFuture(true);
        }

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        AtomicBoolean settled = new AtomicBoolean();
        AtomicReference<ScheduledFuture<?>> timer = new AtomicReference<>();
        AtomicReference<AgentEventHandler> subscription = new AtomicReference<>();

        AgentEventHandler handler = event -> {
            if (!messageId.equals(event.stringValue("messageId")) || !userId.equals(event.stringValue("userId"))) {
                return;
            }
            if (settled.compareAndSet(false, true)) {
                ScheduledFuture<?> pending = timer.get();
                if (pending != null) {
                    pending.cancel(false);
                }
                unsubscribe(AgentEventType.MESSAGE_PROCESSING_COMPLETED, subscription.get());
                log.debug("Processing of message {} completed while waiting.", messageId);
                result.complete(true);
            }
        };
        subscription.set(handler);

        try {
            timer.set(timeoutScheduler.schedule(() -> {
                if (settled.compareAndSet(false, true)) {
                    unsubscribe(AgentEventType.MESSAGE_PROCESSING_COMPLETED, handler);
                    log.info("Timed out after {} ms waiting for message {} to complete.", timeoutMs, messageId);
                    result.complete(false);
                }
            }, timeoutMs, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException ex) {
            log.warn("Event bus is closed. Not waiting for message {}.", messageId);
            return CompletableFuture.completedFuture(false);
        }
        subscribe(AgentEventType.MESSAGE_PROCESSING_COMPLETED, handler);

        // completion may have landed between the first lookup and the subscription
        ProcessingStatus latest = processingStatus.get(new Key(messageId, userId));
        if (latest != null && latest.completed() && settled.compareAndSet(false, true)) {
            unsubscribe(AgentEventType.MESSAGE_PROCESSING_COMPLETED, handler);
            result.complete(true);
        }
        if (settled.get()) {
            timer.get().cancel(false);
            unsubscribe(AgentEventType.MESSAGE_PROCESSING_COMPLETED, handler);
        }
        return result;
    }

    void cleanupStaleEntries() {
        Instant now = clock.instant();
        processingStatus.values().removeIf(status -> status.isOlderThan(retention, now));
    }

    int trackedMessageCount() {
        return processingStatus.size();
    }

    @Override
    public void close() {
        timeoutScheduler.shutdownNow();
    }

    private record Key(String messageId, String userId) {
    }
}
