package com.anemone.events;

import com.anemone.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private final EventBus eventBus = new EventBus();

    @AfterEach
    void tearDown() {
        eventBus.close();
    }

    @Test
    void testPublish_InvokesHandlersInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(AgentEventType.TASK_STARTED, event -> calls.add("first"));
        eventBus.subscribe(AgentEventType.TASK_STARTED, event -> calls.add("second"));
        eventBus.subscribe(AgentEventType.TASK_COMPLETED, event -> calls.add("other"));

        eventBus.publish(AgentEventType.TASK_STARTED, Map.of("taskId", "task-1"));

        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void testPublish_FailingHandlerDoesNotStopOthers() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(AgentEventType.TASK_FAILED, event -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe(AgentEventType.TASK_FAILED, event -> calls.add(event.stringValue("taskId")));

        assertDoesNotThrow(() -> eventBus.publish(AgentEventType.TASK_FAILED, Map.of("taskId", "task-2")));
        assertEquals(List.of("task-2"), calls);
    }

    @Test
    void testPublish_ReentrantPublishFromHandler() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(AgentEventType.TASK_PLAN_COMPLETED, event -> {
            calls.add("plan");
            eventBus.publish(AgentEventType.TASK_COMPLETED, Map.of());
        });
        eventBus.subscribe(AgentEventType.TASK_COMPLETED, event -> calls.add("task"));

        eventBus.publish(AgentEventType.TASK_PLAN_COMPLETED, Map.of());

        assertEquals(List.of("plan", "task"), calls);
    }

    @Test
    void testUnsubscribe_UnknownHandlerIsNoOp() {
        AgentEventHandler handler = event -> { };
        assertDoesNotThrow(() -> eventBus.unsubscribe(AgentEventType.TASK_STARTED, handler));
        assertEquals(0, eventBus.subscriberCount(AgentEventType.TASK_STARTED));
    }

    @Test
    void testStartMessageProcessing_SecondClaimRejectedWhileActive() {
        List<AgentEvent> started = new ArrayList<>();
        eventBus.subscribe(AgentEventType.MESSAGE_PROCESSING_STARTED, started::add);

        assertTrue(eventBus.startMessageProcessing("m1", "u1", "A"));
        assertFalse(eventBus.startMessageProcessing("m1", "u1", "B"));

        assertEquals(1, started.size());
        assertEquals("A", eventBus.getMessageProcessingStatus("m1", "u1").orElseThrow().processor());
    }

    @Test
    void testStartMessageProcessing_DifferentKeysDoNotInterfere() {
        assertTrue(eventBus.startMessageProcessing("m1", "u1", "A"));
        assertTrue(eventBus.startMessageProcessing("m1", "u2", "A"));
        assertTrue(eventBus.startMessageProcessing("m2", "u1", "A"));
    }

    @Test
    void testStartMessageProcessing_SeparatorInIdsDoesNotCollide() {
        assertTrue(eventBus.startMessageProcessing("c", "a:b", "A"));
        assertTrue(eventBus.startMessageProcessing("b:c", "a", "A"));

        eventBus.completeMessageProcessing("c", "a:b", "A");

        assertTrue(eventBus.getMessageProcessingStatus("c", "a:b").orElseThrow().completed());
        assertFalse(eventBus.getMessageProcessingStatus("b:c", "a").orElseThrow().completed());
    }

    @Test
    void testStartMessageProcessing_ReclaimAfterCompletion() {
        assertTrue(eventBus.startMessageProcessing("m1", "u1", "A"));
        eventBus.completeMessageProcessing("m1", "u1", "A");

        assertTrue(eventBus.startMessageProcessing("m1", "u1", "B"));
    }

    @Test
    void testStartMessageProcessing_ConcurrentClaimsAdmitExactlyOne() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String processor = "p" + i;
                futures.add(pool.submit(() -> {
                    ready.await();
                    if (eventBus.startMessageProcessing("m1", "u1", processor)) {
                        admitted.incrementAndGet();
                    }
                    return null;
                }));
            }
            ready.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, admitted.get());
    }

    @Test
    void testCompleteMessageProcessing_ForeignProcessorIgnored() {
        List<AgentEvent> completed = new ArrayList<>();
        eventBus.subscribe(AgentEventType.MESSAGE_PROCESSING_COMPLETED, completed::add);
        eventBus.startMessageProcessing("m1", "u1", "A");

        eventBus.completeMessageProcessing("m1", "u1", "B");

        assertTrue(completed.isEmpty());
        assertTrue(eventBus.getMessageProcessingStatus("m1", "u1").orElseThrow().isActive());
    }

    @Test
    void testCompleteMessageProcessing_PublishesTimings() {
        List<AgentEvent> completed = new ArrayList<>();
        eventBus.subscribe(AgentEventType.MESSAGE_PROCESSING_COMPLETED, completed::add);
        eventBus.startMessageProcessing("m1", "u1", "A");

        eventBus.completeMessageProcessing("m1", "u1", "A");

        assertEquals(1, completed.size());
        Map<String, Object> data = completed.get(0).data();
        assertEquals("m1", data.get("messageId"));
        assertEquals("A", data.get("processor"));
        assertNotNull(data.get("startTime"));
        assertNotNull(data.get("completedTime"));
        assertInstanceOf(Long.class, data.get("processingTime"));
    }

    @Test
    void testWaitForProcessingCompleted_UnknownKeyReturnsFalseImmediately() {
        long start = System.nanoTime();
        assertFalse(eventBus.waitForProcessingCompleted("missing", "u1", 60_000));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 1_000);
    }

    @Test
    void testWaitForProcessingCompleted_AlreadyCompletedReturnsTrue() {
        eventBus.startMessageProcessing("m1", "u1", "A");
        eventBus.completeMessageProcessing("m1", "u1", "A");

        assertTrue(eventBus.waitForProcessingCompleted("m1", "u1", 60_000));
        assertEquals(0, eventBus.subscriberCount(AgentEventType.MESSAGE_PROCESSING_COMPLETED));
    }

    @Test
    void testAwaitProcessingCompleted_ResolvesOnCompletionAndCleansUp() throws Exception {
        eventBus.startMessageProcessing("m1", "u1", "A");
        CompletableFuture<Boolean> waiter = eventBus.awaitProcessingCompleted("m1", "u1", 5_000);
        assertEquals(1, eventBus.subscriberCount(AgentEventType.MESSAGE_PROCESSING_COMPLETED));

        long start = System.nanoTime();
        eventBus.completeMessageProcessing("m1", "u1", "A");

        assertTrue(waiter.get(1, TimeUnit.SECONDS));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 1_000);
        assertEquals(0, eventBus.subscriberCount(AgentEventType.MESSAGE_PROCESSING_COMPLETED));

        // unrelated completions must not reach the resolved waiter
        eventBus.startMessageProcessing("m2", "u1", "A");
        assertDoesNotThrow(() -> eventBus.completeMessageProcessing("m2", "u1", "A"));
        assertEquals(0, eventBus.subscriberCount(AgentEventType.MESSAGE_PROCESSING_COMPLETED));
    }

    @Test
    void testAwaitProcessingCompleted_IgnoresOtherMessages() throws Exception {
        eventBus.startMessageProcessing("m1", "u1", "A");
        eventBus.startMessageProcessing("m2", "u1", "A");
        CompletableFuture<Boolean> waiter = eventBus.awaitProcessingCompleted("m1", "u1", 5_000);

        eventBus.completeMessageProcessing("m2", "u1", "A");
        assertFalse(waiter.isDone());

        eventBus.completeMessageProcessing("m1", "u1", "A");
        assertTrue(waiter.get(1, TimeUnit.SECONDS));
    }

    @Test
    void testWaitForProcessingCompleted_TimesOutAndUnsubscribes() {
        eventBus.startMessageProcessing("m1", "u1", "A");

        assertFalse(eventBus.waitForProcessingCompleted("m1", "u1", 50));
        assertEquals(0, eventBus.subscriberCount(AgentEventType.MESSAGE_PROCESSING_COMPLETED));

        // a late completion is simply unobserved
        assertDoesNotThrow(() -> eventBus.completeMessageProcessing("m1", "u1", "A"));
    }

    @Test
    void testWaitForProcessingCompleted_ClosedBusReturnsFalseWithoutSubscribing() {
        eventBus.startMessageProcessing("m1", "u1", "A");
        eventBus.close();

        assertFalse(assertDoesNotThrow(() -> eventBus.waitForProcessingCompleted("m1", "u1", 1000)));
        assertEquals(0, eventBus.subscriberCount(AgentEventType.MESSAGE_PROCESSING_COMPLETED));
    }

    @Test
    void testWaitForProcessingCompleted_ZeroTimeoutLeavesNoSubscription() {
        eventBus.startMessageProcessing("m1", "u1", "A");

        assertFalse(eventBus.waitForProcessingCompleted("m1", "u1", 0));
        assertEquals(0, eventBus.subscriberCount(AgentEventType.MESSAGE_PROCESSING_COMPLETED));
    }

    @Test
    void testCleanupStaleEntries_RemovesEntriesPastRetention() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        try (EventBus bus = new EventBus(clock, Duration.ofMinutes(30))) {
            bus.startMessageProcessing("old", "u1", "A");
            bus.startMessageProcessing("done", "u1", "A");
            bus.completeMessageProcessing("done", "u1", "A");

            clock.advance(Duration.ofMinutes(31));
            bus.startMessageProcessing("fresh", "u1", "A");
            bus.cleanupStaleEntries();

            assertTrue(bus.getMessageProcessingStatus("old", "u1").isEmpty());
            assertTrue(bus.getMessageProcessingStatus("done", "u1").isEmpty());
            assertTrue(bus.getMessageProcessingStatus("fresh", "u1").isPresent());
            assertEquals(1, bus.trackedMessageCount());
        }
    }
}
