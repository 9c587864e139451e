package com.taskpilot.core.events;

import com.taskpilot.core.persistence.ActivityLog;
import com.taskpilot.core.persistence.WorkflowJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus} and {@link ActivityLogSubscriber}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static WorkflowEvent event(WorkflowEventType type, String taskId) {
        return new WorkflowEvent(type, taskId, null, Map.of(), Instant.now());
    }

    // -- WorkflowEvent record tests -------------------------------------------

    @Nested
    @DisplayName("WorkflowEvent")
    class WorkflowEventTests {

        @Test
        @DisplayName("null payload becomes empty")
        void nullPayload() {
            var e = new WorkflowEvent(WorkflowEventType.WORKFLOW_STARTED, "T1", null, null, Instant.now());

            assertEquals(Map.of(), e.payload());
        }

        @Test
        @DisplayName("payload tolerates null values and is copied")
        void nullValues() {
            var payload = new HashMap<String, Object>();
            payload.put("sha", null);
            var e = WorkflowEvent.of(WorkflowEventType.GIT_COMMIT_CREATED, "T1", "1", payload);
            payload.put("later", "x");

            assertTrue(e.payload().containsKey("sha"));
            assertFalse(e.payload().containsKey("later"));
        }

        @Test
        @DisplayName("wire names are colon separated")
        void wireNames() {
            assertEquals("tdd:red:completed", WorkflowEventType.TDD_RED_COMPLETED.value());
            assertEquals("workflow:started", WorkflowEventType.WORKFLOW_STARTED.value());
        }
    }

    // -- Publishing ------------------------------------------------------------

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("every subscriber sees every task's events in publish order")
        void deliversInOrder() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(WorkflowEventType.WORKFLOW_STARTED, "T1"));
            eventBus.publish(event(WorkflowEventType.PHASE_ENTERED, "T1"));
            eventBus.publish(event(WorkflowEventType.SUBTASK_STARTED, "T2"));

            assertEquals(List.of(WorkflowEventType.WORKFLOW_STARTED, WorkflowEventType.PHASE_ENTERED,
                    WorkflowEventType.SUBTASK_STARTED), received.stream().map(WorkflowEvent::type).toList());
        }

        @Test
        @DisplayName("subscribers run in subscription order")
        void subscriptionOrder() {
            List<String> calls = new ArrayList<>();
            eventBus.subscribeAll(e -> calls.add("log"));
            eventBus.subscribeAll(e -> calls.add("console"));

            eventBus.publish(event(WorkflowEventType.TEST_RUN, "T1"));

            assertEquals(List.of("log", "console"), calls);
        }

        @Test
        @DisplayName("an abort without a readable task id is still delivered")
        void nullTaskId() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(WorkflowEventType.WORKFLOW_ABORTED, null)));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("publishing with no subscribers is a no-op")
        void noSubscribers() {
            assertDoesNotThrow(() -> eventBus.publish(event(WorkflowEventType.TEST_RUN, "T1")));
            assertEquals(0, eventBus.subscriberCount());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<WorkflowEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            eventBus.publish(event(WorkflowEventType.SUBTASK_STARTED, "T1"));
            subscription.unsubscribe();
            eventBus.publish(event(WorkflowEventType.SUBTASK_COMPLETED, "T1"));

            assertEquals(1, received.size());
            assertEquals(0, eventBus.subscriberCount());
        }
    }

    @Nested
    @DisplayName("failure isolation")
    class FailureIsolationTests {

        @Test
        @DisplayName("a throwing subscriber does not stop later subscribers or the publisher")
        void subscriberExceptionIsolated() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("disk full");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(WorkflowEventType.TEST_RUN, "T1")));
            assertEquals(1, received.size());
        }
    }

    // -- Activity log subscriber ----------------------------------------------

    @Nested
    @DisplayName("ActivityLogSubscriber")
    class ActivityLogSubscriberTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("writes each event with task, subtask and payload fields")
        void writesEvents() {
            var activityLog = new ActivityLog(tempDir.resolve("activity.jsonl"), WorkflowJson.newObjectMapper());
            new ActivityLogSubscriber(activityLog).attach(eventBus);

            eventBus.publish(new WorkflowEvent(WorkflowEventType.TDD_RED_COMPLETED, "T1", "1",
                    Map.of("failed", 2), Instant.parse("2026-03-01T10:00:00Z")));

            var logged = activityLog.read();
            assertEquals(1, logged.size());
            assertEquals("tdd:red:completed", logged.get(0).type());
            assertEquals("T1", logged.get(0).field("taskId"));
            assertEquals("1", logged.get(0).field("subtaskId"));
            assertEquals(2, logged.get(0).field("failed"));
            assertEquals(Instant.parse("2026-03-01T10:00:00Z"), logged.get(0).timestamp());
        }

        @Test
        @DisplayName("a failing log does not break publishing")
        void failingLog() throws Exception {
            // a directory where the log file should be makes every append fail
            Path blocked = java.nio.file.Files.createDirectories(tempDir.resolve("blocked.jsonl"));
            new ActivityLogSubscriber(new ActivityLog(blocked, WorkflowJson.newObjectMapper())).attach(eventBus);
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(WorkflowEventType.WORKFLOW_STARTED, "T1")));
            assertEquals(1, received.size());
        }
    }
}
