package com.agentflow.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to workflow subscriber")
        void deliversEventToWorkflowSubscriber() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribe("wf-1", received::add);

            var event = WorkflowEvent.of(WorkflowEventType.TASK_STARTED, "wf-1", "A", Map.of());
            eventBus.publish(event);

            assertEquals(List.of(event), received);
            assertNotNull(event.timestamp());
            assertEquals("task.started", event.eventType());
        }

        @Test
        @DisplayName("a typed subscription only receives the requested event types")
        void typedSubscription() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribe("wf-1", EnumSet.of(WorkflowEventType.TASK_FAILED, WorkflowEventType.WORKFLOW_FAILED),
                    received::add);

            eventBus.publish(WorkflowEvent.of(WorkflowEventType.TASK_STARTED, "wf-1", "A", Map.of()));
            eventBus.publish(WorkflowEvent.of(WorkflowEventType.TASK_FAILED, "wf-1", "A", Map.of("error", "x")));
            eventBus.publish(WorkflowEvent.ofWorkflow(WorkflowEventType.WORKFLOW_FAILED, "wf-1", Map.of()));

            assertEquals(List.of(WorkflowEventType.TASK_FAILED, WorkflowEventType.WORKFLOW_FAILED),
                    received.stream().map(WorkflowEvent::type).toList());
        }

        @Test
        @DisplayName("event payloads are copied and a null payload becomes empty")
        void payloadCopied() {
            var payload = new HashMap<String, Object>();
            payload.put("wave", 1);
            var event = WorkflowEvent.ofWorkflow(WorkflowEventType.WAVE_STARTED, "wf-1", payload);
            payload.put("wave", 2);

            assertEquals(1, event.payload().get("wave"));
            assertEquals(Map.of(), WorkflowEvent.ofWorkflow(WorkflowEventType.WAVE_STARTED, "wf-1", null).payload());
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different workflow")
        void doesNotDeliverToDifferentWorkflow() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribe("wf-2", received::add);

            eventBus.publish(WorkflowEvent.of(WorkflowEventType.TASK_STARTED, "wf-1", "A", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives events from all workflows")
        void globalSubscriberReceivesAll() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(new WorkflowEvent(WorkflowEventType.WORKFLOW_STARTED, "wf-1", null, Map.of(), Instant.now()));
            eventBus.publish(new WorkflowEvent(WorkflowEventType.WORKFLOW_STARTED, "wf-2", null, Map.of(), Instant.now()));

            assertEquals(2, received.size());
            assertEquals("wf-2", received.get(1).workflowId());
        }
    }

    @Nested
    @DisplayName("unsubscribe and failures")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<WorkflowEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("wf-1", received::add);

            eventBus.publish(WorkflowEvent.of(WorkflowEventType.TASK_STARTED, "wf-1", "A", Map.of()));
            subscription.unsubscribe();
            eventBus.publish(WorkflowEvent.of(WorkflowEventType.TASK_COMPLETED, "wf-1", "A", Map.of()));

            assertEquals(1, received.size());
            assertEquals(0, eventBus.subscribedWorkflowCount());
        }

        @Test
        @DisplayName("a throwing subscriber does not prevent delivery to others")
        void throwingSubscriberIsolated() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribe("wf-1", e -> { throw new RuntimeException("boom"); });
            eventBus.subscribe("wf-1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(WorkflowEvent.of(WorkflowEventType.WAVE_STARTED, "wf-1", null, Map.of())));
            assertEquals(1, received.size());
        }
    }
}
