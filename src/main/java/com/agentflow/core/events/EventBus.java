package com.agentflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for the events of workflow runs.
 * <p>
 * A subscription is scoped to one workflow id, or to every workflow, and can be
 * narrowed to a set of {@link WorkflowEventType}s. Delivery is synchronous on
 * the publishing thread; wave branches publish task events from their own
 * threads, so subscribers must be thread-safe and must not block. A subscriber
 * that throws is logged and skipped, and neither the publisher nor the other
 * subscribers see the error.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscriber>> byWorkflow = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Subscriber> global = new CopyOnWriteArrayList<>();

    public void publish(WorkflowEvent event) {
        log.debug("Publishing {} for workflow {}{}", event.eventType(), event.workflowId(),
                event.taskId() != null ? " task " + event.taskId() : "");

        List<Subscriber> subs = byWorkflow.get(event.workflowId());
        if (subs != null) {
            subs.forEach(s -> s.deliver(event));
        }
        global.forEach(s -> s.deliver(event));
    }

    /**
     * Subscribes to every event of one workflow.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(String workflowId, Consumer<WorkflowEvent> consumer) {
        return subscribe(workflowId, EnumSet.allOf(WorkflowEventType.class), consumer);
    }

    /**
     * Subscribes to the given event types of one workflow.
     */
    public Subscription subscribe(String workflowId, Set<WorkflowEventType> types, Consumer<WorkflowEvent> consumer) {
        var subscriber = new Subscriber(types, consumer);
        byWorkflow.computeIfAbsent(workflowId, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        log.debug("Subscribed to {} event type(s) of workflow {}", types.size(), workflowId);
        return () -> byWorkflow.computeIfPresent(workflowId, (k, subs) -> {
            subs.remove(subscriber);
            return subs.isEmpty() ? null : subs;
        });
    }

    /** Subscribes to every event of every workflow. */
    public Subscription subscribeAll(Consumer<WorkflowEvent> consumer) {
        var subscriber = new Subscriber(EnumSet.allOf(WorkflowEventType.class), consumer);
        global.add(subscriber);
        return () -> global.remove(subscriber);
    }

    /** Number of workflows with at least one scoped subscriber. */
    public int subscribedWorkflowCount() {
        return byWorkflow.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Subscriber(Set<WorkflowEventType> types, Consumer<WorkflowEvent> consumer) {

        Subscriber {
            types = types.isEmpty() ? EnumSet.noneOf(WorkflowEventType.class) : EnumSet.copyOf(types);
        }

        void deliver(WorkflowEvent event) {
            if (!types.contains(event.type())) {
                return;
            }
            try {
                consumer.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber failed on {} for workflow {}: {}",
                        event.eventType(), event.workflowId(), e.getMessage(), e);
            }
        }
    }
}
