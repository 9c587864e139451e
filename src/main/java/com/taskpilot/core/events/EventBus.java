package com.taskpilot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous fan-out of workflow events to their subscribers, in subscription order.
 * <p>
 * Subscribers run on the publishing thread, inside the state machine's lock. A subscriber
 * that throws is logged and skipped; the transition that published the event has already
 * been saved and is not undone.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Consumer<WorkflowEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(WorkflowEvent event) {
        log.debug("{} task={} subtask={}", event.type().value(), event.taskId(), event.subtaskId());
        for (Consumer<WorkflowEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Dropped {} for task {} in subscriber {}: {}", event.type().value(),
                        event.taskId(), subscriber, e.getMessage(), e);
            }
        }
    }

    /**
     * Registers {@code subscriber} for every event published from now on.
     *
     * @return handle that removes the subscriber again
     */
    public Subscription subscribeAll(Consumer<WorkflowEvent> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
