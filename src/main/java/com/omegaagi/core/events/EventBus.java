package com.omegaagi.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for execution events.
 * <p>
 * Supports per-execution subscriptions and global subscriptions that receive all events.
 * Section events are published from worker threads, so publish and subscribe are safe
 * to call concurrently.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OmegaEvent>>> executionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<OmegaEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(OmegaEvent event) {
        log.debug("Publishing event: {} for execution {}", event.eventType(), event.executionId());

        List<Consumer<OmegaEvent>> subs = executionSubscribers.get(event.executionId());
        if (subs != null) {
            for (Consumer<OmegaEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<OmegaEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one execution.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(String executionId, Consumer<OmegaEvent> consumer) {
        executionSubscribers.computeIfAbsent(executionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> executionSubscribers.computeIfPresent(executionId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<OmegaEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OmegaEvent> subscriber, OmegaEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
