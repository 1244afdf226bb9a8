package com.tanmi.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for workspace state changes.
 * <p>
 * Supports per-workspace subscriptions and global subscriptions that receive all events.
 * A failing subscriber never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-workspace subscribers keyed by workspaceId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<TanmiEvent>>> workspaceSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all workspaces. */
    private final CopyOnWriteArrayList<Consumer<TanmiEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(TanmiEvent event) {
        log.debug("Publishing event: {} for workspace {}", event.eventType(), event.workspaceId());

        List<Consumer<TanmiEvent>> subs = workspaceSubscribers.get(event.workspaceId());
        if (subs != null) {
            for (Consumer<TanmiEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<TanmiEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific workspace.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String workspaceId, Consumer<TanmiEvent> consumer) {
        workspaceSubscribers.computeIfAbsent(workspaceId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to workspace {}", workspaceId);
        return () -> {
            CopyOnWriteArrayList<Consumer<TanmiEvent>> subs = workspaceSubscribers.get(workspaceId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<TanmiEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TanmiEvent> subscriber, TanmiEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
