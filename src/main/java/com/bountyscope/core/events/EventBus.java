package com.bountyscope.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for run events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * A failing subscriber never affects the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ScanEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ScanEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(ScanEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<ScanEvent>> runSubs = runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<ScanEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<ScanEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String runId, Consumer<ScanEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<ScanEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    runSubscribers.remove(runId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<ScanEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ScanEvent> subscriber, ScanEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
