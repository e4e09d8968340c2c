package com.hivemind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub for swarm lifecycle events.
 * <p>
 * Subscribers register for one swarm or for all swarms. A subscriber that throws
 * is logged and skipped; it never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SwarmEvent>>> swarmSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SwarmEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(SwarmEvent event) {
        log.debug("Publishing event: {} for swarm {}", event.eventType(), event.swarmId());

        List<Consumer<SwarmEvent>> subs = event.swarmId() != null ? swarmSubscribers.get(event.swarmId()) : null;
        if (subs != null) {
            for (Consumer<SwarmEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<SwarmEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a single swarm.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String swarmId, Consumer<SwarmEvent> consumer) {
        swarmSubscribers.computeIfAbsent(swarmId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to swarm {}", swarmId);
        return () -> {
            CopyOnWriteArrayList<Consumer<SwarmEvent>> subs = swarmSubscribers.get(swarmId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<SwarmEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SwarmEvent> subscriber, SwarmEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
