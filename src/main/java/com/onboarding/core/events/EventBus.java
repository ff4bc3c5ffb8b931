package com.onboarding.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for mission execution events.
 * <p>
 * Supports per-mission subscriptions and global subscriptions that receive all events.
 * A subscriber that throws does not prevent delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OnboardingEvent>>> missionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<OnboardingEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(OnboardingEvent event) {
        log.debug("Publishing event: {} for mission {}", event.eventType(), event.missionId());

        List<Consumer<OnboardingEvent>> missionSubs = missionSubscribers.get(event.missionId());
        if (missionSubs != null) {
            for (Consumer<OnboardingEvent> subscriber : missionSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<OnboardingEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific mission.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String missionId, Consumer<OnboardingEvent> consumer) {
        missionSubscribers.computeIfAbsent(missionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to mission {}", missionId);
        return () -> missionSubscribers.computeIfPresent(missionId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<OnboardingEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OnboardingEvent> subscriber, OnboardingEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
