package io.linchmind.daemon.app;

import io.linchmind.connector.model.LifecycleEvent;
import io.linchmind.daemon.domain.LifecycleEventPublisher;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process fan-out of lifecycle events.
 * <p>
 * Every subscriber owns a bounded queue; {@link #publish(LifecycleEvent)} only enqueues, so a slow
 * or failing subscriber never blocks the transition that produced the event. Events of one instance
 * are published under that instance's lock, which keeps them in transition order per subscriber.
 */
public class LifecycleEventBus implements LifecycleEventPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEventBus.class);
    private static final Duration DISPATCH_POLL = Duration.ofMillis(500);

    private final int defaultCapacity;
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();

    public LifecycleEventBus(int defaultCapacity) {
        if (defaultCapacity <= 0) {
            throw new IllegalArgumentException("defaultCapacity must be positive");
        }
        this.defaultCapacity = defaultCapacity;
    }

    @Override
    public void publish(LifecycleEvent event) {
        Objects.requireNonNull(event, "event");
        for (EventSubscription subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    /**
     * Pull-style subscription. The caller drains it with {@link EventSubscription#poll(Duration)}
     * and closes it when done.
     */
    public EventSubscription subscribe(String name) {
        return subscribe(name, defaultCapacity);
    }

    public EventSubscription subscribe(String name, int capacity) {
        EventSubscription subscription = new EventSubscription(name, capacity, subscriptions::remove);
        subscriptions.add(subscription);
        log.debug("subscriber {} attached (capacity={})", name, capacity);
        return subscription;
    }

    /**
     * Push-style subscription served by a dedicated daemon thread. Exceptions thrown by
     * {@code callback} are logged and do not end the subscription.
     */
    public EventSubscription subscribe(String name, Consumer<LifecycleEvent> callback) {
        Objects.requireNonNull(callback, "callback");
        EventSubscription subscription = subscribe(name);
        Thread dispatcher = new Thread(() -> dispatch(subscription, callback), "lifecycle-events-" + name);
        dispatcher.setDaemon(true);
        dispatcher.start();
        return subscription;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    @Override
    public void close() {
        for (EventSubscription subscription : subscriptions) {
            subscription.close();
        }
    }

    private static void dispatch(EventSubscription subscription, Consumer<LifecycleEvent> callback) {
        while (!subscription.isClosed()) {
            LifecycleEvent event;
            try {
                event = subscription.poll(DISPATCH_POLL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                subscription.close();
                return;
            }
            if (event == null) {
                continue;
            }
            try {
                callback.accept(event);
            } catch (RuntimeException e) {
                log.warn("subscriber {} failed on event for instance {}: {}",
                    subscription.name(), event.instanceId(), e.getMessage(), e);
            }
        }
    }
}
