package io.linchmind.daemon.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.LifecycleEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LifecycleEventBusTest {

    private final LifecycleEventBus bus = new LifecycleEventBus(4);

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void fullQueueDropsOldestEvents() throws Exception {
        EventSubscription slow = bus.subscribe("slow", 3);

        for (int i = 1; i <= 5; i++) {
            bus.publish(event("fs_" + i));
        }

        assertThat(slow.droppedCount()).isEqualTo(2);
        assertThat(slow.poll(Duration.ZERO).instanceId()).isEqualTo("fs_3");
        assertThat(slow.poll(Duration.ZERO).instanceId()).isEqualTo("fs_4");
        assertThat(slow.poll(Duration.ZERO).instanceId()).isEqualTo("fs_5");
        assertThat(slow.poll(Duration.ofMillis(10))).isNull();
    }

    @Test
    void blockedSubscriberDoesNotDelayPublisherOrOtherSubscribers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<String> fast = new CopyOnWriteArrayList<>();
        bus.subscribe("blocked", event -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        bus.subscribe("fast", event -> fast.add(event.instanceId()));

        long started = System.nanoTime();
        for (int i = 0; i < 50; i++) {
            bus.publish(event("fs_" + i));
        }
        Duration publishing = Duration.ofNanos(System.nanoTime() - started);

        assertThat(publishing).isLessThan(Duration.ofSeconds(1));
        await().atMost(Duration.ofSeconds(2)).until(() -> fast.contains("fs_49"));
        release.countDown();
    }

    @Test
    void failingCallbackKeepsSubscriptionAlive() {
        List<String> seen = new CopyOnWriteArrayList<>();
        bus.subscribe("flaky", event -> {
            seen.add(event.instanceId());
            if (seen.size() == 1) {
                throw new IllegalStateException("boom");
            }
        });

        bus.publish(event("fs_1"));
        await().atMost(Duration.ofSeconds(2)).until(() -> seen.size() == 1);
        bus.publish(event("fs_2"));

        await().atMost(Duration.ofSeconds(2)).until(() -> seen.size() == 2);
    }

    @Test
    void closedSubscriptionIsDetached() throws Exception {
        EventSubscription subscription = bus.subscribe("short-lived");
        assertThat(bus.subscriberCount()).isEqualTo(1);

        subscription.close();
        bus.publish(event("fs_1"));

        assertThat(bus.subscriberCount()).isZero();
        assertThat(subscription.poll(Duration.ofMillis(10))).isNull();
    }

    private static LifecycleEvent event(String instanceId) {
        return new LifecycleEvent(instanceId, "filesystem", ConnectorState.STARTING, ConnectorState.RUNNING, null,
            Instant.now());
    }
}
