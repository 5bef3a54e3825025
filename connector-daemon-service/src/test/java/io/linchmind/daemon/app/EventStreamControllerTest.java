package io.linchmind.daemon.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.LifecycleEvent;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

class EventStreamControllerTest {

    private final LifecycleEventBus bus = new LifecycleEventBus(16);
    private final EventStreamController controller =
        new EventStreamController(bus, Duration.ofMillis(100), Clock.systemUTC());

    @AfterEach
    void tearDown() {
        controller.destroy();
        bus.close();
    }

    @Test
    void streamsConnectedStateChangesAndIdleHeartbeats() {
        RecordingEmitter emitter = new RecordingEmitter();
        EventSubscription subscription = bus.subscribe("sse-test");
        Thread pump = new Thread(() -> controller.pump(emitter, subscription));
        pump.start();

        bus.publish(new LifecycleEvent("fs_1", "filesystem", ConnectorState.CONFIGURED, ConnectorState.STARTING,
            null, Instant.now()));
        await().atMost(Duration.ofSeconds(2)).until(() -> emitter.names().contains(EventStreamController.HEARTBEAT));
        subscription.close();

        await().atMost(Duration.ofSeconds(2)).until(() -> !pump.isAlive());
        assertThat(emitter.names()).startsWith(EventStreamController.CONNECTED, EventStreamController.STATE_CHANGE);
        assertThat(emitter.sent.get(1)).contains("fs_1");
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void failedSendClosesTheSubscription() {
        RecordingEmitter emitter = new RecordingEmitter();
        emitter.failing = true;
        EventSubscription subscription = bus.subscribe("sse-broken");

        controller.pump(emitter, subscription);

        assertThat(subscription.isClosed()).isTrue();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void eachRequestGetsItsOwnSubscription() {
        controller.events();
        controller.events();

        await().atMost(Duration.ofSeconds(2)).until(() -> bus.subscriberCount() == 2);
    }

    private static final class RecordingEmitter extends SseEmitter {
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private volatile boolean failing;

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            if (failing) {
                throw new IOException("client went away");
            }
            sent.add(builder.build().stream()
                .map(data -> String.valueOf(data.getData()))
                .collect(Collectors.joining()));
        }

        List<String> names() {
            return sent.stream()
                .map(text -> text.lines().filter(l -> l.startsWith("event:")).findFirst().orElse(""))
                .map(line -> line.substring("event:".length()).trim())
                .toList();
        }
    }
}
