package io.linchmind.daemon.app;

import io.linchmind.connector.model.LifecycleEvent;
import io.linchmind.daemon.config.ConnectorDaemonProperties;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-sent stream of lifecycle events. Each client gets its own bus subscription; a keep-alive
 * {@code heartbeat} event goes out whenever the stream is idle.
 */
@RestController
@RequestMapping("/api/connectors")
public class EventStreamController implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(EventStreamController.class);

    static final String CONNECTED = "connected";
    static final String STATE_CHANGE = "state_change";
    static final String HEARTBEAT = "heartbeat";

    private final LifecycleEventBus bus;
    private final Duration idleTimeout;
    private final Clock clock;
    private final AtomicInteger streams = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "sse-stream");
        thread.setDaemon(true);
        return thread;
    });

    @Autowired
    public EventStreamController(LifecycleEventBus bus, ConnectorDaemonProperties properties, Clock clock) {
        this(bus, properties.getEvents().getStreamIdleTimeout(), clock);
    }

    EventStreamController(LifecycleEventBus bus, Duration idleTimeout, Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        SseEmitter emitter = new SseEmitter(0L);
        String name = "sse-" + streams.incrementAndGet();
        EventSubscription subscription = bus.subscribe(name);
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());
        log.info("[REST] GET /api/connectors/events stream={}", name);
        executor.execute(() -> pump(emitter, subscription));
        return emitter;
    }

    void pump(SseEmitter emitter, EventSubscription subscription) {
        try {
            emitter.send(SseEmitter.event().name(CONNECTED)
                .data(Map.of("timestamp", clock.instant().toString()), MediaType.APPLICATION_JSON));
            while (!subscription.isClosed()) {
                LifecycleEvent event = subscription.poll(idleTimeout);
                if (event != null) {
                    emitter.send(SseEmitter.event().name(STATE_CHANGE).data(event, MediaType.APPLICATION_JSON));
                } else if (!subscription.isClosed()) {
                    emitter.send(SseEmitter.event().name(HEARTBEAT)
                        .data(Map.of("timestamp", clock.instant().toString()), MediaType.APPLICATION_JSON));
                }
            }
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.debug("event stream {} closed: {}", subscription.name(), e.getMessage());
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } finally {
            subscription.close();
            if (subscription.droppedCount() > 0) {
                log.info("event stream {} dropped {} events", subscription.name(), subscription.droppedCount());
            }
        }
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
