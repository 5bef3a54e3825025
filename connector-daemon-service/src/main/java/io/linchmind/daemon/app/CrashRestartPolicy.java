package io.linchmind.daemon.app;

import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.LifecycleEvent;
import io.linchmind.daemon.domain.ConnectorLifecycleException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restarts instances whose process died on its own, with linear backoff capped at
 * {@code maxBackoff} and at most {@code maxAttempts} consecutive tries. Reaching RUNNING resets
 * the count; an operator stop or delete cancels a pending retry.
 */
public class CrashRestartPolicy implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CrashRestartPolicy.class);

    private final LifecycleManager manager;
    private final int maxAttempts;
    private final Duration backoff;
    private final Duration maxBackoff;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Integer> attempts = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();
    private EventSubscription subscription;

    public CrashRestartPolicy(LifecycleManager manager, int maxAttempts, Duration backoff, Duration maxBackoff) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "crash-restart");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void bind(LifecycleEventBus bus) {
        this.subscription = bus.subscribe("crash-restart", this::onEvent);
    }

    void onEvent(LifecycleEvent event) {
        String id = event.instanceId();
        switch (event.newState()) {
            case RUNNING -> attempts.remove(id);
            case STOPPED, STOPPING, UNINSTALLED -> {
                attempts.remove(id);
                cancel(id);
            }
            case ERROR -> {
                if (HealthMonitor.PROCESS_EXITED.equals(event.errorMessage())) {
                    scheduleRestart(id);
                }
            }
            default -> {
            }
        }
    }

    Duration delayFor(int attempt) {
        Duration delay = backoff.multipliedBy(attempt);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private void scheduleRestart(String instanceId) {
        int attempt = attempts.merge(instanceId, 1, Integer::sum);
        if (attempt > maxAttempts) {
            log.warn("instance {} crashed {} times in a row; giving up automatic restarts", instanceId, maxAttempts);
            return;
        }
        Duration delay = delayFor(attempt);
        log.info("instance {} crashed; restart attempt {}/{} in {}", instanceId, attempt, maxAttempts, delay);
        ScheduledFuture<?> future = scheduler.schedule(() -> restart(instanceId), delay.toMillis(), TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = pending.put(instanceId, future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void restart(String instanceId) {
        pending.remove(instanceId);
        try {
            if (manager.getInstanceState(instanceId) != ConnectorState.ERROR) {
                return;
            }
            manager.startInstance(instanceId);
        } catch (ConnectorLifecycleException e) {
            log.warn("automatic restart of instance {} failed: {}", instanceId, e.getMessage());
        }
    }

    private void cancel(String instanceId) {
        ScheduledFuture<?> future = pending.remove(instanceId);
        if (future != null) {
            future.cancel(false);
        }
    }

    int attempts(String instanceId) {
        return attempts.getOrDefault(instanceId, 0);
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.close();
        }
        scheduler.shutdownNow();
    }
}
