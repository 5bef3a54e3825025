package io.linchmind.daemon.app;

import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.daemon.domain.ConnectorLifecycleException;
import io.linchmind.daemon.domain.InstanceLockTable;
import io.linchmind.daemon.domain.InstanceStore;
import io.linchmind.daemon.domain.InstanceUpdate;
import io.linchmind.daemon.domain.LifecycleStateMachine;
import io.linchmind.process.ProcessSupervisor;
import io.linchmind.process.ResourceUsage;
import io.linchmind.process.SupervisedProcess;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic liveness checks, one scheduled task per watched instance.
 * <p>
 * A check probes the process and the heartbeat without holding any lock, then takes the instance
 * lock and re-validates that the instance still runs the probed pid before acting. The first
 * passing check promotes STARTING to RUNNING; later ones refresh {@code lastHeartbeat}. A dead
 * process or a stale heartbeat moves the instance to ERROR. A hung process is never killed here.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final String PROCESS_EXITED = "process exited unexpectedly";
    public static final String HEARTBEAT_TIMEOUT = "heartbeat timeout";

    private final ProcessSupervisor supervisor;
    private final InstanceStore store;
    private final InstanceLockTable locks;
    private final LifecycleStateMachine stateMachine;
    private final HeartbeatStrategy heartbeat;
    private final Settings settings;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Watch> watches = new ConcurrentHashMap<>();
    private final Map<String, ResourceUsage> usage = new ConcurrentHashMap<>();

    public record Settings(Duration interval,
                           Duration initialDelay,
                           double cpuWarningPercent,
                           long memoryWarningBytes) {
        public Settings {
            Objects.requireNonNull(interval, "interval");
            Objects.requireNonNull(initialDelay, "initialDelay");
        }
    }

    public HealthMonitor(ProcessSupervisor supervisor,
                         InstanceStore store,
                         InstanceLockTable locks,
                         LifecycleStateMachine stateMachine,
                         HeartbeatStrategy heartbeat,
                         Settings settings,
                         Clock clock) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.store = Objects.requireNonNull(store, "store");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        this.scheduler = Executors.newScheduledThreadPool(threads, new ThreadFactory() {
            private final AtomicInteger sequence = new AtomicInteger();

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "health-monitor-" + sequence.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    /**
     * Starts (or replaces) the periodic check of an instance.
     *
     * @param heartbeatRequired {@code false} for types that declare no health check: liveness only
     */
    public void watch(String instanceId, SupervisedProcess process, boolean heartbeatRequired) {
        Objects.requireNonNull(process, "process");
        unwatch(instanceId);
        Watch watch = new Watch(process, heartbeatRequired);
        watches.put(instanceId, watch);
        watch.future = scheduler.scheduleAtFixedRate(() -> check(instanceId, watch),
            settings.initialDelay().toMillis(), settings.interval().toMillis(), TimeUnit.MILLISECONDS);
        log.debug("watching instance={} pid={} every {}", instanceId, process.pid(), settings.interval());
    }

    public void unwatch(String instanceId) {
        Watch removed = watches.remove(instanceId);
        if (removed != null) {
            removed.cancel();
            log.debug("stopped watching instance={}", instanceId);
        }
    }

    public boolean isWatching(String instanceId) {
        return watches.containsKey(instanceId);
    }

    public Optional<ResourceUsage> latestUsage(String instanceId) {
        return Optional.ofNullable(usage.get(instanceId));
    }

    /**
     * Drops everything kept for a deleted instance, resource history included.
     */
    public void forget(String instanceId) {
        unwatch(instanceId);
        usage.remove(instanceId);
    }

    void check(String instanceId) {
        Watch watch = watches.get(instanceId);
        if (watch != null) {
            check(instanceId, watch);
        }
    }

    private void check(String instanceId, Watch watch) {
        try {
            runCheck(instanceId, watch);
        } catch (ConnectorLifecycleException e) {
            log.warn("health check instance={} skipped: {}", instanceId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("health check instance={} failed", instanceId, e);
        }
    }

    private void runCheck(String instanceId, Watch watch) {
        if (watches.get(instanceId) != watch) {
            // stale task: unwatch may have run before its future was assigned
            watch.cancel();
            return;
        }
        SupervisedProcess process = watch.process;
        Instant now = clock.instant();
        boolean alive = supervisor.isAlive(process.pid());
        boolean fresh = alive && (!watch.heartbeatRequired || heartbeat.isFresh(process, now));
        if (alive) {
            sample(instanceId, process);
        }

        locks.withLock(instanceId, () -> {
            if (watches.get(instanceId) != watch) {
                return;
            }
            Optional<ConnectorInstance> found = store.get(instanceId);
            if (found.isEmpty()) {
                unwatch(instanceId);
                return;
            }
            ConnectorInstance current = found.get();
            boolean monitored = current.state() == ConnectorState.STARTING || current.state() == ConnectorState.RUNNING;
            if (!monitored || !Objects.equals(current.processId(), process.pid())) {
                unwatch(instanceId);
                return;
            }
            if (!alive) {
                unwatch(instanceId);
                supervisor.stop(process, false, Duration.ZERO);
                stateMachine.transition(current, ConnectorState.ERROR, PROCESS_EXITED, InstanceUpdate.builder());
            } else if (!fresh) {
                unwatch(instanceId);
                stateMachine.transition(current, ConnectorState.ERROR, HEARTBEAT_TIMEOUT, InstanceUpdate.builder());
            } else if (current.state() == ConnectorState.STARTING) {
                stateMachine.transition(current, ConnectorState.RUNNING, null,
                    InstanceUpdate.builder().lastHeartbeat(now));
            } else {
                store.update(instanceId, InstanceUpdate.builder()
                    .expectedState(ConnectorState.RUNNING)
                    .lastHeartbeat(now)
                    .build());
            }
        });
    }

    private void sample(String instanceId, SupervisedProcess process) {
        Optional<ResourceUsage> sampled = supervisor.resourceUsage(process.pid());
        if (sampled.isEmpty()) {
            return;
        }
        ResourceUsage previous = usage.get(instanceId);
        ResourceUsage current = sampled.get().withCpuPercent(sampled.get().cpuPercentSince(previous));
        usage.put(instanceId, current);
        if (current.cpuPercent() != null && current.cpuPercent() > settings.cpuWarningPercent()) {
            log.warn("instance {} pid={} cpu {}% above {}%", instanceId, process.pid(),
                String.format("%.1f", current.cpuPercent()), settings.cpuWarningPercent());
        }
        if (current.residentBytes() != null && current.residentBytes() > settings.memoryWarningBytes()) {
            log.warn("instance {} pid={} resident memory {} bytes above {}", instanceId, process.pid(),
                current.residentBytes(), settings.memoryWarningBytes());
        }
    }

    @Override
    public void close() {
        watches.keySet().forEach(this::unwatch);
        scheduler.shutdownNow();
    }

    private static final class Watch {
        private final SupervisedProcess process;
        private final boolean heartbeatRequired;
        private volatile ScheduledFuture<?> future;

        private Watch(SupervisedProcess process, boolean heartbeatRequired) {
            this.process = process;
            this.heartbeatRequired = heartbeatRequired;
        }

        private void cancel() {
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
