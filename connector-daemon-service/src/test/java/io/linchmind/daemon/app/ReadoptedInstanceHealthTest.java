package io.linchmind.daemon.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.ConnectorType;
import io.linchmind.daemon.domain.InstanceLockTable;
import io.linchmind.daemon.domain.InstanceStore;
import io.linchmind.daemon.domain.LifecycleStateMachine;
import io.linchmind.daemon.infra.InMemoryInstanceStore;
import io.linchmind.process.LocalProcessSupervisor;
import io.linchmind.process.ProcessLogSink;
import io.linchmind.process.SpawnRequest;
import io.linchmind.process.SupervisedProcess;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/**
 * Health of instances whose process outlived the previous daemon run, against real OS processes.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ReadoptedInstanceHealthTest {

    private static final Duration STALENESS = Duration.ofSeconds(1);

    @TempDir
    Path typeDir;

    private final Clock clock = Clock.systemUTC();
    private final InstanceStore store = new InMemoryInstanceStore(clock);
    private final LifecycleEventBus bus = new LifecycleEventBus(64);
    private final LocalProcessSupervisor previousRun =
        new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(2));
    private final LocalProcessSupervisor supervisor =
        new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(2));
    private ConnectorType type;
    private HealthMonitor health;
    private LifecycleMetrics metrics;
    private LifecycleManager manager;
    private SupervisedProcess orphan;

    @BeforeEach
    void setUp() {
        type = TestTypes.shell(typeDir);
        TypeCatalog catalog = mock(TypeCatalog.class);
        when(catalog.get(any())).thenReturn(Optional.of(type));
        InstanceLockTable locks = new InstanceLockTable();
        LifecycleStateMachine stateMachine = new LifecycleStateMachine(store, bus, clock);
        HeartbeatTracker heartbeats = new HeartbeatTracker(clock);
        PendingReloadNotifier reloads = new PendingReloadNotifier();
        health = new HealthMonitor(supervisor, store, locks, stateMachine,
            new ActivityHeartbeatStrategy(heartbeats, STALENESS),
            new HealthMonitor.Settings(Duration.ofMillis(100), Duration.ofMillis(10), 80.0, 1L << 30), clock);
        metrics = new LifecycleMetrics(new SimpleMeterRegistry(), store);
        manager = new LifecycleManager(catalog, store, supervisor, health, stateMachine,
            new ConfigChangeRouter(store, reloads), locks, heartbeats, reloads, bus, metrics, new ObjectMapper(),
            new LifecycleManager.Settings("http://127.0.0.1:8088", Duration.ofSeconds(1), Duration.ofSeconds(1),
                Duration.ofSeconds(5)),
            clock);
    }

    @AfterEach
    void tearDown() {
        manager.close();
        health.close();
        metrics.close();
        bus.close();
        if (orphan != null) {
            previousRun.stop(orphan, false, Duration.ZERO);
        }
    }

    @Test
    void longRunningProcessStaysRunningAfterReadoption() throws Exception {
        orphan = previousRun.start(new SpawnRequest("shell_0a1b2c3d", type.resolvedExecutable(),
            type.entryPoint().args(), Map.of(), typeDir));
        await().atMost(Duration.ofSeconds(10)).until(() -> startedBefore(orphan.pid(), Instant.now().minus(STALENESS)));
        Instant now = Instant.now();
        store.create(new ConnectorInstance("shell_0a1b2c3d", "shell", "Shell loop", Map.of(), true, false,
            ConnectorState.RUNNING, orphan.pid(), now, null, 0, now, now));

        assertThat(manager.reconcileInstance("shell_0a1b2c3d")).isEqualTo(ConnectorState.RUNNING);

        await().during(Duration.ofMillis(600)).atMost(Duration.ofSeconds(2))
            .until(() -> store.get("shell_0a1b2c3d").map(ConnectorInstance::state).orElse(null) == ConnectorState.RUNNING);
        assertThat(health.isWatching("shell_0a1b2c3d")).isTrue();
    }

    @Test
    void readoptedProcessStillTimesOutWithoutHeartbeats() throws Exception {
        orphan = previousRun.start(new SpawnRequest("shell_4e5f6a7b", type.resolvedExecutable(),
            type.entryPoint().args(), Map.of(), typeDir));
        Instant now = Instant.now();
        store.create(new ConnectorInstance("shell_4e5f6a7b", "shell", "Shell loop", Map.of(), true, false,
            ConnectorState.RUNNING, orphan.pid(), now, null, 0, now, now));

        manager.reconcileInstance("shell_4e5f6a7b");

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            ConnectorInstance current = store.get("shell_4e5f6a7b").orElseThrow();
            assertThat(current.state()).isEqualTo(ConnectorState.ERROR);
            assertThat(current.errorMessage()).isEqualTo(HealthMonitor.HEARTBEAT_TIMEOUT);
        });
        assertThat(supervisor.isAlive(orphan.pid())).isTrue();
    }

    private static boolean startedBefore(long pid, Instant instant) {
        return ProcessHandle.of(pid)
            .flatMap(handle -> handle.info().startInstant())
            .map(started -> started.isBefore(instant))
            .orElse(true);
    }
}
