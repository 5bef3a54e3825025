package io.linchmind.daemon.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.LifecycleEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CrashRestartPolicyTest {

    private final LifecycleHarness harness = new LifecycleHarness(TestTypes.filesystem());
    private final CrashRestartPolicy policy =
        new CrashRestartPolicy(harness.manager, 2, Duration.ofMillis(50), Duration.ofMillis(80));

    @AfterEach
    void tearDown() {
        policy.close();
        harness.close();
    }

    @Test
    void backoffGrowsLinearlyUpToTheCap() {
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMillis(50));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofMillis(80));
        assertThat(policy.delayFor(5)).isEqualTo(Duration.ofMillis(80));
    }

    @Test
    void crashedInstanceIsRestarted() {
        policy.bind(harness.bus);
        String id = harness.manager.createInstance("filesystem", "Crashy",
            Map.of("watch_dirs", List.of("/tmp")), false, null).instanceId();
        harness.manager.startInstance(id);
        await().atMost(Duration.ofSeconds(2)).until(() -> harness.manager.getInstanceState(id) == ConnectorState.RUNNING);
        Long firstPid = harness.instance(id).processId();

        harness.supervisor.crash(id);

        await().atMost(Duration.ofSeconds(5)).until(() ->
            harness.manager.getInstanceState(id) == ConnectorState.RUNNING
                && !firstPid.equals(harness.instance(id).processId()));
        assertThat(harness.supervisor.spawned).hasSize(2);
        await().atMost(Duration.ofSeconds(2)).until(() -> policy.attempts(id) == 0);
    }

    @Test
    void givesUpAfterMaxConsecutiveAttempts() {
        harness.supervisor.failSpawns = true;
        String id = harness.manager.createInstance("filesystem", "Doomed",
            Map.of("watch_dirs", List.of("/tmp")), false, null).instanceId();

        for (int i = 0; i < 3; i++) {
            policy.onEvent(crash(id));
        }

        assertThat(policy.attempts(id)).isEqualTo(3);
        assertThat(harness.supervisor.spawned).isEmpty();
    }

    @Test
    void operatorStopResetsAttempts() {
        policy.onEvent(crash("fs_1"));
        assertThat(policy.attempts("fs_1")).isEqualTo(1);

        policy.onEvent(new LifecycleEvent("fs_1", "filesystem", ConnectorState.ERROR, ConnectorState.STOPPED, null,
            Instant.now()));

        assertThat(policy.attempts("fs_1")).isZero();
    }

    @Test
    void heartbeatTimeoutIsNotRestartedAutomatically() {
        policy.onEvent(new LifecycleEvent("fs_1", "filesystem", ConnectorState.RUNNING, ConnectorState.ERROR,
            HealthMonitor.HEARTBEAT_TIMEOUT, Instant.now()));

        assertThat(policy.attempts("fs_1")).isZero();
    }

    private static LifecycleEvent crash(String instanceId) {
        return new LifecycleEvent(instanceId, "filesystem", ConnectorState.RUNNING, ConnectorState.ERROR,
            HealthMonitor.PROCESS_EXITED, Instant.now());
    }
}
