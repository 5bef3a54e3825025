package io.linchmind.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class LocalProcessSupervisorTest {

  @TempDir
  Path logDir;

  private LocalProcessSupervisor supervisor;
  private SupervisedProcess started;

  @AfterEach
  void cleanUp() {
    if (started != null) {
      supervisor.stop(started, false, Duration.ZERO);
    }
  }

  @Test
  void startsProcessWithEnvironmentAndCapturesOutput() throws Exception {
    FileProcessLogSink sink = new FileProcessLogSink(logDir);
    supervisor = new LocalProcessSupervisor(sink, Duration.ofSeconds(5));

    started = supervisor.start(shell("fs_1a2b3c4d", "echo \"id=$LINCH_MIND_CONNECTOR_ID\"; sleep 30",
        Map.of("LINCH_MIND_CONNECTOR_ID", "fs_1a2b3c4d")));

    assertThat(started.pid()).isPositive();
    assertThat(supervisor.isAlive(started.pid())).isTrue();
    assertThat(supervisor.retained("fs_1a2b3c4d")).contains(started);
    await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
        assertThat(Files.readString(sink.logFile("fs_1a2b3c4d"))).contains("id=fs_1a2b3c4d"));
  }

  @Test
  void gracefulStopTerminatesCooperativeProcess() throws Exception {
    supervisor = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5));
    started = supervisor.start(shell("clip_1", "sleep 30", Map.of()));

    assertThat(supervisor.stop(started, true, Duration.ofSeconds(5))).isTrue();

    assertThat(supervisor.isAlive(started.pid())).isFalse();
    assertThat(supervisor.retained("clip_1")).isEmpty();
  }

  @Test
  void gracefulStopEscalatesWhenTerminationIsIgnored() throws Exception {
    supervisor = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5));
    started = supervisor.start(shell("stubborn_1", "trap '' TERM; while true; do sleep 1; done", Map.of()));
    Thread.sleep(200);

    long begin = System.nanoTime();
    boolean exited = supervisor.stop(started, true, Duration.ofMillis(500));
    Duration elapsed = Duration.ofNanos(System.nanoTime() - begin);

    assertThat(exited).isTrue();
    assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(500));
    assertThat(supervisor.isAlive(started.pid())).isFalse();
  }

  @Test
  void forcedStopKillsImmediately() throws Exception {
    supervisor = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5));
    started = supervisor.start(shell("stubborn_2", "trap '' TERM; while true; do sleep 1; done", Map.of()));

    long begin = System.nanoTime();
    assertThat(supervisor.stop(started, false, Duration.ofSeconds(30))).isTrue();

    assertThat(Duration.ofNanos(System.nanoTime() - begin)).isLessThan(Duration.ofSeconds(5));
  }

  @Test
  void stoppingAnExitedProcessSucceeds() throws Exception {
    supervisor = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5));
    started = supervisor.start(shell("short_1", "exit 0", Map.of()));
    await().atMost(Duration.ofSeconds(5)).until(() -> !supervisor.isAlive(started.pid()));

    assertThat(supervisor.stop(started, true, Duration.ofSeconds(1))).isTrue();
  }

  @Test
  void spawnFailureCarriesOsError() {
    supervisor = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5));

    assertThatThrownBy(() -> supervisor.start(new SpawnRequest(
        "missing_1", logDir.resolve("does-not-exist").toString(), List.of(), Map.of(), logDir)))
        .isInstanceOf(SpawnFailedException.class)
        .hasMessageContaining("does-not-exist")
        .hasCauseInstanceOf(java.io.IOException.class);
  }

  @Test
  void adoptsLiveProcessAndRejectsDeadPid() throws Exception {
    supervisor = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5));
    started = supervisor.start(shell("orphan_1", "while true; do sleep 1; done", Map.of()));

    LocalProcessSupervisor restarted = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5));
    assertThat(restarted.adopt("orphan_1", started.pid(), "/bin/sh")).isPresent();
    assertThat(restarted.retained("orphan_1")).isPresent();
    assertThat(restarted.adopt("orphan_1", started.pid(), "/opt/other/binary")).isEmpty();

    supervisor.stop(started, false, Duration.ZERO);
    assertThat(restarted.adopt("orphan_1", started.pid(), "/bin/sh")).isEmpty();
  }

  @Test
  void adoptedProcessIsSupervisedFromAdoptionTime() throws Exception {
    supervisor = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5));
    started = supervisor.start(shell("orphan_2", "while true; do sleep 1; done", Map.of()));

    Instant adoptedAt = Instant.now().plus(Duration.ofHours(2));
    LocalProcessSupervisor restarted = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5),
        Clock.fixed(adoptedAt, ZoneOffset.UTC), Path.of("/proc"));

    assertThat(restarted.adopt("orphan_2", started.pid(), "/bin/sh"))
        .hasValueSatisfying(adopted -> assertThat(adopted.startedAt()).isEqualTo(adoptedAt));
  }

  @Test
  void reportsResourceUsageForLiveProcess() throws Exception {
    supervisor = new LocalProcessSupervisor(ProcessLogSink.discarding(), Duration.ofSeconds(5));
    started = supervisor.start(shell("usage_1", "sleep 30", Map.of()));

    assertThat(supervisor.resourceUsage(started.pid())).isPresent();
    assertThat(supervisor.resourceUsage(Long.MAX_VALUE)).isEmpty();
  }

  private SpawnRequest shell(String instanceId, String script, Map<String, String> env) {
    return new SpawnRequest(instanceId, "/bin/sh", List.of("-c", script), env, logDir);
  }
}
