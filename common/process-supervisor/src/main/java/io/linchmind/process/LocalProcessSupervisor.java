package io.linchmind.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessSupervisor} for child processes on the local host, built on {@link ProcessBuilder}
 * and {@link ProcessHandle}.
 * <p>
 * Stops reach the whole process tree: descendants are signalled together with the root.
 * Resident memory is read from {@code /proc/<pid>/statm} and is unavailable on other platforms.
 */
public final class LocalProcessSupervisor implements ProcessSupervisor {

  private static final Logger log = LoggerFactory.getLogger(LocalProcessSupervisor.class);
  private static final long PAGE_SIZE_BYTES = 4096L;

  private final ProcessLogSink logSink;
  private final Duration killTimeout;
  private final Clock clock;
  private final Path procRoot;
  private final Map<String, Tracked> processes = new ConcurrentHashMap<>();

  public LocalProcessSupervisor(ProcessLogSink logSink, Duration killTimeout) {
    this(logSink, killTimeout, Clock.systemUTC(), Path.of("/proc"));
  }

  LocalProcessSupervisor(ProcessLogSink logSink, Duration killTimeout, Clock clock, Path procRoot) {
    this.logSink = Objects.requireNonNull(logSink, "logSink");
    this.killTimeout = Objects.requireNonNull(killTimeout, "killTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.procRoot = procRoot;
  }

  @Override
  public SupervisedProcess start(SpawnRequest request) throws SpawnFailedException {
    Objects.requireNonNull(request, "request");
    ProcessBuilder builder = new ProcessBuilder(request.command());
    if (request.workingDirectory() != null) {
      builder.directory(request.workingDirectory().toFile());
    }
    builder.environment().putAll(request.environment());
    builder.redirectErrorStream(true);
    builder.redirectInput(ProcessBuilder.Redirect.PIPE);
    Process process;
    try {
      builder.redirectOutput(logSink.redirectFor(request.instanceId()));
      process = builder.start();
    } catch (IOException | RuntimeException e) {
      log.warn("spawn failed instance={} command={}: {}", request.instanceId(), request.command(), e.getMessage());
      throw new SpawnFailedException(request.instanceId(),
          "failed to start " + request.executable() + ": " + e.getMessage(), e);
    }
    closeQuietly(process);
    SupervisedProcess supervised = new SupervisedProcess(
        request.instanceId(), process.pid(), request.executable(), clock.instant());
    processes.put(request.instanceId(), new Tracked(supervised, process.toHandle()));
    log.info("spawned instance={} pid={} command={}", request.instanceId(), process.pid(), request.command());
    return supervised;
  }

  @Override
  public boolean stop(SupervisedProcess process, boolean graceful, Duration timeout) {
    Objects.requireNonNull(process, "process");
    ProcessHandle handle = handleFor(process);
    if (handle == null || !handle.isAlive()) {
      release(process);
      return true;
    }
    List<ProcessHandle> descendants = handle.descendants().toList();
    if (graceful) {
      log.info("terminating instance={} pid={} timeout={}", process.instanceId(), process.pid(), timeout);
      descendants.forEach(ProcessHandle::destroy);
      handle.destroy();
      if (awaitExit(handle, timeout)) {
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        release(process);
        return true;
      }
      log.warn("instance={} pid={} ignored termination for {}, killing", process.instanceId(), process.pid(), timeout);
    } else {
      log.info("killing instance={} pid={}", process.instanceId(), process.pid());
    }
    descendants.forEach(ProcessHandle::destroyForcibly);
    handle.destroyForcibly();
    boolean exited = awaitExit(handle, killTimeout);
    if (exited) {
      release(process);
    } else {
      log.warn("instance={} pid={} still alive {} after kill", process.instanceId(), process.pid(), killTimeout);
    }
    return exited;
  }

  @Override
  public boolean isAlive(long pid) {
    return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
  }

  @Override
  public Optional<ResourceUsage> resourceUsage(long pid) {
    Optional<ProcessHandle> handle = ProcessHandle.of(pid);
    if (handle.isEmpty() || !handle.get().isAlive()) {
      return Optional.empty();
    }
    Duration cpu = handle.get().info().totalCpuDuration().orElse(null);
    Long rss = residentBytes(pid);
    if (cpu == null && rss == null) {
      return Optional.empty();
    }
    return Optional.of(new ResourceUsage(cpu, rss, null, clock.instant()));
  }

  @Override
  public Optional<SupervisedProcess> adopt(String instanceId, long pid, String expectedExecutable) {
    Optional<ProcessHandle> found = ProcessHandle.of(pid).filter(ProcessHandle::isAlive);
    if (found.isEmpty()) {
      log.info("adopt instance={} pid={}: process not found", instanceId, pid);
      return Optional.empty();
    }
    ProcessHandle handle = found.get();
    if (!commandMatches(handle.info(), expectedExecutable)) {
      log.warn("adopt instance={} pid={}: pid now runs {}, not {}",
          instanceId, pid, handle.info().command().orElse("?"), expectedExecutable);
      return Optional.empty();
    }
    SupervisedProcess supervised = new SupervisedProcess(instanceId, pid, expectedExecutable, clock.instant());
    processes.put(instanceId, new Tracked(supervised, handle));
    log.info("adopted instance={} pid={}", instanceId, pid);
    return Optional.of(supervised);
  }

  @Override
  public Optional<SupervisedProcess> retained(String instanceId) {
    Tracked tracked = processes.get(instanceId);
    if (tracked == null) {
      return Optional.empty();
    }
    if (!tracked.handle().isAlive()) {
      processes.remove(instanceId, tracked);
      return Optional.empty();
    }
    return Optional.of(tracked.process());
  }

  static boolean commandMatches(ProcessHandle.Info info, String expectedExecutable) {
    if (expectedExecutable == null || expectedExecutable.isBlank()) {
      return true;
    }
    Optional<String> command = info.command();
    Optional<String> commandLine = info.commandLine();
    if (command.isEmpty() && commandLine.isEmpty()) {
      return true;
    }
    String resolved = realPath(expectedExecutable);
    if (command.filter(c -> c.equals(expectedExecutable) || c.equals(resolved)).isPresent()) {
      return true;
    }
    return commandLine.filter(line -> line.contains(expectedExecutable) || line.contains(resolved)).isPresent();
  }

  private static String realPath(String executable) {
    try {
      return Path.of(executable).toRealPath().toString();
    } catch (IOException | RuntimeException e) {
      return executable;
    }
  }

  private ProcessHandle handleFor(SupervisedProcess process) {
    Tracked tracked = processes.get(process.instanceId());
    if (tracked != null && tracked.process().pid() == process.pid()) {
      return tracked.handle();
    }
    return ProcessHandle.of(process.pid()).orElse(null);
  }

  private void release(SupervisedProcess process) {
    processes.computeIfPresent(process.instanceId(),
        (id, tracked) -> tracked.process().pid() == process.pid() ? null : tracked);
  }

  private boolean awaitExit(ProcessHandle handle, Duration timeout) {
    try {
      handle.onExit().get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return !handle.isAlive();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return !handle.isAlive();
    } catch (ExecutionException e) {
      log.debug("waiting for pid {} failed", handle.pid(), e);
      return !handle.isAlive();
    }
  }

  private Long residentBytes(long pid) {
    if (procRoot == null) {
      return null;
    }
    Path statm = procRoot.resolve(Long.toString(pid)).resolve("statm");
    if (!Files.isReadable(statm)) {
      return null;
    }
    try {
      String[] fields = Files.readString(statm, StandardCharsets.US_ASCII).trim().split("\\s+");
      if (fields.length < 2) {
        return null;
      }
      return Long.parseLong(fields[1]) * PAGE_SIZE_BYTES;
    } catch (IOException | NumberFormatException e) {
      log.debug("cannot read {}: {}", statm, e.getMessage());
      return null;
    }
  }

  private static void closeQuietly(Process process) {
    try {
      process.getOutputStream().close();
    } catch (IOException e) {
      log.debug("closing stdin of pid {} failed: {}", process.pid(), e.getMessage());
    }
  }

  private record Tracked(SupervisedProcess process, ProcessHandle handle) {
  }
}
