package io.linchmind.process;

import java.time.Duration;
import java.util.Optional;

/**
 * Owns the OS processes that back connector instances on this host.
 * <p>
 * Implementations retain a handle per instance id from {@link #start(SpawnRequest)} (or
 * {@link #adopt(String, long, String)}) until the process is observed to have exited through
 * {@link #stop(SupervisedProcess, boolean, Duration)}. They never restart anything on their own;
 * retry policy belongs to the caller.
 */
public interface ProcessSupervisor {

  /**
   * Launch the connector binary. The pid is captured before this method returns.
   *
   * @throws SpawnFailedException when the OS refuses to create the process
   */
  SupervisedProcess start(SpawnRequest request) throws SpawnFailedException;

  /**
   * Terminate a process. A graceful stop signals termination and waits up to {@code timeout};
   * a process still alive afterwards, or any process when {@code graceful} is false, is killed.
   *
   * @return whether the process has exited
   */
  boolean stop(SupervisedProcess process, boolean graceful, Duration timeout);

  boolean isAlive(long pid);

  /**
   * Best-effort process statistics; empty when the platform does not expose them.
   */
  Optional<ResourceUsage> resourceUsage(long pid);

  /**
   * Take ownership of a process recorded by an earlier daemon run.
   *
   * @return the adopted process, or empty when the pid is gone or runs a different command
   */
  Optional<SupervisedProcess> adopt(String instanceId, long pid, String expectedExecutable);

  /**
   * Process still retained for an instance, if any.
   */
  Optional<SupervisedProcess> retained(String instanceId);
}
