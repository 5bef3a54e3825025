package io.linchmind.process;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity of a supervised process. The OS handle itself stays inside the supervisor.
 *
 * @param startedAt when supervision began: the spawn, or the adoption of a process left by an
 *     earlier daemon run
 */
public record SupervisedProcess(String instanceId, long pid, String executable, Instant startedAt) {

  public SupervisedProcess {
    Objects.requireNonNull(instanceId, "instanceId");
    Objects.requireNonNull(startedAt, "startedAt");
    if (pid <= 0) {
      throw new IllegalArgumentException("pid must be positive");
    }
  }
}
