package io.linchmind.process;

import java.time.Duration;
import java.time.Instant;

/**
 * One sample of process statistics. Either figure may be {@code null} when unavailable.
 *
 * @param cpuTime       total CPU time consumed since process start
 * @param residentBytes resident set size
 * @param cpuPercent    CPU share since the previous sample, filled in by the sampler
 */
public record ResourceUsage(Duration cpuTime, Long residentBytes, Double cpuPercent, Instant sampledAt) {

  public ResourceUsage withCpuPercent(Double percent) {
    return new ResourceUsage(cpuTime, residentBytes, percent, sampledAt);
  }

  /**
   * CPU percentage between {@code previous} and this sample, or {@code null} if it cannot be derived.
   */
  public Double cpuPercentSince(ResourceUsage previous) {
    if (previous == null || previous.cpuTime() == null || cpuTime == null) {
      return null;
    }
    long wallNanos = Duration.between(previous.sampledAt(), sampledAt).toNanos();
    if (wallNanos <= 0) {
      return null;
    }
    long cpuNanos = cpuTime.minus(previous.cpuTime()).toNanos();
    return Math.max(0d, cpuNanos * 100d / wallNanos);
  }
}
