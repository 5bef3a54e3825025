package io.linchmind.daemon.app;

import io.linchmind.process.SupervisedProcess;
import java.time.Instant;

/**
 * Decides whether a live process has shown a recent enough sign of life.
 */
@FunctionalInterface
public interface HeartbeatStrategy {

    boolean isFresh(SupervisedProcess process, Instant now);
}
