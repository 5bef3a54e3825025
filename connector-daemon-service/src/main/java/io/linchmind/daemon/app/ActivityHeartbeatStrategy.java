package io.linchmind.daemon.app;

import io.linchmind.process.SupervisedProcess;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fresh when a ping or an ingestion arrived within the staleness window. Until the first signal
 * the start of supervision (spawn or re-adoption) counts as the last one.
 */
public class ActivityHeartbeatStrategy implements HeartbeatStrategy {

    private final HeartbeatTracker tracker;
    private final Duration staleness;

    public ActivityHeartbeatStrategy(HeartbeatTracker tracker, Duration staleness) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.staleness = Objects.requireNonNull(staleness, "staleness");
    }

    @Override
    public boolean isFresh(SupervisedProcess process, Instant now) {
        Instant last = process.startedAt();
        Instant signal = tracker.latest(process.instanceId()).orElse(null);
        if (signal != null && signal.isAfter(last)) {
            last = signal;
        }
        return Duration.between(last, now).compareTo(staleness) <= 0;
    }
}
