package io.linchmind.daemon.app;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest liveness signals pushed by connector processes: explicit pings and ingestion activity.
 */
public class HeartbeatTracker {

    private final Clock clock;
    private final Map<String, Instant> pings = new ConcurrentHashMap<>();
    private final Map<String, Instant> ingestions = new ConcurrentHashMap<>();

    public HeartbeatTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void recordPing(String instanceId) {
        pings.put(instanceId, clock.instant());
    }

    public void recordIngestion(String instanceId) {
        ingestions.put(instanceId, clock.instant());
    }

    public Optional<Instant> latest(String instanceId) {
        Instant ping = pings.get(instanceId);
        Instant ingestion = ingestions.get(instanceId);
        if (ping == null) {
            return Optional.ofNullable(ingestion);
        }
        if (ingestion == null) {
            return Optional.of(ping);
        }
        return Optional.of(ping.isAfter(ingestion) ? ping : ingestion);
    }

    public void forget(String instanceId) {
        pings.remove(instanceId);
        ingestions.remove(instanceId);
    }
}
