package io.linchmind.connector.model;

import java.time.Instant;
import java.util.Objects;

/**
 * State change of one instance. Ephemeral; never persisted.
 */
public record LifecycleEvent(
    String instanceId,
    String typeId,
    ConnectorState oldState,
    ConnectorState newState,
    String errorMessage,
    Instant timestamp) {

    public LifecycleEvent {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(newState, "newState");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
