package io.linchmind.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted connector instance.
 * <p>
 * {@code processId} is non-null exactly when {@code state} is STARTING, RUNNING or STOPPING.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectorInstance(
    String instanceId,
    String typeId,
    String displayName,
    Map<String, Object> config,
    boolean enabled,
    boolean autoStart,
    ConnectorState state,
    Long processId,
    Instant lastHeartbeat,
    String errorMessage,
    long dataCount,
    Instant createdAt,
    Instant updatedAt) {

    public ConnectorInstance {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(typeId, "typeId");
        Objects.requireNonNull(state, "state");
        if (state == ConnectorState.UNINSTALLED) {
            throw new IllegalArgumentException("UNINSTALLED is not a persisted state");
        }
        config = Documents.copyOf(config);
        displayName = displayName == null || displayName.isBlank() ? instanceId : displayName;
    }

    /**
     * Fresh record in {@link ConnectorState#CONFIGURED}.
     */
    public static ConnectorInstance configured(String instanceId,
                                               String typeId,
                                               String displayName,
                                               Map<String, Object> config,
                                               boolean autoStart,
                                               Instant now) {
        return new ConnectorInstance(instanceId, typeId, displayName, config, autoStart, autoStart,
            ConnectorState.CONFIGURED, null, null, null, 0L, now, now);
    }

    public boolean hasProcess() {
        return processId != null;
    }
}
