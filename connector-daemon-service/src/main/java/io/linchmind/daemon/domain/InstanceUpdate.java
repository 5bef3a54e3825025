package io.linchmind.daemon.domain;

import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.Documents;
import java.time.Instant;
import java.util.Map;

/**
 * Partial update of a {@link ConnectorInstance}. Only fields that were set are written, so a field
 * can be cleared explicitly (for example {@code processId(null)}).
 */
public final class InstanceUpdate {

    private final ConnectorState expectedState;
    private final ConnectorState state;
    private final boolean setState;
    private final Long processId;
    private final boolean setProcessId;
    private final Instant lastHeartbeat;
    private final boolean setLastHeartbeat;
    private final String errorMessage;
    private final boolean setErrorMessage;
    private final Map<String, Object> config;
    private final Boolean enabled;
    private final long dataCountDelta;

    private InstanceUpdate(Builder builder) {
        this.expectedState = builder.expectedState;
        this.state = builder.state;
        this.setState = builder.setState;
        this.processId = builder.processId;
        this.setProcessId = builder.setProcessId;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.setLastHeartbeat = builder.setLastHeartbeat;
        this.errorMessage = builder.errorMessage;
        this.setErrorMessage = builder.setErrorMessage;
        this.config = builder.config;
        this.enabled = builder.enabled;
        this.dataCountDelta = builder.dataCountDelta;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether this update may be applied to a record currently in {@code current}.
     */
    public boolean matches(ConnectorState current) {
        return expectedState == null || expectedState == current;
    }

    public ConnectorInstance applyTo(ConnectorInstance current, Instant now) {
        return new ConnectorInstance(
            current.instanceId(),
            current.typeId(),
            current.displayName(),
            config != null ? config : current.config(),
            enabled != null ? enabled : current.enabled(),
            current.autoStart(),
            setState ? state : current.state(),
            setProcessId ? processId : current.processId(),
            setLastHeartbeat ? lastHeartbeat : current.lastHeartbeat(),
            setErrorMessage ? errorMessage : current.errorMessage(),
            current.dataCount() + dataCountDelta,
            current.createdAt(),
            now);
    }

    public ConnectorState expectedState() {
        return expectedState;
    }

    public boolean setsState() {
        return setState;
    }

    public ConnectorState state() {
        return state;
    }

    public boolean setsProcessId() {
        return setProcessId;
    }

    public Long processId() {
        return processId;
    }

    public boolean setsLastHeartbeat() {
        return setLastHeartbeat;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public boolean setsErrorMessage() {
        return setErrorMessage;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Map<String, Object> config() {
        return config;
    }

    public Boolean enabled() {
        return enabled;
    }

    public long dataCountDelta() {
        return dataCountDelta;
    }

    public static final class Builder {

        private ConnectorState expectedState;
        private ConnectorState state;
        private boolean setState;
        private Long processId;
        private boolean setProcessId;
        private Instant lastHeartbeat;
        private boolean setLastHeartbeat;
        private String errorMessage;
        private boolean setErrorMessage;
        private Map<String, Object> config;
        private Boolean enabled;
        private long dataCountDelta;

        private Builder() {
        }

        public Builder expectedState(ConnectorState expectedState) {
            this.expectedState = expectedState;
            return this;
        }

        public Builder state(ConnectorState state) {
            if (state == null || state == ConnectorState.UNINSTALLED) {
                throw new IllegalArgumentException("state must be a persisted state");
            }
            this.state = state;
            this.setState = true;
            return this;
        }

        public Builder processId(Long processId) {
            this.processId = processId;
            this.setProcessId = true;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            this.setLastHeartbeat = true;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            this.setErrorMessage = true;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = Documents.copyOf(config);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder incrementDataCount(long delta) {
            if (delta < 0) {
                throw new IllegalArgumentException("data count is monotonic");
            }
            this.dataCountDelta += delta;
            return this;
        }

        public boolean setsProcessId() {
            return setProcessId;
        }

        public InstanceUpdate build() {
            return new InstanceUpdate(this);
        }
    }
}
