package io.linchmind.connector.model;

/**
 * Lifecycle state of a connector instance.
 * <p>
 * {@link #UNINSTALLED} is virtual: it describes a type with no instance and is never persisted.
 * {@link #CONFIGURED} is the initial persisted state; a clean stop lands in {@link #STOPPED}.
 */
public enum ConnectorState {
    UNINSTALLED,
    CONFIGURED,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    ERROR;

    public boolean canTransitionTo(ConnectorState next) {
        if (next == null || next == UNINSTALLED) {
            return false;
        }
        return switch (this) {
            case UNINSTALLED -> next == CONFIGURED;
            case CONFIGURED, STOPPED -> next == STARTING || next == ERROR;
            case STARTING -> next == RUNNING || next == STOPPING || next == ERROR;
            case RUNNING -> next == STOPPING || next == ERROR;
            case STOPPING -> next == STOPPED || next == ERROR;
            case ERROR -> next == STARTING || next == STOPPED || next == ERROR;
        };
    }

    /**
     * States in which the instance owns an OS process and a {@code processId} is recorded.
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING || this == STOPPING;
    }

    public boolean isStartable() {
        return this == CONFIGURED || this == STOPPED || this == ERROR;
    }
}
