package io.linchmind.daemon.domain;

public enum LifecycleError {
    INVALID_TYPE,
    INSTANCE_LIMIT_EXCEEDED,
    NOT_FOUND,
    SPAWN_FAILED,
    STILL_RUNNING,
    INVALID_TRANSITION,
    CONFIG_VALIDATION_FAILED,
    STORE_UNAVAILABLE,
    SHUTDOWN_IN_PROGRESS
}
