package io.linchmind.daemon.domain;

import io.linchmind.connector.model.ConnectorState;
import java.util.Objects;

/**
 * Typed failure of a lifecycle operation.
 */
public class ConnectorLifecycleException extends RuntimeException {

    private final LifecycleError code;

    public ConnectorLifecycleException(LifecycleError code, String message) {
        this(code, message, null);
    }

    public ConnectorLifecycleException(LifecycleError code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public LifecycleError getCode() {
        return code;
    }

    public static ConnectorLifecycleException notFound(String instanceId) {
        return new ConnectorLifecycleException(LifecycleError.NOT_FOUND, "instance " + instanceId + " not found");
    }

    public static ConnectorLifecycleException invalidType(String typeId) {
        return new ConnectorLifecycleException(LifecycleError.INVALID_TYPE, "unknown connector type " + typeId);
    }

    public static ConnectorLifecycleException invalidTransition(String instanceId,
                                                                String operation,
                                                                ConnectorState state) {
        return new ConnectorLifecycleException(LifecycleError.INVALID_TRANSITION,
            "cannot " + operation + " instance " + instanceId + " in state " + state);
    }

    public static ConnectorLifecycleException configInvalid(String message) {
        return new ConnectorLifecycleException(LifecycleError.CONFIG_VALIDATION_FAILED, message);
    }
}
