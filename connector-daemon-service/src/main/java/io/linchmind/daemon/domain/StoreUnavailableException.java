package io.linchmind.daemon.domain;

/**
 * The instance store could not complete a call. Never retried by the lifecycle core.
 */
public class StoreUnavailableException extends ConnectorLifecycleException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(LifecycleError.STORE_UNAVAILABLE, message, cause);
    }
}
