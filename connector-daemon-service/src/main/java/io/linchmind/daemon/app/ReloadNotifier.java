package io.linchmind.daemon.app;

/**
 * Channel that tells a running connector to re-fetch its configuration.
 */
public interface ReloadNotifier {

    /**
     * Records that the persisted configuration of an instance changed.
     */
    void configChanged(String instanceId);

    /**
     * Asks the running process to apply the current configuration.
     *
     * @return whether the notification was accepted for delivery
     */
    boolean requestReload(String instanceId);

    ReloadStatus status(String instanceId);

    /**
     * @return {@code false} when {@code version} is not the current configuration version
     */
    boolean acknowledge(String instanceId, long version);

    void forget(String instanceId);

    record ReloadStatus(long configVersion, boolean reloadRequested) {
    }
}
