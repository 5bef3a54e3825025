package io.linchmind.daemon.app;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Poll-based reload channel. Connectors read {@code config_version} and {@code reload_requested}
 * from their config endpoint and acknowledge the version they applied.
 */
public class PendingReloadNotifier implements ReloadNotifier {

    private static final Logger log = LoggerFactory.getLogger(PendingReloadNotifier.class);

    private final Map<String, ReloadStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public void configChanged(String instanceId) {
        statuses.merge(instanceId, new ReloadStatus(1L, false),
            (current, ignored) -> new ReloadStatus(current.configVersion() + 1, current.reloadRequested()));
    }

    @Override
    public boolean requestReload(String instanceId) {
        ReloadStatus status = statuses.compute(instanceId, (id, current) -> current == null
            ? new ReloadStatus(1L, true)
            : new ReloadStatus(current.configVersion(), true));
        log.info("reload requested instance={} configVersion={}", instanceId, status.configVersion());
        return true;
    }

    @Override
    public ReloadStatus status(String instanceId) {
        return statuses.getOrDefault(instanceId, new ReloadStatus(0L, false));
    }

    @Override
    public boolean acknowledge(String instanceId, long version) {
        ReloadStatus current = statuses.get(instanceId);
        if (current == null || current.configVersion() != version) {
            return false;
        }
        boolean replaced = statuses.replace(instanceId, current, new ReloadStatus(version, false));
        if (replaced) {
            log.info("reload acknowledged instance={} configVersion={}", instanceId, version);
        }
        return replaced;
    }

    @Override
    public void forget(String instanceId) {
        statuses.remove(instanceId);
    }
}
