package io.linchmind.daemon.app;

import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.ConnectorType;
import io.linchmind.daemon.domain.ConfigUpdateResult;
import io.linchmind.daemon.domain.ConnectorLifecycleException;
import io.linchmind.daemon.domain.InstanceStore;
import io.linchmind.daemon.domain.InstanceUpdate;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists configuration changes and routes them to a hot reload or a restart advice.
 * Never restarts a process itself. Callers hold the instance lock.
 */
public class ConfigChangeRouter {

    private static final Logger log = LoggerFactory.getLogger(ConfigChangeRouter.class);

    private final InstanceStore store;
    private final ReloadNotifier reloads;

    public ConfigChangeRouter(InstanceStore store, ReloadNotifier reloads) {
        this.store = Objects.requireNonNull(store, "store");
        this.reloads = Objects.requireNonNull(reloads, "reloads");
    }

    /**
     * @param type the instance's type, or {@code null} when it is no longer catalogued
     */
    public ConfigUpdateResult apply(ConnectorInstance instance, ConnectorType type, Map<String, Object> config) {
        Objects.requireNonNull(instance, "instance");
        if (!store.update(instance.instanceId(), InstanceUpdate.builder().config(config).build())) {
            throw ConnectorLifecycleException.notFound(instance.instanceId());
        }
        reloads.configChanged(instance.instanceId());

        boolean running = instance.state() == ConnectorState.RUNNING;
        if (running && type != null && type.hotConfigReload() && reloads.requestReload(instance.instanceId())) {
            log.info("config updated instance={} applied by hot reload", instance.instanceId());
            return new ConfigUpdateResult(true, false);
        }
        if (running) {
            log.info("config updated instance={} restart required", instance.instanceId());
        } else {
            log.info("config updated instance={} state={}", instance.instanceId(), instance.state());
        }
        return new ConfigUpdateResult(false, running);
    }
}
