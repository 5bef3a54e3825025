package io.linchmind.daemon.app;

import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.daemon.domain.ConnectorLifecycleException;
import io.linchmind.daemon.domain.InstanceStore;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings persisted instances in line with the host after a daemon start: recorded pids are treated
 * as stale until re-adopted, then enabled auto-start instances are started.
 */
public class InstanceReconciler {

    private static final Logger log = LoggerFactory.getLogger(InstanceReconciler.class);

    private final LifecycleManager manager;
    private final InstanceStore store;
    private final boolean autoStart;

    public InstanceReconciler(LifecycleManager manager, InstanceStore store, boolean autoStart) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.store = Objects.requireNonNull(store, "store");
        this.autoStart = autoStart;
    }

    /**
     * @return resulting state per reconciled or auto-started instance
     */
    public Map<String, ConnectorState> reconcile() {
        Map<String, ConnectorState> results = new LinkedHashMap<>();
        for (ConnectorInstance instance : store.list()) {
            if (!instance.state().isActive() && instance.processId() == null) {
                continue;
            }
            try {
                results.put(instance.instanceId(), manager.reconcileInstance(instance.instanceId()));
            } catch (ConnectorLifecycleException e) {
                log.warn("reconciling instance {} failed: {}", instance.instanceId(), e.getMessage());
            }
        }
        if (autoStart) {
            for (ConnectorInstance instance : store.list()) {
                boolean idle = instance.state() == ConnectorState.CONFIGURED || instance.state() == ConnectorState.STOPPED;
                if (!idle || !instance.enabled() || !instance.autoStart()) {
                    continue;
                }
                try {
                    results.put(instance.instanceId(), manager.startInstance(instance.instanceId()));
                } catch (ConnectorLifecycleException e) {
                    log.warn("auto-start of instance {} failed: {}", instance.instanceId(), e.getMessage());
                    results.put(instance.instanceId(), manager.getInstanceState(instance.instanceId()));
                }
            }
        }
        log.info("reconciled {} instances: {}", results.size(), results);
        return results;
    }
}
