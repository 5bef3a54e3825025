package io.linchmind.daemon.app;

import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.LifecycleEvent;
import io.linchmind.daemon.domain.InstanceStore;
import io.linchmind.daemon.domain.StoreUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Micrometer view of the lifecycle. Transition counters are fed from the event bus, so recording
 * never runs inside a transition.
 */
public class LifecycleMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleMetrics.class);

    private final MeterRegistry registry;
    private final InstanceStore store;
    private final List<Gauge> gauges = new ArrayList<>();
    private EventSubscription subscription;

    public LifecycleMetrics(MeterRegistry registry, InstanceStore store) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.store = Objects.requireNonNull(store, "store");
        for (ConnectorState state : ConnectorState.values()) {
            if (state == ConnectorState.UNINSTALLED) {
                continue;
            }
            gauges.add(Gauge.builder("lm_connector_instances", this, m -> m.count(state))
                .description("Persisted connector instances per state")
                .tag("state", state.name())
                .register(registry));
        }
    }

    public void bind(LifecycleEventBus bus) {
        this.subscription = bus.subscribe("metrics", this::record);
    }

    void record(LifecycleEvent event) {
        Counter.builder("lm_connector_transitions_total")
            .description("Connector instance state transitions")
            .tag("from", event.oldState() == null ? "NONE" : event.oldState().name())
            .tag("to", event.newState().name())
            .register(registry)
            .increment();
    }

    public void recordSpawnFailure(String typeId) {
        Counter.builder("lm_connector_spawn_failures_total")
            .description("Connector processes that could not be spawned")
            .tag("type", typeId)
            .register(registry)
            .increment();
    }

    private double count(ConnectorState state) {
        try {
            return store.list(null, state).size();
        } catch (StoreUnavailableException e) {
            log.debug("instance gauge unavailable: {}", e.getMessage());
            return Double.NaN;
        }
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.close();
        }
        gauges.forEach(registry::remove);
        gauges.clear();
    }
}
