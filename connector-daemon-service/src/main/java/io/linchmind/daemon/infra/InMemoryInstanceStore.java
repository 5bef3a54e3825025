package io.linchmind.daemon.infra;

import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.daemon.domain.InstanceStore;
import io.linchmind.daemon.domain.InstanceUpdate;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Volatile {@link InstanceStore}; contents are lost when the daemon stops.
 */
public class InMemoryInstanceStore implements InstanceStore {

    private final Map<String, ConnectorInstance> instances = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryInstanceStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String create(ConnectorInstance instance) {
        Objects.requireNonNull(instance, "instance");
        if (instances.putIfAbsent(instance.instanceId(), instance) != null) {
            throw new IllegalArgumentException("instance " + instance.instanceId() + " already exists");
        }
        return instance.instanceId();
    }

    @Override
    public Optional<ConnectorInstance> get(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public boolean update(String instanceId, InstanceUpdate update) {
        AtomicBoolean applied = new AtomicBoolean();
        instances.computeIfPresent(instanceId, (id, current) -> {
            if (!update.matches(current.state())) {
                return current;
            }
            applied.set(true);
            return update.applyTo(current, clock.instant());
        });
        return applied.get();
    }

    @Override
    public boolean delete(String instanceId) {
        return instances.remove(instanceId) != null;
    }

    @Override
    public List<ConnectorInstance> list(String typeId, ConnectorState state) {
        return instances.values().stream()
            .filter(i -> typeId == null || typeId.equals(i.typeId()))
            .filter(i -> state == null || state == i.state())
            .sorted(Comparator.comparing(ConnectorInstance::createdAt).thenComparing(ConnectorInstance::instanceId))
            .toList();
    }
}
