package io.linchmind.daemon.domain;

import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of connector instances keyed by instance id.
 * <p>
 * Every call is atomic on its own and safe under concurrent callers. Implementations signal
 * I/O failures with {@link StoreUnavailableException}.
 */
public interface InstanceStore {

    /**
     * @throws IllegalArgumentException when an instance with the same id exists
     */
    String create(ConnectorInstance instance);

    Optional<ConnectorInstance> get(String instanceId);

    /**
     * Applies {@code update} to the stored record.
     *
     * @return {@code false} when the instance is missing or the update's expected state does not match
     */
    boolean update(String instanceId, InstanceUpdate update);

    boolean delete(String instanceId);

    /**
     * @param typeId optional type filter
     * @param state  optional state filter
     */
    List<ConnectorInstance> list(String typeId, ConnectorState state);

    default List<ConnectorInstance> list() {
        return list(null, null);
    }
}
