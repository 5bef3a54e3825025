package io.linchmind.daemon.app;

import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import java.time.Instant;

/**
 * List view of an instance; configuration is left out.
 */
public record InstanceSummary(String instanceId,
                              String typeId,
                              String displayName,
                              ConnectorState state,
                              boolean enabled,
                              boolean autoStart,
                              Long processId,
                              Instant lastHeartbeat,
                              String errorMessage,
                              long dataCount,
                              Instant createdAt,
                              Instant updatedAt) {

    static InstanceSummary from(ConnectorInstance instance) {
        return new InstanceSummary(instance.instanceId(), instance.typeId(), instance.displayName(), instance.state(),
            instance.enabled(), instance.autoStart(), instance.processId(), instance.lastHeartbeat(),
            instance.errorMessage(), instance.dataCount(), instance.createdAt(), instance.updatedAt());
    }
}
