package io.linchmind.daemon.domain;

import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.process.ResourceUsage;

/**
 * @param processRetained  whether the supervisor still holds a process for the instance
 * @param resourceUsage    latest sample, or {@code null}
 * @param configVersion    version of the most recent configuration change
 * @param reloadRequested  a hot reload was requested and not yet acknowledged
 */
public record InstanceDetail(ConnectorInstance instance,
                             String typeDisplayName,
                             boolean processRetained,
                             ResourceUsage resourceUsage,
                             long configVersion,
                             boolean reloadRequested) {
}
