package io.linchmind.daemon.domain;

import io.linchmind.connector.model.ConnectorState;

public record CreatedInstance(String instanceId, ConnectorState state) {
}
