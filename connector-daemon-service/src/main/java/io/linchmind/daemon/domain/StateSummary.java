package io.linchmind.daemon.domain;

import io.linchmind.connector.model.ConnectorState;
import java.util.Map;

/**
 * Counts over all persisted instances. The distribution lists every persisted state, zero included.
 */
public record StateSummary(int total, int running, Map<ConnectorState, Integer> stateDistribution) {
    public StateSummary {
        stateDistribution = Map.copyOf(stateDistribution);
    }
}
