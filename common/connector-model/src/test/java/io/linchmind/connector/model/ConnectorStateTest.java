package io.linchmind.connector.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConnectorStateTest {

    @Test
    void startableStatesMayOnlyEnterStartingOrError() {
        for (ConnectorState from : new ConnectorState[] {ConnectorState.CONFIGURED, ConnectorState.STOPPED}) {
            assertThat(from.canTransitionTo(ConnectorState.STARTING)).isTrue();
            assertThat(from.canTransitionTo(ConnectorState.ERROR)).isTrue();
            assertThat(from.canTransitionTo(ConnectorState.RUNNING)).isFalse();
            assertThat(from.canTransitionTo(ConnectorState.STOPPING)).isFalse();
        }
    }

    @Test
    void runningStopsThroughStopping() {
        assertThat(ConnectorState.RUNNING.canTransitionTo(ConnectorState.STOPPING)).isTrue();
        assertThat(ConnectorState.RUNNING.canTransitionTo(ConnectorState.STOPPED)).isFalse();
        assertThat(ConnectorState.STOPPING.canTransitionTo(ConnectorState.STOPPED)).isTrue();
        assertThat(ConnectorState.RUNNING.canTransitionTo(ConnectorState.STARTING)).isFalse();
    }

    @Test
    void errorIsReachableFromActiveStatesAndRetryable() {
        assertThat(ConnectorState.STARTING.canTransitionTo(ConnectorState.ERROR)).isTrue();
        assertThat(ConnectorState.RUNNING.canTransitionTo(ConnectorState.ERROR)).isTrue();
        assertThat(ConnectorState.STOPPING.canTransitionTo(ConnectorState.ERROR)).isTrue();
        assertThat(ConnectorState.ERROR.canTransitionTo(ConnectorState.STARTING)).isTrue();
        assertThat(ConnectorState.ERROR.canTransitionTo(ConnectorState.STOPPED)).isTrue();
    }

    @Test
    void uninstalledIsNeverATarget() {
        for (ConnectorState from : ConnectorState.values()) {
            assertThat(from.canTransitionTo(ConnectorState.UNINSTALLED)).isFalse();
            assertThat(from.canTransitionTo(null)).isFalse();
        }
    }

    @Test
    void activeStatesOwnAProcess() {
        assertThat(ConnectorState.STARTING.isActive()).isTrue();
        assertThat(ConnectorState.RUNNING.isActive()).isTrue();
        assertThat(ConnectorState.STOPPING.isActive()).isTrue();
        assertThat(ConnectorState.CONFIGURED.isActive()).isFalse();
        assertThat(ConnectorState.STOPPED.isActive()).isFalse();
        assertThat(ConnectorState.ERROR.isActive()).isFalse();
    }
}
