package io.linchmind.daemon.domain;

import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.LifecycleEvent;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative writer of instance state.
 * <p>
 * Callers hold the instance lock from {@link InstanceLockTable} and pass the record they read under
 * it. A transition is validated against {@link ConnectorState#canTransitionTo(ConnectorState)},
 * persisted with the read state as precondition, and published only when the state changed.
 * The process id is cleared on every move to a state that does not own a process.
 */
public final class LifecycleStateMachine {

    private static final Logger log = LoggerFactory.getLogger(LifecycleStateMachine.class);

    private final InstanceStore store;
    private final LifecycleEventPublisher events;
    private final Clock clock;

    public LifecycleStateMachine(InstanceStore store, LifecycleEventPublisher events, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ConnectorInstance transition(ConnectorInstance current, ConnectorState target) {
        return transition(current, target, null, InstanceUpdate.builder());
    }

    public ConnectorInstance transition(ConnectorInstance current,
                                        ConnectorState target,
                                        String reason,
                                        InstanceUpdate.Builder changes) {
        Objects.requireNonNull(current, "current");
        ConnectorState from = current.state();
        if (!from.canTransitionTo(target)) {
            throw ConnectorLifecycleException.invalidTransition(current.instanceId(), "move to " + target, from);
        }
        InstanceUpdate.Builder update = changes == null ? InstanceUpdate.builder() : changes;
        if (target.isActive()) {
            if (!update.setsProcessId() && current.processId() == null) {
                throw new IllegalStateException("instance " + current.instanceId() + " cannot enter " + target
                    + " without a process id");
            }
        } else {
            update.processId(null);
        }
        if (target == ConnectorState.ERROR) {
            update.errorMessage(reason);
        } else if (from == ConnectorState.ERROR || target == ConnectorState.STARTING) {
            update.errorMessage(null);
        }
        update.expectedState(from).state(target);

        if (!store.update(current.instanceId(), update.build())) {
            ConnectorInstance fresh = store.get(current.instanceId())
                .orElseThrow(() -> ConnectorLifecycleException.notFound(current.instanceId()));
            throw ConnectorLifecycleException.invalidTransition(current.instanceId(), "move to " + target, fresh.state());
        }
        ConnectorInstance updated = store.get(current.instanceId())
            .orElseThrow(() -> ConnectorLifecycleException.notFound(current.instanceId()));

        if (from != target) {
            if (target == ConnectorState.ERROR) {
                log.warn("instance {} {} -> {}: {}", current.instanceId(), from, target, reason);
            } else {
                log.info("instance {} {} -> {}", current.instanceId(), from, target);
            }
            events.publish(new LifecycleEvent(current.instanceId(), current.typeId(), from, target,
                updated.errorMessage(), clock.instant()));
        } else {
            log.debug("instance {} stays {}: {}", current.instanceId(), target, reason);
        }
        return updated;
    }
}
