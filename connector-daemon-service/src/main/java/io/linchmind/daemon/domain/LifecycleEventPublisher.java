package io.linchmind.daemon.domain;

import io.linchmind.connector.model.LifecycleEvent;

/**
 * Fire-and-forget sink for state changes. Must never block or throw into the caller.
 */
@FunctionalInterface
public interface LifecycleEventPublisher {

    void publish(LifecycleEvent event);
}
