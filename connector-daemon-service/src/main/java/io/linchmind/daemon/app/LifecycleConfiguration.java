package io.linchmind.daemon.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.linchmind.daemon.config.ConnectorDaemonProperties;
import io.linchmind.daemon.domain.InstanceLockTable;
import io.linchmind.daemon.domain.InstanceStore;
import io.linchmind.daemon.domain.LifecycleStateMachine;
import io.linchmind.process.ProcessSupervisor;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Assembles the lifecycle core from the configured store and process supervisor.
 */
@Configuration
public class LifecycleConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InstanceLockTable instanceLockTable() {
        return new InstanceLockTable();
    }

    @Bean(destroyMethod = "close")
    public LifecycleEventBus lifecycleEventBus(ConnectorDaemonProperties properties) {
        return new LifecycleEventBus(properties.getEvents().getSubscriberCapacity());
    }

    @Bean
    public LifecycleStateMachine lifecycleStateMachine(InstanceStore store, LifecycleEventBus bus, Clock clock) {
        return new LifecycleStateMachine(store, bus, clock);
    }

    @Bean
    public TypeCatalog typeCatalog(ObjectMapper mapper, ConnectorDaemonProperties properties) {
        ConnectorDaemonProperties.Types types = properties.getTypes();
        return new TypeCatalog(mapper, types.getRootDir(), types.getManifestFile());
    }

    @Bean
    public HeartbeatTracker heartbeatTracker(Clock clock) {
        return new HeartbeatTracker(clock);
    }

    @Bean
    public HeartbeatStrategy heartbeatStrategy(HeartbeatTracker tracker, ConnectorDaemonProperties properties) {
        ConnectorDaemonProperties.Health health = properties.getHealth();
        return switch (health.getHeartbeatMode()) {
            case ACTIVITY -> new ActivityHeartbeatStrategy(tracker, health.getHeartbeatStaleness());
            case PROCESS -> new ProcessHeartbeatStrategy();
        };
    }

    @Bean
    public ReloadNotifier reloadNotifier() {
        return new PendingReloadNotifier();
    }

    @Bean
    public ConfigChangeRouter configChangeRouter(InstanceStore store, ReloadNotifier reloadNotifier) {
        return new ConfigChangeRouter(store, reloadNotifier);
    }

    @Bean(destroyMethod = "close")
    public HealthMonitor healthMonitor(ProcessSupervisor supervisor,
                                       InstanceStore store,
                                       InstanceLockTable locks,
                                       LifecycleStateMachine stateMachine,
                                       HeartbeatStrategy heartbeatStrategy,
                                       ConnectorDaemonProperties properties,
                                       Clock clock) {
        ConnectorDaemonProperties.Health health = properties.getHealth();
        HealthMonitor.Settings settings = new HealthMonitor.Settings(health.getInterval(), health.getInitialDelay(),
            health.getCpuWarningPercent(), health.getMemoryWarningBytes());
        return new HealthMonitor(supervisor, store, locks, stateMachine, heartbeatStrategy, settings, clock);
    }

    @Bean(destroyMethod = "close")
    public LifecycleMetrics lifecycleMetrics(MeterRegistry registry, InstanceStore store, LifecycleEventBus bus) {
        LifecycleMetrics metrics = new LifecycleMetrics(registry, store);
        metrics.bind(bus);
        return metrics;
    }

    @Bean(destroyMethod = "close")
    public LifecycleManager lifecycleManager(TypeCatalog catalog,
                                             InstanceStore store,
                                             ProcessSupervisor supervisor,
                                             HealthMonitor healthMonitor,
                                             LifecycleStateMachine stateMachine,
                                             ConfigChangeRouter configChangeRouter,
                                             InstanceLockTable locks,
                                             HeartbeatTracker heartbeatTracker,
                                             ReloadNotifier reloadNotifier,
                                             LifecycleEventBus bus,
                                             LifecycleMetrics metrics,
                                             ObjectMapper mapper,
                                             ConnectorDaemonProperties properties,
                                             Clock clock) {
        ConnectorDaemonProperties.Process process = properties.getProcess();
        LifecycleManager.Settings settings = new LifecycleManager.Settings(process.getDaemonUrl(),
            process.getStopTimeout(), process.getKillTimeout(), properties.getShutdown().getDeadline());
        return new LifecycleManager(catalog, store, supervisor, healthMonitor, stateMachine, configChangeRouter,
            locks, heartbeatTracker, reloadNotifier, bus, metrics, mapper, settings, clock);
    }

    @Bean
    public InstanceReconciler instanceReconciler(LifecycleManager manager,
                                                 InstanceStore store,
                                                 ConnectorDaemonProperties properties) {
        return new InstanceReconciler(manager, store, properties.isAutoStartOnBoot());
    }

    @Bean
    public ApplicationRunner connectorBootstrap(TypeCatalog catalog, InstanceReconciler reconciler) {
        return args -> {
            catalog.discover();
            reconciler.reconcile();
        };
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "linch-mind.daemon.restart-policy.enabled", havingValue = "true")
    public CrashRestartPolicy crashRestartPolicy(LifecycleManager manager,
                                                 LifecycleEventBus bus,
                                                 ConnectorDaemonProperties properties) {
        ConnectorDaemonProperties.RestartPolicy policy = properties.getRestartPolicy();
        CrashRestartPolicy restarts = new CrashRestartPolicy(manager, policy.getMaxAttempts(), policy.getBackoff(),
            policy.getMaxBackoff());
        restarts.bind(bus);
        return restarts;
    }
}
