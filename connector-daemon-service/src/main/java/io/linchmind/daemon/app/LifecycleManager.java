package io.linchmind.daemon.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.ConnectorType;
import io.linchmind.connector.model.Documents;
import io.linchmind.connector.model.InstanceTemplate;
import io.linchmind.connector.model.LifecycleEvent;
import io.linchmind.daemon.domain.ConfigUpdateResult;
import io.linchmind.daemon.domain.ConnectorLifecycleException;
import io.linchmind.daemon.domain.CreatedInstance;
import io.linchmind.daemon.domain.DeleteResult;
import io.linchmind.daemon.domain.InstanceDetail;
import io.linchmind.daemon.domain.InstanceLockTable;
import io.linchmind.daemon.domain.InstanceStore;
import io.linchmind.daemon.domain.InstanceUpdate;
import io.linchmind.daemon.domain.LifecycleError;
import io.linchmind.daemon.domain.LifecycleEventPublisher;
import io.linchmind.daemon.domain.LifecycleStateMachine;
import io.linchmind.daemon.domain.StateSummary;
import io.linchmind.process.ProcessSupervisor;
import io.linchmind.process.SpawnFailedException;
import io.linchmind.process.SpawnRequest;
import io.linchmind.process.SupervisedProcess;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates connector instances: creation against the type catalogue, process start and stop,
 * restart, deletion, configuration changes, batch operations and shutdown.
 * <p>
 * Every mutation of an instance runs under that instance's lock from {@link InstanceLockTable};
 * operations on different instances never wait for each other. Creation additionally takes the
 * lock of the type so instance limits cannot be raced.
 */
public class LifecycleManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    public static final String ENV_CONNECTOR_ID = "LINCH_MIND_CONNECTOR_ID";
    public static final String ENV_CONNECTOR_TYPE = "LINCH_MIND_CONNECTOR_TYPE";
    public static final String ENV_DAEMON_URL = "LINCH_MIND_DAEMON_URL";
    public static final String ENV_CONFIG_URL = "LINCH_MIND_CONFIG_URL";
    public static final String ENV_CONNECTOR_CONFIG = "LINCH_MIND_CONNECTOR_CONFIG";
    static final String NOT_FOUND_AFTER_RESTART = "process not found after daemon restart";
    static final String KILL_FAILED = "process did not exit after forced kill";

    private final TypeCatalog catalog;
    private final InstanceStore store;
    private final ProcessSupervisor supervisor;
    private final HealthMonitor health;
    private final LifecycleStateMachine stateMachine;
    private final ConfigChangeRouter configRouter;
    private final InstanceLockTable locks;
    private final HeartbeatTracker heartbeats;
    private final ReloadNotifier reloads;
    private final LifecycleEventPublisher events;
    private final LifecycleMetrics metrics;
    private final ObjectMapper mapper;
    private final Settings settings;
    private final Clock clock;
    private final ExecutorService workers;
    private final AtomicBoolean acceptingStarts = new AtomicBoolean(true);
    private final AtomicBoolean closed = new AtomicBoolean();

    public record Settings(String daemonUrl, Duration stopTimeout, Duration killTimeout, Duration shutdownDeadline) {
        public Settings {
            Objects.requireNonNull(daemonUrl, "daemonUrl");
            Objects.requireNonNull(stopTimeout, "stopTimeout");
            Objects.requireNonNull(killTimeout, "killTimeout");
            Objects.requireNonNull(shutdownDeadline, "shutdownDeadline");
        }
    }

    public LifecycleManager(TypeCatalog catalog,
                            InstanceStore store,
                            ProcessSupervisor supervisor,
                            HealthMonitor health,
                            LifecycleStateMachine stateMachine,
                            ConfigChangeRouter configRouter,
                            InstanceLockTable locks,
                            HeartbeatTracker heartbeats,
                            ReloadNotifier reloads,
                            LifecycleEventPublisher events,
                            LifecycleMetrics metrics,
                            ObjectMapper mapper,
                            Settings settings,
                            Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.store = Objects.requireNonNull(store, "store");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.health = Objects.requireNonNull(health, "health");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.configRouter = Objects.requireNonNull(configRouter, "configRouter");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.heartbeats = Objects.requireNonNull(heartbeats, "heartbeats");
        this.reloads = Objects.requireNonNull(reloads, "reloads");
        this.events = Objects.requireNonNull(events, "events");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.workers = Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger sequence = new AtomicInteger();

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "lifecycle-worker-" + sequence.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    public List<ConnectorType> discoverConnectors() {
        return catalog.discover();
    }

    public List<ConnectorType> listTypes() {
        return catalog.all();
    }

    public CreatedInstance createInstance(String typeId,
                                          String displayName,
                                          Map<String, Object> config,
                                          boolean autoStart,
                                          String templateId) {
        ConnectorType type = catalog.get(typeId).orElseThrow(() -> ConnectorLifecycleException.invalidType(typeId));
        Map<String, Object> effective = effectiveConfig(type, config, templateId);
        ConfigValidator.validate(type, effective);

        String instanceId = locks.withLock(InstanceLockTable.typeKey(type.typeId()), () -> {
            int existing = store.list(type.typeId(), null).size();
            if (existing >= type.instanceLimit()) {
                String reason = type.supportsMultipleInstances()
                    ? "type " + type.typeId() + " allows at most " + type.instanceLimit() + " instances"
                    : "type " + type.typeId() + " does not support multiple instances";
                log.info("create rejected: {}", reason);
                throw new ConnectorLifecycleException(LifecycleError.INSTANCE_LIMIT_EXCEEDED, reason);
            }
            String id = newInstanceId(type.typeId());
            String name = displayName == null || displayName.isBlank() ? type.displayName() : displayName;
            return store.create(ConnectorInstance.configured(id, type.typeId(), name, effective, autoStart,
                clock.instant()));
        });
        log.info("created instance {} type={} autoStart={}", instanceId, type.typeId(), autoStart);

        if (autoStart) {
            try {
                startInstance(instanceId);
            } catch (ConnectorLifecycleException e) {
                log.warn("auto-start of instance {} failed: {}", instanceId, e.getMessage());
            }
        }
        ConnectorState state = store.get(instanceId).map(ConnectorInstance::state).orElse(ConnectorState.CONFIGURED);
        return new CreatedInstance(instanceId, state);
    }

    public DeleteResult deleteInstance(String instanceId, boolean force) {
        return locks.withLock(instanceId, () -> {
            ConnectorInstance current = require(instanceId);
            boolean wasRunning = current.state().isActive() || supervisor.retained(instanceId).isPresent();
            if (wasRunning && !force) {
                log.info("delete rejected: instance {} is {}", instanceId, current.state());
                throw new ConnectorLifecycleException(LifecycleError.STILL_RUNNING,
                    "instance " + instanceId + " is " + current.state() + "; stop it first or delete with force");
            }
            if (wasRunning) {
                ConnectorState stopped = stop(current, true);
                if (stopped == ConnectorState.ERROR) {
                    throw new ConnectorLifecycleException(LifecycleError.STILL_RUNNING,
                        "instance " + instanceId + " could not be stopped");
                }
            }
            health.forget(instanceId);
            heartbeats.forget(instanceId);
            reloads.forget(instanceId);
            if (!store.delete(instanceId)) {
                throw ConnectorLifecycleException.notFound(instanceId);
            }
            events.publish(new LifecycleEvent(instanceId, current.typeId(),
                wasRunning ? ConnectorState.STOPPED : current.state(), ConnectorState.UNINSTALLED, null, clock.instant()));
            locks.forget(instanceId);
            log.info("deleted instance {} wasRunning={}", instanceId, wasRunning);
            return new DeleteResult(instanceId, wasRunning);
        });
    }

    public ConnectorState startInstance(String instanceId) {
        rejectDuringShutdown(instanceId);
        return locks.withLock(instanceId, () -> {
            rejectDuringShutdown(instanceId);
            ConnectorInstance current = require(instanceId);
            if (!current.state().isStartable()) {
                log.info("start rejected: instance {} is {}", instanceId, current.state());
                throw ConnectorLifecycleException.invalidTransition(instanceId, "start", current.state());
            }
            ConnectorType type = catalog.get(current.typeId())
                .orElseThrow(() -> ConnectorLifecycleException.invalidType(current.typeId()));

            killRetained(instanceId);
            health.unwatch(instanceId);
            heartbeats.forget(instanceId);

            SupervisedProcess process;
            try {
                process = supervisor.start(spawnRequest(current, type));
            } catch (SpawnFailedException e) {
                metrics.recordSpawnFailure(type.typeId());
                stateMachine.transition(current, ConnectorState.ERROR, e.getMessage(), InstanceUpdate.builder());
                throw new ConnectorLifecycleException(LifecycleError.SPAWN_FAILED, e.getMessage(), e);
            }
            ConnectorInstance starting;
            try {
                starting = stateMachine.transition(current, ConnectorState.STARTING, null,
                    InstanceUpdate.builder().processId(process.pid()).lastHeartbeat(null));
            } catch (RuntimeException e) {
                supervisor.stop(process, false, Duration.ZERO);
                throw e;
            }
            health.watch(instanceId, process, type.healthCheck());
            return starting.state();
        });
    }

    /**
     * Stops an instance. Stopping an instance that owns no process is a no-op success.
     *
     * @param force skip the graceful phase and kill at once
     * @return the resulting state: STOPPED, or ERROR when the process survived a forced kill
     */
    public ConnectorState stopInstance(String instanceId, boolean force) {
        return locks.withLock(instanceId, () -> stop(require(instanceId), force));
    }

    /**
     * Stop then start under one lock hold. The first failure is propagated.
     */
    public ConnectorState restartInstance(String instanceId) {
        rejectDuringShutdown(instanceId);
        return locks.withLock(instanceId, () -> {
            ConnectorState stopped = stop(require(instanceId), false);
            if (stopped == ConnectorState.ERROR) {
                throw new ConnectorLifecycleException(LifecycleError.STILL_RUNNING,
                    "instance " + instanceId + " did not stop; restart aborted");
            }
            return startInstance(instanceId);
        });
    }

    private ConnectorState stop(ConnectorInstance current, boolean force) {
        String instanceId = current.instanceId();
        heartbeats.forget(instanceId);
        switch (current.state()) {
            case CONFIGURED, STOPPED -> {
                return current.state();
            }
            case ERROR -> {
                health.unwatch(instanceId);
                Optional<SupervisedProcess> retained = supervisor.retained(instanceId);
                if (retained.isPresent() && !supervisor.stop(retained.get(), !force, settings.stopTimeout())) {
                    stateMachine.transition(current, ConnectorState.ERROR, KILL_FAILED, InstanceUpdate.builder());
                    return ConnectorState.ERROR;
                }
                return stateMachine.transition(current, ConnectorState.STOPPED).state();
            }
            case STARTING, RUNNING, STOPPING -> {
                health.unwatch(instanceId);
                ConnectorInstance stopping = current.state() == ConnectorState.STOPPING
                    ? current
                    : stateMachine.transition(current, ConnectorState.STOPPING);
                SupervisedProcess process = supervisor.retained(instanceId)
                    .orElseGet(() -> new SupervisedProcess(instanceId, current.processId(), null, clock.instant()));
                if (supervisor.stop(process, !force, settings.stopTimeout())) {
                    return stateMachine.transition(stopping, ConnectorState.STOPPED).state();
                }
                return stateMachine.transition(stopping, ConnectorState.ERROR, KILL_FAILED, InstanceUpdate.builder())
                    .state();
            }
            default -> throw new IllegalStateException("unexpected state " + current.state());
        }
    }

    private void killRetained(String instanceId) {
        Optional<SupervisedProcess> retained = supervisor.retained(instanceId);
        if (retained.isPresent()) {
            log.info("instance {} still has process {}; killing it before start", instanceId, retained.get().pid());
            if (!supervisor.stop(retained.get(), false, Duration.ZERO)) {
                throw new ConnectorLifecycleException(LifecycleError.STILL_RUNNING,
                    "previous process " + retained.get().pid() + " of instance " + instanceId + " did not exit");
            }
        }
    }

    /**
     * Starts all {@code instanceIds} concurrently.
     *
     * @return per id, whether the instance is now STARTING or RUNNING
     */
    public Map<String, Boolean> batchStart(Collection<String> instanceIds) {
        return runBatch(instanceIds, id -> {
            ConnectorState state = startInstance(id);
            return state == ConnectorState.STARTING || state == ConnectorState.RUNNING;
        }, "start");
    }

    /**
     * @return per id, whether the instance ended stopped
     */
    public Map<String, Boolean> batchStop(Collection<String> instanceIds, boolean force) {
        return runBatch(instanceIds, id -> {
            ConnectorState state = stopInstance(id, force);
            return state == ConnectorState.STOPPED || state == ConnectorState.CONFIGURED;
        }, "stop");
    }

    private Map<String, Boolean> runBatch(Collection<String> instanceIds,
                                          Predicate<String> operation,
                                          String name) {
        Map<String, Future<Boolean>> futures = new LinkedHashMap<>();
        for (String id : instanceIds) {
            futures.putIfAbsent(id, workers.submit(() -> {
                try {
                    return operation.test(id);
                } catch (ConnectorLifecycleException e) {
                    log.info("batch {} of instance {} failed: {}", name, id, e.getMessage());
                    return false;
                }
            }));
        }
        Map<String, Boolean> results = new LinkedHashMap<>();
        futures.forEach((id, future) -> results.put(id, await(future, id, name)));
        return results;
    }

    private boolean await(Future<Boolean> future, String id, String name) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return false;
        } catch (ExecutionException e) {
            log.warn("batch {} of instance {} failed", name, id, e.getCause());
            return false;
        }
    }

    /**
     * Stops every instance concurrently. Starts are rejected until this returns; instances still
     * running at the deadline are killed.
     *
     * @return final state per instance
     */
    public Map<String, ConnectorState> shutdownAll() {
        return shutdownAll(true);
    }

    Map<String, ConnectorState> shutdownAll(boolean reopen) {
        acceptingStarts.set(false);
        try {
            List<ConnectorInstance> instances = store.list();
            log.info("shutting down {} instances (deadline {})", instances.size(), settings.shutdownDeadline());
            Instant deadline = clock.instant().plus(settings.shutdownDeadline());
            Map<String, Future<ConnectorState>> stops = new LinkedHashMap<>();
            for (ConnectorInstance instance : instances) {
                String id = instance.instanceId();
                stops.put(id, workers.submit(() -> stopInstance(id, false)));
            }
            Map<String, ConnectorState> results = new LinkedHashMap<>();
            for (Map.Entry<String, Future<ConnectorState>> entry : stops.entrySet()) {
                results.put(entry.getKey(), awaitStop(entry.getKey(), entry.getValue(), deadline));
            }
            log.info("shutdown finished: {}", results);
            return results;
        } finally {
            if (reopen && !closed.get()) {
                acceptingStarts.set(true);
            }
        }
    }

    private ConnectorState awaitStop(String instanceId, Future<ConnectorState> future, Instant deadline) {
        long remaining = Math.max(0L, Duration.between(clock.instant(), deadline).toMillis());
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            supervisor.retained(instanceId).ifPresent(process -> {
                log.warn("instance {} not stopped by the shutdown deadline, killing pid {}", instanceId, process.pid());
                supervisor.stop(process, false, Duration.ZERO);
            });
            try {
                return future.get(settings.killTimeout().toMillis() + settings.stopTimeout().toMillis(),
                    TimeUnit.MILLISECONDS);
            } catch (TimeoutException | ExecutionException again) {
                log.warn("instance {} stop did not complete after kill", instanceId);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
        } catch (ExecutionException e) {
            log.warn("stopping instance {} during shutdown failed: {}", instanceId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return store.get(instanceId).map(ConnectorInstance::state).orElse(ConnectorState.UNINSTALLED);
    }

    public boolean isShutdownInProgress() {
        return !acceptingStarts.get();
    }

    private void rejectDuringShutdown(String instanceId) {
        if (!acceptingStarts.get()) {
            log.info("start of instance {} rejected: shutdown in progress", instanceId);
            throw new ConnectorLifecycleException(LifecycleError.SHUTDOWN_IN_PROGRESS,
                "shutdown in progress; instance " + instanceId + " was not started");
        }
    }

    public ConfigUpdateResult updateConfig(String instanceId, Map<String, Object> config) {
        return locks.withLock(instanceId, () -> {
            ConnectorInstance current = require(instanceId);
            ConnectorType type = catalog.get(current.typeId()).orElse(null);
            ConfigValidator.validate(type, config);
            return configRouter.apply(current, type, config);
        });
    }

    public ConnectorConfigView getConnectorConfig(String instanceId) {
        ConnectorInstance instance = require(instanceId);
        ReloadNotifier.ReloadStatus status = reloads.status(instanceId);
        return new ConnectorConfigView(instance.instanceId(), instance.typeId(), instance.config(),
            status.configVersion(), status.reloadRequested());
    }

    public boolean acknowledgeConfig(String instanceId, long version) {
        require(instanceId);
        return reloads.acknowledge(instanceId, version);
    }

    /**
     * Liveness ping from a connector process, optionally reporting newly ingested items.
     */
    public void recordHeartbeat(String instanceId, long ingested) {
        require(instanceId);
        heartbeats.recordPing(instanceId);
        if (ingested > 0) {
            heartbeats.recordIngestion(instanceId);
            store.update(instanceId, InstanceUpdate.builder().incrementDataCount(ingested).build());
        }
    }

    public ConnectorState getInstanceState(String instanceId) {
        return require(instanceId).state();
    }

    public InstanceDetail getInstance(String instanceId) {
        ConnectorInstance instance = require(instanceId);
        String typeName = catalog.get(instance.typeId()).map(ConnectorType::displayName).orElse(null);
        ReloadNotifier.ReloadStatus status = reloads.status(instanceId);
        return new InstanceDetail(instance, typeName, supervisor.retained(instanceId).isPresent(),
            health.latestUsage(instanceId).orElse(null), status.configVersion(), status.reloadRequested());
    }

    public List<ConnectorInstance> listInstances(String typeId, ConnectorState state) {
        return store.list(typeId, state);
    }

    public List<ConnectorInstance> listRunningInstances() {
        return store.list(null, ConnectorState.RUNNING);
    }

    public StateSummary getAllStates() {
        Map<ConnectorState, Integer> distribution = new EnumMap<>(ConnectorState.class);
        for (ConnectorState state : ConnectorState.values()) {
            if (state != ConnectorState.UNINSTALLED) {
                distribution.put(state, 0);
            }
        }
        List<ConnectorInstance> all = store.list();
        for (ConnectorInstance instance : all) {
            distribution.merge(instance.state(), 1, Integer::sum);
        }
        return new StateSummary(all.size(), distribution.get(ConnectorState.RUNNING), distribution);
    }

    /**
     * Reconciles a record persisted by an earlier daemon run: its pid is adopted only when the
     * process is still alive and runs the type's executable.
     */
    public ConnectorState reconcileInstance(String instanceId) {
        return locks.withLock(instanceId, () -> {
            ConnectorInstance current = require(instanceId);
            if (!current.state().isActive() && current.processId() == null) {
                return current.state();
            }
            ConnectorType type = catalog.get(current.typeId()).orElse(null);
            String executable = type == null ? null : type.resolvedExecutable();
            Optional<SupervisedProcess> adopted = current.processId() == null
                ? Optional.empty()
                : supervisor.adopt(instanceId, current.processId(), executable);

            if (!current.state().isActive()) {
                adopted.ifPresent(process -> supervisor.stop(process, false, Duration.ZERO));
                store.update(instanceId, InstanceUpdate.builder().processId(null).build());
                return current.state();
            }
            if (adopted.isEmpty()) {
                return stateMachine.transition(current, ConnectorState.ERROR, NOT_FOUND_AFTER_RESTART,
                    InstanceUpdate.builder()).state();
            }
            if (current.state() == ConnectorState.STOPPING) {
                return stop(current, true);
            }
            log.info("re-adopted instance {} pid={} state={}", instanceId, current.processId(), current.state());
            health.watch(instanceId, adopted.get(), type == null || type.healthCheck());
            return current.state();
        });
    }

    private ConnectorInstance require(String instanceId) {
        return store.get(instanceId).orElseThrow(() -> ConnectorLifecycleException.notFound(instanceId));
    }

    private Map<String, Object> effectiveConfig(ConnectorType type, Map<String, Object> config, String templateId) {
        Map<String, Object> merged = type.defaultConfig();
        if (templateId != null && !templateId.isBlank()) {
            InstanceTemplate template = type.template(templateId);
            if (template == null) {
                throw ConnectorLifecycleException.configInvalid(
                    "type " + type.typeId() + " has no instance template " + templateId);
            }
            merged = Documents.merge(merged, template.config());
        }
        return Documents.merge(merged, config);
    }

    private String newInstanceId(String typeId) {
        String id;
        do {
            id = typeId + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (store.get(id).isPresent());
        return id;
    }

    private SpawnRequest spawnRequest(ConnectorInstance instance, ConnectorType type) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(ENV_CONNECTOR_ID, instance.instanceId());
        env.put(ENV_CONNECTOR_TYPE, instance.typeId());
        env.put(ENV_DAEMON_URL, settings.daemonUrl());
        env.put(ENV_CONFIG_URL, settings.daemonUrl() + "/api/connectors/instances/" + instance.instanceId() + "/config");
        try {
            env.put(ENV_CONNECTOR_CONFIG, mapper.writeValueAsString(instance.config()));
        } catch (JsonProcessingException e) {
            throw ConnectorLifecycleException.configInvalid(
                "config of instance " + instance.instanceId() + " is not serialisable: " + e.getOriginalMessage());
        }
        return new SpawnRequest(instance.instanceId(), type.resolvedExecutable(), type.entryPoint().args(), env,
            type.directory());
    }

    /**
     * Stops every instance and keeps rejecting starts; used when the daemon itself stops.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        shutdownAll(false);
        workers.shutdownNow();
    }

    /**
     * Configuration as served to the connector process.
     */
    public record ConnectorConfigView(String instanceId,
                                      String typeId,
                                      Map<String, Object> config,
                                      long configVersion,
                                      boolean reloadRequested) {
    }
}
