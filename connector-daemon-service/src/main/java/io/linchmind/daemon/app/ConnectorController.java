package io.linchmind.daemon.app;

import io.linchmind.connector.model.ConnectorState;
import io.linchmind.connector.model.ConnectorType;
import io.linchmind.daemon.domain.ConfigUpdateResult;
import io.linchmind.daemon.domain.CreatedInstance;
import io.linchmind.daemon.domain.DeleteResult;
import io.linchmind.daemon.domain.InstanceDetail;
import io.linchmind.daemon.domain.StateSummary;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the connector lifecycle. Thin: every endpoint delegates to {@link LifecycleManager}
 * and typed failures are rendered by {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/connectors")
public class ConnectorController {

    private static final Logger log = LoggerFactory.getLogger(ConnectorController.class);

    private final LifecycleManager lifecycle;

    public ConnectorController(LifecycleManager lifecycle) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
    }

    @PostMapping("/discover")
    public List<ConnectorType> discover() {
        log.info("[REST] discover connector types");
        return lifecycle.discoverConnectors();
    }

    @GetMapping("/types")
    public List<ConnectorType> types() {
        return lifecycle.listTypes();
    }

    @PostMapping("/instances")
    public ResponseEntity<CreatedInstance> create(@Valid @RequestBody ConnectorRequests.CreateInstance request) {
        log.info("[REST] create instance type={} template={}", request.typeId(), request.templateId());
        CreatedInstance created = lifecycle.createInstance(request.typeId(), request.displayName(),
            request.config() == null ? Map.of() : request.config(),
            Boolean.TRUE.equals(request.autoStart()), request.templateId());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/instances")
    public List<InstanceSummary> list(@RequestParam(name = "type_id", required = false) String typeId,
                                      @RequestParam(name = "state", required = false) ConnectorState state) {
        return lifecycle.listInstances(typeId, state).stream().map(InstanceSummary::from).toList();
    }

    @GetMapping("/instances/{id}")
    public InstanceDetail get(@PathVariable("id") String id) {
        return lifecycle.getInstance(id);
    }

    @DeleteMapping("/instances/{id}")
    public DeleteResult delete(@PathVariable("id") String id,
                               @RequestParam(name = "force", defaultValue = "false") boolean force) {
        log.info("[REST] delete instance={} force={}", id, force);
        return lifecycle.deleteInstance(id, force);
    }

    @PostMapping("/instances/{id}/start")
    public StateResponse start(@PathVariable("id") String id) {
        log.info("[REST] start instance={}", id);
        return new StateResponse(id, lifecycle.startInstance(id));
    }

    @PostMapping("/instances/{id}/stop")
    public StateResponse stop(@PathVariable("id") String id,
                              @RequestParam(name = "force", defaultValue = "false") boolean force) {
        log.info("[REST] stop instance={} force={}", id, force);
        return new StateResponse(id, lifecycle.stopInstance(id, force));
    }

    @PostMapping("/instances/{id}/restart")
    public StateResponse restart(@PathVariable("id") String id) {
        log.info("[REST] restart instance={}", id);
        return new StateResponse(id, lifecycle.restartInstance(id));
    }

    @PutMapping("/instances/{id}/config")
    public ConfigUpdateResult updateConfig(@PathVariable("id") String id, @RequestBody Map<String, Object> config) {
        log.info("[REST] update config instance={}", id);
        return lifecycle.updateConfig(id, config);
    }

    @GetMapping("/instances/{id}/config")
    public LifecycleManager.ConnectorConfigView config(@PathVariable("id") String id) {
        return lifecycle.getConnectorConfig(id);
    }

    @PostMapping("/instances/{id}/config/ack")
    public ResponseEntity<Map<String, Object>> acknowledgeConfig(@PathVariable("id") String id,
                                                                 @Valid @RequestBody ConnectorRequests.ConfigAck ack) {
        boolean accepted = lifecycle.acknowledgeConfig(id, ack.configVersion());
        Map<String, Object> body = Map.of("instanceId", id, "configVersion", ack.configVersion(), "accepted", accepted);
        return accepted ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @PostMapping("/instances/{id}/heartbeat")
    public ResponseEntity<Void> heartbeat(@PathVariable("id") String id,
                                          @RequestBody(required = false) ConnectorRequests.Heartbeat heartbeat) {
        long ingested = heartbeat == null || heartbeat.ingested() == null ? 0L : heartbeat.ingested();
        lifecycle.recordHeartbeat(id, ingested);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/instances/batch/start")
    public Map<String, Boolean> batchStart(@Valid @RequestBody ConnectorRequests.Batch request) {
        log.info("[REST] batch start {}", request.instanceIds());
        return lifecycle.batchStart(request.instanceIds());
    }

    @PostMapping("/instances/batch/stop")
    public Map<String, Boolean> batchStop(@Valid @RequestBody ConnectorRequests.Batch request) {
        boolean force = Boolean.TRUE.equals(request.force());
        log.info("[REST] batch stop {} force={}", request.instanceIds(), force);
        return lifecycle.batchStop(request.instanceIds(), force);
    }

    @GetMapping("/states")
    public StateSummary states() {
        return lifecycle.getAllStates();
    }

    @PostMapping("/shutdown")
    public Map<String, ConnectorState> shutdown() {
        log.info("[REST] shutdown all instances");
        return lifecycle.shutdownAll();
    }

    public record StateResponse(String instanceId, ConnectorState state) {
    }
}
