package io.linchmind.daemon.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.daemon.domain.InstanceStore;
import io.linchmind.daemon.domain.InstanceUpdate;
import io.linchmind.daemon.domain.StoreUnavailableException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link InstanceStore} on the {@code connector_instance} table. Each call is a single statement,
 * so per-row atomicity comes from Postgres; conditional updates carry the expected state in the
 * {@code WHERE} clause.
 */
public class PostgresInstanceStore implements InstanceStore {

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {
    };
    private static final String COLUMNS = """
        instance_id, type_id, display_name, config, enabled, auto_start, state, process_id,
        last_heartbeat, error_message, data_count, created_at, updated_at
        """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final RowMapper<ConnectorInstance> rowMapper = this::mapRow;

    public PostgresInstanceStore(JdbcTemplate jdbc, ObjectMapper mapper, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String create(ConnectorInstance instance) {
        Objects.requireNonNull(instance, "instance");
        try {
            jdbc.update("INSERT INTO connector_instance (" + COLUMNS + ") VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                instance.instanceId(),
                instance.typeId(),
                instance.displayName(),
                toJson(instance.config()),
                instance.enabled(),
                instance.autoStart(),
                instance.state().name(),
                instance.processId(),
                timestamp(instance.lastHeartbeat()),
                instance.errorMessage(),
                instance.dataCount(),
                timestamp(instance.createdAt()),
                timestamp(instance.updatedAt()));
            return instance.instanceId();
        } catch (DuplicateKeyException e) {
            throw new IllegalArgumentException("instance " + instance.instanceId() + " already exists", e);
        } catch (DataAccessException e) {
            throw unavailable("create " + instance.instanceId(), e);
        }
    }

    @Override
    public Optional<ConnectorInstance> get(String instanceId) {
        try {
            List<ConnectorInstance> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM connector_instance WHERE instance_id = ?", rowMapper, instanceId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw unavailable("read " + instanceId, e);
        }
    }

    @Override
    public boolean update(String instanceId, InstanceUpdate update) {
        StringBuilder sql = new StringBuilder("UPDATE connector_instance SET updated_at = ?");
        List<Object> args = new ArrayList<>();
        args.add(timestamp(clock.instant()));
        if (update.setsState()) {
            sql.append(", state = ?");
            args.add(update.state().name());
        }
        if (update.setsProcessId()) {
            sql.append(", process_id = ?");
            args.add(update.processId());
        }
        if (update.setsLastHeartbeat()) {
            sql.append(", last_heartbeat = ?");
            args.add(timestamp(update.lastHeartbeat()));
        }
        if (update.setsErrorMessage()) {
            sql.append(", error_message = ?");
            args.add(update.errorMessage());
        }
        if (update.config() != null) {
            sql.append(", config = ?::jsonb");
            args.add(toJson(update.config()));
        }
        if (update.enabled() != null) {
            sql.append(", enabled = ?");
            args.add(update.enabled());
        }
        if (update.dataCountDelta() > 0) {
            sql.append(", data_count = data_count + ?");
            args.add(update.dataCountDelta());
        }
        sql.append(" WHERE instance_id = ?");
        args.add(instanceId);
        if (update.expectedState() != null) {
            sql.append(" AND state = ?");
            args.add(update.expectedState().name());
        }
        try {
            return jdbc.update(sql.toString(), args.toArray()) == 1;
        } catch (DataAccessException e) {
            throw unavailable("update " + instanceId, e);
        }
    }

    @Override
    public boolean delete(String instanceId) {
        try {
            return jdbc.update("DELETE FROM connector_instance WHERE instance_id = ?", instanceId) == 1;
        } catch (DataAccessException e) {
            throw unavailable("delete " + instanceId, e);
        }
    }

    @Override
    public List<ConnectorInstance> list(String typeId, ConnectorState state) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM connector_instance WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (typeId != null) {
            sql.append(" AND type_id = ?");
            args.add(typeId);
        }
        if (state != null) {
            sql.append(" AND state = ?");
            args.add(state.name());
        }
        sql.append(" ORDER BY created_at, instance_id");
        try {
            return jdbc.query(sql.toString(), rowMapper, args.toArray());
        } catch (DataAccessException e) {
            throw unavailable("list", e);
        }
    }

    private ConnectorInstance mapRow(ResultSet rs, int rowNum) throws SQLException {
        long pid = rs.getLong("process_id");
        Long processId = rs.wasNull() ? null : pid;
        return new ConnectorInstance(
            rs.getString("instance_id"),
            rs.getString("type_id"),
            rs.getString("display_name"),
            fromJson(rs.getString("config")),
            rs.getBoolean("enabled"),
            rs.getBoolean("auto_start"),
            ConnectorState.valueOf(rs.getString("state")),
            processId,
            instant(rs.getTimestamp("last_heartbeat")),
            rs.getString("error_message"),
            rs.getLong("data_count"),
            instant(rs.getTimestamp("created_at")),
            instant(rs.getTimestamp("updated_at")));
    }

    private String toJson(Map<String, Object> config) {
        try {
            return mapper.writeValueAsString(config == null ? Map.of() : config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("config is not serialisable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> fromJson(String json) throws SQLException {
        if (json == null) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, CONFIG_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("stored config is not valid JSON", e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static StoreUnavailableException unavailable(String operation, DataAccessException e) {
        return new StoreUnavailableException("instance store unavailable during " + operation + ": "
            + e.getMostSpecificCause().getMessage(), e);
    }
}
