package io.linchmind.daemon.infra;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.json.JsonMapper;
import io.linchmind.daemon.domain.InstanceStore;
import java.time.Clock;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class PostgresInstanceStoreTest extends InstanceStoreContract {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
        new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("linchmind")
            .withUsername("linchmind")
            .withPassword("linchmind");

    private static JdbcTemplate jdbc;
    private PostgresInstanceStore store;

    @BeforeAll
    static void migrate() {
        DriverManagerDataSource dataSource =
            new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        Flyway.configure().dataSource(dataSource).locations("classpath:db/migration").load().migrate();
        jdbc = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbc.update("DELETE FROM connector_instance");
        store = new PostgresInstanceStore(jdbc, JsonMapper.builder().findAndAddModules().build(), Clock.systemUTC());
    }

    @Override
    protected InstanceStore store() {
        return store;
    }

    @Test
    void schemaRejectsProcessIdOutsideActiveStates() {
        Integer constraints = jdbc.queryForObject(
            "SELECT COUNT(*) FROM pg_constraint WHERE conname = 'connector_instance_pid_chk'", Integer.class);

        assertThat(constraints).isEqualTo(1);
    }
}
