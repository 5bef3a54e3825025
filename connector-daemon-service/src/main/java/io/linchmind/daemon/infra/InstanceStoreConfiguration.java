package io.linchmind.daemon.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.linchmind.daemon.domain.InstanceStore;
import java.nio.file.Path;
import java.time.Clock;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Selects the {@link InstanceStore} backend from {@code linch-mind.store.sink}.
 */
@Configuration
public class InstanceStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(InstanceStoreConfiguration.class);

    @Bean
    @ConditionalOnProperty(name = "linch-mind.store.sink", havingValue = "file", matchIfMissing = true)
    public InstanceStore fileInstanceStore(ObjectMapper mapper,
                                           Clock clock,
                                           @Value("${linch-mind.store.file.dir}") String dir) {
        if (dir == null || dir.isBlank()) {
            throw new IllegalArgumentException("linch-mind.store.file.dir must not be blank");
        }
        return new FileInstanceStore(mapper, Path.of(dir), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "linch-mind.store.sink", havingValue = "memory")
    public InstanceStore inMemoryInstanceStore(Clock clock) {
        log.warn("using in-memory instance store; instances are lost when the daemon stops");
        return new InMemoryInstanceStore(clock);
    }

    @Configuration
    @ConditionalOnProperty(name = "linch-mind.store.sink", havingValue = "postgres")
    static class Postgres {

        @Bean
        DataSource instanceStoreDataSource(@Value("${linch-mind.store.postgres.url}") String url,
                                           @Value("${linch-mind.store.postgres.username}") String username,
                                           @Value("${linch-mind.store.postgres.password}") String password) {
            DataSource dataSource = new DriverManagerDataSource(url, username, password);
            Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration")
                .load()
                .migrate();
            log.info("instance store schema migrated at {}", url);
            return dataSource;
        }

        @Bean
        InstanceStore postgresInstanceStore(DataSource instanceStoreDataSource, ObjectMapper mapper, Clock clock) {
            return new PostgresInstanceStore(new JdbcTemplate(instanceStoreDataSource), mapper, clock);
        }
    }
}
