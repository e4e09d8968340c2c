package com.hivemind.core.store;

import com.hivemind.core.config.HivemindProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Provides the {@link TaskStore} bean.
 * <p>
 * With {@code hivemind.store.type=jdbc} a {@link JdbcTaskStore} backed by PostgreSQL
 * is created and its tables are ensured on startup. Otherwise an
 * {@link InMemoryTaskStore} is used; it is not durable across restarts.
 */
@Configuration
public class TaskStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "hivemind.store", name = "type", havingValue = "jdbc")
    public DataSource taskStoreDataSource(HivemindProperties properties) {
        var store = properties.getStore();
        if (store.getJdbcUrl() == null || store.getJdbcUrl().isBlank()) {
            throw new IllegalStateException("hivemind.store.jdbc-url is required when hivemind.store.type=jdbc");
        }
        return DataSourceBuilder.create()
                .url(store.getJdbcUrl())
                .username(store.getUsername())
                .password(store.getPassword())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "hivemind.store", name = "type", havingValue = "jdbc")
    public TaskStore jdbcTaskStore(DataSource taskStoreDataSource, Clock clock) throws Exception {
        log.info("Configuring JDBC task store (PostgreSQL)");
        var store = new JdbcTaskStore(taskStoreDataSource, clock);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(TaskStore.class)
    public TaskStore inMemoryTaskStore(Clock clock) {
        log.info("Using in-memory task store (state will not persist across restarts)");
        return new InMemoryTaskStore(clock);
    }
}
