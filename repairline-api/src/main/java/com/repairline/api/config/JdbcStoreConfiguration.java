package com.repairline.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.repository.CheckpointRepository;
import com.repairline.core.repository.ExecutionRepository;
import com.repairline.core.repository.IdempotencyRepository;
import com.repairline.core.repository.LockRepository;
import com.repairline.core.repository.WorkflowDefinitionRepository;
import com.repairline.engine.persistence.jdbc.JdbcCheckpointRepository;
import com.repairline.engine.persistence.jdbc.JdbcExecutionRepository;
import com.repairline.engine.persistence.jdbc.JdbcIdempotencyRepository;
import com.repairline.engine.persistence.jdbc.JdbcLockRepository;
import com.repairline.engine.persistence.jdbc.JdbcWorkflowDefinitionRepository;
import com.repairline.worker.broker.JdbcMessageBroker;
import com.repairline.worker.broker.MessageBroker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * PostgreSQL-backed stores, enabled with {@code repairline.store=jdbc}.
 * The schema scripts are idempotent and run on every startup.
 */
@Configuration
@ConditionalOnProperty(name = "repairline.store", havingValue = "jdbc")
public class JdbcStoreConfiguration {

    static final String ENGINE_SCHEMA = "db/repairline-schema.sql";
    static final String WORKER_SCHEMA = "db/repairline-worker-schema.sql";

    @Bean
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties dataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    public DataSource dataSource(DataSourceProperties properties) {
        return properties.initializeDataSourceBuilder().build();
    }

    @Bean
    public DataSourceInitializer schemaInitializer(DataSource dataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(
            new ClassPathResource(ENGINE_SCHEMA),
            new ClassPathResource(WORKER_SCHEMA));
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(populator);
        return initializer;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public IdempotencyRepository idempotencyRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcIdempotencyRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public LockRepository lockRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcLockRepository(jdbcTemplate);
    }

    @Bean
    public CheckpointRepository checkpointRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcCheckpointRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public WorkflowDefinitionRepository workflowDefinitionRepository(JdbcTemplate jdbcTemplate,
                                                                     ObjectMapper objectMapper) {
        return new JdbcWorkflowDefinitionRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public ExecutionRepository executionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcExecutionRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public MessageBroker messageBroker(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        return new JdbcMessageBroker(jdbcTemplate, objectMapper, clock);
    }
}
