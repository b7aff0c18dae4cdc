package com.repairline.api.config;

import com.repairline.core.repository.CheckpointRepository;
import com.repairline.core.repository.ExecutionRepository;
import com.repairline.core.repository.IdempotencyRepository;
import com.repairline.core.repository.LockRepository;
import com.repairline.core.repository.WorkflowDefinitionRepository;
import com.repairline.engine.persistence.InMemoryCheckpointRepository;
import com.repairline.engine.persistence.InMemoryExecutionRepository;
import com.repairline.engine.persistence.InMemoryIdempotencyRepository;
import com.repairline.engine.persistence.InMemoryLockRepository;
import com.repairline.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.repairline.worker.broker.InMemoryMessageBroker;
import com.repairline.worker.broker.MessageBroker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single-process stores. State is lost on restart; used for local runs and tests.
 */
@Configuration
@ConditionalOnProperty(name = "repairline.store", havingValue = "memory", matchIfMissing = true)
public class MemoryStoreConfiguration {

    @Bean
    public IdempotencyRepository idempotencyRepository() {
        return new InMemoryIdempotencyRepository();
    }

    @Bean
    public LockRepository lockRepository() {
        return new InMemoryLockRepository();
    }

    @Bean
    public CheckpointRepository checkpointRepository() {
        return new InMemoryCheckpointRepository();
    }

    @Bean
    public WorkflowDefinitionRepository workflowDefinitionRepository() {
        return new InMemoryWorkflowDefinitionRepository();
    }

    @Bean
    public ExecutionRepository executionRepository() {
        return new InMemoryExecutionRepository();
    }

    @Bean
    public MessageBroker messageBroker(Clock clock) {
        return new InMemoryMessageBroker(clock);
    }
}
