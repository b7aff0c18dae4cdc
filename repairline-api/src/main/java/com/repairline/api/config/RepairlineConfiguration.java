package com.repairline.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.repository.CheckpointRepository;
import com.repairline.core.repository.ExecutionRepository;
import com.repairline.core.repository.IdempotencyRepository;
import com.repairline.core.repository.LockRepository;
import com.repairline.core.repository.WorkflowDefinitionRepository;
import com.repairline.engine.agent.Agent;
import com.repairline.engine.agent.AgentRegistry;
import com.repairline.engine.checkpoint.CheckpointManager;
import com.repairline.engine.coordinator.OrchestrationCoordinator;
import com.repairline.engine.hooks.ExecutionHook;
import com.repairline.engine.hooks.HookRunner;
import com.repairline.engine.idempotency.IdempotencyManager;
import com.repairline.engine.lock.DistributedLockManager;
import com.repairline.engine.metrics.EngineMetrics;
import com.repairline.worker.WorkerMetrics;
import com.repairline.worker.WorkerProcessor;
import com.repairline.worker.broker.MessageBroker;
import com.repairline.worker.broker.PullConsumer;
import com.repairline.worker.handler.BuiltInHandlers;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the engine and worker. Repositories and the broker come from
 * {@link MemoryStoreConfiguration} or {@link JdbcStoreConfiguration}.
 * Agents and hooks declared as beans are registered at startup.
 */
@Configuration
public class RepairlineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RepairlineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EngineMetrics engineMetrics(MeterRegistry meterRegistry) {
        return new EngineMetrics(meterRegistry);
    }

    @Bean
    public WorkerMetrics workerMetrics(MeterRegistry meterRegistry) {
        return new WorkerMetrics(meterRegistry);
    }

    // ========== Engine ==========

    @Bean
    public IdempotencyManager idempotencyManager(IdempotencyRepository repository, EngineProperties properties,
                                                 EngineMetrics metrics, Clock clock) {
        return new IdempotencyManager(repository, properties.toIdempotencyTtl(), metrics, clock);
    }

    @Bean
    public DistributedLockManager distributedLockManager(LockRepository repository, EngineMetrics metrics,
                                                         Clock clock) {
        return new DistributedLockManager(repository, metrics, clock);
    }

    @Bean
    public CheckpointManager checkpointManager(CheckpointRepository repository, Clock clock) {
        return new CheckpointManager(repository, clock);
    }

    @Bean
    public AgentRegistry agentRegistry(ObjectProvider<Agent> agents) {
        AgentRegistry registry = new AgentRegistry();
        List<Agent> declared = agents.orderedStream().toList();
        declared.forEach(registry::register);
        log.info("Registered {} agents", declared.size());
        return registry;
    }

    @Bean
    public HookRunner hookRunner(ObjectProvider<ExecutionHook> hooks) {
        HookRunner runner = new HookRunner();
        hooks.orderedStream().forEach(runner::register);
        return runner;
    }

    @Bean
    public OrchestrationCoordinator orchestrationCoordinator(
            WorkflowDefinitionRepository workflowRepository,
            ExecutionRepository executionRepository,
            AgentRegistry agentRegistry,
            HookRunner hookRunner,
            EngineProperties properties,
            EngineMetrics metrics,
            Clock clock) {
        return new OrchestrationCoordinator(workflowRepository, executionRepository, agentRegistry,
            hookRunner, properties.toEngineSettings(), metrics, clock);
    }

    // ========== Worker ==========

    @Bean
    public WorkerProcessor workerProcessor(
            IdempotencyManager idempotency,
            DistributedLockManager locks,
            CheckpointManager checkpoints,
            OrchestrationCoordinator coordinator,
            ObjectMapper objectMapper,
            WorkerProperties workerProperties,
            EngineProperties engineProperties,
            WorkerMetrics metrics,
            Clock clock) {
        WorkerProcessor processor = new WorkerProcessor(idempotency, locks, checkpoints, objectMapper,
            workerProperties.toSettings(engineProperties.getIdempotency().getTtlSeconds()), metrics, clock);
        BuiltInHandlers.register(processor, coordinator, clock);
        return processor;
    }

    @Bean
    @ConditionalOnProperty(name = "repairline.worker.mode", havingValue = "pull")
    public PullConsumer pullConsumer(MessageBroker broker, WorkerProcessor processor) {
        return new PullConsumer(broker, processor);
    }
}
