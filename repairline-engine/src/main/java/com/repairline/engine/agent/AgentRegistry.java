package com.repairline.engine.agent;

import com.repairline.core.exception.AgentUnavailableException;
import com.repairline.core.exception.NotFoundException;
import com.repairline.core.model.AgentDescriptor;
import com.repairline.core.model.AgentPool;
import com.repairline.core.model.LoadBalancingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local registry of agents and agent pools.
 *
 * Tracks in-flight invocations per agent and bounds them by the agent's
 * {@code maxConcurrency}.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, RegisteredAgent> agents = new LinkedHashMap<>();
    private final Map<String, AgentPool> pools = new LinkedHashMap<>();
    private final AtomicLong agentCounter = new AtomicLong();
    private final AtomicLong poolCounter = new AtomicLong();

    // ========== Agents ==========

    /**
     * Register an agent under a newly assigned id ({@code agent_N}).
     *
     * @return the descriptor as stored, carrying the assigned id
     */
    public synchronized AgentDescriptor register(Agent agent) {
        String id = "agent_" + agentCounter.incrementAndGet();
        AgentDescriptor descriptor = agent.descriptor().withId(id);
        agents.put(id, new RegisteredAgent(agent, descriptor));
        log.info("Registered agent {} ({}) with capabilities {}",
            id, descriptor.name(), descriptor.capabilityNames());
        return descriptor;
    }

    /**
     * Remove the agent and its pool memberships.
     */
    public synchronized boolean unregister(String agentId) {
        RegisteredAgent removed = agents.remove(agentId);
        if (removed == null) {
            return false;
        }
        pools.replaceAll((id, pool) -> pool.withoutAgent(agentId));
        log.info("Unregistered agent {}", agentId);
        return true;
    }

    public synchronized Optional<AgentDescriptor> get(String agentId) {
        return Optional.ofNullable(agents.get(agentId)).map(RegisteredAgent::descriptor);
    }

    /**
     * All agents in registration order.
     */
    public synchronized List<AgentDescriptor> list() {
        return agents.values().stream().map(RegisteredAgent::descriptor).toList();
    }

    /**
     * Healthy agents exposing the capability, in registration order.
     */
    public synchronized List<AgentDescriptor> findByCapability(String capability) {
        return agents.values().stream()
            .map(RegisteredAgent::descriptor)
            .filter(AgentDescriptor::healthy)
            .filter(d -> d.hasCapability(capability))
            .toList();
    }

    public synchronized AgentDescriptor updateHealth(String agentId, boolean healthy) {
        RegisteredAgent registered = agents.get(agentId);
        if (registered == null) {
            throw new NotFoundException("Agent", agentId);
        }
        if (registered.descriptor().healthy() != healthy) {
            log.info("Agent {} is now {}", agentId, healthy ? "healthy" : "unhealthy");
        }
        registered.descriptor = registered.descriptor().withHealthy(healthy);
        return registered.descriptor();
    }

    /**
     * Number of invocations currently running on the agent.
     */
    public int inFlight(String agentId) {
        RegisteredAgent registered;
        synchronized (this) {
            registered = agents.get(agentId);
        }
        return registered == null ? 0 : registered.inFlight.get();
    }

    /**
     * Reserve one concurrency slot on the agent.
     *
     * @throws AgentUnavailableException if the agent is unknown or at its concurrency limit
     */
    public Reservation reserve(String agentId) {
        RegisteredAgent registered;
        synchronized (this) {
            registered = agents.get(agentId);
        }
        if (registered == null) {
            throw new AgentUnavailableException(agentId, "not registered");
        }
        if (!registered.permits.tryAcquire()) {
            throw new AgentUnavailableException(agentId, "at max concurrency");
        }
        registered.inFlight.incrementAndGet();
        return new Reservation(registered);
    }

    // ========== Pools ==========

    public synchronized AgentPool createPool(String name, List<String> agentIds, LoadBalancingStrategy strategy) {
        String id = "pool_" + poolCounter.incrementAndGet();
        List<String> members = new ArrayList<>();
        for (String agentId : agentIds == null ? List.<String>of() : agentIds) {
            requireAgent(agentId);
            members.add(agentId);
        }
        AgentPool pool = new AgentPool(id, name, members, strategy);
        pools.put(id, pool);
        log.info("Created pool {} ({}) with strategy {}", id, name, pool.strategy());
        return pool;
    }

    public synchronized AgentPool addToPool(String poolId, String agentId) {
        requireAgent(agentId);
        AgentPool updated = requirePool(poolId).withAgent(agentId);
        pools.put(poolId, updated);
        return updated;
    }

    public synchronized AgentPool removeFromPool(String poolId, String agentId) {
        AgentPool updated = requirePool(poolId).withoutAgent(agentId);
        pools.put(poolId, updated);
        return updated;
    }

    public synchronized Optional<AgentPool> getPool(String poolId) {
        return Optional.ofNullable(pools.get(poolId));
    }

    public synchronized List<AgentPool> listPools() {
        return List.copyOf(pools.values());
    }

    public synchronized boolean deletePool(String poolId) {
        return pools.remove(poolId) != null;
    }

    // ========== Internal Methods ==========

    Agent agent(String agentId) {
        RegisteredAgent registered;
        synchronized (this) {
            registered = agents.get(agentId);
        }
        if (registered == null) {
            throw new AgentUnavailableException(agentId, "not registered");
        }
        return registered.agent;
    }

    private void requireAgent(String agentId) {
        if (!agents.containsKey(agentId)) {
            throw new NotFoundException("Agent", agentId);
        }
    }

    private AgentPool requirePool(String poolId) {
        AgentPool pool = pools.get(poolId);
        if (pool == null) {
            throw new NotFoundException("AgentPool", poolId);
        }
        return pool;
    }

    private static final class RegisteredAgent {
        private final Agent agent;
        private final Semaphore permits;
        private final AtomicInteger inFlight = new AtomicInteger();
        private volatile AgentDescriptor descriptor;

        RegisteredAgent(Agent agent, AgentDescriptor descriptor) {
            this.agent = agent;
            this.descriptor = descriptor;
            this.permits = new Semaphore(descriptor.maxConcurrency());
        }

        AgentDescriptor descriptor() {
            return descriptor;
        }
    }

    /**
     * A held concurrency slot; closing it frees the slot.
     */
    public static final class Reservation implements AutoCloseable {

        private final RegisteredAgent registered;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Reservation(RegisteredAgent registered) {
            this.registered = registered;
        }

        public String agentId() {
            return registered.descriptor().id();
        }

        public Agent agent() {
            return registered.agent;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                registered.inFlight.decrementAndGet();
                registered.permits.release();
            }
        }
    }
}
