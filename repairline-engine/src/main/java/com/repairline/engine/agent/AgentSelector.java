package com.repairline.engine.agent;

import com.repairline.core.exception.AgentUnavailableException;
import com.repairline.core.model.AgentDescriptor;
import com.repairline.core.model.AgentPool;
import com.repairline.core.model.LoadBalancingStrategy;
import com.repairline.core.model.TaskDefinition;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Picks the agent that runs a task.
 *
 * A pinned agent always wins. Otherwise the healthy agents exposing the task's
 * capability are narrowed to the first pool containing any of them, and that
 * pool's strategy decides. Candidates outside every pool use the default strategy.
 * Agents at their concurrency limit are only picked when every candidate is.
 */
public class AgentSelector {

    private final AgentRegistry registry;
    private final LoadBalancingStrategy defaultStrategy;
    private final Random random;
    private final Map<String, AtomicLong> rotations = new ConcurrentHashMap<>();

    public AgentSelector(AgentRegistry registry, LoadBalancingStrategy defaultStrategy) {
        this(registry, defaultStrategy, new Random());
    }

    public AgentSelector(AgentRegistry registry, LoadBalancingStrategy defaultStrategy, Random random) {
        this.registry = registry;
        this.defaultStrategy = defaultStrategy == null ? LoadBalancingStrategy.ROUND_ROBIN : defaultStrategy;
        this.random = random;
    }

    /**
     * @throws AgentUnavailableException if no healthy agent can run the task
     */
    public AgentDescriptor select(TaskDefinition task) {
        if (task.isPinned()) {
            AgentDescriptor pinned = registry.get(task.agentId())
                .orElseThrow(() -> new AgentUnavailableException(task.agentId(), "not registered"));
            if (!pinned.healthy()) {
                throw new AgentUnavailableException(pinned.id(), "unhealthy");
            }
            return pinned;
        }
        return selectForCapability(task.capability());
    }

    public AgentDescriptor selectForCapability(String capability) {
        List<AgentDescriptor> candidates = registry.findByCapability(capability);
        if (candidates.isEmpty()) {
            throw new AgentUnavailableException(capability);
        }

        for (AgentPool pool : registry.listPools()) {
            List<AgentDescriptor> members = candidates.stream()
                .filter(c -> pool.contains(c.id()))
                .toList();
            if (!members.isEmpty()) {
                return choose(members, pool.strategy(), pool.id());
            }
        }
        return choose(candidates, defaultStrategy, "capability:" + capability);
    }

    private AgentDescriptor choose(List<AgentDescriptor> all, LoadBalancingStrategy strategy, String rotationKey) {
        // Saturated agents are skipped while another candidate has a free slot.
        List<AgentDescriptor> free = all.stream()
            .filter(a -> registry.inFlight(a.id()) < a.maxConcurrency())
            .toList();
        List<AgentDescriptor> candidates = free.isEmpty() ? all : free;
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        Comparator<AgentDescriptor> leastBusy = Comparator.comparingInt(a -> registry.inFlight(a.id()));
        return switch (strategy) {
            case ROUND_ROBIN -> {
                long turn = rotations.computeIfAbsent(rotationKey, k -> new AtomicLong()).getAndIncrement();
                yield candidates.get((int) Math.floorMod(turn, (long) candidates.size()));
            }
            case LEAST_BUSY -> candidates.stream().min(leastBusy).orElseThrow();
            case RANDOM -> candidates.get(random.nextInt(candidates.size()));
            case PRIORITY -> candidates.stream()
                .min(Comparator.comparingInt(AgentDescriptor::priority).reversed().thenComparing(leastBusy))
                .orElseThrow();
        };
    }
}
