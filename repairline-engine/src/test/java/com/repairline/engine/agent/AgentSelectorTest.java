package com.repairline.engine.agent;

import com.repairline.core.exception.AgentUnavailableException;
import com.repairline.core.model.AgentDescriptor;
import com.repairline.core.model.LoadBalancingStrategy;
import com.repairline.core.model.TaskDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentSelectorTest {

    private AgentRegistry registry;
    private AgentDescriptor first;
    private AgentDescriptor second;
    private AgentDescriptor third;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry();
        first = registry.register(TestAgents.withPriority("first", 1, "diagnose"));
        second = registry.register(TestAgents.withPriority("second", 5, "diagnose"));
        third = registry.register(TestAgents.withPriority("third", 3, "diagnose"));
    }

    @Test
    @DisplayName("Round robin cycles through candidates in registration order")
    void roundRobin() {
        AgentSelector selector = new AgentSelector(registry, LoadBalancingStrategy.ROUND_ROBIN);

        List<String> picks = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            picks.add(selector.selectForCapability("diagnose").id());
        }

        assertThat(picks).containsExactly(first.id(), second.id(), third.id(), first.id());
    }

    @Test
    @DisplayName("Least busy avoids agents with invocations in flight")
    void leastBusy() {
        AgentSelector selector = new AgentSelector(registry, LoadBalancingStrategy.LEAST_BUSY);

        try (AgentRegistry.Reservation r1 = registry.reserve(first.id());
             AgentRegistry.Reservation r2 = registry.reserve(second.id())) {
            assertThat(selector.selectForCapability("diagnose").id()).isEqualTo(third.id());
        }
    }

    @Test
    @DisplayName("Priority picks the highest priority healthy agent")
    void priority() {
        AgentSelector selector = new AgentSelector(registry, LoadBalancingStrategy.PRIORITY);

        assertThat(selector.selectForCapability("diagnose").id()).isEqualTo(second.id());

        registry.updateHealth(second.id(), false);
        assertThat(selector.selectForCapability("diagnose").id()).isEqualTo(third.id());
    }

    @Test
    @DisplayName("Round robin and random skip an agent at its concurrency limit while a peer has room")
    void saturatedAgentSkipped() {
        AgentRegistry small = new AgentRegistry();
        AgentDescriptor busy = small.register(Agent.of(TestAgents.descriptor("busy", 0, 1, "quote"),
            request -> null));
        AgentDescriptor idle = small.register(Agent.of(TestAgents.descriptor("idle", 0, 1, "quote"),
            request -> null));
        AgentSelector roundRobin = new AgentSelector(small, LoadBalancingStrategy.ROUND_ROBIN);
        AgentSelector random = new AgentSelector(small, LoadBalancingStrategy.RANDOM, new Random(7));

        try (AgentRegistry.Reservation held = small.reserve(busy.id())) {
            for (int i = 0; i < 10; i++) {
                assertThat(roundRobin.selectForCapability("quote").id()).isEqualTo(idle.id());
                assertThat(random.selectForCapability("quote").id()).isEqualTo(idle.id());
            }
            try (AgentRegistry.Reservation alsoHeld = small.reserve(idle.id())) {
                assertThat(roundRobin.selectForCapability("quote").id()).isIn(busy.id(), idle.id());
            }
        }
    }

    @Test
    @DisplayName("Random only ever picks candidates")
    void random() {
        AgentSelector selector = new AgentSelector(registry, LoadBalancingStrategy.RANDOM, new Random(42));

        for (int i = 0; i < 20; i++) {
            assertThat(selector.selectForCapability("diagnose").id())
                .isIn(first.id(), second.id(), third.id());
        }
    }

    @Test
    @DisplayName("A pool narrows selection to its members and applies its own strategy")
    void poolRestrictsCandidates() {
        registry.createPool("night-shift", List.of(first.id(), third.id()), LoadBalancingStrategy.PRIORITY);
        AgentSelector selector = new AgentSelector(registry, LoadBalancingStrategy.ROUND_ROBIN);

        for (int i = 0; i < 3; i++) {
            assertThat(selector.selectForCapability("diagnose").id()).isEqualTo(third.id());
        }
    }

    @Test
    @DisplayName("A pinned agent is used regardless of strategy")
    void pinnedAgent() {
        AgentSelector selector = new AgentSelector(registry, LoadBalancingStrategy.PRIORITY);
        TaskDefinition task = TaskDefinition.builder("inspect").agentId(first.id()).build();

        assertThat(selector.select(task).id()).isEqualTo(first.id());
    }

    @Test
    @DisplayName("An unhealthy or unknown pinned agent is unavailable")
    void pinnedAgentUnavailable() {
        AgentSelector selector = new AgentSelector(registry, LoadBalancingStrategy.ROUND_ROBIN);
        registry.updateHealth(first.id(), false);

        assertThatThrownBy(() -> selector.select(TaskDefinition.builder("t").agentId(first.id()).build()))
            .isInstanceOf(AgentUnavailableException.class);
        assertThatThrownBy(() -> selector.select(TaskDefinition.builder("t").agentId("agent_77").build()))
            .isInstanceOf(AgentUnavailableException.class);
    }

    @Test
    @DisplayName("A capability without healthy agents is unavailable")
    void noCandidates() {
        AgentSelector selector = new AgentSelector(registry, LoadBalancingStrategy.ROUND_ROBIN);

        assertThatThrownBy(() -> selector.selectForCapability("quote"))
            .isInstanceOf(AgentUnavailableException.class)
            .hasMessageContaining("quote");
    }
}
