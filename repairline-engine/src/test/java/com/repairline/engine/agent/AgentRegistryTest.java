package com.repairline.engine.agent;

import com.repairline.core.exception.AgentUnavailableException;
import com.repairline.core.exception.NotFoundException;
import com.repairline.core.model.AgentDescriptor;
import com.repairline.core.model.AgentPool;
import com.repairline.core.model.LoadBalancingStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRegistryTest {

    private AgentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry();
    }

    @Test
    @DisplayName("Registration assigns sequential ids")
    void registerAssignsIds() {
        AgentDescriptor first = registry.register(TestAgents.echo("diagnoser", "diagnose"));
        AgentDescriptor second = registry.register(TestAgents.echo("quoter", "quote"));

        assertThat(first.id()).isEqualTo("agent_1");
        assertThat(second.id()).isEqualTo("agent_2");
        assertThat(registry.list()).extracting(AgentDescriptor::name).containsExactly("diagnoser", "quoter");
    }

    @Test
    @DisplayName("Capability lookup skips unhealthy agents and keeps registration order")
    void findByCapabilitySkipsUnhealthy() {
        AgentDescriptor a = registry.register(TestAgents.echo("a", "diagnose"));
        AgentDescriptor b = registry.register(TestAgents.echo("b", "diagnose", "quote"));
        AgentDescriptor c = registry.register(TestAgents.echo("c", "diagnose"));

        registry.updateHealth(b.id(), false);

        assertThat(registry.findByCapability("diagnose")).extracting(AgentDescriptor::id)
            .containsExactly(a.id(), c.id());
        assertThat(registry.findByCapability("quote")).isEmpty();
        assertThat(registry.findByCapability("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Updating the health of an unknown agent fails")
    void updateHealthUnknownAgent() {
        assertThatThrownBy(() -> registry.updateHealth("agent_99", false))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Reservations are bounded by maxConcurrency and freed on close")
    void reservationsRespectConcurrency() {
        AgentDescriptor agent = registry.register(
            Agent.of(TestAgents.descriptor("single", 0, 1, "diagnose"), request -> null));

        try (AgentRegistry.Reservation reservation = registry.reserve(agent.id())) {
            assertThat(reservation.agentId()).isEqualTo(agent.id());
            assertThat(registry.inFlight(agent.id())).isEqualTo(1);
            assertThatThrownBy(() -> registry.reserve(agent.id()))
                .isInstanceOf(AgentUnavailableException.class)
                .hasMessageContaining("max concurrency");
        }

        assertThat(registry.inFlight(agent.id())).isZero();
        registry.reserve(agent.id()).close();
    }

    @Test
    @DisplayName("Reserving an unregistered agent fails")
    void reserveUnknownAgent() {
        assertThatThrownBy(() -> registry.reserve("agent_404"))
            .isInstanceOf(AgentUnavailableException.class)
            .hasMessageContaining("not registered");
    }

    @Test
    @DisplayName("Pools track membership and lose agents that unregister")
    void poolMembership() {
        AgentDescriptor a = registry.register(TestAgents.echo("a", "diagnose"));
        AgentDescriptor b = registry.register(TestAgents.echo("b", "diagnose"));

        AgentPool pool = registry.createPool("primary", List.of(a.id()), LoadBalancingStrategy.LEAST_BUSY);
        assertThat(pool.id()).isEqualTo("pool_1");

        registry.addToPool(pool.id(), b.id());
        assertThat(registry.getPool(pool.id())).get()
            .extracting(AgentPool::agentIds).isEqualTo(List.of(a.id(), b.id()));

        registry.unregister(a.id());
        assertThat(registry.getPool(pool.id()).orElseThrow().agentIds()).containsExactly(b.id());

        registry.removeFromPool(pool.id(), b.id());
        assertThat(registry.getPool(pool.id()).orElseThrow().agentIds()).isEmpty();

        assertThat(registry.deletePool(pool.id())).isTrue();
        assertThat(registry.listPools()).isEmpty();
    }

    @Test
    @DisplayName("Pools only accept registered agents")
    void poolRejectsUnknownAgents() {
        assertThatThrownBy(() -> registry.createPool("ghosts", List.of("agent_7"), null))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.addToPool("pool_9", "agent_7"))
            .isInstanceOf(NotFoundException.class);
    }
}
