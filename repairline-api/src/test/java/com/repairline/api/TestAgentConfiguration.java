package com.repairline.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.repairline.core.model.AgentDescriptor;
import com.repairline.engine.agent.Agent;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A single "diagnose" agent that counts its invocations.
 */
@TestConfiguration
public class TestAgentConfiguration {

    @Bean
    public AtomicInteger diagnoseCalls() {
        return new AtomicInteger();
    }

    @Bean
    public Agent diagnoser(AtomicInteger diagnoseCalls) {
        return Agent.of(AgentDescriptor.builder("diagnoser").capability("diagnose").build(),
            request -> {
                diagnoseCalls.incrementAndGet();
                return JsonNodeFactory.instance.objectNode().put("diagnosis", "worn belt");
            });
    }
}
