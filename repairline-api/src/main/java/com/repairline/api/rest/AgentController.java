package com.repairline.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.exception.NotFoundException;
import com.repairline.core.model.AgentCapability;
import com.repairline.core.model.AgentDescriptor;
import com.repairline.core.model.AgentPool;
import com.repairline.core.model.LoadBalancingStrategy;
import com.repairline.core.model.TaskResult;
import com.repairline.engine.agent.AgentRegistry;
import com.repairline.engine.service.OrchestrationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API over the agent registry. Agents themselves are registered in-process;
 * this surface inspects them, flips health, and manages pools.
 */
@RestController
@RequestMapping("/api/v1")
public class AgentController {

    private final AgentRegistry registry;
    private final OrchestrationService orchestration;

    public AgentController(AgentRegistry registry, OrchestrationService orchestration) {
        this.registry = registry;
        this.orchestration = orchestration;
    }

    @GetMapping("/agents")
    public ResponseEntity<List<AgentResponse>> listAgents(@RequestParam(required = false) String capability) {
        List<AgentDescriptor> agents = capability != null
            ? registry.findByCapability(capability)
            : registry.list();
        return ResponseEntity.ok(agents.stream().map(this::toResponse).toList());
    }

    @GetMapping("/agents/{agentId}")
    public ResponseEntity<AgentResponse> getAgent(@PathVariable String agentId) {
        AgentDescriptor agent = registry.get(agentId)
            .orElseThrow(() -> new NotFoundException("Agent", agentId));
        return ResponseEntity.ok(toResponse(agent));
    }

    @PutMapping("/agents/{agentId}/health")
    public ResponseEntity<AgentResponse> updateHealth(
            @PathVariable String agentId,
            @Valid @RequestBody HealthUpdateRequest request) {
        return ResponseEntity.ok(toResponse(registry.updateHealth(agentId, request.healthy())));
    }

    @DeleteMapping("/agents/{agentId}")
    public ResponseEntity<Void> unregister(@PathVariable String agentId) {
        return registry.unregister(agentId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    /**
     * Run one capability outside any workflow.
     */
    @PostMapping("/capabilities/{capability}/invoke")
    public ResponseEntity<TaskResult> invokeCapability(
            @PathVariable String capability,
            @RequestBody(required = false) InvokeRequest request) {
        InvokeRequest body = request != null ? request : new InvokeRequest(null, null);
        return ResponseEntity.ok(orchestration.invokeCapability(capability, body.input(), body.tenantId()));
    }

    // ========== Pools ==========

    @PostMapping("/pools")
    public ResponseEntity<AgentPool> createPool(@Valid @RequestBody CreatePoolRequest request) {
        AgentPool pool = registry.createPool(request.name(), request.agentIds(), request.strategy());
        return ResponseEntity.status(HttpStatus.CREATED).body(pool);
    }

    @GetMapping("/pools")
    public ResponseEntity<List<AgentPool>> listPools() {
        return ResponseEntity.ok(registry.listPools());
    }

    @GetMapping("/pools/{poolId}")
    public ResponseEntity<AgentPool> getPool(@PathVariable String poolId) {
        return ResponseEntity.ok(registry.getPool(poolId)
            .orElseThrow(() -> new NotFoundException("Pool", poolId)));
    }

    @PutMapping("/pools/{poolId}/agents/{agentId}")
    public ResponseEntity<AgentPool> addToPool(@PathVariable String poolId, @PathVariable String agentId) {
        return ResponseEntity.ok(registry.addToPool(poolId, agentId));
    }

    @DeleteMapping("/pools/{poolId}/agents/{agentId}")
    public ResponseEntity<AgentPool> removeFromPool(@PathVariable String poolId, @PathVariable String agentId) {
        return ResponseEntity.ok(registry.removeFromPool(poolId, agentId));
    }

    @DeleteMapping("/pools/{poolId}")
    public ResponseEntity<Void> deletePool(@PathVariable String poolId) {
        return registry.deletePool(poolId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    private AgentResponse toResponse(AgentDescriptor agent) {
        return AgentResponse.from(agent, registry.inFlight(agent.id()));
    }

    // ========== DTOs ==========

    public record HealthUpdateRequest(@NotNull Boolean healthy) {}

    public record InvokeRequest(JsonNode input, String tenantId) {}

    public record CreatePoolRequest(
        @NotBlank String name,
        List<String> agentIds,
        LoadBalancingStrategy strategy
    ) {}

    public record AgentResponse(
        String id,
        String name,
        String version,
        String description,
        List<AgentCapability> capabilities,
        int priority,
        int maxConcurrency,
        Map<String, String> tags,
        boolean healthy,
        int inFlight
    ) {
        public static AgentResponse from(AgentDescriptor agent, int inFlight) {
            return new AgentResponse(
                agent.id(),
                agent.name(),
                agent.version(),
                agent.description(),
                agent.capabilities(),
                agent.priority(),
                agent.maxConcurrency(),
                agent.tags(),
                agent.healthy(),
                inFlight
            );
        }
    }
}
