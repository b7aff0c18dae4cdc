package com.repairline.engine.persistence;

import com.repairline.core.model.WorkflowDefinition;
import com.repairline.core.repository.WorkflowDefinitionRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 */
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public WorkflowDefinition save(WorkflowDefinition definition) {
        definitions.put(definition.id(), definition);
        return definition;
    }

    @Override
    public Optional<WorkflowDefinition> findById(String id) {
        return Optional.ofNullable(definitions.get(id));
    }

    @Override
    public List<WorkflowDefinition> findAll() {
        return definitions.values().stream()
            .sorted((a, b) -> a.createdAt().compareTo(b.createdAt()))
            .toList();
    }

    @Override
    public boolean delete(String id) {
        return definitions.remove(id) != null;
    }
}
