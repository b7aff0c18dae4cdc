package com.repairline.core.repository;

import com.repairline.core.model.WorkflowDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Repository for workflow definitions.
 */
public interface WorkflowDefinitionRepository {

    WorkflowDefinition save(WorkflowDefinition definition);

    Optional<WorkflowDefinition> findById(String id);

    List<WorkflowDefinition> findAll();

    boolean delete(String id);
}
