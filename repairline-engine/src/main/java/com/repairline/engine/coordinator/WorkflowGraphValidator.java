package com.repairline.engine.coordinator;

import com.repairline.core.exception.CircularDependencyException;
import com.repairline.core.exception.UnknownTaskReferenceException;
import com.repairline.core.exception.WorkflowValidationException;
import com.repairline.core.model.TaskDefinition;
import com.repairline.core.model.WorkflowDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on workflow definitions: required fields, dependency
 * references, and acyclicity of the task graph.
 */
public class WorkflowGraphValidator {

    private enum Mark { VISITING, DONE }

    public void validate(WorkflowDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw WorkflowValidationException.invalidField("name", "cannot be empty");
        }
        if (definition.tasks() == null || definition.tasks().isEmpty()) {
            throw WorkflowValidationException.invalidField("tasks", "cannot be empty");
        }

        Set<String> ids = new HashSet<>();
        for (TaskDefinition task : definition.tasks()) {
            if (task.id() == null || task.id().isBlank()) {
                throw WorkflowValidationException.invalidField("tasks.id", "cannot be empty");
            }
            if (!ids.add(task.id())) {
                throw WorkflowValidationException.invalidField("tasks.id", "duplicate task id " + task.id());
            }
            boolean hasCapability = task.capability() != null && !task.capability().isBlank();
            if (!hasCapability && !task.isPinned()) {
                throw WorkflowValidationException.invalidField(
                    "tasks." + task.id(), "needs a capability or an agentId");
            }
        }

        for (TaskDefinition task : definition.tasks()) {
            for (String dependency : task.dependencies()) {
                if (dependency.equals(task.id())) {
                    throw new CircularDependencyException(List.of(task.id(), task.id()));
                }
                if (!ids.contains(dependency)) {
                    throw new UnknownTaskReferenceException(task.id(), dependency);
                }
            }
        }

        detectCycles(definition);
    }

    /**
     * Task ids such that every task follows all of its dependencies.
     * Ties keep declaration order. Assumes a validated definition.
     */
    public List<String> topologicalOrder(WorkflowDefinition definition) {
        Map<String, Integer> remaining = new LinkedHashMap<>();
        for (TaskDefinition task : definition.tasks()) {
            remaining.put(task.id(), task.dependencies().size());
        }
        List<String> order = new ArrayList<>();
        Deque<String> ready = new ArrayDeque<>();
        remaining.forEach((id, count) -> {
            if (count == 0) {
                ready.add(id);
            }
        });
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (TaskDefinition dependent : definition.dependentsOf(id)) {
                int left = remaining.merge(dependent.id(), -1, Integer::sum);
                if (left == 0) {
                    ready.add(dependent.id());
                }
            }
        }
        return order;
    }

    // Three-color depth-first search; a back edge to a VISITING node closes a cycle.
    private void detectCycles(WorkflowDefinition definition) {
        Map<String, TaskDefinition> byId = new HashMap<>();
        definition.tasks().forEach(t -> byId.put(t.id(), t));
        Map<String, Mark> marks = new HashMap<>();

        for (TaskDefinition task : definition.tasks()) {
            if (!marks.containsKey(task.id())) {
                visit(task.id(), byId, marks, new ArrayList<>());
            }
        }
    }

    private void visit(String id, Map<String, TaskDefinition> byId, Map<String, Mark> marks, List<String> path) {
        marks.put(id, Mark.VISITING);
        path.add(id);
        for (String dependency : byId.get(id).dependencies()) {
            Mark mark = marks.get(dependency);
            if (mark == Mark.VISITING) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                throw new CircularDependencyException(cycle);
            }
            if (mark == null) {
                visit(dependency, byId, marks, path);
            }
        }
        path.remove(path.size() - 1);
        marks.put(id, Mark.DONE);
    }
}
