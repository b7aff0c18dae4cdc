package com.repairline.engine.hooks;

import com.repairline.core.model.Execution;
import com.repairline.core.model.TaskDefinition;
import com.repairline.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Dispatches lifecycle events to hooks in registration order.
 */
public class HookRunner {

    private static final Logger log = LoggerFactory.getLogger(HookRunner.class);

    private final List<ExecutionHook> hooks = new CopyOnWriteArrayList<>();

    /**
     * @return false if a hook with the same name is already registered
     */
    public synchronized boolean register(ExecutionHook hook) {
        boolean duplicate = hooks.stream().anyMatch(h -> h.name().equals(hook.name()));
        if (duplicate) {
            log.warn("Hook {} is already registered", hook.name());
            return false;
        }
        hooks.add(hook);
        return true;
    }

    public synchronized boolean unregister(String name) {
        return hooks.removeIf(h -> h.name().equals(name));
    }

    public List<String> registeredNames() {
        return hooks.stream().map(ExecutionHook::name).toList();
    }

    public HookRunResult executionStarted(Execution execution) {
        return dispatch("onExecutionStarted", h -> h.onExecutionStarted(execution));
    }

    public HookRunResult taskStarted(Execution execution, TaskDefinition task) {
        return dispatch("onTaskStarted", h -> h.onTaskStarted(execution, task));
    }

    public HookRunResult taskFinished(Execution execution, TaskResult result) {
        if (result.isSuccess()) {
            return dispatch("onTaskCompleted", h -> h.onTaskCompleted(execution, result));
        }
        return dispatch("onTaskFailed", h -> h.onTaskFailed(execution, result));
    }

    public HookRunResult executionFinished(Execution execution) {
        return dispatch("onExecutionFinished", h -> h.onExecutionFinished(execution));
    }

    private HookRunResult dispatch(String event, Consumer<ExecutionHook> callback) {
        if (hooks.isEmpty()) {
            return HookRunResult.empty();
        }
        int successful = 0;
        int failed = 0;
        for (ExecutionHook hook : hooks) {
            try {
                callback.accept(hook);
                successful++;
            } catch (RuntimeException e) {
                failed++;
                log.error("Hook {} failed in {}", hook.name(), event, e);
            }
        }
        return new HookRunResult(successful + failed, successful, failed);
    }
}
