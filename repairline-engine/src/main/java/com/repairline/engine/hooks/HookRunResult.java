package com.repairline.engine.hooks;

/**
 * Tally of one event dispatched to all registered hooks.
 */
public record HookRunResult(int total, int successful, int failed) {

    public static HookRunResult empty() {
        return new HookRunResult(0, 0, 0);
    }
}
