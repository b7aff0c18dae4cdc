package com.repairline.core.model;

/**
 * Whether a task may run alongside siblings that share a dependency with it.
 */
public enum DependencyType {
    /** Runs one at a time, in declaration order, among siblings of a shared predecessor. */
    SEQUENTIAL,
    /** May run concurrently with other ready tasks. */
    PARALLEL
}
