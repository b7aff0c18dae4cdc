package com.repairline.core.model;

/**
 * How an agent pool picks among its healthy members.
 */
public enum LoadBalancingStrategy {
    /** Rotate through members in order. */
    ROUND_ROBIN,
    /** Member with the fewest in-flight tasks. */
    LEAST_BUSY,
    RANDOM,
    /** Highest declared priority wins; ties broken by fewest in-flight tasks. */
    PRIORITY
}
