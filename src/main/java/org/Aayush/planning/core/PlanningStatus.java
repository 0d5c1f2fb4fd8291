package org.Aayush.planning.core;

/**
 * Terminal status of one {@code plan()} call.
 */
public enum PlanningStatus {
    /** A satisfying plan is held. */
    SOLVED,
    /** The iteration, vertex or time budget ran out with no plan. */
    TIMEOUT,
    /** Stopped by {@link PlanningSession#cancel()}. A plan may still be held. */
    CANCELLED,
    /** An environment change destroyed the start; the mission must be re-seeded. */
    UNRECOVERABLE
}
