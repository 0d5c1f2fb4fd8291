package org.Aayush.planning.core;

/**
 * Which near vertices may serve as parents of, or be rewired through, a new vertex.
 */
public enum RewirePolicy {
    /**
     * Any vertex whose automaton state reaches the other vertex's state in one transition
     * under the other vertex's labels.
     */
    TRANSITION,
    /**
     * Only vertices sharing the automaton state. The progress-aware nearest vertex is always
     * an admissible parent, so automaton progress is still possible.
     */
    SAME_STATE
}
