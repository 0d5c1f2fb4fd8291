package org.Aayush.planning.workspace;

/**
 * Semantic role of a workspace region.
 */
public enum RegionKind {
    /** Blocks motion; its label is still reported by containment queries. */
    OBSTACLE,
    /** Free region that only contributes its label. */
    LABELED
}
