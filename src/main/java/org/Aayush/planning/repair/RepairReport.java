package org.Aayush.planning.repair;

import lombok.Builder;
import lombok.Value;
import org.Aayush.planning.workspace.RegionUpdate;

import java.util.SortedSet;

/**
 * Summary of one in-place graph repair.
 */
@Value
@Builder
public class RepairReport {
    RegionUpdate update;
    SortedSet<String> affectedRegionIds;
    /** Workspace version after the update. */
    long workspaceVersion;
    /** Vertices whose labels changed. */
    int verticesRelabeled;
    /** Vertices found invalid before subtree removal. */
    int verticesInvalidated;
    /** Vertices removed, invalid ones and their descendants. */
    int verticesRemoved;
    int crossEdgesRemoved;
    /** Start vertices added because the start labels now enter new automaton states. */
    int startVerticesAdded;
    /** Whether the best plan held before the update was discarded. */
    boolean planDiscarded;
    /** The start configuration is blocked or its labels violate the formula. */
    boolean unrecoverable;
    long durationNanos;
}
