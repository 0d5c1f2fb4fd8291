package org.Aayush.planning.core;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of a planning session, safe to read from any thread.
 */
@Value
@Builder(toBuilder = true)
public class PlanningDiagnostics {
    /** Iterations run over the whole session. */
    long iterations;
    /** Live product vertices, root anchor excluded. */
    int vertexCount;
    /** Tree edges plus cross edges. */
    int edgeCount;
    int crossEdgeCount;
    /** Cost of the best plan held, or {@code +INF}. */
    @Builder.Default
    double bestCost = Double.POSITIVE_INFINITY;
    /** Acceptance kind of the best plan, or {@code null} when none is held. */
    Plan.AcceptanceKind acceptance;
    /** Status of the last finished {@code plan()} call, or {@code null} before the first. */
    PlanningStatus status;
    /** Plans accepted as a new best over the session. */
    int plansFound;
    int repairsApplied;
    /** Updates the workspace refused as invalid geometry. */
    int updatesRejected;
    /** Vertices removed by repairs. */
    long verticesPruned;
    long workspaceVersion;

    public boolean hasPlan() {
        return acceptance != null;
    }

    public static PlanningDiagnostics empty() {
        return PlanningDiagnostics.builder().build();
    }
}
