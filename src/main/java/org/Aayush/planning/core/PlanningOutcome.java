package org.Aayush.planning.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of one {@code plan()} call.
 */
@Value
@Builder
public class PlanningOutcome {
    @NonNull
    PlanningStatus status;
    /** Best plan held when the call returned; absent for timeouts and unrecoverable repairs. */
    Plan plan;
    /** Iterations run by this call. */
    long iterations;
    /** Regions whose change made the mission unrecoverable. */
    @Builder.Default
    SortedSet<String> offendingRegionIds = new TreeSet<>();
    @NonNull
    PlanningDiagnostics diagnostics;

    public Optional<Plan> plan() {
        return Optional.ofNullable(plan);
    }

    public boolean isSolved() {
        return plan != null;
    }

    /**
     * @return the plan.
     * @throws PlanningException when no plan is held, coded by the status.
     */
    public Plan orElseThrow() {
        if (plan != null) {
            return plan;
        }
        switch (status) {
            case UNRECOVERABLE:
                throw new PlanningException(
                        PlanningException.REASON_UNRECOVERABLE_REPAIR,
                        "start destroyed by change of regions " + offendingRegionIds
                );
            case CANCELLED:
                throw new PlanningException(
                        PlanningException.REASON_PLANNING_CANCELLED,
                        "planning cancelled after " + iterations + " iterations without a plan"
                );
            default:
                throw new PlanningException(
                        PlanningException.REASON_PLANNING_TIMEOUT,
                        "no feasible plan after " + iterations + " iterations ("
                                + diagnostics.getVertexCount() + " vertices)"
                );
        }
    }
}
