package org.Aayush.planning.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.Workspace;

/**
 * Planning problem: an LTL formula over region labels, the workspace it refers to and the
 * robot's start configuration.
 */
@Value
@Builder
public class Mission {
    /** LTL formula text; propositions name region labels. */
    @NonNull
    String formula;
    /** Workspace the robot moves in. Owned by the session once the mission is opened. */
    @NonNull
    Workspace workspace;
    /** Start configuration; labels are recomputed against the workspace. */
    @NonNull
    Configuration start;

    public static Mission of(String formula, Workspace workspace, Configuration start) {
        return Mission.builder().formula(formula).workspace(workspace).start(start).build();
    }
}
