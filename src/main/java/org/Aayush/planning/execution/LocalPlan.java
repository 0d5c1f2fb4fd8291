package org.Aayush.planning.execution;

import org.Aayush.planning.workspace.Configuration;

import java.util.List;

/**
 * Output of {@link LocalRequestPlanner}.
 *
 * @param path configurations to visit after the current one, ending at the global target;
 *             empty when no local plan was found within budget.
 * @param served request the path passes through, or {@code null}.
 * @param treeSize nodes of the local tree, {@code 0} for free movement.
 */
public record LocalPlan(List<Configuration> path, LocalRequest served, int treeSize) {
    public LocalPlan {
        path = List.copyOf(path);
    }

    static LocalPlan failed(int treeSize) {
        return new LocalPlan(List.of(), null, treeSize);
    }

    public boolean isEmpty() {
        return path.isEmpty();
    }
}
