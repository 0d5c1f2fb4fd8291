package org.Aayush.planning.graph;

import org.Aayush.planning.sampling.Trajectory;

import java.util.Objects;

/**
 * Directed product transition {@code from -> to} with its collision-free connector.
 *
 * @param from source vertex id.
 * @param to target vertex id.
 * @param cost geometric cost (connector length).
 * @param trajectory connector between the two configurations.
 */
public record ProductEdge(int from, int to, double cost, Trajectory trajectory) {
    public ProductEdge {
        Objects.requireNonNull(trajectory, "trajectory");
        if (!(cost >= 0.0d) || Double.isInfinite(cost)) {
            throw new IllegalArgumentException("edge cost must be finite and >= 0, got " + cost);
        }
    }

    public static ProductEdge straight(ProductVertex from, ProductVertex to) {
        Trajectory trajectory = Trajectory.straight(from.config(), to.config());
        return new ProductEdge(from.id(), to.id(), trajectory.length(), trajectory);
    }

    public boolean connects(int source, int target) {
        return from == source && to == target;
    }
}
