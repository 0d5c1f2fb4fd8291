package org.Aayush.planning.execution;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.planning.graph.ProductEdge;
import org.Aayush.planning.graph.ProductGraph;
import org.Aayush.planning.graph.ProductVertex;
import org.Aayush.planning.search.ProductPotentials;
import org.Aayush.planning.workspace.Configuration;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Picks the next global target by descending the product potentials.
 * <p>
 * From a product vertex the target is the successor of minimum potential, ties broken by
 * vertex id. A vertex at potential {@code 0} that is not parking has already reached
 * acceptance, so a zero-potential successor is skipped in favour of the cheapest positive
 * one and the robot moves on around its accepting cycle. Parking vertices stay put.
 * </p>
 */
public final class PotentialGuide {
    private static final double SAME_POINT_RADIUS = 1e-9d;

    private final ProductGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final ProductPotentials potentials;

    public PotentialGuide(ProductGraph graph, ProductPotentials potentials) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.potentials = Objects.requireNonNull(potentials, "potentials");
    }

    /**
     * Live product vertices at {@code at} whose automaton state is in {@code states}, ascending.
     */
    public IntList verticesAt(Configuration at, IntSet states) {
        IntList near = graph.near(at, SAME_POINT_RADIUS);
        IntArrayList matching = new IntArrayList();
        for (int i = 0; i < near.size(); i++) {
            ProductVertex v = graph.vertex(near.getInt(i));
            if (v != null && states.contains(v.state()) && v.config().samePoint(at)) {
                matching.add(v.id());
            }
        }
        int[] ids = matching.toIntArray();
        Arrays.sort(ids);
        return IntArrayList.wrap(ids);
    }

    /**
     * Potential of the robot at {@code at} with monitored states {@code states}: the minimum
     * over matching product vertices, infinite when none matches.
     */
    public double potential(Configuration at, IntSet states) {
        double best = Double.POSITIVE_INFINITY;
        IntList ids = verticesAt(at, states);
        for (int i = 0; i < ids.size(); i++) {
            best = Math.min(best, potentials.potential(ids.getInt(i)));
        }
        return best;
    }

    /**
     * @return the vertex to head for from {@code vertexId}; {@code vertexId} itself when it
     *         parks, empty when no successor can reach acceptance.
     */
    public OptionalInt next(int vertexId) {
        ProductVertex v = graph.vertex(vertexId);
        if (v == null) {
            return OptionalInt.empty();
        }
        if (potentials.isParking(vertexId)) {
            return OptionalInt.of(vertexId);
        }
        IntList candidates = new IntArrayList(1);
        candidates.add(vertexId);
        return bestSuccessor(candidates, potentials.potential(vertexId));
    }

    /**
     * Next global target for a robot at {@code at} whose execution monitor holds
     * {@code states}.
     *
     * @return the configuration to head for; {@code at} itself when a matching vertex parks,
     *         empty when the robot is off the graph or cannot reach acceptance.
     */
    public Optional<Configuration> nextTarget(Configuration at, IntSet states) {
        IntList ids = verticesAt(at, states);
        double current = Double.POSITIVE_INFINITY;
        for (int i = 0; i < ids.size(); i++) {
            int id = ids.getInt(i);
            if (potentials.isParking(id)) {
                return Optional.of(at);
            }
            current = Math.min(current, potentials.potential(id));
        }
        OptionalInt best = bestSuccessor(ids, current);
        return best.isPresent() ? Optional.of(graph.vertex(best.getAsInt()).config()) : Optional.empty();
    }

    private OptionalInt bestSuccessor(IntList from, double currentPotential) {
        int best = -1;
        int bestPositive = -1;
        for (int i = 0; i < from.size(); i++) {
            ProductVertex v = graph.vertex(from.getInt(i));
            IntList children = v.children();
            for (int k = 0; k < children.size(); k++) {
                int to = children.getInt(k);
                best = lower(best, to);
                if (potentials.potential(to) > 0.0d) {
                    bestPositive = lower(bestPositive, to);
                }
            }
            for (ProductEdge edge : v.crossOut()) {
                best = lower(best, edge.to());
                if (potentials.potential(edge.to()) > 0.0d) {
                    bestPositive = lower(bestPositive, edge.to());
                }
            }
        }
        if (best >= 0 && currentPotential == 0.0d && potentials.potential(best) == 0.0d && bestPositive >= 0) {
            best = bestPositive;
        }
        if (best < 0 || !potentials.canReachGoal(best)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(best);
    }

    private int lower(int incumbent, int challenger) {
        if (!potentials.canReachGoal(challenger)) {
            return incumbent;
        }
        if (incumbent < 0) {
            return challenger;
        }
        int byPotential = Double.compare(potentials.potential(challenger), potentials.potential(incumbent));
        return byPotential < 0 || (byPotential == 0 && challenger < incumbent) ? challenger : incumbent;
    }
}
