package org.Aayush.planning.search;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.graph.ProductEdge;
import org.Aayush.planning.graph.ProductGraph;
import org.Aayush.planning.graph.ProductVertex;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * Distance of every product vertex to acceptance, measured along product edges.
 * <p>
 * Goal vertices have potential {@code 0}: accepting vertices lying on a product cycle, and
 * parking vertices whose state accepts staying at their label set forever. Other potentials
 * come from one Dijkstra sweep over reversed tree and cross edges, seeded with every goal.
 * Vertices that cannot reach a goal, dead ids and the root anchor keep
 * {@link Double#POSITIVE_INFINITY}.
 * </p>
 * <p>
 * A snapshot: potentials are not updated when the graph grows or is repaired.
 * </p>
 */
@Slf4j
public final class ProductPotentials {
    private final double[] potential;
    private final BitSet parking;
    @Getter
    @Accessors(fluent = true)
    private final int goalCount;

    private ProductPotentials(double[] potential, BitSet parking, int goalCount) {
        this.potential = potential;
        this.parking = parking;
        this.goalCount = goalCount;
    }

    public static ProductPotentials compute(ProductGraph graph, SpecificationAutomaton automaton) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(automaton, "automaton");
        int n = graph.idBound();
        int[] component = AcceptingCycleSearch.components(AcceptingCycleSearch.adjacency(graph));
        int[] componentSize = new int[n];
        for (int id = 0; id < n; id++) {
            if (component[id] >= 0) {
                componentSize[component[id]]++;
            }
        }

        double[] potential = new double[n];
        Arrays.fill(potential, Double.POSITIVE_INFINITY);
        boolean[] settled = new boolean[n];
        BitSet parking = new BitSet(n);
        SearchQueue queue = new SearchQueue(Math.max(0, n - 1), Math.max(1, n));
        int goals = 0;
        for (int id = 1; id < n; id++) {
            ProductVertex v = graph.vertex(id);
            if (v == null) {
                continue;
            }
            boolean parks = automaton.acceptsConstantSuffix(v.state(), v.labelMask());
            boolean loops = automaton.isAccepting(v.state()) && componentSize[component[id]] > 1;
            if (parks) {
                parking.set(id);
            }
            if (parks || loops) {
                potential[id] = 0.0d;
                queue.insert(id, 0.0d, -1);
                goals++;
            }
        }

        while (!queue.isEmpty()) {
            SearchState state = queue.extractMin();
            int id = state.vertexId;
            double cost = state.cost;
            queue.recycle(state);
            if (settled[id]) {
                continue;
            }
            settled[id] = true;
            ProductVertex v = graph.vertex(id);
            ProductEdge tree = v.incoming();
            if (tree != null) {
                relax(tree, cost, potential, settled, queue);
            }
            for (ProductEdge edge : v.crossIn()) {
                relax(edge, cost, potential, settled, queue);
            }
        }
        log.debug("potentials computed: {} goal vertices over {} ids", goals, n);
        return new ProductPotentials(potential, parking, goals);
    }

    private static void relax(ProductEdge edge, double base, double[] potential, boolean[] settled, SearchQueue queue) {
        int from = edge.from();
        if (from == ProductGraph.ROOT || settled[from]) {
            return;
        }
        double candidate = base + edge.cost();
        if (candidate < potential[from]) {
            potential[from] = candidate;
            queue.insert(from, candidate, edge.to());
        }
    }

    /**
     * @return potential of {@code vertexId}; infinite for ids unknown to this snapshot.
     */
    public double potential(int vertexId) {
        if (vertexId < 0 || vertexId >= potential.length) {
            return Double.POSITIVE_INFINITY;
        }
        return potential[vertexId];
    }

    /**
     * @return true when the vertex accepts by staying where it is.
     */
    public boolean isParking(int vertexId) {
        return vertexId >= 0 && parking.get(vertexId);
    }

    public boolean canReachGoal(int vertexId) {
        return Double.isFinite(potential(vertexId));
    }
}
