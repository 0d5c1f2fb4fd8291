package org.Aayush.planning.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.graph.ProductEdge;
import org.Aayush.planning.graph.ProductGraph;
import org.Aayush.planning.graph.ProductVertex;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the cheapest lasso through an accepting product vertex.
 * <p>
 * A sweep first computes strongly connected components over tree and cross edges, so only
 * accepting vertices lying on some cycle are examined. Candidates are tried cheapest first;
 * for each, a Dijkstra search from its successors back to the vertex finds its shortest
 * loop. Lasso cost is {@code cost(f) + loop(f)}, which prunes both candidates and the
 * Dijkstra frontier against the best lasso known.
 * </p>
 */
@Slf4j
public final class AcceptingCycleSearch {
    private final ProductGraph graph;
    private final SpecificationAutomaton automaton;

    @Getter
    @Accessors(fluent = true)
    private long settledStates;

    public AcceptingCycleSearch(ProductGraph graph, SpecificationAutomaton automaton) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.automaton = Objects.requireNonNull(automaton, "automaton");
    }

    /**
     * @param maxSources accepting vertices examined, cheapest first.
     * @param bound only lassos strictly cheaper than this are reported.
     * @return the cheapest lasso found below the bound.
     */
    public Optional<AcceptingCycle> search(int maxSources, double bound) {
        int n = graph.idBound();
        int[][] adjacency = adjacency(graph);
        int[] component = components(adjacency);
        int[] componentSize = new int[n];
        for (int id = 0; id < n; id++) {
            if (component[id] >= 0) {
                componentSize[component[id]]++;
            }
        }

        IntArrayList sources = new IntArrayList();
        for (int id = 1; id < n; id++) {
            ProductVertex v = graph.vertex(id);
            if (v != null && automaton.isAccepting(v.state()) && componentSize[component[id]] > 1) {
                sources.add(id);
            }
        }
        int[] ordered = sources.toIntArray();
        Integer[] boxed = Arrays.stream(ordered).boxed().toArray(Integer[]::new);
        Arrays.sort(boxed, (a, b) -> {
            int byCost = Double.compare(graph.vertex(a).cost(), graph.vertex(b).cost());
            return byCost != 0 ? byCost : Integer.compare(a, b);
        });

        double best = bound;
        AcceptingCycle bestCycle = null;
        SearchQueue queue = new SearchQueue(n, Math.max(1, n));
        double[] distance = new double[n];
        int[] predecessor = new int[n];
        boolean[] settled = new boolean[n];
        int examined = 0;
        for (Integer source : boxed) {
            if (examined++ >= maxSources) {
                break;
            }
            double prefixCost = graph.vertex(source).cost();
            if (prefixCost >= best) {
                break;
            }
            AcceptingCycle cycle = shortestLoop(
                    source, component, adjacency, queue, distance, predecessor, settled, best - prefixCost
            );
            if (cycle != null && prefixCost + cycle.loopCost() < best) {
                best = prefixCost + cycle.loopCost();
                bestCycle = cycle;
            }
        }
        log.debug(
                "cycle sweep: {} candidates, {} examined, best={}",
                boxed.length, Math.min(examined, boxed.length), bestCycle == null ? "none" : best
        );
        return Optional.ofNullable(bestCycle);
    }

    private AcceptingCycle shortestLoop(
            int source,
            int[] component,
            int[][] adjacency,
            SearchQueue queue,
            double[] distance,
            int[] predecessor,
            boolean[] settled,
            double limit
    ) {
        Arrays.fill(distance, Double.POSITIVE_INFINITY);
        Arrays.fill(settled, false);
        queue.clear();
        int scc = component[source];
        relaxFrom(source, 0.0d, scc, component, adjacency, queue, distance, limit);
        while (!queue.isEmpty()) {
            SearchState state = queue.extractMin();
            int id = state.vertexId;
            double cost = state.cost;
            int pred = state.predecessor;
            queue.recycle(state);
            if (settled[id]) {
                continue;
            }
            settled[id] = true;
            predecessor[id] = pred;
            settledStates++;
            if (id == source) {
                queue.clear();
                return unwind(source, pred, predecessor, cost);
            }
            relaxFrom(id, cost, scc, component, adjacency, queue, distance, limit);
        }
        return null;
    }

    private void relaxFrom(
            int from,
            double base,
            int scc,
            int[] component,
            int[][] adjacency,
            SearchQueue queue,
            double[] distance,
            double limit
    ) {
        for (int to : adjacency[from]) {
            if (component[to] != scc) {
                continue;
            }
            double cost = base + graph.edge(from, to).cost();
            if (cost < distance[to] && cost < limit) {
                distance[to] = cost;
                queue.insert(to, cost, from);
            }
        }
    }

    private static AcceptingCycle unwind(int source, int last, int[] predecessor, double loopCost) {
        IntArrayList reversed = new IntArrayList();
        int current = last;
        while (current != source) {
            reversed.add(current);
            current = predecessor[current];
        }
        IntArrayList loop = new IntArrayList(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            loop.add(reversed.getInt(i));
        }
        return new AcceptingCycle(source, loop, loopCost);
    }

    /**
     * Out-neighbors over tree children and cross edges, ascending; {@code null} rows for dead ids.
     */
    static int[][] adjacency(ProductGraph graph) {
        int n = graph.idBound();
        int[][] adjacency = new int[n][];
        for (int id = 0; id < n; id++) {
            ProductVertex v = graph.vertex(id);
            if (v == null) {
                continue;
            }
            IntList children = v.children();
            int[] row = new int[children.size() + v.crossOut().size()];
            int k = 0;
            for (int i = 0; i < children.size(); i++) {
                row[k++] = children.getInt(i);
            }
            for (ProductEdge edge : v.crossOut()) {
                row[k++] = edge.to();
            }
            Arrays.sort(row);
            adjacency[id] = row;
        }
        return adjacency;
    }

    /**
     * Iterative Tarjan. Dead ids get component {@code -1}.
     */
    static int[] components(int[][] adjacency) {
        int n = adjacency.length;
        int[] index = new int[n];
        int[] low = new int[n];
        int[] component = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        Arrays.fill(component, -1);
        int[] stack = new int[n];
        int stackTop = 0;
        int[] callVertex = new int[n];
        int[] callEdge = new int[n];
        int counter = 0;
        int components = 0;

        for (int root = 0; root < n; root++) {
            if (adjacency[root] == null || index[root] >= 0) {
                continue;
            }
            int depth = 0;
            callVertex[0] = root;
            callEdge[0] = 0;
            index[root] = low[root] = counter++;
            stack[stackTop++] = root;
            onStack[root] = true;
            while (depth >= 0) {
                int v = callVertex[depth];
                int[] row = adjacency[v];
                if (callEdge[depth] < row.length) {
                    int w = row[callEdge[depth]++];
                    if (index[w] < 0) {
                        index[w] = low[w] = counter++;
                        stack[stackTop++] = w;
                        onStack[w] = true;
                        depth++;
                        callVertex[depth] = w;
                        callEdge[depth] = 0;
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }
                if (low[v] == index[v]) {
                    int w;
                    do {
                        w = stack[--stackTop];
                        onStack[w] = false;
                        component[w] = components;
                    } while (w != v);
                    components++;
                }
                depth--;
                if (depth >= 0) {
                    int parent = callVertex[depth];
                    low[parent] = Math.min(low[parent], low[v]);
                }
            }
        }
        return component;
    }
}
