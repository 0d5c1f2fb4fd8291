package org.Aayush.planning.search;

/**
 * Frontier entry of a cost-ordered sweep: a product vertex, the cost of the best path found
 * to it so far and the vertex that path arrives from.
 * <p>
 * Entries belong to a {@link SearchQueue} pool and are reused after
 * {@link SearchQueue#recycle(SearchState)}; read the fields before handing one back.
 * </p>
 */
public class SearchState implements Comparable<SearchState> {

    public int vertexId;

    public double cost;

    /** Arrival vertex, {@code -1} at the sweep source. */
    public int predecessor;

    void set(int vertexId, double cost, int predecessor) {
        this.vertexId = vertexId;
        this.cost = cost;
        this.predecessor = predecessor;
    }

    /**
     * Cheaper first; ties go to the lower vertex id so sweeps settle in a fixed order.
     */
    @Override
    public int compareTo(SearchState other) {
        int byCost = Double.compare(cost, other.cost);
        return byCost != 0 ? byCost : Integer.compare(vertexId, other.vertexId);
    }

    @Override
    public String toString() {
        return "SearchState[v" + vertexId + " cost=" + cost + " from=" + predecessor + "]";
    }
}
