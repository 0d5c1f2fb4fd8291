package org.Aayush.planning.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.planning.workspace.Configuration;

import java.util.Collections;
import java.util.List;

/**
 * Product vertex: a configuration paired with one automaton state.
 * <p>
 * Vertices live in the {@link ProductGraph} arena; parent and children are arena ids, not
 * references. Only the graph mutates vertices. Besides its tree edge a vertex keeps the
 * extra product transitions (cross edges) it takes part in.
 * </p>
 */
public final class ProductVertex {
    private final int id;
    private Configuration config;
    private final int state;
    private long labelMask;
    private double cost;
    private int parent;
    private ProductEdge incoming;
    private final IntArrayList children = new IntArrayList(2);
    private ObjectArrayList<ProductEdge> crossOut;
    private ObjectArrayList<ProductEdge> crossIn;
    private long generation;

    ProductVertex(int id, Configuration config, int state, long labelMask, long generation) {
        this.id = id;
        this.config = config;
        this.state = state;
        this.labelMask = labelMask;
        this.generation = generation;
        this.parent = -1;
    }

    public int id() {
        return id;
    }

    /**
     * @return labeled configuration.
     */
    public Configuration config() {
        return config;
    }

    public int state() {
        return state;
    }

    public long labelMask() {
        return labelMask;
    }

    /**
     * @return cost of the tree path from the root.
     */
    public double cost() {
        return cost;
    }

    /**
     * @return parent id, or {@code -1} for the root anchor.
     */
    public int parent() {
        return parent;
    }

    /**
     * @return tree edge from the parent, or {@code null} for the root anchor.
     */
    public ProductEdge incoming() {
        return incoming;
    }

    public IntList children() {
        return IntLists.unmodifiable(children);
    }

    public List<ProductEdge> crossOut() {
        return crossOut == null ? Collections.emptyList() : Collections.unmodifiableList(crossOut);
    }

    public List<ProductEdge> crossIn() {
        return crossIn == null ? Collections.emptyList() : Collections.unmodifiableList(crossIn);
    }

    /**
     * @return workspace version this vertex was created or last relabeled against.
     */
    public long generation() {
        return generation;
    }

    void attach(int parentId, ProductEdge edge, double newCost) {
        this.parent = parentId;
        this.incoming = edge;
        this.cost = newCost;
    }

    void setCost(double newCost) {
        this.cost = newCost;
    }

    void relabel(Configuration labeled, long mask, long version) {
        this.config = labeled;
        this.labelMask = mask;
        this.generation = version;
    }

    IntArrayList childIds() {
        return children;
    }

    ObjectArrayList<ProductEdge> crossOutEdges(boolean create) {
        if (crossOut == null && create) {
            crossOut = new ObjectArrayList<>(2);
        }
        return crossOut;
    }

    ObjectArrayList<ProductEdge> crossInEdges(boolean create) {
        if (crossIn == null && create) {
            crossIn = new ObjectArrayList<>(2);
        }
        return crossIn;
    }

    @Override
    public String toString() {
        return "ProductVertex{id=" + id + ", state=" + state + ", cost=" + cost + ", parent=" + parent
                + ", at=" + config + "}";
    }
}
