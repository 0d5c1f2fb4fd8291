package org.Aayush.planning.graph;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.sampling.Trajectory;
import org.Aayush.planning.workspace.Configuration;

import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Arena-owned product-space planning graph.
 * <p>
 * Vertices are stored in an indexed arena; removed slots become {@code null} and ids are
 * never reused. Tree structure is expressed through parent/children ids. Vertex
 * {@link #ROOT} is an anchor pairing the start configuration with the automaton's initial
 * state: it has not read any label yet, so its children are zero-cost start vertices, one per
 * automaton state entered on the start labels. Additional feasible product transitions are
 * kept as cross edges and are used by cycle search.
 * </p>
 * <p>
 * <strong>Single writer:</strong> all mutators must be called from the planning thread.
 * </p>
 */
public final class ProductGraph {
    public static final int ROOT = 0;
    private static final double COST_TOLERANCE = 1e-9;

    private final ObjectArrayList<ProductVertex> vertices = new ObjectArrayList<>();
    private final VertexGridIndex index;
    private int liveCount;
    private int crossEdgeCount;

    /**
     * @param start labeled start configuration.
     * @param cellSize grid cell size for neighbor queries (typically the steering step).
     * @param generation workspace version the start was labeled against.
     */
    public ProductGraph(Configuration start, long labelMask, double cellSize, long generation) {
        Objects.requireNonNull(start, "start");
        this.index = new VertexGridIndex(cellSize);
        ProductVertex root = new ProductVertex(ROOT, start, SpecificationAutomaton.INIT, labelMask, generation);
        vertices.add(root);
        liveCount = 1;
    }

    public ProductVertex root() {
        return vertices.get(ROOT);
    }

    /**
     * @return live vertex, or {@code null} when removed or never allocated.
     */
    public ProductVertex vertex(int id) {
        return id >= 0 && id < vertices.size() ? vertices.get(id) : null;
    }

    public boolean isLive(int id) {
        return vertex(id) != null;
    }

    /**
     * @return live vertices including the root anchor.
     */
    public int size() {
        return liveCount;
    }

    /**
     * @return exclusive upper bound of allocated ids.
     */
    public int idBound() {
        return vertices.size();
    }

    /**
     * @return tree edges plus cross edges.
     */
    public int edgeCount() {
        return (liveCount - 1) + crossEdgeCount;
    }

    public int crossEdgeCount() {
        return crossEdgeCount;
    }

    /**
     * Inserts a vertex under {@code parentId}.
     *
     * @return the new vertex.
     */
    public ProductVertex addVertex(
            Configuration config,
            int state,
            long labelMask,
            int parentId,
            Trajectory connector,
            long generation
    ) {
        ProductVertex parent = requireLive(parentId);
        int id = vertices.size();
        ProductVertex vertex = new ProductVertex(id, config, state, labelMask, generation);
        ProductEdge edge = new ProductEdge(parentId, id, connector.length(), connector);
        vertex.attach(parentId, edge, parent.cost() + edge.cost());
        vertices.add(vertex);
        parent.childIds().add(id);
        index.add(id, config.x(), config.y());
        liveCount++;
        return vertex;
    }

    /**
     * Adds a start vertex: a zero-cost child of the root anchor at the start configuration.
     */
    public ProductVertex addStartVertex(int state, long generation) {
        ProductVertex root = root();
        return addVertex(
                root.config(),
                state,
                root.labelMask(),
                ROOT,
                Trajectory.straight(root.config(), root.config()),
                generation
        );
    }

    /**
     * Moves {@code childId} under {@code newParentId}. The old tree edge is kept as a cross
     * edge and costs are propagated through the moved subtree.
     *
     * @return number of vertices whose cost changed.
     * @throws IllegalStateException when the move would create a cycle.
     */
    public int reparent(int childId, int newParentId, Trajectory connector) {
        ProductVertex child = requireLive(childId);
        ProductVertex newParent = requireLive(newParentId);
        if (childId == ROOT) {
            throw new IllegalStateException("root anchor cannot be re-parented");
        }
        if (isAncestor(childId, newParentId)) {
            throw new IllegalStateException("re-parenting " + childId + " under " + newParentId + " would create a cycle");
        }
        ProductEdge displaced = child.incoming();
        ProductVertex oldParent = requireLive(child.parent());
        oldParent.childIds().rem(childId);
        removeCrossEdge(newParentId, childId);

        ProductEdge edge = new ProductEdge(newParentId, childId, connector.length(), connector);
        child.attach(newParentId, edge, newParent.cost() + edge.cost());
        newParent.childIds().add(childId);
        if (displaced.from() != ROOT) {
            addCrossEdge(displaced);
        }
        return 1 + propagateCosts(childId);
    }

    /**
     * Recomputes costs below {@code vertexId} from their tree edges.
     *
     * @return number of descendants whose cost was rewritten.
     */
    public int propagateCosts(int vertexId) {
        int updated = 0;
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(vertexId);
        while (!queue.isEmpty()) {
            ProductVertex v = vertices.get(queue.dequeueInt());
            IntArrayList kids = v.childIds();
            for (int i = 0; i < kids.size(); i++) {
                ProductVertex c = vertices.get(kids.getInt(i));
                c.setCost(v.cost() + c.incoming().cost());
                updated++;
                queue.enqueue(c.id());
            }
        }
        return updated;
    }

    /**
     * @return true when {@code ancestorId} lies on the parent chain of {@code vertexId}
     * (a vertex is its own ancestor).
     */
    public boolean isAncestor(int ancestorId, int vertexId) {
        int current = vertexId;
        int guard = vertices.size();
        while (current >= 0 && guard-- >= 0) {
            if (current == ancestorId) {
                return true;
            }
            current = vertices.get(current).parent();
        }
        return false;
    }

    /**
     * Records an extra product transition. Duplicates and existing tree edges are ignored.
     *
     * @return true when the edge was added.
     */
    public boolean addCrossEdge(ProductEdge edge) {
        ProductVertex from = requireLive(edge.from());
        ProductVertex to = requireLive(edge.to());
        if (to.parent() == edge.from() || edge.from() == edge.to()) {
            return false;
        }
        ObjectArrayList<ProductEdge> out = from.crossOutEdges(true);
        for (int i = 0; i < out.size(); i++) {
            if (out.get(i).to() == edge.to()) {
                return false;
            }
        }
        out.add(edge);
        to.crossInEdges(true).add(edge);
        crossEdgeCount++;
        return true;
    }

    /**
     * @return true when a cross edge {@code fromId -> toId} existed and was removed.
     */
    public boolean removeCrossEdge(int fromId, int toId) {
        ProductVertex from = vertex(fromId);
        ProductVertex to = vertex(toId);
        if (from == null || to == null) {
            return false;
        }
        boolean removed = removeEdge(from.crossOutEdges(false), fromId, toId);
        if (removed) {
            removeEdge(to.crossInEdges(false), fromId, toId);
            crossEdgeCount--;
        }
        return removed;
    }

    private static boolean removeEdge(ObjectArrayList<ProductEdge> edges, int fromId, int toId) {
        if (edges == null) {
            return false;
        }
        for (int i = 0; i < edges.size(); i++) {
            if (edges.get(i).connects(fromId, toId)) {
                edges.remove(i);
                return true;
            }
        }
        return false;
    }

    /**
     * @return the tree or cross edge {@code fromId -> toId}, or {@code null}.
     */
    public ProductEdge edge(int fromId, int toId) {
        ProductVertex to = vertex(toId);
        if (to == null || vertex(fromId) == null) {
            return null;
        }
        if (to.parent() == fromId) {
            return to.incoming();
        }
        for (ProductEdge e : to.crossIn()) {
            if (e.from() == fromId) {
                return e;
            }
        }
        return null;
    }

    /**
     * Removes {@code vertexId} and its whole subtree, including every cross edge touching a
     * removed vertex.
     *
     * @return removed ids in breadth-first order.
     */
    public IntList removeSubtree(int vertexId) {
        ProductVertex top = requireLive(vertexId);
        if (vertexId == ROOT) {
            throw new IllegalStateException("root anchor cannot be removed");
        }
        vertices.get(top.parent()).childIds().rem(vertexId);
        IntArrayList removed = new IntArrayList();
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(vertexId);
        while (!queue.isEmpty()) {
            int id = queue.dequeueInt();
            removed.add(id);
            IntArrayList kids = vertices.get(id).childIds();
            for (int i = 0; i < kids.size(); i++) {
                queue.enqueue(kids.getInt(i));
            }
        }
        for (int i = 0; i < removed.size(); i++) {
            detachCrossEdges(vertices.get(removed.getInt(i)));
        }
        for (int i = 0; i < removed.size(); i++) {
            int id = removed.getInt(i);
            index.remove(id);
            vertices.set(id, null);
            liveCount--;
        }
        return removed;
    }

    private void detachCrossEdges(ProductVertex v) {
        ObjectArrayList<ProductEdge> out = v.crossOutEdges(false);
        if (out != null) {
            for (ProductEdge e : out.toArray(new ProductEdge[0])) {
                removeCrossEdge(e.from(), e.to());
            }
        }
        ObjectArrayList<ProductEdge> in = v.crossInEdges(false);
        if (in != null) {
            for (ProductEdge e : in.toArray(new ProductEdge[0])) {
                removeCrossEdge(e.from(), e.to());
            }
        }
    }

    /**
     * Updates the labels of a vertex in place. Callers must re-validate its incoming
     * transitions afterwards.
     */
    public void relabel(int vertexId, Configuration labeled, long labelMask, long generation) {
        requireLive(vertexId).relabel(labeled, labelMask, generation);
    }

    /**
     * Up to {@code k} nearest non-root vertices passing {@code filter}, ordered by (distance, id).
     */
    public IntList nearest(Configuration query, int k, IntPredicate filter) {
        return index.nearest(query.x(), query.y(), k, filter);
    }

    /**
     * Non-root vertices within {@code radius}, ordered by (distance, id).
     */
    public IntList near(Configuration query, double radius) {
        return index.withinRadius(query.x(), query.y(), radius, id -> true);
    }

    /**
     * Tree path from the first start vertex to {@code vertexId}, root anchor excluded.
     */
    public IntList pathFromStart(int vertexId) {
        IntArrayList path = new IntArrayList();
        int current = vertexId;
        while (current != ROOT) {
            path.add(current);
            current = requireLive(current).parent();
        }
        IntArrayList reversed = new IntArrayList(path.size());
        for (int i = path.size() - 1; i >= 0; i--) {
            reversed.add(path.getInt(i));
        }
        return reversed;
    }

    /**
     * @return ids of live vertices in ascending order, root included.
     */
    public IntList liveIds() {
        IntArrayList ids = new IntArrayList(liveCount);
        for (int i = 0; i < vertices.size(); i++) {
            if (vertices.get(i) != null) {
                ids.add(i);
            }
        }
        return ids;
    }

    /**
     * Checks the structural invariants: every non-root vertex has a live parent that lists it
     * as a child, its cost equals parent cost plus edge cost, parent chains reach the root
     * without repetition, and cross edges connect live vertices.
     *
     * @throws IllegalStateException describing the first violation.
     */
    public void verifyInvariants() {
        int live = 0;
        int cross = 0;
        for (int id = 0; id < vertices.size(); id++) {
            ProductVertex v = vertices.get(id);
            if (v == null) {
                continue;
            }
            live++;
            for (ProductEdge e : v.crossOut()) {
                if (vertex(e.to()) == null || e.from() != id) {
                    throw new IllegalStateException("dangling cross edge " + e.from() + " -> " + e.to());
                }
                cross++;
            }
            if (id == ROOT) {
                if (v.parent() != -1) {
                    throw new IllegalStateException("root anchor has a parent");
                }
                continue;
            }
            ProductVertex parent = vertex(v.parent());
            if (parent == null) {
                throw new IllegalStateException("vertex " + id + " has dead parent " + v.parent());
            }
            if (!parent.childIds().contains(id)) {
                throw new IllegalStateException("vertex " + id + " missing from children of " + v.parent());
            }
            ProductEdge edge = v.incoming();
            if (edge == null || edge.from() != v.parent() || edge.to() != id) {
                throw new IllegalStateException("vertex " + id + " has inconsistent tree edge " + edge);
            }
            double expected = parent.cost() + edge.cost();
            if (Math.abs(v.cost() - expected) > COST_TOLERANCE * Math.max(1.0d, expected)) {
                throw new IllegalStateException(
                        "vertex " + id + " cost " + v.cost() + " != parent cost + edge cost " + expected
                );
            }
            int steps = 0;
            int current = id;
            while (current != ROOT) {
                ProductVertex step = vertex(current);
                current = step == null ? -1 : step.parent();
                if (++steps > liveCount || current < 0) {
                    throw new IllegalStateException("parent chain of vertex " + id + " does not reach the root");
                }
            }
        }
        if (live != liveCount) {
            throw new IllegalStateException("live count " + liveCount + " != " + live);
        }
        if (cross != crossEdgeCount) {
            throw new IllegalStateException("cross edge count " + crossEdgeCount + " != " + cross);
        }
    }

    private ProductVertex requireLive(int id) {
        ProductVertex v = vertex(id);
        if (v == null) {
            throw new IllegalArgumentException("vertex " + id + " is not live");
        }
        return v;
    }
}
