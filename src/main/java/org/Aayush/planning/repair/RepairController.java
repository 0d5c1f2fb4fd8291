package org.Aayush.planning.repair;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.planning.automaton.PropositionAlphabet;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.core.PlanningEngine;
import org.Aayush.planning.graph.ProductEdge;
import org.Aayush.planning.graph.ProductGraph;
import org.Aayush.planning.graph.ProductVertex;
import org.Aayush.planning.sampling.LocalPlanner;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.RegionUpdate;
import org.Aayush.planning.workspace.UpdateResult;
import org.Aayush.planning.workspace.Workspace;

import java.util.List;
import java.util.Objects;

/**
 * Repairs the product graph in place after a region change.
 * <ol>
 * <li>Vertices inside the changed envelope are relabeled, or marked invalid when now
 * blocked.</li>
 * <li>Tree and cross edges whose connector touches the envelope, or whose endpoint was
 * relabeled, are re-checked for traversability and for the automaton transition into
 * their target.</li>
 * <li>Invalid cross edges are dropped; invalid vertices are removed with their
 * subtrees.</li>
 * <li>Start vertices are reconciled with the automaton states entered on the new start
 * labels, and the engine re-derives its plan candidates.</li>
 * </ol>
 * A blocked start, or start labels that now violate the formula, make the mission
 * unrecoverable; the graph is then left untouched.
 */
@Slf4j
public final class RepairController {
    private final PlanningEngine engine;
    private final ProductGraph graph;
    private final Workspace workspace;
    private final SpecificationAutomaton automaton;
    private final LocalPlanner localPlanner;

    public RepairController(PlanningEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.graph = engine.graph();
        this.workspace = engine.workspace();
        this.automaton = engine.automaton();
        this.localPlanner = engine.localPlanner();
    }

    /**
     * Applies {@code update} to the workspace, then repairs the graph.
     *
     * @throws org.Aayush.planning.workspace.GeometryException when the workspace rejects the
     *                                                         update; nothing changes then.
     */
    public RepairReport apply(RegionUpdate update) {
        return repair(workspace.applyUpdate(update));
    }

    public RepairReport repair(UpdateResult result) {
        long started = System.nanoTime();
        PropositionAlphabet alphabet = automaton.alphabet();
        long version = result.version();
        int n = graph.idBound();
        boolean[] invalid = new boolean[n];
        boolean[] relabeled = new boolean[n];

        Configuration start = graph.root().config();
        Configuration startLabeled = start;
        if (result.touches(start.x(), start.y())) {
            if (!workspace.isFree(start)) {
                return unrecoverable(result, started, "start " + start + " is now blocked");
            }
            startLabeled = workspace.label(start);
        }
        long startMask = alphabet.mask(startLabeled.labels());
        IntList entry = automaton.successors(SpecificationAutomaton.INIT, startMask);
        if (entry.isEmpty()) {
            return unrecoverable(result, started, "start labels " + startLabeled.labels() + " violate the formula");
        }
        if (!startLabeled.labels().equals(start.labels())) {
            graph.relabel(ProductGraph.ROOT, startLabeled, startMask, version);
            relabeled[ProductGraph.ROOT] = true;
        }

        int relabelCount = 0;
        int invalidCount = 0;
        for (int id = 1; id < n; id++) {
            ProductVertex v = graph.vertex(id);
            if (v == null || !result.touches(v.config().x(), v.config().y())) {
                continue;
            }
            if (result.obstaclesChanged() && !workspace.isFree(v.config())) {
                invalid[id] = true;
                invalidCount++;
                continue;
            }
            Configuration labeled = workspace.label(v.config());
            if (!labeled.labels().equals(v.config().labels())) {
                graph.relabel(id, labeled, alphabet.mask(labeled.labels()), version);
                relabeled[id] = true;
                relabelCount++;
            }
        }

        for (int id = 1; id < n; id++) {
            ProductVertex v = graph.vertex(id);
            if (v != null && !invalid[id] && !isValid(v.incoming(), result, relabeled)) {
                invalid[id] = true;
                invalidCount++;
            }
        }

        int crossRemoved = 0;
        for (int id = 0; id < n; id++) {
            ProductVertex v = graph.vertex(id);
            if (v == null || invalid[id]) {
                continue;
            }
            List<ProductEdge> out = List.copyOf(v.crossOut());
            for (ProductEdge edge : out) {
                if (!invalid[edge.to()] && !isValid(edge, result, relabeled)
                        && graph.removeCrossEdge(edge.from(), edge.to())) {
                    crossRemoved++;
                }
            }
        }

        int removed = 0;
        for (int id = 1; id < n; id++) {
            if (invalid[id] && graph.isLive(id)) {
                removed += graph.removeSubtree(id).size();
            }
        }

        IntSet startStates = new IntOpenHashSet();
        IntList rootChildren = graph.root().children();
        for (int i = 0; i < rootChildren.size(); i++) {
            startStates.add(graph.vertex(rootChildren.getInt(i)).state());
        }
        int added = 0;
        for (int i = 0; i < entry.size(); i++) {
            if (!startStates.contains(entry.getInt(i))) {
                graph.addStartVertex(entry.getInt(i), version);
                added++;
            }
        }

        boolean discarded = engine.onGraphRepaired();
        RepairReport report = RepairReport.builder()
                .update(result.update())
                .affectedRegionIds(result.affectedRegionIds())
                .workspaceVersion(version)
                .verticesRelabeled(relabelCount)
                .verticesInvalidated(invalidCount)
                .verticesRemoved(removed)
                .crossEdgesRemoved(crossRemoved)
                .startVerticesAdded(added)
                .planDiscarded(discarded)
                .unrecoverable(false)
                .durationNanos(System.nanoTime() - started)
                .build();
        log.info(
                "repair v{} {}: relabeled={}, invalid={}, removed={}, crossRemoved={}, startsAdded={}, planDiscarded={}",
                version, result.affectedRegionIds(), relabelCount, invalidCount, removed, crossRemoved, added, discarded
        );
        return report;
    }

    /**
     * An edge stays valid when it is untouched by the change, or when its connector is still
     * traversable and its target state is still entered from its source state on the
     * target's labels.
     */
    private boolean isValid(ProductEdge edge, UpdateResult result, boolean[] relabeled) {
        double[] box = edge.trajectory().bounds();
        boolean touched = result.touches(box[0], box[1], box[2], box[3]);
        if (!touched && !relabeled[edge.from()] && !relabeled[edge.to()]) {
            return true;
        }
        ProductVertex from = graph.vertex(edge.from());
        ProductVertex to = graph.vertex(edge.to());
        if (touched && !localPlanner.isTraversable(from.config(), to.config())) {
            return false;
        }
        return automaton.successors(from.state(), to.labelMask()).contains(to.state());
    }

    private RepairReport unrecoverable(UpdateResult result, long started, String reason) {
        log.warn("unrecoverable repair after change of {}: {}", result.affectedRegionIds(), reason);
        return RepairReport.builder()
                .update(result.update())
                .affectedRegionIds(result.affectedRegionIds())
                .workspaceVersion(result.version())
                .unrecoverable(true)
                .durationNanos(System.nanoTime() - started)
                .build();
    }
}
