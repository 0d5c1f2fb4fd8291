package org.Aayush.planning.core;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.planning.automaton.PropositionAlphabet;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.graph.ProductEdge;
import org.Aayush.planning.graph.ProductGraph;
import org.Aayush.planning.graph.ProductVertex;
import org.Aayush.planning.sampling.LocalPlanner;
import org.Aayush.planning.sampling.RegionBiasedSampler;
import org.Aayush.planning.sampling.Sampler;
import org.Aayush.planning.sampling.Trajectory;
import org.Aayush.planning.sampling.UniformSampler;
import org.Aayush.planning.search.AcceptingCycle;
import org.Aayush.planning.search.AcceptingCycleSearch;
import org.Aayush.planning.search.ProductPotentials;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.Workspace;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Sampling-based product-space planner (RRG with RRT*-style rewiring).
 * <p>
 * One {@link #iterate()} call samples a configuration, steers towards it from the nearest
 * vertex that can make automaton progress there, inserts one product vertex per automaton
 * state that the new configuration can be entered in from a traversable neighbor, and
 * rewires neighbors through each new vertex. Every feasible
 * product transition found on the way is kept, as a tree edge or a cross edge, so accepting
 * cycles can be found later by {@link AcceptingCycleSearch}.
 * </p>
 * <p>
 * Two plan candidates are tracked: the cheapest vertex where parking forever is accepted,
 * and the cheapest lasso through an accepting vertex found by the periodic cycle sweep.
 * </p>
 * <p>
 * <strong>Single writer:</strong> not thread-safe; owned by one planning thread.
 * </p>
 */
@Slf4j
public final class PlanningEngine {
    private static final double COST_EPSILON = 1e-9;

    @Getter
    @Accessors(fluent = true)
    private final Workspace workspace;
    @Getter
    @Accessors(fluent = true)
    private final SpecificationAutomaton automaton;
    @Getter
    @Accessors(fluent = true)
    private final PlannerConfig config;
    @Getter
    @Accessors(fluent = true)
    private final ProductGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final LocalPlanner localPlanner;
    private final PropositionAlphabet alphabet;
    private final Sampler sampler;
    private final Random random;
    private final AcceptingCycleSearch cycleSearch;
    private final IntRBTreeSet stutterVertices = new IntRBTreeSet();

    private int bestStutter = -1;
    private AcceptingCycle bestCycle;
    private double lastBestCost = Double.POSITIVE_INFINITY;
    private double checkpointCost = Double.POSITIVE_INFINITY;

    /** Iterations run since creation. */
    @Getter
    @Accessors(fluent = true)
    private long iterations;
    /** Times the best plan cost strictly improved. */
    @Getter
    @Accessors(fluent = true)
    private int plansFound;
    @Getter
    @Accessors(fluent = true)
    private long rewires;

    private PlanningEngine(
            Workspace workspace,
            SpecificationAutomaton automaton,
            PlannerConfig config,
            ProductGraph graph
    ) {
        this.workspace = workspace;
        this.automaton = automaton;
        this.config = config;
        this.graph = graph;
        this.alphabet = automaton.alphabet();
        this.localPlanner = new LocalPlanner(workspace, config.getStepSize(), config.getCollisionResolution());
        this.sampler = config.getSamplerPolicy() == SamplerPolicy.UNIFORM
                ? new UniformSampler(workspace)
                : new RegionBiasedSampler(workspace, automaton, config.getRegionBias());
        this.random = new Random(config.getSeed());
        this.cycleSearch = new AcceptingCycleSearch(graph, automaton);
    }

    /**
     * Creates an engine whose graph holds the root anchor and one start vertex per
     * automaton state entered on the start labels.
     *
     * @param start start configuration, free in the workspace.
     * @throws PlanningException with {@link PlanningException#REASON_START_REJECTED} when the
     *                           start labels already violate the formula.
     */
    public static PlanningEngine create(
            Workspace workspace,
            SpecificationAutomaton automaton,
            Configuration start,
            PlannerConfig config
    ) {
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(automaton, "automaton");
        Objects.requireNonNull(config, "config").validate();
        Configuration labeled = workspace.label(start);
        long mask = automaton.alphabet().mask(labeled.labels());
        IntList entry = automaton.successors(SpecificationAutomaton.INIT, mask);
        if (entry.isEmpty()) {
            throw new PlanningException(
                    PlanningException.REASON_START_REJECTED,
                    "start labels " + labeled.labels() + " already violate the formula"
            );
        }
        ProductGraph graph = new ProductGraph(labeled, mask, config.getStepSize(), workspace.version());
        PlanningEngine engine = new PlanningEngine(workspace, automaton, config, graph);
        for (int i = 0; i < entry.size(); i++) {
            ProductVertex v = graph.addStartVertex(entry.getInt(i), workspace.version());
            engine.trackStutter(v);
        }
        return engine;
    }

    /**
     * Runs one sample-extend-rewire iteration, plus a cycle sweep every
     * {@code cycleCheckInterval} iterations.
     *
     * @return true when the graph grew.
     */
    public boolean iterate() {
        iterations++;
        boolean grew = extend(sampler.sample(random));
        if (iterations % config.getCycleCheckInterval() == 0) {
            sweep();
        }
        return grew;
    }

    /**
     * @return true when no further vertex may be inserted.
     */
    public boolean atVertexLimit() {
        return graph.size() - 1 >= config.getMaxVertices();
    }

    /**
     * Refreshes the parking candidate from current costs and searches for a cheaper lasso.
     */
    public void sweep() {
        refreshStutterBest();
        Optional<AcceptingCycle> found = cycleSearch.search(config.getMaxCycleSources(), bestCost());
        found.ifPresent(cycle -> bestCycle = cycle);
        noteBest();
    }

    /**
     * Convergence checkpoint, evaluated every {@code convergenceWindow} iterations of a run.
     *
     * @param runIterations iterations since the current run started.
     * @return true when the best cost improved by less than the relative tolerance over the
     * last window.
     */
    public boolean converged(long runIterations) {
        int window = config.getConvergenceWindow();
        if (window == 0 || runIterations == 0 || runIterations % window != 0) {
            return false;
        }
        sweep();
        double cost = bestCost();
        boolean converged = Double.isFinite(checkpointCost)
                && checkpointCost - cost <= config.getConvergenceTolerance() * checkpointCost;
        log.debug("convergence checkpoint at {}: previous={}, current={}, converged={}",
                iterations, checkpointCost, cost, converged);
        checkpointCost = cost;
        return converged;
    }

    public void resetConvergence() {
        checkpointCost = Double.POSITIVE_INFINITY;
    }

    /**
     * @return cost of the best candidate held, or {@code +INF}.
     */
    public double bestCost() {
        return Math.min(stutterCost(), cycleCost());
    }

    public boolean hasPlan() {
        return bestStutter >= 0 || bestCycle != null;
    }

    /**
     * @return kind of the cheapest candidate, without materializing it.
     */
    public Optional<Plan.AcceptanceKind> bestAcceptance() {
        if (bestStutter >= 0 && stutterCost() <= cycleCost()) {
            return Optional.of(Plan.AcceptanceKind.STUTTER);
        }
        return bestCycle == null ? Optional.empty() : Optional.of(Plan.AcceptanceKind.CYCLE);
    }

    /**
     * Potentials of the current graph, for guiding execution toward acceptance.
     */
    public ProductPotentials potentials() {
        return ProductPotentials.compute(graph, automaton);
    }

    /**
     * Materializes the cheapest candidate against the current tree.
     */
    public Optional<Plan> bestPlan() {
        double stutter = stutterCost();
        double cycle = cycleCost();
        if (bestStutter >= 0 && stutter <= cycle) {
            return Optional.of(stutterPlan(bestStutter));
        }
        if (bestCycle != null) {
            return Optional.of(cyclePlan(bestCycle));
        }
        return Optional.empty();
    }

    /**
     * Re-derives candidates after the graph was repaired in place.
     *
     * @return true when a previously held candidate was discarded.
     */
    public boolean onGraphRepaired() {
        boolean discarded = false;
        int previousStutter = bestStutter;
        stutterVertices.clear();
        IntList live = graph.liveIds();
        for (int i = 0; i < live.size(); i++) {
            int id = live.getInt(i);
            if (id != ProductGraph.ROOT) {
                trackStutterFlag(graph.vertex(id));
            }
        }
        bestStutter = -1;
        refreshStutterBest();
        if (previousStutter >= 0 && !stutterVertices.contains(previousStutter)) {
            discarded = true;
        }
        if (bestCycle != null && !isIntact(bestCycle)) {
            log.debug("held lasso through vertex {} lost to repair", bestCycle.acceptingVertex());
            bestCycle = null;
            discarded = true;
        }
        lastBestCost = bestCost();
        resetConvergence();
        return discarded;
    }

    private boolean extend(Configuration sample) {
        IntList candidates = graph.nearest(sample, config.getNearestCandidates(), id -> true);
        for (int i = 0; i < candidates.size(); i++) {
            ProductVertex near = graph.vertex(candidates.getInt(i));
            Optional<Configuration> steered = localPlanner.steer(near.config(), sample);
            if (steered.isEmpty()) {
                continue;
            }
            Configuration q = steered.get();
            if (!localPlanner.isLabelConsistent(near.config(), q)) {
                continue;
            }
            long mask = alphabet.mask(q.labels());
            if (automaton.successors(near.state(), mask).isEmpty()) {
                continue;
            }
            return insert(near, q, mask);
        }
        return false;
    }

    /**
     * Inserts {@code q} once for every automaton state some traversable neighbor enters on
     * its labels, each under its cheapest admissible parent.
     *
     * @return false when the vertex limit leaves no room for the new vertices.
     */
    private boolean insert(ProductVertex near, Configuration q, long mask) {
        double radius = config.rewireRadius(graph.size() - 1, workspace.dimension());
        IntList nearIds = graph.near(q, radius);
        Map<Configuration, Boolean> traversable = new IdentityHashMap<>();
        traversable.put(near.config(), Boolean.TRUE);

        IntArrayList parents = new IntArrayList();
        parents.add(near.id());
        for (int i = 0; i < nearIds.size(); i++) {
            ProductVertex candidate = graph.vertex(nearIds.getInt(i));
            if (candidate.id() != near.id() && !candidate.config().samePoint(q)
                    && !automaton.successors(candidate.state(), mask).isEmpty()
                    && traversable(traversable, candidate.config(), q)) {
                parents.add(candidate.id());
            }
        }
        IntRBTreeSet states = new IntRBTreeSet();
        for (int i = 0; i < parents.size(); i++) {
            ProductVertex parent = graph.vertex(parents.getInt(i));
            IntList next = automaton.successors(parent.state(), mask);
            for (int k = 0; k < next.size(); k++) {
                if (parent.id() == near.id() || mayPrecede(parent, next.getInt(k), mask)) {
                    states.add(next.getInt(k));
                }
            }
        }
        if (graph.size() - 1 + states.size() > config.getMaxVertices()) {
            return false;
        }

        IntArrayList created = new IntArrayList(states.size());
        IntIterator it = states.iterator();
        while (it.hasNext()) {
            int state = it.nextInt();
            ProductVertex parent = null;
            double parentCost = Double.POSITIVE_INFINITY;
            IntArrayList admissible = new IntArrayList();
            for (int i = 0; i < parents.size(); i++) {
                ProductVertex candidate = graph.vertex(parents.getInt(i));
                boolean allowed = candidate.id() == near.id()
                        ? automaton.successors(candidate.state(), mask).contains(state)
                        : mayPrecede(candidate, state, mask);
                if (!allowed) {
                    continue;
                }
                admissible.add(candidate.id());
                double cost = candidate.cost() + candidate.config().distanceTo(q);
                if (parent == null || cost < parentCost - COST_EPSILON
                        || (cost <= parentCost + COST_EPSILON && candidate.id() < parent.id())) {
                    parent = candidate;
                    parentCost = cost;
                }
            }
            ProductVertex vertex = graph.addVertex(
                    q, state, mask, parent.id(), Trajectory.straight(parent.config(), q), workspace.version()
            );
            for (int i = 0; i < admissible.size(); i++) {
                int from = admissible.getInt(i);
                if (from != parent.id()) {
                    graph.addCrossEdge(ProductEdge.straight(graph.vertex(from), vertex));
                }
            }
            rewire(vertex, nearIds, traversable);
            trackStutter(vertex);
            created.add(vertex.id());
        }
        propagate(created);
        return true;
    }

    /**
     * Spreads automaton states reached at new vertices to the configurations around them.
     * A neighbor configuration gains a vertex for every state it is entered in from a new
     * vertex and does not hold yet; gained vertices are expanded the same way.
     */
    private void propagate(IntList seeds) {
        IntArrayFIFOQueue pending = new IntArrayFIFOQueue(Math.max(4, seeds.size()));
        for (int i = 0; i < seeds.size(); i++) {
            pending.enqueue(seeds.getInt(i));
        }
        int seedsLeft = seeds.size();
        int spread = 0;
        while (!pending.isEmpty() && !atVertexLimit()) {
            boolean seed = seedsLeft-- > 0;
            ProductVertex from = graph.vertex(pending.dequeueInt());
            if (from == null) {
                continue;
            }
            double radius = config.rewireRadius(graph.size() - 1, workspace.dimension());
            IntList nearIds = graph.near(from.config(), radius);
            IntArrayList gainedHere = new IntArrayList();
            Map<Configuration, Boolean> traversable = new IdentityHashMap<>();
            for (int i = 0; i < nearIds.size() && !atVertexLimit(); i++) {
                ProductVertex neighbor = graph.vertex(nearIds.getInt(i));
                if (neighbor.config().samePoint(from.config())) {
                    continue;
                }
                IntList next = automaton.successors(from.state(), neighbor.labelMask());
                for (int k = 0; k < next.size() && !atVertexLimit(); k++) {
                    int state = next.getInt(k);
                    if (holdsState(nearIds, neighbor.config(), state)
                            || holdsState(gainedHere, neighbor.config(), state)
                            || !mayPrecede(from, state, neighbor.labelMask())
                            || !traversable(traversable, neighbor.config(), from.config())) {
                        continue;
                    }
                    ProductVertex gained = graph.addVertex(
                            neighbor.config(), state, neighbor.labelMask(), from.id(),
                            Trajectory.straight(from.config(), neighbor.config()), workspace.version()
                    );
                    spread++;
                    trackStutter(gained);
                    pending.enqueue(gained.id());
                    gainedHere.add(gained.id());
                }
            }
            if (!seed) {
                rewire(from, nearIds, traversable);
            }
        }
        if (spread > 0) {
            log.trace("propagated {} automaton states to neighboring configurations", spread);
        }
    }

    private boolean holdsState(IntList ids, Configuration point, int state) {
        for (int i = 0; i < ids.size(); i++) {
            ProductVertex v = graph.vertex(ids.getInt(i));
            if (v.state() == state && v.config().samePoint(point)) {
                return true;
            }
        }
        return false;
    }

    private void rewire(ProductVertex via, IntList nearIds, Map<Configuration, Boolean> traversable) {
        for (int i = 0; i < nearIds.size(); i++) {
            ProductVertex target = graph.vertex(nearIds.getInt(i));
            if (target == null || target.config().samePoint(via.config())) {
                continue;
            }
            if (!automaton.successors(via.state(), target.labelMask()).contains(target.state())) {
                continue;
            }
            if (!traversable(traversable, target.config(), via.config())) {
                continue;
            }
            double cost = via.cost() + via.config().distanceTo(target.config());
            boolean policyAllows = config.getRewirePolicy() == RewirePolicy.TRANSITION
                    || target.state() == via.state();
            if (policyAllows && cost < target.cost() - COST_EPSILON && !graph.isAncestor(target.id(), via.id())) {
                graph.reparent(target.id(), via.id(), Trajectory.straight(via.config(), target.config()));
                rewires++;
            } else {
                graph.addCrossEdge(ProductEdge.straight(via, target));
            }
        }
    }

    /**
     * Whether {@code candidate} may be the tree parent of a new vertex in {@code state}.
     */
    private boolean mayPrecede(ProductVertex candidate, int state, long mask) {
        if (config.getRewirePolicy() == RewirePolicy.SAME_STATE && candidate.state() != state) {
            return false;
        }
        return automaton.successors(candidate.state(), mask).contains(state);
    }

    private boolean traversable(Map<Configuration, Boolean> memo, Configuration other, Configuration q) {
        Boolean known = memo.get(other);
        if (known == null) {
            known = localPlanner.isTraversable(other, q);
            memo.put(other, known);
        }
        return known;
    }

    private void trackStutter(ProductVertex v) {
        if (trackStutterFlag(v) && (bestStutter < 0 || cheaper(v, graph.vertex(bestStutter)))) {
            bestStutter = v.id();
            noteBest();
        }
    }

    private boolean trackStutterFlag(ProductVertex v) {
        if (automaton.acceptsConstantSuffix(v.state(), v.labelMask())) {
            stutterVertices.add(v.id());
            return true;
        }
        return false;
    }

    private void refreshStutterBest() {
        int best = -1;
        IntIterator it = stutterVertices.iterator();
        while (it.hasNext()) {
            int id = it.nextInt();
            ProductVertex v = graph.vertex(id);
            if (v == null) {
                it.remove();
            } else if (best < 0 || cheaper(v, graph.vertex(best))) {
                best = id;
            }
        }
        bestStutter = best;
    }

    private static boolean cheaper(ProductVertex a, ProductVertex b) {
        int byCost = Double.compare(a.cost(), b.cost());
        return byCost < 0 || (byCost == 0 && a.id() < b.id());
    }

    private void noteBest() {
        double cost = bestCost();
        if (cost < lastBestCost - COST_EPSILON) {
            if (!Double.isFinite(lastBestCost)) {
                log.info("first plan found after {} iterations: cost={}, vertices={}",
                        iterations, cost, graph.size() - 1);
            }
            plansFound++;
        }
        lastBestCost = Math.min(lastBestCost, cost);
    }

    private double stutterCost() {
        return bestStutter < 0 ? Double.POSITIVE_INFINITY : graph.vertex(bestStutter).cost();
    }

    private double cycleCost() {
        return bestCycle == null
                ? Double.POSITIVE_INFINITY
                : graph.vertex(bestCycle.acceptingVertex()).cost() + bestCycle.loopCost();
    }

    private boolean isIntact(AcceptingCycle cycle) {
        int previous = cycle.acceptingVertex();
        if (!graph.isLive(previous)) {
            return false;
        }
        IntList loop = cycle.loop();
        for (int i = 0; i < loop.size(); i++) {
            int id = loop.getInt(i);
            if (graph.edge(previous, id) == null) {
                return false;
            }
            previous = id;
        }
        return graph.edge(previous, cycle.acceptingVertex()) != null;
    }

    private Plan stutterPlan(int vertexId) {
        IntList ids = graph.pathFromStart(vertexId);
        List<Trajectory> segments = new ArrayList<>(ids.size());
        for (int i = 1; i < ids.size(); i++) {
            segments.add(graph.vertex(ids.getInt(i)).incoming().trajectory());
        }
        return materialize(ids, ids.size() - 1, graph.vertex(vertexId).cost(), Plan.AcceptanceKind.STUTTER, segments);
    }

    private Plan cyclePlan(AcceptingCycle cycle) {
        IntArrayList ids = new IntArrayList(graph.pathFromStart(cycle.acceptingVertex()));
        int suffixStart = ids.size() - 1;
        ids.addAll(cycle.loop());
        List<Trajectory> segments = new ArrayList<>(ids.size());
        double loopCost = 0.0d;
        for (int i = 1; i <= ids.size(); i++) {
            int from = ids.getInt(i - 1);
            int to = i < ids.size() ? ids.getInt(i) : cycle.acceptingVertex();
            ProductEdge edge = graph.edge(from, to);
            segments.add(edge.trajectory());
            if (i > suffixStart) {
                loopCost += edge.cost();
            }
        }
        double cost = graph.vertex(cycle.acceptingVertex()).cost() + loopCost;
        return materialize(ids, suffixStart, cost, Plan.AcceptanceKind.CYCLE, segments);
    }

    private Plan materialize(
            IntList ids,
            int suffixStart,
            double cost,
            Plan.AcceptanceKind kind,
            List<Trajectory> segments
    ) {
        List<Configuration> configurations = new ArrayList<>(ids.size());
        IntArrayList states = new IntArrayList(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            ProductVertex v = graph.vertex(ids.getInt(i));
            configurations.add(v.config());
            states.add(v.state());
        }
        return new Plan(configurations, states, ids, suffixStart, cost, kind, segments);
    }
}
