package org.Aayush.planning.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.planning.automaton.BuchiAutomaton;
import org.Aayush.planning.automaton.LtlTranslator;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.graph.ProductGraph;
import org.Aayush.planning.repair.EnvironmentEventQueue;
import org.Aayush.planning.repair.RepairController;
import org.Aayush.planning.repair.RepairReport;
import org.Aayush.planning.search.ProductPotentials;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.GeometryException;
import org.Aayush.planning.workspace.RegionUpdate;
import org.Aayush.planning.workspace.Workspace;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One mission: owns the workspace, automaton, product graph, engine and repair controller.
 * <p>
 * {@link #plan()} and {@link #drainUpdates()} run on the calling (planning) thread and are
 * mutually exclusive. {@link #submit(RegionUpdate)}, {@link #cancel()} and
 * {@link #diagnostics()} may be called from any thread. Queued updates are applied between
 * iterations, never during one.
 * </p>
 */
@Slf4j
public final class PlanningSession {
    @Getter
    @Accessors(fluent = true)
    private final Mission mission;
    @Getter
    @Accessors(fluent = true)
    private final PlannerConfig config;
    @Getter
    @Accessors(fluent = true)
    private final SpecificationAutomaton automaton;
    private final PlanningEngine engine;
    private final RepairController repairs;
    private final EnvironmentEventQueue events = new EnvironmentEventQueue();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final ReentrantLock planningLock = new ReentrantLock();

    private volatile PlanningDiagnostics diagnostics = PlanningDiagnostics.empty();
    private PlanningStatus lastStatus;
    private int repairsApplied;
    private int updatesRejected;
    private long verticesPruned;
    private SortedSet<String> unrecoverableRegions;

    private PlanningSession(Mission mission, PlannerConfig config, SpecificationAutomaton automaton, PlanningEngine engine) {
        this.mission = mission;
        this.config = config;
        this.automaton = automaton;
        this.engine = engine;
        this.repairs = new RepairController(engine);
    }

    /**
     * Translates the formula and seeds the product graph at the start configuration.
     *
     * @throws org.Aayush.planning.automaton.FormulaException for malformed or unsatisfiable formulas.
     * @throws GeometryException when the start has the wrong dimension or is not free.
     * @throws PlanningException for invalid parameters or start labels violating the formula.
     */
    public static PlanningSession open(Mission mission, PlannerConfig config) {
        Objects.requireNonNull(mission, "mission");
        Objects.requireNonNull(config, "config").validate();
        Workspace workspace = mission.getWorkspace();
        Configuration start = mission.getStart();
        if (start.dimension() != workspace.dimension()) {
            throw new GeometryException(
                    GeometryException.REASON_DIMENSION_MISMATCH,
                    "start has dimension " + start.dimension() + ", workspace expects " + workspace.dimension()
            );
        }
        if (!workspace.isFree(start)) {
            throw new GeometryException(GeometryException.REASON_START_NOT_FREE, "start " + start + " is not free");
        }
        BuchiAutomaton automaton = LtlTranslator.translate(mission.getFormula(), workspace.labels());
        PlanningEngine engine = PlanningEngine.create(workspace, automaton, start, config);
        log.info(
                "mission opened: formula='{}', automaton states={}, deterministic={}, regions={}, seed={}",
                mission.getFormula(), automaton.stateCount(), automaton.isDeterministic(),
                workspace.regions().size(), config.getSeed()
        );
        PlanningSession session = new PlanningSession(mission, config, automaton, engine);
        session.publish();
        return session;
    }

    /**
     * Runs iterations until a budget runs out, the best cost converges, {@link #cancel()} is
     * requested or a repair proves the mission unrecoverable. Every call gets a fresh
     * iteration and time budget and continues from the current graph.
     *
     * @throws PlanningException with {@link PlanningException#REASON_UNRECOVERABLE_REPAIR} when
     *                           called after an unrecoverable repair.
     * @throws IllegalStateException when another thread is already planning.
     */
    public PlanningOutcome plan() {
        if (!planningLock.tryLock()) {
            throw new IllegalStateException("plan() is already running on another thread");
        }
        try {
            requireRecoverable();
            long deadline = deadline(config.getTimeBudget());
            engine.resetConvergence();
            long run = 0;
            PlanningStatus status = null;
            while (status == null) {
                if (applyQueuedUpdates()) {
                    status = PlanningStatus.UNRECOVERABLE;
                } else if (cancelRequested.getAndSet(false)) {
                    status = PlanningStatus.CANCELLED;
                } else if (run >= config.getMaxIterations() || engine.atVertexLimit()
                        || System.nanoTime() - deadline > 0) {
                    status = engine.hasPlan() ? PlanningStatus.SOLVED : PlanningStatus.TIMEOUT;
                } else {
                    engine.iterate();
                    run++;
                    if (engine.converged(run) && engine.hasPlan()) {
                        log.debug("best cost converged after {} iterations", run);
                        status = PlanningStatus.SOLVED;
                    }
                    publish();
                }
            }
            if (status != PlanningStatus.UNRECOVERABLE) {
                engine.sweep();
            }
            return finish(status, run);
        } finally {
            planningLock.unlock();
        }
    }

    /**
     * Queues a region change; it is applied before the next planning iteration or by
     * {@link #drainUpdates()}.
     */
    public void submit(RegionUpdate update) {
        events.submit(update);
    }

    /**
     * Requests the running, or next, {@link #plan()} call to stop between iterations.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    /**
     * Applies queued updates now, outside a planning run.
     *
     * @return reports of the applied updates; rejected updates have none.
     */
    public List<RepairReport> drainUpdates() {
        planningLock.lock();
        try {
            requireRecoverable();
            List<RepairReport> reports = new ArrayList<>();
            applyQueuedUpdates(reports);
            publish();
            return reports;
        } finally {
            planningLock.unlock();
        }
    }

    public PlanningDiagnostics diagnostics() {
        return diagnostics;
    }

    /**
     * @return best plan held right now. Planning thread only.
     */
    public Optional<Plan> currentPlan() {
        return engine.bestPlan();
    }

    /**
     * Potentials over the graph as it stands, computed between planning runs.
     *
     * @throws IllegalStateException when another thread is planning.
     */
    public ProductPotentials potentials() {
        if (!planningLock.tryLock()) {
            throw new IllegalStateException("potentials are not available while plan() runs");
        }
        try {
            return engine.potentials();
        } finally {
            planningLock.unlock();
        }
    }

    public Workspace workspace() {
        return engine.workspace();
    }

    /**
     * @return the live graph, for inspection from the planning thread.
     */
    public ProductGraph graph() {
        return engine.graph();
    }

    public boolean isUnrecoverable() {
        return unrecoverableRegions != null;
    }

    private boolean applyQueuedUpdates() {
        return applyQueuedUpdates(null);
    }

    /**
     * @return true when an update made the mission unrecoverable.
     */
    private boolean applyQueuedUpdates(List<RepairReport> sink) {
        if (events.isEmpty()) {
            return false;
        }
        for (RegionUpdate update : events.drain()) {
            if (unrecoverableRegions != null) {
                log.warn("dropping update {} queued after an unrecoverable repair", update);
                continue;
            }
            RepairReport report;
            try {
                report = repairs.apply(update);
            } catch (GeometryException e) {
                updatesRejected++;
                log.warn("rejected environment update {}: {}", update, e.getMessage());
                continue;
            }
            repairsApplied++;
            verticesPruned += report.getVerticesRemoved();
            if (sink != null) {
                sink.add(report);
            }
            if (report.isUnrecoverable()) {
                unrecoverableRegions = Collections.unmodifiableSortedSet(new TreeSet<>(report.getAffectedRegionIds()));
            }
        }
        return unrecoverableRegions != null;
    }

    private void requireRecoverable() {
        if (unrecoverableRegions != null) {
            throw new PlanningException(
                    PlanningException.REASON_UNRECOVERABLE_REPAIR,
                    "session is unrecoverable after change of regions " + unrecoverableRegions
                            + "; open a new session"
            );
        }
    }

    private PlanningOutcome finish(PlanningStatus status, long run) {
        lastStatus = status;
        PlanningDiagnostics snapshot = publish();
        Plan plan = status == PlanningStatus.UNRECOVERABLE ? null : engine.bestPlan().orElse(null);
        PlanningOutcome outcome = PlanningOutcome.builder()
                .status(status)
                .plan(plan)
                .iterations(run)
                .offendingRegionIds(unrecoverableRegions == null ? new TreeSet<>() : unrecoverableRegions)
                .diagnostics(snapshot)
                .build();
        log.info(
                "planning finished: status={}, iterations={}, vertices={}, bestCost={}, acceptance={}",
                status, run, snapshot.getVertexCount(), snapshot.getBestCost(), snapshot.getAcceptance()
        );
        return outcome;
    }

    private PlanningDiagnostics publish() {
        ProductGraph graph = engine.graph();
        Plan.AcceptanceKind acceptance = null;
        double bestCost = Double.POSITIVE_INFINITY;
        if (engine.hasPlan() && unrecoverableRegions == null) {
            bestCost = engine.bestCost();
            acceptance = engine.bestAcceptance().orElse(null);
        }
        PlanningDiagnostics snapshot = PlanningDiagnostics.builder()
                .iterations(engine.iterations())
                .vertexCount(graph.size() - 1)
                .edgeCount(graph.edgeCount())
                .crossEdgeCount(graph.crossEdgeCount())
                .bestCost(bestCost)
                .acceptance(acceptance)
                .status(lastStatus)
                .plansFound(engine.plansFound())
                .repairsApplied(repairsApplied)
                .updatesRejected(updatesRejected)
                .verticesPruned(verticesPruned)
                .workspaceVersion(engine.workspace().version())
                .build();
        diagnostics = snapshot;
        return snapshot;
    }

    private static long deadline(Duration budget) {
        long now = System.nanoTime();
        return budget == null ? now + Long.MAX_VALUE / 2 : now + budget.toNanos();
    }
}
