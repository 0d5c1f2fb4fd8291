package org.Aayush.planning.core;

import org.Aayush.planning.automaton.BuchiAutomaton;
import org.Aayush.planning.automaton.LtlTranslator;
import org.Aayush.planning.graph.ProductGraph;
import org.Aayush.planning.testutil.MissionFixtures;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.PolygonWorkspace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Planning Engine Tests")
class PlanningEngineTest {

    private static PlanningEngine engine(String formula, PolygonWorkspace workspace, Configuration start, PlannerConfig config) {
        BuchiAutomaton automaton = LtlTranslator.translate(formula, workspace.labels());
        return PlanningEngine.create(workspace, automaton, start, config);
    }

    private static void run(PlanningEngine engine) {
        for (int i = 0; i < engine.config().getMaxIterations() && !engine.atVertexLimit(); i++) {
            engine.iterate();
        }
        engine.sweep();
    }

    private static void assertVerified(PlanningEngine engine, Plan plan) {
        PlanVerifier verifier = new PlanVerifier(engine.workspace(), engine.automaton(), 0.01d);
        PlanVerifier.Result result = verifier.verify(plan);
        assertTrue(result.isValid(), () -> plan + " " + result);
    }

    private static int firstIndexWith(List<SortedSet<String>> labels, String label, int from) {
        for (int i = from; i < labels.size(); i++) {
            if (labels.get(i).contains(label)) {
                return i;
            }
        }
        return -1;
    }

    @Nested
    @DisplayName("1. Seeding")
    class Seeding {

        @Test
        @DisplayName("Start vertices hang off the root anchor at zero cost")
        void testStartVertices() {
            PlanningEngine engine = engine(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(),
                    MissionFixtures.START, MissionFixtures.smallConfig()
            );
            ProductGraph graph = engine.graph();
            assertTrue(graph.size() >= 2, "root plus at least one start vertex");
            for (int id : graph.liveIds().toIntArray()) {
                if (id != ProductGraph.ROOT) {
                    assertEquals(ProductGraph.ROOT, graph.vertex(id).parent());
                    assertEquals(0.0d, graph.vertex(id).cost(), 0.0d);
                }
            }
            assertFalse(engine.hasPlan());
            assertTrue(engine.bestPlan().isEmpty());
            assertEquals(Double.POSITIVE_INFINITY, engine.bestCost());
        }

        @Test
        @DisplayName("Start labels that already violate the formula are rejected")
        void testStartRejected() {
            PlanningException ex = assertThrows(PlanningException.class, () -> engine(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(),
                    Configuration.of(3.0d, 5.0d), MissionFixtures.smallConfig()
            ));
            assertEquals(PlanningException.REASON_START_REJECTED, ex.reasonCode());
            assertTrue(ex.getMessage().contains("c"));
        }

        @Test
        @DisplayName("Invalid parameters are rejected before seeding")
        void testInvalidConfig() {
            PlannerConfig config = MissionFixtures.smallConfig().toBuilder().maxIterations(0).build();
            PlanningException ex = assertThrows(PlanningException.class, () -> engine(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(), MissionFixtures.START, config
            ));
            assertEquals(PlanningException.REASON_CONFIG_INVALID, ex.reasonCode());
        }
    }

    @Nested
    @DisplayName("2. Reach-Avoid Sequence")
    class Sequence {

        @Test
        @Timeout(value = 60, unit = TimeUnit.SECONDS)
        @DisplayName("Visits a, then b, never c, and parks")
        void testSequencePlan() {
            PlanningEngine engine = engine(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(),
                    MissionFixtures.START, MissionFixtures.smallConfig()
            );
            run(engine);

            assertTrue(engine.hasPlan(), "2500 iterations should solve the sequence mission");
            Plan plan = engine.bestPlan().orElseThrow();
            assertEquals(Plan.AcceptanceKind.STUTTER, plan.acceptance());
            assertEquals(plan.size() - 1, plan.suffixStart());
            assertEquals(plan.size() - 1, plan.segments().size());
            assertEquals(engine.bestCost(), plan.cost(), 1e-9);

            List<SortedSet<String>> labels = plan.labelSequence();
            int a = firstIndexWith(labels, "a", 0);
            assertTrue(a >= 0, "plan must visit a: " + labels);
            assertTrue(firstIndexWith(labels, "b", a) > a, "plan must visit b after a: " + labels);
            assertEquals(-1, firstIndexWith(labels, "c", 0), "plan must avoid c: " + labels);
            assertTrue(plan.cost() >= MissionFixtures.START.distanceTo(Configuration.of(1.0d, 4.4d)),
                    "cost is bounded below by the straight distance to a");

            assertVerified(engine, plan);
            engine.graph().verifyInvariants();
            assertTrue(engine.plansFound() >= 1);
        }

        @Test
        @Timeout(value = 60, unit = TimeUnit.SECONDS)
        @DisplayName("Same seed gives the same plan")
        void testDeterministic() {
            PlannerConfig config = MissionFixtures.smallConfig().toBuilder().maxIterations(1_200).build();
            PlanningEngine first = engine(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(), MissionFixtures.START, config
            );
            PlanningEngine second = engine(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(), MissionFixtures.START, config
            );
            run(first);
            run(second);

            assertEquals(first.graph().size(), second.graph().size());
            assertEquals(first.graph().edgeCount(), second.graph().edgeCount());
            assertEquals(first.bestCost(), second.bestCost(), 0.0d);
            assertEquals(first.bestPlan().map(Plan::vertexIds), second.bestPlan().map(Plan::vertexIds));
        }

        @Test
        @Timeout(value = 60, unit = TimeUnit.SECONDS)
        @DisplayName("Best cost never increases while the graph grows")
        void testMonotoneCost() {
            PlanningEngine engine = engine(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(),
                    MissionFixtures.START, MissionFixtures.smallConfig()
            );
            double previous = Double.POSITIVE_INFINITY;
            for (int i = 0; i < 2_500; i++) {
                engine.iterate();
                if (i % 250 == 249) {
                    engine.sweep();
                    double cost = engine.bestCost();
                    assertTrue(cost <= previous + 1e-9, "cost rose from " + previous + " to " + cost);
                    previous = cost;
                }
            }
        }

        @Test
        @Timeout(value = 60, unit = TimeUnit.SECONDS)
        @DisplayName("Same-state rewiring keeps the graph consistent")
        void testSameStatePolicy() {
            PlannerConfig config = MissionFixtures.smallConfig().toBuilder()
                    .rewirePolicy(RewirePolicy.SAME_STATE)
                    .maxIterations(1_500)
                    .build();
            PlanningEngine engine = engine(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(), MissionFixtures.START, config
            );
            run(engine);

            engine.graph().verifyInvariants();
            assertTrue(engine.graph().size() > 100, "graph should grow under either policy");
            engine.bestPlan().ifPresent(plan -> assertVerified(engine, plan));
        }
    }

    @Nested
    @DisplayName("3. Recurrence")
    class Recurrence {

        @Test
        @Timeout(value = 90, unit = TimeUnit.SECONDS)
        @DisplayName("Visiting a and b forever needs a cycle plan")
        void testLivenessPlan() {
            PlanningEngine engine = engine(
                    MissionFixtures.LIVENESS_FORMULA, MissionFixtures.twoRegions(),
                    Configuration.of(3.0d, 1.0d), MissionFixtures.smallConfig()
            );
            run(engine);

            assertTrue(engine.hasPlan(), "2500 iterations should close a loop through a and b");
            Plan plan = engine.bestPlan().orElseThrow();
            assertEquals(Plan.AcceptanceKind.CYCLE, plan.acceptance());
            assertEquals(plan.size(), plan.segments().size(), "cycle plans carry a closing segment");

            List<SortedSet<String>> suffix = plan.labelSequence().subList(plan.suffixStart(), plan.size());
            assertTrue(firstIndexWith(suffix, "a", 0) >= 0, "loop must pass a: " + suffix);
            assertTrue(firstIndexWith(suffix, "b", 0) >= 0, "loop must pass b: " + suffix);
            assertTrue(plan.cost() > 2.0d * 0.8d, "a loop between a and b is at least twice the gap between them");

            assertVerified(engine, plan);
            engine.graph().verifyInvariants();
        }
    }

    @Nested
    @DisplayName("4. Budgets")
    class Budgets {

        @Test
        @DisplayName("Vertex limit stops growth")
        void testVertexLimit() {
            PlannerConfig config = MissionFixtures.smallConfig().toBuilder().maxVertices(40).build();
            PlanningEngine engine = engine(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(), MissionFixtures.START, config
            );
            for (int i = 0; i < 500; i++) {
                engine.iterate();
            }
            int live = engine.graph().size() - 1;
            assertTrue(live <= 40, "live vertices: " + live);
            assertTrue(live > 30, "500 iterations should nearly fill 40 vertices, got " + live);
            engine.iterate();
            assertTrue(engine.graph().size() - 1 <= 40, "no growth past the limit");
            assertEquals(501, engine.iterations());
        }
    }
}
