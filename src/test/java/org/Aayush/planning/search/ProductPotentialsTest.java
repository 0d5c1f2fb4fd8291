package org.Aayush.planning.search;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.core.Plan;
import org.Aayush.planning.core.PlanningSession;
import org.Aayush.planning.graph.ProductEdge;
import org.Aayush.planning.graph.ProductGraph;
import org.Aayush.planning.graph.ProductVertex;
import org.Aayush.planning.testutil.MissionFixtures;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Product Potentials Tests")
class ProductPotentialsTest {
    private static final double TOLERANCE = 1e-9d;

    private static PlanningSession sequence;
    private static PlanningSession liveness;

    @BeforeAll
    @Timeout(value = 120, unit = TimeUnit.SECONDS)
    static void planMissions() {
        sequence = PlanningSession.open(MissionFixtures.sequenceMission(), MissionFixtures.smallConfig());
        sequence.plan().orElseThrow();
        liveness = PlanningSession.open(MissionFixtures.livenessMission(), MissionFixtures.smallConfig());
        liveness.plan().orElseThrow();
    }

    private static List<ProductEdge> outgoing(ProductGraph graph, ProductVertex v) {
        List<ProductEdge> edges = new ArrayList<>(v.crossOut());
        IntList children = v.children();
        for (int i = 0; i < children.size(); i++) {
            edges.add(graph.vertex(children.getInt(i)).incoming());
        }
        return edges;
    }

    private static void assertShortestDistances(PlanningSession session) {
        ProductGraph graph = session.graph();
        SpecificationAutomaton automaton = session.automaton();
        ProductPotentials potentials = session.potentials();
        IntList live = graph.liveIds();
        for (int i = 0; i < live.size(); i++) {
            int id = live.getInt(i);
            if (id == ProductGraph.ROOT) {
                continue;
            }
            ProductVertex v = graph.vertex(id);
            double own = potentials.potential(id);
            boolean parks = automaton.acceptsConstantSuffix(v.state(), v.labelMask());
            assertEquals(parks, potentials.isParking(id), "parking flag of " + v);
            if (parks) {
                assertEquals(0.0d, own, 0.0d, "parking vertex " + v);
            }
            boolean tight = own == 0.0d;
            for (ProductEdge edge : outgoing(graph, v)) {
                double through = edge.cost() + potentials.potential(edge.to());
                assertTrue(own <= through + TOLERANCE, "potential of " + v + " exceeds the route via " + edge.to());
                tight |= Math.abs(own - through) <= TOLERANCE;
            }
            if (Double.isFinite(own)) {
                assertTrue(tight, "no successor realises the potential of " + v);
            }
        }
    }

    @Nested
    @DisplayName("1. Shortest Distance To Acceptance")
    class Distances {

        @Test
        @DisplayName("Sequence mission potentials are shortest distances to a goal")
        void testSequenceDistances() {
            assertShortestDistances(sequence);
        }

        @Test
        @DisplayName("Liveness mission potentials are shortest distances to a goal")
        void testLivenessDistances() {
            assertShortestDistances(liveness);
        }

        @Test
        @DisplayName("The held plan bounds the potential of its first vertex")
        void testPlanBound() {
            Plan plan = sequence.currentPlan().orElseThrow();
            ProductPotentials potentials = sequence.potentials();

            int first = plan.vertexIds().getInt(0);
            assertTrue(potentials.canReachGoal(first));
            assertTrue(potentials.potential(first) <= plan.cost() + TOLERANCE,
                    potentials.potential(first) + " > plan cost " + plan.cost());
            if (plan.acceptance() == Plan.AcceptanceKind.STUTTER) {
                int last = plan.vertexIds().getInt(plan.size() - 1);
                assertEquals(0.0d, potentials.potential(last), 0.0d, "the parking vertex of a stutter plan is a goal");
                assertTrue(potentials.isParking(last));
            } else {
                assertEquals(0.0d, potentials.potential(plan.vertexIds().getInt(plan.suffixStart())), 0.0d);
            }
        }
    }

    @Nested
    @DisplayName("2. Goals")
    class Goals {

        @Test
        @DisplayName("Accepting loop vertices are goals and nothing parks under G F a && G F b")
        void testLoopGoals() {
            Plan plan = liveness.currentPlan().orElseThrow();
            assertEquals(Plan.AcceptanceKind.CYCLE, plan.acceptance());
            ProductPotentials potentials = liveness.potentials();

            int accepting = plan.vertexIds().getInt(plan.suffixStart());
            assertEquals(0.0d, potentials.potential(accepting), 0.0d);
            assertFalse(potentials.isParking(accepting));
            assertTrue(potentials.goalCount() > 0);

            IntList live = liveness.graph().liveIds();
            for (int i = 0; i < live.size(); i++) {
                assertFalse(potentials.isParking(live.getInt(i)), "a single label set cannot hold both a and b");
            }
        }

        @Test
        @DisplayName("Root anchor and unknown ids have infinite potential")
        void testUnknownIds() {
            ProductPotentials potentials = sequence.potentials();
            assertEquals(Double.POSITIVE_INFINITY, potentials.potential(ProductGraph.ROOT));
            assertEquals(Double.POSITIVE_INFINITY, potentials.potential(-1));
            assertEquals(Double.POSITIVE_INFINITY, potentials.potential(sequence.graph().idBound() + 5));
            assertFalse(potentials.isParking(-1));
            assertFalse(potentials.canReachGoal(ProductGraph.ROOT));
        }
    }
}
