package org.Aayush.planning.execution;

import org.Aayush.planning.automaton.BuchiAutomaton;
import org.Aayush.planning.automaton.LtlTranslator;
import org.Aayush.planning.testutil.MissionFixtures;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.DiscShape;
import org.Aayush.planning.workspace.PolygonShape;
import org.Aayush.planning.workspace.PolygonWorkspace;
import org.Aayush.planning.workspace.RegionShape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Local Request Planner Tests")
class LocalRequestPlannerTest {
    private static final double ETA = 0.2d;

    private PolygonWorkspace workspace;
    private BuchiAutomaton automaton;
    private LocalRequestPlanner planner;

    @BeforeEach
    void setUp() {
        workspace = MissionFixtures.threeRegions();
        automaton = LtlTranslator.translate(MissionFixtures.SEQUENCE_FORMULA, workspace.labels());
        planner = new LocalRequestPlanner(workspace, ETA, 1.5d, 3_000, 11L);
    }

    private Configuration at(double x, double y) {
        return workspace.label(Configuration.of(x, y));
    }

    private static void assertConnected(Configuration from, List<Configuration> path) {
        Configuration previous = from;
        for (Configuration next : path) {
            assertTrue(previous.distanceTo(next) <= ETA + 1e-9, previous + " -> " + next);
            previous = next;
        }
    }

    @Test
    @DisplayName("Clear segments are followed straight in eta steps")
    void testFreeMovement() {
        Configuration current = at(1.0d, 1.0d);
        Configuration target = at(2.0d, 1.0d);
        LocalPlan plan = planner.plan(new ExecutionMonitor(automaton, current), current, target, List.of(), List.of());

        assertFalse(plan.isEmpty());
        assertEquals(0, plan.treeSize());
        assertNull(plan.served());
        assertEquals(5, plan.path().size());
        assertEquals(target, plan.path().get(plan.path().size() - 1));
        assertConnected(current, plan.path());
    }

    @Test
    @DisplayName("A pending request is served on the way to the target")
    void testServesRequest() {
        Configuration current = at(1.0d, 1.0d);
        Configuration target = at(2.0d, 1.0d);
        LocalRequest pickup = new LocalRequest("pickup", DiscShape.of(1.5d, 2.0d, 0.3d), 1);
        LocalRequest later = new LocalRequest("survey", DiscShape.of(0.5d, 0.5d, 0.2d), 5);

        LocalPlan plan = planner.plan(
                new ExecutionMonitor(automaton, current), current, target, List.of(later, pickup), List.of()
        );

        assertFalse(plan.isEmpty(), "request is inside the sensing disc");
        assertSame(pickup, plan.served(), "lower priority value is served first");
        assertTrue(plan.treeSize() > 1);
        assertTrue(plan.path().stream().anyMatch(c -> pickup.servedAt(c.x(), c.y())), "path must pass the request");
        assertEquals(target, plan.path().get(plan.path().size() - 1));
    }

    @Test
    @DisplayName("Local obstacles are avoided")
    void testAvoidsLocalObstacle() {
        Configuration current = at(1.0d, 1.0d);
        Configuration target = at(2.0d, 1.0d);
        RegionShape box = PolygonShape.box(1.4d, 0.6d, 1.6d, 1.4d);

        LocalPlan plan = planner.plan(new ExecutionMonitor(automaton, current), current, target, List.of(), List.of(box));

        assertFalse(plan.isEmpty());
        assertTrue(plan.treeSize() > 1, "blocked straight line needs the local tree");
        Configuration previous = current;
        for (Configuration next : plan.path()) {
            assertFalse(box.intersectsSegment(previous.x(), previous.y(), next.x(), next.y()),
                    "segment " + previous + " -> " + next + " hits the local obstacle");
            previous = next;
        }
        assertEquals(target, previous);
    }

    @Test
    @DisplayName("Requests the formula forbids are never served")
    void testForbiddenRequest() {
        Configuration current = at(3.0d, 3.8d);
        Configuration target = at(2.5d, 3.8d);
        LocalRequest insideC = new LocalRequest("inspect", DiscShape.of(3.0d, 5.0d, 0.3d), 1);
        LocalRequestPlanner small = new LocalRequestPlanner(workspace, ETA, 1.5d, 400, 3L);

        LocalPlan plan = small.plan(
                new ExecutionMonitor(automaton, current), current, target, List.of(insideC), List.of()
        );

        assertTrue(plan.isEmpty());
        assertNull(plan.served());
        assertTrue(plan.treeSize() >= 1);
    }

    @Test
    @DisplayName("Parameters must be positive")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new LocalRequestPlanner(workspace, 0.0d, 1.0d, 10, 1L));
        assertThrows(IllegalArgumentException.class, () -> new LocalRequestPlanner(workspace, 0.1d, -1.0d, 10, 1L));
        assertThrows(IllegalArgumentException.class, () -> new LocalRequestPlanner(workspace, 0.1d, 1.0d, 0, 1L));
        assertThrows(NullPointerException.class, () -> new LocalRequest(null, DiscShape.of(0.0d, 0.0d, 1.0d), 0));
    }
}
