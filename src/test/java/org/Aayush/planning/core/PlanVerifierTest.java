package org.Aayush.planning.core;

import org.Aayush.planning.testutil.MissionFixtures;
import org.Aayush.planning.workspace.PolygonShape;
import org.Aayush.planning.workspace.PolygonWorkspace;
import org.Aayush.planning.workspace.Region;
import org.Aayush.planning.workspace.RegionUpdate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Plan Verifier Tests")
@Timeout(value = 60, unit = TimeUnit.SECONDS)
class PlanVerifierTest {

    private static PlanningSession session;
    private static Plan plan;

    @BeforeAll
    static void planSequence() {
        session = PlanningSession.open(MissionFixtures.sequenceMission(), MissionFixtures.smallConfig());
        plan = session.plan().orElseThrow();
    }

    @Test
    @DisplayName("A fresh plan is valid in the workspace it was planned in")
    void testValid() {
        PlanVerifier.Result result = new PlanVerifier(session.workspace(), session.automaton(), 0.01d).verify(plan);

        assertTrue(result.isValid(), result::toString);
        assertTrue(result.violations().isEmpty());
        assertEquals("valid", result.toString());
    }

    @Test
    @DisplayName("An obstacle over region a invalidates the plan")
    void testObstacleOverWaypoint() {
        PolygonWorkspace blocked = MissionFixtures.threeRegions();
        blocked.applyUpdate(RegionUpdate.added(
                Region.obstacle("crate", PolygonShape.box(0.3d, 4.3d, 1.7d, 5.7d))
        ));

        PlanVerifier.Result result = new PlanVerifier(blocked, session.automaton(), 0.01d).verify(plan);

        assertFalse(result.isValid());
        assertTrue(result.violations().stream().anyMatch(v -> v.contains("collision") || v.contains("blocked")),
                result::toString);
    }

    @Test
    @DisplayName("Removing region a leaves a word the formula rejects")
    void testLabelRemoved() {
        PolygonWorkspace relabeled = MissionFixtures.threeRegions();
        relabeled.applyUpdate(RegionUpdate.removed("a"));

        PlanVerifier.Result result = new PlanVerifier(relabeled, session.automaton(), 0.01d).verify(plan);

        assertFalse(result.isValid());
        assertTrue(result.toString().startsWith("invalid: "));
    }
}
