package org.Aayush.planning.core;

import org.Aayush.planning.automaton.FormulaException;
import org.Aayush.planning.repair.RepairReport;
import org.Aayush.planning.testutil.MissionFixtures;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.GeometryException;
import org.Aayush.planning.workspace.PolygonShape;
import org.Aayush.planning.workspace.PolygonWorkspace;
import org.Aayush.planning.workspace.Region;
import org.Aayush.planning.workspace.RegionUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Planning Session Tests")
class PlanningSessionTest {

    @Nested
    @DisplayName("1. Opening a Mission")
    class Opening {

        @Test
        @DisplayName("Start with the wrong dimension is rejected")
        void testDimensionMismatch() {
            Mission mission = Mission.of(
                    MissionFixtures.SEQUENCE_FORMULA, MissionFixtures.threeRegions(), Configuration.of(1.0d, 1.0d, 1.0d)
            );
            GeometryException ex = assertThrows(
                    GeometryException.class, () -> PlanningSession.open(mission, MissionFixtures.smallConfig())
            );
            assertEquals(GeometryException.REASON_DIMENSION_MISMATCH, ex.reasonCode());
        }

        @Test
        @DisplayName("Start inside an obstacle is rejected")
        void testStartNotFree() {
            PolygonWorkspace workspace = MissionFixtures.threeRegions();
            workspace.applyUpdate(RegionUpdate.added(Region.obstacle("pillar", PolygonShape.box(0.5d, 0.5d, 1.5d, 1.5d))));
            Mission mission = Mission.of(MissionFixtures.SEQUENCE_FORMULA, workspace, MissionFixtures.START);

            GeometryException ex = assertThrows(
                    GeometryException.class, () -> PlanningSession.open(mission, MissionFixtures.smallConfig())
            );
            assertEquals(GeometryException.REASON_START_NOT_FREE, ex.reasonCode());
        }

        @Test
        @DisplayName("Formula errors surface with their reason codes")
        void testFormulaErrors() {
            Mission malformed = Mission.of("F (a &&", MissionFixtures.threeRegions(), MissionFixtures.START);
            FormulaException parse = assertThrows(
                    FormulaException.class, () -> PlanningSession.open(malformed, MissionFixtures.smallConfig())
            );
            assertEquals(FormulaException.REASON_UNEXPECTED_END, parse.reasonCode());

            Mission impossible = Mission.of("F a && G !a", MissionFixtures.threeRegions(), MissionFixtures.START);
            FormulaException unsat = assertThrows(
                    FormulaException.class, () -> PlanningSession.open(impossible, MissionFixtures.smallConfig())
            );
            assertEquals(FormulaException.REASON_UNSATISFIABLE, unsat.reasonCode());
        }

        @Test
        @DisplayName("A fresh session publishes empty diagnostics")
        void testFreshDiagnostics() {
            PlanningSession session = PlanningSession.open(MissionFixtures.sequenceMission(), MissionFixtures.smallConfig());
            PlanningDiagnostics diagnostics = session.diagnostics();

            assertEquals(0L, diagnostics.getIterations());
            assertTrue(diagnostics.getVertexCount() >= 1);
            assertFalse(diagnostics.hasPlan());
            assertNull(diagnostics.getStatus());
            assertTrue(session.currentPlan().isEmpty());
            assertTrue(session.automaton().stateCount() > 0);
        }
    }

    @Nested
    @DisplayName("2. Planning Runs")
    class Runs {

        @Test
        @Timeout(value = 60, unit = TimeUnit.SECONDS)
        @DisplayName("Sequence mission is solved and the diagnostics agree")
        void testSolved() {
            PlanningSession session = PlanningSession.open(MissionFixtures.sequenceMission(), MissionFixtures.smallConfig());
            PlanningOutcome outcome = session.plan();

            assertEquals(PlanningStatus.SOLVED, outcome.getStatus());
            Plan plan = outcome.orElseThrow();
            PlanningDiagnostics diagnostics = outcome.getDiagnostics();
            assertEquals(2_500L, outcome.getIterations());
            assertEquals(plan.cost(), diagnostics.getBestCost(), 1e-9);
            assertEquals(plan.acceptance(), diagnostics.getAcceptance());
            assertEquals(PlanningStatus.SOLVED, diagnostics.getStatus());
            assertEquals(session.graph().size() - 1, diagnostics.getVertexCount());

            PlanVerifier verifier = new PlanVerifier(session.workspace(), session.automaton(), 0.01d);
            assertTrue(verifier.verify(plan).isValid());
        }

        @Test
        @DisplayName("Tiny budgets time out without a plan")
        void testTimeout() {
            PlannerConfig config = MissionFixtures.smallConfig().toBuilder().maxIterations(5).build();
            PlanningSession session = PlanningSession.open(MissionFixtures.sequenceMission(), config);
            PlanningOutcome outcome = session.plan();

            assertEquals(PlanningStatus.TIMEOUT, outcome.getStatus());
            assertEquals(5L, outcome.getIterations());
            PlanningException ex = assertThrows(PlanningException.class, outcome::orElseThrow);
            assertEquals(PlanningException.REASON_PLANNING_TIMEOUT, ex.reasonCode());
        }

        @Test
        @DisplayName("Cancel before planning stops the next run at once")
        void testCancel() {
            PlanningSession session = PlanningSession.open(MissionFixtures.sequenceMission(), MissionFixtures.smallConfig());
            session.cancel();
            PlanningOutcome outcome = session.plan();

            assertEquals(PlanningStatus.CANCELLED, outcome.getStatus());
            assertEquals(0L, outcome.getIterations());
            PlanningException ex = assertThrows(PlanningException.class, outcome::orElseThrow);
            assertEquals(PlanningException.REASON_PLANNING_CANCELLED, ex.reasonCode());
        }

        @Test
        @DisplayName("Repeated calls continue from the current graph")
        void testContinues() {
            PlannerConfig config = MissionFixtures.smallConfig().toBuilder().maxIterations(200).build();
            PlanningSession session = PlanningSession.open(MissionFixtures.sequenceMission(), config);
            session.plan();
            int after = session.graph().size();
            session.plan();

            assertEquals(400L, session.diagnostics().getIterations());
            assertTrue(session.graph().size() >= after);
        }
    }

    @Nested
    @DisplayName("3. Environment Updates")
    class Updates {

        @Test
        @DisplayName("An obstacle over the start makes the session unrecoverable")
        void testUnrecoverable() {
            PlanningSession session = PlanningSession.open(MissionFixtures.sequenceMission(), MissionFixtures.smallConfig());
            int vertices = session.graph().size();
            session.submit(RegionUpdate.added(Region.obstacle("pillar", PolygonShape.box(0.5d, 0.5d, 1.5d, 1.5d))));

            PlanningOutcome outcome = session.plan();

            assertEquals(PlanningStatus.UNRECOVERABLE, outcome.getStatus());
            assertEquals(Set.of("pillar"), outcome.getOffendingRegionIds());
            assertTrue(outcome.plan().isEmpty());
            assertTrue(session.isUnrecoverable());
            assertEquals(vertices, session.graph().size(), "graph is left as it was");
            assertEquals(1, session.diagnostics().getRepairsApplied());

            PlanningException ex = assertThrows(PlanningException.class, session::plan);
            assertEquals(PlanningException.REASON_UNRECOVERABLE_REPAIR, ex.reasonCode());
            assertThrows(PlanningException.class, session::drainUpdates);
        }

        @Test
        @DisplayName("Invalid updates are counted and skipped")
        void testRejectedUpdates() {
            PlanningSession session = PlanningSession.open(MissionFixtures.sequenceMission(), MissionFixtures.smallConfig());
            session.submit(RegionUpdate.removed("nowhere"));
            session.submit(RegionUpdate.scaled("c", -1.0d));

            List<RepairReport> reports = session.drainUpdates();

            assertTrue(reports.isEmpty());
            assertEquals(2, session.diagnostics().getUpdatesRejected());
            assertEquals(0, session.diagnostics().getRepairsApplied());
            assertEquals(0L, session.workspace().version());
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("Updates submitted from another thread are applied on drain")
        void testAsyncSubmit() throws InterruptedException {
            PlannerConfig config = MissionFixtures.smallConfig().toBuilder().maxIterations(300).build();
            PlanningSession session = PlanningSession.open(MissionFixtures.sequenceMission(), config);
            session.plan();

            CountDownLatch submitted = new CountDownLatch(1);
            Thread producer = new Thread(() -> {
                session.submit(RegionUpdate.scaled("c", 1.3d));
                submitted.countDown();
            }, "environment-producer");
            producer.start();
            assertTrue(submitted.await(5, TimeUnit.SECONDS));
            producer.join();

            List<RepairReport> reports = session.drainUpdates();

            assertEquals(1, reports.size());
            RepairReport report = reports.get(0);
            assertFalse(report.isUnrecoverable());
            assertEquals(1L, report.getWorkspaceVersion());
            assertEquals(1, session.diagnostics().getRepairsApplied());
            assertEquals(1L, session.diagnostics().getWorkspaceVersion());
            session.graph().verifyInvariants();
        }
    }
}
