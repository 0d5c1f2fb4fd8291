package org.Aayush.planning.execution;

import org.Aayush.planning.automaton.BuchiAutomaton;
import org.Aayush.planning.automaton.LtlTranslator;
import org.Aayush.planning.testutil.MissionFixtures;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.PolygonWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayDeque;
import java.util.Deque;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Execution Monitor Tests")
class ExecutionMonitorTest {

    private PolygonWorkspace workspace;
    private ExecutionMonitor monitor;

    @BeforeEach
    void setUp() {
        workspace = MissionFixtures.threeRegions();
        BuchiAutomaton automaton = LtlTranslator.translate(MissionFixtures.SEQUENCE_FORMULA, workspace.labels());
        monitor = new ExecutionMonitor(automaton, workspace.label(MissionFixtures.START));
    }

    private Configuration at(double x, double y) {
        return workspace.label(Configuration.of(x, y));
    }

    @Test
    @DisplayName("Letters are read only when the label set changes")
    void testLetterOnChange() {
        assertEquals(1, monitor.lettersRead(), "start labels are the first letter");
        assertTrue(monitor.observe(at(2.0d, 1.0d)));
        assertTrue(monitor.observe(at(2.0d, 2.0d)));
        assertEquals(1, monitor.lettersRead(), "moving through unlabeled space reads nothing");

        assertTrue(monitor.observe(at(1.0d, 5.0d)));
        assertEquals(2, monitor.lettersRead());
        assertTrue(monitor.observe(at(1.1d, 5.0d)));
        assertEquals(2, monitor.lettersRead());
        assertTrue(monitor.lastLabels().contains("a"));
    }

    @Test
    @DisplayName("Entering the avoided region is a violation")
    void testViolation() {
        assertFalse(monitor.admits(at(3.0d, 5.0d)), "c is never admitted");
        assertTrue(monitor.admits(at(1.0d, 5.0d)));
        assertFalse(monitor.isViolated(), "admits must not record anything");

        assertFalse(monitor.observe(at(3.0d, 5.0d)));
        assertTrue(monitor.isViolated());
        assertTrue(monitor.states().isEmpty());
    }

    @Test
    @DisplayName("Visiting a then b reaches acceptance")
    void testAccepting() {
        monitor.observe(at(1.0d, 5.0d));
        monitor.observe(at(2.0d, 3.0d));
        monitor.observe(at(5.0d, 5.0d));
        monitor.observe(at(5.0d, 3.0d));

        assertFalse(monitor.isViolated());
        assertTrue(monitor.isInAcceptingState());
        assertEquals(5, monitor.lettersRead());
    }

    @Test
    @DisplayName("Copies evolve independently and reset restarts")
    void testCopyAndReset() {
        ExecutionMonitor copy = monitor.copy();
        copy.observe(at(3.0d, 5.0d));

        assertTrue(copy.isViolated());
        assertFalse(monitor.isViolated());

        copy.reset(at(1.0d, 1.0d));
        assertFalse(copy.isViolated());
        assertEquals(1, copy.lettersRead());
        assertEquals(monitor.states(), copy.states());
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"F (a && F b) && G !c", "G F a && G F b", "G (a -> F b)", "F G a", "a U b"})
    @DisplayName("Every tracked state can still reach acceptance, so an empty set is the only violation")
    void testEveryStateCanAccept(String formula) {
        BuchiAutomaton automaton = LtlTranslator.translate(formula, workspace.labels());
        for (int state = 0; state < automaton.stateCount(); state++) {
            assertTrue(reachesAcceptingCycle(automaton, state), formula + ": state " + state + " cannot accept");
        }
    }

    private static boolean reachesAcceptingCycle(BuchiAutomaton automaton, int from) {
        boolean[] seen = new boolean[automaton.stateCount()];
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(from);
        seen[from] = true;
        while (!pending.isEmpty()) {
            int state = pending.pop();
            if (automaton.isAccepting(state) && onCycle(automaton, state)) {
                return true;
            }
            for (int t = 0; t < automaton.outDegree(state); t++) {
                int next = automaton.target(state, t);
                if (!seen[next]) {
                    seen[next] = true;
                    pending.push(next);
                }
            }
        }
        return false;
    }

    private static boolean onCycle(BuchiAutomaton automaton, int start) {
        boolean[] seen = new boolean[automaton.stateCount()];
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            int state = pending.pop();
            for (int t = 0; t < automaton.outDegree(state); t++) {
                int next = automaton.target(state, t);
                if (next == start) {
                    return true;
                }
                if (!seen[next]) {
                    seen[next] = true;
                    pending.push(next);
                }
            }
        }
        return false;
    }
}
