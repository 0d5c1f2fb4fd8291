package org.Aayush.app;

import org.Aayush.planning.core.PlanningOutcome;
import org.Aayush.planning.core.PlanningStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    @Timeout(value = 120, unit = TimeUnit.SECONDS)
    @DisplayName("Smoke run plans, repairs and plans again")
    void testRun() {
        List<PlanningOutcome> outcomes = Main.run(7L);

        assertEquals(2, outcomes.size());
        assertEquals(PlanningStatus.SOLVED, outcomes.get(0).getStatus());
        assertTrue(outcomes.get(0).orElseThrow().labelSequence().stream().noneMatch(labels -> labels.contains("c")));

        PlanningOutcome repaired = outcomes.get(1);
        assertNotEquals(PlanningStatus.UNRECOVERABLE, repaired.getStatus());
        assertEquals(1, repaired.getDiagnostics().getRepairsApplied());
        assertEquals(1L, repaired.getDiagnostics().getWorkspaceVersion());
    }

    @Test
    @Timeout(value = 120, unit = TimeUnit.SECONDS)
    @DisplayName("Malformed seed falls back to the default")
    void testMalformedSeed() {
        assertDoesNotThrow(() -> Main.main(new String[]{"not-a-seed"}));
    }
}
