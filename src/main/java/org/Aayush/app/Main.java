package org.Aayush.app;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.planning.core.Mission;
import org.Aayush.planning.core.Plan;
import org.Aayush.planning.core.PlannerConfig;
import org.Aayush.planning.core.PlanningOutcome;
import org.Aayush.planning.core.PlanningSession;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.DiscShape;
import org.Aayush.planning.workspace.PolygonWorkspace;
import org.Aayush.planning.workspace.Region;
import org.Aayush.planning.workspace.RegionUpdate;
import org.Aayush.planning.workspace.WorkspaceBounds;

import java.util.ArrayList;
import java.util.List;

/**
 * Smoke run: visit {@code a} then {@code b} while always avoiding {@code c}, then grow
 * {@code c} and let the session repair the plan.
 */
@Slf4j
public class Main {
    static final String FORMULA = "F (a && F b) && G !c";
    private static final long DEFAULT_SEED = 7L;

    /**
     * @param args optional random seed.
     */
    public static void main(String[] args) {
        long seed = DEFAULT_SEED;
        if (args.length > 0) {
            try {
                seed = Long.parseLong(args[0].trim());
            } catch (NumberFormatException e) {
                log.warn("ignoring malformed seed '{}', using {}", args[0], DEFAULT_SEED);
            }
        }
        run(seed);
    }

    /**
     * @return outcomes before and after the environment change.
     */
    static List<PlanningOutcome> run(long seed) {
        PolygonWorkspace workspace = PolygonWorkspace.builder()
                .bounds(WorkspaceBounds.of(0.0d, 0.0d, 10.0d, 10.0d))
                .region(Region.labeled("a", DiscShape.of(2.0d, 8.0d, 1.0d)))
                .region(Region.labeled("b", DiscShape.of(8.0d, 8.0d, 1.0d)))
                .region(Region.labeled("c", DiscShape.of(5.0d, 5.0d, 1.0d)))
                .build();
        PlannerConfig config = PlannerConfig.fromSystemProperties().toBuilder().seed(seed).build();
        PlanningSession session = PlanningSession.open(
                Mission.of(FORMULA, workspace, Configuration.of(1.0d, 1.0d)),
                config
        );
        List<PlanningOutcome> outcomes = new ArrayList<>();
        outcomes.add(report("initial", session.plan()));
        session.submit(RegionUpdate.scaled("c", 1.6d));
        outcomes.add(report("after growing c", session.plan()));
        return outcomes;
    }

    private static PlanningOutcome report(String phase, PlanningOutcome outcome) {
        if (outcome.plan().isPresent()) {
            Plan plan = outcome.plan().get();
            log.info("{}: {} with cost {} over {} waypoints, labels {}",
                    phase, outcome.getStatus(), plan.cost(), plan.size(), plan.labelSequence());
        } else {
            log.info("{}: {} after {} iterations", phase, outcome.getStatus(), outcome.getIterations());
        }
        return outcome;
    }
}
