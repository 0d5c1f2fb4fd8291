package org.Aayush.planning.execution;

import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.planning.core.Plan;
import org.Aayush.planning.workspace.Configuration;

import java.util.Objects;

/**
 * Walks a plan: the prefix once, then the suffix forever.
 */
public final class PlanFollower {
    @Getter
    @Accessors(fluent = true)
    private final Plan plan;
    /** Index of the configuration the robot is at. */
    @Getter
    @Accessors(fluent = true)
    private int position;
    /** Completed traversals of the suffix loop. */
    @Getter
    @Accessors(fluent = true)
    private int laps;

    public PlanFollower(Plan plan) {
        this.plan = Objects.requireNonNull(plan, "plan");
    }

    public Configuration current() {
        return plan.configurations().get(position);
    }

    /**
     * @return index of the configuration after {@link #position()}.
     */
    public int nextPosition() {
        int last = plan.size() - 1;
        if (position < last) {
            return position + 1;
        }
        return plan.acceptance() == Plan.AcceptanceKind.CYCLE ? plan.suffixStart() : last;
    }

    /**
     * The next waypoint the robot should head for; the global target of local planning.
     */
    public Configuration target() {
        return plan.configurations().get(nextPosition());
    }

    /**
     * Target chosen by the potentials for a robot at {@link #current()} with monitored
     * {@code states}; the plan's next waypoint when the guide has none.
     */
    public Configuration target(PotentialGuide guide, IntSet states) {
        return guide.nextTarget(current(), states).orElseGet(this::target);
    }

    /**
     * Moves to the next configuration.
     *
     * @return the configuration reached.
     */
    public Configuration advance() {
        int next = nextPosition();
        if (next <= position && plan.acceptance() == Plan.AcceptanceKind.CYCLE) {
            laps++;
        }
        position = next;
        return current();
    }

    public boolean isInSuffix() {
        return position >= plan.suffixStart();
    }

    /**
     * @return true for stutter plans that reached their parking configuration.
     */
    public boolean isParked() {
        return plan.acceptance() == Plan.AcceptanceKind.STUTTER && position == plan.size() - 1;
    }
}
