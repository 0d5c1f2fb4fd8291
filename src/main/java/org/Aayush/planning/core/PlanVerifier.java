package org.Aayush.planning.core;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.Aayush.planning.automaton.LassoChecker;
import org.Aayush.planning.automaton.PropositionAlphabet;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.sampling.LocalPlanner;
import org.Aayush.planning.sampling.Trajectory;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.Workspace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Re-checks a plan against the current workspace: labels are recomputed, every state step
 * must be an automaton transition, every segment must be traversable and the acceptance
 * claim must hold for the resulting lasso word.
 */
public final class PlanVerifier {
    private final Workspace workspace;
    private final SpecificationAutomaton automaton;
    private final LocalPlanner localPlanner;

    public PlanVerifier(Workspace workspace, SpecificationAutomaton automaton, double resolution) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.automaton = Objects.requireNonNull(automaton, "automaton");
        this.localPlanner = new LocalPlanner(workspace, resolution, resolution);
    }

    /**
     * Verification verdict; {@code violations} is empty when the plan is valid.
     */
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Result {
        private final List<String> violations;

        public boolean isValid() {
            return violations.isEmpty();
        }

        @Override
        public String toString() {
            return isValid() ? "valid" : "invalid: " + violations;
        }
    }

    public Result verify(Plan plan) {
        List<String> violations = new ArrayList<>();
        PropositionAlphabet alphabet = automaton.alphabet();
        List<Configuration> configurations = plan.configurations();
        IntList states = plan.states();
        List<SortedSet<String>> labels = new ArrayList<>(configurations.size());
        for (int i = 0; i < configurations.size(); i++) {
            Configuration c = configurations.get(i);
            if (!workspace.isFree(c)) {
                violations.add("configuration " + i + " is in collision: " + c);
            }
            labels.add(workspace.contains(c));
        }

        int previous = SpecificationAutomaton.INIT;
        for (int i = 0; i < states.size(); i++) {
            int state = states.getInt(i);
            if (!automaton.successors(previous, alphabet.mask(labels.get(i))).contains(state)) {
                violations.add("no transition " + previous + " -> " + state + " on " + labels.get(i) + " at step " + i);
            }
            previous = state;
        }

        List<Trajectory> segments = plan.segments();
        for (int i = 0; i < segments.size(); i++) {
            List<Configuration> waypoints = segments.get(i).waypoints();
            for (int k = 1; k < waypoints.size(); k++) {
                Configuration a = workspace.label(waypoints.get(k - 1));
                Configuration b = workspace.label(waypoints.get(k));
                if (!localPlanner.isTraversable(a, b)) {
                    violations.add("segment " + i + " is blocked or crosses an unrecorded region");
                    break;
                }
            }
        }

        int n = configurations.size();
        int s = plan.suffixStart();
        if (plan.acceptance() == Plan.AcceptanceKind.CYCLE) {
            int closing = states.getInt(s);
            if (!automaton.isAccepting(closing)) {
                violations.add("loop vertex state " + closing + " is not accepting");
            }
            long closingMask = alphabet.mask(labels.get(s));
            if (!automaton.successors(states.getInt(n - 1), closingMask).contains(closing)) {
                violations.add("loop does not close: no transition " + states.getInt(n - 1) + " -> " + closing);
            }
        } else if (!automaton.acceptsConstantSuffix(states.getInt(n - 1), alphabet.mask(labels.get(n - 1)))) {
            violations.add("parking at the last configuration is not accepted");
        }
        if (!LassoChecker.accepts(automaton, labels.subList(0, s), labels.subList(s, n))) {
            violations.add("lasso word is rejected by the automaton");
        }
        return new Result(Collections.unmodifiableList(violations));
    }
}
