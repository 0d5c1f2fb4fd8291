package org.Aayush.planning.execution;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.planning.automaton.LassoChecker;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.workspace.Configuration;

import java.util.Objects;
import java.util.SortedSet;

/**
 * Half-monitor over executed configurations.
 * <p>
 * Tracks every automaton state consistent with the label history. A letter is read each time
 * the label set changes; staying inside one label set reads nothing, so the monitor suits
 * formulas without the next operator. Because the automaton keeps only states from which
 * acceptance is reachable, an empty state set is exactly a violation.
 * </p>
 */
public final class ExecutionMonitor {
    private final SpecificationAutomaton automaton;
    private IntSortedSet states;
    private SortedSet<String> lastLabels;
    /** Label changes read so far. */
    @Getter
    @Accessors(fluent = true)
    private int lettersRead;

    /**
     * @param start labeled start configuration.
     */
    public ExecutionMonitor(SpecificationAutomaton automaton, Configuration start) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
        reset(start);
    }

    private ExecutionMonitor(SpecificationAutomaton automaton, IntSortedSet states, SortedSet<String> lastLabels, int lettersRead) {
        this.automaton = automaton;
        this.states = states;
        this.lastLabels = lastLabels;
        this.lettersRead = lettersRead;
    }

    public void reset(Configuration start) {
        IntSortedSet initial = new IntRBTreeSet();
        initial.add(automaton.initialState());
        this.states = LassoChecker.advance(automaton, initial, automaton.alphabet().mask(start.labels()));
        this.lastLabels = start.labels();
        this.lettersRead = 1;
    }

    /**
     * Records the robot reaching {@code next}.
     *
     * @return false when the execution now violates the formula.
     */
    public boolean observe(Configuration next) {
        if (!next.labels().equals(lastLabels)) {
            lettersRead++;
        }
        states = successorStates(states, lastLabels, next);
        lastLabels = next.labels();
        return !states.isEmpty();
    }

    /**
     * States reached from {@code from} when moving from a configuration labeled
     * {@code fromLabels} to {@code next}, without recording anything.
     */
    public IntSortedSet successorStates(IntSortedSet from, SortedSet<String> fromLabels, Configuration next) {
        if (next.labels().equals(fromLabels)) {
            return from;
        }
        return LassoChecker.advance(automaton, from, automaton.alphabet().mask(next.labels()));
    }

    /**
     * @return true when moving to {@code next} keeps the execution satisfiable.
     */
    public boolean admits(Configuration next) {
        if (next.labels().equals(lastLabels)) {
            return !states.isEmpty();
        }
        return !LassoChecker.advance(automaton, states, automaton.alphabet().mask(next.labels())).isEmpty();
    }

    public IntSortedSet states() {
        return IntSortedSets.unmodifiable(states);
    }

    public SortedSet<String> lastLabels() {
        return lastLabels;
    }

    /**
     * @return true when no continuation can be accepted any more; the negation says that
     *         some continuation still is, since every tracked state can reach acceptance.
     */
    public boolean isViolated() {
        return states.isEmpty();
    }

    public boolean isInAcceptingState() {
        for (int state : states) {
            if (automaton.isAccepting(state)) {
                return true;
            }
        }
        return false;
    }

    public ExecutionMonitor copy() {
        return new ExecutionMonitor(automaton, new IntRBTreeSet(states), lastLabels, lettersRead);
    }
}
