package org.Aayush.planning.automaton;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Collection;

/**
 * Finite automaton over label sets that tracks mission progress.
 * <p>
 * States are dense ids {@code 0 .. stateCount()-1}; {@link #INIT} reads the label set of the
 * first configuration. An empty successor set means the word read so far can no longer be
 * accepted: the automaton only keeps states from which acceptance is still reachable.
 * </p>
 */
public interface SpecificationAutomaton {
    int INIT = 0;
    int REJECT = -1;

    PropositionAlphabet alphabet();

    int stateCount();

    default int initialState() {
        return INIT;
    }

    /**
     * @return successor states in ascending id order; empty means REJECT.
     */
    IntList successors(int state, long labelMask);

    default IntList successors(int state, Collection<String> labels) {
        return successors(state, alphabet().mask(labels));
    }

    /**
     * Deterministic step.
     *
     * @return the unique successor, or {@link #REJECT}.
     * @throws IllegalStateException when the automaton branches on this letter.
     */
    default int step(int state, long labelMask) {
        IntList next = successors(state, labelMask);
        if (next.isEmpty()) {
            return REJECT;
        }
        if (next.size() > 1) {
            throw new IllegalStateException(
                    "automaton is nondeterministic in state " + state + "; use successors()"
            );
        }
        return next.getInt(0);
    }

    default int step(int state, Collection<String> labels) {
        return step(state, alphabet().mask(labels));
    }

    boolean isAccepting(int state);

    /**
     * @return true when every state has at most one successor for every letter.
     */
    boolean isDeterministic();

    /**
     * Whether reading {@code labelMask} forever from {@code state} is accepted.
     * This is the acceptance test for a robot that stays at one configuration.
     */
    boolean acceptsConstantSuffix(int state, long labelMask);

    /**
     * @return propositions that appear un-negated in some transition guard.
     */
    long positivePropositions();
}
