package org.Aayush.planning.automaton;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Acceptance test for ultimately periodic words {@code prefix · loop^ω}.
 */
public final class LassoChecker {

    private LassoChecker() {
    }

    /**
     * @param automaton automaton to run.
     * @param prefix label sets read once, starting from the initial state.
     * @param loop non-empty label sets repeated forever after the prefix.
     * @return true when some run visits an accepting state infinitely often.
     */
    public static boolean accepts(
            SpecificationAutomaton automaton,
            List<? extends Collection<String>> prefix,
            List<? extends Collection<String>> loop
    ) {
        Objects.requireNonNull(automaton, "automaton");
        if (loop.isEmpty()) {
            throw new IllegalArgumentException("loop must contain at least one label set");
        }
        PropositionAlphabet alphabet = automaton.alphabet();
        long[] loopMasks = new long[loop.size()];
        for (int i = 0; i < loopMasks.length; i++) {
            loopMasks[i] = alphabet.mask(loop.get(i));
        }
        IntSortedSet current = new IntRBTreeSet();
        current.add(automaton.initialState());
        for (Collection<String> letter : prefix) {
            current = advance(automaton, current, alphabet.mask(letter));
            if (current.isEmpty()) {
                return false;
            }
        }
        return acceptingLassoFrom(automaton, current, loopMasks);
    }

    /**
     * One subset-construction step.
     */
    public static IntSortedSet advance(SpecificationAutomaton automaton, IntSortedSet states, long labelMask) {
        IntSortedSet next = new IntRBTreeSet();
        for (int state : states) {
            IntList successors = automaton.successors(state, labelMask);
            next.addAll(successors);
        }
        return next;
    }

    /**
     * Searches the product of the automaton with the cyclic loop word. Node
     * {@code state * m + j} means "in {@code state}, about to read letter {@code j}".
     */
    private static boolean acceptingLassoFrom(SpecificationAutomaton automaton, IntSortedSet starts, long[] loop) {
        int m = loop.length;
        int nodes = automaton.stateCount() * m;
        boolean[] reached = new boolean[nodes];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int state : starts) {
            int node = state * m;
            reached[node] = true;
            queue.enqueue(node);
        }
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            forEachSuccessor(automaton, loop, node, next -> {
                if (!reached[next]) {
                    reached[next] = true;
                    queue.enqueue(next);
                }
                return false;
            });
        }
        for (int node = 0; node < nodes; node++) {
            if (reached[node] && automaton.isAccepting(node / m) && onCycle(automaton, loop, node)) {
                return true;
            }
        }
        return false;
    }

    private static boolean onCycle(SpecificationAutomaton automaton, long[] loop, int start) {
        boolean[] seen = new boolean[automaton.stateCount() * loop.length];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(start);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            boolean closed = forEachSuccessor(automaton, loop, node, next -> {
                if (next == start) {
                    return true;
                }
                if (!seen[next]) {
                    seen[next] = true;
                    queue.enqueue(next);
                }
                return false;
            });
            if (closed) {
                return true;
            }
        }
        return false;
    }

    @FunctionalInterface
    private interface NodeVisitor {
        /**
         * @return true to stop the iteration.
         */
        boolean visit(int node);
    }

    private static boolean forEachSuccessor(SpecificationAutomaton automaton, long[] loop, int node, NodeVisitor visitor) {
        int m = loop.length;
        int state = node / m;
        int letter = node % m;
        IntList successors = automaton.successors(state, loop[letter]);
        for (int i = 0; i < successors.size(); i++) {
            if (visitor.visit(successors.getInt(i) * m + (letter + 1) % m)) {
                return true;
            }
        }
        return false;
    }
}
