package org.Aayush.planning.automaton;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.Objects;

/**
 * Explicit Büchi automaton with guarded transitions.
 * <p>
 * Transitions of each state are stored sorted by target id, so successor lists come out in
 * ascending order without extra sorting. Instances are immutable apart from an internal,
 * synchronized cache for {@link #acceptsConstantSuffix(int, long)}.
 * </p>
 */
public final class BuchiAutomaton implements SpecificationAutomaton {

    private final PropositionAlphabet alphabet;
    private final int[][] targets;
    private final Guard[][] guards;
    private final boolean[] accepting;
    private final boolean deterministic;
    private final long positivePropositions;
    // label mask -> per-state answer of acceptsConstantSuffix
    private final Long2ObjectOpenHashMap<boolean[]> constantSuffixCache = new Long2ObjectOpenHashMap<>();

    /**
     * @param alphabet propositions referenced by guards.
     * @param targets per-state transition targets, ascending.
     * @param guards per-state guards parallel to {@code targets}.
     * @param accepting accepting flags.
     */
    BuchiAutomaton(PropositionAlphabet alphabet, int[][] targets, Guard[][] guards, boolean[] accepting) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        if (targets.length == 0 || targets.length != guards.length || targets.length != accepting.length) {
            throw new IllegalArgumentException("inconsistent automaton tables");
        }
        this.targets = targets;
        this.guards = guards;
        this.accepting = accepting;
        long positive = 0L;
        for (Guard[] row : guards) {
            for (Guard guard : row) {
                positive |= guard.positive();
            }
        }
        this.positivePropositions = positive;
        this.deterministic = computeDeterministic();
    }

    private boolean computeDeterministic() {
        for (int state = 0; state < targets.length; state++) {
            for (int i = 0; i < targets[state].length; i++) {
                for (int j = i + 1; j < targets[state].length; j++) {
                    if (targets[state][i] == targets[state][j]) {
                        continue;
                    }
                    Guard a = guards[state][i];
                    Guard b = guards[state][j];
                    if (((a.positive() | b.positive()) & (a.negative() | b.negative())) == 0L) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    @Override
    public PropositionAlphabet alphabet() {
        return alphabet;
    }

    @Override
    public int stateCount() {
        return targets.length;
    }

    @Override
    public IntList successors(int state, long labelMask) {
        requireState(state);
        int[] row = targets[state];
        Guard[] rowGuards = guards[state];
        IntArrayList out = null;
        int last = REJECT;
        for (int i = 0; i < row.length; i++) {
            if (row[i] != last && rowGuards[i].matches(labelMask)) {
                if (out == null) {
                    out = new IntArrayList(2);
                }
                out.add(row[i]);
                last = row[i];
            }
        }
        return out == null ? IntLists.emptyList() : out;
    }

    @Override
    public boolean isAccepting(int state) {
        requireState(state);
        return accepting[state];
    }

    @Override
    public boolean isDeterministic() {
        return deterministic;
    }

    @Override
    public long positivePropositions() {
        return positivePropositions;
    }

    public int transitionCount() {
        int total = 0;
        for (int[] row : targets) {
            total += row.length;
        }
        return total;
    }

    /**
     * @return number of outgoing transitions of {@code state}.
     */
    public int outDegree(int state) {
        requireState(state);
        return targets[state].length;
    }

    public int target(int state, int transition) {
        return targets[state][transition];
    }

    public Guard guard(int state, int transition) {
        return guards[state][transition];
    }

    @Override
    public boolean acceptsConstantSuffix(int state, long labelMask) {
        requireState(state);
        boolean[] answers;
        synchronized (constantSuffixCache) {
            answers = constantSuffixCache.get(labelMask);
            if (answers == null) {
                answers = computeConstantSuffix(labelMask);
                constantSuffixCache.put(labelMask, answers);
            }
        }
        return answers[state];
    }

    /**
     * In the subgraph of transitions enabled by {@code labelMask}, marks every state that
     * reaches (in zero or more steps) an accepting state lying on a cycle.
     */
    private boolean[] computeConstantSuffix(long labelMask) {
        int n = targets.length;
        IntArrayList[] reverse = new IntArrayList[n];
        for (int i = 0; i < n; i++) {
            reverse[i] = new IntArrayList();
        }
        for (int p = 0; p < n; p++) {
            for (int i = 0; i < targets[p].length; i++) {
                if (guards[p][i].matches(labelMask)) {
                    reverse[targets[p][i]].add(p);
                }
            }
        }
        boolean[] result = new boolean[n];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int f = 0; f < n; f++) {
            if (accepting[f] && !result[f] && onEnabledCycle(f, labelMask)) {
                result[f] = true;
                queue.enqueue(f);
            }
        }
        while (!queue.isEmpty()) {
            int q = queue.dequeueInt();
            IntArrayList preds = reverse[q];
            for (int i = 0; i < preds.size(); i++) {
                int p = preds.getInt(i);
                if (!result[p]) {
                    result[p] = true;
                    queue.enqueue(p);
                }
            }
        }
        return result;
    }

    private boolean onEnabledCycle(int start, long labelMask) {
        boolean[] seen = new boolean[targets.length];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(start);
        while (!queue.isEmpty()) {
            int p = queue.dequeueInt();
            for (int i = 0; i < targets[p].length; i++) {
                if (!guards[p][i].matches(labelMask)) {
                    continue;
                }
                int q = targets[p][i];
                if (q == start) {
                    return true;
                }
                if (!seen[q]) {
                    seen[q] = true;
                    queue.enqueue(q);
                }
            }
        }
        return false;
    }

    private void requireState(int state) {
        if (state < 0 || state >= targets.length) {
            throw new IndexOutOfBoundsException("automaton state out of bounds: " + state);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BuchiAutomaton{states=").append(targets.length)
                .append(", transitions=").append(transitionCount())
                .append(", deterministic=").append(deterministic).append('\n');
        for (int p = 0; p < targets.length; p++) {
            sb.append("  ").append(p).append(accepting[p] ? " (acc)" : "").append(':');
            for (int i = 0; i < targets[p].length; i++) {
                sb.append(" [").append(guards[p][i].describe(alphabet)).append("] -> ").append(targets[p][i]);
            }
            sb.append('\n');
        }
        return sb.append('}').toString();
    }
}
