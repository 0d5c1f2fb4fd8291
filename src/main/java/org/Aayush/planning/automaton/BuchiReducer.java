package org.Aayush.planning.automaton;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Language-preserving simplification of Büchi automata.
 * <ol>
 * <li>Trim: keep only states reachable from {@link SpecificationAutomaton#INIT} that can
 * still reach an accepting cycle. A word leaving this set can never be accepted, so dropping
 * it turns violations into an immediate REJECT.</li>
 * <li>Merge: collapse states that are bisimilar with respect to guards and acceptance
 * (partition refinement). The initial state keeps its own block and id 0.</li>
 * </ol>
 */
final class BuchiReducer {

    private BuchiReducer() {
    }

    private record Move(long positive, long negative, int target) {
    }

    private record Signature(int block, List<Move> moves) {
    }

    private static final Comparator<Move> MOVE_ORDER = Comparator
            .comparingInt(Move::target)
            .thenComparingLong(Move::positive)
            .thenComparingLong(Move::negative);

    /**
     * @param automaton unreduced automaton.
     * @param formulaText formula text for error messages.
     * @throws FormulaException when no accepting run exists at all.
     */
    static BuchiAutomaton reduce(BuchiAutomaton automaton, String formulaText) {
        boolean[] keep = live(automaton);
        if (!keep[SpecificationAutomaton.INIT]) {
            throw new FormulaException(
                    FormulaException.REASON_UNSATISFIABLE,
                    "formula has no satisfying word: " + formulaText
            );
        }
        return merge(automaton, keep);
    }

    private static boolean[] live(BuchiAutomaton a) {
        int n = a.stateCount();
        boolean[] reachable = new boolean[n];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        reachable[SpecificationAutomaton.INIT] = true;
        queue.enqueue(SpecificationAutomaton.INIT);
        IntArrayList[] reverse = new IntArrayList[n];
        for (int i = 0; i < n; i++) {
            reverse[i] = new IntArrayList();
        }
        while (!queue.isEmpty()) {
            int p = queue.dequeueInt();
            for (int i = 0; i < a.outDegree(p); i++) {
                int q = a.target(p, i);
                reverse[q].add(p);
                if (!reachable[q]) {
                    reachable[q] = true;
                    queue.enqueue(q);
                }
            }
        }

        boolean[] live = new boolean[n];
        for (int f = 0; f < n; f++) {
            if (reachable[f] && a.isAccepting(f) && !live[f] && onCycle(a, f)) {
                live[f] = true;
                queue.enqueue(f);
            }
        }
        while (!queue.isEmpty()) {
            int q = queue.dequeueInt();
            IntArrayList preds = reverse[q];
            for (int i = 0; i < preds.size(); i++) {
                int p = preds.getInt(i);
                if (!live[p]) {
                    live[p] = true;
                    queue.enqueue(p);
                }
            }
        }
        return live;
    }

    private static boolean onCycle(BuchiAutomaton a, int start) {
        boolean[] seen = new boolean[a.stateCount()];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(start);
        while (!queue.isEmpty()) {
            int p = queue.dequeueInt();
            for (int i = 0; i < a.outDegree(p); i++) {
                int q = a.target(p, i);
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

    private static BuchiAutomaton merge(BuchiAutomaton a, boolean[] keep) {
        int n = a.stateCount();
        int[] block = new int[n];
        // initial partition: {INIT}, accepting, non-accepting
        for (int s = 0; s < n; s++) {
            if (!keep[s]) {
                block[s] = -1;
            } else if (s == SpecificationAutomaton.INIT) {
                block[s] = 0;
            } else {
                block[s] = a.isAccepting(s) ? 1 : 2;
            }
        }
        int blockCount = countBlocks(block);
        while (true) {
            Map<Signature, Integer> ids = new LinkedHashMap<>();
            int[] refined = new int[n];
            for (int s = 0; s < n; s++) {
                if (block[s] < 0) {
                    refined[s] = -1;
                    continue;
                }
                Signature signature = new Signature(block[s], moves(a, s, block));
                Integer id = ids.get(signature);
                if (id == null) {
                    id = ids.size();
                    ids.put(signature, id);
                }
                refined[s] = id;
            }
            block = refined;
            if (ids.size() == blockCount) {
                break;
            }
            blockCount = ids.size();
        }

        // blocks are numbered by first member, so INIT's block is 0
        int[] representative = new int[blockCount];
        boolean[] seen = new boolean[blockCount];
        boolean[] accepting = new boolean[blockCount];
        for (int s = 0; s < n; s++) {
            int b = block[s];
            if (b >= 0 && !seen[b]) {
                seen[b] = true;
                representative[b] = s;
                accepting[b] = a.isAccepting(s);
            }
        }
        int[][] targets = new int[blockCount][];
        Guard[][] guards = new Guard[blockCount][];
        for (int b = 0; b < blockCount; b++) {
            List<Move> moves = moves(a, representative[b], block);
            targets[b] = new int[moves.size()];
            guards[b] = new Guard[moves.size()];
            for (int i = 0; i < moves.size(); i++) {
                Move move = moves.get(i);
                targets[b][i] = move.target();
                guards[b][i] = new Guard(move.positive(), move.negative());
            }
        }
        return new BuchiAutomaton(a.alphabet(), targets, guards, accepting);
    }

    /**
     * Outgoing transitions of {@code state} into live blocks, deduplicated and sorted.
     */
    private static List<Move> moves(BuchiAutomaton a, int state, int[] block) {
        List<Move> moves = new ArrayList<>(a.outDegree(state));
        for (int i = 0; i < a.outDegree(state); i++) {
            int targetBlock = block[a.target(state, i)];
            if (targetBlock < 0) {
                continue;
            }
            Guard guard = a.guard(state, i);
            Move move = new Move(guard.positive(), guard.negative(), targetBlock);
            if (!moves.contains(move)) {
                moves.add(move);
            }
        }
        moves.sort(MOVE_ORDER);
        return moves;
    }

    private static int countBlocks(int[] block) {
        boolean[] used = new boolean[3];
        int count = 0;
        for (int b : block) {
            if (b >= 0 && !used[b]) {
                used[b] = true;
                count++;
            }
        }
        return count;
    }
}
