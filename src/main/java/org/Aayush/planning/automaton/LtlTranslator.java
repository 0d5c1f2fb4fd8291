package org.Aayush.planning.automaton;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Translates LTL formulas into reduced Büchi automata.
 * <p>
 * Stage 1 expands the negation normal form with the on-the-fly tableau of Gerth, Peled,
 * Vardi and Wolper. Each tableau node becomes a state whose literals guard every transition
 * entering it; every until subformula contributes one generalized acceptance set. Stage 2
 * degeneralizes with a round-robin counter. Stage 3 hands the result to
 * {@link BuchiReducer}.
 * </p>
 * <p>
 * All intermediate collections are insertion-ordered, so the same formula always yields the
 * same state numbering.
 * </p>
 */
@Slf4j
public final class LtlTranslator {
    private static final int INIT_NODE = 0;

    private LtlTranslator() {
    }

    public static BuchiAutomaton translate(String formula) {
        return translate(LtlParser.parse(formula));
    }

    /**
     * Translates a formula and warns about propositions no workspace region can report.
     *
     * @param formula mission formula text.
     * @param knownLabels labels the workspace can produce.
     */
    public static BuchiAutomaton translate(String formula, Collection<String> knownLabels) {
        LtlFormula parsed = LtlParser.parse(formula);
        Set<String> atoms = new TreeSet<>();
        parsed.collectAtoms(atoms);
        for (String atom : atoms) {
            if (!knownLabels.contains(atom)) {
                log.warn("proposition '{}' in formula '{}' matches no region label and is always false", atom, formula);
            }
        }
        return translate(parsed);
    }

    /**
     * Translates a syntax tree.
     *
     * @throws FormulaException when the formula is unsatisfiable or uses too many propositions.
     */
    public static BuchiAutomaton translate(LtlFormula formula) {
        Objects.requireNonNull(formula, "formula");
        SortedSet<String> atoms = new TreeSet<>();
        formula.collectAtoms(atoms);
        PropositionAlphabet alphabet = PropositionAlphabet.of(atoms);

        LtlFormula nnf = formula.nnf();
        List<Node> nodes = expand(nnf);
        List<LtlFormula.Until> untils = new ArrayList<>(collectUntils(nnf, new LinkedHashSet<>()));
        BuchiAutomaton raw = degeneralize(nodes, untils, alphabet);
        BuchiAutomaton reduced = BuchiReducer.reduce(raw, formula.toString());
        log.debug(
                "translated '{}': {} tableau nodes, {} acceptance sets, {} -> {} states",
                formula, nodes.size(), untils.size(), raw.stateCount(), reduced.stateCount()
        );
        return reduced;
    }

    /**
     * Tableau node. {@code id} is assigned once the node is fully expanded.
     */
    private static final class Node {
        private int id = -1;
        private final IntLinkedOpenHashSet incoming;
        private final LinkedHashSet<LtlFormula> pending;
        private final LinkedHashSet<LtlFormula> old;
        private final LinkedHashSet<LtlFormula> next;

        private Node(IntLinkedOpenHashSet incoming, Set<LtlFormula> pending) {
            this.incoming = incoming;
            this.pending = new LinkedHashSet<>(pending);
            this.old = new LinkedHashSet<>();
            this.next = new LinkedHashSet<>();
        }

        private Node split() {
            Node copy = new Node(new IntLinkedOpenHashSet(incoming), pending);
            copy.old.addAll(old);
            copy.next.addAll(next);
            return copy;
        }

        private void addPending(LtlFormula formula) {
            if (!old.contains(formula)) {
                pending.add(formula);
            }
        }
    }

    private record NodeKey(Set<LtlFormula> old, Set<LtlFormula> next) {
    }

    private static List<Node> expand(LtlFormula nnf) {
        List<Node> finished = new ArrayList<>();
        Map<NodeKey, Node> byKey = new HashMap<>();
        Deque<Node> stack = new ArrayDeque<>();
        IntLinkedOpenHashSet initIncoming = new IntLinkedOpenHashSet();
        initIncoming.add(INIT_NODE);
        stack.push(new Node(initIncoming, Set.of(nnf)));

        while (!stack.isEmpty()) {
            Node node = stack.pop();
            boolean alive = true;
            while (alive) {
                if (node.pending.isEmpty()) {
                    NodeKey key = new NodeKey(Set.copyOf(node.old), Set.copyOf(node.next));
                    Node existing = byKey.get(key);
                    if (existing != null) {
                        existing.incoming.addAll(node.incoming);
                    } else {
                        node.id = finished.size() + 1;
                        finished.add(node);
                        byKey.put(key, node);
                        IntLinkedOpenHashSet incoming = new IntLinkedOpenHashSet();
                        incoming.add(node.id);
                        stack.push(new Node(incoming, node.next));
                    }
                    break;
                }
                Iterator<LtlFormula> it = node.pending.iterator();
                LtlFormula eta = it.next();
                it.remove();
                alive = process(node, eta, stack);
            }
        }
        return finished;
    }

    /**
     * Expands one pending obligation of {@code node}.
     *
     * @return false when the node is contradictory and must be dropped.
     */
    private static boolean process(Node node, LtlFormula eta, Deque<Node> stack) {
        if (LtlFormula.isLiteral(eta)) {
            if (eta instanceof LtlFormula.Constant) {
                return ((LtlFormula.Constant) eta).value();
            }
            if (node.old.contains(eta.negatedNnf())) {
                return false;
            }
            node.old.add(eta);
            return true;
        }
        if (eta instanceof LtlFormula.And) {
            LtlFormula.And and = (LtlFormula.And) eta;
            node.old.add(eta);
            node.addPending(and.left());
            node.addPending(and.right());
            return true;
        }
        if (eta instanceof LtlFormula.Next) {
            node.old.add(eta);
            node.next.add(((LtlFormula.Next) eta).operand());
            return true;
        }
        Node other = node.split();
        node.old.add(eta);
        other.old.add(eta);
        if (eta instanceof LtlFormula.Or) {
            LtlFormula.Or or = (LtlFormula.Or) eta;
            node.addPending(or.left());
            other.addPending(or.right());
        } else if (eta instanceof LtlFormula.Until) {
            LtlFormula.Until until = (LtlFormula.Until) eta;
            node.addPending(until.left());
            node.next.add(eta);
            other.addPending(until.right());
        } else if (eta instanceof LtlFormula.Release) {
            LtlFormula.Release release = (LtlFormula.Release) eta;
            node.addPending(release.right());
            node.next.add(eta);
            other.addPending(release.left());
            other.addPending(release.right());
        } else {
            throw new IllegalStateException("formula is not in negation normal form: " + eta);
        }
        stack.push(other);
        return true;
    }

    private static Set<LtlFormula.Until> collectUntils(LtlFormula formula, Set<LtlFormula.Until> sink) {
        if (formula instanceof LtlFormula.Until) {
            LtlFormula.Until until = (LtlFormula.Until) formula;
            sink.add(until);
            collectUntils(until.left(), sink);
            collectUntils(until.right(), sink);
        } else if (formula instanceof LtlFormula.Release) {
            LtlFormula.Release release = (LtlFormula.Release) formula;
            collectUntils(release.left(), sink);
            collectUntils(release.right(), sink);
        } else if (formula instanceof LtlFormula.And) {
            LtlFormula.And and = (LtlFormula.And) formula;
            collectUntils(and.left(), sink);
            collectUntils(and.right(), sink);
        } else if (formula instanceof LtlFormula.Or) {
            LtlFormula.Or or = (LtlFormula.Or) formula;
            collectUntils(or.left(), sink);
            collectUntils(or.right(), sink);
        } else if (formula instanceof LtlFormula.Next) {
            collectUntils(((LtlFormula.Next) formula).operand(), sink);
        }
        return sink;
    }

    private static Guard guardOf(Node node, PropositionAlphabet alphabet) {
        long positive = 0L;
        long negative = 0L;
        for (LtlFormula formula : node.old) {
            if (formula instanceof LtlFormula.Atom) {
                positive |= 1L << alphabet.indexOf(((LtlFormula.Atom) formula).name());
            } else if (formula instanceof LtlFormula.Not && ((LtlFormula.Not) formula).operand() instanceof LtlFormula.Atom) {
                LtlFormula.Atom atom = (LtlFormula.Atom) ((LtlFormula.Not) formula).operand();
                negative |= 1L << alphabet.indexOf(atom.name());
            }
        }
        return new Guard(positive, negative);
    }

    /**
     * Counter construction over tableau nodes. State {@code (node, i)} moves to counter
     * {@code i + 1} when {@code node} belongs to acceptance set {@code i}; states
     * {@code (node, 0)} with {@code node} in set 0 are accepting.
     */
    private static BuchiAutomaton degeneralize(List<Node> nodes, List<LtlFormula.Until> untils, PropositionAlphabet alphabet) {
        int nodeCount = nodes.size() + 1;
        int sets = Math.max(1, untils.size());

        boolean[][] inSet = new boolean[sets][nodeCount];
        Guard[] nodeGuard = new Guard[nodeCount];
        nodeGuard[INIT_NODE] = Guard.TRUE;
        IntArrayList[] nodeSuccessors = new IntArrayList[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            nodeSuccessors[i] = new IntArrayList();
        }
        for (Node node : nodes) {
            nodeGuard[node.id] = guardOf(node, alphabet);
            for (int s = 0; s < sets; s++) {
                inSet[s][node.id] = untils.isEmpty() || !node.old.contains(untils.get(s))
                        || node.old.contains(untils.get(s).right());
            }
        }
        // nodes are numbered in completion order, so iterating them keeps successor lists ascending
        for (Node node : nodes) {
            int[] sources = node.incoming.toIntArray();
            for (int source : sources) {
                nodeSuccessors[source].add(node.id);
            }
        }

        Int2IntOpenHashMap stateOf = new Int2IntOpenHashMap();
        stateOf.defaultReturnValue(-1);
        IntArrayList stateNode = new IntArrayList();
        IntArrayList stateCounter = new IntArrayList();
        List<IntArrayList> stateTargets = new ArrayList<>();
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        stateOf.put(INIT_NODE * sets, 0);
        stateNode.add(INIT_NODE);
        stateCounter.add(0);
        stateTargets.add(new IntArrayList());
        queue.enqueue(0);
        while (!queue.isEmpty()) {
            int state = queue.dequeueInt();
            int p = stateNode.getInt(state);
            int i = stateCounter.getInt(state);
            int j = p == INIT_NODE ? 0 : (inSet[i][p] ? (i + 1) % sets : i);
            IntArrayList succ = nodeSuccessors[p];
            for (int k = 0; k < succ.size(); k++) {
                int q = succ.getInt(k);
                int key = q * sets + j;
                int target = stateOf.get(key);
                if (target < 0) {
                    target = stateNode.size();
                    stateOf.put(key, target);
                    stateNode.add(q);
                    stateCounter.add(j);
                    stateTargets.add(new IntArrayList());
                    queue.enqueue(target);
                }
                stateTargets.get(state).add(target);
            }
        }

        int n = stateNode.size();
        int[][] targets = new int[n][];
        Guard[][] guards = new Guard[n][];
        boolean[] accepting = new boolean[n];
        for (int s = 0; s < n; s++) {
            int[] row = stateTargets.get(s).toIntArray();
            Arrays.sort(row);
            targets[s] = row;
            guards[s] = new Guard[row.length];
            for (int k = 0; k < row.length; k++) {
                guards[s][k] = nodeGuard[stateNode.getInt(row[k])];
            }
            int node = stateNode.getInt(s);
            accepting[s] = node != INIT_NODE && stateCounter.getInt(s) == 0 && inSet[0][node];
        }
        return new BuchiAutomaton(alphabet, targets, guards, accepting);
    }
}
