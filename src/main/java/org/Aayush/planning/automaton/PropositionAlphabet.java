package org.Aayush.planning.automaton;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Dense mapping between proposition names and bit positions of a label mask.
 * <p>
 * Names are indexed in sorted order so the mapping is reproducible. Immutable and safe for
 * concurrent reads. At most {@value #MAX_PROPOSITIONS} propositions fit into one mask.
 * </p>
 */
public final class PropositionAlphabet {
    public static final int MAX_PROPOSITIONS = 64;

    // String -> bit index, -1 when absent
    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    private PropositionAlphabet(SortedSet<String> names) {
        this.forward = new Object2IntOpenHashMap<>(names.size());
        this.forward.defaultReturnValue(-1);
        this.reverse = names.toArray(new String[0]);
        for (int i = 0; i < reverse.length; i++) {
            forward.put(reverse[i], i);
        }
        this.forward.trim();
    }

    /**
     * Creates an alphabet over the given names.
     *
     * @throws FormulaException when more than {@value #MAX_PROPOSITIONS} distinct names are given.
     */
    public static PropositionAlphabet of(Collection<String> names) {
        SortedSet<String> sorted = new TreeSet<>(names);
        if (sorted.size() > MAX_PROPOSITIONS) {
            throw new FormulaException(
                    FormulaException.REASON_TOO_MANY_PROPOSITIONS,
                    "formula uses " + sorted.size() + " propositions, at most " + MAX_PROPOSITIONS + " are supported"
            );
        }
        return new PropositionAlphabet(sorted);
    }

    /**
     * @return bit index, or {@code -1} for names outside the alphabet.
     */
    public int indexOf(String name) {
        return forward.getInt(name);
    }

    public String name(int index) {
        if (index < 0 || index >= reverse.length) {
            throw new IndexOutOfBoundsException("proposition index out of bounds: " + index);
        }
        return reverse[index];
    }

    public boolean contains(String name) {
        return forward.containsKey(name);
    }

    public int size() {
        return reverse.length;
    }

    public List<String> names() {
        return List.of(reverse);
    }

    /**
     * Encodes a label set; labels outside the alphabet are ignored.
     */
    public long mask(Collection<String> labels) {
        long mask = 0L;
        for (String label : labels) {
            int index = forward.getInt(label);
            if (index >= 0) {
                mask |= 1L << index;
            }
        }
        return mask;
    }

    /**
     * Decodes a mask into sorted proposition names.
     */
    public SortedSet<String> labels(long mask) {
        SortedSet<String> out = new TreeSet<>();
        for (int i = 0; i < reverse.length; i++) {
            if ((mask & (1L << i)) != 0L) {
                out.add(reverse[i]);
            }
        }
        return Collections.unmodifiableSortedSet(out);
    }

    @Override
    public String toString() {
        return "PropositionAlphabet" + names();
    }
}
