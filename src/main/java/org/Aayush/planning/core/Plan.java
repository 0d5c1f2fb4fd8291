package org.Aayush.planning.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.planning.sampling.Trajectory;
import org.Aayush.planning.workspace.Configuration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Satisfying plan in prefix-suffix form.
 * <p>
 * The robot visits {@code configurations[0 .. n-1]} once and then repeats
 * {@code configurations[suffixStart .. n-1]} forever. For {@link AcceptanceKind#STUTTER}
 * plans the suffix is the last configuration alone: the robot parks there. For
 * {@link AcceptanceKind#CYCLE} plans one extra segment closes the loop from the last
 * configuration back to {@code configurations[suffixStart]}.
 * </p>
 * <p>
 * {@code states[i]} is the automaton state after reading the labels of
 * {@code configurations[i]}.
 * </p>
 */
@Getter
@Accessors(fluent = true)
public final class Plan {

    /**
     * How the plan certifies acceptance.
     */
    public enum AcceptanceKind {
        /** Staying forever at the last configuration is accepted. */
        STUTTER,
        /** The suffix loop passes through an accepting state. */
        CYCLE
    }

    private final List<Configuration> configurations;
    private final IntList states;
    /** Product vertex ids the plan was extracted from. */
    private final IntList vertexIds;
    private final int suffixStart;
    /** Prefix length plus one traversal of the suffix loop. */
    private final double cost;
    private final AcceptanceKind acceptance;
    /**
     * Connectors between consecutive configurations; for cycle plans the last entry closes
     * the loop.
     */
    private final List<Trajectory> segments;

    Plan(
            List<Configuration> configurations,
            IntList states,
            IntList vertexIds,
            int suffixStart,
            double cost,
            AcceptanceKind acceptance,
            List<Trajectory> segments
    ) {
        Objects.requireNonNull(acceptance, "acceptance");
        int n = configurations.size();
        if (n == 0 || states.size() != n || vertexIds.size() != n) {
            throw new IllegalArgumentException("plan sequences must be non-empty and parallel");
        }
        if (suffixStart < 0 || suffixStart >= n) {
            throw new IllegalArgumentException("suffixStart " + suffixStart + " outside [0, " + n + ")");
        }
        int expectedSegments = acceptance == AcceptanceKind.CYCLE ? n : n - 1;
        if (segments.size() != expectedSegments) {
            throw new IllegalArgumentException("expected " + expectedSegments + " segments, got " + segments.size());
        }
        this.configurations = List.copyOf(configurations);
        this.states = IntLists.unmodifiable(new IntArrayList(states));
        this.vertexIds = IntLists.unmodifiable(new IntArrayList(vertexIds));
        this.suffixStart = suffixStart;
        this.cost = cost;
        this.acceptance = acceptance;
        this.segments = List.copyOf(segments);
    }

    public int size() {
        return configurations.size();
    }

    public List<Configuration> prefix() {
        return configurations.subList(0, suffixStart);
    }

    /**
     * @return configurations repeated forever, never empty.
     */
    public List<Configuration> suffix() {
        return configurations.subList(suffixStart, configurations.size());
    }

    public List<SortedSet<String>> labelSequence() {
        List<SortedSet<String>> labels = new ArrayList<>(configurations.size());
        for (Configuration c : configurations) {
            labels.add(c.labels());
        }
        return Collections.unmodifiableList(labels);
    }

    /**
     * Geometric path of the prefix followed by one traversal of the suffix loop.
     */
    public List<Configuration> path() {
        List<Configuration> path = new ArrayList<>();
        path.add(configurations.get(0));
        for (Trajectory segment : segments) {
            List<Configuration> waypoints = segment.waypoints();
            path.addAll(waypoints.subList(1, waypoints.size()));
        }
        return Collections.unmodifiableList(path);
    }

    @Override
    public String toString() {
        return "Plan{" + acceptance + ", size=" + configurations.size() + ", suffixStart=" + suffixStart
                + ", cost=" + cost + "}";
    }
}
