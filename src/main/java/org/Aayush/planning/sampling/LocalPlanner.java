package org.Aayush.planning.sampling;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.Workspace;

import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Straight-line steering and connection between configurations.
 */
@Getter
@Accessors(fluent = true)
public final class LocalPlanner {
    private final Workspace workspace;
    /** Maximum extension of one steering step. */
    private final double stepSize;
    /** Increment used when walking towards a blocked target. */
    private final double resolution;

    public LocalPlanner(Workspace workspace, double stepSize, double resolution) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        if (!(stepSize > 0.0d) || !(resolution > 0.0d)) {
            throw new IllegalArgumentException("stepSize and resolution must be > 0");
        }
        this.stepSize = stepSize;
        this.resolution = resolution;
    }

    public Optional<Configuration> steer(Configuration from, Configuration to) {
        return steer(from, to, stepSize);
    }

    /**
     * Farthest point towards {@code to}, at most {@code maxExtension} away, whose connecting
     * segment from {@code from} is free.
     *
     * @return labeled configuration, or empty when less than one resolution step is free
     * or {@code from} coincides with {@code to}.
     */
    public Optional<Configuration> steer(Configuration from, Configuration to, double maxExtension) {
        double distance = from.distanceTo(to);
        if (distance <= 0.0d) {
            return Optional.empty();
        }
        Configuration target = distance <= maxExtension ? to : from.interpolate(to, maxExtension / distance);
        if (workspace.segmentIsFree(from, target)) {
            return Optional.of(workspace.label(target));
        }
        double reach = Math.min(distance, maxExtension);
        int steps = (int) Math.floor(reach / resolution);
        Configuration lastFree = null;
        Configuration previous = from;
        for (int k = 1; k <= steps; k++) {
            Configuration next = from.interpolate(to, k * resolution / distance);
            if (!workspace.segmentIsFree(previous, next)) {
                break;
            }
            lastFree = next;
            previous = next;
        }
        return lastFree == null ? Optional.empty() : Optional.of(workspace.label(lastFree));
    }

    /**
     * @return straight trajectory when the segment is traversable.
     */
    public Optional<Trajectory> connect(Configuration from, Configuration to) {
        if (!isTraversable(from, to)) {
            return Optional.empty();
        }
        return Optional.of(Trajectory.straight(from, to));
    }

    public boolean isFree(Configuration from, Configuration to) {
        return workspace.segmentIsFree(from, to);
    }

    /**
     * Whether the segment reads the labels of {@code from} and then those of {@code to},
     * with no third label set in between. Both endpoints must carry their current labels.
     */
    public boolean isLabelConsistent(Configuration from, Configuration to) {
        double distance = from.distanceTo(to);
        int pieces = (int) Math.ceil(distance / resolution);
        boolean switched = from.labels().equals(to.labels());
        for (int k = 1; k < pieces; k++) {
            SortedSet<String> labels = workspace.contains(from.interpolate(to, (double) k / pieces));
            if (!switched && labels.equals(from.labels())) {
                continue;
            }
            if (!labels.equals(to.labels())) {
                return false;
            }
            switched = true;
        }
        return true;
    }

    /**
     * A product edge may use the segment: it is free and label consistent.
     */
    public boolean isTraversable(Configuration from, Configuration to) {
        return workspace.segmentIsFree(from, to) && isLabelConsistent(from, to);
    }
}
