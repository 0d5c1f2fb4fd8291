package org.Aayush.planning.workspace;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable point in the robot configuration space.
 * <p>
 * A configuration also carries the set of region labels that contained it at the time it
 * was labeled by a {@link Workspace}. Labels are a derived view: relabeling produces a new
 * instance via {@link #withLabels(Collection)} and never mutates this one.
 * </p>
 */
public final class Configuration {

    private final double[] coords;
    private final SortedSet<String> labels;

    private Configuration(double[] coords, SortedSet<String> labels) {
        this.coords = coords;
        this.labels = labels;
    }

    /**
     * Creates an unlabeled configuration.
     *
     * @param coords coordinates; must be non-empty and finite.
     * @return immutable configuration.
     */
    public static Configuration of(double... coords) {
        if (coords == null || coords.length == 0) {
            throw new IllegalArgumentException("configuration needs at least one coordinate");
        }
        for (int i = 0; i < coords.length; i++) {
            if (!Double.isFinite(coords[i])) {
                throw new GeometryException(
                        GeometryException.REASON_NON_FINITE_COORDINATE,
                        "coordinate " + i + " must be finite, got " + coords[i]
                );
            }
        }
        return new Configuration(coords.clone(), Collections.emptySortedSet());
    }

    /**
     * Returns a copy of this configuration carrying the given labels.
     */
    public Configuration withLabels(Collection<String> newLabels) {
        if (newLabels == null || newLabels.isEmpty()) {
            return labels.isEmpty() ? this : new Configuration(coords, Collections.emptySortedSet());
        }
        SortedSet<String> copy = Collections.unmodifiableSortedSet(new TreeSet<>(newLabels));
        if (copy.equals(labels)) {
            return this;
        }
        return new Configuration(coords, copy);
    }

    public int dimension() {
        return coords.length;
    }

    public double coord(int axis) {
        return coords[axis];
    }

    public double x() {
        return coords[0];
    }

    public double y() {
        return coords.length > 1 ? coords[1] : 0.0d;
    }

    /**
     * @return a copy of the coordinates.
     */
    public double[] coordinates() {
        return coords.clone();
    }

    /**
     * @return immutable, sorted label set.
     */
    public SortedSet<String> labels() {
        return labels;
    }

    public boolean hasLabel(String label) {
        return labels.contains(label);
    }

    /**
     * Euclidean distance in configuration space.
     *
     * @throws GeometryException if dimensions differ.
     */
    public double distanceTo(Configuration other) {
        requireSameDimension(other);
        double sum = 0.0d;
        for (int i = 0; i < coords.length; i++) {
            double d = other.coords[i] - coords[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /**
     * Point on the straight segment towards {@code to}; {@code t = 0} is this point.
     * The result is unlabeled.
     */
    public Configuration interpolate(Configuration to, double t) {
        requireSameDimension(to);
        double[] out = new double[coords.length];
        for (int i = 0; i < coords.length; i++) {
            out[i] = coords[i] + t * (to.coords[i] - coords[i]);
        }
        return new Configuration(out, Collections.emptySortedSet());
    }

    /**
     * Coordinate equality, ignoring labels.
     */
    public boolean samePoint(Configuration other) {
        return other != null && Arrays.equals(coords, other.coords);
    }

    private void requireSameDimension(Configuration other) {
        if (other.coords.length != coords.length) {
            throw new GeometryException(
                    GeometryException.REASON_DIMENSION_MISMATCH,
                    "dimension mismatch: " + coords.length + " vs " + other.coords.length
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Configuration)) {
            return false;
        }
        Configuration that = (Configuration) o;
        return Arrays.equals(coords, that.coords) && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(coords) + labels.hashCode();
    }

    @Override
    public String toString() {
        return "Configuration" + Arrays.toString(coords) + (labels.isEmpty() ? "" : labels.toString());
    }
}
