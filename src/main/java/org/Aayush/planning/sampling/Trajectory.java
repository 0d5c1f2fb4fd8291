package org.Aayush.planning.sampling;

import org.Aayush.planning.workspace.Configuration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable polyline of configurations produced by the local planner.
 */
public final class Trajectory {
    private final List<Configuration> waypoints;
    private final double length;

    private Trajectory(List<Configuration> waypoints, double length) {
        this.waypoints = waypoints;
        this.length = length;
    }

    /**
     * @param waypoints at least two configurations, first is the start.
     */
    public static Trajectory of(List<Configuration> waypoints) {
        Objects.requireNonNull(waypoints, "waypoints");
        if (waypoints.size() < 2) {
            throw new IllegalArgumentException("trajectory needs at least two waypoints");
        }
        List<Configuration> copy = List.copyOf(waypoints);
        double total = 0.0d;
        for (int i = 1; i < copy.size(); i++) {
            total += copy.get(i - 1).distanceTo(copy.get(i));
        }
        return new Trajectory(copy, total);
    }

    public static Trajectory straight(Configuration from, Configuration to) {
        return of(List.of(from, to));
    }

    public List<Configuration> waypoints() {
        return waypoints;
    }

    public Configuration start() {
        return waypoints.get(0);
    }

    public Configuration end() {
        return waypoints.get(waypoints.size() - 1);
    }

    public double length() {
        return length;
    }

    /**
     * Axis-aligned bounds as {@code {minX, minY, maxX, maxY}}.
     */
    public double[] bounds() {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Configuration c : waypoints) {
            minX = Math.min(minX, c.x());
            minY = Math.min(minY, c.y());
            maxX = Math.max(maxX, c.x());
            maxY = Math.max(maxY, c.y());
        }
        return new double[]{minX, minY, maxX, maxY};
    }

    public Trajectory reversed() {
        List<Configuration> copy = new ArrayList<>(waypoints);
        Collections.reverse(copy);
        return new Trajectory(List.copyOf(copy), length);
    }

    /**
     * Splits every segment so no piece is longer than {@code resolution}.
     */
    public List<Configuration> discretize(double resolution) {
        if (!(resolution > 0.0d)) {
            throw new IllegalArgumentException("resolution must be > 0");
        }
        List<Configuration> out = new ArrayList<>();
        out.add(start());
        for (int i = 1; i < waypoints.size(); i++) {
            Configuration a = waypoints.get(i - 1);
            Configuration b = waypoints.get(i);
            int pieces = Math.max(1, (int) Math.ceil(a.distanceTo(b) / resolution));
            for (int k = 1; k < pieces; k++) {
                out.add(a.interpolate(b, (double) k / pieces));
            }
            out.add(b);
        }
        return out;
    }

    @Override
    public String toString() {
        return "Trajectory{waypoints=" + waypoints.size() + ", length=" + length + "}";
    }
}
