package org.Aayush.planning.execution;

import org.Aayush.planning.workspace.RegionShape;

import java.util.Objects;

/**
 * Transient service request sensed near the robot.
 *
 * @param name request label.
 * @param region area where the request can be served.
 * @param priority urgency; lower values are served first.
 */
public record LocalRequest(String name, RegionShape region, int priority) {
    public LocalRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(region, "region");
    }

    public boolean servedAt(double x, double y) {
        return region.contains(x, y);
    }
}
