package org.Aayush.planning.workspace;

import lombok.Value;
import org.locationtech.jts.geom.Envelope;

/**
 * Axis-aligned rectangular boundary of a planar workspace.
 */
@Value
public class WorkspaceBounds {
    double minX;
    double minY;
    double maxX;
    double maxY;

    /**
     * Creates validated bounds.
     *
     * @throws GeometryException when any value is non-finite or the box has no area.
     */
    public static WorkspaceBounds of(double minX, double minY, double maxX, double maxY) {
        if (!Double.isFinite(minX) || !Double.isFinite(minY) || !Double.isFinite(maxX) || !Double.isFinite(maxY)) {
            throw new GeometryException(
                    GeometryException.REASON_NON_FINITE_COORDINATE,
                    "workspace bounds must be finite"
            );
        }
        if (!(minX < maxX) || !(minY < maxY)) {
            throw new GeometryException(
                    GeometryException.REASON_INVALID_BOUNDS,
                    "workspace bounds must satisfy min < max on both axes, got ["
                            + minX + ", " + maxX + "] x [" + minY + ", " + maxY + "]"
            );
        }
        return new WorkspaceBounds(minX, minY, maxX, maxY);
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    public double area() {
        return width() * height();
    }

    /**
     * Shrinks the box by {@code margin} on every side (robot footprint clearance).
     *
     * @throws GeometryException when the margin collapses the box.
     */
    public WorkspaceBounds shrink(double margin) {
        if (margin <= 0.0d) {
            return this;
        }
        return of(minX + margin, minY + margin, maxX - margin, maxY - margin);
    }

    public Envelope toEnvelope() {
        return new Envelope(minX, maxX, minY, maxY);
    }
}
