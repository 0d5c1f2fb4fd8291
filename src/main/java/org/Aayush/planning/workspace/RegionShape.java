package org.Aayush.planning.workspace;

import org.locationtech.jts.geom.Envelope;

/**
 * Closed planar primitive backing a {@link Region}.
 * <p>
 * Implementations are immutable; {@link #inflate(double)} and {@link #scale(double)} return
 * new shapes and report degenerate results with {@link GeometryException}.
 * </p>
 */
public interface RegionShape {

    /**
     * @return true when the point lies inside or on the boundary.
     */
    boolean contains(double x, double y);

    /**
     * @return true when the closed segment touches the shape.
     */
    boolean intersectsSegment(double x1, double y1, double x2, double y2);

    /**
     * @return axis-aligned bounding box.
     */
    Envelope envelope();

    double area();

    /**
     * Minkowski-style growth by a robot footprint radius.
     *
     * @param radius non-negative clearance.
     */
    RegionShape inflate(double radius);

    /**
     * Uniform scaling about the shape's own center.
     *
     * @param factor strictly positive factor.
     */
    RegionShape scale(double factor);
}
