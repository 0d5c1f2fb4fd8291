package org.Aayush.planning.workspace;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.locationtech.jts.geom.Envelope;

/**
 * Closed disc, evaluated analytically.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class DiscShape implements RegionShape {
    private final double centerX;
    private final double centerY;
    private final double radius;

    /**
     * Creates a validated disc.
     *
     * @throws GeometryException for non-finite values or a non-positive radius.
     */
    public static DiscShape of(double centerX, double centerY, double radius) {
        if (!Double.isFinite(centerX) || !Double.isFinite(centerY) || !Double.isFinite(radius)) {
            throw new GeometryException(
                    GeometryException.REASON_NON_FINITE_COORDINATE,
                    "disc center and radius must be finite"
            );
        }
        if (radius <= 0.0d) {
            throw new GeometryException(
                    GeometryException.REASON_DEGENERATE_REGION,
                    "disc radius must be > 0, got " + radius
            );
        }
        return new DiscShape(centerX, centerY, radius);
    }

    @Override
    public boolean contains(double x, double y) {
        double dx = x - centerX;
        double dy = y - centerY;
        return dx * dx + dy * dy <= radius * radius;
    }

    @Override
    public boolean intersectsSegment(double x1, double y1, double x2, double y2) {
        double vx = x2 - x1;
        double vy = y2 - y1;
        double lengthSquared = vx * vx + vy * vy;
        double t = 0.0d;
        if (lengthSquared > 0.0d) {
            t = ((centerX - x1) * vx + (centerY - y1) * vy) / lengthSquared;
            t = Math.max(0.0d, Math.min(1.0d, t));
        }
        return contains(x1 + t * vx, y1 + t * vy);
    }

    @Override
    public Envelope envelope() {
        return new Envelope(centerX - radius, centerX + radius, centerY - radius, centerY + radius);
    }

    @Override
    public double area() {
        return Math.PI * radius * radius;
    }

    @Override
    public DiscShape inflate(double clearance) {
        ShapeArguments.requireClearance(clearance);
        return clearance == 0.0d ? this : new DiscShape(centerX, centerY, radius + clearance);
    }

    @Override
    public DiscShape scale(double factor) {
        ShapeArguments.requirePositiveFactor(factor);
        return new DiscShape(centerX, centerY, radius * factor);
    }

    @Override
    public String toString() {
        return "Disc(" + centerX + ", " + centerY + ", r=" + radius + ")";
    }
}
