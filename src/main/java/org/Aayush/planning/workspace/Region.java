package org.Aayush.planning.workspace;

import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Named workspace region carrying the proposition label used by mission formulas.
 */
@Value
@Accessors(fluent = true)
public class Region {
    String id;
    String label;
    RegionKind kind;
    RegionShape shape;

    /**
     * Creates a validated region.
     *
     * @param id unique region id.
     * @param label proposition label (several regions may share one).
     * @param kind obstacle or labeled region.
     * @param shape geometry.
     */
    public static Region of(String id, String label, RegionKind kind, RegionShape shape) {
        return new Region(
                requireName(id, "id"),
                requireName(label, "label"),
                Objects.requireNonNull(kind, "kind"),
                Objects.requireNonNull(shape, "shape")
        );
    }

    /**
     * Obstacle whose label equals its id.
     */
    public static Region obstacle(String id, RegionShape shape) {
        return of(id, id, RegionKind.OBSTACLE, shape);
    }

    /**
     * Free labeled region whose label equals its id.
     */
    public static Region labeled(String id, RegionShape shape) {
        return of(id, id, RegionKind.LABELED, shape);
    }

    public Region withShape(RegionShape newShape) {
        return new Region(id, label, kind, Objects.requireNonNull(newShape, "shape"));
    }

    public boolean isObstacle() {
        return kind == RegionKind.OBSTACLE;
    }

    private static String requireName(String value, String what) {
        Objects.requireNonNull(value, what);
        if (value.isBlank()) {
            throw new IllegalArgumentException("region " + what + " must be non-blank");
        }
        return value;
    }
}
