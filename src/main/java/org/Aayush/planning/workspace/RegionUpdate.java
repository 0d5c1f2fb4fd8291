package org.Aayush.planning.workspace;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * One discrete environment change addressed to a region id.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RegionUpdate {

    /**
     * Change category.
     */
    public enum Kind {
        /** A new region appears. */
        ADDED,
        /** An existing region disappears. */
        REMOVED,
        /** An existing region gets a new shape. */
        RESHAPED,
        /** An existing region is scaled about its center. */
        SCALED
    }

    private final Kind kind;
    private final String regionId;
    /** New region for {@link Kind#ADDED}, otherwise {@code null}. */
    private final Region region;
    /** Replacement shape for {@link Kind#RESHAPED}, otherwise {@code null}. */
    private final RegionShape shape;
    /** Scale factor for {@link Kind#SCALED}, otherwise {@code 1.0}. */
    private final double factor;

    public static RegionUpdate added(Region region) {
        Objects.requireNonNull(region, "region");
        return new RegionUpdate(Kind.ADDED, region.id(), region, null, 1.0d);
    }

    public static RegionUpdate removed(String regionId) {
        return new RegionUpdate(Kind.REMOVED, Objects.requireNonNull(regionId, "regionId"), null, null, 1.0d);
    }

    public static RegionUpdate reshaped(String regionId, RegionShape shape) {
        return new RegionUpdate(
                Kind.RESHAPED,
                Objects.requireNonNull(regionId, "regionId"),
                null,
                Objects.requireNonNull(shape, "shape"),
                1.0d
        );
    }

    public static RegionUpdate scaled(String regionId, double factor) {
        return new RegionUpdate(Kind.SCALED, Objects.requireNonNull(regionId, "regionId"), null, null, factor);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ADDED -> "ADDED(" + regionId + " " + region.shape() + ")";
            case REMOVED -> "REMOVED(" + regionId + ")";
            case RESHAPED -> "RESHAPED(" + regionId + " " + shape + ")";
            case SCALED -> "SCALED(" + regionId + " x" + factor + ")";
        };
    }
}
