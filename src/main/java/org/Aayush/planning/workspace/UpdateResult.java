package org.Aayush.planning.workspace;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.locationtech.jts.geom.Envelope;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of {@link Workspace#applyUpdate(RegionUpdate)}.
 * <p>
 * The envelope bounds every point whose containment or collision answer may have changed:
 * it covers both the geometry before and after the update.
 * </p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class UpdateResult {
    private final RegionUpdate update;
    private final SortedSet<String> affectedRegionIds;
    private final Envelope affectedEnvelope;
    /** True when free space changed (an obstacle was touched). */
    private final boolean obstaclesChanged;
    /** Workspace version after the update. */
    private final long version;

    static UpdateResult of(
            RegionUpdate update,
            String regionId,
            Envelope before,
            Envelope after,
            boolean obstacle,
            long version
    ) {
        Envelope envelope = new Envelope();
        if (before != null) {
            envelope.expandToInclude(before);
        }
        if (after != null) {
            envelope.expandToInclude(after);
        }
        SortedSet<String> ids = new TreeSet<>();
        ids.add(regionId);
        return new UpdateResult(
                update,
                Collections.unmodifiableSortedSet(ids),
                envelope,
                obstacle,
                version
        );
    }

    /**
     * @return true when the closed envelope touches the segment's bounding box.
     */
    public boolean touches(double x1, double y1, double x2, double y2) {
        return affectedEnvelope.intersects(new Envelope(x1, x2, y1, y2));
    }

    public boolean touches(double x, double y) {
        return affectedEnvelope.intersects(x, y);
    }
}
