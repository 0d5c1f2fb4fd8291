package org.Aayush.planning.workspace;

import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Planar workspace of disc and polygon regions.
 * <p>
 * Regions are held in an immutable snapshot that writers replace atomically under a
 * lock, so queries never observe a half-applied update. Every region is inflated by the
 * robot footprint radius and the bounds are shrunk by it, so the robot can be treated as
 * a point afterwards.
 * </p>
 */
@Slf4j
public final class PolygonWorkspace implements Workspace {

    private final WorkspaceBounds bounds;
    private final double footprintRadius;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Snapshot snapshot;

    /**
     * Immutable region table. {@code effective} holds inflated regions in definition order.
     */
    private static final class Snapshot {
        private final Map<String, Region> raw;
        private final Map<String, Region> effective;
        private final List<Region> obstacles;
        private final SortedSet<String> labels;
        private final long version;

        private Snapshot(Map<String, Region> raw, Map<String, Region> effective, long version) {
            this.raw = Collections.unmodifiableMap(raw);
            this.effective = Collections.unmodifiableMap(effective);
            List<Region> blocking = new ArrayList<>();
            SortedSet<String> allLabels = new TreeSet<>();
            for (Region region : effective.values()) {
                if (region.isObstacle()) {
                    blocking.add(region);
                }
                allLabels.add(region.label());
            }
            this.obstacles = Collections.unmodifiableList(blocking);
            this.labels = Collections.unmodifiableSortedSet(allLabels);
            this.version = version;
        }
    }

    private PolygonWorkspace(WorkspaceBounds bounds, double footprintRadius, Snapshot snapshot) {
        this.bounds = bounds;
        this.footprintRadius = footprintRadius;
        this.snapshot = snapshot;
    }

    /**
     * Builds a workspace.
     *
     * @param bounds outer boundary before footprint shrinking.
     * @param regions initial regions; ids must be unique.
     * @param footprintRadius robot radius ({@code >= 0}).
     * @throws GeometryException for invalid bounds, footprint or duplicate ids.
     */
    @Builder
    private static PolygonWorkspace create(
            WorkspaceBounds bounds,
            @Singular List<Region> regions,
            double footprintRadius
    ) {
        Objects.requireNonNull(bounds, "bounds");
        ShapeArguments.requireClearance(footprintRadius);
        WorkspaceBounds effectiveBounds = bounds.shrink(footprintRadius);
        Map<String, Region> raw = new LinkedHashMap<>();
        Map<String, Region> effective = new LinkedHashMap<>();
        for (Region region : regions) {
            if (raw.containsKey(region.id())) {
                throw new GeometryException(
                        GeometryException.REASON_DUPLICATE_REGION_ID,
                        "duplicate region id",
                        region.id(),
                        null
                );
            }
            raw.put(region.id(), region);
            effective.put(region.id(), inflate(region, footprintRadius));
        }
        log.debug("workspace built: bounds={}, regions={}, footprint={}", effectiveBounds, raw.size(), footprintRadius);
        return new PolygonWorkspace(effectiveBounds, footprintRadius, new Snapshot(raw, effective, 0L));
    }

    private static Region inflate(Region region, double radius) {
        try {
            return region.withShape(region.shape().inflate(radius));
        } catch (GeometryException e) {
            throw e.forRegion(region.id());
        }
    }

    @Override
    public int dimension() {
        return 2;
    }

    @Override
    public WorkspaceBounds bounds() {
        return bounds;
    }

    public double footprintRadius() {
        return footprintRadius;
    }

    @Override
    public SortedSet<String> contains(Configuration configuration) {
        requirePlanar(configuration);
        double x = configuration.x();
        double y = configuration.y();
        SortedSet<String> out = null;
        for (Region region : snapshot.effective.values()) {
            if (region.shape().contains(x, y)) {
                if (out == null) {
                    out = new TreeSet<>();
                }
                out.add(region.label());
            }
        }
        return out == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(out);
    }

    @Override
    public boolean isFree(Configuration configuration) {
        requirePlanar(configuration);
        double x = configuration.x();
        double y = configuration.y();
        if (!bounds.contains(x, y)) {
            return false;
        }
        for (Region obstacle : snapshot.obstacles) {
            if (obstacle.shape().contains(x, y)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The bounds are convex, so endpoint checks cover them; obstacles are tested exactly.
     */
    @Override
    public boolean segmentIsFree(Configuration from, Configuration to) {
        requirePlanar(from);
        requirePlanar(to);
        double x1 = from.x();
        double y1 = from.y();
        double x2 = to.x();
        double y2 = to.y();
        if (!bounds.contains(x1, y1) || !bounds.contains(x2, y2)) {
            return false;
        }
        Envelope segmentBox = new Envelope(x1, x2, y1, y2);
        for (Region obstacle : snapshot.obstacles) {
            RegionShape shape = obstacle.shape();
            if (shape.envelope().intersects(segmentBox) && shape.intersectsSegment(x1, y1, x2, y2)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public UpdateResult applyUpdate(RegionUpdate update) {
        Objects.requireNonNull(update, "update");
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            Map<String, Region> raw = new LinkedHashMap<>(current.raw);
            Map<String, Region> effective = new LinkedHashMap<>(current.effective);
            String id = update.regionId();
            Region before = effective.get(id);
            Region after;

            switch (update.kind()) {
                case ADDED -> {
                    if (before != null) {
                        throw new GeometryException(
                                GeometryException.REASON_DUPLICATE_REGION_ID,
                                "region already exists",
                                id,
                                null
                        );
                    }
                    raw.put(id, update.region());
                    after = inflate(update.region(), footprintRadius);
                    effective.put(id, after);
                }
                case REMOVED -> {
                    requireKnown(before, id);
                    raw.remove(id);
                    effective.remove(id);
                    after = null;
                }
                case RESHAPED -> {
                    requireKnown(before, id);
                    Region reshaped = raw.get(id).withShape(update.shape());
                    raw.put(id, reshaped);
                    after = inflate(reshaped, footprintRadius);
                    effective.put(id, after);
                }
                case SCALED -> {
                    requireKnown(before, id);
                    Region scaled;
                    try {
                        scaled = raw.get(id).withShape(raw.get(id).shape().scale(update.factor()));
                    } catch (GeometryException e) {
                        throw e.forRegion(id);
                    }
                    raw.put(id, scaled);
                    after = inflate(scaled, footprintRadius);
                    effective.put(id, after);
                }
                default -> throw new IllegalStateException("unsupported update kind " + update.kind());
            }

            long version = current.version + 1;
            snapshot = new Snapshot(raw, effective, version);
            boolean obstacle = (before != null && before.isObstacle()) || (after != null && after.isObstacle());
            UpdateResult result = UpdateResult.of(
                    update,
                    id,
                    before == null ? null : before.shape().envelope(),
                    after == null ? null : after.shape().envelope(),
                    obstacle,
                    version
            );
            log.debug("applied {} -> version {}, affected envelope {}", update, version, result.affectedEnvelope());
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    private static void requireKnown(Region region, String id) {
        if (region == null) {
            throw new GeometryException(
                    GeometryException.REASON_UNKNOWN_REGION_ID,
                    "no such region",
                    id,
                    null
            );
        }
    }

    private void requirePlanar(Configuration configuration) {
        if (configuration.dimension() != 2) {
            throw new GeometryException(
                    GeometryException.REASON_DIMENSION_MISMATCH,
                    "planar workspace expects 2 coordinates, got " + configuration.dimension()
            );
        }
    }

    @Override
    public List<Region> regions() {
        return List.copyOf(snapshot.effective.values());
    }

    @Override
    public Optional<Region> region(String id) {
        return Optional.ofNullable(snapshot.effective.get(id));
    }

    @Override
    public SortedSet<String> labels() {
        return snapshot.labels;
    }

    @Override
    public long version() {
        return snapshot.version;
    }
}
