package org.Aayush.planning.workspace;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Geometric model of free space and labeled regions.
 * <p>
 * Query methods are safe for concurrent readers. {@link #applyUpdate(RegionUpdate)} is the only
 * mutator; it either applies completely or throws and leaves the model unchanged.
 * </p>
 */
public interface Workspace {

    /**
     * @return configuration-space dimension accepted by this workspace.
     */
    int dimension();

    /**
     * @return sampling bounds (already shrunk by the robot footprint).
     */
    WorkspaceBounds bounds();

    /**
     * @return labels of every region containing the configuration.
     */
    SortedSet<String> contains(Configuration configuration);

    /**
     * @return the configuration carrying its current labels.
     */
    default Configuration label(Configuration configuration) {
        return configuration.withLabels(contains(configuration));
    }

    /**
     * @return true when the configuration is inside the bounds and outside every obstacle.
     */
    boolean isFree(Configuration configuration);

    /**
     * @return true when the whole straight segment is free.
     */
    boolean segmentIsFree(Configuration from, Configuration to);

    /**
     * Applies one region change.
     *
     * @return ids and envelope of the change, used to scope graph repair.
     * @throws GeometryException for degenerate geometry or unknown/duplicate ids.
     */
    UpdateResult applyUpdate(RegionUpdate update);

    /**
     * @return regions in definition order, with their effective (inflated) shapes.
     */
    List<Region> regions();

    Optional<Region> region(String id);

    /**
     * @return every label any region can report.
     */
    SortedSet<String> labels();

    /**
     * @return number of successfully applied updates.
     */
    long version();
}
