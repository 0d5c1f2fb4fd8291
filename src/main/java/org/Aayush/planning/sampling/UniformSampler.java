package org.Aayush.planning.sampling;

import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.Workspace;
import org.Aayush.planning.workspace.WorkspaceBounds;

import java.util.Objects;
import java.util.Random;

/**
 * Uniform samples over the workspace bounds. Bounds are read per call so workspace updates
 * are honored; samples may land in obstacles and are filtered by steering.
 */
public final class UniformSampler implements Sampler {
    private final Workspace workspace;

    public UniformSampler(Workspace workspace) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
    }

    @Override
    public Configuration sample(Random random) {
        WorkspaceBounds bounds = workspace.bounds();
        double x = bounds.getMinX() + random.nextDouble() * bounds.width();
        double y = bounds.getMinY() + random.nextDouble() * bounds.height();
        return Configuration.of(x, y);
    }
}
