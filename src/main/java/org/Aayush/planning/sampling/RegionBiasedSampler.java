package org.Aayush.planning.sampling;

import org.Aayush.planning.automaton.PropositionAlphabet;
import org.Aayush.planning.automaton.SpecificationAutomaton;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.Region;
import org.Aayush.planning.workspace.Workspace;
import org.Aayush.planning.workspace.WorkspaceBounds;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Mixes uniform samples with samples drawn inside regions the mission needs to visit.
 * <p>
 * With probability {@code bias} a sample is taken from a region whose label occurs
 * un-negated in some automaton guard (a progress label). The region is picked uniformly,
 * then a point is rejection-sampled from its bounding box. When no progress region exists
 * or rejection fails, the sample falls back to uniform.
 * </p>
 */
public final class RegionBiasedSampler implements Sampler {
    private static final int MAX_REJECTION_TRIES = 32;

    private final Workspace workspace;
    private final long progressLabels;
    private final PropositionAlphabet alphabet;
    private final double bias;
    private final UniformSampler uniform;

    public RegionBiasedSampler(Workspace workspace, SpecificationAutomaton automaton, double bias) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(automaton, "automaton");
        if (!(bias >= 0.0d && bias <= 1.0d)) {
            throw new IllegalArgumentException("bias must be within [0, 1], got " + bias);
        }
        this.alphabet = automaton.alphabet();
        this.progressLabels = automaton.positivePropositions();
        this.bias = bias;
        this.uniform = new UniformSampler(workspace);
    }

    @Override
    public Configuration sample(Random random) {
        if (random.nextDouble() >= bias) {
            return uniform.sample(random);
        }
        List<Region> targets = progressRegions();
        if (targets.isEmpty()) {
            return uniform.sample(random);
        }
        Region region = targets.get(random.nextInt(targets.size()));
        Envelope box = region.shape().envelope();
        WorkspaceBounds bounds = workspace.bounds();
        double minX = Math.max(box.getMinX(), bounds.getMinX());
        double maxX = Math.min(box.getMaxX(), bounds.getMaxX());
        double minY = Math.max(box.getMinY(), bounds.getMinY());
        double maxY = Math.min(box.getMaxY(), bounds.getMaxY());
        if (minX > maxX || minY > maxY) {
            return uniform.sample(random);
        }
        for (int attempt = 0; attempt < MAX_REJECTION_TRIES; attempt++) {
            double x = minX + random.nextDouble() * (maxX - minX);
            double y = minY + random.nextDouble() * (maxY - minY);
            if (region.shape().contains(x, y)) {
                return Configuration.of(x, y);
            }
        }
        return uniform.sample(random);
    }

    private List<Region> progressRegions() {
        List<Region> out = new ArrayList<>();
        for (Region region : workspace.regions()) {
            int index = alphabet.indexOf(region.label());
            if (!region.isObstacle() && index >= 0 && (progressLabels & (1L << index)) != 0L) {
                out.add(region);
            }
        }
        return out;
    }
}
