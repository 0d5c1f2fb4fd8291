package org.Aayush.planning.execution;

import it.unimi.dsi.fastutil.ints.IntSortedSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.planning.sampling.LocalPlanner;
import org.Aayush.planning.workspace.Configuration;
import org.Aayush.planning.workspace.RegionShape;
import org.Aayush.planning.workspace.Workspace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.SortedSet;

/**
 * Services transient local requests and avoids local obstacles while following a global plan.
 * <p>
 * With no request pending and a clear straight segment to the global target, the robot moves
 * straight there in steps of {@code eta}. Otherwise a random tree is grown inside the sensing
 * disc. Each extension must be collision free with respect to the workspace and the local
 * obstacles, and must keep the execution monitor satisfiable. Growth stops at the first node
 * that has passed through the most urgent request, if any, and connects straight to the
 * global target.
 * </p>
 */
@Slf4j
public final class LocalRequestPlanner {
    private final Workspace workspace;
    private final LocalPlanner localPlanner;
    @Getter
    @Accessors(fluent = true)
    private final double eta;
    @Getter
    @Accessors(fluent = true)
    private final double sensingRadius;
    @Getter
    @Accessors(fluent = true)
    private final int maxSamples;
    private final Random random;

    /**
     * @param eta steering step and free-movement resolution.
     * @param sensingRadius radius of the disc local samples are drawn from.
     * @param maxSamples samples drawn before giving up.
     * @param seed seed of the local sampler.
     */
    public LocalRequestPlanner(Workspace workspace, double eta, double sensingRadius, int maxSamples, long seed) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        if (!(eta > 0.0d) || !(sensingRadius > 0.0d) || maxSamples <= 0) {
            throw new IllegalArgumentException("eta, sensingRadius and maxSamples must be > 0");
        }
        this.localPlanner = new LocalPlanner(workspace, eta, eta / 4.0d);
        this.eta = eta;
        this.sensingRadius = sensingRadius;
        this.maxSamples = maxSamples;
        this.random = new Random(seed);
    }

    private static final class Node {
        private final Configuration config;
        private final IntSortedSet states;
        private final int parent;
        private final boolean hit;

        private Node(Configuration config, IntSortedSet states, int parent, boolean hit) {
            this.config = config;
            this.states = states;
            this.parent = parent;
            this.hit = hit;
        }
    }

    /**
     * Plans toward the target the guide picks from the monitored states at {@code current}.
     *
     * @return a failed plan when the robot is off the product graph or cannot reach acceptance.
     */
    public LocalPlan plan(
            ExecutionMonitor monitor,
            Configuration current,
            PotentialGuide guide,
            List<LocalRequest> requests,
            List<RegionShape> localObstacles
    ) {
        Optional<Configuration> target = guide.nextTarget(current, monitor.states());
        if (target.isEmpty()) {
            log.debug("no global target from {} with states {}", current, monitor.states());
            return LocalPlan.failed(0);
        }
        return plan(monitor, current, target.get(), requests, localObstacles);
    }

    /**
     * @param monitor execution monitor positioned at {@code current}.
     * @param current labeled robot configuration.
     * @param globalTarget next waypoint of the global plan.
     * @param requests pending local requests.
     * @param localObstacles transient obstacles sensed near the robot.
     */
    public LocalPlan plan(
            ExecutionMonitor monitor,
            Configuration current,
            Configuration globalTarget,
            List<LocalRequest> requests,
            List<RegionShape> localObstacles
    ) {
        Configuration target = workspace.label(globalTarget);
        LocalRequest tracked = mostUrgent(requests);
        if (tracked == null && isClear(current, target, localObstacles)) {
            return new LocalPlan(freeMovement(current, target), null, 0);
        }

        List<Node> tree = new ArrayList<>();
        tree.add(new Node(current, monitor.states(), -1, tracked != null && tracked.servedAt(current.x(), current.y())));
        if (reachesTarget(monitor, tree.get(0), tracked, target, localObstacles)) {
            return new LocalPlan(freeMovement(current, target), tracked, tree.size());
        }
        for (int i = 0; i < maxSamples; i++) {
            Configuration sample = sampleDisc(current);
            if (!workspace.bounds().contains(sample.x(), sample.y())) {
                continue;
            }
            int nearest = nearest(tree, sample);
            Node from = tree.get(nearest);
            Optional<Configuration> steered = localPlanner.steer(from.config, sample, eta);
            if (steered.isEmpty()) {
                continue;
            }
            Configuration dest = steered.get();
            if (!localPlanner.isLabelConsistent(from.config, dest) || blocked(from.config, dest, localObstacles)) {
                continue;
            }
            IntSortedSet states = monitor.successorStates(from.states, from.config.labels(), dest);
            if (states.isEmpty()) {
                continue;
            }
            boolean hit = tracked != null && (from.hit || tracked.servedAt(dest.x(), dest.y()));
            Node node = new Node(dest, states, nearest, hit);
            tree.add(node);
            if (reachesTarget(monitor, node, tracked, target, localObstacles)) {
                List<Configuration> path = branch(tree, tree.size() - 1);
                path.addAll(freeMovement(dest, target));
                log.debug("local plan found: tree={}, path={}, request={}", tree.size(), path.size(), tracked);
                return new LocalPlan(path, tracked, tree.size());
            }
        }
        log.debug("no local plan within {} samples (tree={}, request={})", maxSamples, tree.size(), tracked);
        return LocalPlan.failed(tree.size());
    }

    private static LocalRequest mostUrgent(List<LocalRequest> requests) {
        LocalRequest best = null;
        for (LocalRequest request : requests) {
            if (best == null || request.priority() < best.priority()) {
                best = request;
            }
        }
        return best;
    }

    private boolean reachesTarget(
            ExecutionMonitor monitor,
            Node node,
            LocalRequest tracked,
            Configuration target,
            List<RegionShape> localObstacles
    ) {
        if (tracked != null && !node.hit) {
            return false;
        }
        if (!isClear(node.config, target, localObstacles)) {
            return false;
        }
        SortedSet<String> labels = node.config.labels();
        return !monitor.successorStates(node.states, labels, target).isEmpty();
    }

    private boolean isClear(Configuration from, Configuration to, List<RegionShape> localObstacles) {
        return localPlanner.isTraversable(from, to) && !blocked(from, to, localObstacles);
    }

    private static boolean blocked(Configuration from, Configuration to, List<RegionShape> localObstacles) {
        for (RegionShape obstacle : localObstacles) {
            if (obstacle.intersectsSegment(from.x(), from.y(), to.x(), to.y())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Straight path from {@code from} (excluded) to {@code to} in steps of at most {@code eta}.
     */
    private List<Configuration> freeMovement(Configuration from, Configuration to) {
        List<Configuration> points = new ArrayList<>();
        double distance = from.distanceTo(to);
        int pieces = Math.max(1, (int) Math.ceil(distance / eta));
        for (int k = 1; k < pieces; k++) {
            points.add(workspace.label(from.interpolate(to, (double) k / pieces)));
        }
        points.add(to);
        return points;
    }

    private Configuration sampleDisc(Configuration center) {
        double r = sensingRadius * Math.sqrt(random.nextDouble());
        double theta = 2.0d * Math.PI * random.nextDouble();
        return Configuration.of(center.x() + r * Math.cos(theta), center.y() + r * Math.sin(theta));
    }

    private static int nearest(List<Node> tree, Configuration sample) {
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < tree.size(); i++) {
            double d = tree.get(i).config.distanceTo(sample);
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return best;
    }

    /**
     * Tree path from the root (excluded) to {@code leaf}.
     */
    private static List<Configuration> branch(List<Node> tree, int leaf) {
        List<Configuration> path = new ArrayList<>();
        for (int i = leaf; tree.get(i).parent >= 0; i = tree.get(i).parent) {
            path.add(tree.get(i).config);
        }
        Collections.reverse(path);
        return path;
    }
}
