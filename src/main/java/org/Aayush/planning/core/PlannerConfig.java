package org.Aayush.planning.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Function;

/**
 * Immutable planner parameters.
 * <p>
 * Every field has a default; {@link #fromSystemProperties()} overlays
 * {@code ltlplan.planner.<field>} system properties, ignoring malformed values.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class PlannerConfig {
    static final String PROPERTY_PREFIX = "ltlplan.planner.";

    /** Seed of the planner's random generator. */
    @Builder.Default
    long seed = 1L;

    /** Iterations per {@code plan()} call. */
    @Builder.Default
    int maxIterations = 5_000;

    /** Hard cap on live product vertices. */
    @Builder.Default
    int maxVertices = 100_000;

    /** Wall-clock budget per {@code plan()} call, or {@code null} for none. */
    @Builder.Default
    Duration timeBudget = null;

    /** Maximum extension of one steering step. */
    @Builder.Default
    double stepSize = 0.5d;

    /** Walk increment used when steering towards a blocked target. */
    @Builder.Default
    double collisionResolution = 0.05d;

    /** Rewiring radius constant: {@code r(n) = min(rewireRadiusMax, gamma * (ln n / n)^(1/d))}. */
    @Builder.Default
    double rewireGamma = 10.0d;

    /** Upper bound on the rewiring radius. */
    @Builder.Default
    double rewireRadiusMax = 1.0d;

    /** Nearest vertices tried, in order, for a progress-admitting extension. */
    @Builder.Default
    int nearestCandidates = 4;

    @Builder.Default
    RewirePolicy rewirePolicy = RewirePolicy.TRANSITION;

    @Builder.Default
    SamplerPolicy samplerPolicy = SamplerPolicy.REGION_BIASED;

    /** Probability of drawing a sample inside a progress region. */
    @Builder.Default
    double regionBias = 0.2d;

    /** Iterations between accepting-cycle sweeps. */
    @Builder.Default
    int cycleCheckInterval = 100;

    /** Accepting vertices examined per sweep, cheapest first. */
    @Builder.Default
    int maxCycleSources = 32;

    /** Iterations between convergence checkpoints; {@code 0} disables early exit. */
    @Builder.Default
    int convergenceWindow = 1_000;

    /** Relative best-cost improvement below which the search is considered converged. */
    @Builder.Default
    double convergenceTolerance = 1e-3d;

    /**
     * Defaults overlaid with {@code ltlplan.planner.*} system properties.
     */
    public static PlannerConfig fromSystemProperties() {
        PlannerConfig defaults = PlannerConfig.builder().build();
        return defaults.toBuilder()
                .seed(read("seed", Long::parseLong, defaults.seed))
                .maxIterations(read("maxIterations", Integer::parseInt, defaults.maxIterations))
                .maxVertices(read("maxVertices", Integer::parseInt, defaults.maxVertices))
                .timeBudget(read("timeBudget", Duration::parse, defaults.timeBudget))
                .stepSize(read("stepSize", Double::parseDouble, defaults.stepSize))
                .collisionResolution(read("collisionResolution", Double::parseDouble, defaults.collisionResolution))
                .rewireGamma(read("rewireGamma", Double::parseDouble, defaults.rewireGamma))
                .rewireRadiusMax(read("rewireRadiusMax", Double::parseDouble, defaults.rewireRadiusMax))
                .nearestCandidates(read("nearestCandidates", Integer::parseInt, defaults.nearestCandidates))
                .rewirePolicy(read("rewirePolicy", RewirePolicy::valueOf, defaults.rewirePolicy))
                .samplerPolicy(read("samplerPolicy", SamplerPolicy::valueOf, defaults.samplerPolicy))
                .regionBias(read("regionBias", Double::parseDouble, defaults.regionBias))
                .cycleCheckInterval(read("cycleCheckInterval", Integer::parseInt, defaults.cycleCheckInterval))
                .maxCycleSources(read("maxCycleSources", Integer::parseInt, defaults.maxCycleSources))
                .convergenceWindow(read("convergenceWindow", Integer::parseInt, defaults.convergenceWindow))
                .convergenceTolerance(read("convergenceTolerance", Double::parseDouble, defaults.convergenceTolerance))
                .build();
    }

    private static <T> T read(String field, Function<String, T> parser, T fallback) {
        String raw = System.getProperty(PROPERTY_PREFIX + field);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(raw.trim());
        } catch (RuntimeException ex) {
            return fallback;
        }
    }

    /**
     * @return this config.
     * @throws PlanningException with {@link PlanningException#REASON_CONFIG_INVALID} on bad values.
     */
    public PlannerConfig validate() {
        require(maxIterations > 0, "maxIterations must be > 0, got " + maxIterations);
        require(maxVertices > 1, "maxVertices must be > 1, got " + maxVertices);
        require(timeBudget == null || (!timeBudget.isNegative() && !timeBudget.isZero()),
                "timeBudget must be positive, got " + timeBudget);
        require(stepSize > 0.0d && Double.isFinite(stepSize), "stepSize must be finite and > 0, got " + stepSize);
        require(collisionResolution > 0.0d && collisionResolution <= stepSize,
                "collisionResolution must be within (0, stepSize], got " + collisionResolution);
        require(rewireGamma > 0.0d && Double.isFinite(rewireGamma), "rewireGamma must be finite and > 0, got " + rewireGamma);
        require(rewireRadiusMax > 0.0d && Double.isFinite(rewireRadiusMax),
                "rewireRadiusMax must be finite and > 0, got " + rewireRadiusMax);
        require(nearestCandidates > 0, "nearestCandidates must be > 0, got " + nearestCandidates);
        require(rewirePolicy != null, "rewirePolicy must be set");
        require(samplerPolicy != null, "samplerPolicy must be set");
        require(regionBias >= 0.0d && regionBias <= 1.0d, "regionBias must be within [0, 1], got " + regionBias);
        require(cycleCheckInterval > 0, "cycleCheckInterval must be > 0, got " + cycleCheckInterval);
        require(maxCycleSources > 0, "maxCycleSources must be > 0, got " + maxCycleSources);
        require(convergenceWindow >= 0, "convergenceWindow must be >= 0, got " + convergenceWindow);
        require(convergenceTolerance >= 0.0d, "convergenceTolerance must be >= 0, got " + convergenceTolerance);
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new PlanningException(PlanningException.REASON_CONFIG_INVALID, message);
        }
    }

    /**
     * Shrinking rewiring radius for {@code n} vertices in dimension {@code d}.
     */
    public double rewireRadius(int n, int dimension) {
        if (n < 2) {
            return rewireRadiusMax;
        }
        double shrinking = rewireGamma * Math.pow(Math.log(n) / n, 1.0d / dimension);
        return Math.min(rewireRadiusMax, shrinking);
    }
}
