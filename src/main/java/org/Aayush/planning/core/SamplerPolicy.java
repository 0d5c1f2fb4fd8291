package org.Aayush.planning.core;

/**
 * Sampling distribution used by the planning engine.
 */
public enum SamplerPolicy {
    /** Uniform over the workspace bounds. */
    UNIFORM,
    /** Uniform mixed with samples inside regions carrying progress labels. */
    REGION_BIASED
}
