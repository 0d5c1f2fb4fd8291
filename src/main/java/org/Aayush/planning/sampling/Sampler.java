package org.Aayush.planning.sampling;

import org.Aayush.planning.workspace.Configuration;

import java.util.Random;

/**
 * Draws configurations. All randomness comes from the caller's generator, so a fixed seed
 * gives a fixed sample sequence.
 */
public interface Sampler {

    Configuration sample(Random random);
}
