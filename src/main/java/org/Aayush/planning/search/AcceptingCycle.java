package org.Aayush.planning.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Product-graph cycle through an accepting vertex.
 *
 * @param acceptingVertex vertex the cycle starts and ends at.
 * @param loop vertices visited after {@code acceptingVertex}, before returning to it.
 * @param loopCost summed edge cost of the closed loop.
 */
public record AcceptingCycle(int acceptingVertex, IntList loop, double loopCost) {
    public AcceptingCycle {
        if (loop.isEmpty()) {
            throw new IllegalArgumentException("cycle needs at least one vertex besides the accepting one");
        }
        loop = IntLists.unmodifiable(new IntArrayList(loop));
    }
}
