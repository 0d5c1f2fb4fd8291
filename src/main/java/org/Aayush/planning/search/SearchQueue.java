package org.Aayush.planning.search;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Cost-ordered frontier used by the accepting-cycle sweeps.
 * <p>
 * Entries are {@link SearchState} objects borrowed from a fixed pool, so a sweep over a
 * large product component allocates nothing once the queue is built. A product vertex is
 * queued at most once: offering it again with a cheaper cost moves the existing entry up,
 * a dearer offer is dropped.
 * </p>
 * <p>Not thread-safe; each sweep owns its queue.</p>
 */
@Slf4j
public class SearchQueue {

    // 0-based binary heap over the first `size` slots
    private final SearchState[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // slotOf[vertexId] = heap slot + 1, 0 when the vertex is not queued
    private final int[] slotOf;

    private final SearchState[] spares;
    private int spareCount;

    private int borrowed = 0;
    @Getter
    private int peakActiveStates = 0;

    /**
     * @param maxVertexId highest product vertex id the sweep may offer.
     * @param capacity number of pooled entries, which also bounds the queue length.
     * @throws IllegalArgumentException if maxVertexId is negative or capacity is not positive.
     */
    public SearchQueue(int maxVertexId, int capacity) {
        if (maxVertexId < 0) {
            throw new IllegalArgumentException("maxVertexId must be non-negative, got " + maxVertexId);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.heap = new SearchState[capacity];
        this.slotOf = new int[maxVertexId + 1];
        this.spares = new SearchState[capacity];
        for (int i = 0; i < capacity; i++) {
            spares[i] = new SearchState();
        }
        this.spareCount = capacity;
    }

    /**
     * Offers a vertex to the frontier.
     *
     * @param vertexId product vertex id, at most the configured maximum.
     * @param cost path cost from the sweep source.
     * @param predecessor vertex the path arrives from.
     * @throws IllegalArgumentException if vertexId is outside the table.
     * @throws IllegalStateException if no pooled entry is left.
     */
    public void insert(int vertexId, double cost, int predecessor) {
        if (vertexId < 0 || vertexId >= slotOf.length) {
            throw new IllegalArgumentException(
                    "vertexId " + vertexId + " outside [0, " + (slotOf.length - 1) + "]"
            );
        }
        int slot = slotOf[vertexId] - 1;
        if (slot >= 0) {
            SearchState queued = heap[slot];
            if (cost < queued.cost) {
                queued.set(vertexId, cost, predecessor);
                siftUp(slot);
            }
            return;
        }
        if (spareCount == 0) {
            throw new IllegalStateException(
                    "Pool exhausted: " + borrowed + " of " + spares.length
                            + " entries are out; recycle extracted states or clear() the queue"
            );
        }
        SearchState entry = spares[--spareCount];
        borrowed++;
        peakActiveStates = Math.max(peakActiveStates, borrowed);
        entry.set(vertexId, cost, predecessor);
        place(entry, size);
        size++;
        siftUp(size - 1);
    }

    /**
     * Removes the cheapest entry. It stays borrowed until handed back with
     * {@link #recycle(SearchState)}.
     *
     * @throws EmptyQueueException if nothing is queued.
     */
    public SearchState extractMin() {
        if (size == 0) {
            throw new EmptyQueueException("no product vertex left on the frontier");
        }
        SearchState top = heap[0];
        slotOf[top.vertexId] = 0;
        size--;
        SearchState tail = heap[size];
        heap[size] = null;
        if (size > 0) {
            place(tail, 0);
            siftDown(0);
        }
        return top;
    }

    /**
     * Hands a borrowed entry back to the pool; {@code null} is ignored.
     *
     * @throws IllegalStateException if more entries come back than were borrowed.
     */
    public void recycle(SearchState state) {
        if (state == null) {
            return;
        }
        if (borrowed == 0 || spareCount == spares.length) {
            throw new IllegalStateException("entry recycled twice or never borrowed: " + state);
        }
        borrowed--;
        spares[spareCount++] = state;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Empties the frontier. Entries extracted but never recycled are replaced with fresh ones.
     */
    public void clear() {
        while (size > 0) {
            size--;
            SearchState entry = heap[size];
            heap[size] = null;
            slotOf[entry.vertexId] = 0;
            recycle(entry);
        }
        if (borrowed > 0) {
            log.warn("{} search states were never recycled; refilling the pool", borrowed);
            while (borrowed > 0 && spareCount < spares.length) {
                spares[spareCount++] = new SearchState();
                borrowed--;
            }
            borrowed = 0;
        }
    }

    /**
     * @return fraction of pooled entries currently borrowed.
     */
    public double getPoolUtilization() {
        return (double) borrowed / spares.length;
    }

    private void siftUp(int slot) {
        SearchState moving = heap[slot];
        while (slot > 0) {
            int parent = (slot - 1) >>> 1;
            if (heap[parent].compareTo(moving) <= 0) {
                break;
            }
            place(heap[parent], slot);
            slot = parent;
        }
        place(moving, slot);
    }

    private void siftDown(int slot) {
        SearchState moving = heap[slot];
        int half = size >>> 1;
        while (slot < half) {
            int child = 2 * slot + 1;
            if (child + 1 < size && heap[child + 1].compareTo(heap[child]) < 0) {
                child++;
            }
            if (moving.compareTo(heap[child]) <= 0) {
                break;
            }
            place(heap[child], slot);
            slot = child;
        }
        place(moving, slot);
    }

    private void place(SearchState entry, int slot) {
        heap[slot] = entry;
        slotOf[entry.vertexId] = slot + 1;
    }
}
