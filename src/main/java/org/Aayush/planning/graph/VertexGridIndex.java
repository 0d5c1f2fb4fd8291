package org.Aayush.planning.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.Arrays;
import java.util.function.IntPredicate;

/**
 * Uniform grid over planar vertex positions.
 * <p>
 * Results are ordered by (distance, id) so neighbor queries are reproducible regardless of
 * hash iteration order.
 * </p>
 */
final class VertexGridIndex {
    private final double cellSize;
    private final Long2ObjectOpenHashMap<IntArrayList> cells = new Long2ObjectOpenHashMap<>();
    private final DoubleArrayList xs = new DoubleArrayList();
    private final DoubleArrayList ys = new DoubleArrayList();
    private int size;
    private int minCellX = Integer.MAX_VALUE;
    private int minCellY = Integer.MAX_VALUE;
    private int maxCellX = Integer.MIN_VALUE;
    private int maxCellY = Integer.MIN_VALUE;

    VertexGridIndex(double cellSize) {
        if (!(cellSize > 0.0d)) {
            throw new IllegalArgumentException("cellSize must be > 0");
        }
        this.cellSize = cellSize;
    }

    void add(int id, double x, double y) {
        while (xs.size() <= id) {
            xs.add(Double.NaN);
            ys.add(Double.NaN);
        }
        xs.set(id, x);
        ys.set(id, y);
        int cx = cell(x);
        int cy = cell(y);
        long k = key(cx, cy);
        IntArrayList bucket = cells.get(k);
        if (bucket == null) {
            bucket = new IntArrayList(4);
            cells.put(k, bucket);
        }
        bucket.add(id);
        minCellX = Math.min(minCellX, cx);
        minCellY = Math.min(minCellY, cy);
        maxCellX = Math.max(maxCellX, cx);
        maxCellY = Math.max(maxCellY, cy);
        size++;
    }

    void remove(int id) {
        double x = xs.getDouble(id);
        double y = ys.getDouble(id);
        long k = key(cell(x), cell(y));
        IntArrayList bucket = cells.get(k);
        if (bucket != null && bucket.rem(id)) {
            size--;
            if (bucket.isEmpty()) {
                cells.remove(k);
            }
        }
    }

    int size() {
        return size;
    }

    /**
     * Ids within {@code radius} (inclusive) of the point, ordered by (distance, id).
     */
    IntList withinRadius(double x, double y, double radius, IntPredicate filter) {
        int r = (int) Math.ceil(radius / cellSize);
        int cx = cell(x);
        int cy = cell(y);
        IntArrayList ids = new IntArrayList();
        DoubleArrayList distances = new DoubleArrayList();
        for (int i = Math.max(cx - r, minCellX); i <= Math.min(cx + r, maxCellX); i++) {
            for (int j = Math.max(cy - r, minCellY); j <= Math.min(cy + r, maxCellY); j++) {
                IntArrayList bucket = cells.get(key(i, j));
                if (bucket == null) {
                    continue;
                }
                for (int b = 0; b < bucket.size(); b++) {
                    int id = bucket.getInt(b);
                    double d = distance(id, x, y);
                    if (d <= radius && filter.test(id)) {
                        ids.add(id);
                        distances.add(d);
                    }
                }
            }
        }
        return sorted(ids, distances, Integer.MAX_VALUE);
    }

    /**
     * Up to {@code k} nearest ids passing the filter, ordered by (distance, id).
     * Searches rings of cells outward until no closer candidate can exist.
     */
    IntList nearest(double x, double y, int k, IntPredicate filter) {
        if (size == 0 || k <= 0) {
            return new IntArrayList();
        }
        int cx = cell(x);
        int cy = cell(y);
        int maxRing = Math.max(
                Math.max(Math.abs(cx - minCellX), Math.abs(maxCellX - cx)),
                Math.max(Math.abs(cy - minCellY), Math.abs(maxCellY - cy))
        );
        IntArrayList ids = new IntArrayList();
        DoubleArrayList distances = new DoubleArrayList();
        for (int ring = 0; ring <= maxRing; ring++) {
            for (int i = cx - ring; i <= cx + ring; i++) {
                for (int j = cy - ring; j <= cy + ring; j++) {
                    if (Math.max(Math.abs(i - cx), Math.abs(j - cy)) != ring) {
                        continue;
                    }
                    IntArrayList bucket = cells.get(key(i, j));
                    if (bucket == null) {
                        continue;
                    }
                    for (int b = 0; b < bucket.size(); b++) {
                        int id = bucket.getInt(b);
                        if (filter.test(id)) {
                            ids.add(id);
                            distances.add(distance(id, x, y));
                        }
                    }
                }
            }
            // every point in ring + 1 or beyond is at least ring * cellSize away
            if (ids.size() >= k && kthSmallest(distances, k) <= ring * cellSize) {
                break;
            }
        }
        return sorted(ids, distances, k);
    }

    private static double kthSmallest(DoubleArrayList values, int k) {
        double[] copy = values.toDoubleArray();
        Arrays.sort(copy);
        return copy[k - 1];
    }

    private static IntList sorted(IntArrayList ids, DoubleArrayList distances, int limit) {
        Integer[] order = new Integer[ids.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> {
            int byDistance = Double.compare(distances.getDouble(a), distances.getDouble(b));
            return byDistance != 0 ? byDistance : Integer.compare(ids.getInt(a), ids.getInt(b));
        });
        int n = Math.min(limit, order.length);
        IntArrayList out = new IntArrayList(n);
        for (int i = 0; i < n; i++) {
            out.add(ids.getInt(order[i]));
        }
        return out;
    }

    private double distance(int id, double x, double y) {
        double dx = xs.getDouble(id) - x;
        double dy = ys.getDouble(id) - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    private int cell(double v) {
        return (int) Math.floor(v / cellSize);
    }

    private static long key(int cx, int cy) {
        return ((long) cx << 32) ^ (cy & 0xffffffffL);
    }
}
