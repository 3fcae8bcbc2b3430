package com.secureflow.ensemble.engine.neighbors;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Static k-d tree over a fixed set of points. The tree is stored implicitly: each
 * sub-range of {@code order} is a subtree whose median element is the node.
 * Immutable after construction and safe for concurrent queries.
 */
public final class KdTree {

    private static final Comparator<double[]> BY_DISTANCE_THEN_INDEX =
            Comparator.<double[]>comparingDouble(c -> c[0]).thenComparingDouble(c -> c[1]);

    private final double[][] points;
    private final int[] order;
    private final int[] axes;

    public KdTree(double[][] points) {
        this.points = points;
        this.order = new int[points.length];
        this.axes = new int[points.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        if (points.length > 0) {
            build(0, points.length, 0);
        }
    }

    private void build(int lo, int hi, int depth) {
        if (lo >= hi) return;
        int axis = depth % points[0].length;
        Integer[] range = new Integer[hi - lo];
        for (int i = lo; i < hi; i++) range[i - lo] = order[i];
        Arrays.sort(range, Comparator.comparingDouble((Integer i) -> points[i][axis]).thenComparingInt(i -> i));
        for (int i = lo; i < hi; i++) order[i] = range[i - lo];

        int mid = (lo + hi) >>> 1;
        axes[mid] = axis;
        build(lo, mid, depth + 1);
        build(mid + 1, hi, depth + 1);
    }

    public int size() {
        return points.length;
    }

    /**
     * The k nearest indexed points, nearest first. Equal distances are ordered by index.
     *
     * @param exclude index to leave out of the result (the query's own position), or -1
     */
    public List<Neighbor> nearest(double[] query, int k, int exclude) {
        if (k <= 0 || points.length == 0) {
            return List.of();
        }
        // candidates are {squaredDistance, index}; head is the current worst
        PriorityQueue<double[]> heap = new PriorityQueue<>(k + 1, BY_DISTANCE_THEN_INDEX.reversed());
        searchNearest(query, k, exclude, 0, points.length, heap);

        List<double[]> found = new ArrayList<>(heap);
        found.sort(BY_DISTANCE_THEN_INDEX);
        List<Neighbor> neighbors = new ArrayList<>(found.size());
        for (double[] candidate : found) {
            neighbors.add(new Neighbor((int) candidate[1], Math.sqrt(candidate[0])));
        }
        return Collections.unmodifiableList(neighbors);
    }

    private void searchNearest(double[] query, int k, int exclude, int lo, int hi, PriorityQueue<double[]> heap) {
        if (lo >= hi) return;
        int mid = (lo + hi) >>> 1;
        int index = order[mid];

        if (index != exclude) {
            double[] candidate = {squaredDistance(query, points[index]), index};
            if (heap.size() < k) {
                heap.add(candidate);
            } else if (BY_DISTANCE_THEN_INDEX.compare(candidate, heap.peek()) < 0) {
                heap.poll();
                heap.add(candidate);
            }
        }

        double diff = query[axes[mid]] - points[index][axes[mid]];
        boolean leftFirst = diff < 0;
        if (leftFirst) {
            searchNearest(query, k, exclude, lo, mid, heap);
        } else {
            searchNearest(query, k, exclude, mid + 1, hi, heap);
        }
        // Equal distances may still displace by index, hence <=
        if (heap.size() < k || diff * diff <= heap.peek()[0]) {
            if (leftFirst) {
                searchNearest(query, k, exclude, mid + 1, hi, heap);
            } else {
                searchNearest(query, k, exclude, lo, mid, heap);
            }
        }
    }

    /**
     * Number of indexed points whose distance to the query is at most {@code radius}.
     */
    public int countWithin(double[] query, double radius) {
        return countWithin(query, radius, 0, points.length);
    }

    private int countWithin(double[] query, double radius, int lo, int hi) {
        if (lo >= hi) return 0;
        int mid = (lo + hi) >>> 1;
        int index = order[mid];
        int count = Math.sqrt(squaredDistance(query, points[index])) <= radius ? 1 : 0;

        double diff = query[axes[mid]] - points[index][axes[mid]];
        // left holds coordinates <= the pivot, right holds coordinates >= it
        if (diff <= radius) {
            count += countWithin(query, radius, lo, mid);
        }
        if (-diff <= radius) {
            count += countWithin(query, radius, mid + 1, hi);
        }
        return count;
    }

    static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }
}
