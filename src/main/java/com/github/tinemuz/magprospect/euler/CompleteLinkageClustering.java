/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.magprospect.euler;

import java.util.Arrays;

/**
 * Agglomerative clustering with complete linkage, cut at a distance.
 *
 * <p>The dendrogram is built with the nearest-neighbour-chain algorithm over a
 * dense distance matrix ({@code O(n^2)} time and memory). Points end up in
 * the same flat cluster when they are joined by merges no higher than the
 * cut distance, so every pair inside a cluster is at most that far apart.</p>
 */
final class CompleteLinkageClustering {

    private CompleteLinkageClustering() {}

    /**
     * Flat cluster label of each point. Labels are numbered from 0 in order of
     * first appearance.
     *
     * @param points {@code points[i]} are the coordinates of point i
     * @param radius maximum merge distance
     */
    static int[] labels(double[][] points, double radius) {
        int n = points.length;
        if (n == 0) return new int[0];

        double[][] d = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                d[i][j] = d[j][i] = distance(points[i], points[j]);
            }
        }

        int[] parent = new int[n];
        for (int i = 0; i < n; i++) parent[i] = i;

        boolean[] active = new boolean[n];
        Arrays.fill(active, true);
        int[] chain = new int[n];
        int len = 0;
        int remaining = n;

        while (remaining > 1) {
            if (len == 0) {
                chain[len++] = firstActive(active);
            }
            int a;
            int b;
            while (true) {
                int c = chain[len - 1];
                int prev = len > 1 ? chain[len - 2] : -1;
                // previous chain element wins ties so the chain always terminates
                int best = prev;
                double bestD = prev >= 0 ? d[c][prev] : Double.POSITIVE_INFINITY;
                for (int j = 0; j < n; j++) {
                    if (!active[j] || j == c) continue;
                    if (d[c][j] < bestD) {
                        bestD = d[c][j];
                        best = j;
                    }
                }
                if (best == prev) {
                    a = c;
                    b = prev;
                    break;
                }
                chain[len++] = best;
            }
            len -= 2;

            double height = d[a][b];
            if (height <= radius) union(parent, a, b);

            // Lance-Williams update for complete linkage; cluster lives on at a
            for (int j = 0; j < n; j++) {
                if (!active[j] || j == a || j == b) continue;
                double m = Math.max(d[a][j], d[b][j]);
                d[a][j] = m;
                d[j][a] = m;
            }
            active[b] = false;
            remaining--;
        }

        int[] labels = new int[n];
        int[] idOfRoot = new int[n];
        Arrays.fill(idOfRoot, -1);
        int next = 0;
        for (int i = 0; i < n; i++) {
            int root = find(parent, i);
            if (idOfRoot[root] < 0) idOfRoot[root] = next++;
            labels[i] = idOfRoot[root];
        }
        return labels;
    }

    private static int firstActive(boolean[] active) {
        for (int i = 0; i < active.length; i++) {
            if (active[i]) return i;
        }
        throw new IllegalStateException("no active cluster left");
    }

    private static double distance(double[] p, double[] q) {
        double sum = 0.0;
        for (int k = 0; k < p.length; k++) {
            double diff = p[k] - q[k];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) parent[rb] = ra;
    }
}
