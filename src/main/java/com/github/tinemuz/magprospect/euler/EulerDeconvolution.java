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

import com.github.tinemuz.magprospect.Parallel;
import com.github.tinemuz.magprospect.field.DerivativeChannels;
import com.github.tinemuz.magprospect.field.ObservationSeries;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window Euler deconvolution.
 *
 * <p>Each window of {@code w} consecutive observations is solved for the
 * source position {@code (x0, y0, z0)} and background {@code B} from Euler's
 * homogeneity equation</p>
 *
 * <pre>
 *   x0 Tx + y0 Ty + z0 Tz + N B = x Tx + y Ty + z Tz + N T
 * </pre>
 *
 * <p>in the least-squares sense, with z positive down. Windows start every
 * {@code max(1, w / 2)} samples. A window yields no estimate when it contains
 * an invalid sample, when its system is singular or worse conditioned than
 * the configured limit, or when the depth falls outside {@code (0, zMax)};
 * these outcomes are counted in the returned {@link EulerSolution}.</p>
 */
public final class EulerDeconvolution {
    private static final Logger log = LoggerFactory.getLogger(EulerDeconvolution.class);

    private EulerDeconvolution() {}

    private enum Outcome {
        ACCEPTED,
        INVALID_INPUT,
        DEGENERATE,
        OUT_OF_RANGE
    }

    /** Run with default settings. */
    public static EulerSolution solve(ObservationSeries series) {
        return solve(series, EulerSettings.defaults());
    }

    /**
     * Solve every window of {@code series}.
     *
     * @throws IllegalArgumentException if the series carries no derivative channels
     */
    public static EulerSolution solve(ObservationSeries series, EulerSettings settings) {
        DerivativeChannels d = series.derivatives()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Euler deconvolution needs dx, dy and dz derivative channels"));
        int n = series.size();
        int w = settings.windowSize();
        int stride = Math.max(1, w / 2);
        int windows = n > w ? (n - w - 1) / stride + 1 : 0;

        SourceEstimate[] slots = new SourceEstimate[windows];
        Outcome[] outcomes = new Outcome[windows];
        Parallel.forEachIndex(windows, k -> {
            int start = k * stride;
            outcomes[k] = solveWindow(series, d, start, w, settings, slots, k);
        });

        List<SourceEstimate> estimates = new ArrayList<>();
        int invalid = 0;
        int degenerate = 0;
        int outOfRange = 0;
        for (int k = 0; k < windows; k++) {
            switch (outcomes[k]) {
                case ACCEPTED -> estimates.add(slots[k]);
                case INVALID_INPUT -> invalid++;
                case DEGENERATE -> degenerate++;
                case OUT_OF_RANGE -> outOfRange++;
            }
        }
        log.debug("Euler windows: {} invalid input, {} degenerate, {} out of depth range",
                invalid, degenerate, outOfRange);
        if (estimates.isEmpty()) {
            log.info("Euler deconvolution ({}): no solutions from {} windows", settings, windows);
        } else {
            log.info("Euler deconvolution ({}): {} solutions from {} windows, depth {} to {}",
                    settings, estimates.size(), windows,
                    estimates.stream().mapToDouble(SourceEstimate::z0).min().getAsDouble(),
                    estimates.stream().mapToDouble(SourceEstimate::z0).max().getAsDouble());
        }
        return new EulerSolution(estimates, windows, invalid, degenerate, outOfRange);
    }

    private static Outcome solveWindow(
            ObservationSeries series,
            DerivativeChannels d,
            int start,
            int w,
            EulerSettings settings,
            SourceEstimate[] slots,
            int slot) {
        for (int i = start; i < start + w; i++) {
            if (!series.isValid(i)) return Outcome.INVALID_INPUT;
        }
        double nIndex = settings.structuralIndex().index();
        RealMatrix a = new Array2DRowRealMatrix(w, 4);
        RealVector b = new ArrayRealVector(w);
        for (int r = 0; r < w; r++) {
            int i = start + r;
            double x = series.x(i);
            double y = series.y(i);
            double z = series.zOrElse(i, settings.datumElevation());
            double tx = d.dx(i);
            double ty = d.dy(i);
            double tz = d.dz(i);
            a.setEntry(r, 0, tx);
            a.setEntry(r, 1, ty);
            a.setEntry(r, 2, tz);
            a.setEntry(r, 3, nIndex);
            b.setEntry(r, x * tx + y * ty + z * tz + nIndex * series.value(i));
        }

        RealVector sol;
        try {
            SingularValueDecomposition svd = new SingularValueDecomposition(a);
            DecompositionSolver solver = svd.getSolver();
            if (svd.getRank() < 4 || !(svd.getConditionNumber() <= settings.maxConditionNumber())) {
                return Outcome.DEGENERATE;
            }
            sol = solver.solve(b);
        } catch (SingularMatrixException | MathIllegalStateException e) {
            log.debug("Euler window at {} dropped: {}", start, e.getMessage());
            return Outcome.DEGENERATE;
        }
        for (int k = 0; k < 4; k++) {
            if (!Double.isFinite(sol.getEntry(k))) return Outcome.DEGENERATE;
        }

        double z0 = sol.getEntry(2);
        if (!(z0 > 0.0 && z0 < settings.zMax())) return Outcome.OUT_OF_RANGE;

        double residual = a.operate(sol).subtract(b).getNorm();
        slots[slot] = new SourceEstimate(
                sol.getEntry(0), sol.getEntry(1), z0, sol.getEntry(3), residual, w, settings.structuralIndex());
        return Outcome.ACCEPTED;
    }

    /**
     * Estimates with {@code zMin <= z0 <= zMax}, in input order. Applying the
     * same filter twice gives the same list.
     */
    public static List<SourceEstimate> filterByDepth(List<SourceEstimate> estimates, double zMin, double zMax) {
        if (!(zMin <= zMax)) {
            throw new IllegalArgumentException("depth range is empty: [" + zMin + ", " + zMax + "]");
        }
        List<SourceEstimate> out = new ArrayList<>(estimates.size());
        for (SourceEstimate e : estimates) {
            if (e.z0() >= zMin && e.z0() <= zMax) out.add(e);
        }
        log.debug("Depth filter [{}, {}] kept {} of {} estimates", zMin, zMax, out.size(), estimates.size());
        return out;
    }

    /**
     * Group estimates by complete-linkage clustering of {@code (x0, y0, z0)}
     * cut at {@code radius}. Clusters are ordered by member count, largest
     * first.
     */
    public static List<SourceCluster> cluster(List<SourceEstimate> estimates, double radius) {
        if (!(radius > 0)) {
            throw new IllegalArgumentException("cluster radius must be positive, got " + radius);
        }
        int n = estimates.size();
        double[][] points = new double[n][];
        for (int i = 0; i < n; i++) {
            SourceEstimate e = estimates.get(i);
            points[i] = new double[] {e.x0(), e.y0(), e.z0()};
        }
        int[] labels = CompleteLinkageClustering.labels(points, radius);
        int groups = 0;
        for (int label : labels) groups = Math.max(groups, label + 1);

        double[][] sums = new double[groups][3];
        int[] counts = new int[groups];
        for (int i = 0; i < n; i++) {
            int g = labels[i];
            sums[g][0] += points[i][0];
            sums[g][1] += points[i][1];
            sums[g][2] += points[i][2];
            counts[g]++;
        }
        List<SourceCluster> clusters = new ArrayList<>(groups);
        for (int g = 0; g < groups; g++) {
            clusters.add(new SourceCluster(
                    sums[g][0] / counts[g], sums[g][1] / counts[g], sums[g][2] / counts[g], counts[g]));
        }
        clusters.sort(Comparator.comparingInt(SourceCluster::memberCount).reversed());
        log.debug("Clustered {} estimates into {} sources at radius {}", n, groups, radius);
        return clusters;
    }
}
