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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.magprospect.field.DerivativeChannels;
import com.github.tinemuz.magprospect.field.ObservationSeries;
import com.github.tinemuz.magprospect.forward.FieldDirection;
import com.github.tinemuz.magprospect.forward.ForwardModel;
import com.github.tinemuz.magprospect.forward.Sphere;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EulerDeconvolutionTest {

    private static final FieldDirection DIRECTION = new FieldDirection(45, 0);

    @Nested
    @DisplayName("Source recovery")
    class SourceRecovery {

        @Test
        @DisplayName("Sphere at 100 m on a 50x50 grid clusters within [85, 115] m")
        void sphereOnGrid() {
            Sphere source = new Sphere(0, 0, 100, 50, 0.05);
            ObservationSeries series = synthetic(gridSeries(-500, 500, 50), source);
            EulerSettings settings = EulerSettings.builder()
                    .structuralIndex(StructuralIndex.SPHERE)
                    .windowSize(5)
                    .build();

            EulerSolution solution = EulerDeconvolution.solve(series, settings);
            List<SourceEstimate> kept = EulerDeconvolution.filterByDepth(solution.estimates(), 10, 200);
            List<SourceCluster> clusters = EulerDeconvolution.cluster(kept, 50);

            assertFalse(clusters.isEmpty());
            SourceCluster best = clusters.stream()
                    .filter(c -> c.centroidZ() >= 85 && c.centroidZ() <= 115)
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("no cluster near 100 m in " + clusters));
            assertEquals(0.0, best.centroidX(), 10.0);
            assertEquals(0.0, best.centroidY(), 10.0);
            assertEquals(
                    solution.windows(),
                    solution.accepted() + solution.invalidInput() + solution.degenerate() + solution.outOfRange());
        }

        @Test
        @DisplayName("Noiseless line over an offset sphere recovers position exactly")
        void exactRecovery() {
            Sphere source = new Sphere(37, 60, 80, 20, 0.1);
            double[] x = new double[41];
            double[] y = new double[41];
            for (int i = 0; i < x.length; i++) {
                x[i] = -200 + 10 * i;
                y[i] = 0.25 * x[i] + 5;
            }
            ObservationSeries series = synthetic(ObservationSeries.of(x, y, new double[x.length]), source);
            EulerSettings settings = EulerSettings.builder().structuralIndex(StructuralIndex.SPHERE).build();

            EulerSolution solution = EulerDeconvolution.solve(series, settings);

            assertFalse(solution.isEmpty());
            for (SourceEstimate e : solution.estimates()) {
                assertEquals(37.0, e.x0(), 1e-4);
                assertEquals(60.0, e.y0(), 1e-4);
                assertEquals(80.0, e.z0(), 1e-4);
                assertEquals(0.0, e.baseLevel(), 1e-6);
                assertEquals(5, e.nPoints());
                assertEquals(StructuralIndex.SPHERE, e.structuralIndex());
                assertTrue(e.residualNorm() < 1e-6);
            }
        }

        @Test
        @DisplayName("Constant background is reported with its own sign")
        void baseLevelSign() {
            Sphere source = new Sphere(37, 60, 80, 20, 0.1);
            double[] x = new double[41];
            double[] y = new double[41];
            for (int i = 0; i < x.length; i++) {
                x[i] = -200 + 10 * i;
                y[i] = 0.25 * x[i] + 5;
            }
            ObservationSeries clean = synthetic(ObservationSeries.of(x, y, new double[x.length]), source);
            double[] values = clean.values();
            for (int i = 0; i < values.length; i++) values[i] += 7.0;
            ObservationSeries shifted = ObservationSeries.of(x, y, clean.z(0.0), values)
                    .withDerivatives(clean.derivatives().orElseThrow());
            EulerSettings settings = EulerSettings.builder().structuralIndex(StructuralIndex.SPHERE).build();

            EulerSolution solution = EulerDeconvolution.solve(shifted, settings);

            assertFalse(solution.isEmpty());
            for (SourceEstimate e : solution.estimates()) {
                assertEquals(7.0, e.baseLevel(), 1e-6);
                assertEquals(80.0, e.z0(), 1e-4);
            }
        }

        @Test
        @DisplayName("Observation elevation enters the solve")
        void elevatedObservations() {
            Sphere source = new Sphere(0, 0, 150, 20, 0.1);
            double[] x = new double[30];
            double[] y = new double[30];
            double[] z = new double[30];
            for (int i = 0; i < x.length; i++) {
                x[i] = -150 + 10 * i;
                y[i] = 20;
                z[i] = -50;
            }
            ObservationSeries series = synthetic(ObservationSeries.of(x, y, z, new double[x.length]), source);
            EulerSettings settings = EulerSettings.builder().structuralIndex(StructuralIndex.SPHERE).build();

            for (SourceEstimate e : EulerDeconvolution.solve(series, settings).estimates()) {
                assertEquals(150.0, e.z0(), 1e-4);
            }
        }

        @Test
        @DisplayName("Sequential and parallel runs agree")
        void sequentialMatchesParallel() {
            ObservationSeries series = synthetic(gridSeries(-300, 300, 20), new Sphere(10, -10, 90, 30, 0.05));
            EulerSettings settings = EulerSettings.builder().structuralIndex(StructuralIndex.SPHERE).build();
            String previous = System.getProperty("magprospect.parallel");
            try {
                System.setProperty("magprospect.parallel", "false");
                EulerSolution sequential = EulerDeconvolution.solve(series, settings);
                System.setProperty("magprospect.parallel", "true");
                EulerSolution parallel = EulerDeconvolution.solve(series, settings);
                assertEquals(sequential, parallel);
            } finally {
                if (previous == null) System.clearProperty("magprospect.parallel");
                else System.setProperty("magprospect.parallel", previous);
            }
        }
    }

    @Nested
    @DisplayName("Window outcomes")
    class WindowOutcomes {

        @Test
        @DisplayName("Windows touching an invalid sample are skipped and counted")
        void invalidWindows() {
            ObservationSeries clean = synthetic(lineSeries(40), new Sphere(0, 30, 60, 10, 0.1));
            double[] values = clean.values();
            values[10] = Double.NaN;
            ObservationSeries series = ObservationSeries.of(clean.x(), clean.y(), values)
                    .withDerivatives(clean.derivatives().orElseThrow());
            EulerSettings settings = EulerSettings.builder().structuralIndex(StructuralIndex.SPHERE).build();

            EulerSolution solution = EulerDeconvolution.solve(series, settings);

            // stride 2: windows starting at 6, 8 and 10 contain sample 10
            assertEquals(3, solution.invalidInput());
            assertEquals(18, solution.windows());
        }

        @Test
        @DisplayName("Identical rows make every window degenerate")
        void degenerateWindows() {
            int n = 20;
            double[] ones = new double[n];
            Arrays.fill(ones, 1.0);
            ObservationSeries series = ObservationSeries.of(new double[n], new double[n], ones)
                    .withDerivatives(DerivativeChannels.of(ones, ones, ones));

            EulerSolution solution = EulerDeconvolution.solve(series, EulerSettings.defaults());

            assertTrue(solution.isEmpty());
            assertEquals(solution.windows(), solution.degenerate());
        }

        @Test
        @DisplayName("Source above the observations is rejected by depth")
        void sourceAbove() {
            ObservationSeries series = synthetic(lineSeries(30), new Sphere(0, 30, -80, 10, 0.1));
            EulerSettings settings = EulerSettings.builder().structuralIndex(StructuralIndex.SPHERE).build();

            EulerSolution solution = EulerDeconvolution.solve(series, settings);

            assertTrue(solution.isEmpty());
            assertTrue(solution.outOfRange() > 0);
        }

        @Test
        @DisplayName("Series shorter than a window yields an empty solution")
        void shortSeries() {
            ObservationSeries series = synthetic(lineSeries(4), new Sphere(0, 30, 60, 10, 0.1));

            EulerSolution solution = EulerDeconvolution.solve(series, EulerSettings.defaults());

            assertEquals(0, solution.windows());
            assertTrue(solution.isEmpty());
        }

        @Test
        @DisplayName("Missing derivative channels fail fast")
        void missingDerivatives() {
            ObservationSeries series = lineSeries(10);
            assertThrows(IllegalArgumentException.class, () -> EulerDeconvolution.solve(series));
        }

        @Test
        @DisplayName("Settings are validated")
        void settingsValidation() {
            assertThrows(IllegalArgumentException.class, () -> EulerSettings.builder().windowSize(3).build());
            assertThrows(IllegalArgumentException.class,
                    () -> EulerSettings.builder().depthRange(100, 50).build());
            assertThrows(IllegalArgumentException.class, () -> StructuralIndex.of(4));
            assertEquals(StructuralIndex.DIKE, EulerSettings.defaults().structuralIndex());
        }
    }

    @Nested
    @DisplayName("Post-processing")
    class PostProcessing {

        @Test
        @DisplayName("Depth filter is inclusive and idempotent")
        void depthFilter() {
            List<SourceEstimate> estimates = List.of(
                    estimate(0, 0, 5), estimate(0, 0, 10), estimate(0, 0, 100), estimate(0, 0, 200), estimate(0, 0, 201));

            List<SourceEstimate> once = EulerDeconvolution.filterByDepth(estimates, 10, 200);
            List<SourceEstimate> twice = EulerDeconvolution.filterByDepth(once, 10, 200);

            assertEquals(3, once.size());
            assertEquals(once, twice);
            assertThrows(IllegalArgumentException.class, () -> EulerDeconvolution.filterByDepth(estimates, 5, 1));
        }

        @Test
        @DisplayName("Clusters report centroids, largest first")
        void clusters() {
            List<SourceEstimate> estimates = new ArrayList<>();
            estimates.add(estimate(1000, 1000, 300));
            for (int i = 0; i < 4; i++) estimates.add(estimate(i * 2, -i, 100 + i));
            estimates.add(estimate(1004, 1000, 300));

            List<SourceCluster> clusters = EulerDeconvolution.cluster(estimates, 25);

            assertEquals(2, clusters.size());
            assertEquals(4, clusters.get(0).memberCount());
            assertEquals(3.0, clusters.get(0).centroidX(), 1e-12);
            assertEquals(-1.5, clusters.get(0).centroidY(), 1e-12);
            assertEquals(101.5, clusters.get(0).centroidZ(), 1e-12);
            assertEquals(2, clusters.get(1).memberCount());
            assertEquals(1002.0, clusters.get(1).centroidX(), 1e-12);
        }

        @Test
        @DisplayName("No estimates give no clusters")
        void emptyClusters() {
            assertTrue(EulerDeconvolution.cluster(List.of(), 10).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> EulerDeconvolution.cluster(List.of(), 0));
        }
    }

    private static SourceEstimate estimate(double x, double y, double z) {
        return new SourceEstimate(x, y, z, 0, 0, 5, StructuralIndex.SPHERE);
    }

    private static ObservationSeries synthetic(ObservationSeries points, Sphere source) {
        double[] values = ForwardModel.sphere(points, source, DIRECTION);
        double[] z = points.z(0.0);
        ObservationSeries withValues = ObservationSeries.of(points.x(), points.y(), z, values);
        return withValues.withDerivatives(ForwardModel.gradient(points, source, DIRECTION));
    }

    private static ObservationSeries gridSeries(double from, double to, int n) {
        double[] x = new double[n * n];
        double[] y = new double[n * n];
        double step = (to - from) / (n - 1);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                x[r * n + c] = from + c * step;
                y[r * n + c] = from + r * step;
            }
        }
        return ObservationSeries.of(x, y, new double[n * n]);
    }

    private static ObservationSeries lineSeries(int n) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++) x[i] = -100 + 10 * i;
        return ObservationSeries.of(x, new double[n], new double[n]);
    }
}
