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
package com.github.tinemuz.magprospect.regional;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.magprospect.field.FieldGrid;
import com.github.tinemuz.magprospect.field.GridGeometry;
import com.github.tinemuz.magprospect.field.ObservationSeries;
import com.github.tinemuz.magprospect.field.Profile;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RegionalResidualSeparatorTest {

    private static final double TOLERANCE = 1e-8;

    @Nested
    @DisplayName("Polynomial trend")
    class Polynomial {

        @Test
        @DisplayName("A planar field is entirely regional")
        void planeIsRegional() {
            FieldGrid g = grid(12, 10, (u, v) -> 100 + 20 * u - 35 * v);

            Separation<FieldGrid> s = RegionalResidualSeparator.polynomial(g, 1);

            assertArrayEquals(g.values(), s.regional().values(), TOLERANCE);
            for (double r : s.residual().values()) assertEquals(0.0, r, TOLERANCE);
        }

        @Test
        @DisplayName("Cubic trend is recovered and the anomaly left in the residual")
        void cubicWithAnomaly() {
            FieldGrid trend = grid(20, 20, (u, v) -> 5 * u * u * u - 2 * u * v * v + v);
            double[] values = trend.values();
            int spike = trend.geometry().index(10, 10);
            values[spike] += 50;
            FieldGrid g = FieldGrid.of(trend.geometry(), values);

            Separation<FieldGrid> s = RegionalResidualSeparator.polynomial(g, 3);

            double[] residual = s.residual().values();
            int peak = 0;
            for (int i = 1; i < residual.length; i++) if (residual[i] > residual[peak]) peak = i;
            assertEquals(spike, peak);
            double[] regional = s.regional().values();
            double[] observed = g.values();
            for (int i = 0; i < observed.length; i++) {
                assertEquals(observed[i], regional[i] + residual[i], TOLERANCE);
            }
        }

        @Test
        @DisplayName("Trend is evaluated on invalid cells, residual stays invalid there")
        void invalidCells() {
            double[] values = grid(8, 8, (u, v) -> 3 * u + v).values();
            values[9] = Double.NaN;
            FieldGrid g = FieldGrid.of(new GridGeometry(0, 0, 1, 1, 8, 8), values);

            Separation<FieldGrid> s = RegionalResidualSeparator.polynomial(g, 2);

            assertTrue(s.regional().isValid(1, 1));
            assertFalse(s.residual().isValid(1, 1));
            assertEquals(3.0 / 7 + 1.0 / 7, s.regional().get(1, 1), TOLERANCE);
        }

        @Test
        @DisplayName("Degenerate fit falls back to the moving average")
        void degenerateFallback() {
            double[] values = new double[36];
            Arrays.fill(values, Double.NaN);
            values[0] = 1;
            values[35] = 2;
            FieldGrid g = FieldGrid.of(new GridGeometry(0, 0, 1, 1, 6, 6), values);

            Separation<FieldGrid> poly = RegionalResidualSeparator.polynomial(g, 2);
            Separation<FieldGrid> avg = RegionalResidualSeparator.movingAverage(g);

            assertEquals(avg, poly);
        }

        @Test
        @DisplayName("Only degrees 1 to 3 are supported")
        void degreeRange() {
            FieldGrid g = grid(4, 4, (u, v) -> u);
            assertThrows(IllegalArgumentException.class, () -> RegionalResidualSeparator.polynomial(g, 0));
            assertThrows(IllegalArgumentException.class, () -> RegionalResidualSeparator.polynomial(g, 4));
        }

        @Test
        @DisplayName("Scattered quadratic surface is fitted exactly")
        void scattered() {
            double[] x = {0, 100, 250, 400, 30, 330, 210, 90, 380, 150};
            double[] y = {0, 500, 120, 40, 260, 310, 480, 90, 200, 400};
            double[] v = new double[x.length];
            for (int i = 0; i < v.length; i++) {
                double u = x[i] / 400.0;
                double w = y[i] / 500.0;
                v[i] = 1 + 2 * u * u - u * w + 3 * w;
            }

            Separation<double[]> s = RegionalResidualSeparator.polynomial(ObservationSeries.of(x, y, v), 2);

            for (double r : s.residual()) assertEquals(0.0, r, TOLERANCE);
        }

        @Test
        @DisplayName("Profile trend removes a linear ramp")
        void profileRamp() {
            double[] v = new double[50];
            for (int i = 0; i < v.length; i++) v[i] = 10 + 0.5 * i;

            Separation<Profile> s = RegionalResidualSeparator.polynomial(Profile.of(v, 25.0), 1);

            for (double r : s.residual().values()) assertEquals(0.0, r, TOLERANCE);
            assertEquals(25.0, s.regional().spacing());
        }
    }

    @Nested
    @DisplayName("Moving average")
    class MovingAverage {

        @Test
        @DisplayName("Constant field has zero residual")
        void constant() {
            FieldGrid g = grid(30, 20, (u, v) -> 7.0);

            Separation<FieldGrid> s = RegionalResidualSeparator.separate(g, TrendMethod.MOVING_AVERAGE);

            for (double r : s.residual().values()) assertEquals(0.0, r, TOLERANCE);
        }

        @Test
        @DisplayName("Window of a tenth of the series, invalid samples skipped")
        void seriesWindow() {
            double[] v = new double[40];
            for (int i = 0; i < v.length; i++) v[i] = i;
            v[20] = Double.NaN;

            Separation<Profile> s = RegionalResidualSeparator.movingAverage(Profile.of(v, 1.0));

            // window 4 covering indices 18..21, index 20 skipped
            assertEquals((18 + 19 + 21) / 3.0, s.regional().values()[20], TOLERANCE);
            assertFalse(s.residual().isValid(20));
            assertEquals((8 + 9 + 10 + 11) / 4.0, s.regional().values()[10], TOLERANCE);
        }

        @Test
        @DisplayName("Default polynomial separation uses the configured degree")
        void defaultPolynomial() {
            FieldGrid g = grid(10, 10, (u, v) -> u * u + v * v);

            Separation<FieldGrid> s = RegionalResidualSeparator.separate(g, TrendMethod.POLYNOMIAL);

            for (double r : s.residual().values()) assertEquals(0.0, r, TOLERANCE);
        }
    }

    private interface Surface {
        double at(double u, double v);
    }

    // values as a function of normalized coordinates
    private static FieldGrid grid(int nx, int ny, Surface s) {
        GridGeometry g = new GridGeometry(0, 0, 1, 1, nx, ny);
        double[] v = new double[g.size()];
        for (int r = 0; r < ny; r++) {
            for (int c = 0; c < nx; c++) {
                v[g.index(r, c)] = s.at((double) c / (nx - 1), (double) r / (ny - 1));
            }
        }
        return FieldGrid.of(g, v);
    }
}
