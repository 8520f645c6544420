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
package com.github.tinemuz.magprospect.forward;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.magprospect.field.DerivativeChannels;
import com.github.tinemuz.magprospect.field.FieldGrid;
import com.github.tinemuz.magprospect.field.GridGeometry;
import com.github.tinemuz.magprospect.field.ObservationSeries;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ForwardModelTest {

    private static final double RELATIVE_TOLERANCE = 1e-9;
    private static final FieldDirection DIRECTION = new FieldDirection(45, 0);

    @Nested
    @DisplayName("Sphere response")
    class SphereResponse {

        @Test
        @DisplayName("Directly above the centre: 2 C m / r^3")
        void aboveCentre() {
            Sphere s = new Sphere(0, 0, 100, 10, 0.1);
            ObservationSeries p = ObservationSeries.of(new double[] {0}, new double[] {0}, new double[] {0});

            double t = ForwardModel.sphere(p, s, DIRECTION)[0];

            double expected = ForwardModel.FIELD_CONSTANT * s.moment() * 2.0 / 1e6;
            assertEquals(expected, t, expected * RELATIVE_TOLERANCE);
        }

        @Test
        @DisplayName("Vertical approximation is symmetric about the source")
        void symmetric() {
            Sphere s = new Sphere(0, 0, 50, 5, 0.01);
            ObservationSeries p = ObservationSeries.of(
                    new double[] {-30, 30, 0, 0}, new double[] {0, 0, -30, 30}, new double[4]);

            double[] t = ForwardModel.sphere(p, s, DIRECTION);

            assertEquals(t[0], t[1], Math.abs(t[0]) * RELATIVE_TOLERANCE);
            assertEquals(t[0], t[2], Math.abs(t[0]) * RELATIVE_TOLERANCE);
            assertEquals(t[2], t[3], Math.abs(t[0]) * RELATIVE_TOLERANCE);
        }

        @Test
        @DisplayName("Distance is floored at one length unit")
        void distanceFloor() {
            Sphere s = new Sphere(0, 0, 0, 2, 0.5);
            ObservationSeries p = ObservationSeries.of(new double[] {0}, new double[] {0}, new double[] {0});

            double t = ForwardModel.sphere(p, s, DIRECTION)[0];

            assertTrue(Double.isFinite(t));
            assertEquals(-ForwardModel.FIELD_CONSTANT * s.moment(), t, 1e-9);
        }

        @Test
        @DisplayName("Total-field dipole with vertical field equals the vertical approximation")
        void dipoleVerticalField() {
            Sphere s = new Sphere(10, -20, 80, 15, 0.02);
            ObservationSeries p = line(-200, 200, 21);
            FieldDirection vertical = new FieldDirection(90, 0);

            double[] approx = ForwardModel.sphere(p, s, vertical, ResponseModel.VERTICAL_APPROXIMATION);
            double[] dipole = ForwardModel.sphere(p, s, vertical, ResponseModel.TOTAL_FIELD_DIPOLE);

            for (int i = 0; i < approx.length; i++) {
                assertEquals(approx[i], dipole[i], Math.abs(approx[i]) * 1e-9 + 1e-15);
            }
        }

        @Test
        @DisplayName("Inclined dipole anomaly is asymmetric along declination")
        void inclinedDipole() {
            Sphere s = new Sphere(0, 0, 60, 10, 0.05);
            ObservationSeries p = ObservationSeries.of(new double[] {-40, 40}, new double[2], new double[2]);

            double[] t = ForwardModel.sphere(p, s, DIRECTION, ResponseModel.TOTAL_FIELD_DIPOLE);

            assertNotEquals(t[0], t[1], 1e-6);
        }

        @Test
        @DisplayName("Gradient vanishes inside the distance floor")
        void gradientInsideFloor() {
            Sphere s = new Sphere(10, 20, 30, 2, 0.5);
            ObservationSeries p = ObservationSeries.of(
                    new double[] {10, 10.5, 10}, new double[] {20, 20, 20}, new double[] {30, 30, 32}, new double[3]);

            DerivativeChannels g = ForwardModel.gradient(p, s, DIRECTION);

            for (int i = 0; i < 2; i++) {
                assertEquals(0.0, g.dx(i), 0.0);
                assertEquals(0.0, g.dy(i), 0.0);
                assertEquals(0.0, g.dz(i), 0.0);
            }
            assertNotEquals(0.0, g.dz(2));
        }

        @Test
        @DisplayName("Analytic gradient matches central differences")
        void gradient() {
            Sphere s = new Sphere(5, 3, 120, 40, 0.05);
            double[] x = {-150, -20, 0, 60, 230};
            double[] y = {40, -80, 10, 0, 120};
            double[] z = {0, 0, -10, 5, 0};
            ObservationSeries p = ObservationSeries.of(x, y, z, new double[5]);
            double h = 1e-3;

            for (ResponseModel model : ResponseModel.values()) {
                DerivativeChannels g = ForwardModel.gradient(p, s, DIRECTION, model);
                for (int i = 0; i < x.length; i++) {
                    double fdx = central(s, model, x[i], y[i], z[i], h, 0, 0);
                    double fdy = central(s, model, x[i], y[i], z[i], 0, h, 0);
                    double fdz = central(s, model, x[i], y[i], z[i], 0, 0, h);
                    double scale = Math.abs(g.dx(i)) + Math.abs(g.dy(i)) + Math.abs(g.dz(i));
                    assertEquals(fdx, g.dx(i), scale * 1e-5);
                    assertEquals(fdy, g.dy(i), scale * 1e-5);
                    assertEquals(fdz, g.dz(i), scale * 1e-5);
                }
            }
        }

        @Test
        @DisplayName("Grid response matches the point response")
        void gridResponse() {
            Sphere s = new Sphere(50, 50, 70, 20, 0.03);
            GridGeometry geom = new GridGeometry(0, 0, 25, 25, 5, 5);

            FieldGrid grid = ForwardModel.grid(geom, 0.0, s, DIRECTION);
            double[] point = ForwardModel.sphere(
                    new double[] {geom.x(3)}, new double[] {geom.y(1)}, new double[] {0.0},
                    s, DIRECTION, ResponseModel.VERTICAL_APPROXIMATION);

            assertEquals(point[0], grid.get(1, 3));
        }

        @Test
        @DisplayName("Mismatched coordinate arrays are rejected")
        void mismatch() {
            Sphere s = new Sphere(0, 0, 10, 1, 0.1);
            assertThrows(IllegalArgumentException.class, () -> ForwardModel.sphere(
                    new double[2], new double[2], new double[1], s, DIRECTION, ResponseModel.VERTICAL_APPROXIMATION));
        }
    }

    @Nested
    @DisplayName("Prism response")
    class PrismResponse {

        @Test
        @DisplayName("Prism response equals the sum of its sub-cell spheres exactly")
        void superposition() {
            Prism prism = new Prism(-50, 50, -30, 30, 100, 160, 0.04);
            ObservationSeries p = line(-300, 300, 31);

            double[] total = ForwardModel.prism(p, prism, DIRECTION, 3, 3, 3);

            double[] sum = new double[p.size()];
            for (Sphere cell : prism.subdivide(3, 3, 3)) {
                double[] t = ForwardModel.sphere(p, cell, DIRECTION);
                for (int i = 0; i < sum.length; i++) sum[i] += t[i];
            }
            assertArrayEquals(sum, total, 0.0);
        }

        @Test
        @DisplayName("Default subdivision is 3x3x3")
        void defaultSubdivision() {
            Prism prism = new Prism(0, 10, 0, 10, 20, 30, 0.1);
            ObservationSeries p = line(-20, 20, 5);

            assertArrayEquals(
                    ForwardModel.prism(p, prism, DIRECTION, 3, 3, 3), ForwardModel.prism(p, prism, DIRECTION), 0.0);
        }

        @Test
        @DisplayName("Sub-cells preserve the prism volume and centres")
        void subdivision() {
            Prism prism = new Prism(0, 90, 0, 60, 10, 40, 0.1);

            List<Sphere> cells = prism.subdivide(3, 2, 1);

            assertEquals(6, cells.size());
            double volume = cells.stream().mapToDouble(Sphere::volume).sum();
            assertEquals(prism.volume(), volume, prism.volume() * 1e-12);
            assertEquals(15.0, cells.get(0).x());
            assertEquals(15.0, cells.get(0).y());
            assertEquals(25.0, cells.get(0).z());
            assertEquals(45.0, cells.get(1).y());
        }

        @Test
        @DisplayName("Inverted bounds are rejected")
        void invertedBounds() {
            assertThrows(IllegalArgumentException.class, () -> new Prism(10, 0, 0, 1, 0, 1, 0.1));
            assertThrows(IllegalArgumentException.class, () -> new Sphere(0, 0, 0, 0, 0.1));
            assertThrows(IllegalArgumentException.class, () -> new FieldDirection(95, 0));
        }
    }

    private static double central(
            Sphere s, ResponseModel model, double x, double y, double z, double hx, double hy, double hz) {
        double h = hx + hy + hz;
        double plus = ForwardModel.sphere(
                new double[] {x + hx}, new double[] {y + hy}, new double[] {z + hz}, s, DIRECTION, model)[0];
        double minus = ForwardModel.sphere(
                new double[] {x - hx}, new double[] {y - hy}, new double[] {z - hz}, s, DIRECTION, model)[0];
        return (plus - minus) / (2 * h);
    }

    private static ObservationSeries line(double from, double to, int n) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++) x[i] = from + (to - from) * i / (n - 1);
        return ObservationSeries.of(x, new double[n], new double[n]);
    }
}
