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
package com.github.tinemuz.magprospect.inversion;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.magprospect.field.ObservationSeries;
import com.github.tinemuz.magprospect.forward.FieldDirection;
import com.github.tinemuz.magprospect.forward.ForwardModel;
import com.github.tinemuz.magprospect.forward.Sphere;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SusceptibilityInversionTest {

    private static final FieldDirection DIRECTION = new FieldDirection(60, 10);

    private static InversionConfig smallMesh(double alpha) {
        return InversionConfig.builder()
                .cells(4, 4, 2)
                .cellSize(100, 100, 50)
                .zTop(0)
                .alpha(alpha)
                .build();
    }

    private static ObservationSeries survey(double[] values) {
        double[] x = new double[36];
        double[] y = new double[36];
        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 6; c++) {
                x[r * 6 + c] = -150 + 60 * c;
                y[r * 6 + c] = -150 + 60 * r;
            }
        }
        return ObservationSeries.of(x, y, values == null ? new double[36] : values);
    }

    private static ObservationSeries syntheticSurvey() {
        ObservationSeries points = survey(null);
        return survey(ForwardModel.sphere(points, new Sphere(20, -30, 80, 40, 0.05), DIRECTION));
    }

    @Nested
    @DisplayName("Solutions")
    class Solutions {

        @Test
        @DisplayName("Zero data gives a zero model")
        void zeroData() {
            SusceptibilityModel model = SusceptibilityInversion.invert(survey(null), DIRECTION, smallMesh(1.0));

            for (double v : model.values()) assertEquals(0.0, v, 0.0);
            assertEquals(0.0, model.rms(), 0.0);
            assertEquals(32, model.values().length);
            assertEquals(4, model.values3d().length);
            assertEquals(2, model.values3d()[0][0].length);
        }

        @Test
        @DisplayName("Stronger damping trades misfit for a smaller model")
        void dampingTradeOff() {
            ObservationSeries data = syntheticSurvey();
            double previousRms = -1;
            double previousNorm = Double.POSITIVE_INFINITY;
            double previousVariation = Double.POSITIVE_INFINITY;
            for (double alpha = 1e-2; alpha <= 1e6; alpha *= 10) {
                SusceptibilityModel model = SusceptibilityInversion.invert(data, DIRECTION, smallMesh(alpha));
                double rms = model.rms();
                double norm = model.l2Norm();
                double variation = model.totalVariation();
                assertTrue(rms >= previousRms * (1 - 1e-6) - 1e-12, "rms dropped at alpha=" + alpha);
                assertTrue(norm <= previousNorm * (1 + 1e-6) + 1e-12, "norm grew at alpha=" + alpha);
                assertTrue(variation <= previousVariation * (1 + 1e-6) + 1e-12,
                        "total variation grew at alpha=" + alpha);
                assertEquals(alpha, model.alpha(), 0.0);
                previousRms = rms;
                previousNorm = norm;
                previousVariation = variation;
            }
        }

        @Test
        @DisplayName("Predicted data plus residuals reproduce the observations")
        void residuals() {
            ObservationSeries data = syntheticSurvey();
            SusceptibilityModel model = SusceptibilityInversion.invert(data, DIRECTION, smallMesh(10.0));

            double[] predicted = model.predicted();
            double[] residuals = model.residuals();
            double[] observed = data.values();
            for (int i = 0; i < observed.length; i++) {
                assertEquals(observed[i], predicted[i] + residuals[i], 1e-12 * Math.abs(observed[i]) + 1e-15);
            }
            assertTrue(model.totalVariation() >= 0);
        }

        @Test
        @DisplayName("Smoothing operators solve as well")
        void smoothingOperators() {
            ObservationSeries data = syntheticSurvey();
            for (RegularizationOperator op : new RegularizationOperator[] {
                new GradientRegularization(), new LaplacianRegularization()
            }) {
                InversionConfig config = smallMesh(1.0).toBuilder().regularization(op).build();
                SusceptibilityModel model = SusceptibilityInversion.invert(data, DIRECTION, config);
                for (double v : model.values()) assertTrue(Double.isFinite(v));
            }
        }
    }

    @Nested
    @DisplayName("Guards")
    class Guards {

        @Test
        @DisplayName("Oversized mesh is refused before allocation")
        void tooLarge() {
            InversionConfig config = InversionConfig.builder().cells(100, 100, 10).build();

            ConfigurationTooLargeException e = assertThrows(ConfigurationTooLargeException.class,
                    () -> SusceptibilityInversion.invert(syntheticSurvey(), DIRECTION, config));

            assertTrue(e.getMessage().contains("MiB"), e.getMessage());
            assertEquals(SusceptibilityInversion.estimateBytes(36, 100_000), e.estimatedBytes());
            assertTrue(e.estimatedSeconds() > 0);
        }

        @Test
        @DisplayName("Mesh whose byte count overflows a long is refused")
        void overflowingEstimate() {
            InversionConfig config = InversionConfig.builder().cells(1000, 1000, 620).build();
            ObservationSeries two = ObservationSeries.of(
                    new double[] {0, 100}, new double[] {0, 100}, new double[] {1, 2});

            ConfigurationTooLargeException e = assertThrows(ConfigurationTooLargeException.class,
                    () -> SusceptibilityInversion.invert(two, DIRECTION, config));

            assertEquals(Long.MAX_VALUE, e.estimatedBytes());
            assertEquals(Long.MAX_VALUE, SusceptibilityInversion.estimateBytes(100, 620_000_000L));
        }

        @Test
        @DisplayName("Cost estimates follow the dense system size")
        void estimates() {
            assertEquals(8L * (10 * 20 + 3 * 400), SusceptibilityInversion.estimateBytes(10, 20));
            assertEquals((10.0 * 400 + 8000.0 / 3) / 1e3, SusceptibilityInversion.estimateSeconds(10, 20, 1e3), 1e-12);
        }

        @Test
        @DisplayName("Invalid or missing observations are rejected")
        void invalidObservations() {
            double[] values = syntheticSurvey().values();
            values[3] = Double.NaN;

            assertThrows(IllegalArgumentException.class,
                    () -> SusceptibilityInversion.invert(survey(values), DIRECTION, smallMesh(1.0)));
            assertThrows(IllegalArgumentException.class,
                    () -> SusceptibilityInversion.invert(
                            ObservationSeries.of(new double[0], new double[0], new double[0]),
                            DIRECTION,
                            smallMesh(1.0)));
        }

        @Test
        @DisplayName("Configuration is validated")
        void configValidation() {
            assertThrows(IllegalArgumentException.class, () -> InversionConfig.builder().cells(0, 1, 1).build());
            assertThrows(IllegalArgumentException.class,
                    () -> InversionConfig.builder().cellSize(10, -1, 10).build());
            assertThrows(IllegalArgumentException.class, () -> InversionConfig.builder().alpha(-1).build());
            assertThrows(IllegalArgumentException.class, () -> InversionConfig.builder().maxIterations(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> InversionConfig.builder().regularization(null).build());

            InversionConfig defaults = InversionConfig.defaults();
            assertEquals(500, defaults.cellCount());
            assertEquals(1.0, defaults.alpha());
            assertEquals(50, defaults.maxIterations());
            assertEquals("identity", defaults.regularization().toString());
        }
    }
}
