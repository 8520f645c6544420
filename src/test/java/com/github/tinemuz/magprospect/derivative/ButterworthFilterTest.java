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
package com.github.tinemuz.magprospect.derivative;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.magprospect.field.Profile;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ButterworthFilterTest {

    private static final double COEFFICIENT_TOLERANCE = 1e-12;
    private static final double SIGNAL_TOLERANCE = 1e-9;

    @Nested
    @DisplayName("Design")
    class Design {

        @Test
        @DisplayName("Half-band low-pass matches the closed form")
        void halfBandLowPass() {
            // poles of the half-band design lie at +/- i tan(pi/16) and +/- i tan(3 pi/16)
            double t1 = Math.pow(Math.tan(Math.PI / 16), 2);
            double t2 = Math.pow(Math.tan(3 * Math.PI / 16), 2);
            double[] expectedA = {1.0, 0.0, t1 + t2, 0.0, t1 * t2};
            double k = (1.0 + t1 + t2 + t1 * t2) / 16.0;
            double[] expectedB = {k, 4 * k, 6 * k, 4 * k, k};

            ButterworthFilter f = ButterworthFilter.lowPass(0.5);

            assertArrayEquals(expectedA, f.a(), COEFFICIENT_TOLERANCE);
            assertArrayEquals(expectedB, f.b(), COEFFICIENT_TOLERANCE);
        }

        @Test
        @DisplayName("Low-pass has unit DC gain, high-pass blocks DC")
        void dcGain() {
            ButterworthFilter low = ButterworthFilter.lowPass(0.1);
            ButterworthFilter high = ButterworthFilter.highPass(0.1);

            assertEquals(1.0, sum(low.b()) / sum(low.a()), 1e-9);
            assertEquals(0.0, sum(high.b()) / sum(high.a()), 1e-9);
            assertEquals(5, high.a().length);
            assertEquals(1.0, high.a()[0]);
        }

        @Test
        @DisplayName("Cutoff outside (0, 1) is rejected")
        void badCutoff() {
            assertThrows(IllegalArgumentException.class, () -> ButterworthFilter.lowPass(0.0));
            assertThrows(IllegalArgumentException.class, () -> ButterworthFilter.highPass(1.0));
            assertThrows(IllegalArgumentException.class, () -> ButterworthFilter.design(0, 0.3, false));
        }
    }

    @Nested
    @DisplayName("Zero-phase filtering")
    class ZeroPhase {

        @Test
        @DisplayName("Constant input: low-pass keeps it, high-pass removes it")
        void constantInput() {
            double[] x = new double[200];
            Arrays.fill(x, 42.0);
            Profile p = Profile.of(x, 1.0);

            double[] low = DerivativeSuite.lowPass(p, 0.2).values();
            double[] high = DerivativeSuite.highPass(p, 0.2).values();

            for (int i = 0; i < x.length; i++) {
                assertEquals(42.0, low[i], SIGNAL_TOLERANCE);
                assertEquals(0.0, high[i], SIGNAL_TOLERANCE);
            }
        }

        @Test
        @DisplayName("Slow sine passes the low-pass without phase shift")
        void slowSine() {
            double[] x = new double[200];
            for (int i = 0; i < x.length; i++) x[i] = Math.sin(2 * Math.PI * 0.01 * i);

            double[] low = ButterworthFilter.lowPass(0.5).filtfilt(x);
            double[] high = ButterworthFilter.highPass(0.5).filtfilt(x);

            for (int i = 50; i < 150; i++) {
                assertEquals(x[i], low[i], 1e-3);
                assertEquals(0.0, high[i], 1e-2);
            }
        }

        @Test
        @DisplayName("Series not longer than the padding is rejected")
        void tooShort() {
            ButterworthFilter f = ButterworthFilter.lowPass(0.3);
            assertEquals(15, f.padLength());
            assertThrows(IllegalArgumentException.class, () -> f.filtfilt(new double[15]));
            assertDoesNotThrow(() -> f.filtfilt(new double[16]));
        }

        @Test
        @DisplayName("Invalid sample makes the filtered profile invalid")
        void invalidInput() {
            double[] x = new double[100];
            x[10] = Double.NaN;

            Profile out = DerivativeSuite.lowPass(Profile.of(x, 1.0), 0.3);

            assertEquals(0, out.validCount());
        }
    }

    private static double sum(double[] v) {
        double s = 0;
        for (double d : v) s += d;
        return s;
    }
}
