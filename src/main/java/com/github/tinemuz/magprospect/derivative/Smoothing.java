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

import com.github.tinemuz.magprospect.field.Profile;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Noise reduction for profiles prior to differentiation.
 * Invalid samples propagate to every output sample whose window covers them.
 */
public final class Smoothing {

    private Smoothing() {}

    /**
     * Savitzky-Golay smoothing: each sample is replaced by the value of a
     * least-squares polynomial of degree {@code order} fitted to the
     * {@code window} samples centred on it. The first and last half-windows
     * are evaluated from the polynomial fitted to the first and last full
     * window.
     *
     * @param window odd window length, not longer than the profile
     * @param order  polynomial degree, smaller than {@code window}
     */
    public static Profile savitzkyGolay(Profile profile, int window, int order) {
        if (window < 1 || window % 2 == 0) {
            throw new IllegalArgumentException("window must be a positive odd number, got " + window);
        }
        if (order < 0 || order >= window) {
            throw new IllegalArgumentException("order must be in [0, window), got " + order);
        }
        int n = profile.size();
        if (window > n) {
            throw new IllegalArgumentException("window " + window + " is longer than the profile (" + n + ")");
        }
        double[] x = profile.values();
        double[][] hat = hatMatrix(window, order);
        int half = window / 2;
        double[] out = new double[n];
        for (int i = half; i < n - half; i++) {
            out[i] = dot(hat[half], x, i - half);
        }
        for (int p = 0; p < half; p++) {
            out[p] = dot(hat[p], x, 0);
            out[n - half + p] = dot(hat[half + 1 + p], x, n - window);
        }
        return Profile.of(out, profile.spacing());
    }

    /**
     * Gaussian smoothing with {@code sigma = window / 4} samples, truncated at
     * four sigma, with mirror reflection at the ends.
     */
    public static Profile gaussian(Profile profile, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
        double sigma = window / 4.0;
        int radius = (int) (4.0 * sigma + 0.5);
        double[] kernel = new double[2 * radius + 1];
        double sum = 0.0;
        for (int i = -radius; i <= radius; i++) {
            kernel[i + radius] = Math.exp(-0.5 * i * i / (sigma * sigma));
            sum += kernel[i + radius];
        }
        for (int i = 0; i < kernel.length; i++) kernel[i] /= sum;

        double[] x = profile.values();
        int n = x.length;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double acc = 0.0;
            for (int k = -radius; k <= radius; k++) {
                acc += kernel[k + radius] * x[Spectral.reflect(i + k, n)];
            }
            out[i] = acc;
        }
        return Profile.of(out, profile.spacing());
    }

    // Row p gives the weights that evaluate the fitted polynomial at window position p
    private static double[][] hatMatrix(int window, int order) {
        int half = window / 2;
        RealMatrix v = new Array2DRowRealMatrix(window, order + 1);
        for (int i = 0; i < window; i++) {
            double t = i - half;
            double pow = 1.0;
            for (int j = 0; j <= order; j++) {
                v.setEntry(i, j, pow);
                pow *= t;
            }
        }
        RealMatrix pinv = new SingularValueDecomposition(v).getSolver().getInverse();
        return v.multiply(pinv).getData();
    }

    private static double dot(double[] weights, double[] x, int offset) {
        double acc = 0.0;
        for (int j = 0; j < weights.length; j++) acc += weights[j] * x[offset + j];
        return acc;
    }
}
