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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Frequency-domain filtering helpers built on the Commons Math radix-2 FFT.
 *
 * <p>Inputs whose length is not a power of two are extended by mirror
 * reflection to the next power of two, filtered, and cropped back. Lengths
 * that already are a power of two are transformed as-is, so the periodic
 * behaviour matches a plain DFT of the input.</p>
 */
final class Spectral {
    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    private Spectral() {}

    /** Spectral multiplier as a function of wavenumber (cycles per length unit). */
    @FunctionalInterface
    interface Multiplier {
        Complex at(double k);
    }

    /** 2D spectral multiplier as a function of wavenumbers along x and y. */
    @FunctionalInterface
    interface Multiplier2D {
        Complex at(double kx, double ky);
    }

    /**
     * Multiply the spectrum of {@code values} by {@code m} and return the real
     * part of the inverse transform, cropped to the input length.
     */
    static double[] filter(double[] values, double spacing, Multiplier m) {
        int n = values.length;
        int len = nextPowerOfTwo(n);
        Complex[] spectrum = FFT.transform(mirrorPad(values, len), TransformType.FORWARD);
        double[] k = frequencies(len, spacing);
        for (int i = 0; i < len; i++) {
            spectrum[i] = spectrum[i].multiply(m.at(k[i]));
        }
        Complex[] back = FFT.transform(spectrum, TransformType.INVERSE);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = back[i].getReal();
        return out;
    }

    /**
     * 2D version of {@link #filter} over a row-major grid of {@code nx} columns
     * and {@code ny} rows; rows and columns are transformed separately.
     */
    static double[] filter2D(double[] rowMajor, int nx, int ny, double dx, double dy, Multiplier2D m) {
        int lenX = nextPowerOfTwo(nx);
        int lenY = nextPowerOfTwo(ny);

        // Mirror-pad rows, then mirror-pad whole rows along y
        Complex[][] data = new Complex[lenY][];
        double[] row = new double[nx];
        for (int r = 0; r < lenY; r++) {
            int src = reflect(r, ny);
            System.arraycopy(rowMajor, src * nx, row, 0, nx);
            data[r] = FFT.transform(mirrorPad(row, lenX), TransformType.FORWARD);
        }
        transformColumns(data, lenX, lenY, TransformType.FORWARD);

        double[] kx = frequencies(lenX, dx);
        double[] ky = frequencies(lenY, dy);
        for (int r = 0; r < lenY; r++) {
            for (int c = 0; c < lenX; c++) {
                data[r][c] = data[r][c].multiply(m.at(kx[c], ky[r]));
            }
        }

        transformColumns(data, lenX, lenY, TransformType.INVERSE);
        double[] out = new double[nx * ny];
        for (int r = 0; r < ny; r++) {
            Complex[] back = FFT.transform(data[r], TransformType.INVERSE);
            for (int c = 0; c < nx; c++) out[r * nx + c] = back[c].getReal();
        }
        return out;
    }

    private static void transformColumns(Complex[][] data, int lenX, int lenY, TransformType type) {
        Complex[] column = new Complex[lenY];
        for (int c = 0; c < lenX; c++) {
            for (int r = 0; r < lenY; r++) column[r] = data[r][c];
            Complex[] t = FFT.transform(column, type);
            for (int r = 0; r < lenY; r++) data[r][c] = t[r];
        }
    }

    /**
     * Sample frequencies of a length-{@code n} DFT with sample spacing
     * {@code d}: {@code [0, 1, ..., n/2-1, -n/2, ..., -1] / (d*n)} for even n.
     */
    static double[] frequencies(int n, double d) {
        double[] k = new double[n];
        int positive = (n - 1) / 2 + 1;
        for (int i = 0; i < positive; i++) k[i] = i / (d * n);
        for (int i = positive; i < n; i++) k[i] = (i - n) / (d * n);
        return k;
    }

    static int nextPowerOfTwo(int n) {
        if (n < 1) throw new IllegalArgumentException("length must be positive, got " + n);
        int p = 1;
        while (p < n) p <<= 1;
        return p;
    }

    /** Extend {@code values} to {@code len} samples by half-sample mirror reflection. */
    static double[] mirrorPad(double[] values, int len) {
        double[] out = new double[len];
        for (int i = 0; i < len; i++) out[i] = values[reflect(i, values.length)];
        return out;
    }

    // Index into [0, n) under repeated half-sample reflection: ... c b a | a b c | c b a ...
    static int reflect(int i, int n) {
        int period = 2 * n;
        int j = i % period;
        if (j < 0) j += period;
        return j < n ? j : period - 1 - j;
    }
}
