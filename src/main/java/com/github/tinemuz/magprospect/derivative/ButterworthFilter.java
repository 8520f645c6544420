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
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Digital Butterworth filter with zero-phase forward-backward application.
 *
 * <p>Coefficients come from the analog prototype transformed to low-pass or
 * high-pass at the pre-warped cutoff and mapped to the z-plane by the bilinear
 * transform. {@link #filtfilt(double[])} extends the signal by odd reflection,
 * starts each pass from the steady-state filter state, and crops the
 * extension.</p>
 *
 * <p>Cutoffs are normalized to the Nyquist frequency and must lie in
 * {@code (0, 1)}.</p>
 */
public final class ButterworthFilter {
    /** Order used by the band separation helpers. */
    public static final int DEFAULT_ORDER = 4;

    // Sample rate implied by Nyquist-normalized cutoffs
    private static final double FS = 2.0;

    private final double[] b;
    private final double[] a;

    private ButterworthFilter(double[] b, double[] a) {
        this.b = b;
        this.a = a;
    }

    public static ButterworthFilter lowPass(double cutoff) {
        return design(DEFAULT_ORDER, cutoff, false);
    }

    public static ButterworthFilter highPass(double cutoff) {
        return design(DEFAULT_ORDER, cutoff, true);
    }

    /**
     * Design an {@code order}-pole filter.
     *
     * @param cutoff   Nyquist-normalized cutoff in {@code (0, 1)}
     * @param highPass true for high-pass, false for low-pass
     */
    public static ButterworthFilter design(int order, double cutoff, boolean highPass) {
        if (order < 1) {
            throw new IllegalArgumentException("filter order must be positive, got " + order);
        }
        if (!(cutoff > 0.0 && cutoff < 1.0)) {
            throw new IllegalArgumentException("cutoff must be in (0, 1) relative to Nyquist, got " + cutoff);
        }
        double warped = 2.0 * FS * Math.tan(Math.PI * cutoff / FS);

        // Analog prototype poles on the left half of the unit circle
        Complex[] proto = new Complex[order];
        for (int i = 0; i < order; i++) {
            int m = -order + 1 + 2 * i;
            proto[i] = new Complex(0.0, Math.PI * m / (2.0 * order)).exp().negate();
        }

        Complex[] zeros;
        Complex[] poles = new Complex[order];
        double gain;
        if (highPass) {
            zeros = new Complex[order];
            Complex prodNeg = Complex.ONE;
            for (int i = 0; i < order; i++) {
                poles[i] = new Complex(warped).divide(proto[i]);
                zeros[i] = Complex.ZERO;
                prodNeg = prodNeg.multiply(proto[i].negate());
            }
            gain = Complex.ONE.divide(prodNeg).getReal();
        } else {
            zeros = new Complex[0];
            for (int i = 0; i < order; i++) poles[i] = proto[i].multiply(warped);
            gain = Math.pow(warped, order);
        }

        // Bilinear transform; missing zeros go to z = -1
        double fs2 = 2.0 * FS;
        Complex[] zd = new Complex[order];
        Complex[] pd = new Complex[order];
        Complex num = Complex.ONE;
        Complex den = Complex.ONE;
        for (int i = 0; i < order; i++) {
            pd[i] = new Complex(fs2).add(poles[i]).divide(new Complex(fs2).subtract(poles[i]));
            den = den.multiply(new Complex(fs2).subtract(poles[i]));
            if (i < zeros.length) {
                zd[i] = new Complex(fs2).add(zeros[i]).divide(new Complex(fs2).subtract(zeros[i]));
                num = num.multiply(new Complex(fs2).subtract(zeros[i]));
            } else {
                zd[i] = new Complex(-1.0);
            }
        }
        double k = gain * num.divide(den).getReal();

        double[] bz = realPoly(zd);
        for (int i = 0; i < bz.length; i++) bz[i] *= k;
        return new ButterworthFilter(bz, realPoly(pd));
    }

    /** Numerator coefficients, highest power of z^-1 last. */
    public double[] b() {
        return b.clone();
    }

    /** Denominator coefficients, {@code a[0] == 1}. */
    public double[] a() {
        return a.clone();
    }

    /** Extension applied on each side before filtering. */
    public int padLength() {
        return 3 * Math.max(a.length, b.length);
    }

    /**
     * Zero-phase filtering of {@code x}.
     *
     * @throws IllegalArgumentException if {@code x} is not longer than {@link #padLength()}
     */
    public double[] filtfilt(double[] x) {
        int pad = padLength();
        int n = x.length;
        if (n <= pad) {
            throw new IllegalArgumentException(
                    "series of " + n + " samples is too short for zero-phase filtering, need more than " + pad);
        }
        double[] ext = new double[n + 2 * pad];
        for (int i = 0; i < pad; i++) {
            ext[i] = 2.0 * x[0] - x[pad - i];
            ext[n + pad + i] = 2.0 * x[n - 1] - x[n - 2 - i];
        }
        System.arraycopy(x, 0, ext, pad, n);

        double[] zi = steadyState();
        double[] forward = lfilter(ext, scaled(zi, ext[0]));
        double[] reversed = reverse(forward);
        double[] backward = reverse(lfilter(reversed, scaled(zi, reversed[0])));

        double[] out = new double[n];
        System.arraycopy(backward, pad, out, 0, n);
        return out;
    }

    // Direct form II transposed
    double[] lfilter(double[] x, double[] state) {
        int order = a.length - 1;
        double[] z = state.clone();
        double[] y = new double[x.length];
        for (int t = 0; t < x.length; t++) {
            double xi = x[t];
            double yi = b[0] * xi + z[0];
            for (int i = 0; i < order - 1; i++) {
                z[i] = b[i + 1] * xi + z[i + 1] - a[i + 1] * yi;
            }
            z[order - 1] = b[order] * xi - a[order] * yi;
            y[t] = yi;
        }
        return y;
    }

    /** Filter state for a unit step input that has settled. */
    double[] steadyState() {
        int order = a.length - 1;
        RealMatrix m = new Array2DRowRealMatrix(order, order);
        for (int i = 0; i < order; i++) {
            m.setEntry(i, i, 1.0);
            m.addToEntry(i, 0, a[i + 1]);
            if (i + 1 < order) m.addToEntry(i, i + 1, -1.0);
        }
        RealVector rhs = new ArrayRealVector(order);
        for (int i = 0; i < order; i++) rhs.setEntry(i, b[i + 1] - a[i + 1] * b[0]);
        return new LUDecomposition(m).getSolver().solve(rhs).toArray();
    }

    private static double[] realPoly(Complex[] roots) {
        Complex[] c = new Complex[roots.length + 1];
        c[0] = Complex.ONE;
        for (int i = 1; i < c.length; i++) c[i] = Complex.ZERO;
        for (int r = 0; r < roots.length; r++) {
            for (int i = r + 1; i >= 1; i--) {
                c[i] = c[i].subtract(roots[r].multiply(c[i - 1]));
            }
        }
        double[] out = new double[c.length];
        for (int i = 0; i < c.length; i++) out[i] = c[i].getReal();
        return out;
    }

    private static double[] scaled(double[] v, double s) {
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) out[i] = v[i] * s;
        return out;
    }

    private static double[] reverse(double[] v) {
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) out[i] = v[v.length - 1 - i];
        return out;
    }
}
