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

import com.github.tinemuz.magprospect.EngineDefaults;
import com.github.tinemuz.magprospect.field.FieldGrid;
import com.github.tinemuz.magprospect.field.GridGeometry;
import com.github.tinemuz.magprospect.field.Profile;
import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derivative and filter transforms of potential-field profiles and grids.
 *
 * <p>All operations return a new {@link Profile} or {@link FieldGrid} of the
 * input shape. Invalid samples are handled by one of two policies:</p>
 * <ul>
 *   <li>stencil operations (finite differences, Sobel, Laplacian) propagate:
 *       an output sample is invalid when its stencil touches an invalid
 *       sample;</li>
 *   <li>spectral operations (FFT derivative, upward continuation, Butterworth)
 *       need a complete series: any invalid input makes the whole output
 *       invalid and a warning is logged.</li>
 * </ul>
 *
 * <p>Vertical derivatives are taken along +z (down). Units are input units
 * per length unit of the spacing.</p>
 */
public final class DerivativeSuite {
    private static final Logger log = LoggerFactory.getLogger(DerivativeSuite.class);

    /** Floor on the horizontal gradient in the tilt-angle denominator. */
    static final double TILT_EPSILON = 1e-10;

    private DerivativeSuite() {}

    // ---------------------------------------------------------------- profiles

    /**
     * Horizontal derivative by central differences, one-sided at the ends,
     * scaled by the spacing.
     */
    public static Profile horizontalDerivative(Profile profile) {
        int n = profile.size();
        if (n < 2) {
            throw new IllegalArgumentException("horizontal derivative needs at least 2 samples, got " + n);
        }
        double[] v = profile.values();
        double h = profile.spacing();
        double[] out = new double[n];
        out[0] = (v[1] - v[0]) / h;
        out[n - 1] = (v[n - 1] - v[n - 2]) / h;
        for (int i = 1; i < n - 1; i++) {
            out[i] = (v[i + 1] - v[i - 1]) / (2.0 * h);
        }
        return Profile.of(out, h);
    }

    /** Total horizontal gradient of a profile: {@code |dT/dx|}. */
    public static Profile totalHorizontalGradient(Profile profile) {
        double[] d = horizontalDerivative(profile).values();
        for (int i = 0; i < d.length; i++) d[i] = Math.abs(d[i]);
        return Profile.of(d, profile.spacing());
    }

    /**
     * Vertical derivative of order {@code order} by the spectral method:
     * the spectrum is multiplied by {@code (2 pi i k)^order}.
     */
    public static Profile verticalDerivative(Profile profile, int order) {
        if (order < 1) {
            throw new IllegalArgumentException("derivative order must be >= 1, got " + order);
        }
        if (incomplete(profile, "vertical derivative")) return invalidLike(profile);
        double[] out = Spectral.filter(profile.values(), profile.spacing(), k -> {
            Complex base = new Complex(0.0, 2.0 * Math.PI * k);
            Complex p = Complex.ONE;
            for (int i = 0; i < order; i++) p = p.multiply(base);
            return p;
        });
        return Profile.of(out, profile.spacing());
    }

    /** First-order vertical derivative. */
    public static Profile verticalDerivative(Profile profile) {
        return verticalDerivative(profile, 1);
    }

    /** Tilt angle {@code atan2(dT/dz, |dT/dx|)} in radians. */
    public static Profile tiltAngle(Profile profile) {
        double[] thg = totalHorizontalGradient(profile).values();
        double[] dz = verticalDerivative(profile).values();
        double[] out = new double[thg.length];
        for (int i = 0; i < out.length; i++) out[i] = tilt(dz[i], thg[i]);
        return Profile.of(out, profile.spacing());
    }

    /** Analytic signal {@code sqrt(dx^2 + dz^2)} of a profile. */
    public static Profile analyticSignal(Profile profile) {
        double[] dx = horizontalDerivative(profile).values();
        double[] dz = verticalDerivative(profile).values();
        double[] out = new double[dx.length];
        for (int i = 0; i < out.length; i++) out[i] = Math.sqrt(dx[i] * dx[i] + dz[i] * dz[i]);
        return Profile.of(out, profile.spacing());
    }

    /**
     * Continue the field upward by {@code height} length units, attenuating
     * wavenumber {@code k} by {@code exp(-2 pi |k| h)}.
     */
    public static Profile upwardContinuation(Profile profile, double height) {
        requireHeight(height);
        if (incomplete(profile, "upward continuation")) return invalidLike(profile);
        double[] out = Spectral.filter(
                profile.values(), profile.spacing(), k -> new Complex(Math.exp(-2.0 * Math.PI * Math.abs(k) * height)));
        return Profile.of(out, profile.spacing());
    }

    /** High-pass at the {@code filter.highPassCutoff} default. */
    public static Profile highPass(Profile profile) {
        return highPass(profile, EngineDefaults.getDouble("filter.highPassCutoff"));
    }

    /** Low-pass at the {@code filter.lowPassCutoff} default. */
    public static Profile lowPass(Profile profile) {
        return lowPass(profile, EngineDefaults.getDouble("filter.lowPassCutoff"));
    }

    /** Residual band: 4th-order zero-phase Butterworth high-pass. */
    public static Profile highPass(Profile profile, double cutoff) {
        return butterworth(profile, ButterworthFilter.highPass(cutoff), "high-pass");
    }

    /** Regional band: 4th-order zero-phase Butterworth low-pass. */
    public static Profile lowPass(Profile profile, double cutoff) {
        return butterworth(profile, ButterworthFilter.lowPass(cutoff), "low-pass");
    }

    private static Profile butterworth(Profile profile, ButterworthFilter filter, String what) {
        if (incomplete(profile, what)) return invalidLike(profile);
        return Profile.of(filter.filtfilt(profile.values()), profile.spacing());
    }

    // ------------------------------------------------------------------- grids

    /** Derivative along +x with a normalized 3x3 Sobel operator. */
    public static FieldGrid horizontalDerivativeX(FieldGrid grid) {
        return sobel(grid, true);
    }

    /** Derivative along +y with a normalized 3x3 Sobel operator. */
    public static FieldGrid horizontalDerivativeY(FieldGrid grid) {
        return sobel(grid, false);
    }

    /** {@code sqrt(dx^2 + dy^2)}. */
    public static FieldGrid totalHorizontalGradient(FieldGrid grid) {
        return hypot(horizontalDerivativeX(grid), horizontalDerivativeY(grid));
    }

    /**
     * First-order vertical derivative surrogate {@code -lap(T) / 2} using the
     * 5-point Laplacian scaled by the grid spacing, in the same units as the
     * Sobel derivatives. This is an approximation; use
     * {@link #verticalDerivative(Profile, int)} on lines for the spectral form.
     */
    public static FieldGrid verticalDerivative(FieldGrid grid) {
        GridGeometry g = grid.geometry();
        int nx = g.nx();
        int ny = g.ny();
        double[] v = grid.values();
        double dx2 = g.dx() * g.dx();
        double dy2 = g.dy() * g.dy();
        double[] out = new double[v.length];
        Arrays.fill(out, Double.NaN);
        for (int r = 1; r < ny - 1; r++) {
            for (int c = 1; c < nx - 1; c++) {
                int i = g.index(r, c);
                double lap = (v[i - 1] + v[i + 1] - 2.0 * v[i]) / dx2
                        + (v[i - nx] + v[i + nx] - 2.0 * v[i]) / dy2;
                out[i] = -lap / 2.0;
            }
        }
        return FieldGrid.of(g, out);
    }

    /** Tilt angle in radians. */
    public static FieldGrid tiltAngle(FieldGrid grid) {
        return tiltOf(totalHorizontalGradient(grid), verticalDerivative(grid));
    }

    /** Analytic signal {@code sqrt(dx^2 + dy^2 + dz^2)}. */
    public static FieldGrid analyticSignal(FieldGrid grid) {
        return analyticOf(horizontalDerivativeX(grid), horizontalDerivativeY(grid), verticalDerivative(grid));
    }

    /**
     * Horizontal derivative along {@code azimuthDeg}, measured clockwise from
     * +y (north): 0 is +y, 90 is +x.
     */
    public static FieldGrid directionalDerivative(FieldGrid grid, double azimuthDeg) {
        double theta = Math.toRadians(90.0 - azimuthDeg);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        double[] gx = horizontalDerivativeX(grid).values();
        double[] gy = horizontalDerivativeY(grid).values();
        double[] out = new double[gx.length];
        for (int i = 0; i < out.length; i++) out[i] = gx[i] * cos + gy[i] * sin;
        return FieldGrid.of(grid.geometry(), out);
    }

    /** Upward continuation of a grid by {@code height} length units. */
    public static FieldGrid upwardContinuation(FieldGrid grid, double height) {
        requireHeight(height);
        GridGeometry g = grid.geometry();
        if (grid.hasInvalid()) {
            log.warn("upward continuation: grid has {} invalid nodes, output is invalid",
                    g.size() - grid.validCount());
            return invalidLike(grid);
        }
        double[] out = Spectral.filter2D(grid.values(), g.nx(), g.ny(), g.dx(), g.dy(), (kx, ky) -> {
            double k = Math.sqrt(kx * kx + ky * ky);
            return new Complex(Math.exp(-2.0 * Math.PI * k * height));
        });
        return FieldGrid.of(g, out);
    }

    /** All standard derivative products in one pass. */
    public static GridDerivatives compute(FieldGrid grid) {
        FieldGrid dx = horizontalDerivativeX(grid);
        FieldGrid dy = horizontalDerivativeY(grid);
        FieldGrid thg = hypot(dx, dy);
        FieldGrid dz = verticalDerivative(grid);
        log.debug("Computed derivative suite for {}", grid);
        return new GridDerivatives(dx, dy, thg, dz, tiltOf(thg, dz), analyticOf(dx, dy, dz));
    }

    /** Element-wise radians to degrees. */
    public static FieldGrid toDegrees(FieldGrid radians) {
        double[] v = radians.values();
        for (int i = 0; i < v.length; i++) v[i] = FastMath.toDegrees(v[i]);
        return FieldGrid.of(radians.geometry(), v);
    }

    /** Element-wise radians to degrees. */
    public static Profile toDegrees(Profile radians) {
        double[] v = radians.values();
        for (int i = 0; i < v.length; i++) v[i] = FastMath.toDegrees(v[i]);
        return Profile.of(v, radians.spacing());
    }

    // ----------------------------------------------------------------- helpers

    private static FieldGrid sobel(FieldGrid grid, boolean alongX) {
        GridGeometry g = grid.geometry();
        int nx = g.nx();
        int ny = g.ny();
        double h = alongX ? g.dx() : g.dy();
        double[] v = grid.values();
        double[] out = new double[v.length];
        Arrays.fill(out, Double.NaN);
        for (int r = 1; r < ny - 1; r++) {
            for (int c = 1; c < nx - 1; c++) {
                int i = g.index(r, c);
                // the centre column or row has zero weight but still invalidates the output
                if (Double.isNaN(v[i - nx]) || Double.isNaN(v[i]) || Double.isNaN(v[i + nx])
                        || Double.isNaN(v[i - 1]) || Double.isNaN(v[i + 1])) {
                    continue;
                }
                double s;
                if (alongX) {
                    s = (v[i - nx + 1] + 2.0 * v[i + 1] + v[i + nx + 1])
                            - (v[i - nx - 1] + 2.0 * v[i - 1] + v[i + nx - 1]);
                } else {
                    s = (v[i + nx - 1] + 2.0 * v[i + nx] + v[i + nx + 1])
                            - (v[i - nx - 1] + 2.0 * v[i - nx] + v[i - nx + 1]);
                }
                out[i] = s / (8.0 * h);
            }
        }
        return FieldGrid.of(g, out);
    }

    private static FieldGrid hypot(FieldGrid a, FieldGrid b) {
        double[] x = a.values();
        double[] y = b.values();
        double[] out = new double[x.length];
        for (int i = 0; i < out.length; i++) out[i] = Math.sqrt(x[i] * x[i] + y[i] * y[i]);
        return FieldGrid.of(a.geometry(), out);
    }

    private static FieldGrid tiltOf(FieldGrid thg, FieldGrid dz) {
        double[] h = thg.values();
        double[] z = dz.values();
        double[] out = new double[h.length];
        for (int i = 0; i < out.length; i++) out[i] = tilt(z[i], h[i]);
        return FieldGrid.of(thg.geometry(), out);
    }

    private static FieldGrid analyticOf(FieldGrid dx, FieldGrid dy, FieldGrid dz) {
        double[] x = dx.values();
        double[] y = dy.values();
        double[] z = dz.values();
        double[] out = new double[x.length];
        for (int i = 0; i < out.length; i++) out[i] = Math.sqrt(x[i] * x[i] + y[i] * y[i] + z[i] * z[i]);
        return FieldGrid.of(dx.geometry(), out);
    }

    private static double tilt(double dz, double thg) {
        // NaN must survive Math.max
        if (Double.isNaN(dz) || Double.isNaN(thg)) return Double.NaN;
        return Math.atan2(dz, Math.max(thg, TILT_EPSILON));
    }

    private static boolean incomplete(Profile profile, String what) {
        if (!profile.hasInvalid()) return false;
        log.warn("{}: profile has {} invalid samples, output is invalid",
                what, profile.size() - profile.validCount());
        return true;
    }

    private static Profile invalidLike(Profile profile) {
        double[] nan = new double[profile.size()];
        Arrays.fill(nan, Double.NaN);
        return Profile.of(nan, profile.spacing());
    }

    private static FieldGrid invalidLike(FieldGrid grid) {
        double[] nan = new double[grid.geometry().size()];
        Arrays.fill(nan, Double.NaN);
        return FieldGrid.of(grid.geometry(), nan);
    }

    private static void requireHeight(double height) {
        if (!(height >= 0) || !Double.isFinite(height)) {
            throw new IllegalArgumentException("continuation height must be finite and >= 0, got " + height);
        }
    }
}
