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

import com.github.tinemuz.magprospect.EngineDefaults;
import com.github.tinemuz.magprospect.field.FieldGrid;
import com.github.tinemuz.magprospect.field.GridGeometry;
import com.github.tinemuz.magprospect.field.ObservationSeries;
import com.github.tinemuz.magprospect.field.Profile;
import java.util.Optional;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a field into a smooth regional trend and the residual anomalies.
 *
 * <p>The polynomial method fits all monomials up to degree 1, 2 or 3 in
 * coordinates normalized to {@code [0, 1]}, using valid samples only, and
 * evaluates the trend everywhere, including invalid samples. When the fit is
 * degenerate (fewer valid samples than terms, or a rank-deficient design) the
 * moving-average method is used instead and a warning is logged.</p>
 *
 * <p>The moving-average method takes the mean of the valid samples in a
 * window of about a tenth of each axis, reflecting at the ends. A window with
 * no valid sample gives an invalid trend value.</p>
 *
 * <p>Residuals are invalid wherever the observation is invalid.</p>
 */
public final class RegionalResidualSeparator {
    private static final Logger log = LoggerFactory.getLogger(RegionalResidualSeparator.class);

    static final double RANK_THRESHOLD = 1e-10;

    private RegionalResidualSeparator() {}

    // ------------------------------------------------------------------- grids

    /** Separate with {@code method}; polynomial degree from {@code regional.polynomialDegree}. */
    public static Separation<FieldGrid> separate(FieldGrid grid, TrendMethod method) {
        return switch (method) {
            case POLYNOMIAL -> polynomial(grid, EngineDefaults.getInt("regional.polynomialDegree"));
            case MOVING_AVERAGE -> movingAverage(grid);
        };
    }

    public static Separation<FieldGrid> polynomial(FieldGrid grid, int degree) {
        requireDegree(degree);
        GridGeometry g = grid.geometry();
        int n = g.size();
        double[] u = new double[n];
        double[] v = new double[n];
        for (int r = 0; r < g.ny(); r++) {
            for (int c = 0; c < g.nx(); c++) {
                int i = g.index(r, c);
                u[i] = g.nx() > 1 ? (double) c / (g.nx() - 1) : 0.0;
                v[i] = g.ny() > 1 ? (double) r / (g.ny() - 1) : 0.0;
            }
        }
        double[] observed = grid.values();
        Optional<double[]> trend = fitSurface(u, v, observed, degree);
        if (trend.isEmpty()) {
            log.warn("Polynomial trend of degree {} is degenerate for {}, using moving average", degree, grid);
            return movingAverage(grid);
        }
        return gridSeparation(g, observed, trend.get());
    }

    public static Separation<FieldGrid> movingAverage(FieldGrid grid) {
        GridGeometry g = grid.geometry();
        int nx = g.nx();
        int ny = g.ny();
        int wx = Math.max(1, nx / 10);
        int wy = Math.max(1, ny / 10);
        double[] observed = grid.values();
        double[] trend = new double[observed.length];
        for (int r = 0; r < ny; r++) {
            for (int c = 0; c < nx; c++) {
                double sum = 0.0;
                int count = 0;
                for (int dr = 0; dr < wy; dr++) {
                    int rr = reflect(r - wy / 2 + dr, ny);
                    for (int dc = 0; dc < wx; dc++) {
                        double val = observed[g.index(rr, reflect(c - wx / 2 + dc, nx))];
                        if (Double.isNaN(val)) continue;
                        sum += val;
                        count++;
                    }
                }
                trend[g.index(r, c)] = count > 0 ? sum / count : Double.NaN;
            }
        }
        return gridSeparation(g, observed, trend);
    }

    // --------------------------------------------------------------- scattered

    /**
     * Polynomial trend of scattered observations; x and y are normalized by
     * their ranges (an axis of zero range maps to 0).
     */
    public static Separation<double[]> polynomial(ObservationSeries series, int degree) {
        requireDegree(degree);
        double[] x = normalize(series.x());
        double[] y = normalize(series.y());
        double[] observed = series.values();
        for (int i = 0; i < observed.length; i++) {
            if (!series.isValid(i)) observed[i] = Double.NaN;
        }
        Optional<double[]> trend = fitSurface(x, y, observed, degree);
        if (trend.isEmpty()) {
            log.warn("Polynomial trend of degree {} is degenerate for {} observations, using moving average",
                    degree, observed.length);
            return movingAverage(observed);
        }
        return arraySeparation(observed, trend.get());
    }

    /** Moving average along the series order. */
    public static Separation<double[]> movingAverage(ObservationSeries series) {
        double[] observed = series.values();
        for (int i = 0; i < observed.length; i++) {
            if (!series.isValid(i)) observed[i] = Double.NaN;
        }
        return movingAverage(observed);
    }

    // ---------------------------------------------------------------- profiles

    public static Separation<Profile> polynomial(Profile profile, int degree) {
        requireDegree(degree);
        int n = profile.size();
        double[] observed = profile.values();
        double[] t = new double[n];
        for (int i = 0; i < n; i++) t[i] = n > 1 ? (double) i / (n - 1) : 0.0;
        Optional<double[]> trend = fit(design1d(t, degree), observed);
        if (trend.isEmpty()) {
            log.warn("Polynomial trend of degree {} is degenerate for {}, using moving average", degree, profile);
            return movingAverage(profile);
        }
        return profileSeparation(profile, arraySeparation(observed, trend.get()));
    }

    public static Separation<Profile> movingAverage(Profile profile) {
        return profileSeparation(profile, movingAverage(profile.values()));
    }

    // ----------------------------------------------------------------- helpers

    private static Separation<double[]> movingAverage(double[] observed) {
        int n = observed.length;
        int w = Math.max(1, n / 10);
        double[] trend = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            int count = 0;
            for (int k = 0; k < w; k++) {
                double val = observed[reflect(i - w / 2 + k, n)];
                if (Double.isNaN(val)) continue;
                sum += val;
                count++;
            }
            trend[i] = count > 0 ? sum / count : Double.NaN;
        }
        return arraySeparation(observed, trend);
    }

    private static Optional<double[]> fitSurface(double[] u, double[] v, double[] observed, int degree) {
        return fit(design2d(u, v, degree), observed);
    }

    /**
     * Least-squares fit of {@code observed} on the rows of {@code design}
     * whose observation is finite, evaluated on every row. Empty when the fit
     * is degenerate.
     */
    private static Optional<double[]> fit(RealMatrix design, double[] observed) {
        int terms = design.getColumnDimension();
        int valid = 0;
        for (double o : observed) if (Double.isFinite(o)) valid++;
        if (valid < terms) return Optional.empty();

        RealMatrix a = new Array2DRowRealMatrix(valid, terms);
        RealVector b = new ArrayRealVector(valid);
        int row = 0;
        for (int i = 0; i < observed.length; i++) {
            if (!Double.isFinite(observed[i])) continue;
            a.setRow(row, design.getRow(i));
            b.setEntry(row, observed[i]);
            row++;
        }
        RealVector coefficients;
        try {
            DecompositionSolver solver = new QRDecomposition(a, RANK_THRESHOLD).getSolver();
            if (!solver.isNonSingular()) return Optional.empty();
            coefficients = solver.solve(b);
        } catch (SingularMatrixException e) {
            log.debug("Trend fit is singular: {}", e.getMessage());
            return Optional.empty();
        }
        return Optional.of(design.operate(coefficients).toArray());
    }

    // Monomials u^p v^(d-p) for d = 0..degree, p = d..0
    static RealMatrix design2d(double[] u, double[] v, int degree) {
        int terms = (degree + 1) * (degree + 2) / 2;
        RealMatrix m = new Array2DRowRealMatrix(u.length, terms);
        for (int i = 0; i < u.length; i++) {
            int col = 0;
            for (int d = 0; d <= degree; d++) {
                for (int p = d; p >= 0; p--) {
                    m.setEntry(i, col++, Math.pow(u[i], p) * Math.pow(v[i], d - p));
                }
            }
        }
        return m;
    }

    private static RealMatrix design1d(double[] t, int degree) {
        RealMatrix m = new Array2DRowRealMatrix(t.length, degree + 1);
        for (int i = 0; i < t.length; i++) {
            for (int p = 0; p <= degree; p++) m.setEntry(i, p, Math.pow(t[i], p));
        }
        return m;
    }

    private static double[] normalize(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double val : values) {
            if (!Double.isFinite(val)) continue;
            min = Math.min(min, val);
            max = Math.max(max, val);
        }
        double range = max - min;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = range > 0 ? (values[i] - min) / range : 0.0;
        }
        return out;
    }

    private static Separation<FieldGrid> gridSeparation(GridGeometry g, double[] observed, double[] trend) {
        Separation<double[]> s = arraySeparation(observed, trend);
        return new Separation<>(FieldGrid.of(g, s.regional()), FieldGrid.of(g, s.residual()));
    }

    private static Separation<Profile> profileSeparation(Profile profile, Separation<double[]> s) {
        return new Separation<>(
                Profile.of(s.regional(), profile.spacing()), Profile.of(s.residual(), profile.spacing()));
    }

    private static Separation<double[]> arraySeparation(double[] observed, double[] trend) {
        double[] residual = new double[observed.length];
        for (int i = 0; i < observed.length; i++) residual[i] = observed[i] - trend[i];
        return new Separation<>(trend, residual);
    }

    private static int reflect(int i, int n) {
        int period = 2 * n;
        int j = i % period;
        if (j < 0) j += period;
        return j < n ? j : period - 1 - j;
    }

    private static void requireDegree(int degree) {
        if (degree < 1 || degree > 3) {
            throw new IllegalArgumentException("polynomial degree must be 1, 2 or 3, got " + degree);
        }
    }
}
