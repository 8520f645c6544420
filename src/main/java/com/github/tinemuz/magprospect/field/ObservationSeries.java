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
package com.github.tinemuz.magprospect.field;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Ordered, read-only collection of {@link Observation}s sharing one
 * coordinate reference, optionally annotated with derivative channels.
 *
 * <p>Instances are assembled once (through {@link #builder()} or
 * {@link #of(double[], double[], double[])}) and never change afterwards;
 * {@link #withDerivatives(DerivativeChannels)} returns a new series.</p>
 */
public final class ObservationSeries {
    private final double[] x;
    private final double[] y;
    private final double[] z; // NaN where the observation has no elevation
    private final boolean[] hasZ;
    private final double[] values;
    private final DerivativeChannels derivatives;

    private ObservationSeries(
            double[] x, double[] y, double[] z, boolean[] hasZ, double[] values, DerivativeChannels derivatives) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.hasZ = hasZ;
        this.values = values;
        this.derivatives = derivatives;
    }

    /** Series of surface observations from parallel arrays (copied). */
    public static ObservationSeries of(double[] x, double[] y, double[] values) {
        requireSameLength(x.length, y.length, "y");
        requireSameLength(x.length, values.length, "values");
        double[] z = new double[x.length];
        Arrays.fill(z, Double.NaN);
        return new ObservationSeries(x.clone(), y.clone(), z, new boolean[x.length], values.clone(), null);
    }

    /** Series of observations at explicit elevations {@code z} (copied). */
    public static ObservationSeries of(double[] x, double[] y, double[] z, double[] values) {
        requireSameLength(x.length, y.length, "y");
        requireSameLength(x.length, z.length, "z");
        requireSameLength(x.length, values.length, "values");
        boolean[] hasZ = new boolean[x.length];
        Arrays.fill(hasZ, true);
        return new ObservationSeries(x.clone(), y.clone(), z.clone(), hasZ, values.clone(), null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Same observations annotated with {@code channels}; lengths must match. */
    public ObservationSeries withDerivatives(DerivativeChannels channels) {
        requireSameLength(x.length, channels.size(), "derivative channels");
        return new ObservationSeries(x, y, z, hasZ, values, channels);
    }

    public int size() {
        return x.length;
    }

    public Observation get(int i) {
        return new Observation(x[i], y[i], hasZ[i] ? OptionalDouble.of(z[i]) : OptionalDouble.empty(), values[i]);
    }

    public double x(int i) {
        return x[i];
    }

    public double y(int i) {
        return y[i];
    }

    /** Sensor elevation of observation {@code i}, or {@code datum} when it has none. */
    public double zOrElse(int i, double datum) {
        return hasZ[i] ? z[i] : datum;
    }

    public double value(int i) {
        return values[i];
    }

    public double[] x() {
        return x.clone();
    }

    public double[] y() {
        return y.clone();
    }

    /** Elevations with observations lacking one reported as {@code datum}. */
    public double[] z(double datum) {
        double[] out = new double[x.length];
        for (int i = 0; i < out.length; i++) out[i] = zOrElse(i, datum);
        return out;
    }

    public double[] values() {
        return values.clone();
    }

    public Optional<DerivativeChannels> derivatives() {
        return Optional.ofNullable(derivatives);
    }

    /**
     * True when observation {@code i} is usable: finite coordinates, value and
     * elevation, and finite derivatives when channels are attached.
     */
    public boolean isValid(int i) {
        boolean ok = Double.isFinite(x[i])
                && Double.isFinite(y[i])
                && Double.isFinite(values[i])
                && (!hasZ[i] || Double.isFinite(z[i]));
        return ok && (derivatives == null || derivatives.isValid(i));
    }

    public int invalidCount() {
        int bad = 0;
        for (int i = 0; i < x.length; i++) if (!isValid(i)) bad++;
        return bad;
    }

    public Extent extent() {
        return Extent.of(x, y);
    }

    private static void requireSameLength(int expected, int actual, String what) {
        if (expected != actual) {
            throw new IllegalArgumentException(
                    "length mismatch: " + what + " has " + actual + " entries, expected " + expected);
        }
    }

    /** Accumulates observations in order. */
    public static final class Builder {
        private final List<Observation> observations = new ArrayList<>();

        private Builder() {}

        public Builder add(Observation observation) {
            observations.add(observation);
            return this;
        }

        public Builder add(double x, double y, double value) {
            return add(Observation.at(x, y, value));
        }

        public ObservationSeries build() {
            int n = observations.size();
            double[] x = new double[n];
            double[] y = new double[n];
            double[] z = new double[n];
            boolean[] hasZ = new boolean[n];
            double[] values = new double[n];
            for (int i = 0; i < n; i++) {
                Observation o = observations.get(i);
                x[i] = o.x();
                y[i] = o.y();
                hasZ[i] = o.z().isPresent();
                z[i] = hasZ[i] ? o.z().getAsDouble() : Double.NaN;
                values[i] = o.value();
            }
            return new ObservationSeries(x, y, z, hasZ, values, null);
        }
    }
}
