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
package com.github.tinemuz.magprospect.prospectivity;

import java.util.Arrays;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Rescaling of layer values. NaN entries are left out of every statistic and
 * stay NaN in the output. A constant input maps to 0 where it is valid.
 */
public final class Normalization {

    private Normalization() {}

    /** Linear map of {@code [min, max]} onto {@code [0, 1]}. */
    public static double[] minMax(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (Double.isNaN(v)) continue;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return rescale(values, min, max);
    }

    /** Standard score using the population standard deviation. */
    public static double[] zScore(double[] values) {
        double[] finite = finite(values);
        double[] out = new double[values.length];
        if (finite.length == 0) {
            Arrays.fill(out, Double.NaN);
            return out;
        }
        double mean = StatUtils.mean(finite);
        double std = Math.sqrt(StatUtils.populationVariance(finite));
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (Double.isNaN(v)) out[i] = Double.NaN;
            else out[i] = std > 0 ? (v - mean) / std : 0.0;
        }
        return out;
    }

    /**
     * Clip to the {@code low} and {@code high} percentiles (0 to 100, linear
     * interpolation between order statistics) and map that band onto
     * {@code [0, 1]}. Damps the influence of outliers on the scale.
     */
    public static double[] percentileClip(double[] values, double low, double high) {
        if (!(low >= 0 && low < high && high <= 100)) {
            throw new IllegalArgumentException("percentiles must satisfy 0 <= low < high <= 100, got "
                    + low + ", " + high);
        }
        double[] finite = finite(values);
        if (finite.length == 0) {
            double[] out = new double[values.length];
            Arrays.fill(out, Double.NaN);
            return out;
        }
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(finite);
        // Percentile rejects p == 0
        double lo = low == 0 ? StatUtils.min(finite) : percentile.evaluate(low);
        double hi = percentile.evaluate(high);
        double[] clipped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            clipped[i] = Double.isNaN(v) ? Double.NaN : Math.min(Math.max(v, lo), hi);
        }
        return rescale(clipped, lo, hi);
    }

    private static double[] rescale(double[] values, double min, double max) {
        double[] out = new double[values.length];
        double range = max - min;
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (Double.isNaN(v)) out[i] = Double.NaN;
            else out[i] = range > 0 ? (v - min) / range : 0.0;
        }
        return out;
    }

    private static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }
}
