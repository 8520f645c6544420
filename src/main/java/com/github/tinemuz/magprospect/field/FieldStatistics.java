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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Summary statistics over the valid (finite) entries of a value array.
 * Percentiles use linear interpolation between order statistics (R-7);
 * {@code std} is the population standard deviation.
 *
 * <p>When no entry is valid, every statistic except the counts is NaN.</p>
 */
public record FieldStatistics(
        int total,
        int valid,
        double min,
        double max,
        double mean,
        double median,
        double std,
        double percentile25,
        double percentile75) {

    public static FieldStatistics of(double[] values) {
        double[] finite = finite(values);
        if (finite.length == 0) {
            return new FieldStatistics(
                    values.length, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                    Double.NaN, Double.NaN, Double.NaN);
        }
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(finite);
        return new FieldStatistics(
                values.length,
                finite.length,
                StatUtils.min(finite),
                StatUtils.max(finite),
                StatUtils.mean(finite),
                percentile.evaluate(50.0),
                Math.sqrt(StatUtils.populationVariance(finite)),
                percentile.evaluate(25.0),
                percentile.evaluate(75.0));
    }

    public static FieldStatistics of(Profile profile) {
        return of(profile.values());
    }

    public static FieldStatistics of(FieldGrid grid) {
        return of(grid.values());
    }

    /** Number of non-finite entries. */
    public int invalid() {
        return total - valid;
    }

    public double range() {
        return max - min;
    }

    /**
     * Root-mean-square difference between {@code observed} and
     * {@code predicted}, over pairs where both are finite.
     */
    public static double rms(double[] observed, double[] predicted) {
        if (observed.length != predicted.length) {
            throw new IllegalArgumentException(
                    "length mismatch: observed=" + observed.length + ", predicted=" + predicted.length);
        }
        double sum = 0.0;
        int n = 0;
        for (int i = 0; i < observed.length; i++) {
            double d = observed[i] - predicted[i];
            if (!Double.isFinite(d)) continue;
            sum += d * d;
            n++;
        }
        return n == 0 ? Double.NaN : Math.sqrt(sum / n);
    }

    static double[] finite(double[] values) {
        int n = 0;
        for (double v : values) if (Double.isFinite(v)) n++;
        double[] out = new double[n];
        int j = 0;
        for (double v : values) if (Double.isFinite(v)) out[j++] = v;
        return out;
    }
}
