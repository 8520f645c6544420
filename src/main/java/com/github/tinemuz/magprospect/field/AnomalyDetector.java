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

import java.util.Arrays;

import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags samples that deviate from the mean by more than a number of standard
 * deviations. Invalid (non-finite) samples are skipped for the thresholds and
 * never flagged.
 */
public final class AnomalyDetector {
    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private AnomalyDetector() {}

    /**
     * Detect high and low anomalies at {@code mean +/- sigma * std}
     * (population std over the valid samples).
     *
     * @param values field samples, NaN for no data
     * @param sigma  threshold in standard deviations, positive
     */
    public static Report detect(double[] values, double sigma) {
        if (!(sigma > 0) || !Double.isFinite(sigma)) {
            throw new IllegalArgumentException("sigma must be positive and finite, got " + sigma);
        }
        double[] finite = FieldStatistics.finite(values);
        if (finite.length == 0) {
            return new Report(Double.NaN, Double.NaN, new int[0], new int[0]);
        }
        double mean = StatUtils.mean(finite);
        double std = Math.sqrt(StatUtils.populationVariance(finite));
        double upper = mean + sigma * std;
        double lower = mean - sigma * std;

        int[] high = new int[values.length];
        int[] low = new int[values.length];
        int nh = 0;
        int nl = 0;
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (!Double.isFinite(v)) continue;
            if (v > upper) high[nh++] = i;
            else if (v < lower) low[nl++] = i;
        }
        log.debug("Detected {} high and {} low anomalies at {} sigma", nh, nl, sigma);
        return new Report(upper, lower, Arrays.copyOf(high, nh), Arrays.copyOf(low, nl));
    }

    /**
     * Detection outcome.
     *
     * @param upperThreshold values above this are high anomalies
     * @param lowerThreshold values below this are low anomalies
     * @param highIndices    indices of high anomalies, ascending
     * @param lowIndices     indices of low anomalies, ascending
     */
    public record Report(double upperThreshold, double lowerThreshold, int[] highIndices, int[] lowIndices) {

        public int highCount() {
            return highIndices.length;
        }

        public int lowCount() {
            return lowIndices.length;
        }
    }
}
