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

import com.github.tinemuz.magprospect.EngineDefaults;
import com.github.tinemuz.magprospect.field.Extent;
import com.github.tinemuz.magprospect.field.ObservationSeries;

/**
 * Point layer sampled by inverse-distance weighting over all valid points.
 * A query that coincides with a point returns that point's value.
 */
public final class ScatteredLayer implements Layer {
    static final double EXACT_HIT = 1e-12;

    private final String name;
    private final double[] x;
    private final double[] y;
    private final double[] values;
    private final double power;
    private final Extent extent;

    /** Layer with the default weighting power ({@code prospectivity.idwPower}). */
    public ScatteredLayer(String name, ObservationSeries points) {
        this(name, points, EngineDefaults.getDouble("prospectivity.idwPower"));
    }

    /**
     * @throws IllegalArgumentException if there is no valid point or the power is not positive
     */
    public ScatteredLayer(String name, ObservationSeries points, double power) {
        if (name == null) {
            throw new IllegalArgumentException("layer name is required");
        }
        if (!(power > 0)) {
            throw new IllegalArgumentException("IDW power must be positive, got " + power);
        }
        int n = points.size() - points.invalidCount();
        if (n == 0) {
            throw new IllegalArgumentException("layer '" + name + "' has no valid points");
        }
        this.name = name;
        this.power = power;
        this.x = new double[n];
        this.y = new double[n];
        this.values = new double[n];
        int k = 0;
        for (int i = 0; i < points.size(); i++) {
            if (!points.isValid(i)) continue;
            x[k] = points.x(i);
            y[k] = points.y(i);
            values[k] = points.value(i);
            k++;
        }
        this.extent = Extent.of(x, y);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Extent extent() {
        return extent;
    }

    @Override
    public double sample(double qx, double qy) {
        double weights = 0.0;
        double acc = 0.0;
        for (int i = 0; i < values.length; i++) {
            double dx = qx - x[i];
            double dy = qy - y[i];
            double d = Math.sqrt(dx * dx + dy * dy);
            if (d < EXACT_HIT) return values[i];
            double w = Math.pow(d, -power);
            weights += w;
            acc += w * values[i];
        }
        return acc / weights;
    }

    @Override
    public String toString() {
        return "ScatteredLayer[" + name + ", " + values.length + " points]";
    }
}
