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

import java.util.OptionalDouble;

/**
 * One scalar field measurement.
 *
 * @param x     easting
 * @param y     northing
 * @param z     elevation of the sensor, positive down like depths; empty means
 *              the measurement lies on the datum surface
 * @param value field value (typically total magnetic intensity in nT)
 */
public record Observation(double x, double y, OptionalDouble z, double value) {

    public Observation {
        if (z == null) {
            throw new IllegalArgumentException("z must be an OptionalDouble, use OptionalDouble.empty()");
        }
    }

    /** Observation on the datum surface. */
    public static Observation at(double x, double y, double value) {
        return new Observation(x, y, OptionalDouble.empty(), value);
    }

    /** Observation at an explicit sensor elevation {@code z}. */
    public static Observation at(double x, double y, double z, double value) {
        return new Observation(x, y, OptionalDouble.of(z), value);
    }

    /** True when coordinates, value and (if present) z are all finite. */
    public boolean isValid() {
        return Double.isFinite(x)
                && Double.isFinite(y)
                && Double.isFinite(value)
                && (z.isEmpty() || Double.isFinite(z.getAsDouble()));
    }
}
