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
package com.github.tinemuz.magprospect.forward;

import com.github.tinemuz.magprospect.EngineDefaults;

/**
 * Direction of the inducing geomagnetic field.
 *
 * @param inclinationDeg angle below horizontal, degrees, in [-90, 90]
 * @param declinationDeg angle east of north (+x), degrees
 */
public record FieldDirection(double inclinationDeg, double declinationDeg) {

    public FieldDirection {
        if (!Double.isFinite(inclinationDeg) || inclinationDeg < -90.0 || inclinationDeg > 90.0) {
            throw new IllegalArgumentException("inclination must be in [-90, 90], got " + inclinationDeg);
        }
        if (!Double.isFinite(declinationDeg)) {
            throw new IllegalArgumentException("declination must be finite, got " + declinationDeg);
        }
    }

    /** Direction from {@code forward.inclination} and {@code forward.declination} defaults. */
    public static FieldDirection defaults() {
        return new FieldDirection(
                EngineDefaults.getDouble("forward.inclination"),
                EngineDefaults.getDouble("forward.declination"));
    }

    /** Unit vector {@code (cos I cos D, cos I sin D, sin I)} in the (x, y, z-down) frame. */
    public double[] unitVector() {
        double inc = Math.toRadians(inclinationDeg);
        double dec = Math.toRadians(declinationDeg);
        return new double[] {
            Math.cos(inc) * Math.cos(dec),
            Math.cos(inc) * Math.sin(dec),
            Math.sin(inc)
        };
    }
}
