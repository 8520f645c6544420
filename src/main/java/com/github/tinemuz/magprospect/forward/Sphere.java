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

/**
 * Uniformly magnetized sphere.
 *
 * @param x              centre easting
 * @param y              centre northing
 * @param z              centre depth, positive down
 * @param radius         radius, positive
 * @param susceptibility volume susceptibility (SI)
 */
public record Sphere(double x, double y, double z, double radius, double susceptibility) {

    public Sphere {
        if (!(radius > 0) || !Double.isFinite(radius)) {
            throw new IllegalArgumentException("radius must be positive and finite, got " + radius);
        }
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z) || !Double.isFinite(susceptibility)) {
            throw new IllegalArgumentException("sphere parameters must be finite");
        }
    }

    /** Sphere of the given {@code volume} centred at {@code (x, y, z)}. */
    public static Sphere withVolume(double x, double y, double z, double volume, double susceptibility) {
        if (!(volume > 0)) {
            throw new IllegalArgumentException("volume must be positive, got " + volume);
        }
        return new Sphere(x, y, z, Math.cbrt(3.0 * volume / (4.0 * Math.PI)), susceptibility);
    }

    public double volume() {
        return 4.0 / 3.0 * Math.PI * radius * radius * radius;
    }

    /** Induced moment {@code V * chi}, before the field constant. */
    public double moment() {
        return volume() * susceptibility;
    }
}
