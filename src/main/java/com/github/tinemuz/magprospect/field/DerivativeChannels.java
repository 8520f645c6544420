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

/**
 * Spatial derivative channels of a field, one entry per observation.
 * {@code dz} is taken along +z, which points down.
 */
public final class DerivativeChannels {
    private final double[] dx;
    private final double[] dy;
    private final double[] dz;

    private DerivativeChannels(double[] dx, double[] dy, double[] dz) {
        this.dx = dx;
        this.dy = dy;
        this.dz = dz;
    }

    /** Copy the three channels; all must have the same length. */
    public static DerivativeChannels of(double[] dx, double[] dy, double[] dz) {
        if (dx.length != dy.length || dx.length != dz.length) {
            throw new IllegalArgumentException(
                    "derivative channel lengths differ: dx=" + dx.length
                            + ", dy=" + dy.length + ", dz=" + dz.length);
        }
        return new DerivativeChannels(dx.clone(), dy.clone(), dz.clone());
    }

    public int size() {
        return dx.length;
    }

    public double dx(int i) {
        return dx[i];
    }

    public double dy(int i) {
        return dy[i];
    }

    public double dz(int i) {
        return dz[i];
    }

    public double[] dx() {
        return dx.clone();
    }

    public double[] dy() {
        return dy.clone();
    }

    public double[] dz() {
        return dz.clone();
    }

    /** True when all three derivatives of sample {@code i} are finite. */
    public boolean isValid(int i) {
        return Double.isFinite(dx[i]) && Double.isFinite(dy[i]) && Double.isFinite(dz[i]);
    }
}
