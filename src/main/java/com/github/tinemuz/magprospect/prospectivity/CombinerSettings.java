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

/** Weights and common-grid resolution of a prospectivity combination. */
public final class CombinerSettings {
    private final double magneticWeight;
    private final double indicatorWeight;
    private final int nx;
    private final int ny;

    private CombinerSettings(Builder b) {
        this.magneticWeight = b.magneticWeight;
        this.indicatorWeight = b.indicatorWeight;
        this.nx = b.nx;
        this.ny = b.ny;
    }

    public static CombinerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double magneticWeight() {
        return magneticWeight;
    }

    public double indicatorWeight() {
        return indicatorWeight;
    }

    public int nx() {
        return nx;
    }

    public int ny() {
        return ny;
    }

    public static final class Builder {
        private double magneticWeight = EngineDefaults.getDouble("prospectivity.magneticWeight");
        private double indicatorWeight = EngineDefaults.getDouble("prospectivity.indicatorWeight");
        private int nx = EngineDefaults.getInt("prospectivity.gridNx");
        private int ny = EngineDefaults.getInt("prospectivity.gridNy");

        private Builder() {}

        public Builder weights(double magnetic, double indicator) {
            this.magneticWeight = magnetic;
            this.indicatorWeight = indicator;
            return this;
        }

        public Builder resolution(int nx, int ny) {
            this.nx = nx;
            this.ny = ny;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a weight is negative, both are
         *     zero, or the grid has fewer than 2 nodes along an axis
         */
        public CombinerSettings build() {
            if (!(magneticWeight >= 0) || !(indicatorWeight >= 0)
                    || Double.isInfinite(magneticWeight) || Double.isInfinite(indicatorWeight)) {
                throw new IllegalArgumentException(
                        "weights must be finite and >= 0, got " + magneticWeight + ", " + indicatorWeight);
            }
            if (!(magneticWeight + indicatorWeight > 0)) {
                throw new IllegalArgumentException("weights must not both be zero");
            }
            if (nx < 2 || ny < 2) {
                throw new IllegalArgumentException("common grid needs at least 2x2 nodes, got " + nx + "x" + ny);
            }
            return new CombinerSettings(this);
        }
    }
}
