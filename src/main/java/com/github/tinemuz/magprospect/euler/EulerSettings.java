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
package com.github.tinemuz.magprospect.euler;

import com.github.tinemuz.magprospect.EngineDefaults;

/**
 * Parameters of an Euler deconvolution run. Built through {@link #builder()},
 * which starts from the engine defaults.
 */
public final class EulerSettings {
    private final int windowSize;
    private final StructuralIndex structuralIndex;
    private final double zMin;
    private final double zMax;
    private final double clusterRadius;
    private final double datumElevation;
    private final double maxConditionNumber;

    private EulerSettings(Builder b) {
        this.windowSize = b.windowSize;
        this.structuralIndex = b.structuralIndex;
        this.zMin = b.zMin;
        this.zMax = b.zMax;
        this.clusterRadius = b.clusterRadius;
        this.datumElevation = b.datumElevation;
        this.maxConditionNumber = b.maxConditionNumber;
    }

    /** Settings with every value at its default. */
    public static EulerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Samples per sliding window. */
    public int windowSize() {
        return windowSize;
    }

    public StructuralIndex structuralIndex() {
        return structuralIndex;
    }

    /** Lower bound for {@link EulerDeconvolution#filterByDepth}. */
    public double zMin() {
        return zMin;
    }

    /** Exclusive upper bound on accepted depths. */
    public double zMax() {
        return zMax;
    }

    public double clusterRadius() {
        return clusterRadius;
    }

    /** Elevation used for observations that carry none. */
    public double datumElevation() {
        return datumElevation;
    }

    /** Windows whose design matrix is worse conditioned than this are dropped. */
    public double maxConditionNumber() {
        return maxConditionNumber;
    }

    @Override
    public String toString() {
        return "EulerSettings[w=" + windowSize + ", N=" + structuralIndex.index()
                + ", z=[" + zMin + ", " + zMax + "], radius=" + clusterRadius + "]";
    }

    public static final class Builder {
        private int windowSize = EngineDefaults.getInt("euler.windowSize");
        private StructuralIndex structuralIndex = StructuralIndex.of(EngineDefaults.getInt("euler.structuralIndex"));
        private double zMin = EngineDefaults.getDouble("euler.zMin");
        private double zMax = EngineDefaults.getDouble("euler.zMax");
        private double clusterRadius = EngineDefaults.getDouble("euler.clusterRadius");
        private double datumElevation = EngineDefaults.getDouble("euler.datumElevation");
        private double maxConditionNumber = EngineDefaults.getDouble("euler.maxConditionNumber");

        private Builder() {}

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder structuralIndex(StructuralIndex structuralIndex) {
            this.structuralIndex = structuralIndex;
            return this;
        }

        public Builder depthRange(double zMin, double zMax) {
            this.zMin = zMin;
            this.zMax = zMax;
            return this;
        }

        public Builder clusterRadius(double clusterRadius) {
            this.clusterRadius = clusterRadius;
            return this;
        }

        public Builder datumElevation(double datumElevation) {
            this.datumElevation = datumElevation;
            return this;
        }

        public Builder maxConditionNumber(double maxConditionNumber) {
            this.maxConditionNumber = maxConditionNumber;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the window has fewer than 4
         *     samples, the depth range is not {@code 0 <= zMin < zMax}, or a
         *     radius or threshold is not positive
         */
        public EulerSettings build() {
            if (windowSize < 4) {
                throw new IllegalArgumentException(
                        "window must hold at least 4 samples for 4 unknowns, got " + windowSize);
            }
            if (structuralIndex == null) {
                throw new IllegalArgumentException("structural index is required");
            }
            if (!(zMin >= 0) || !(zMax > zMin) || Double.isInfinite(zMax)) {
                throw new IllegalArgumentException("depth range must satisfy 0 <= zMin < zMax, got ["
                        + zMin + ", " + zMax + "]");
            }
            if (!(clusterRadius > 0)) {
                throw new IllegalArgumentException("cluster radius must be positive, got " + clusterRadius);
            }
            if (!Double.isFinite(datumElevation)) {
                throw new IllegalArgumentException("datum elevation must be finite, got " + datumElevation);
            }
            if (!(maxConditionNumber > 1)) {
                throw new IllegalArgumentException("max condition number must exceed 1, got " + maxConditionNumber);
            }
            return new EulerSettings(this);
        }
    }
}
