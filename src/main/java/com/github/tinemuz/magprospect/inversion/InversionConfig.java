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
package com.github.tinemuz.magprospect.inversion;

import com.github.tinemuz.magprospect.EngineDefaults;
import com.github.tinemuz.magprospect.forward.ResponseModel;

/**
 * Mesh and solver settings of a susceptibility inversion. Built through
 * {@link #builder()}, which starts from the engine defaults.
 */
public final class InversionConfig {
    private final int nx;
    private final int ny;
    private final int nz;
    private final double dx;
    private final double dy;
    private final double dz;
    private final double zTop;
    private final double alpha;
    private final int maxIterations;
    private final RegularizationOperator regularization;
    private final ResponseModel responseModel;
    private final long maxMatrixBytes;
    private final double flopsPerSecond;

    private InversionConfig(Builder b) {
        this.nx = b.nx;
        this.ny = b.ny;
        this.nz = b.nz;
        this.dx = b.dx;
        this.dy = b.dy;
        this.dz = b.dz;
        this.zTop = b.zTop;
        this.alpha = b.alpha;
        this.maxIterations = b.maxIterations;
        this.regularization = b.regularization;
        this.responseModel = b.responseModel;
        this.maxMatrixBytes = b.maxMatrixBytes;
        this.flopsPerSecond = b.flopsPerSecond;
    }

    public static InversionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .cells(nx, ny, nz)
                .cellSize(dx, dy, dz)
                .zTop(zTop)
                .alpha(alpha)
                .maxIterations(maxIterations)
                .regularization(regularization)
                .responseModel(responseModel)
                .maxMatrixBytes(maxMatrixBytes)
                .flopsPerSecond(flopsPerSecond);
    }

    public int nx() {
        return nx;
    }

    public int ny() {
        return ny;
    }

    public int nz() {
        return nz;
    }

    public double dx() {
        return dx;
    }

    public double dy() {
        return dy;
    }

    public double dz() {
        return dz;
    }

    /** Depth of the top of the mesh, positive down. */
    public double zTop() {
        return zTop;
    }

    /** Damping weight of the penalty term. */
    public double alpha() {
        return alpha;
    }

    /** Reserved for iterative solvers; the direct solver does not iterate. */
    public int maxIterations() {
        return maxIterations;
    }

    public RegularizationOperator regularization() {
        return regularization;
    }

    public ResponseModel responseModel() {
        return responseModel;
    }

    public long maxMatrixBytes() {
        return maxMatrixBytes;
    }

    public double flopsPerSecond() {
        return flopsPerSecond;
    }

    public int cellCount() {
        return nx * ny * nz;
    }

    @Override
    public String toString() {
        return "InversionConfig[" + nx + "x" + ny + "x" + nz + " cells of " + dx + "x" + dy + "x" + dz
                + ", zTop=" + zTop + ", alpha=" + alpha + ", " + regularization + "]";
    }

    public static final class Builder {
        private int nx = EngineDefaults.getInt("inversion.nx");
        private int ny = EngineDefaults.getInt("inversion.ny");
        private int nz = EngineDefaults.getInt("inversion.nz");
        private double dx = EngineDefaults.getDouble("inversion.dx");
        private double dy = EngineDefaults.getDouble("inversion.dy");
        private double dz = EngineDefaults.getDouble("inversion.dz");
        private double zTop = EngineDefaults.getDouble("inversion.zTop");
        private double alpha = EngineDefaults.getDouble("inversion.alpha");
        private int maxIterations = EngineDefaults.getInt("inversion.maxIterations");
        private RegularizationOperator regularization = new IdentityRegularization();
        private ResponseModel responseModel = ResponseModel.VERTICAL_APPROXIMATION;
        private long maxMatrixBytes = EngineDefaults.getLong("inversion.maxMatrixBytes");
        private double flopsPerSecond = EngineDefaults.getDouble("inversion.flopsPerSecond");

        private Builder() {}

        public Builder cells(int nx, int ny, int nz) {
            this.nx = nx;
            this.ny = ny;
            this.nz = nz;
            return this;
        }

        public Builder cellSize(double dx, double dy, double dz) {
            this.dx = dx;
            this.dy = dy;
            this.dz = dz;
            return this;
        }

        public Builder zTop(double zTop) {
            this.zTop = zTop;
            return this;
        }

        public Builder alpha(double alpha) {
            this.alpha = alpha;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder regularization(RegularizationOperator regularization) {
            this.regularization = regularization;
            return this;
        }

        public Builder responseModel(ResponseModel responseModel) {
            this.responseModel = responseModel;
            return this;
        }

        public Builder maxMatrixBytes(long maxMatrixBytes) {
            this.maxMatrixBytes = maxMatrixBytes;
            return this;
        }

        public Builder flopsPerSecond(double flopsPerSecond) {
            this.flopsPerSecond = flopsPerSecond;
            return this;
        }

        /**
         * @throws IllegalArgumentException on non-positive mesh dimensions or
         *     cell sizes, a negative or non-finite alpha, a non-positive
         *     iteration count, or a missing operator
         */
        public InversionConfig build() {
            if (nx < 1 || ny < 1 || nz < 1) {
                throw new IllegalArgumentException(
                        "mesh dimensions must be positive, got " + nx + "x" + ny + "x" + nz);
            }
            if ((long) nx * ny * nz > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("mesh has too many cells: " + nx + "x" + ny + "x" + nz);
            }
            if (!(dx > 0) || !(dy > 0) || !(dz > 0)
                    || Double.isInfinite(dx) || Double.isInfinite(dy) || Double.isInfinite(dz)) {
                throw new IllegalArgumentException(
                        "cell sizes must be positive and finite, got " + dx + ", " + dy + ", " + dz);
            }
            if (!Double.isFinite(zTop)) {
                throw new IllegalArgumentException("zTop must be finite, got " + zTop);
            }
            if (!(alpha >= 0) || Double.isInfinite(alpha)) {
                throw new IllegalArgumentException("alpha must be finite and >= 0, got " + alpha);
            }
            if (maxIterations < 1) {
                throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
            }
            if (regularization == null || responseModel == null) {
                throw new IllegalArgumentException("regularization and response model are required");
            }
            if (maxMatrixBytes < 1 || !(flopsPerSecond > 0)) {
                throw new IllegalArgumentException("memory limit and throughput must be positive");
            }
            return new InversionConfig(this);
        }
    }
}
