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

import java.util.ArrayList;
import java.util.List;

/**
 * Rectangular prism of uniform susceptibility, bounded by
 * {@code [x1, x2] x [y1, y2] x [z1, z2]} with z positive down.
 */
public record Prism(double x1, double x2, double y1, double y2, double z1, double z2, double susceptibility) {

    public Prism {
        if (!(x2 > x1) || !(y2 > y1) || !(z2 > z1)) {
            throw new IllegalArgumentException(
                    "prism bounds must be increasing: x[" + x1 + ", " + x2 + "] y[" + y1 + ", " + y2
                            + "] z[" + z1 + ", " + z2 + "]");
        }
        if (!Double.isFinite(susceptibility)) {
            throw new IllegalArgumentException("susceptibility must be finite, got " + susceptibility);
        }
    }

    public double volume() {
        return (x2 - x1) * (y2 - y1) * (z2 - z1);
    }

    /**
     * Split into {@code nx * ny * nz} equal cells, each replaced by a sphere
     * of the cell's volume at the cell centre. Order is x-major, then y, then z.
     */
    public List<Sphere> subdivide(int nx, int ny, int nz) {
        if (nx < 1 || ny < 1 || nz < 1) {
            throw new IllegalArgumentException("subdivisions must be >= 1, got " + nx + "x" + ny + "x" + nz);
        }
        double ddx = (x2 - x1) / nx;
        double ddy = (y2 - y1) / ny;
        double ddz = (z2 - z1) / nz;
        double cellVolume = ddx * ddy * ddz;
        List<Sphere> cells = new ArrayList<>(nx * ny * nz);
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                for (int k = 0; k < nz; k++) {
                    cells.add(Sphere.withVolume(
                            x1 + (i + 0.5) * ddx,
                            y1 + (j + 0.5) * ddy,
                            z1 + (k + 0.5) * ddz,
                            cellVolume,
                            susceptibility));
                }
            }
        }
        return cells;
    }
}
