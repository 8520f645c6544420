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

import com.github.tinemuz.magprospect.field.Extent;
import com.github.tinemuz.magprospect.field.FieldGrid;
import com.github.tinemuz.magprospect.field.GridGeometry;

/**
 * Gridded layer sampled by bilinear interpolation. A sample is NaN outside
 * the grid or when any of the four surrounding nodes is invalid.
 */
public final class GridLayer implements Layer {
    static final double EDGE_TOLERANCE = 1e-9;

    private final String name;
    private final FieldGrid grid;

    public GridLayer(String name, FieldGrid grid) {
        if (name == null || grid == null) {
            throw new IllegalArgumentException("layer name and grid are required");
        }
        this.name = name;
        this.grid = grid;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Extent extent() {
        return grid.geometry().extent();
    }

    public FieldGrid grid() {
        return grid;
    }

    @Override
    public double sample(double x, double y) {
        GridGeometry g = grid.geometry();
        double u = snap((x - g.originX()) / g.dx(), g.nx() - 1);
        double v = snap((y - g.originY()) / g.dy(), g.ny() - 1);
        if (!(u >= 0 && u <= g.nx() - 1 && v >= 0 && v <= g.ny() - 1)) return Double.NaN;

        int c0 = Math.min((int) Math.floor(u), Math.max(g.nx() - 2, 0));
        int r0 = Math.min((int) Math.floor(v), Math.max(g.ny() - 2, 0));
        int c1 = Math.min(c0 + 1, g.nx() - 1);
        int r1 = Math.min(r0 + 1, g.ny() - 1);
        double fx = u - c0;
        double fy = v - r0;

        double q00 = grid.get(r0, c0);
        double q01 = grid.get(r0, c1);
        double q10 = grid.get(r1, c0);
        double q11 = grid.get(r1, c1);
        if (Double.isNaN(q00) || Double.isNaN(q01) || Double.isNaN(q10) || Double.isNaN(q11)) {
            return Double.NaN;
        }
        double bottom = q00 * (1 - fx) + q01 * fx;
        double top = q10 * (1 - fx) + q11 * fx;
        return bottom * (1 - fy) + top * fy;
    }

    // absorb rounding of queries placed exactly on the outer nodes
    private static double snap(double u, int last) {
        if (u < 0 && u > -EDGE_TOLERANCE) return 0;
        if (u > last && u < last + EDGE_TOLERANCE) return last;
        return u;
    }

    @Override
    public String toString() {
        return "GridLayer[" + name + ", " + grid + "]";
    }
}
