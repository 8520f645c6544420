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
 * Geometry of a regular 2D grid. Node {@code (row, col)} sits at
 * {@code x = originX + col * dx}, {@code y = originY + row * dy}; rows run
 * along +y and columns along +x.
 *
 * @param originX x of column 0
 * @param originY y of row 0
 * @param dx      column spacing, positive
 * @param dy      row spacing, positive
 * @param nx      number of columns
 * @param ny      number of rows
 */
public record GridGeometry(double originX, double originY, double dx, double dy, int nx, int ny) {

    public GridGeometry {
        if (nx < 1 || ny < 1) {
            throw new IllegalArgumentException("grid needs at least one row and column, got " + nx + "x" + ny);
        }
        if (!(dx > 0) || !(dy > 0) || !Double.isFinite(dx) || !Double.isFinite(dy)) {
            throw new IllegalArgumentException("grid spacing must be positive and finite, got " + dx + ", " + dy);
        }
        if (!Double.isFinite(originX) || !Double.isFinite(originY)) {
            throw new IllegalArgumentException("grid origin must be finite");
        }
    }

    /**
     * Grid with {@code nx} by {@code ny} nodes spanning {@code extent} edge to
     * edge (the first and last nodes lie on the extent boundary).
     */
    public static GridGeometry spanning(Extent extent, int nx, int ny) {
        if (nx < 2 || ny < 2) {
            throw new IllegalArgumentException("spanning grid needs at least 2x2 nodes, got " + nx + "x" + ny);
        }
        if (extent.isEmpty()) {
            throw new IllegalArgumentException("cannot span an empty extent: " + extent);
        }
        return new GridGeometry(
                extent.minX(),
                extent.minY(),
                extent.width() / (nx - 1),
                extent.height() / (ny - 1),
                nx,
                ny);
    }

    public double x(int col) {
        return originX + col * dx;
    }

    public double y(int row) {
        return originY + row * dy;
    }

    /** Total number of nodes. */
    public int size() {
        return nx * ny;
    }

    /** Row-major flat index of {@code (row, col)}. */
    public int index(int row, int col) {
        return row * nx + col;
    }

    public Extent extent() {
        return new Extent(originX, originY, x(nx - 1), y(ny - 1));
    }
}
