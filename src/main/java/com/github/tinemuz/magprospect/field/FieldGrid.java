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

import java.util.Arrays;
import java.util.BitSet;
import java.util.OptionalDouble;

/**
 * Scalar field on a regular 2D grid (row-major) with an explicit validity
 * mask. Same no-data rules as {@link Profile}: NaN, infinite or masked nodes
 * are invalid and read back as NaN, never as zero.
 */
public final class FieldGrid {
    private final GridGeometry geometry;
    private final double[] values;
    private final BitSet valid;

    private FieldGrid(GridGeometry geometry, double[] values, BitSet valid) {
        this.geometry = geometry;
        this.values = values;
        this.valid = valid;
    }

    /** Wrap row-major {@code values} (copied); length must equal {@code geometry.size()}. */
    public static FieldGrid of(GridGeometry geometry, double[] values) {
        if (values.length != geometry.size()) {
            throw new IllegalArgumentException(
                    "grid of " + geometry.nx() + "x" + geometry.ny() + " needs "
                            + geometry.size() + " values, got " + values.length);
        }
        double[] copy = values.clone();
        BitSet valid = new BitSet(copy.length);
        for (int i = 0; i < copy.length; i++) {
            if (Double.isFinite(copy[i])) valid.set(i);
            else copy[i] = Double.NaN;
        }
        return new FieldGrid(geometry, copy, valid);
    }

    /** Wrap {@code rows[row][col]}; every row must have {@code geometry.nx()} entries. */
    public static FieldGrid of(GridGeometry geometry, double[][] rows) {
        if (rows.length != geometry.ny()) {
            throw new IllegalArgumentException("expected " + geometry.ny() + " rows, got " + rows.length);
        }
        double[] flat = new double[geometry.size()];
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != geometry.nx()) {
                throw new IllegalArgumentException(
                        "row " + r + " has " + rows[r].length + " values, expected " + geometry.nx());
            }
            System.arraycopy(rows[r], 0, flat, r * geometry.nx(), geometry.nx());
        }
        return of(geometry, flat);
    }

    /** Copy of this grid with the flat indices set in {@code invalid} masked out. */
    public FieldGrid mask(BitSet invalid) {
        BitSet v = (BitSet) valid.clone();
        v.andNot(invalid);
        double[] copy = values.clone();
        for (int i = invalid.nextSetBit(0); i >= 0 && i < copy.length; i = invalid.nextSetBit(i + 1)) {
            copy[i] = Double.NaN;
        }
        return new FieldGrid(geometry, copy, v);
    }

    public GridGeometry geometry() {
        return geometry;
    }

    public int rows() {
        return geometry.ny();
    }

    public int cols() {
        return geometry.nx();
    }

    public boolean isValid(int row, int col) {
        return valid.get(geometry.index(row, col));
    }

    public OptionalDouble valueAt(int row, int col) {
        int i = geometry.index(row, col);
        return valid.get(i) ? OptionalDouble.of(values[i]) : OptionalDouble.empty();
    }

    /** Raw value at {@code (row, col)}, NaN when invalid. */
    public double get(int row, int col) {
        return values[geometry.index(row, col)];
    }

    /** Row-major values with invalid nodes reported as NaN. */
    public double[] values() {
        return values.clone();
    }

    public int validCount() {
        return valid.cardinality();
    }

    public boolean hasInvalid() {
        return valid.cardinality() < values.length;
    }

    @Override
    public String toString() {
        return "FieldGrid[" + geometry.nx() + "x" + geometry.ny() + ", valid=" + validCount() + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldGrid other)) return false;
        return geometry.equals(other.geometry) && valid.equals(other.valid) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * geometry.hashCode() + Arrays.hashCode(values);
    }
}
