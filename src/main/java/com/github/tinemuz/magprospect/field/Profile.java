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
 * Evenly spaced 1D series of field samples (a survey line or a flattened
 * series) with an explicit validity mask.
 *
 * <p>A sample is invalid when it is NaN, infinite, or masked through
 * {@link #mask(BitSet)}. Invalid samples read as NaN from {@link #values()}
 * and as empty from {@link #valueAt(int)}; they are never replaced by zero.</p>
 */
public final class Profile {
    private final double[] values;
    private final BitSet valid;
    private final double spacing;

    private Profile(double[] values, BitSet valid, double spacing) {
        this.values = values;
        this.valid = valid;
        this.spacing = spacing;
    }

    /**
     * Wrap {@code values} (copied) sampled every {@code spacing} length units.
     * Non-finite values are marked invalid.
     */
    public static Profile of(double[] values, double spacing) {
        if (!(spacing > 0) || !Double.isFinite(spacing)) {
            throw new IllegalArgumentException("spacing must be positive and finite, got " + spacing);
        }
        double[] copy = values.clone();
        BitSet valid = new BitSet(copy.length);
        for (int i = 0; i < copy.length; i++) {
            if (Double.isFinite(copy[i])) valid.set(i);
            else copy[i] = Double.NaN;
        }
        return new Profile(copy, valid, spacing);
    }

    /** Copy of this profile with the samples set in {@code invalid} masked out. */
    public Profile mask(BitSet invalid) {
        BitSet v = (BitSet) valid.clone();
        v.andNot(invalid);
        double[] copy = values.clone();
        for (int i = invalid.nextSetBit(0); i >= 0 && i < copy.length; i = invalid.nextSetBit(i + 1)) {
            copy[i] = Double.NaN;
        }
        return new Profile(copy, v, spacing);
    }

    public int size() {
        return values.length;
    }

    public double spacing() {
        return spacing;
    }

    public boolean isValid(int i) {
        return valid.get(i);
    }

    public OptionalDouble valueAt(int i) {
        return valid.get(i) ? OptionalDouble.of(values[i]) : OptionalDouble.empty();
    }

    /** Values with invalid samples reported as NaN. */
    public double[] values() {
        return values.clone();
    }

    public int validCount() {
        return valid.cardinality();
    }

    /** True when at least one sample is invalid. */
    public boolean hasInvalid() {
        return valid.cardinality() < values.length;
    }

    @Override
    public String toString() {
        return "Profile[n=" + values.length + ", spacing=" + spacing + ", valid=" + validCount() + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Profile other)) return false;
        return spacing == other.spacing && valid.equals(other.valid) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Double.hashCode(spacing);
    }
}
