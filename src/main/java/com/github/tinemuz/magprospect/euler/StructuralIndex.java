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

/**
 * Exponent of Euler's homogeneity equation, encoding the assumed source
 * geometry. The field of a source decays as {@code 1 / r^N}.
 */
public enum StructuralIndex {
    CONTACT(0),
    DIKE(1),
    CYLINDER(2),
    SPHERE(3);

    private final int index;

    StructuralIndex(int index) {
        this.index = index;
    }

    /** The exponent N. */
    public int index() {
        return index;
    }

    /**
     * Geometry for exponent {@code n}.
     *
     * @throws IllegalArgumentException if {@code n} is not 0, 1, 2 or 3
     */
    public static StructuralIndex of(int n) {
        for (StructuralIndex si : values()) {
            if (si.index == n) return si;
        }
        throw new IllegalArgumentException("structural index must be 0, 1, 2 or 3, got " + n);
    }
}
