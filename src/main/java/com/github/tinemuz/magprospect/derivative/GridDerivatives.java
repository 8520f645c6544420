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
package com.github.tinemuz.magprospect.derivative;

import com.github.tinemuz.magprospect.field.FieldGrid;

/**
 * Standard derivative products of one grid, all on the input geometry.
 *
 * @param dx             derivative along +x (Sobel)
 * @param dy             derivative along +y (Sobel)
 * @param totalHorizontal total horizontal gradient
 * @param dz             Laplacian vertical-derivative surrogate
 * @param tilt           tilt angle in radians
 * @param analyticSignal analytic signal amplitude
 */
public record GridDerivatives(
        FieldGrid dx,
        FieldGrid dy,
        FieldGrid totalHorizontal,
        FieldGrid dz,
        FieldGrid tilt,
        FieldGrid analyticSignal) {

    /** Tilt angle converted to degrees. */
    public FieldGrid tiltDegrees() {
        return DerivativeSuite.toDegrees(tilt);
    }
}
