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

/** Choice of scalar response for a magnetized sphere. */
public enum ResponseModel {
    /**
     * {@code C m (3 cos^2(theta) - 1) / r^3} with theta measured from
     * vertical. Ignores the field direction; an approximation of the
     * total-field anomaly.
     */
    VERTICAL_APPROXIMATION,

    /**
     * Induced dipole projected on the field direction f:
     * {@code C m (3 (f.r)^2 / r^5 - 1 / r^3)}.
     */
    TOTAL_FIELD_DIPOLE;

    /** Unit direction the response is projected on. */
    double[] axis(FieldDirection direction) {
        return this == VERTICAL_APPROXIMATION ? new double[] {0.0, 0.0, 1.0} : direction.unitVector();
    }
}
