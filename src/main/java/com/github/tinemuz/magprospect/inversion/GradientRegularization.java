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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * First-order Tikhonov: penalizes differences between face-adjacent cells,
 * {@code P = sum over axes of D^T D} with D the forward-difference operator.
 */
public final class GradientRegularization implements RegularizationOperator {

    @Override
    public RealMatrix penalty(RegularMesh mesh) {
        int n = mesh.cellCount();
        RealMatrix p = new Array2DRowRealMatrix(n, n);
        for (int i = 0; i < mesh.nx(); i++) {
            for (int j = 0; j < mesh.ny(); j++) {
                for (int k = 0; k < mesh.nz(); k++) {
                    int c = mesh.index(i, j, k);
                    if (i + 1 < mesh.nx()) addDifference(p, c, mesh.index(i + 1, j, k));
                    if (j + 1 < mesh.ny()) addDifference(p, c, mesh.index(i, j + 1, k));
                    if (k + 1 < mesh.nz()) addDifference(p, c, mesh.index(i, j, k + 1));
                }
            }
        }
        return p;
    }

    // d^T d for the difference row with -1 at a and +1 at b
    private static void addDifference(RealMatrix p, int a, int b) {
        p.addToEntry(a, a, 1.0);
        p.addToEntry(b, b, 1.0);
        p.addToEntry(a, b, -1.0);
        p.addToEntry(b, a, -1.0);
    }

    @Override
    public String toString() {
        return "gradient";
    }
}
