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
 * Second-order Tikhonov: {@code P = L^T L} with L the 7-point discrete
 * Laplacian. Boundary cells use only their existing neighbours (zero-flux
 * boundary), so a constant model has no penalty.
 */
public final class LaplacianRegularization implements RegularizationOperator {

    @Override
    public RealMatrix penalty(RegularMesh mesh) {
        int n = mesh.cellCount();
        RealMatrix p = new Array2DRowRealMatrix(n, n);
        int[] support = new int[7];
        double[] weight = new double[7];
        for (int i = 0; i < mesh.nx(); i++) {
            for (int j = 0; j < mesh.ny(); j++) {
                for (int k = 0; k < mesh.nz(); k++) {
                    int m = 1;
                    if (i > 0) support[m++] = mesh.index(i - 1, j, k);
                    if (i + 1 < mesh.nx()) support[m++] = mesh.index(i + 1, j, k);
                    if (j > 0) support[m++] = mesh.index(i, j - 1, k);
                    if (j + 1 < mesh.ny()) support[m++] = mesh.index(i, j + 1, k);
                    if (k > 0) support[m++] = mesh.index(i, j, k - 1);
                    if (k + 1 < mesh.nz()) support[m++] = mesh.index(i, j, k + 1);
                    support[0] = mesh.index(i, j, k);
                    weight[0] = -(m - 1);
                    for (int s = 1; s < m; s++) weight[s] = 1.0;

                    // accumulate the outer product of this Laplacian row
                    for (int a = 0; a < m; a++) {
                        for (int b = 0; b < m; b++) {
                            p.addToEntry(support[a], support[b], weight[a] * weight[b]);
                        }
                    }
                }
            }
        }
        return p;
    }

    @Override
    public String toString() {
        return "laplacian";
    }
}
