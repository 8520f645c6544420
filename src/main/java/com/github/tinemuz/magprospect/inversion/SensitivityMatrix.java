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

import com.github.tinemuz.magprospect.Parallel;
import com.github.tinemuz.magprospect.field.ObservationSeries;
import com.github.tinemuz.magprospect.forward.FieldDirection;
import com.github.tinemuz.magprospect.forward.ForwardModel;
import com.github.tinemuz.magprospect.forward.ResponseModel;
import com.github.tinemuz.magprospect.forward.Sphere;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Dense {@code nObs x nCells} kernel G: entry {@code (i, j)} is the response
 * at observation i of cell j with unit susceptibility, modelled as a sphere
 * of the cell's volume at the cell centre. Stored by column.
 */
public final class SensitivityMatrix {
    private final double[][] columns;
    private final int rows;

    private SensitivityMatrix(double[][] columns, int rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /** Assemble G, one column per cell, columns in parallel. */
    public static SensitivityMatrix assemble(
            ObservationSeries observations, RegularMesh mesh, FieldDirection direction, ResponseModel model) {
        double[] x = observations.x();
        double[] y = observations.y();
        double[] z = observations.z(0.0);
        double volume = mesh.cellVolume();
        double[][] columns = new double[mesh.cellCount()][];
        Parallel.forEachIndex(columns.length, j -> {
            Sphere cell = Sphere.withVolume(mesh.xCenter(j), mesh.yCenter(j), mesh.zCenter(j), volume, 1.0);
            columns[j] = ForwardModel.sphere(x, y, z, cell, direction, model);
        });
        return new SensitivityMatrix(columns, x.length);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns.length;
    }

    public double entry(int observation, int cell) {
        return columns[cell][observation];
    }

    public double[] column(int cell) {
        return columns[cell].clone();
    }

    /** {@code G m}. */
    public double[] multiply(double[] model) {
        double[] out = new double[rows];
        for (int j = 0; j < columns.length; j++) {
            double mj = model[j];
            if (mj == 0.0) continue;
            double[] col = columns[j];
            for (int i = 0; i < rows; i++) out[i] += col[i] * mj;
        }
        return out;
    }

    /** {@code G^T d}. */
    public double[] transposeMultiply(double[] data) {
        double[] out = new double[columns.length];
        for (int j = 0; j < columns.length; j++) out[j] = dot(columns[j], data);
        return out;
    }

    /** {@code G^T G}, upper triangle computed in parallel and mirrored. */
    public RealMatrix normalMatrix() {
        int n = columns.length;
        double[][] g = new double[n][n];
        Parallel.forEachIndex(n, a -> {
            for (int b = a; b < n; b++) g[a][b] = dot(columns[a], columns[b]);
        });
        for (int a = 0; a < n; a++) {
            for (int b = 0; b < a; b++) g[a][b] = g[b][a];
        }
        return new Array2DRowRealMatrix(g, false);
    }

    private static double dot(double[] p, double[] q) {
        double sum = 0.0;
        for (int i = 0; i < p.length; i++) sum += p[i] * q[i];
        return sum;
    }
}
