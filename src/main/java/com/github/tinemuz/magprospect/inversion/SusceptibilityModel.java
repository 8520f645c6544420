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

import com.github.tinemuz.magprospect.field.FieldStatistics;

/**
 * Solved cell susceptibilities of one inversion run with their fit
 * diagnostics. Immutable; array accessors return copies.
 */
public final class SusceptibilityModel {
    private final RegularMesh mesh;
    private final double[] values;
    private final double[] observed;
    private final double[] predicted;
    private final double alpha;

    SusceptibilityModel(RegularMesh mesh, double[] values, double[] observed, double[] predicted, double alpha) {
        this.mesh = mesh;
        this.values = values;
        this.observed = observed;
        this.predicted = predicted;
        this.alpha = alpha;
    }

    public RegularMesh mesh() {
        return mesh;
    }

    /** Damping weight the model was solved with. */
    public double alpha() {
        return alpha;
    }

    /** Susceptibility of every cell by flat index. */
    public double[] values() {
        return values.clone();
    }

    public double get(int i, int j, int k) {
        return values[mesh.index(i, j, k)];
    }

    /** Susceptibilities reshaped to {@code [nx][ny][nz]}. */
    public double[][][] values3d() {
        double[][][] out = new double[mesh.nx()][mesh.ny()][mesh.nz()];
        for (int i = 0; i < mesh.nx(); i++) {
            for (int j = 0; j < mesh.ny(); j++) {
                for (int k = 0; k < mesh.nz(); k++) out[i][j][k] = get(i, j, k);
            }
        }
        return out;
    }

    /** Predicted data {@code G m}. */
    public double[] predicted() {
        return predicted.clone();
    }

    /** Residuals {@code d - G m}. */
    public double[] residuals() {
        double[] r = new double[observed.length];
        for (int i = 0; i < r.length; i++) r[i] = observed[i] - predicted[i];
        return r;
    }

    /** Root-mean-square of the residuals. */
    public double rms() {
        return FieldStatistics.rms(observed, predicted);
    }

    /** Euclidean norm of the model. */
    public double l2Norm() {
        double sum = 0.0;
        for (double v : values) sum += v * v;
        return Math.sqrt(sum);
    }

    /** Sum of absolute differences between face-adjacent cells. */
    public double totalVariation() {
        double tv = 0.0;
        for (int i = 0; i < mesh.nx(); i++) {
            for (int j = 0; j < mesh.ny(); j++) {
                for (int k = 0; k < mesh.nz(); k++) {
                    double v = get(i, j, k);
                    if (i + 1 < mesh.nx()) tv += Math.abs(get(i + 1, j, k) - v);
                    if (j + 1 < mesh.ny()) tv += Math.abs(get(i, j + 1, k) - v);
                    if (k + 1 < mesh.nz()) tv += Math.abs(get(i, j, k + 1) - v);
                }
            }
        }
        return tv;
    }

    @Override
    public String toString() {
        return "SusceptibilityModel[" + mesh + ", alpha=" + alpha + ", rms=" + rms() + "]";
    }
}
