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

import com.github.tinemuz.magprospect.field.Extent;
import com.github.tinemuz.magprospect.field.ObservationSeries;

/**
 * Regular 3D mesh of the inversion domain. Cell {@code (i, j, k)} has flat
 * index {@code (i * ny + j) * nz + k}; i runs along x, j along y and k down.
 */
public final class RegularMesh {
    private final int nx;
    private final int ny;
    private final int nz;
    private final double dx;
    private final double dy;
    private final double dz;
    private final double zTop;
    private final double[] xCenters;
    private final double[] yCenters;
    private final double[] zCenters;

    private RegularMesh(InversionConfig config, double[] xCenters, double[] yCenters, double[] zCenters) {
        this.nx = config.nx();
        this.ny = config.ny();
        this.nz = config.nz();
        this.dx = config.dx();
        this.dy = config.dy();
        this.dz = config.dz();
        this.zTop = config.zTop();
        this.xCenters = xCenters;
        this.yCenters = yCenters;
        this.zCenters = zCenters;
    }

    /**
     * Mesh whose horizontal cell centres span the observation bounds evenly
     * (a single centre sits at the midpoint) and whose layers start at
     * {@code zTop}, centred at {@code zTop + (k + 0.5) dz}.
     */
    public static RegularMesh over(ObservationSeries observations, InversionConfig config) {
        Extent bounds = observations.extent();
        double[] z = new double[config.nz()];
        for (int k = 0; k < z.length; k++) z[k] = config.zTop() + (k + 0.5) * config.dz();
        return new RegularMesh(
                config,
                linspace(bounds.minX(), bounds.maxX(), config.nx()),
                linspace(bounds.minY(), bounds.maxY(), config.ny()),
                z);
    }

    static double[] linspace(double from, double to, int n) {
        double[] out = new double[n];
        if (n == 1) {
            out[0] = 0.5 * (from + to);
            return out;
        }
        double step = (to - from) / (n - 1);
        for (int i = 0; i < n; i++) out[i] = from + i * step;
        out[n - 1] = to;
        return out;
    }

    public int nx() {
        return nx;
    }

    public int ny() {
        return ny;
    }

    public int nz() {
        return nz;
    }

    public double dx() {
        return dx;
    }

    public double dy() {
        return dy;
    }

    public double dz() {
        return dz;
    }

    public double zTop() {
        return zTop;
    }

    public int cellCount() {
        return nx * ny * nz;
    }

    public double cellVolume() {
        return dx * dy * dz;
    }

    public int index(int i, int j, int k) {
        return (i * ny + j) * nz + k;
    }

    public double xCenter(int cell) {
        return xCenters[cell / (ny * nz)];
    }

    public double yCenter(int cell) {
        return yCenters[(cell / nz) % ny];
    }

    public double zCenter(int cell) {
        return zCenters[cell % nz];
    }

    public double[] xCenters() {
        return xCenters.clone();
    }

    public double[] yCenters() {
        return yCenters.clone();
    }

    public double[] zCenters() {
        return zCenters.clone();
    }

    @Override
    public String toString() {
        return "RegularMesh[" + nx + "x" + ny + "x" + nz + ", zTop=" + zTop + "]";
    }
}
