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

import com.github.tinemuz.magprospect.EngineDefaults;
import com.github.tinemuz.magprospect.field.DerivativeChannels;
import com.github.tinemuz.magprospect.field.FieldGrid;
import com.github.tinemuz.magprospect.field.GridGeometry;
import com.github.tinemuz.magprospect.field.ObservationSeries;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthetic anomalies of simple magnetized bodies.
 *
 * <p>Bodies are spheres, or prisms approximated by sub-cell spheres. The
 * response of a sphere at separation {@code r = obs - centre} is
 * {@code C m (3 (f.r)^2 / r^5 - 1 / r^3)} with {@code C = mu0 1e9 / 4 pi = 100},
 * {@code m = V chi} and f the axis chosen by the {@link ResponseModel}. The
 * distance is floored at {@value #MIN_DISTANCE} length units.</p>
 *
 * <p>Observation elevations are z-down like depths; observations without an
 * elevation lie on {@code z = 0}. Results are in nT for an inducing field of
 * unit strength, so they are relative rather than calibrated.</p>
 */
public final class ForwardModel {
    private static final Logger log = LoggerFactory.getLogger(ForwardModel.class);

    /** {@code mu0 * 1e9 / (4 pi)}. */
    public static final double FIELD_CONSTANT = 100.0;

    static final double MIN_DISTANCE = 1.0;

    private ForwardModel() {}

    // ------------------------------------------------------------------ sphere

    public static double[] sphere(ObservationSeries points, Sphere sphere, FieldDirection direction) {
        return sphere(points, sphere, direction, ResponseModel.VERTICAL_APPROXIMATION);
    }

    public static double[] sphere(
            ObservationSeries points, Sphere sphere, FieldDirection direction, ResponseModel model) {
        return sphere(points.x(), points.y(), points.z(0.0), sphere, direction, model);
    }

    /**
     * Anomaly of {@code sphere} at each point {@code (x[i], y[i], z[i])}.
     *
     * @throws IllegalArgumentException if the coordinate arrays differ in length
     */
    public static double[] sphere(
            double[] x, double[] y, double[] z, Sphere sphere, FieldDirection direction, ResponseModel model) {
        requireSameLength(x, y, z);
        double[] axis = model.axis(direction);
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = response(x[i], y[i], z[i], sphere, axis);
        }
        return out;
    }

    /** Response of one sphere at one point, projected on unit {@code axis}. */
    static double response(double x, double y, double z, Sphere sphere, double[] axis) {
        double rx = x - sphere.x();
        double ry = y - sphere.y();
        double rz = z - sphere.z();
        double r = Math.max(Math.sqrt(rx * rx + ry * ry + rz * rz), MIN_DISTANCE);
        double s = axis[0] * rx + axis[1] * ry + axis[2] * rz;
        double r3 = r * r * r;
        return FIELD_CONSTANT * sphere.moment() * (3.0 * s * s / (r3 * r * r) - 1.0 / r3);
    }

    // ------------------------------------------------------------------- prism

    /** Prism response with the default subdivision ({@code forward.prismSubdivisions} per axis). */
    public static double[] prism(ObservationSeries points, Prism prism, FieldDirection direction) {
        int n = EngineDefaults.getInt("forward.prismSubdivisions");
        return prism(points, prism, direction, n, n, n);
    }

    public static double[] prism(
            ObservationSeries points, Prism prism, FieldDirection direction, int nx, int ny, int nz) {
        return prism(points, prism, direction, nx, ny, nz, ResponseModel.VERTICAL_APPROXIMATION);
    }

    /** Sum of the responses of the prism's sub-cell spheres. */
    public static double[] prism(
            ObservationSeries points,
            Prism prism,
            FieldDirection direction,
            int nx,
            int ny,
            int nz,
            ResponseModel model) {
        List<Sphere> cells = prism.subdivide(nx, ny, nz);
        double[] x = points.x();
        double[] y = points.y();
        double[] z = points.z(0.0);
        double[] axis = model.axis(direction);
        double[] out = new double[x.length];
        for (Sphere cell : cells) {
            for (int i = 0; i < out.length; i++) {
                out[i] += response(x[i], y[i], z[i], cell, axis);
            }
        }
        log.debug("Prism response from {} sub-cells at {} points", cells.size(), out.length);
        return out;
    }

    // ---------------------------------------------------------------- gradient

    public static DerivativeChannels gradient(ObservationSeries points, Sphere sphere, FieldDirection direction) {
        return gradient(points, sphere, direction, ResponseModel.VERTICAL_APPROXIMATION);
    }

    /**
     * Analytic spatial derivatives of the sphere response with respect to
     * the observation position; {@code dz} is along +z (down). Points closer
     * than {@link #MIN_DISTANCE} to the centre get zero derivatives.
     */
    public static DerivativeChannels gradient(
            ObservationSeries points, Sphere sphere, FieldDirection direction, ResponseModel model) {
        int n = points.size();
        double[] axis = model.axis(direction);
        double[] dx = new double[n];
        double[] dy = new double[n];
        double[] dz = new double[n];
        double cm = FIELD_CONSTANT * sphere.moment();
        for (int i = 0; i < n; i++) {
            double rx = points.x(i) - sphere.x();
            double ry = points.y(i) - sphere.y();
            double rz = points.zOrElse(i, 0.0) - sphere.z();
            double r = Math.sqrt(rx * rx + ry * ry + rz * rz);
            // response is held constant inside the distance floor
            if (r < MIN_DISTANCE) continue;
            double s = axis[0] * rx + axis[1] * ry + axis[2] * rz;
            double r2 = r * r;
            double r5 = r2 * r2 * r;
            double r7 = r5 * r2;
            double radial = -15.0 * s * s / r7 + 3.0 / r5;
            double along = 6.0 * s / r5;
            dx[i] = cm * (along * axis[0] + radial * rx);
            dy[i] = cm * (along * axis[1] + radial * ry);
            dz[i] = cm * (along * axis[2] + radial * rz);
        }
        return DerivativeChannels.of(dx, dy, dz);
    }

    // -------------------------------------------------------------------- grid

    /** Sphere response on every node of {@code geometry} at sensor elevation {@code z}. */
    public static FieldGrid grid(GridGeometry geometry, double z, Sphere sphere, FieldDirection direction) {
        return grid(geometry, z, sphere, direction, ResponseModel.VERTICAL_APPROXIMATION);
    }

    public static FieldGrid grid(
            GridGeometry geometry, double z, Sphere sphere, FieldDirection direction, ResponseModel model) {
        double[] axis = model.axis(direction);
        double[] out = new double[geometry.size()];
        for (int r = 0; r < geometry.ny(); r++) {
            for (int c = 0; c < geometry.nx(); c++) {
                out[geometry.index(r, c)] = response(geometry.x(c), geometry.y(r), z, sphere, axis);
            }
        }
        return FieldGrid.of(geometry, out);
    }

    private static void requireSameLength(double[] x, double[] y, double[] z) {
        if (x.length != y.length || x.length != z.length) {
            throw new IllegalArgumentException(
                    "coordinate lengths differ: x=" + x.length + ", y=" + y.length + ", z=" + z.length);
        }
    }
}
