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

import com.github.tinemuz.magprospect.field.ObservationSeries;
import com.github.tinemuz.magprospect.forward.FieldDirection;
import java.util.Locale;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Damped least-squares susceptibility inversion.
 *
 * <p>Solves {@code (G^T G + alpha P) m = G^T d} directly by Cholesky
 * decomposition, where G is the {@link SensitivityMatrix} of the mesh and P
 * the configured {@link RegularizationOperator}. The dense system costs
 * {@code O(nObs nCells)} to assemble and {@code O(nCells^3)} to solve; the
 * memory it needs is checked against the configured limit before anything
 * is allocated.</p>
 */
public final class SusceptibilityInversion {
    private static final Logger log = LoggerFactory.getLogger(SusceptibilityInversion.class);

    private SusceptibilityInversion() {}

    /**
     * Invert {@code observations} for cell susceptibilities.
     *
     * @throws IllegalArgumentException         if there are no observations or any is invalid
     * @throws ConfigurationTooLargeException if the dense system exceeds {@code maxMatrixBytes}
     * @throws InversionException               if the regularized system cannot be solved
     */
    public static SusceptibilityModel invert(
            ObservationSeries observations, FieldDirection direction, InversionConfig config) {
        int nObs = observations.size();
        if (nObs == 0) {
            throw new IllegalArgumentException("inversion needs at least one observation");
        }
        int bad = observations.invalidCount();
        if (bad > 0) {
            throw new IllegalArgumentException(
                    "inversion needs valid observations; " + bad + " of " + nObs + " are invalid");
        }
        checkSize(nObs, config);

        RegularMesh mesh = RegularMesh.over(observations, config);
        log.debug("Assembling {}x{} sensitivity matrix for {}", nObs, mesh.cellCount(), mesh);
        SensitivityMatrix g = SensitivityMatrix.assemble(observations, mesh, direction, config.responseModel());

        double[] data = observations.values();
        RealMatrix system = g.normalMatrix().add(config.regularization().penalty(mesh).scalarMultiply(config.alpha()));
        RealVector rhs = new ArrayRealVector(g.transposeMultiply(data), false);

        double[] m;
        try {
            m = new CholeskyDecomposition(
                            system, CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD, 0.0)
                    .getSolver()
                    .solve(rhs)
                    .toArray();
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            throw new InversionException(
                    "regularized normal equations are not positive definite (alpha=" + config.alpha()
                            + ", " + config.regularization() + ")", e);
        }
        for (double v : m) {
            if (!Double.isFinite(v)) {
                throw new InversionException("inversion produced non-finite susceptibilities (alpha="
                        + config.alpha() + ")");
            }
        }

        SusceptibilityModel model = new SusceptibilityModel(mesh, m, data, g.multiply(m), config.alpha());
        log.info("Inverted {} observations into {} cells: alpha={}, rms={}",
                nObs, mesh.cellCount(), config.alpha(), model.rms());
        return model;
    }

    /**
     * Bytes of the dense sensitivity matrix plus the normal, penalty and
     * system matrices; {@link Long#MAX_VALUE} when that does not fit a long.
     */
    static long estimateBytes(long nObs, long nCells) {
        try {
            long kernel = Math.multiplyExact(nObs, nCells);
            long square = Math.multiplyExact(3L, Math.multiplyExact(nCells, nCells));
            return Math.multiplyExact(8L, Math.addExact(kernel, square));
        } catch (ArithmeticException e) {
            log.debug("Dense system of {} x {} overflows a byte count", nObs, nCells);
            return Long.MAX_VALUE;
        }
    }

    /** Assembly plus Cholesky operation count at {@code flopsPerSecond}. */
    static double estimateSeconds(long nObs, long nCells, double flopsPerSecond) {
        double n = nCells;
        return (nObs * n * n + n * n * n / 3.0) / flopsPerSecond;
    }

    private static void checkSize(int nObs, InversionConfig config) {
        long cells = config.cellCount();
        long bytes = estimateBytes(nObs, cells);
        if (bytes > config.maxMatrixBytes()) {
            double seconds = estimateSeconds(nObs, cells, config.flopsPerSecond());
            throw new ConfigurationTooLargeException(
                    String.format(Locale.ROOT,
                            "mesh of %d cells with %d observations needs about %.1f MiB (limit %.1f MiB)"
                                    + " and about %.1f s; reduce nx, ny or nz",
                            cells, nObs, bytes / 1048576.0, config.maxMatrixBytes() / 1048576.0, seconds),
                    bytes,
                    seconds);
        }
    }
}
