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
 * Source position solved from one Euler window.
 *
 * @param x0              source easting
 * @param y0              source northing
 * @param z0              source depth, positive down, in {@code (0, zMax)}
 * @param baseLevel       regional background B of the window, in field units; solved from
 *                        {@code x0 Tx + y0 Ty + z0 Tz + N B = x Tx + y Ty + z Tz + N T}, so
 *                        it has the same sign as the field it offsets (a
 *                        {@code -N} column convention would report {@code -B})
 * @param residualNorm    {@code ||A sol - b||} of the window's least-squares fit
 * @param nPoints         samples in the window
 * @param structuralIndex index the window was solved with
 */
public record SourceEstimate(
        double x0,
        double y0,
        double z0,
        double baseLevel,
        double residualNorm,
        int nPoints,
        StructuralIndex structuralIndex) {

    /** Euclidean distance between the two source positions. */
    public double distanceTo(SourceEstimate other) {
        double dx = x0 - other.x0;
        double dy = y0 - other.y0;
        double dz = z0 - other.z0;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
