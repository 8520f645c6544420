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

import java.util.List;

/**
 * Accepted estimates of one Euler run together with the fate of every window.
 *
 * @param estimates    accepted estimates in window order
 * @param windows      windows examined
 * @param invalidInput windows skipped for an invalid sample in any input channel
 * @param degenerate   windows whose local system was singular, ill-conditioned or non-finite
 * @param outOfRange   windows whose depth fell outside {@code (0, zMax)}
 */
public record EulerSolution(
        List<SourceEstimate> estimates, int windows, int invalidInput, int degenerate, int outOfRange) {

    public EulerSolution {
        estimates = List.copyOf(estimates);
    }

    public int accepted() {
        return estimates.size();
    }

    public boolean isEmpty() {
        return estimates.isEmpty();
    }
}
