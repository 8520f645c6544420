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

/**
 * Thrown before allocation when a mesh would need a dense system larger than
 * the configured memory limit.
 */
public class ConfigurationTooLargeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final long estimatedBytes;
    private final double estimatedSeconds;

    public ConfigurationTooLargeException(String message, long estimatedBytes, double estimatedSeconds) {
        super(message);
        this.estimatedBytes = estimatedBytes;
        this.estimatedSeconds = estimatedSeconds;
    }

    /** Memory the dense sensitivity and normal matrices would take. */
    public long estimatedBytes() {
        return estimatedBytes;
    }

    /** Rough assembly plus solve time at the configured throughput. */
    public double estimatedSeconds() {
        return estimatedSeconds;
    }
}
