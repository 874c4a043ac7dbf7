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

package com.github.tinemuz.meeus.orbit;

/**
 * Thrown when an iterative solution does not reach the requested accuracy
 * within its iteration limit.
 */
public class NonConvergenceException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int iterations;
    private final double lastCorrection;

    public NonConvergenceException(String message, int iterations, double lastCorrection) {
        super(message + " (after " + iterations + " iterations, last correction " + lastCorrection + ")");
        this.iterations = iterations;
        this.lastCorrection = lastCorrection;
    }

    /** Number of iterations performed before giving up. */
    public int getIterations() {
        return iterations;
    }

    /** Magnitude of the last correction applied. */
    public double getLastCorrection() {
        return lastCorrection;
    }
}
