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

package com.github.tinemuz.meeus.interpolation;

import com.github.tinemuz.meeus.orbit.NonConvergenceException;

/**
 * Interpolation in tables of equidistant values (Meeus, chapter 3).
 *
 * <p>The interpolating factor n is measured in table intervals from the
 * central value, so n = 0 returns the central value and n = ±1 its
 * neighbours.</p>
 */
public final class Interpolation {
    private static final int MAX_ITERATIONS = 50;
    private static final double ZERO_TOLERANCE = 1e-12;

    private Interpolation() {}

    /**
     * Interpolate from three consecutive values.
     *
     * @param y1 first value
     * @param y2 central value
     * @param y3 third value
     * @param n  interpolating factor, best kept within [-1, 1]
     */
    public static double threeValues(double y1, double y2, double y3, double n) {
        double a = y2 - y1;
        double b = y3 - y2;
        double c = b - a;
        return y2 + n / 2.0 * (a + b + n * c);
    }

    /**
     * Interpolate from five consecutive values, centered on {@code y3}.
     */
    public static double fiveValues(double y1, double y2, double y3, double y4, double y5, double n) {
        double a = y2 - y1;
        double b = y3 - y2;
        double c = y4 - y3;
        double d = y5 - y4;
        double e = b - a;
        double f = c - b;
        double g = d - c;
        double h = f - e;
        double j = g - f;
        double k = j - h;
        double n2 = n * n;
        return y3 + n / 2.0 * (b + c) + n2 / 2.0 * f + n * (n2 - 1.0) / 12.0 * (h + j)
                + n2 * (n2 - 1.0) / 24.0 * k;
    }

    /**
     * Extreme value of the parabola through three values.
     *
     * @return {y<sub>m</sub>, n<sub>m</sub>}: the extremum and where it occurs
     * @throws IllegalArgumentException if the values lie on a straight line
     */
    public static double[] extremumOfThree(double y1, double y2, double y3) {
        double a = y2 - y1;
        double b = y3 - y2;
        double c = b - a;
        if (c == 0.0) {
            throw new IllegalArgumentException("Values are collinear; there is no extremum");
        }
        return new double[] {y2 - (a + b) * (a + b) / (8.0 * c), -(a + b) / (2.0 * c)};
    }

    /**
     * Interpolating factor at which the parabola through three values
     * crosses zero, found by iteration from n = 0.
     *
     * @throws NonConvergenceException if the iteration does not settle
     */
    public static double zeroOfThree(double y1, double y2, double y3) {
        double a = y2 - y1;
        double b = y3 - y2;
        double c = b - a;
        double n = 0.0;
        double correction = Double.NaN;
        for (int i = 1; i <= MAX_ITERATIONS; i++) {
            double next = -2.0 * y2 / (a + b + c * n);
            correction = Math.abs(next - n);
            n = next;
            if (correction < ZERO_TOLERANCE) {
                return n;
            }
        }
        throw new NonConvergenceException("Zero of interpolating parabola not found", MAX_ITERATIONS, correction);
    }
}
