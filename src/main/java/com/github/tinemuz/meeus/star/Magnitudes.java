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

package com.github.tinemuz.meeus.star;

/**
 * Stellar magnitude arithmetic (Meeus, chapter 56).
 */
public final class Magnitudes {
    private Magnitudes() {}

    /** Combined magnitude of two stars seen as one. */
    public static double combined(double m1, double m2) {
        return m2 - 2.5 * Math.log10(brightnessRatio(m1, m2) + 1.0);
    }

    /**
     * Combined magnitude of several stars.
     *
     * @throws IllegalArgumentException if no magnitude is given
     */
    public static double combined(double... magnitudes) {
        if (magnitudes == null || magnitudes.length == 0) {
            throw new IllegalArgumentException("At least one magnitude is required");
        }
        double sum = 0.0;
        for (double m : magnitudes) {
            sum += Math.pow(10.0, -0.4 * m);
        }
        return -2.5 * Math.log10(sum);
    }

    /** How many times brighter a star of magnitude m1 is than one of m2. */
    public static double brightnessRatio(double m1, double m2) {
        return Math.pow(10.0, 0.4 * (m2 - m1));
    }

    /**
     * Magnitude difference corresponding to a brightness ratio.
     *
     * @throws IllegalArgumentException if the ratio is not positive
     */
    public static double difference(double brightnessRatio) {
        if (!(brightnessRatio > 0.0)) {
            throw new IllegalArgumentException("Brightness ratio must be positive: " + brightnessRatio);
        }
        return 2.5 * Math.log10(brightnessRatio);
    }

    /**
     * Absolute magnitude from the annual parallax.
     *
     * @param parallax          parallax in radians
     * @param apparentMagnitude apparent magnitude
     */
    public static double absoluteFromParallax(double parallax, double apparentMagnitude) {
        if (!(parallax > 0.0)) {
            throw new IllegalArgumentException("Parallax must be positive: " + parallax);
        }
        double arcsec = Math.toDegrees(parallax) * 3600.0;
        return apparentMagnitude + 5.0 + 5.0 * Math.log10(arcsec);
    }

    /**
     * Absolute magnitude from the distance.
     *
     * @param distance          distance in parsecs
     * @param apparentMagnitude apparent magnitude
     */
    public static double absoluteFromDistance(double distance, double apparentMagnitude) {
        if (!(distance > 0.0)) {
            throw new IllegalArgumentException("Distance must be positive: " + distance);
        }
        return apparentMagnitude + 5.0 - 5.0 * Math.log10(distance);
    }
}
