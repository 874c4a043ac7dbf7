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

package com.github.tinemuz.meeus.planet;

/**
 * Sizes of minor planets (Meeus, chapter 56).
 */
public final class Asteroids {

    private Asteroids() {}

    /**
     * True diameter from absolute magnitude and albedo:
     * log D = 3.12 - H/5 - 0.5 log A.
     *
     * @param absoluteMagnitude H
     * @param albedo            geometric albedo, in (0, 1]
     * @return diameter in km
     */
    public static double diameterKm(double absoluteMagnitude, double albedo) {
        if (!(albedo > 0.0 && albedo <= 1.0)) {
            throw new IllegalArgumentException("albedo must be in (0, 1]: " + albedo);
        }
        return Math.pow(10.0, 3.12 - absoluteMagnitude / 5.0 - 0.5 * Math.log10(albedo));
    }

    /**
     * Apparent diameter.
     *
     * @param diameterKm true diameter, km
     * @param distance   distance from the Earth, AU
     * @return arcseconds
     */
    public static double apparentDiameter(double diameterKm, double distance) {
        if (!(distance > 0.0)) {
            throw new IllegalArgumentException("distance must be positive: " + distance);
        }
        return 1.3788 * diameterKm / distance;
    }
}
