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

package com.github.tinemuz.meeus.reduction;

/**
 * Parallactic angle: the angle at the body between the directions to the
 * zenith and to the celestial pole (Meeus, chapter 14).
 */
public final class ParallacticAngle {

    private ParallacticAngle() {}

    /**
     * Parallactic angle q. Negative before and positive after the meridian
     * transit.
     *
     * @param hourAngle   local hour angle H
     * @param declination δ
     * @param latitude    observer's latitude φ
     * @return q in radians, in (-π, π]
     */
    public static double of(double hourAngle, double declination, double latitude) {
        return Math.atan2(Math.sin(hourAngle),
                Math.tan(latitude) * Math.cos(declination) - Math.sin(declination) * Math.cos(hourAngle));
    }

    /**
     * Parallactic angle when the body is on the horizon.
     *
     * @throws IllegalArgumentException if the body never reaches the horizon
     */
    public static double onHorizon(double declination, double latitude) {
        double c = Math.sin(latitude) / Math.cos(declination);
        if (Math.abs(c) > 1.0) {
            throw new IllegalArgumentException("Body never reaches the horizon at this latitude");
        }
        return Math.acos(c);
    }
}
