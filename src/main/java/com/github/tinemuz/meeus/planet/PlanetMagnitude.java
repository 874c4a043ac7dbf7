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
 * Apparent visual magnitudes of planets (Meeus, chapter 41).
 */
public final class PlanetMagnitude {

    private PlanetMagnitude() {}

    /**
     * Saturn, including its rings, by G. Müller's formula.
     *
     * @param radiusVector  distance from the Sun, AU
     * @param distance      distance from the Earth, AU
     * @param deltaU        difference between the Saturnicentric longitudes
     *                      of the Sun and the Earth in the ring plane, radians
     * @param ringLatitude  Saturnicentric latitude B of the Earth, radians
     */
    public static double saturnMuller(double radiusVector, double distance, double deltaU, double ringLatitude) {
        return -8.68 + saturnTerms(radiusVector, distance, deltaU, ringLatitude);
    }

    /** Saturn, including its rings, by the Astronomical Almanac formula of 1984. */
    public static double saturn1984(double radiusVector, double distance, double deltaU, double ringLatitude) {
        return -8.88 + saturnTerms(radiusVector, distance, deltaU, ringLatitude);
    }

    /** Pluto by the Astronomical Almanac formula of 1984. */
    public static double pluto1984(double radiusVector, double distance) {
        return Pluto.magnitude(radiusVector, distance);
    }

    private static double saturnTerms(double r, double delta, double deltaU, double b) {
        double sinB = Math.sin(b);
        return 5.0 * Math.log10(r * delta)
                + 0.044 * Math.abs(Math.toDegrees(deltaU))
                - 2.60 * Math.sin(Math.abs(b))
                + 1.25 * sinB * sinB;
    }
}
