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

package com.github.tinemuz.meeus.coords;

/**
 * Position on the celestial sphere in equatorial coordinates.
 *
 * @param rightAscension right ascension α, radians
 * @param declination    declination δ, radians, positive north
 */
public record EquatorialPoint(double rightAscension, double declination) {

    /** A point from right ascension and declination in degrees. */
    public static EquatorialPoint ofDegrees(double rightAscensionDeg, double declinationDeg) {
        return new EquatorialPoint(Math.toRadians(rightAscensionDeg), Math.toRadians(declinationDeg));
    }

    /** Angular distance to another equatorial point, radians. */
    public double separation(EquatorialPoint other) {
        return AngularSeparation.separation(rightAscension, declination,
                other.rightAscension, other.declination);
    }
}
