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
 * Position on the celestial sphere in ecliptic coordinates.
 *
 * @param longitude ecliptic longitude λ, radians
 * @param latitude  ecliptic latitude β, radians, positive north
 */
public record EclipticPoint(double longitude, double latitude) {

    /** A point from longitude and latitude in degrees. */
    public static EclipticPoint ofDegrees(double longitudeDeg, double latitudeDeg) {
        return new EclipticPoint(Math.toRadians(longitudeDeg), Math.toRadians(latitudeDeg));
    }

    /** Angular distance to another ecliptic point, radians. */
    public double separation(EclipticPoint other) {
        return AngularSeparation.separation(longitude, latitude, other.longitude, other.latitude);
    }
}
