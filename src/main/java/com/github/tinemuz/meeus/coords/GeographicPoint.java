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
 * Observer's place on the Earth.
 *
 * <p>Longitude follows the astronomical convention of Meeus: positive
 * WEST of Greenwich, negative east. Washington is at +77°03'56" and Paris
 * at -2°20'14".</p>
 *
 * @param longitude geographic longitude, radians, positive west
 * @param latitude  geographic (geodetic) latitude, radians, positive north
 */
public record GeographicPoint(double longitude, double latitude) {

    /** A point from longitude (positive west) and latitude in degrees. */
    public static GeographicPoint ofDegrees(double longitudeWestDeg, double latitudeDeg) {
        return new GeographicPoint(Math.toRadians(longitudeWestDeg), Math.toRadians(latitudeDeg));
    }

    /** Angular distance to another place, radians, on a spherical Earth. */
    public double separation(GeographicPoint other) {
        return AngularSeparation.separation(longitude, latitude, other.longitude, other.latitude);
    }
}
