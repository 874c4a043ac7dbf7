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
 * Angular distance between two points on a sphere (Meeus, chapter 17).
 *
 * <p>The arguments are generic spherical coordinates: right ascension and
 * declination, ecliptic longitude and latitude, or geographic longitude and
 * latitude.</p>
 */
public final class AngularSeparation {

    private AngularSeparation() {}

    /**
     * Separation by the spherical law of cosines (Meeus 17.1).
     *
     * <p>Loses precision when the points are closer than a few arcminutes or
     * nearly antipodal; prefer {@link #separation}.</p>
     *
     * @return separation in radians, in [0, π]
     */
    public static double lawOfCosines(double lon1, double lat1, double lon2, double lat2) {
        double cosD = Math.sin(lat1) * Math.sin(lat2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.cos(lon1 - lon2);
        return Math.acos(Math.max(-1.0, Math.min(1.0, cosD)));
    }

    /**
     * Separation from an atan2 formulation that keeps full precision for
     * both tiny and near-antipodal separations.
     *
     * @return separation in radians, in [0, π]
     */
    public static double separation(double lon1, double lat1, double lon2, double lat2) {
        double dLon = lon2 - lon1;
        double sinLat1 = Math.sin(lat1);
        double cosLat1 = Math.cos(lat1);
        double sinLat2 = Math.sin(lat2);
        double cosLat2 = Math.cos(lat2);
        double x = cosLat2 * Math.sin(dLon);
        double y = cosLat1 * sinLat2 - sinLat1 * cosLat2 * Math.cos(dLon);
        double z = sinLat1 * sinLat2 + cosLat1 * cosLat2 * Math.cos(dLon);
        return Math.atan2(Math.hypot(x, y), z);
    }

    /** Separation between two equatorial points, radians. */
    public static double between(EquatorialPoint a, EquatorialPoint b) {
        return separation(a.rightAscension(), a.declination(), b.rightAscension(), b.declination());
    }

    /** Separation between two ecliptic points, radians. */
    public static double between(EclipticPoint a, EclipticPoint b) {
        return separation(a.longitude(), a.latitude(), b.longitude(), b.latitude());
    }
}
