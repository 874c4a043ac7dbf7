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

package com.github.tinemuz.meeus.sun;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.EclipticPoint;
import com.github.tinemuz.meeus.coords.EquatorialPoint;
import com.github.tinemuz.meeus.coords.Transforms;
import com.github.tinemuz.meeus.ecliptic.Obliquity;
import com.github.tinemuz.meeus.series.Polynomials;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Position of the Sun to about 0.01° (Meeus, chapter 25).
 *
 * <p>The theory treats the Sun's orbit as an unperturbed ellipse with
 * secular terms, so the latitude is always zero.</p>
 */
public final class SunPosition {
    private static final double FK5_LONGITUDE_CORRECTION = Angles.fromArcsec(-0.09033);
    private static final double FK5_LATITUDE_FACTOR = Angles.fromArcsec(0.03916);
    private static final double SEMIDIAMETER_AT_1_AU = Angles.fromArcsec(959.63);

    private SunPosition() {}

    /**
     * Geometric position referred to the mean equinox of the date.
     *
     * @param jde Julian Ephemeris Day
     * @return true longitude, zero latitude, radius vector and mean anomaly
     */
    public static Result geometric(double jde) {
        double t = JulianDay.julianCentury(jde);
        double l0 = Polynomials.horner(t, 280.46646, 36000.76983, 0.0003032);
        double m = Angles.normalizedRadians(Polynomials.horner(t, 357.52911, 35999.05029, -0.0001537));
        double e = Polynomials.horner(t, 0.016708634, -0.000042037, -0.0000001267);
        double c = Polynomials.horner(t, 1.914602, -0.004817, -0.000014) * Math.sin(m)
                + (0.019993 - 0.000101 * t) * Math.sin(2 * m)
                + 0.000289 * Math.sin(3 * m);
        double trueLongitude = Angles.normalizedRadians(l0 + c);
        double v = m + Math.toRadians(c);
        double r = 1.000001018 * (1 - e * e) / (1 + e * Math.cos(v));
        return new Result(trueLongitude, 0.0, r, m);
    }

    /**
     * Apparent position: the geometric longitude corrected for nutation and
     * aberration using the low-accuracy node term.
     */
    public static Result apparent(double jde) {
        Result geometric = geometric(jde);
        double omega = lowAccuracyNode(jde);
        double lambda = geometric.longitude
                - Math.toRadians(0.00569)
                - Math.toRadians(0.00478) * Math.sin(omega);
        return new Result(Angles.normalizeToTwoPi(lambda), 0.0, geometric.radiusVector, geometric.meanAnomaly);
    }

    /**
     * Apparent right ascension and declination, with the mean obliquity
     * corrected by the same node term as {@link #apparent(double)}.
     */
    public static EquatorialPoint apparentEquatorial(double jde) {
        Result apparent = apparent(jde);
        double obliquity = Obliquity.meanIau(jde) + Math.toRadians(0.00256) * Math.cos(lowAccuracyNode(jde));
        return Transforms.equatorialFromEcliptic(apparent.ecliptic(), obliquity);
    }

    /**
     * Convert a position computed in the dynamical (VSOP87) frame to the FK5
     * system.
     *
     * @param jde       Julian Ephemeris Day
     * @param longitude ecliptic longitude, radians
     * @param latitude  ecliptic latitude, radians
     * @return the position in FK5
     */
    public static EclipticPoint toFk5(double jde, double longitude, double latitude) {
        double t = JulianDay.julianCentury(jde);
        double lambda1 = longitude - Math.toRadians(t * (1.397 + 0.00031 * t));
        double lon = longitude + FK5_LONGITUDE_CORRECTION;
        double lat = latitude + FK5_LATITUDE_FACTOR * (Math.cos(lambda1) - Math.sin(lambda1));
        return new EclipticPoint(lon, lat);
    }

    /**
     * Geocentric equatorial rectangular coordinates of the Sun.
     *
     * @param longitude    geometric longitude
     * @param latitude     geometric latitude
     * @param radiusVector distance in AU
     * @param obliquity    mean obliquity of the ecliptic
     * @return {x, y, z} in AU
     */
    public static double[] rectangular(double longitude, double latitude, double radiusVector, double obliquity) {
        double cosB = Math.cos(latitude);
        double x = radiusVector * cosB * Math.cos(longitude);
        double y = radiusVector * (cosB * Math.sin(longitude) * Math.cos(obliquity)
                - Math.sin(latitude) * Math.sin(obliquity));
        double z = radiusVector * (cosB * Math.sin(longitude) * Math.sin(obliquity)
                + Math.sin(latitude) * Math.cos(obliquity));
        return new double[] {x, y, z};
    }

    /**
     * Apparent semidiameter of the Sun.
     *
     * @param radiusVector Earth-Sun distance in AU, must be positive
     * @return semidiameter in radians
     */
    public static double semidiameter(double radiusVector) {
        if (!(radiusVector > 0.0)) {
            throw new IllegalArgumentException("radius vector must be positive: " + radiusVector);
        }
        return SEMIDIAMETER_AT_1_AU / radiusVector;
    }

    private static double lowAccuracyNode(double jde) {
        double t = JulianDay.julianCentury(jde);
        return Math.toRadians(125.04 - 1934.136 * t);
    }

    /** Position of the Sun. */
    public static final class Result {
        /** Ecliptic longitude, radians in [0, 2π). */
        public final double longitude;
        /** Ecliptic latitude, radians. */
        public final double latitude;
        /** Earth-Sun distance, AU. */
        public final double radiusVector;
        /** Mean anomaly of the Sun, radians. */
        public final double meanAnomaly;

        Result(double longitude, double latitude, double radiusVector, double meanAnomaly) {
            this.longitude = longitude;
            this.latitude = latitude;
            this.radiusVector = radiusVector;
            this.meanAnomaly = meanAnomaly;
        }

        public EclipticPoint ecliptic() {
            return new EclipticPoint(longitude, latitude);
        }
    }
}
