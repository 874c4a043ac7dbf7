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

package com.github.tinemuz.meeus.moon;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.series.FundamentalArguments;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Librations of the Moon and the position angle of its axis (Meeus,
 * chapter 53).
 *
 * <p>Longitudes of libration are reduced to [-π, π); a negative value means
 * the mean center of the disk is displaced toward the west.</p>
 */
public final class Libration {
    private static final double I = MoonOrbit.INCLINATION_OF_MEAN_EQUATOR;

    private Libration() {}

    /**
     * Optical librations in longitude and latitude.
     *
     * @param jde           Julian Ephemeris Day
     * @param meanLongitude geocentric longitude of the Moon without nutation
     * @param latitude      apparent geocentric latitude of the Moon
     */
    public static Result optical(double jde, double meanLongitude, double latitude) {
        double t = JulianDay.julianCentury(jde);
        FundamentalArguments fa = FundamentalArguments.forMoon(t);
        double w = meanLongitude - fa.ascendingNode();
        double a = argumentA(w, latitude);
        double l = Angles.normalizeToPlusMinusPi(a - fa.argumentOfLatitude());
        double b = Math.asin(-Math.sin(w) * Math.cos(latitude) * Math.sin(I)
                - Math.sin(latitude) * Math.cos(I));
        return new Result(l, b);
    }

    /**
     * Physical librations in longitude and latitude. These never exceed
     * 0.04°.
     *
     * @param jde             Julian Ephemeris Day
     * @param meanLongitude   geocentric longitude of the Moon without nutation
     * @param latitude        apparent geocentric latitude of the Moon
     * @param opticalLatitude optical libration in latitude b'
     */
    public static Result physical(double jde, double meanLongitude, double latitude, double opticalLatitude) {
        double t = JulianDay.julianCentury(jde);
        FundamentalArguments fa = FundamentalArguments.forMoon(t);
        double d = fa.elongation();
        double m = fa.sunAnomaly();
        double m1 = fa.moonAnomaly();
        double f = fa.argumentOfLatitude();
        double omega = fa.ascendingNode();
        double e = MoonPosition.eccentricityFactor(t);
        double k1 = Angles.normalizedRadians(119.75 + 131.849 * t);
        double k2 = Angles.normalizedRadians(72.56 + 20.186 * t);
        double[] rs = rhoSigma(d, m1, f);
        double rho = rs[0];
        double sigma = rs[1];
        double tau = Math.toRadians(
                0.02520 * e * Math.sin(m)
                + 0.00473 * Math.sin(2 * m1 - 2 * f)
                - 0.00467 * Math.sin(m1)
                + 0.00396 * Math.sin(k1)
                + 0.00276 * Math.sin(2 * m1 - 2 * d)
                + 0.00196 * Math.sin(omega)
                - 0.00183 * Math.cos(m1 - f)
                + 0.00115 * Math.sin(m1 - 2 * d)
                - 0.00096 * Math.sin(m1 - d)
                + 0.00046 * Math.sin(2 * f - 2 * d)
                - 0.00039 * Math.sin(m1 - f)
                - 0.00032 * Math.sin(m1 - m - d)
                + 0.00027 * Math.sin(2 * m1 - m - 2 * d)
                + 0.00023 * Math.sin(k2)
                - 0.00014 * Math.sin(2 * d)
                + 0.00014 * Math.cos(2 * m1 - 2 * f)
                - 0.00012 * Math.sin(m1 - 2 * f)
                - 0.00012 * Math.sin(2 * m1)
                + 0.00011 * Math.sin(2 * m1 - 2 * m - 2 * d));
        double a = argumentA(meanLongitude - omega, latitude);
        double l = -tau + (rho * Math.cos(a) + sigma * Math.sin(a)) * Math.tan(opticalLatitude);
        double b = sigma * Math.cos(a) - rho * Math.sin(a);
        return new Result(l, b);
    }

    /**
     * Total (optical plus physical) librations.
     */
    public static Result total(double jde, double meanLongitude, double latitude) {
        Result optical = optical(jde, meanLongitude, latitude);
        Result physical = physical(jde, meanLongitude, latitude, optical.latitude);
        return new Result(
                Angles.normalizeToPlusMinusPi(optical.longitude + physical.longitude),
                optical.latitude + physical.latitude);
    }

    /**
     * Position angle of the Moon's axis of rotation.
     *
     * @param jde                  Julian Ephemeris Day
     * @param nutationInLongitude  Δψ, radians
     * @param trueObliquity        ε, radians
     * @param apparentRa           apparent right ascension of the Moon
     * @param totalLatitude        total libration in latitude b
     * @return P in radians, in [-π/2, π/2]
     */
    public static double positionAngleOfAxis(
            double jde, double nutationInLongitude, double trueObliquity, double apparentRa,
            double totalLatitude) {
        double t = JulianDay.julianCentury(jde);
        FundamentalArguments fa = FundamentalArguments.forMoon(t);
        double[] rs = rhoSigma(fa.elongation(), fa.moonAnomaly(), fa.argumentOfLatitude());
        double rho = rs[0];
        double sigma = rs[1];
        double v = fa.ascendingNode() + nutationInLongitude + sigma / Math.sin(I);
        double x = Math.sin(I + rho) * Math.sin(v);
        double y = Math.sin(I + rho) * Math.cos(v) * Math.cos(trueObliquity)
                - Math.cos(I + rho) * Math.sin(trueObliquity);
        double w = Math.atan2(x, y);
        return Math.asin(Math.hypot(x, y) * Math.cos(apparentRa - w) / Math.cos(totalLatitude));
    }

    /**
     * Topocentric corrections to the librations and position angle, by
     * differential corrections (Meeus 53.3).
     *
     * @param observerLatitude geographic latitude φ
     * @param declination      geocentric declination of the Moon
     * @param hourAngle        local hour angle of the Moon
     * @param parallax         geocentric horizontal parallax of the Moon
     * @param positionAngle    geocentric position angle of the axis P
     * @param totalLatitude    geocentric total libration in latitude b
     */
    public static Topocentric topocentricCorrections(
            double observerLatitude, double declination, double hourAngle, double parallax,
            double positionAngle, double totalLatitude) {
        double q = Math.atan2(Math.cos(observerLatitude) * Math.sin(hourAngle),
                Math.cos(declination) * Math.sin(observerLatitude)
                        - Math.sin(declination) * Math.cos(observerLatitude) * Math.cos(hourAngle));
        double cosZ = Math.sin(declination) * Math.sin(observerLatitude)
                + Math.cos(declination) * Math.cos(observerLatitude) * Math.cos(hourAngle);
        double z = Math.acos(Math.max(-1.0, Math.min(1.0, cosZ)));
        double pi1 = parallax * (Math.sin(z) + 0.0084 * Math.sin(2 * z));
        double dl = -pi1 * Math.sin(q - positionAngle) / Math.cos(totalLatitude);
        double db = pi1 * Math.cos(q - positionAngle);
        double dp = dl * Math.sin(totalLatitude + db) - pi1 * Math.sin(q) * Math.tan(declination);
        return new Topocentric(dl, db, dp);
    }

    private static double argumentA(double w, double latitude) {
        return Math.atan2(
                Math.sin(w) * Math.cos(latitude) * Math.cos(I) - Math.sin(latitude) * Math.sin(I),
                Math.cos(w) * Math.cos(latitude));
    }

    private static double[] rhoSigma(double d, double m1, double f) {
        double rho = -0.02752 * Math.cos(m1)
                - 0.02245 * Math.sin(f)
                + 0.00684 * Math.cos(m1 - 2 * f)
                - 0.00293 * Math.cos(2 * f)
                - 0.00085 * Math.cos(2 * f - 2 * d)
                - 0.00054 * Math.cos(m1 - 2 * d)
                - 0.00020 * Math.sin(m1 + f)
                - 0.00020 * Math.cos(m1 + 2 * f)
                - 0.00020 * Math.cos(m1 - f)
                + 0.00014 * Math.cos(m1 + 2 * f - 2 * d);
        double sigma = -0.02816 * Math.sin(m1)
                + 0.02244 * Math.cos(f)
                - 0.00682 * Math.sin(m1 - 2 * f)
                - 0.00279 * Math.sin(2 * f)
                - 0.00083 * Math.sin(2 * f - 2 * d)
                + 0.00069 * Math.sin(m1 - 2 * d)
                + 0.00040 * Math.cos(m1 + f)
                - 0.00025 * Math.sin(2 * m1)
                - 0.00023 * Math.sin(m1 + 2 * f)
                + 0.00020 * Math.cos(m1 - f)
                + 0.00019 * Math.sin(m1 - f)
                + 0.00013 * Math.sin(m1 + 2 * f - 2 * d)
                - 0.00010 * Math.cos(m1 - 3 * f);
        return new double[] {Math.toRadians(rho), Math.toRadians(sigma)};
    }

    /** Libration in longitude and latitude. */
    public static final class Result {
        /** Libration in longitude, radians. */
        public final double longitude;
        /** Libration in latitude, radians. */
        public final double latitude;

        Result(double longitude, double latitude) {
            this.longitude = longitude;
            this.latitude = latitude;
        }
    }

    /** Topocentric corrections returned by {@link #topocentricCorrections}. */
    public static final class Topocentric {
        /** Correction to the libration in longitude, radians. */
        public final double longitude;
        /** Correction to the libration in latitude, radians. */
        public final double latitude;
        /** Correction to the position angle of the axis, radians. */
        public final double positionAngle;

        Topocentric(double longitude, double latitude, double positionAngle) {
            this.longitude = longitude;
            this.latitude = latitude;
            this.positionAngle = positionAngle;
        }
    }
}
