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

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.EquatorialPoint;

/**
 * Proper motion of the stars (Meeus, chapter 63).
 */
public final class StarMotion {
    /** Kilometres per second expressed in parsecs per year. */
    public static final double KM_PER_S_IN_PC_PER_YEAR = 1.0 / 977792.0;

    private StarMotion() {}

    /**
     * Position of a star after a number of years, using its space motion.
     * Unlike a linear application of the proper motion this stays valid far
     * from the epoch and near the poles.
     *
     * @param start          position at the starting epoch
     * @param distance       distance in parsecs
     * @param radialVelocity radial velocity in parsecs per year, positive
     *                       when receding; see {@link #KM_PER_S_IN_PC_PER_YEAR}
     * @param properMotionRa proper motion in right ascension, radians per
     *                       year
     * @param properMotionDec proper motion in declination, radians per year
     * @param years          elapsed Julian years, negative for the past
     */
    public static EquatorialPoint positionAfter(EquatorialPoint start, double distance, double radialVelocity,
                                                double properMotionRa, double properMotionDec, double years) {
        if (!(distance > 0.0)) {
            throw new IllegalArgumentException("Distance must be positive: " + distance);
        }
        double a0 = start.rightAscension();
        double d0 = start.declination();
        double x = distance * Math.cos(d0) * Math.cos(a0);
        double y = distance * Math.cos(d0) * Math.sin(a0);
        double z = distance * Math.sin(d0);

        double dx = x / distance * radialVelocity - z * properMotionDec * Math.cos(a0) - y * properMotionRa;
        double dy = y / distance * radialVelocity - z * properMotionDec * Math.sin(a0) + x * properMotionRa;
        double dz = z / distance * radialVelocity + distance * properMotionDec * Math.cos(d0);

        double x1 = x + years * dx;
        double y1 = y + years * dy;
        double z1 = z + years * dz;
        return new EquatorialPoint(Angles.normalizeToTwoPi(Math.atan2(y1, x1)),
                Math.atan2(z1, Math.hypot(x1, y1)));
    }

    /**
     * Proper motion converted to ecliptic coordinates.
     *
     * @param position        equatorial position of the star
     * @param properMotionRa  proper motion in right ascension
     * @param properMotionDec proper motion in declination
     * @param latitude        ecliptic latitude of the star
     * @param obliquity       obliquity of the ecliptic
     * @return proper motion in longitude and latitude, same units as input
     */
    public static ProperMotion properMotionInEcliptic(EquatorialPoint position, double properMotionRa,
                                                      double properMotionDec, double latitude, double obliquity) {
        double ra = position.rightAscension();
        double dec = position.declination();
        double cosBeta = Math.cos(latitude);
        double common = Math.cos(obliquity) * Math.cos(dec) + Math.sin(obliquity) * Math.sin(dec) * Math.sin(ra);
        double crossTerm = Math.sin(obliquity) * Math.cos(ra);

        double inLongitude = (properMotionDec * crossTerm + properMotionRa * Math.cos(dec) * common)
                / (cosBeta * cosBeta);
        double inLatitude = (properMotionDec * common - properMotionRa * crossTerm * Math.cos(dec)) / cosBeta;
        return new ProperMotion(inLongitude, inLatitude);
    }

    /**
     * Angle at the star between the directions to the north celestial pole
     * and the north ecliptic pole.
     */
    public static double angleBetweenNorthCelestialAndEclipticPole(double longitude, double latitude,
                                                                   double obliquity) {
        double tanEps = Math.tan(obliquity);
        return Math.atan2(Math.cos(longitude) * tanEps,
                Math.sin(latitude) * Math.sin(longitude) * tanEps - Math.cos(latitude));
    }

    /** Proper motion in ecliptic longitude and latitude. */
    public record ProperMotion(double inLongitude, double inLatitude) {}
}
