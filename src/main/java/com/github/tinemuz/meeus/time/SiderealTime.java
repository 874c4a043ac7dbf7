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

package com.github.tinemuz.meeus.time;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.ecliptic.Obliquity;
import com.github.tinemuz.meeus.nutation.Nutation;

/**
 * Sidereal time at Greenwich (Meeus, chapter 12).
 */
public final class SiderealTime {

    private SiderealTime() {}

    /**
     * Mean sidereal time at Greenwich for any instant.
     *
     * @param jd Julian Day (UT)
     * @return mean sidereal time in radians, in [0, 2π)
     */
    public static double meanGreenwich(double jd) {
        double t = JulianDay.julianCentury(jd);
        double deg = 280.46061837
                + 360.98564736629 * (jd - JulianDay.J2000)
                + t * t * (0.000387933 - t / 38710000.0);
        return Angles.normalizedRadians(deg);
    }

    /**
     * Apparent sidereal time at Greenwich: the mean value corrected for the
     * equation of the equinoxes.
     *
     * @param jd                  Julian Day (UT)
     * @param nutationInLongitude Δψ in radians
     * @param trueObliquity       ε in radians
     * @return apparent sidereal time in radians, in [0, 2π)
     */
    public static double apparentGreenwich(double jd, double nutationInLongitude, double trueObliquity) {
        return Angles.normalizeToTwoPi(
                meanGreenwich(jd) + nutationInLongitude * Math.cos(trueObliquity));
    }

    /**
     * Apparent sidereal time at Greenwich, computing nutation and obliquity
     * for the same instant.
     */
    public static double apparentGreenwich(double jd) {
        Nutation.Corrections nutation = Nutation.of(jd);
        double epsilon = Obliquity.meanIau(jd) + nutation.inObliquity;
        return apparentGreenwich(jd, nutation.inLongitude, epsilon);
    }

    /** Sidereal time in decimal hours. */
    public static double toHours(double siderealRadians) {
        return Math.toDegrees(siderealRadians) / 15.0;
    }
}
