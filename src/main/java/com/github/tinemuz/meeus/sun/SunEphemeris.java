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

/**
 * Ephemeris for physical observations of the Sun (Meeus, chapter 29).
 */
public final class SunEphemeris {
    private static final double INCLINATION_OF_EQUATOR = Math.toRadians(7.25);

    private SunEphemeris() {}

    /**
     * Position angle of the rotation axis and heliographic coordinates of
     * the center of the disk.
     *
     * @param jd                     Julian Day
     * @param apparentLongitude      apparent longitude of the Sun without
     *                               nutation, radians
     * @param longitudeWithNutation  apparent longitude including nutation
     * @param trueObliquity          true obliquity of the ecliptic
     */
    public static Result of(double jd, double apparentLongitude, double longitudeWithNutation,
                            double trueObliquity) {
        double theta = Angles.normalizedRadians((jd - 2398220.0) * 360.0 / 25.38);
        double k = Math.toRadians(73.6667 + 1.3958333 * (jd - 2396758.0) / 36525.0);
        double z = apparentLongitude - k;
        double x = Math.atan(-Math.cos(longitudeWithNutation) * Math.tan(trueObliquity));
        double y = Math.atan(-Math.cos(z) * Math.tan(INCLINATION_OF_EQUATOR));
        double b0 = Math.asin(Math.sin(z) * Math.sin(INCLINATION_OF_EQUATOR));
        double eta = Math.atan2(-Math.sin(z) * Math.cos(INCLINATION_OF_EQUATOR), -Math.cos(z));
        double l0 = Angles.normalizeToTwoPi(eta - theta);
        return new Result(x + y, b0, l0);
    }

    /**
     * Julian Ephemeris Day at which a Carrington synodic rotation starts.
     *
     * @param rotation Carrington rotation number
     */
    public static double synodicRotationStart(int rotation) {
        double m = Math.toRadians(281.96 + 26.882476 * rotation);
        return 2398140.2270 + 27.2752316 * rotation
                + 0.1454 * Math.sin(m)
                - 0.0085 * Math.sin(2 * m)
                - 0.0141 * Math.cos(2 * m);
    }

    /** Physical ephemeris of the Sun. */
    public static final class Result {
        /** Position angle of the northern extremity of the rotation axis, radians. */
        public final double positionAngle;
        /** Heliographic latitude of the center of the disk, radians. */
        public final double centerLatitude;
        /** Heliographic longitude of the center of the disk, radians in [0, 2π). */
        public final double centerLongitude;

        Result(double positionAngle, double centerLatitude, double centerLongitude) {
            this.positionAngle = positionAngle;
            this.centerLatitude = centerLatitude;
            this.centerLongitude = centerLongitude;
        }
    }
}
