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

package com.github.tinemuz.meeus.reduction;

import com.github.tinemuz.meeus.angle.Angles;

/**
 * Atmospheric refraction (Meeus, chapter 16). Values are for a pressure of
 * 1010 mbar and a temperature of 10 °C; scale them with
 * {@link #pressureFactor(double)} and {@link #temperatureFactor(double)}.
 */
public final class Refraction {
    private static final double ABOVE_15_LIMIT = Math.toRadians(15.0);

    private Refraction() {}

    /**
     * Refraction to subtract from an apparent altitude (Bennett's formula),
     * good to 0.07' at all altitudes.
     *
     * @param apparentAltitude h0, radians
     * @return R in radians, never negative
     */
    public static double fromApparentAltitude(double apparentAltitude) {
        checkAltitude(apparentAltitude);
        double h = Math.toDegrees(apparentAltitude);
        double arcmin = 1.0 / Math.tan(Math.toRadians(h + 7.31 / (h + 4.4)));
        return Math.max(0.0, Math.toRadians(arcmin / 60.0));
    }

    /**
     * Refraction to add to a true altitude (Saemundsson's formula).
     *
     * @param trueAltitude h, radians
     * @return R in radians, never negative
     */
    public static double fromTrueAltitude(double trueAltitude) {
        checkAltitude(trueAltitude);
        double h = Math.toDegrees(trueAltitude);
        double arcmin = 1.02 / Math.tan(Math.toRadians(h + 10.3 / (h + 5.11)));
        return Math.max(0.0, Math.toRadians(arcmin / 60.0));
    }

    /**
     * Refraction from an apparent altitude above 15°, accurate to a few
     * hundredths of an arcsecond.
     *
     * @throws IllegalArgumentException below 15°
     */
    public static double fromApparentAltitudeAbove15(double apparentAltitude) {
        checkAbove15(apparentAltitude);
        double tanZ = Math.tan(Math.PI / 2 - apparentAltitude);
        return Angles.fromArcsec(58.294 * tanZ - 0.0668 * tanZ * tanZ * tanZ);
    }

    /**
     * Refraction from a true altitude above 15°.
     *
     * @throws IllegalArgumentException below 15°
     */
    public static double fromTrueAltitudeAbove15(double trueAltitude) {
        checkAbove15(trueAltitude);
        double tanZ = Math.tan(Math.PI / 2 - trueAltitude);
        return Angles.fromArcsec(58.276 * tanZ - 0.0824 * tanZ * tanZ * tanZ);
    }

    /** Multiplier for an atmospheric pressure other than 1010 mbar. */
    public static double pressureFactor(double pressureMbar) {
        return pressureMbar / 1010.0;
    }

    /** Multiplier for an air temperature other than 10 °C. */
    public static double temperatureFactor(double temperatureCelsius) {
        return 283.0 / (273.0 + temperatureCelsius);
    }

    private static void checkAltitude(double altitude) {
        if (!(altitude >= -Math.PI / 2 && altitude <= Math.PI / 2)) {
            throw new IllegalArgumentException("altitude must be in [-90°, 90°]: " + Math.toDegrees(altitude));
        }
    }

    private static void checkAbove15(double altitude) {
        checkAltitude(altitude);
        if (altitude < ABOVE_15_LIMIT) {
            throw new IllegalArgumentException("altitude must be at least 15°: " + Math.toDegrees(altitude));
        }
    }
}
