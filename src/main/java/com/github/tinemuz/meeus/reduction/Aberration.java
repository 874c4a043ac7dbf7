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
import com.github.tinemuz.meeus.coords.EquatorialPoint;
import com.github.tinemuz.meeus.series.SeriesTable;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Annual aberration of starlight.
 *
 * <p>The Earth's velocity comes from the Ron-Vondrák series (Meeus, Table
 * 23.A), read from <code>series/aberration.txt</code>.</p>
 */
public final class Aberration {
    static final String RESOURCE = "series/aberration.txt";
    private static final SeriesTable TERMS = new SeriesTable(RESOURCE);

    /** Speed of light in units of 1e-8 AU per day. */
    private static final double LIGHT_SPEED = 17314463350.0;
    private static final double SOLAR_CONSTANT = Angles.fromArcsec(20.4898);

    private Aberration() {}

    /** Load the coefficient table now. */
    public static void preload() {
        TERMS.preload();
    }

    /**
     * Corrections to a star's right ascension and declination.
     *
     * @param jde   Julian Ephemeris Day
     * @param point mean place of the star, J2000.0 frame
     * @return Δα and Δδ in radians, packed as an {@link EquatorialPoint}
     * @throws IllegalStateException if the coefficient table cannot be loaded
     */
    public static EquatorialPoint inEquatorialCoordinates(double jde, EquatorialPoint point) {
        double t = JulianDay.julianCentury(jde);
        double[] args = {
                3.1761467 + 1021.3285546 * t, // Venus
                1.7534703 + 628.3075849 * t, // Earth
                6.2034809 + 334.0612431 * t, // Mars
                0.5995465 + 52.9690965 * t, // Jupiter
                0.8740168 + 21.3299095 * t, // Saturn
                5.4812939 + 7.4781599 * t, // Uranus
                5.3118863 + 3.8133036 * t, // Neptune
                3.8103444 + 8399.6847337 * t, // Moon
                5.1984667 + 7771.3771486 * t,
                2.3555559 + 8328.6914289 * t,
                1.6279052 + 8433.4661601 * t
        };
        double x = 0.0;
        double y = 0.0;
        double z = 0.0;
        for (int row = 0; row < TERMS.rowCount(); row++) {
            double a = TERMS.argument(row, args);
            double s = Math.sin(a);
            double c = Math.cos(a);
            x += term(row, 0, t, s, c);
            y += term(row, 4, t, s, c);
            z += term(row, 8, t, s, c);
        }
        double ra = point.rightAscension();
        double dec = point.declination();
        double dAlpha = (y * Math.cos(ra) - x * Math.sin(ra)) / (LIGHT_SPEED * Math.cos(dec));
        double dDelta = -((x * Math.cos(ra) + y * Math.sin(ra)) * Math.sin(dec) - z * Math.cos(dec)) / LIGHT_SPEED;
        return new EquatorialPoint(dAlpha, dDelta);
    }

    /**
     * Aberration of the Sun in longitude, low accuracy: -20.4898" / R.
     *
     * @param radiusVector Earth-Sun distance, AU
     * @return correction in radians (negative)
     */
    public static double solarLowAccuracy(double radiusVector) {
        if (!(radiusVector > 0.0)) {
            throw new IllegalArgumentException("radius vector must be positive: " + radiusVector);
        }
        return -SOLAR_CONSTANT / radiusVector;
    }

    private static double term(int row, int first, double t, double sin, double cos) {
        return (TERMS.coefficient(row, first) + t * TERMS.coefficient(row, first + 1)) * sin
                + (TERMS.coefficient(row, first + 2) + t * TERMS.coefficient(row, first + 3)) * cos;
    }
}
