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

package com.github.tinemuz.meeus.planet;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.orbit.OrbitalElements;
import com.github.tinemuz.meeus.series.SeriesTable;
import com.github.tinemuz.meeus.time.JulianDay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heliocentric position of Pluto (Meeus, chapter 37), referred to the
 * standard equinox of J2000.0.
 *
 * <p>The 43 periodic terms are read from <code>series/pluto.txt</code>. The
 * fit is only valid from 1885 to 2099; outside that range the result is
 * still computed but a warning is logged once.</p>
 */
public final class Pluto {
    private static final Logger log = LoggerFactory.getLogger(Pluto.class);

    static final String RESOURCE = "series/pluto.txt";
    private static final SeriesTable TERMS = new SeriesTable(RESOURCE);

    private static final double FIRST_VALID_JD = 2409542.5; // 1885-01-01
    private static final double LAST_VALID_JD = 2488069.5; // 2100-01-01
    private static final double SEMIDIAMETER_AT_1_AU = Angles.fromArcsec(2.07);

    /** Mean orbital elements near 2000 (equinox J2000.0). */
    public static final OrbitalElements MEAN_ELEMENTS_2000 = new OrbitalElements(
            39.543, 0.249, Math.toRadians(17.140), Math.toRadians(110.307), Math.toRadians(113.768));

    private static volatile boolean warnedOutsideRange = false;

    private Pluto() {}

    /** Load the coefficient table now. */
    public static void preload() {
        TERMS.preload();
    }

    /**
     * Heliocentric ecliptic position, J2000.0.
     *
     * @param jde Julian Ephemeris Day
     * @throws IllegalStateException if the coefficient table cannot be loaded
     */
    public static SphericalPosition heliocentric(double jde) {
        if (jde < FIRST_VALID_JD || jde >= LAST_VALID_JD) {
            warnOutsideRange(jde);
        }
        double t = JulianDay.julianCentury(jde);
        double j = Math.toRadians(34.35 + 3034.9057 * t);
        double s = Math.toRadians(50.08 + 1222.1138 * t);
        double p = Math.toRadians(238.96 + 144.9600 * t);
        double l = 238.958116 + 144.96 * t;
        double b = -3.908239;
        double r = 40.7241346;
        for (int row = 0; row < TERMS.rowCount(); row++) {
            double a = TERMS.argument(row, j, s, p);
            double sinA = Math.sin(a);
            double cosA = Math.cos(a);
            l += TERMS.coefficient(row, 0) * sinA + TERMS.coefficient(row, 1) * cosA;
            b += TERMS.coefficient(row, 2) * sinA + TERMS.coefficient(row, 3) * cosA;
            r += TERMS.coefficient(row, 4) * sinA + TERMS.coefficient(row, 5) * cosA;
        }
        return new SphericalPosition(Angles.normalizedRadians(l), Math.toRadians(b), r);
    }

    /** Apparent equatorial semidiameter for a distance from the Earth in AU. */
    public static double semidiameter(double distance) {
        if (!(distance > 0.0)) {
            throw new IllegalArgumentException("distance must be positive: " + distance);
        }
        return SEMIDIAMETER_AT_1_AU / distance;
    }

    /**
     * Apparent visual magnitude (Astronomical Almanac, 1984).
     *
     * @param radiusVector distance from the Sun, AU
     * @param distance     distance from the Earth, AU
     */
    public static double magnitude(double radiusVector, double distance) {
        return 5.0 * Math.log10(radiusVector * distance) - 1.0;
    }

    private static void warnOutsideRange(double jde) {
        if (!warnedOutsideRange) {
            synchronized (Pluto.class) {
                if (!warnedOutsideRange) {
                    warnedOutsideRange = true;
                    log.warn("JDE {} is outside 1885-2099; Pluto's periodic terms are not valid there",
                            String.format("%.2f", jde));
                }
            }
        }
    }
}
