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

package com.github.tinemuz.meeus.nutation;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.EquatorialPoint;
import com.github.tinemuz.meeus.series.FundamentalArguments;
import com.github.tinemuz.meeus.series.SeriesTable;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Nutation in longitude and in obliquity (IAU 1980 theory, Meeus chapter 22).
 *
 * <p>The 63 periodic terms are read from the classpath resource
 * <code>series/nutation.txt</code>. Call {@link #preload()} once at startup
 * to detect a missing table early. Accuracy is about 0.5" in Δψ and 0.1" in
 * Δε for dates near the present.</p>
 */
public final class Nutation {
    static final String RESOURCE = "series/nutation.txt";
    private static final SeriesTable TERMS = new SeriesTable(RESOURCE);

    // table columns after the five multipliers
    private static final int SIN_COEFF = 0;
    private static final int SIN_RATE = 1;
    private static final int COS_COEFF = 2;
    private static final int COS_RATE = 3;

    private static final double UNIT_ARCSEC = 0.0001;

    private Nutation() {}

    /** Load the coefficient table now. */
    public static void preload() {
        TERMS.preload();
    }

    /**
     * Nutation at an instant.
     *
     * @param jde Julian Ephemeris Day
     * @return Δψ and Δε in radians
     * @throws IllegalStateException if the coefficient table cannot be loaded
     */
    public static Corrections of(double jde) {
        double t = JulianDay.julianCentury(jde);
        double[] args = FundamentalArguments.forNutation(t).withNode();
        double dPsi = 0.0;
        double dEps = 0.0;
        for (int row = 0; row < TERMS.rowCount(); row++) {
            double arg = TERMS.argument(row, args);
            double s = TERMS.coefficient(row, SIN_COEFF) + t * TERMS.coefficient(row, SIN_RATE);
            double c = TERMS.coefficient(row, COS_COEFF) + t * TERMS.coefficient(row, COS_RATE);
            if (s != 0.0) dPsi += s * Math.sin(arg);
            if (c != 0.0) dEps += c * Math.cos(arg);
        }
        return new Corrections(
                Angles.fromArcsec(dPsi * UNIT_ARCSEC), Angles.fromArcsec(dEps * UNIT_ARCSEC));
    }

    /**
     * Corrections to right ascension and declination for nutation
     * (Meeus 23.1). Not valid close to the celestial poles.
     *
     * @param point               mean place of the body
     * @param nutationInLongitude Δψ in radians
     * @param nutationInObliquity Δε in radians
     * @param trueObliquity       ε in radians
     * @return Δα and Δδ in radians, packed as an {@link EquatorialPoint}
     */
    public static EquatorialPoint inEquatorialCoordinates(
            EquatorialPoint point, double nutationInLongitude, double nutationInObliquity,
            double trueObliquity) {
        double a = point.rightAscension();
        double tanDec = Math.tan(point.declination());
        double sinEps = Math.sin(trueObliquity);
        double cosEps = Math.cos(trueObliquity);
        double dAlpha = (cosEps + sinEps * Math.sin(a) * tanDec) * nutationInLongitude
                - Math.cos(a) * tanDec * nutationInObliquity;
        double dDelta = sinEps * Math.cos(a) * nutationInLongitude
                + Math.sin(a) * nutationInObliquity;
        return new EquatorialPoint(dAlpha, dDelta);
    }

    /**
     * Nutation corrections returned by {@link #of}.
     */
    public static final class Corrections {
        /** Nutation in longitude Δψ, in radians. */
        public final double inLongitude;

        /** Nutation in obliquity Δε, in radians. */
        public final double inObliquity;

        Corrections(double inLongitude, double inObliquity) {
            this.inLongitude = inLongitude;
            this.inObliquity = inObliquity;
        }

        /** Δψ in arcseconds. */
        public double inLongitudeArcsec() {
            return Angles.toArcsec(inLongitude);
        }

        /** Δε in arcseconds. */
        public double inObliquityArcsec() {
            return Angles.toArcsec(inObliquity);
        }
    }
}
