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

package com.github.tinemuz.meeus.ecliptic;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.nutation.Nutation;
import com.github.tinemuz.meeus.series.Polynomials;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Obliquity of the ecliptic (Meeus, chapter 22).
 */
public final class Obliquity {
    /** Mean obliquity at J2000.0, 23°26'21.448". */
    public static final double J2000 = Angles.radiansFromDms(23, 26, 21.448);

    /** Mean obliquity at B1950.0, 23°26'44.84". */
    public static final double B1950 = Angles.radiansFromDms(23, 26, 44.84);

    private static final double EPS0_ARCSEC = 84381.448;

    private Obliquity() {}

    /**
     * Mean obliquity from the IAU formula (Meeus 22.2).
     *
     * <p>Error about 1" over 2000 years and 10" over 4000 years from J2000.0.</p>
     *
     * @param jde Julian Ephemeris Day
     * @return ε0 in radians
     */
    public static double meanIau(double jde) {
        double t = JulianDay.julianCentury(jde);
        return Angles.fromArcsec(Polynomials.horner(t, EPS0_ARCSEC, -46.8150, -0.00059, 0.001813));
    }

    /**
     * Mean obliquity from Laskar's formula (Meeus 22.3).
     *
     * <p>Accurate to 0.01" over 1000 years and a few arcseconds over 10000
     * years. Not valid beyond 10000 years from J2000.0.</p>
     *
     * @param jde Julian Ephemeris Day
     * @return ε0 in radians
     */
    public static double meanLaskar(double jde) {
        double u = JulianDay.julianCentury(jde) / 100.0;
        return Angles.fromArcsec(Polynomials.horner(u,
                EPS0_ARCSEC, -4680.93, -1.55, 1999.25, -51.38, -249.67,
                -39.05, 7.12, 27.87, 5.79, 2.45));
    }

    /**
     * True obliquity: mean obliquity (Laskar) plus the nutation in obliquity.
     *
     * @param jde Julian Ephemeris Day
     * @return ε in radians
     */
    public static double trueObliquity(double jde) {
        return meanLaskar(jde) + Nutation.of(jde).inObliquity;
    }
}
