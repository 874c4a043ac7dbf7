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

package com.github.tinemuz.meeus.series;

import com.github.tinemuz.meeus.angle.Angles;

/**
 * The Delaunay arguments that drive the nutation and lunar series.
 *
 * <p>All values are in radians, reduced to [0, 2π). Each is a polynomial in
 * Julian centuries since J2000.0 reduced to [0°, 360°) before conversion.</p>
 *
 * @param elongation         D, mean elongation of the Moon from the Sun
 * @param sunAnomaly         M, mean anomaly of the Sun (Earth)
 * @param moonAnomaly        M', mean anomaly of the Moon
 * @param argumentOfLatitude F, Moon's argument of latitude
 * @param ascendingNode      Ω, longitude of the ascending node of the Moon's
 *                           mean orbit on the ecliptic
 */
public record FundamentalArguments(
        double elongation,
        double sunAnomaly,
        double moonAnomaly,
        double argumentOfLatitude,
        double ascendingNode) {

    /**
     * Arguments as used by the IAU 1980 nutation theory (Meeus, chapter 22).
     *
     * @param t Julian centuries since J2000.0 (TD)
     */
    public static FundamentalArguments forNutation(double t) {
        double d = 297.85036 + t * (445267.111480 - t * (0.0019142 - t / 189474.0));
        double m = 357.52772 + t * (35999.050340 - t * (0.0001603 + t / 300000.0));
        double m1 = 134.96298 + t * (477198.867398 + t * (0.0086972 + t / 56250.0));
        double f = 93.27191 + t * (483202.017538 - t * (0.0036825 - t / 327270.0));
        double omega = 125.04452 - t * (1934.136261 - t * (0.0020708 + t / 450000.0));
        return ofDegrees(d, m, m1, f, omega);
    }

    /**
     * Arguments as used by the lunar theory (Meeus, chapter 47).
     *
     * @param t Julian centuries since J2000.0 (TD)
     */
    public static FundamentalArguments forMoon(double t) {
        double d = Polynomials.horner(t,
                297.8501921, 445267.1114034, -0.0018819, 1.0 / 545868.0, -1.0 / 113065000.0);
        double m = Polynomials.horner(t,
                357.5291092, 35999.0502909, -0.0001536, 1.0 / 24490000.0);
        double m1 = Polynomials.horner(t,
                134.9633964, 477198.8675055, 0.0087414, 1.0 / 69699.0, -1.0 / 14712000.0);
        double f = Polynomials.horner(t,
                93.2720950, 483202.0175233, -0.0036539, -1.0 / 3526000.0, 1.0 / 863310000.0);
        double omega = Polynomials.horner(t,
                125.0445479, -1934.1362891, 0.0020754, 1.0 / 467441.0, -1.0 / 60616000.0);
        return ofDegrees(d, m, m1, f, omega);
    }

    private static FundamentalArguments ofDegrees(double d, double m, double m1, double f, double omega) {
        return new FundamentalArguments(
                Angles.normalizedRadians(d),
                Angles.normalizedRadians(m),
                Angles.normalizedRadians(m1),
                Angles.normalizedRadians(f),
                Angles.normalizedRadians(omega));
    }

    /** D, M, M', F, Ω in table column order. */
    public double[] withNode() {
        return new double[] {elongation, sunAnomaly, moonAnomaly, argumentOfLatitude, ascendingNode};
    }

    /** D, M, M', F in table column order. */
    public double[] withoutNode() {
        return new double[] {elongation, sunAnomaly, moonAnomaly, argumentOfLatitude};
    }
}
