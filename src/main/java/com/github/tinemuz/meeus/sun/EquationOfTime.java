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
import com.github.tinemuz.meeus.series.Polynomials;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Equation of time (Meeus, chapter 28): apparent minus mean solar time.
 */
public final class EquationOfTime {

    private EquationOfTime() {}

    /**
     * Equation of time as an angle.
     *
     * @param jde                 Julian Ephemeris Day
     * @param apparentRa          apparent right ascension of the Sun
     * @param nutationInLongitude Δψ, radians
     * @param trueObliquity       ε, radians
     * @return E in radians, in [-π, π); positive when the true Sun is ahead
     *         of the mean Sun
     */
    public static double of(double jde, double apparentRa, double nutationInLongitude, double trueObliquity) {
        double tau = JulianDay.julianMillennium(jde);
        double l0 = Polynomials.horner(tau,
                280.4664567, 360007.6982779, 0.03032028, 1.0 / 49931, -1.0 / 15300, -1.0 / 2000000);
        double e = Angles.normalizedRadians(l0 - 0.0057183)
                - apparentRa
                + nutationInLongitude * Math.cos(trueObliquity);
        return Angles.normalizeToPlusMinusPi(e);
    }

    /** Equation of time converted to minutes of time. */
    public static double toMinutes(double equationOfTime) {
        return Math.toDegrees(equationOfTime) * 4.0;
    }
}
