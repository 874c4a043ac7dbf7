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

package com.github.tinemuz.meeus.moon;

import com.github.tinemuz.meeus.angle.Angles;

/**
 * Instants of the principal phases of the Moon (Meeus, chapter 49).
 *
 * <p>Mean error about 4 seconds of time for dates between 1980 and
 * 2020.</p>
 */
public final class MoonPhases {
    private static final double[] NEW_MOON_COEFFS = {
        -0.40720, 0.17241, 0.01608, 0.01039, 0.00739, -0.00514, 0.00208, -0.00111,
        -0.00057, 0.00056, -0.00042, 0.00042, 0.00038, -0.00024, -0.00017, -0.00007,
        0.00004, 0.00004, 0.00003, 0.00003, -0.00003, 0.00003, -0.00002, -0.00002,
        0.00002
    };
    private static final double[] FULL_MOON_COEFFS = {
        -0.40614, 0.17302, 0.01614, 0.01043, 0.00734, -0.00515, 0.00209, -0.00111,
        -0.00057, 0.00056, -0.00042, 0.00042, 0.00038, -0.00024, -0.00017, -0.00007,
        0.00004, 0.00004, 0.00003, 0.00003, -0.00003, 0.00003, -0.00002, -0.00002,
        0.00002
    };
    // power of E applied to each new/full moon coefficient
    private static final int[] NEW_FULL_E_POWER = {
        0, 1, 0, 0, 1, 1, 2, 0, 0, 1, 0, 1, 1, 1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0
    };
    private static final double[] QUARTER_COEFFS = {
        -0.62801, 0.17172, -0.01183, 0.00862, 0.00804, 0.00454, 0.00204, -0.00180,
        -0.00070, -0.00040, -0.00034, 0.00032, 0.00032, -0.00028, 0.00027, -0.00017,
        -0.00005, 0.00004, -0.00004, 0.00004, 0.00003, 0.00003, 0.00002, 0.00002,
        -0.00002
    };
    private static final int[] QUARTER_E_POWER = {
        0, 1, 1, 0, 0, 1, 2, 0, 0, 0, 0, 1, 1, 2, 1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0
    };
    private static final double[] PLANETARY_COEFFS = {
        0.000325, 0.000165, 0.000164, 0.000126, 0.000110, 0.000062, 0.000060,
        0.000056, 0.000047, 0.000042, 0.000040, 0.000037, 0.000035, 0.000023
    };

    private MoonPhases() {}

    /**
     * Instant of the given phase nearest to a date.
     *
     * @param phase       the phase
     * @param decimalYear approximate date, year with decimals
     * @return Julian Ephemeris Day of the phase
     */
    public static double time(MoonPhase phase, double decimalYear) {
        double approx = 12.3685 * (decimalYear - 2000.0);
        double k = Math.rint(approx - phase.fraction()) + phase.fraction();
        return timeOfLunation(phase, k);
    }

    /**
     * Instant of lunation {@code k}. k = 0 is the new moon of 2000
     * January 6; the fractional part of k must match the phase.
     *
     * @throws IllegalArgumentException if k has the wrong fractional part
     */
    public static double timeOfLunation(MoonPhase phase, double k) {
        double frac = k - Math.floor(k);
        if (Math.abs(frac - phase.fraction()) > 1e-9) {
            throw new IllegalArgumentException("k = " + k + " does not denote a " + phase + " phase");
        }
        double t = k / 1236.85;
        double jde = 2451550.09766 + 29.530588861 * k
                + t * t * (0.00015437 + t * (-0.000000150 + t * 0.00000000073));
        double e = MoonPosition.eccentricityFactor(t);
        double m = Angles.normalizedRadians(2.5534 + 29.10535670 * k
                - t * t * (0.0000014 + t * 0.00000011));
        double m1 = Angles.normalizedRadians(201.5643 + 385.81693528 * k
                + t * t * (0.0107582 + t * (0.00001238 - t * 0.000000058)));
        double f = Angles.normalizedRadians(160.7108 + 390.67050284 * k
                - t * t * (0.0016118 + t * (0.00000227 - t * 0.000000011)));
        double omega = Angles.normalizedRadians(124.7746 - 1.56375588 * k
                + t * t * (0.0020672 + t * 0.00000215));

        switch (phase) {
            case NEW:
                jde += periodic(NEW_MOON_COEFFS, NEW_FULL_E_POWER, e, newFullArguments(m, m1, f, omega));
                break;
            case FULL:
                jde += periodic(FULL_MOON_COEFFS, NEW_FULL_E_POWER, e, newFullArguments(m, m1, f, omega));
                break;
            default:
                jde += periodic(QUARTER_COEFFS, QUARTER_E_POWER, e, quarterArguments(m, m1, f, omega));
                double w = 0.00306
                        - 0.00038 * e * Math.cos(m)
                        + 0.00026 * Math.cos(m1)
                        - 0.00002 * Math.cos(m1 - m)
                        + 0.00002 * Math.cos(m1 + m)
                        + 0.00002 * Math.cos(2.0 * f);
                jde += phase == MoonPhase.FIRST_QUARTER ? w : -w;
                break;
        }

        double[] planetary = {
            299.77 + 0.107408 * k - 0.009173 * t * t,
            251.88 + 0.016321 * k,
            251.83 + 26.651886 * k,
            349.42 + 36.412478 * k,
            84.66 + 18.206239 * k,
            141.74 + 53.303771 * k,
            207.14 + 2.453732 * k,
            154.84 + 7.306860 * k,
            34.52 + 27.261239 * k,
            207.19 + 0.121824 * k,
            291.34 + 1.844379 * k,
            161.72 + 24.198154 * k,
            239.56 + 25.513099 * k,
            331.55 + 3.592518 * k
        };
        for (int i = 0; i < planetary.length; i++) {
            jde += PLANETARY_COEFFS[i] * Math.sin(Angles.normalizedRadians(planetary[i]));
        }
        return jde;
    }

    private static double periodic(double[] coeffs, int[] ePower, double e, double[] args) {
        double sum = 0.0;
        for (int i = 0; i < coeffs.length; i++) {
            double scale = ePower[i] == 0 ? 1.0 : (ePower[i] == 1 ? e : e * e);
            sum += coeffs[i] * scale * Math.sin(args[i]);
        }
        return sum;
    }

    private static double[] newFullArguments(double m, double m1, double f, double omega) {
        return new double[] {
            m1, m, 2 * m1, 2 * f, m1 - m, m1 + m, 2 * m, m1 - 2 * f, m1 + 2 * f, 2 * m1 + m,
            3 * m1, m + 2 * f, m - 2 * f, 2 * m1 - m, omega, m1 + 2 * m, 2 * m1 - 2 * f, 3 * m,
            m1 + m - 2 * f, 2 * m1 + 2 * f, m1 + m + 2 * f, m1 - m + 2 * f, m1 - m - 2 * f,
            3 * m1 + m, 4 * m1
        };
    }

    private static double[] quarterArguments(double m, double m1, double f, double omega) {
        return new double[] {
            m1, m, m1 + m, 2 * m1, 2 * f, m1 - m, 2 * m, m1 - 2 * f, m1 + 2 * f, 3 * m1,
            2 * m1 - m, m + 2 * f, m - 2 * f, m1 + 2 * m, 2 * m1 + m, omega, m1 - m - 2 * f,
            2 * m1 + 2 * f, m1 + m + 2 * f, m1 - 2 * m, m1 + m - 2 * f, 3 * m, 2 * m1 - 2 * f,
            m1 - m + 2 * f, 3 * m1 + m
        };
    }
}
