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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximate difference ΔT = TD - UT in seconds.
 *
 * <p>Uses the polynomial fits published by Espenak and Meeus for 1900 to
 * 2150 and the long-term parabola outside that window. Outside the fitted
 * window the value can be wrong by minutes; a warning is logged once.</p>
 */
public final class DeltaT {
    private static final Logger log = LoggerFactory.getLogger(DeltaT.class);
    private static volatile boolean warnedOutsideFit = false;

    private DeltaT() {}

    /**
     * ΔT in seconds for a decimal year.
     *
     * @param decimalYear year with decimals, e.g. 1988.21
     * @return TD - UT in seconds
     */
    public static double approximate(double decimalYear) {
        double y = decimalYear;
        if (y < 1900.0 || y >= 2150.0) {
            warnOutsideFit(y);
            double u = (y - 1820.0) / 100.0;
            return -20.0 + 32.0 * u * u;
        }
        if (y < 1920.0) {
            double t = y - 1900.0;
            return -2.79 + t * (1.494119 + t * (-0.0598939 + t * (0.0061966 - t * 0.000197)));
        }
        if (y < 1941.0) {
            double t = y - 1920.0;
            return 21.20 + t * (0.84493 + t * (-0.076100 + t * 0.0020936));
        }
        if (y < 1961.0) {
            double t = y - 1950.0;
            return 29.07 + t * (0.407 + t * (-1.0 / 233.0 + t / 2547.0));
        }
        if (y < 1986.0) {
            double t = y - 1975.0;
            return 45.45 + t * (1.067 + t * (-1.0 / 260.0 - t / 718.0));
        }
        if (y < 2005.0) {
            double t = y - 2000.0;
            return 63.86 + t * (0.3345 + t * (-0.060374 + t * (0.0017275
                    + t * (0.000651814 + t * 0.00002373599))));
        }
        if (y < 2050.0) {
            double t = y - 2000.0;
            return 62.92 + t * (0.32217 + t * 0.005589);
        }
        double u = (y - 1820.0) / 100.0;
        return -20.0 + 32.0 * u * u - 0.5628 * (2150.0 - y);
    }

    /** ΔT in seconds for a calendar date. */
    public static double approximate(CalendarDate date) {
        return approximate(JulianDay.decimalYear(date));
    }

    private static void warnOutsideFit(double year) {
        if (!warnedOutsideFit) {
            synchronized (DeltaT.class) {
                if (!warnedOutsideFit) {
                    warnedOutsideFit = true;
                    log.warn(
                            "Year {} is outside the 1900-2150 fit for Delta T; "
                                    + "using the long-term parabola",
                            String.format("%.2f", year));
                }
            }
        }
    }
}
