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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.meeus.angle.Angles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SiderealTimeTest {

    /** 0.001 second of time. */
    private static final double HOURS_TOLERANCE = 0.001 / 3600.0;

    @Test
    @DisplayName("Mean sidereal time at 0h UT, 1987 April 10")
    void meanAtZeroHours() {
        double hours = SiderealTime.toHours(SiderealTime.meanGreenwich(2446895.5));
        assertEquals(Angles.hoursFromHms(13, 10, 46.3668), hours, HOURS_TOLERANCE);
    }

    @Test
    @DisplayName("Mean sidereal time at any instant")
    void meanAtInstant() {
        double hours = SiderealTime.toHours(SiderealTime.meanGreenwich(2446896.30625));
        assertEquals(Angles.hoursFromHms(8, 34, 57.0896), hours, HOURS_TOLERANCE);
    }

    @Test
    @DisplayName("Apparent sidereal time includes the equation of the equinoxes")
    void apparent() {
        double dPsi = Angles.fromArcsec(-3.788);
        double eps = Angles.radiansFromDms(23, 26, 36.85);
        double hours = SiderealTime.toHours(SiderealTime.apparentGreenwich(2446895.5, dPsi, eps));
        assertEquals(Angles.hoursFromHms(13, 10, 46.1351), hours, HOURS_TOLERANCE);
        double computed = SiderealTime.toHours(SiderealTime.apparentGreenwich(2446895.5));
        assertEquals(Angles.hoursFromHms(13, 10, 46.1351), computed, HOURS_TOLERANCE);
    }

    @Test
    @DisplayName("Result lies in [0, 2π)")
    void range() {
        for (double jd = 2400000.5; jd < 2500000.5; jd += 12345.678) {
            double s = SiderealTime.meanGreenwich(jd);
            assertTrue(s >= 0.0 && s < Angles.TWO_PI);
        }
    }
}
