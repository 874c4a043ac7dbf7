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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DeltaTTest {

    private static final double SECONDS_TOLERANCE = 1e-6;

    @Test
    @DisplayName("Polynomial fits inside 1900-2150")
    void insideFit() {
        assertEquals(63.86, DeltaT.approximate(2000.0), SECONDS_TOLERANCE);
        assertEquals(56.894641, DeltaT.approximate(1990.0), SECONDS_TOLERANCE);
        assertEquals(66.7006, DeltaT.approximate(2010.0), SECONDS_TOLERANCE);
    }

    @Test
    @DisplayName("Long-term parabola outside the fitted window")
    void outsideFit() {
        assertEquals(26.08, DeltaT.approximate(1700.0), SECONDS_TOLERANCE);
    }

    @Test
    @DisplayName("Segments join without large jumps")
    void continuity() {
        double[] joins = {1920.0, 1941.0, 1961.0, 1986.0, 2005.0, 2050.0};
        for (double y : joins) {
            double before = DeltaT.approximate(y - 1e-6);
            double after = DeltaT.approximate(y);
            assertEquals(before, after, 1.5, "Discontinuity at " + y);
        }
    }

    @Test
    @DisplayName("Calendar date overload uses the decimal year")
    void calendarDate() {
        CalendarDate date = CalendarDate.gregorian(2000, 1, 1.0);
        assertEquals(DeltaT.approximate(2000.0), DeltaT.approximate(date), SECONDS_TOLERANCE);
    }
}
