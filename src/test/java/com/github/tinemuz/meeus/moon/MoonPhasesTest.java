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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MoonPhasesTest {

    private static final double DAY_TOLERANCE = 1e-5;

    @Test
    @DisplayName("New moon of 1977 February")
    void newMoon() {
        assertEquals(2443192.65118, MoonPhases.time(MoonPhase.NEW, 1977.13), DAY_TOLERANCE);
        assertEquals(2443192.65118, MoonPhases.timeOfLunation(MoonPhase.NEW, -283.0), DAY_TOLERANCE);
    }

    @Test
    @DisplayName("First last quarter of 2044")
    void lastQuarter() {
        assertEquals(2467636.49186, MoonPhases.time(MoonPhase.LAST_QUARTER, 2044.05), DAY_TOLERANCE);
    }

    @Test
    @DisplayName("Phases follow each other in order within a lunation")
    void ordering() {
        double newMoon = MoonPhases.timeOfLunation(MoonPhase.NEW, 100.0);
        double first = MoonPhases.timeOfLunation(MoonPhase.FIRST_QUARTER, 100.25);
        double full = MoonPhases.timeOfLunation(MoonPhase.FULL, 100.5);
        double last = MoonPhases.timeOfLunation(MoonPhase.LAST_QUARTER, 100.75);
        double next = MoonPhases.timeOfLunation(MoonPhase.NEW, 101.0);
        assertTrue(newMoon < first && first < full && full < last && last < next);
        assertEquals(29.53, next - newMoon, 0.4);
    }

    @Test
    @DisplayName("Lunation number must match the phase")
    void wrongFraction() {
        assertThrows(IllegalArgumentException.class, () -> MoonPhases.timeOfLunation(MoonPhase.FULL, 10.0));
        assertThrows(IllegalArgumentException.class, () -> MoonPhases.timeOfLunation(MoonPhase.NEW, 10.25));
    }
}
