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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlutoTest {

    @Test
    @DisplayName("Heliocentric position on 1992 October 13")
    void heliocentric() {
        SphericalPosition p = Pluto.heliocentric(2448908.5);
        assertEquals(232.74071, Math.toDegrees(p.longitude()), 1e-4);
        assertEquals(14.58782, Math.toDegrees(p.latitude()), 1e-4);
        assertEquals(29.711111, p.radiusVector(), 1e-5);
    }

    @Test
    @DisplayName("Table loads eagerly")
    void preload() {
        assertDoesNotThrow(Pluto::preload);
    }

    @Test
    @DisplayName("Outside 1885-2099 still returns a position")
    void outsideRange() {
        SphericalPosition p = Pluto.heliocentric(2305447.5);
        assertTrue(p.radiusVector() > 25.0 && p.radiusVector() < 55.0);
    }

    @Test
    @DisplayName("Magnitude by the 1984 formula")
    void magnitude() {
        assertEquals(13.7284, Pluto.magnitude(29.711, 29.7), 1e-4);
        assertEquals(Pluto.magnitude(29.711, 29.7), PlanetMagnitude.pluto1984(29.711, 29.7), 0.0);
    }

    @Test
    @DisplayName("Semidiameter requires a positive distance")
    void semidiameter() {
        assertEquals(Pluto.semidiameter(10.0) * 2.0, Pluto.semidiameter(5.0), 1e-18);
        assertThrows(IllegalArgumentException.class, () -> Pluto.semidiameter(-1.0));
    }
}
