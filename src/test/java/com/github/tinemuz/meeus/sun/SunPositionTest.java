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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.EclipticPoint;
import com.github.tinemuz.meeus.coords.EquatorialPoint;
import com.github.tinemuz.meeus.ecliptic.Obliquity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SunPositionTest {

    private static final double JDE = 2448908.5; // 1992 October 13, 0h TD
    private static final double DEG_TOLERANCE = 1e-5;

    @Nested
    @DisplayName("Position")
    class PositionTests {

        @Test
        @DisplayName("Geometric longitude and radius vector")
        void geometric() {
            SunPosition.Result r = SunPosition.geometric(JDE);
            assertEquals(199.90987, Math.toDegrees(r.longitude), DEG_TOLERANCE);
            assertEquals(0.0, r.latitude, 0.0);
            assertEquals(0.99766, r.radiusVector, 1e-5);
            assertEquals(278.99397, Math.toDegrees(r.meanAnomaly), 1e-4);
        }

        @Test
        @DisplayName("Apparent longitude")
        void apparent() {
            assertEquals(199.90894, Math.toDegrees(SunPosition.apparent(JDE).longitude), DEG_TOLERANCE);
        }

        @Test
        @DisplayName("Apparent right ascension and declination")
        void apparentEquatorial() {
            EquatorialPoint p = SunPosition.apparentEquatorial(JDE);
            assertEquals(198.38083, Math.toDegrees(p.rightAscension()), DEG_TOLERANCE);
            assertEquals(-7.78507, Math.toDegrees(p.declination()), DEG_TOLERANCE);
        }
    }

    @Nested
    @DisplayName("Derived quantities")
    class DerivedTests {

        @Test
        @DisplayName("Rectangular coordinates")
        void rectangular() {
            SunPosition.Result r = SunPosition.geometric(JDE);
            double[] xyz = SunPosition.rectangular(r.longitude, r.latitude, r.radiusVector, Obliquity.meanIau(JDE));
            assertEquals(-0.9379952, xyz[0], 1e-4);
            assertEquals(-0.3116544, xyz[1], 1e-4);
            assertEquals(-0.1351215, xyz[2], 1e-4);
            assertEquals(r.radiusVector, Math.sqrt(xyz[0] * xyz[0] + xyz[1] * xyz[1] + xyz[2] * xyz[2]), 1e-12);
        }

        @Test
        @DisplayName("FK5 correction is a small fixed shift in longitude")
        void fk5() {
            EclipticPoint p = SunPosition.toFk5(JDE, Math.toRadians(199.907372), Math.toRadians(0.000179));
            assertEquals(-0.09033, Angles.toArcsec(p.longitude() - Math.toRadians(199.907372)), 1e-6);
            assertTrue(Math.abs(Angles.toArcsec(p.latitude() - Math.toRadians(0.000179))) < 0.06);
        }

        @Test
        @DisplayName("Semidiameter")
        void semidiameter() {
            assertEquals(959.63, Angles.toArcsec(SunPosition.semidiameter(1.0)), 1e-9);
            assertEquals(961.879, Angles.toArcsec(SunPosition.semidiameter(0.99766195)), 1e-3);
            assertThrows(IllegalArgumentException.class, () -> SunPosition.semidiameter(0.0));
        }
    }
}
