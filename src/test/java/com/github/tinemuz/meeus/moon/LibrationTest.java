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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LibrationTest {

    // Meeus 53.a, 1992 April 12 0h TD
    private static final double JDE = 2448724.5;
    private static final double MEAN_LONGITUDE = Math.toRadians(133.162655);
    private static final double LATITUDE = Math.toRadians(-3.229126);

    @Nested
    @DisplayName("Librations")
    class LibrationTests {

        @Test
        @DisplayName("Optical librations")
        void optical() {
            Libration.Result r = Libration.optical(JDE, MEAN_LONGITUDE, LATITUDE);
            assertEquals(-1.206, Math.toDegrees(r.longitude), 0.001);
            assertEquals(4.194, Math.toDegrees(r.latitude), 0.001);
        }

        @Test
        @DisplayName("Physical librations")
        void physical() {
            Libration.Result optical = Libration.optical(JDE, MEAN_LONGITUDE, LATITUDE);
            Libration.Result r = Libration.physical(JDE, MEAN_LONGITUDE, LATITUDE, optical.latitude);
            assertEquals(-0.025, Math.toDegrees(r.longitude), 0.001);
            assertEquals(0.006, Math.toDegrees(r.latitude), 0.001);
        }

        @Test
        @DisplayName("Total librations are the sum")
        void total() {
            Libration.Result r = Libration.total(JDE, MEAN_LONGITUDE, LATITUDE);
            assertEquals(-1.231, Math.toDegrees(r.longitude), 0.001);
            assertEquals(4.200, Math.toDegrees(r.latitude), 0.001);
        }
    }

    @Nested
    @DisplayName("Axis and topocentric corrections")
    class AxisTests {

        @Test
        @DisplayName("Position angle of the axis")
        void positionAngle() {
            Libration.Result total = Libration.total(JDE, MEAN_LONGITUDE, LATITUDE);
            double p = Libration.positionAngleOfAxis(JDE, Math.toRadians(0.004610),
                    Math.toRadians(23.440636), Math.toRadians(134.688470), total.latitude);
            assertEquals(15.08, Math.toDegrees(p), 0.01);
        }

        @Test
        @DisplayName("Moon at the zenith has no topocentric correction")
        void zenith() {
            double lat = Math.toRadians(10.0);
            Libration.Topocentric t = Libration.topocentricCorrections(
                    lat, lat, 0.0, Math.toRadians(0.95), Math.toRadians(15.0), Math.toRadians(4.0));
            assertEquals(0.0, t.longitude, 1e-8);
            assertEquals(0.0, t.latitude, 1e-8);
            assertEquals(0.0, t.positionAngle, 1e-8);
        }

        @Test
        @DisplayName("Corrections are bounded by the parallax")
        void bounded() {
            double parallax = Math.toRadians(0.95);
            Libration.Topocentric t = Libration.topocentricCorrections(Math.toRadians(45.0),
                    Math.toRadians(-5.0), Math.toRadians(60.0), parallax, Math.toRadians(15.0), Math.toRadians(4.0));
            assertTrue(Math.abs(t.latitude) <= parallax * 1.01);
            assertTrue(Math.abs(t.longitude) <= parallax * 1.01 / Math.cos(Math.toRadians(4.0)));
        }
    }
}
