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

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.nutation.Nutation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MoonPositionTest {

    private static final double JDE = 2448724.5; // 1992 April 12, 0h TD
    private static final double DEG_TOLERANCE = 1e-6;

    @Nested
    @DisplayName("Geocentric position")
    class PositionTests {

        @Test
        @DisplayName("Meeus example 47.a")
        void example() {
            MoonPosition.Result r = MoonPosition.geocentric(JDE);
            assertEquals(133.162655, Math.toDegrees(r.longitude), DEG_TOLERANCE);
            assertEquals(-3.229126, Math.toDegrees(r.latitude), DEG_TOLERANCE);
            assertEquals(368409.7, r.distanceKm, 0.1);
            assertEquals(r.longitude, r.ecliptic().longitude(), 0.0);
        }

        @Test
        @DisplayName("Apparent longitude adds the nutation in longitude")
        void apparent() {
            MoonPosition.Result geo = MoonPosition.geocentric(JDE);
            MoonPosition.Result app = MoonPosition.apparent(JDE);
            assertEquals(geo.longitude + Nutation.of(JDE).inLongitude, app.longitude, 1e-12);
            assertEquals(133.167265, Math.toDegrees(app.longitude), 2e-6);
            assertEquals(geo.latitude, app.latitude, 0.0);
        }

        @Test
        @DisplayName("Distance stays between perigee and apogee")
        void distanceRange() {
            for (double jd = 2451545.0; jd < 2451545.0 + 60.0; jd += 0.7) {
                double d = MoonPosition.geocentric(jd).distanceKm;
                assertTrue(d > 356000.0 && d < 407000.0, "distance " + d);
            }
        }
    }

    @Nested
    @DisplayName("Parallax and semidiameter")
    class ParallaxTests {

        @Test
        @DisplayName("Equatorial horizontal parallax")
        void parallax() {
            assertEquals(0.991990, Math.toDegrees(MoonPosition.equatorialHorizontalParallax(368409.7)), 1e-6);
        }

        @Test
        @DisplayName("Semidiameter near 15.5 arcminutes at mean distance")
        void semidiameter() {
            double s = Angles.toArcsec(MoonPosition.semidiameter(384400.0));
            assertEquals(932.6, s, 1.0);
        }

        @Test
        @DisplayName("Distances inside the Earth are rejected")
        void rejectsTinyDistance() {
            assertThrows(IllegalArgumentException.class, () -> MoonPosition.equatorialHorizontalParallax(6000.0));
        }
    }
}
