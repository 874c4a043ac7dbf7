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

package com.github.tinemuz.meeus.ecliptic;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.meeus.angle.Angles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ObliquityTest {

    private static final double ARCSEC_TOLERANCE = 0.001;
    private static final double JDE = 2446895.5;

    @Nested
    @DisplayName("Obliquity of the ecliptic")
    class ObliquityTests {

        @Test
        @DisplayName("IAU mean obliquity, 1987 April 10")
        void meanIau() {
            assertEquals(Angles.degreesFromDms(23, 26, 27.407),
                    Math.toDegrees(Obliquity.meanIau(JDE)), ARCSEC_TOLERANCE / 3600.0);
        }

        @Test
        @DisplayName("Laskar agrees with IAU near J2000.0")
        void laskar() {
            assertEquals(Obliquity.meanIau(JDE), Obliquity.meanLaskar(JDE), Angles.fromArcsec(0.01));
            assertEquals(Obliquity.J2000, Obliquity.meanLaskar(2451545.0), 1e-12);
        }

        @Test
        @DisplayName("True obliquity adds the nutation in obliquity")
        void trueObliquity() {
            assertEquals(Angles.degreesFromDms(23, 26, 36.849),
                    Math.toDegrees(Obliquity.trueObliquity(JDE)), 0.002 / 3600.0);
        }
    }

    @Nested
    @DisplayName("Ecliptic and horizon")
    class HorizonTests {

        private final double eps = Math.toRadians(23.44);
        private final double lat = Math.toRadians(51.0);
        private final double theta = Math.toRadians(75.0);

        @Test
        @DisplayName("Longitudes of the ecliptic points on the horizon")
        void longitudes() {
            double[] lons = EclipticHorizon.longitudesOnHorizon(eps, lat, theta);
            assertEquals(349.35830, Math.toDegrees(lons[0]), 1e-4);
            assertEquals(169.35830, Math.toDegrees(lons[1]), 1e-4);
        }

        @Test
        @DisplayName("Angle between the ecliptic and the horizon")
        void angle() {
            assertEquals(61.88731, Math.toDegrees(EclipticHorizon.angleWithHorizon(eps, lat, theta)), 1e-4);
        }
    }
}
