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

import com.github.tinemuz.meeus.angle.Angles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PhysicalEphemerisTest {

    @Nested
    @DisplayName("Mars on 1992 November 9")
    class MarsTests {
        private final MarsEphemeris.Result mars = MarsEphemeris.of(2448935.5);

        @Test
        @DisplayName("Declinations of the Earth and the Sun")
        void declinations() {
            assertEquals(12.426, Math.toDegrees(mars.earthDeclination), 0.05);
            assertEquals(-2.768, Math.toDegrees(mars.sunDeclination), 0.05);
        }

        @Test
        @DisplayName("Position angle and central meridian")
        void orientation() {
            assertEquals(347.625, Math.toDegrees(mars.positionAngle), 0.05);
            assertEquals(111.34, Math.toDegrees(mars.centralMeridian), 0.5);
        }

        @Test
        @DisplayName("Apparent diameter and defect of illumination")
        void disk() {
            assertEquals(10.758, Angles.toArcsec(mars.diameter), 0.02);
            assertEquals(1.063, Angles.toArcsec(mars.defectOfIllumination), 0.02);
            assertEquals(mars.diameter * (1.0 - mars.illuminatedFraction), mars.defectOfIllumination, 1e-15);
        }
    }

    @Nested
    @DisplayName("Jupiter on 1992 December 16")
    class JupiterTests {
        private final JupiterEphemeris.Result jupiter = JupiterEphemeris.of(2448972.50068);

        @Test
        @DisplayName("Declinations and position angle")
        void geometry() {
            assertEquals(-2.479, Math.toDegrees(jupiter.earthDeclination), 0.02);
            assertEquals(-2.191, Math.toDegrees(jupiter.sunDeclination), 0.02);
            assertEquals(24.815, Math.toDegrees(jupiter.positionAngle), 0.02);
        }

        @Test
        @DisplayName("Central meridians of systems I and II")
        void systems() {
            assertEquals(268.20, Math.toDegrees(jupiter.systemI), 0.2);
            assertEquals(72.88, Math.toDegrees(jupiter.systemII), 0.2);
        }

        @Test
        @DisplayName("Polar semidiameter is smaller than equatorial")
        void flattening() {
            assertTrue(JupiterEphemeris.polarSemidiameter(5.0) < JupiterEphemeris.equatorialSemidiameter(5.0));
        }
    }

    @Nested
    @DisplayName("Saturn's rings on 1992 December 16")
    class SaturnTests {
        private final SaturnRings.Result rings = SaturnRings.of(2448972.50068);

        @Test
        @DisplayName("Ring plane latitudes")
        void latitudes() {
            assertEquals(16.452, Math.toDegrees(rings.earthLatitude), 0.02);
            assertEquals(14.697, Math.toDegrees(rings.sunLatitude), 0.02);
        }

        @Test
        @DisplayName("Position angle and ΔU")
        void angles() {
            assertEquals(6.741, Math.toDegrees(rings.positionAngle), 0.02);
            assertEquals(4.181, Math.toDegrees(rings.deltaU), 0.02);
        }

        @Test
        @DisplayName("Outer ring axes")
        void axes() {
            assertEquals(35.736, Angles.toArcsec(rings.semimajorAxis), 0.05);
            assertEquals(10.121, Angles.toArcsec(rings.semiminorAxis), 0.05);
        }

        @Test
        @DisplayName("Inner edges scale the outer ellipse")
        void edges() {
            double[] edge = rings.edge(SaturnRings.INNER_EDGE_OF_OUTER_RING);
            assertEquals(rings.semimajorAxis * 0.8801, edge[0], 1e-15);
            assertEquals(rings.semiminorAxis * 0.8801, edge[1], 1e-15);
        }

        @Test
        @DisplayName("Globe polar semidiameter shrinks as the pole tilts away")
        void polarSemidiameter() {
            double edgeOn = SaturnRings.polarSemidiameter(10.0, 0.0);
            double tilted = SaturnRings.polarSemidiameter(10.0, Math.toRadians(26.0));
            assertTrue(edgeOn < tilted);
            assertThrows(IllegalArgumentException.class, () -> SaturnRings.polarSemidiameter(0.0, 0.0));
        }
    }

    @Nested
    @DisplayName("Magnitudes and minor planets")
    class MagnitudeTests {

        @Test
        @DisplayName("Saturn by Müller's formula")
        void saturn() {
            double m = PlanetMagnitude.saturnMuller(9.867, 10.464, Math.toRadians(4.198), Math.toRadians(16.442));
            assertEquals(0.9384, m, 1e-4);
            double aa = PlanetMagnitude.saturn1984(9.867, 10.464, Math.toRadians(4.198), Math.toRadians(16.442));
            assertEquals(m - 0.20, aa, 1e-12);
        }

        @Test
        @DisplayName("Diameter of Vesta from H and albedo")
        void diameter() {
            double d = Asteroids.diameterKm(3.34, 0.38);
            assertEquals(459.31, d, 0.01);
            assertEquals(1.3788 * d / 1.5, Asteroids.apparentDiameter(d, 1.5), 1e-9);
        }

        @Test
        @DisplayName("Invalid albedo or distance")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> Asteroids.diameterKm(3.0, 0.0));
            assertThrows(IllegalArgumentException.class, () -> Asteroids.diameterKm(3.0, 1.5));
            assertThrows(IllegalArgumentException.class, () -> Asteroids.apparentDiameter(100.0, 0.0));
        }
    }
}
