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

package com.github.tinemuz.meeus.orbit;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EllipticOrbitTest {

    // Halley's comet, Meeus 39.a and 30.b
    private static final double HALLEY_A = 17.9400782;
    private static final double HALLEY_E = 0.96727426;
    private static final double HALLEY_T = 2446470.5;

    @Nested
    @DisplayName("Kepler's equation")
    class KeplerTests {

        @Test
        @DisplayName("M = 5°, e = 0.1")
        void smallEccentricity() {
            double e = EllipticOrbit.eccentricAnomaly(Math.toRadians(5.0), 0.1, 1e-12);
            assertEquals(5.5545893, Math.toDegrees(e), 1e-6);
        }

        @Test
        @DisplayName("Converges for every mean anomaly up to e = 0.99")
        void sweep() {
            double tolerance = 1e-9;
            for (double e : new double[] {0.0, 0.5, 0.9, 0.99}) {
                for (int deg = 0; deg < 360; deg++) {
                    double m = Math.toRadians(deg);
                    double ea = EllipticOrbit.eccentricAnomaly(m, e, tolerance);
                    assertEquals(m, ea - e * Math.sin(ea), tolerance, "e = " + e + ", M = " + deg + "°");
                }
            }
        }

        @Test
        @DisplayName("Whole turns of the mean anomaly are kept")
        void unreducedMeanAnomaly() {
            double m = Math.toRadians(5.0);
            double reduced = EllipticOrbit.eccentricAnomaly(m, 0.1, 1e-12);
            double turned = EllipticOrbit.eccentricAnomaly(m + 4.0 * Math.PI, 0.1, 1e-12);
            assertEquals(reduced + 4.0 * Math.PI, turned, 1e-12);
            double negative = EllipticOrbit.eccentricAnomaly(-m, 0.1, 1e-12);
            assertEquals(-reduced, negative, 1e-12);
        }

        @Test
        @DisplayName("Circular orbit returns the mean anomaly")
        void circular() {
            assertEquals(1.234, EllipticOrbit.eccentricAnomaly(1.234, 0.0, 1e-12), 0.0);
        }

        @Test
        @DisplayName("Iteration cap raises NonConvergenceException")
        void cap() {
            NonConvergenceException ex = assertThrows(NonConvergenceException.class,
                    () -> EllipticOrbit.eccentricAnomaly(0.1, 0.99, 1e-15, 5));
            assertEquals(5, ex.getIterations());
            assertTrue(ex.getLastCorrection() > 1e-15);
        }

        @Test
        @DisplayName("Non-elliptic eccentricity does not iterate")
        void parabolic() {
            NonConvergenceException ex = assertThrows(NonConvergenceException.class,
                    () -> EllipticOrbit.eccentricAnomaly(0.1, 1.0, 1e-9));
            assertEquals(0, ex.getIterations());
        }

        @Test
        @DisplayName("Invalid arguments are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> EllipticOrbit.eccentricAnomaly(0.1, -0.1, 1e-9));
            assertThrows(IllegalArgumentException.class, () -> EllipticOrbit.eccentricAnomaly(0.1, 0.1, 0.0));
            assertThrows(IllegalArgumentException.class, () -> EllipticOrbit.eccentricAnomaly(0.1, 0.1, 1e-9, 0));
        }

        @Test
        @DisplayName("True anomaly and radius vector agree")
        void anomalies() {
            double a = 2.0;
            double e = 0.3;
            double ea = EllipticOrbit.eccentricAnomaly(1.0, e, 1e-14);
            double v = EllipticOrbit.trueAnomaly(ea, e);
            assertEquals(EllipticOrbit.radiusVectorFromEccentricAnomaly(ea, a, e),
                    EllipticOrbit.radiusVectorFromTrueAnomaly(v, a, e), 1e-12);
            assertEquals(Math.PI, Math.abs(EllipticOrbit.trueAnomaly(Math.PI, e)), 1e-12);
        }
    }

    @Nested
    @DisplayName("Ellipse geometry and velocities")
    class GeometryTests {

        @Test
        @DisplayName("Velocities of Halley's comet")
        void velocities() {
            assertEquals(41.5308, EllipticOrbit.velocity(1.0, HALLEY_A), 1e-4);
            assertEquals(54.5216, EllipticOrbit.perihelionVelocity(HALLEY_A, HALLEY_E), 1e-4);
            assertEquals(0.90697, EllipticOrbit.aphelionVelocity(HALLEY_A, HALLEY_E), 1e-5);
        }

        @Test
        @DisplayName("Length of Halley's orbit")
        void length() {
            double b = HALLEY_A * Math.sqrt(1.0 - HALLEY_E * HALLEY_E);
            assertEquals(77.0903, EllipticOrbit.length(HALLEY_A, b), 1e-3);
            assertEquals(77.0649, EllipticOrbit.ramanujanLength(HALLEY_A, b), 1e-3);
            assertEquals(2.0 * Math.PI, EllipticOrbit.length(1.0, 1.0), 1e-12);
        }

        @Test
        @DisplayName("Semimajor axis and mean motion")
        void axisAndMotion() {
            assertEquals(HALLEY_A, EllipticOrbit.semimajorAxis(HALLEY_A * (1.0 - HALLEY_E), HALLEY_E), 1e-9);
            assertEquals(17.93998, EllipticOrbit.semimajorAxis(0.5870992, HALLEY_E), 1e-5);
            assertEquals(EllipticOrbit.GAUSS_K, EllipticOrbit.meanMotion(1.0), 0.0);
            assertThrows(IllegalArgumentException.class, () -> EllipticOrbit.semimajorAxis(1.0, 1.0));
        }
    }

    @Nested
    @DisplayName("Passage through the nodes")
    class NodeTests {

        private final double omega = Math.toRadians(111.84644);
        private final double n = EllipticOrbit.meanMotion(HALLEY_A);

        @Test
        @DisplayName("Ascending node of Halley's comet")
        void ascending() {
            NodePassage p = EllipticOrbit.passageThroughNode(NodeKind.ASCENDING, omega, n, HALLEY_A, HALLEY_E, HALLEY_T);
            assertEquals(-92.2990, p.time() - HALLEY_T, 1e-3);
            assertEquals(1.80450, p.radiusVector(), 1e-4);
        }

        @Test
        @DisplayName("Descending node of Halley's comet")
        void descending() {
            NodePassage p = EllipticOrbit.passageThroughNode(NodeKind.DESCENDING, omega, n, HALLEY_A, HALLEY_E, HALLEY_T);
            assertEquals(28.91026, p.time() - HALLEY_T, 1e-3);
            assertEquals(0.849290, p.radiusVector(), 1e-4);
        }
    }

    @Test
    @DisplayName("Orbital elements record derives the usual quantities")
    void orbitalElements() {
        OrbitalElements el = new OrbitalElements(HALLEY_A, HALLEY_E, Math.toRadians(162.2), 1.0, 2.0);
        assertEquals(0.5870992, el.perihelionDistance(), 1e-5);
        assertEquals(35.29, el.aphelionDistance(), 0.01);
        assertEquals(HALLEY_A * Math.sqrt(1.0 - HALLEY_E * HALLEY_E), el.semiminorAxis(), 1e-12);
        assertEquals(3.0, el.longitudeOfPerihelion(), 1e-12);
        assertEquals(76.0, el.period() / 365.25, 0.1);
        assertThrows(IllegalArgumentException.class, () -> new OrbitalElements(-1.0, 0.1, 0.0, 0.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new OrbitalElements(1.0, 1.0, 0.0, 0.0, 0.0));
    }
}
