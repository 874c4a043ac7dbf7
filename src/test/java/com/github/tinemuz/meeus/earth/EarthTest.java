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

package com.github.tinemuz.meeus.earth;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.GeographicPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EarthTest {

    private static final double LAT_42 = Math.toRadians(42.0);

    @Nested
    @DisplayName("Figure of the Earth")
    class FigureTests {

        @Test
        @DisplayName("Geocentric factors for Palomar")
        void palomar() {
            Earth.GeocentricFactors f = Earth.geocentricFactors(Angles.radiansFromDms(33, 21, 22.0), 1706.0);
            assertEquals(0.5468608, f.rhoSinPhi(), 1e-7);
            assertEquals(0.8363392, f.rhoCosPhi(), 1e-7);
            assertEquals(f.rhoSinPhi(), Earth.rhoSinPhi(Angles.radiansFromDms(33, 21, 22.0), 1706.0), 0.0);
        }

        @Test
        @DisplayName("Radius of the parallel and rotation speed at 42°")
        void parallel() {
            assertEquals(4746.999, Earth.radiusOfParallel(LAT_42), 5e-3);
            assertEquals(0.346157, Earth.linearVelocity(LAT_42), 1e-6);
        }

        @Test
        @DisplayName("Radius of curvature of the meridian at 42°")
        void meridian() {
            assertEquals(6364.030, Earth.radiusOfCurvatureOfMeridian(LAT_42), 1e-3);
        }

        @Test
        @DisplayName("ρ is one at the equator and the polar ratio at the pole")
        void rho() {
            assertEquals(1.0, Earth.rho(0.0), 1e-6);
            assertEquals(Earth.POLAR_RADIUS_KM / Earth.EQUATORIAL_RADIUS_KM, Earth.rho(Math.PI / 2), 1e-6);
        }

        @Test
        @DisplayName("Geographic and geocentric latitudes differ most at 45°")
        void latitudeDifference() {
            double at45 = Earth.geographicMinusGeocentricLatitude(Math.toRadians(45.0));
            assertEquals(692.73, Angles.toArcsec(at45), 1e-6);
            assertEquals(0.0, Earth.geographicMinusGeocentricLatitude(0.0), 1e-15);
        }
    }

    @Nested
    @DisplayName("Distances")
    class DistanceTests {
        private final GeographicPoint paris = new GeographicPoint(
                Angles.radiansFromDms(true, 2, 20, 14.0), Angles.radiansFromDms(48, 50, 11.0));
        private final GeographicPoint washington = new GeographicPoint(
                Angles.radiansFromDms(77, 3, 56.0), Angles.radiansFromDms(38, 55, 17.0));

        @Test
        @DisplayName("Paris to Washington on the ellipsoid")
        void geodesic() {
            assertEquals(6181.6255, Earth.geodesicDistance(paris, washington), 1e-3);
            assertEquals(6181.6255, Earth.geodesicDistance(washington, paris), 1e-3);
        }

        @Test
        @DisplayName("Paris to Washington on a sphere")
        void sphere() {
            assertEquals(6165.597, Earth.approximateDistance(paris, washington), 1e-3);
        }

        @Test
        @DisplayName("Coincident points are zero apart")
        void coincident() {
            assertEquals(0.0, Earth.geodesicDistance(paris, paris), 0.0);
        }
    }

    @Nested
    @DisplayName("Diurnal path")
    class DiurnalPathTests {

        @Test
        @DisplayName("Equator crosses the horizon at the colatitude")
        void equator() {
            double j = Earth.angleBetweenDiurnalPathAndHorizon(0.0, Math.toRadians(40.0));
            assertEquals(50.0, Math.toDegrees(j), 1e-9);
        }

        @Test
        @DisplayName("Circumpolar body is rejected")
        void circumpolar() {
            assertThrows(IllegalArgumentException.class,
                    () -> Earth.angleBetweenDiurnalPathAndHorizon(Math.toRadians(80.0), Math.toRadians(60.0)));
        }
    }
}
