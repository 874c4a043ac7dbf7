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

package com.github.tinemuz.meeus.coords;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.meeus.angle.Angles;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TransformsTest {

    private static final double DEG_TOLERANCE = 1e-5;

    @Nested
    @DisplayName("Equatorial and ecliptic")
    class EclipticTests {

        private final EquatorialPoint pollux = new EquatorialPoint(
                Angles.radiansFromHms(7, 45, 18.946), Angles.radiansFromDms(28, 1, 34.26));
        private final double eps = Math.toRadians(23.4392911);

        @Test
        @DisplayName("Pollux to ecliptic coordinates")
        void toEcliptic() {
            EclipticPoint e = Transforms.eclipticFromEquatorial(pollux, eps);
            assertEquals(113.215629, Math.toDegrees(e.longitude()), DEG_TOLERANCE);
            assertEquals(6.684170, Math.toDegrees(e.latitude()), DEG_TOLERANCE);
        }

        @Test
        @DisplayName("Ecliptic back to equatorial")
        void roundTrip() {
            EquatorialPoint back = Transforms.equatorialFromEcliptic(
                    Transforms.eclipticFromEquatorial(pollux, eps), eps);
            assertEquals(pollux.rightAscension(), back.rightAscension(), 1e-12);
            assertEquals(pollux.declination(), back.declination(), 1e-12);
        }

        @Test
        @DisplayName("Ecliptic round trip for random points and obliquities")
        void randomRoundTrip() {
            Random random = new Random(20240601L);
            for (int i = 0; i < 10000; i++) {
                EquatorialPoint p = new EquatorialPoint(random.nextDouble() * 2.0 * Math.PI,
                        Math.toRadians(-89.0 + 178.0 * random.nextDouble()));
                double obliquity = Math.toRadians(45.0 * random.nextDouble());
                EquatorialPoint back = Transforms.equatorialFromEcliptic(
                        Transforms.eclipticFromEquatorial(p, obliquity), obliquity);
                assertEquals(0.0, p.separation(back), 1e-9, "point " + p + ", obliquity " + obliquity);
                assertEquals(p.declination(), back.declination(), 1e-9);
            }
        }
    }

    @Nested
    @DisplayName("Horizontal coordinates")
    class HorizontalTests {

        private final double lat = Angles.radiansFromDms(38, 55, 17);
        private final double lon = Angles.radiansFromDms(77, 3, 56);
        private final EquatorialPoint venus = new EquatorialPoint(
                Angles.radiansFromHms(23, 9, 16.641), Angles.radiansFromDms(true, 6, 43, 11.61));

        @Test
        @DisplayName("Venus seen from Washington, 1987 April 10 19h21m UT")
        void venus() {
            double theta0 = Angles.radiansFromHms(8, 34, 56.853);
            double h = Transforms.hourAngle(theta0, lon, venus.rightAscension());
            assertEquals(64.351994, Angles.normalizeTo360(Math.toDegrees(h)), DEG_TOLERANCE);
            HorizontalPoint p = Transforms.horizontalFromEquatorial(h, venus.declination(), lat);
            assertEquals(68.033596, Math.toDegrees(p.azimuth()), DEG_TOLERANCE);
            assertEquals(15.124974, Math.toDegrees(p.altitude()), DEG_TOLERANCE);
        }

        @Test
        @DisplayName("Horizontal back to hour angle and declination")
        void inverse() {
            double h = Math.toRadians(64.352);
            HorizontalPoint p = Transforms.horizontalFromEquatorial(h, venus.declination(), lat);
            assertEquals(h, Transforms.hourAngleFromHorizontal(p, lat), 1e-12);
            assertEquals(venus.declination(), Transforms.declinationFromHorizontal(p, lat), 1e-12);
        }

        @Test
        @DisplayName("Hour angle from local sidereal time")
        void localSidereal() {
            assertEquals(0.5, Transforms.hourAngleFromLocalSidereal(2.0, 1.5), 0.0);
        }
    }

    @Nested
    @DisplayName("Galactic coordinates")
    class GalacticTests {

        @Test
        @DisplayName("Nova Serpentis 1978")
        void nova() {
            EquatorialPoint nova = new EquatorialPoint(
                    Angles.radiansFromHms(17, 48, 59.74), Angles.radiansFromDms(true, 14, 43, 8.2));
            GalacticPoint g = Transforms.galacticFromEquatorial(nova);
            assertEquals(12.959250, Math.toDegrees(g.longitude()), DEG_TOLERANCE);
            assertEquals(6.046298, Math.toDegrees(g.latitude()), DEG_TOLERANCE);

            EquatorialPoint back = Transforms.equatorialFromGalactic(g);
            assertEquals(nova.rightAscension(), back.rightAscension(), 1e-10);
            assertEquals(nova.declination(), back.declination(), 1e-10);
        }
    }

    @Nested
    @DisplayName("Angular separation")
    class SeparationTests {

        private final EquatorialPoint arcturus = EquatorialPoint.ofDegrees(213.9154, 19.1825);
        private final EquatorialPoint spica = EquatorialPoint.ofDegrees(201.2983, -11.1614);

        @Test
        @DisplayName("Arcturus and Spica")
        void arcturusSpica() {
            assertEquals(32.793027, Math.toDegrees(AngularSeparation.between(arcturus, spica)), DEG_TOLERANCE);
            assertEquals(32.793027, Math.toDegrees(arcturus.separation(spica)), DEG_TOLERANCE);
            assertEquals(32.793027, Math.toDegrees(AngularSeparation.lawOfCosines(
                    arcturus.rightAscension(), arcturus.declination(),
                    spica.rightAscension(), spica.declination())), DEG_TOLERANCE);
        }

        @Test
        @DisplayName("Stable for tiny and antipodal separations")
        void extremes() {
            double tiny = Angles.fromArcsec(0.001);
            assertEquals(tiny, AngularSeparation.separation(1.0, 0.2, 1.0 + tiny / Math.cos(0.2), 0.2), 1e-14);
            assertEquals(Math.PI, AngularSeparation.separation(0.3, 0.4, 0.3 + Math.PI, -0.4), 1e-12);
        }

        @Test
        @DisplayName("Ecliptic points use the same formula")
        void ecliptic() {
            EclipticPoint a = EclipticPoint.ofDegrees(10.0, 0.0);
            EclipticPoint b = EclipticPoint.ofDegrees(40.0, 0.0);
            assertEquals(30.0, Math.toDegrees(AngularSeparation.between(a, b)), 1e-10);
            assertEquals(30.0, Math.toDegrees(a.separation(b)), 1e-10);
        }
    }
}
