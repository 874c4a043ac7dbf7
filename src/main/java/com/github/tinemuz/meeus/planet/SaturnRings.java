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

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.EclipticPoint;
import com.github.tinemuz.meeus.coords.EquatorialPoint;
import com.github.tinemuz.meeus.coords.Transforms;
import com.github.tinemuz.meeus.ecliptic.Obliquity;
import com.github.tinemuz.meeus.nutation.Nutation;
import com.github.tinemuz.meeus.series.Polynomials;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * The ring system of Saturn (Meeus, chapter 45).
 */
public final class SaturnRings {
    /** Ratio of the inner edge of the outer ring to the outer edge of the outer ring. */
    public static final double INNER_EDGE_OF_OUTER_RING = 0.8801;
    /** Ratio of the outer edge of the inner ring. */
    public static final double OUTER_EDGE_OF_INNER_RING = 0.8599;
    /** Ratio of the inner edge of the inner ring. */
    public static final double INNER_EDGE_OF_INNER_RING = 0.6650;
    /** Ratio of the inner edge of the dusky ring. */
    public static final double INNER_EDGE_OF_DUSKY_RING = 0.5486;

    private static final double RING_SEMIMAJOR_AT_1_AU = Angles.fromArcsec(375.35);
    private static final double POLAR_SEMIDIAMETER_AT_1_AU = Angles.fromArcsec(73.82);

    private SaturnRings() {}

    /** Inclination of the ring plane on the ecliptic of date. */
    public static double inclination(double t) {
        return Math.toRadians(Polynomials.horner(t, 28.075216, -0.012998, 0.000004));
    }

    /** Longitude of the ascending node of the ring plane on the ecliptic of date. */
    public static double ascendingNode(double t) {
        return Math.toRadians(Polynomials.horner(t, 169.508470, 1.394681, 0.000412));
    }

    /**
     * Ring elements at an instant.
     *
     * @param jde Julian Ephemeris Day
     */
    public static Result of(double jde) {
        double t = JulianDay.julianCentury(jde);
        double i = inclination(t);
        double omega = ascendingNode(t);

        PlanetPosition.Geocentric geo = PlanetPosition.geocentric(Planet.SATURN, jde);
        SphericalPosition helio = geo.heliocentric;
        double lambda = geo.position.longitude();
        double beta = geo.position.latitude();
        double delta = geo.distance();

        double earthLatitude = Math.asin(Math.sin(i) * Math.cos(beta) * Math.sin(lambda - omega)
                - Math.cos(i) * Math.sin(beta));
        double a = RING_SEMIMAJOR_AT_1_AU / delta;
        double b = a * Math.sin(Math.abs(earthLatitude));

        double n = Math.toRadians(113.6655 + 0.8771 * t);
        double r = helio.radiusVector();
        double l1 = helio.longitude() - Math.toRadians(0.01759 / r);
        double b1 = helio.latitude() - Math.toRadians(0.000764 * Math.cos(helio.longitude() - n) / r);
        double sunLatitude = Math.asin(Math.sin(i) * Math.cos(b1) * Math.sin(l1 - omega)
                - Math.cos(i) * Math.sin(b1));
        double u1 = Math.atan2(Math.sin(i) * Math.sin(b1) + Math.cos(i) * Math.cos(b1) * Math.sin(l1 - omega),
                Math.cos(b1) * Math.cos(l1 - omega));
        double u2 = Math.atan2(Math.sin(i) * Math.sin(beta) + Math.cos(i) * Math.cos(beta) * Math.sin(lambda - omega),
                Math.cos(beta) * Math.cos(lambda - omega));
        double deltaU = Math.abs(Angles.normalizeToPlusMinusPi(u1 - u2));

        Nutation.Corrections nut = Nutation.of(jde);
        double eps = Obliquity.meanIau(jde) + nut.inObliquity;
        EclipticPoint apparent = PoleGeometry.withAberration(geo.ecliptic(), geo.earth.longitude());
        EquatorialPoint body = Transforms.equatorialFromEcliptic(
                new EclipticPoint(apparent.longitude() + nut.inLongitude, apparent.latitude()), eps);
        EquatorialPoint pole = Transforms.equatorialFromEcliptic(
                new EclipticPoint(omega - Math.PI / 2 + nut.inLongitude, Math.PI / 2 - i), eps);
        double positionAngle = PoleGeometry.positionAngle(pole, body);

        return new Result(earthLatitude, sunLatitude, positionAngle, deltaU, a, b);
    }

    /**
     * Apparent polar semidiameter of Saturn's globe, allowing for the tilt
     * of the planet toward the Earth.
     *
     * @param distance      distance from the Earth, AU
     * @param earthLatitude Saturnicentric latitude of the Earth B
     */
    public static double polarSemidiameter(double distance, double earthLatitude) {
        if (!(distance > 0.0)) {
            throw new IllegalArgumentException("distance must be positive: " + distance);
        }
        double a = Angles.fromArcsec(Planet.SATURN.semidiameterAtUnitDistance());
        double ratio = POLAR_SEMIDIAMETER_AT_1_AU / a;
        double k = 1.0 - ratio * ratio;
        double cosB = Math.cos(earthLatitude);
        return a / distance * Math.sqrt(1.0 - k * cosB * cosB);
    }

    /** Ring elements. All angles are radians. */
    public static final class Result {
        /** Saturnicentric latitude of the Earth referred to the ring plane, B. */
        public final double earthLatitude;
        /** Saturnicentric latitude of the Sun referred to the ring plane, B'. */
        public final double sunLatitude;
        /** Position angle of the northern semiminor axis of the ring ellipse, P. */
        public final double positionAngle;
        /** Difference between the Saturnicentric longitudes of Sun and Earth, ΔU. */
        public final double deltaU;
        /** Apparent semimajor axis of the outer edge of the outer ring. */
        public final double semimajorAxis;
        /** Apparent semiminor axis of the outer edge of the outer ring. */
        public final double semiminorAxis;

        Result(double earthLatitude, double sunLatitude, double positionAngle, double deltaU,
               double semimajorAxis, double semiminorAxis) {
            this.earthLatitude = earthLatitude;
            this.sunLatitude = sunLatitude;
            this.positionAngle = positionAngle;
            this.deltaU = deltaU;
            this.semimajorAxis = semimajorAxis;
            this.semiminorAxis = semiminorAxis;
        }

        /** Semiaxes of another ring edge, given its ratio to the outer edge. */
        public double[] edge(double ratio) {
            return new double[] {semimajorAxis * ratio, semiminorAxis * ratio};
        }
    }
}
