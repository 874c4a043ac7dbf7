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

/**
 * Ephemeris for physical observations of Jupiter (Meeus, chapter 43).
 *
 * <p>System I applies to the equatorial belt, System II to the rest of the
 * disk.</p>
 */
public final class JupiterEphemeris {
    private static final double POLAR_SEMIDIAMETER_AT_1_AU = Angles.fromArcsec(92.06);

    private JupiterEphemeris() {}

    /**
     * Physical ephemeris at an instant.
     *
     * @param jde Julian Ephemeris Day
     */
    public static Result of(double jde) {
        double d = jde - 2433282.5;
        double t1 = d / 36525.0;
        EquatorialPoint pole = EquatorialPoint.ofDegrees(268.00 + 0.1061 * t1, 64.50 - 0.0164 * t1);
        double w1 = 17.710 + 877.90003539 * d;
        double w2 = 16.838 + 870.27003539 * d;

        PlanetPosition.Geocentric geo = PlanetPosition.geocentric(Planet.JUPITER, jde);
        SphericalPosition earth = geo.earth;
        double r = geo.heliocentric.radiusVector();
        double l = geo.heliocentric.longitude() - Math.toRadians(0.01299) * geo.distance() / (r * r);
        double b = geo.heliocentric.latitude();
        double[] e = PlanetPosition.rectangular(earth);
        double[] p = PlanetPosition.rectangular(new SphericalPosition(l, b, r));
        double x = p[0] - e[0];
        double y = p[1] - e[1];
        double z = p[2] - e[2];
        double delta = Math.sqrt(x * x + y * y + z * z);

        double eps0 = Obliquity.meanIau(jde);
        EquatorialPoint sunDirection = Transforms.equatorialFromEcliptic(new EclipticPoint(l, b), eps0);
        double sunDeclination = planetocentricDeclination(pole, sunDirection.rightAscension(),
                sunDirection.declination());

        double u = y * Math.cos(eps0) - z * Math.sin(eps0);
        double v = y * Math.sin(eps0) + z * Math.cos(eps0);
        double alpha = Math.atan2(u, x);
        double dec = Math.atan2(v, Math.hypot(x, u));
        double zeta = Math.toDegrees(PoleGeometry.meridianOffset(pole, alpha, dec));
        double earthDeclination = planetocentricDeclination(pole, alpha, dec);

        // phase correction
        double sunDistance = earth.radiusVector();
        double c = 57.2958 * (2 * r * delta + sunDistance * sunDistance - r * r - delta * delta) / (4 * r * delta);
        if (Math.sin(l - earth.longitude()) < 0) c = -c;
        double systemI = Angles.normalizedRadians(w1 - zeta - 5.07033 * delta + c);
        double systemII = Angles.normalizedRadians(w2 - zeta - 5.02626 * delta + c);

        Nutation.Corrections nut = Nutation.of(jde);
        double eps = eps0 + nut.inObliquity;
        double l0 = earth.longitude();
        double k = PoleGeometry.ABERRATION_CONSTANT;
        double alphaAb = alpha + k * (Math.cos(alpha) * Math.cos(l0) * Math.cos(eps)
                + Math.sin(alpha) * Math.sin(l0)) / Math.cos(dec);
        double decAb = dec + k * (Math.cos(l0) * Math.cos(eps) * (Math.tan(eps) * Math.cos(dec)
                - Math.sin(alpha) * Math.sin(dec)) + Math.cos(alpha) * Math.sin(dec) * Math.sin(l0));
        EquatorialPoint body = withNutation(new EquatorialPoint(alphaAb, decAb), nut, eps);
        EquatorialPoint poleApparent = withNutation(pole, nut, eps);
        double positionAngle = PoleGeometry.positionAngle(poleApparent, body);

        return new Result(earthDeclination, sunDeclination, positionAngle, systemI, systemII);
    }

    /** Equatorial semidiameter for a distance from the Earth in AU. */
    public static double equatorialSemidiameter(double distance) {
        return Planet.JUPITER.semidiameter(distance);
    }

    /** Polar semidiameter for a distance from the Earth in AU. */
    public static double polarSemidiameter(double distance) {
        if (!(distance > 0.0)) {
            throw new IllegalArgumentException("distance must be positive: " + distance);
        }
        return POLAR_SEMIDIAMETER_AT_1_AU / distance;
    }

    private static double planetocentricDeclination(EquatorialPoint pole, double alpha, double dec) {
        return Math.asin(-Math.sin(pole.declination()) * Math.sin(dec)
                - Math.cos(pole.declination()) * Math.cos(dec) * Math.cos(pole.rightAscension() - alpha));
    }

    private static EquatorialPoint withNutation(EquatorialPoint p, Nutation.Corrections nut, double eps) {
        EquatorialPoint delta = Nutation.inEquatorialCoordinates(p, nut.inLongitude, nut.inObliquity, eps);
        return new EquatorialPoint(p.rightAscension() + delta.rightAscension(),
                p.declination() + delta.declination());
    }

    /** Physical ephemeris of Jupiter. All angles are radians. */
    public static final class Result {
        /** Planetocentric declination of the Earth, De. */
        public final double earthDeclination;
        /** Planetocentric declination of the Sun, Ds. */
        public final double sunDeclination;
        /** Position angle of the north pole, P, in [0, 2π). */
        public final double positionAngle;
        /** Longitude of the central meridian in System I, ω1. */
        public final double systemI;
        /** Longitude of the central meridian in System II, ω2. */
        public final double systemII;

        Result(double earthDeclination, double sunDeclination, double positionAngle, double systemI,
               double systemII) {
            this.earthDeclination = earthDeclination;
            this.sunDeclination = sunDeclination;
            this.positionAngle = positionAngle;
            this.systemI = systemI;
            this.systemII = systemII;
        }
    }
}
