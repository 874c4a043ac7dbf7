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
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Ephemeris for physical observations of Mars (Meeus, chapter 42).
 */
public final class MarsEphemeris {
    /** North pole of Mars, equinox J2000.0. */
    public static final EquatorialPoint NORTH_POLE_J2000 = EquatorialPoint.ofDegrees(317.681, 52.886);

    private static final double SEMIDIAMETER_AT_1_AU = Angles.fromArcsec(4.68);
    private static final double DIAMETER_AT_1_AU = Angles.fromArcsec(9.36);

    private MarsEphemeris() {}

    /** Ecliptic coordinates of the north pole of Mars, mean equinox of date. */
    public static EclipticPoint northPole(double jde) {
        double t = JulianDay.julianCentury(jde);
        return EclipticPoint.ofDegrees(352.9065 + 1.17330 * t, 63.28180 - 0.00394 * t);
    }

    /**
     * Physical ephemeris at an instant.
     *
     * @param jde Julian Ephemeris Day
     */
    public static Result of(double jde) {
        double t = JulianDay.julianCentury(jde);
        EclipticPoint pole = northPole(jde);
        PlanetPosition.Geocentric geo = PlanetPosition.geocentric(Planet.MARS, jde);
        SphericalPosition helio = geo.heliocentric;
        SphericalPosition earth = geo.earth;
        double lambda = geo.position.longitude();
        double beta = geo.position.latitude();
        double delta = geo.distance();

        double earthDeclination = PoleGeometry.declinationOnPlanet(pole, lambda, beta);

        double n = Math.toRadians(49.5581 + 0.7721 * t);
        double l1 = helio.longitude() - Math.toRadians(0.00697 / helio.radiusVector());
        double b1 = helio.latitude()
                - Math.toRadians(0.000225 * Math.cos(helio.longitude() - n) / helio.radiusVector());
        double sunDeclination = PoleGeometry.declinationOnPlanet(pole, l1, b1);

        double w = Angles.normalizedRadians(11.504 + 350.89200025 * (jde - geo.lightTime - 2433282.5));
        double eps0 = Obliquity.meanIau(jde);
        EquatorialPoint pole0 = Transforms.equatorialFromEcliptic(pole, eps0);
        double u = geo.y * Math.cos(eps0) - geo.z * Math.sin(eps0);
        double v = geo.y * Math.sin(eps0) + geo.z * Math.cos(eps0);
        double alpha = Math.atan2(u, geo.x);
        double dec = Math.atan2(v, Math.hypot(geo.x, u));
        double zeta = PoleGeometry.meridianOffset(pole0, alpha, dec);
        double centralMeridian = Angles.normalizeToTwoPi(w - zeta);

        Nutation.Corrections nut = Nutation.of(jde);
        EclipticPoint apparent = PoleGeometry.withAberration(geo.ecliptic(), earth.longitude());
        double trueObliquity = eps0 + nut.inObliquity;
        EquatorialPoint body = Transforms.equatorialFromEcliptic(
                new EclipticPoint(apparent.longitude() + nut.inLongitude, apparent.latitude()), trueObliquity);
        EquatorialPoint poleApparent = Transforms.equatorialFromEcliptic(
                new EclipticPoint(pole.longitude() + nut.inLongitude, pole.latitude()), trueObliquity);
        double positionAngle = PoleGeometry.positionAngle(poleApparent, body);

        double diameter = DIAMETER_AT_1_AU / delta;
        double k = PlanetPosition.illuminatedFraction(helio.radiusVector(), delta, earth.radiusVector());
        return new Result(earthDeclination, sunDeclination, positionAngle, centralMeridian, diameter,
                (1.0 - k) * diameter, k);
    }

    /** Apparent semidiameter for a distance from the Earth in AU. */
    public static double semidiameter(double distance) {
        return SEMIDIAMETER_AT_1_AU / distance;
    }

    /** Physical ephemeris of Mars. All angles are radians. */
    public static final class Result {
        /** Planetocentric declination of the Earth, De. */
        public final double earthDeclination;
        /** Planetocentric declination of the Sun, Ds. */
        public final double sunDeclination;
        /** Position angle of the north pole, P, in [0, 2π). */
        public final double positionAngle;
        /** Areographic longitude of the central meridian, ω. */
        public final double centralMeridian;
        /** Apparent diameter d. */
        public final double diameter;
        /** Greatest defect of illumination q. */
        public final double defectOfIllumination;
        /** Illuminated fraction of the disk k. */
        public final double illuminatedFraction;

        Result(double earthDeclination, double sunDeclination, double positionAngle, double centralMeridian,
               double diameter, double defectOfIllumination, double illuminatedFraction) {
            this.earthDeclination = earthDeclination;
            this.sunDeclination = sunDeclination;
            this.positionAngle = positionAngle;
            this.centralMeridian = centralMeridian;
            this.diameter = diameter;
            this.defectOfIllumination = defectOfIllumination;
            this.illuminatedFraction = illuminatedFraction;
        }
    }
}
