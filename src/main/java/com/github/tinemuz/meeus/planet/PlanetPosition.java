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
import com.github.tinemuz.meeus.orbit.EllipticOrbit;
import com.github.tinemuz.meeus.orbit.NonConvergenceException;

/**
 * Planetary positions from the mean elements of {@link MeanElements} and
 * Kepler's equation (Meeus, chapters 31 and 33).
 *
 * <p>The positions are those of an unperturbed ellipse, good to about one
 * arcminute for the inner planets over a few centuries and rather worse for
 * Jupiter and Saturn. They are referred to the mean ecliptic and equinox of
 * the date.</p>
 */
public final class PlanetPosition {
    /** Days of light travel per AU. */
    public static final double LIGHT_TIME_PER_AU = 0.0057755183;

    private static final double KEPLER_TOLERANCE = 1e-12;
    private static final double LIGHT_TIME_TOLERANCE = 1e-9;
    private static final int MAX_LIGHT_TIME_ITERATIONS = 10;

    private PlanetPosition() {}

    /**
     * Heliocentric ecliptic position.
     *
     * @param planet the planet
     * @param jde    Julian Ephemeris Day
     */
    public static SphericalPosition heliocentric(Planet planet, double jde) {
        MeanElements el = MeanElements.of(planet, jde);
        double e = EllipticOrbit.eccentricAnomaly(el.meanAnomaly, el.eccentricity, KEPLER_TOLERANCE);
        double v = EllipticOrbit.trueAnomaly(e, el.eccentricity);
        double r = EllipticOrbit.radiusVectorFromEccentricAnomaly(e, el.semimajorAxis, el.eccentricity);
        if (planet == Planet.EARTH) {
            return new SphericalPosition(Angles.normalizeToTwoPi(v + el.longitudeOfPerihelion), 0.0, r);
        }
        return heliocentricFromElements(el.inclination, el.ascendingNode, el.argumentOfPerihelion, v, r);
    }

    /**
     * Heliocentric ecliptic position of a body from its orbital elements and
     * its place in the orbit.
     *
     * @param inclination          i
     * @param ascendingNode        Ω
     * @param argumentOfPerihelion ω
     * @param trueAnomaly          v
     * @param radiusVector         r, AU
     */
    public static SphericalPosition heliocentricFromElements(double inclination, double ascendingNode,
                                                             double argumentOfPerihelion, double trueAnomaly,
                                                             double radiusVector) {
        double u = argumentOfPerihelion + trueAnomaly;
        double x = radiusVector * (Math.cos(ascendingNode) * Math.cos(u)
                - Math.sin(ascendingNode) * Math.sin(u) * Math.cos(inclination));
        double y = radiusVector * (Math.sin(ascendingNode) * Math.cos(u)
                + Math.cos(ascendingNode) * Math.sin(u) * Math.cos(inclination));
        double z = radiusVector * Math.sin(inclination) * Math.sin(u);
        return fromRectangular(x, y, z);
    }

    /**
     * Geometric geocentric position corrected for light time. The
     * correction is iterated until it changes by less than 1e-9 day.
     *
     * @throws IllegalArgumentException if {@code planet} is the Earth
     * @throws NonConvergenceException  if the light time does not settle
     */
    public static Geocentric geocentric(Planet planet, double jde) {
        if (planet == Planet.EARTH) {
            throw new IllegalArgumentException("The Earth has no geocentric position");
        }
        SphericalPosition earth = heliocentric(Planet.EARTH, jde);
        double[] e = rectangular(earth);
        double tau = 0.0;
        double correction = Double.NaN;
        for (int i = 1; i <= MAX_LIGHT_TIME_ITERATIONS; i++) {
            SphericalPosition body = heliocentric(planet, jde - tau);
            double[] p = rectangular(body);
            double x = p[0] - e[0];
            double y = p[1] - e[1];
            double z = p[2] - e[2];
            double distance = Math.sqrt(x * x + y * y + z * z);
            double newTau = lightTime(distance);
            correction = Math.abs(newTau - tau);
            tau = newTau;
            if (correction < LIGHT_TIME_TOLERANCE) {
                return new Geocentric(fromRectangular(x, y, z), x, y, z, tau, body, earth);
            }
        }
        throw new NonConvergenceException("Light-time correction did not converge",
                MAX_LIGHT_TIME_ITERATIONS, correction);
    }

    /** Ecliptic rectangular coordinates {x, y, z} of a spherical position. */
    public static double[] rectangular(SphericalPosition p) {
        double cosB = Math.cos(p.latitude());
        return new double[] {
                p.radiusVector() * cosB * Math.cos(p.longitude()),
                p.radiusVector() * cosB * Math.sin(p.longitude()),
                p.radiusVector() * Math.sin(p.latitude())
        };
    }

    /** Spherical position from ecliptic rectangular coordinates. */
    public static SphericalPosition fromRectangular(double x, double y, double z) {
        double rho = Math.hypot(x, y);
        return new SphericalPosition(
                Angles.normalizeToTwoPi(Math.atan2(y, x)),
                Math.atan2(z, rho),
                Math.sqrt(rho * rho + z * z));
    }

    /**
     * Light travel time.
     *
     * @param distance AU
     * @return days
     */
    public static double lightTime(double distance) {
        return LIGHT_TIME_PER_AU * distance;
    }

    /**
     * Illuminated fraction of a planet's disk from the Sun-planet,
     * Earth-planet and Sun-Earth distances.
     */
    public static double illuminatedFraction(double radiusVector, double distance, double earthRadiusVector) {
        double s = radiusVector + distance;
        return (s * s - earthRadiusVector * earthRadiusVector) / (4.0 * radiusVector * distance);
    }

    /** Geocentric position of a planet together with the vectors it came from. */
    public static final class Geocentric {
        /** Geocentric ecliptic longitude, latitude and distance Δ. */
        public final SphericalPosition position;
        /** Geocentric ecliptic rectangular coordinates, AU. */
        public final double x;
        public final double y;
        public final double z;
        /** Light time, days. */
        public final double lightTime;
        /** Heliocentric position of the planet at the retarded time. */
        public final SphericalPosition heliocentric;
        /** Heliocentric position of the Earth at the instant of observation. */
        public final SphericalPosition earth;

        Geocentric(SphericalPosition position, double x, double y, double z, double lightTime,
                   SphericalPosition heliocentric, SphericalPosition earth) {
            this.position = position;
            this.x = x;
            this.y = y;
            this.z = z;
            this.lightTime = lightTime;
            this.heliocentric = heliocentric;
            this.earth = earth;
        }

        /** Distance from the Earth, AU. */
        public double distance() {
            return position.radiusVector();
        }

        public EclipticPoint ecliptic() {
            return new EclipticPoint(position.longitude(), position.latitude());
        }
    }
}
