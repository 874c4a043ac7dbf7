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

package com.github.tinemuz.meeus.star;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.orbit.EllipticOrbit;

/**
 * Apparent orbit of a visual binary star (Meeus, chapter 57).
 *
 * <p>Times are years with decimals. Solve Kepler's equation for the
 * eccentric anomaly with {@link EllipticOrbit#eccentricAnomaly}.</p>
 */
public final class BinaryStar {
    private BinaryStar() {}

    /**
     * Mean annual motion of the companion.
     *
     * @param period period of revolution in years
     * @return radians per year
     */
    public static double meanAnnualMotion(double period) {
        if (!(period > 0.0)) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        return Angles.TWO_PI / period;
    }

    /**
     * Mean anomaly of the companion, not reduced.
     *
     * @param meanMotion   radians per year
     * @param year         epoch, e.g. 1980.0
     * @param periastron   year of periastron passage
     */
    public static double meanAnomaly(double meanMotion, double year, double periastron) {
        return meanMotion * (year - periastron);
    }

    /** Radius vector in the units of the apparent semimajor axis. */
    public static double radiusVector(double semimajorAxis, double eccentricity, double eccentricAnomaly) {
        return EllipticOrbit.radiusVectorFromEccentricAnomaly(eccentricAnomaly, semimajorAxis, eccentricity);
    }

    public static double trueAnomaly(double eccentricity, double eccentricAnomaly) {
        return EllipticOrbit.trueAnomaly(eccentricAnomaly, eccentricity);
    }

    /**
     * Apparent position angle of the companion, in [0, 2π).
     *
     * @param ascendingNode position angle of the ascending node
     * @param trueAnomaly   true anomaly
     * @param periastron    longitude of periastron
     * @param inclination   inclination of the true orbit to the plane of the sky
     */
    public static double positionAngle(double ascendingNode, double trueAnomaly, double periastron,
                                       double inclination) {
        double u = trueAnomaly + periastron;
        double x = Math.atan2(Math.sin(u) * Math.cos(inclination), Math.cos(u));
        return Angles.normalizeToTwoPi(x + ascendingNode);
    }

    /** Apparent angular separation, in the units of the radius vector. */
    public static double separation(double radiusVector, double trueAnomaly, double periastron, double inclination) {
        double u = trueAnomaly + periastron;
        double s = Math.sin(u) * Math.cos(inclination);
        double c = Math.cos(u);
        return radiusVector * Math.sqrt(s * s + c * c);
    }

    /**
     * Eccentricity of the apparent orbit projected on the sky.
     *
     * @param eccentricity eccentricity of the true orbit
     * @param periastron   longitude of periastron
     * @param inclination  inclination of the true orbit
     */
    public static double apparentOrbitEccentricity(double eccentricity, double periastron, double inclination) {
        double cosI = Math.cos(inclination);
        double e2 = eccentricity * eccentricity;
        double cosW = Math.cos(periastron);
        double sinW = Math.sin(periastron);

        double a = (1.0 - e2 * cosW * cosW) * cosI * cosI;
        double b = e2 * sinW * cosW * cosI;
        double c = 1.0 - e2 * sinW * sinW;
        double d = Math.sqrt((a - c) * (a - c) + 4.0 * b * b);
        return Math.sqrt(2.0 * d / (a + c + d));
    }
}
