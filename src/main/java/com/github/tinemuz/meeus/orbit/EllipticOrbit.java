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

import com.github.tinemuz.meeus.angle.Angles;

/**
 * Motion in an elliptic orbit (Meeus, chapters 30 and 39).
 *
 * <p>Distances are in AU, velocities in km/s and times in days. Angles are
 * radians.</p>
 */
public final class EllipticOrbit {
    /** Gaussian gravitational constant, radians per day. */
    public static final double GAUSS_K = 0.01720209895;

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private static final double HIGH_ECCENTRICITY = 0.8;

    private EllipticOrbit() {}

    /**
     * Solve Kepler's equation E = M + e sin E by Newton's method (Meeus
     * 30.7), starting from M, or from π when e exceeds 0.8.
     *
     * @param meanAnomaly M, radians
     * @param eccentricity e, in [0, 1)
     * @param tolerance   stop when successive values differ by less than this
     * @return eccentric anomaly E, radians
     * @throws NonConvergenceException if e &gt;= 1 or the iteration limit is hit
     */
    public static double eccentricAnomaly(double meanAnomaly, double eccentricity, double tolerance) {
        return eccentricAnomaly(meanAnomaly, eccentricity, tolerance, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Solve Kepler's equation with an explicit iteration limit.
     *
     * @throws IllegalArgumentException if e is negative, the tolerance is not
     *                                  positive or the limit is below one
     * @throws NonConvergenceException  if e &gt;= 1 or the iteration limit is hit
     */
    public static double eccentricAnomaly(double meanAnomaly, double eccentricity, double tolerance,
                                          int maxIterations) {
        if (!(eccentricity >= 0.0)) {
            throw new IllegalArgumentException("eccentricity must be non-negative: " + eccentricity);
        }
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1: " + maxIterations);
        }
        if (eccentricity >= 1.0) {
            // not an ellipse
            throw new NonConvergenceException("Kepler's equation has no elliptic solution for e = "
                    + eccentricity, 0, Double.NaN);
        }
        // solve for M reduced to [0, 2π) and restore the whole turns afterwards
        double m = Angles.normalizeToTwoPi(meanAnomaly);
        double turns = meanAnomaly - m;
        double ea = eccentricity > HIGH_ECCENTRICITY ? Math.PI : m;
        double correction = Double.NaN;
        for (int i = 1; i <= maxIterations; i++) {
            double step = (m + eccentricity * Math.sin(ea) - ea) / (1.0 - eccentricity * Math.cos(ea));
            ea += step;
            correction = Math.abs(step);
            if (correction <= tolerance) {
                return ea + turns;
            }
        }
        throw new NonConvergenceException("Kepler's equation did not converge", maxIterations, correction);
    }

    /** True anomaly from the eccentric anomaly. */
    public static double trueAnomaly(double eccentricAnomaly, double eccentricity) {
        return 2.0 * Math.atan2(Math.sqrt(1.0 + eccentricity) * Math.sin(eccentricAnomaly / 2.0),
                Math.sqrt(1.0 - eccentricity) * Math.cos(eccentricAnomaly / 2.0));
    }

    /** r = a (1 - e cos E). */
    public static double radiusVectorFromEccentricAnomaly(double eccentricAnomaly, double semimajorAxis,
                                                          double eccentricity) {
        return semimajorAxis * (1.0 - eccentricity * Math.cos(eccentricAnomaly));
    }

    /** r = a (1 - e²) / (1 + e cos v). */
    public static double radiusVectorFromTrueAnomaly(double trueAnomaly, double semimajorAxis,
                                                     double eccentricity) {
        return semimajorAxis * (1.0 - eccentricity * eccentricity) / (1.0 + eccentricity * Math.cos(trueAnomaly));
    }

    /**
     * Instantaneous velocity from the vis-viva relation.
     *
     * @param radiusVector  distance from the Sun, AU
     * @param semimajorAxis AU
     * @return km/s
     */
    public static double velocity(double radiusVector, double semimajorAxis) {
        return 42.1219 * Math.sqrt(1.0 / radiusVector - 0.5 / semimajorAxis);
    }

    /** Velocity at perihelion, km/s. */
    public static double perihelionVelocity(double semimajorAxis, double eccentricity) {
        return 29.7847 * Math.sqrt((1.0 + eccentricity) / ((1.0 - eccentricity) * semimajorAxis));
    }

    /** Velocity at aphelion, km/s. */
    public static double aphelionVelocity(double semimajorAxis, double eccentricity) {
        return 29.7847 * Math.sqrt((1.0 - eccentricity) / ((1.0 + eccentricity) * semimajorAxis));
    }

    /**
     * Length of the ellipse from the arithmetic, geometric and harmonic means
     * of its axes (Meeus 30.4). Good to 0.001% for e below 0.95.
     */
    public static double length(double semimajorAxis, double semiminorAxis) {
        double a = semimajorAxis;
        double b = semiminorAxis;
        double am = (a + b) / 2.0;
        double gm = Math.sqrt(a * b);
        double hm = 2.0 * a * b / (a + b);
        return Math.PI * (21.0 * am - 2.0 * gm - 3.0 * hm) / 8.0;
    }

    /** Ramanujan's first approximation to the length of the ellipse. */
    public static double ramanujanLength(double semimajorAxis, double semiminorAxis) {
        double a = semimajorAxis;
        double b = semiminorAxis;
        return Math.PI * (3.0 * (a + b) - Math.sqrt((a + 3.0 * b) * (3.0 * a + b)));
    }

    /** a = q / (1 - e). */
    public static double semimajorAxis(double perihelionDistance, double eccentricity) {
        if (!(eccentricity >= 0.0 && eccentricity < 1.0)) {
            throw new IllegalArgumentException("eccentricity must be in [0, 1): " + eccentricity);
        }
        return perihelionDistance / (1.0 - eccentricity);
    }

    /** Mean motion in radians per day for a semimajor axis in AU. */
    public static double meanMotion(double semimajorAxis) {
        return GAUSS_K / Math.pow(semimajorAxis, 1.5);
    }

    /**
     * Time and distance of the passage through a node.
     *
     * @param kind                 which node
     * @param argumentOfPerihelion ω, radians
     * @param meanMotion           n, radians per day
     * @param semimajorAxis        a, AU
     * @param eccentricity         e
     * @param perihelionTime       T, JDE
     */
    public static NodePassage passageThroughNode(NodeKind kind, double argumentOfPerihelion, double meanMotion,
                                                 double semimajorAxis, double eccentricity,
                                                 double perihelionTime) {
        double v = kind == NodeKind.ASCENDING ? -argumentOfPerihelion : Math.PI - argumentOfPerihelion;
        double ea = 2.0 * Math.atan(Math.sqrt((1.0 - eccentricity) / (1.0 + eccentricity)) * Math.tan(v / 2.0));
        double m = ea - eccentricity * Math.sin(ea);
        return new NodePassage(perihelionTime + m / meanMotion,
                semimajorAxis * (1.0 - eccentricity * Math.cos(ea)));
    }
}
