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
 * Motion in an orbit with eccentricity close to 1, elliptic or hyperbolic
 * (Meeus, chapter 35; algorithm of W. Landgraf).
 */
public final class NearParabolicOrbit {
    private static final int MAX_SERIES_TERMS = 50;
    private static final int MAX_OUTER_ITERATIONS = 50;
    private static final int MAX_INNER_ITERATIONS = 100;
    private static final double DIVERGENCE_LIMIT = 1000.0;

    private NearParabolicOrbit() {}

    /**
     * True anomaly and radius vector.
     *
     * @param daysFromPerihelion t - T, days
     * @param perihelionDistance q, AU
     * @param eccentricity       e, positive
     * @param tolerance          convergence threshold, e.g. 1e-9
     * @return {v (radians, in [0, 2π)), r (AU)}
     * @throws NonConvergenceException if the series diverges or the
     *                                 iterations do not settle
     */
    public static double[] trueAnomalyAndRadiusVector(double daysFromPerihelion, double perihelionDistance,
                                                      double eccentricity, double tolerance) {
        if (!(perihelionDistance > 0.0)) {
            throw new IllegalArgumentException("perihelion distance must be positive: " + perihelionDistance);
        }
        if (!(eccentricity > 0.0)) {
            throw new IllegalArgumentException("eccentricity must be positive: " + eccentricity);
        }
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        }
        if (daysFromPerihelion == 0.0) {
            return new double[] {0.0, perihelionDistance};
        }
        double e = eccentricity;
        double q1 = EllipticOrbit.GAUSS_K * Math.sqrt((1.0 + e) / perihelionDistance) / (2.0 * perihelionDistance);
        double g = (1.0 - e) / (1.0 + e);
        double q2 = q1 * daysFromPerihelion;
        double s = 2.0 / (3.0 * Math.abs(q2));
        s = 2.0 / Math.tan(2.0 * Math.atan(Math.cbrt(Math.tan(Math.atan(s) / 2.0))));
        if (daysFromPerihelion < 0.0) s = -s;

        if (e != 1.0) {
            double outerCorrection = Double.NaN;
            for (int outer = 1; ; outer++) {
                if (outer > MAX_OUTER_ITERATIONS) {
                    throw new NonConvergenceException("Near-parabolic solution did not converge",
                            MAX_OUTER_ITERATIONS, outerCorrection);
                }
                double s0 = s;
                double y = s * s;
                double g1 = -y * s;
                double q3 = q2 + g * s * y * 2.0 / 3.0;
                double f;
                int z = 1;
                do {
                    z++;
                    g1 = -g1 * g * y;
                    double z1 = (z - (z + 1) * g) / (2.0 * z + 1.0);
                    f = z1 * g1;
                    q3 += f;
                    if (z > MAX_SERIES_TERMS || Math.abs(f) > DIVERGENCE_LIMIT) {
                        throw new NonConvergenceException("Near-parabolic series diverges", z, Math.abs(f));
                    }
                } while (Math.abs(f) > tolerance);

                double innerCorrection;
                int inner = 0;
                do {
                    if (++inner > MAX_INNER_ITERATIONS) {
                        throw new NonConvergenceException("Near-parabolic inner iteration did not converge",
                                MAX_INNER_ITERATIONS, Math.abs(s - s0));
                    }
                    double s1 = s;
                    s = (2.0 * s * s * s / 3.0 + q3) / (s * s + 1.0);
                    innerCorrection = Math.abs(s - s1);
                } while (innerCorrection > tolerance);

                outerCorrection = Math.abs(s - s0);
                if (outerCorrection <= tolerance) break;
            }
        }

        double v = Angles.normalizeToTwoPi(2.0 * Math.atan(s));
        double r = perihelionDistance * (1.0 + e) / (1.0 + e * Math.cos(v));
        return new double[] {v, r};
    }
}
