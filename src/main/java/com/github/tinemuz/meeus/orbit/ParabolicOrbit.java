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

/**
 * Motion in a parabolic orbit (Meeus, chapters 34 and 39).
 */
public final class ParabolicOrbit {

    private ParabolicOrbit() {}

    /**
     * True anomaly and radius vector, solving Barker's equation directly.
     *
     * @param daysFromPerihelion t - T, days
     * @param perihelionDistance q, AU
     * @return {v (radians, in (-π, π)), r (AU)}
     */
    public static double[] trueAnomalyAndRadiusVector(double daysFromPerihelion, double perihelionDistance) {
        if (!(perihelionDistance > 0.0)) {
            throw new IllegalArgumentException("perihelion distance must be positive: " + perihelionDistance);
        }
        double w = 0.03649116245 * daysFromPerihelion / Math.pow(perihelionDistance, 1.5);
        double g = w / 2.0;
        double y = Math.cbrt(g + Math.sqrt(g * g + 1.0));
        double s = y - 1.0 / y;
        return new double[] {2.0 * Math.atan(s), perihelionDistance * (1.0 + s * s)};
    }

    /**
     * Time and distance of the passage through a node.
     *
     * @param kind                 which node
     * @param argumentOfPerihelion ω, radians
     * @param perihelionDistance   q, AU
     * @param perihelionTime       T, JDE
     */
    public static NodePassage passageThroughNode(NodeKind kind, double argumentOfPerihelion,
                                                 double perihelionDistance, double perihelionTime) {
        double v = kind == NodeKind.ASCENDING ? -argumentOfPerihelion : Math.PI - argumentOfPerihelion;
        double s = Math.tan(v / 2.0);
        double t = perihelionTime + 27.403895 * s * (s * s + 3.0) * Math.pow(perihelionDistance, 1.5);
        return new NodePassage(t, perihelionDistance * (1.0 + s * s));
    }
}
