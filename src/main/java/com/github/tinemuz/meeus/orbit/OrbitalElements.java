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
 * Keplerian elements of an elliptic orbit. Angles are radians and refer to
 * the ecliptic and equinox of a single epoch.
 *
 * @param semimajorAxis        a, AU
 * @param eccentricity         e, in [0, 1)
 * @param inclination          i
 * @param ascendingNode        Ω, longitude of the ascending node
 * @param argumentOfPerihelion ω
 */
public record OrbitalElements(
        double semimajorAxis,
        double eccentricity,
        double inclination,
        double ascendingNode,
        double argumentOfPerihelion) {

    public OrbitalElements {
        if (!(semimajorAxis > 0.0)) {
            throw new IllegalArgumentException("semimajor axis must be positive: " + semimajorAxis);
        }
        if (!(eccentricity >= 0.0 && eccentricity < 1.0)) {
            throw new IllegalArgumentException("eccentricity must be in [0, 1): " + eccentricity);
        }
    }

    /** q = a (1 - e). */
    public double perihelionDistance() {
        return semimajorAxis * (1.0 - eccentricity);
    }

    /** Q = a (1 + e). */
    public double aphelionDistance() {
        return semimajorAxis * (1.0 + eccentricity);
    }

    public double semiminorAxis() {
        return semimajorAxis * Math.sqrt(1.0 - eccentricity * eccentricity);
    }

    /** ϖ = Ω + ω, in [0, 2π). */
    public double longitudeOfPerihelion() {
        return Angles.normalizeToTwoPi(ascendingNode + argumentOfPerihelion);
    }

    /** Mean motion, radians per day. */
    public double meanMotion() {
        return EllipticOrbit.meanMotion(semimajorAxis);
    }

    /** Sidereal period in days. */
    public double period() {
        return Angles.TWO_PI / meanMotion();
    }
}
