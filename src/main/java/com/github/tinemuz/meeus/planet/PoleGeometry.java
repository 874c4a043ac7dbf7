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

/** Shared steps of the physical ephemerides of Mars, Jupiter and Saturn. */
final class PoleGeometry {
    static final double ABERRATION_CONSTANT = Math.toRadians(0.005693);

    private PoleGeometry() {}

    /** Position angle of a pole measured eastward from north at the body's place. */
    static double positionAngle(EquatorialPoint pole, EquatorialPoint body) {
        double dAlpha = pole.rightAscension() - body.rightAscension();
        return Angles.normalizeToTwoPi(Math.atan2(
                Math.cos(pole.declination()) * Math.sin(dAlpha),
                Math.sin(pole.declination()) * Math.cos(body.declination())
                        - Math.cos(pole.declination()) * Math.sin(body.declination()) * Math.cos(dAlpha)));
    }

    /**
     * Planetocentric declination of a point seen in direction (λ, β) from
     * a planet whose pole is at (λ0, β0).
     */
    static double declinationOnPlanet(EclipticPoint pole, double longitude, double latitude) {
        return Math.asin(-Math.sin(pole.latitude()) * Math.sin(latitude)
                - Math.cos(pole.latitude()) * Math.cos(latitude) * Math.cos(pole.longitude() - longitude));
    }

    /** Annual aberration in ecliptic coordinates given the Earth's heliocentric longitude. */
    static EclipticPoint withAberration(EclipticPoint p, double earthLongitude) {
        double lambda = p.longitude() + ABERRATION_CONSTANT * Math.cos(earthLongitude - p.longitude())
                / Math.cos(p.latitude());
        double beta = p.latitude() + ABERRATION_CONSTANT * Math.sin(earthLongitude - lambda)
                * Math.sin(p.latitude());
        return new EclipticPoint(lambda, beta);
    }

    /**
     * Angle between the direction of the pole and the meridian through the
     * planet, used to turn a prime-meridian angle into a central meridian.
     */
    static double meridianOffset(EquatorialPoint pole, double rightAscension, double declination) {
        double dAlpha = pole.rightAscension() - rightAscension;
        return Math.atan2(
                Math.sin(pole.declination()) * Math.cos(declination) * Math.cos(dAlpha)
                        - Math.sin(declination) * Math.cos(pole.declination()),
                Math.cos(declination) * Math.sin(dAlpha));
    }
}
