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

package com.github.tinemuz.meeus.ecliptic;

import com.github.tinemuz.meeus.angle.Angles;

/**
 * The ecliptic and the horizon (Meeus, chapter 24).
 */
public final class EclipticHorizon {

    private EclipticHorizon() {}

    /**
     * Longitudes of the two points of the ecliptic on the horizon.
     *
     * @param obliquity     ε, radians
     * @param latitude      observer's latitude φ, radians
     * @param localSidereal local sidereal time θ, radians
     * @return the two longitudes in [0, 2π), 180° apart; the first is the
     *         setting point when {@code localSidereal} is that of the
     *         observer
     */
    public static double[] longitudesOnHorizon(double obliquity, double latitude, double localSidereal) {
        double lon = Math.atan2(-Math.cos(localSidereal),
                Math.sin(obliquity) * Math.tan(latitude) + Math.cos(obliquity) * Math.sin(localSidereal));
        double first = Angles.normalizeToTwoPi(lon);
        return new double[] {first, Angles.normalizeToTwoPi(first + Math.PI)};
    }

    /**
     * Angle between the ecliptic and the horizon.
     *
     * @return angle I, radians, in [0, π]
     */
    public static double angleWithHorizon(double obliquity, double latitude, double localSidereal) {
        double cosI = Math.cos(obliquity) * Math.sin(latitude)
                - Math.sin(obliquity) * Math.cos(latitude) * Math.sin(localSidereal);
        return Math.acos(Math.max(-1.0, Math.min(1.0, cosI)));
    }
}
