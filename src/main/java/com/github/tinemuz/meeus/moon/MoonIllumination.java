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

package com.github.tinemuz.meeus.moon;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.AngularSeparation;
import com.github.tinemuz.meeus.coords.EclipticPoint;
import com.github.tinemuz.meeus.coords.EquatorialPoint;

/**
 * Illuminated fraction and bright limb of the Moon (Meeus, chapter 48).
 *
 * <p>The same relations apply to a planet when the Earth-Sun and
 * Earth-body distances are given in the same unit.</p>
 */
public final class MoonIllumination {

    private MoonIllumination() {}

    /**
     * Phase angle (Sun-Moon-Earth) from the geocentric elongation of the
     * Moon.
     *
     * @param elongation     geocentric elongation ψ of the Moon from the Sun
     * @param moonDistance   Earth-Moon distance
     * @param sunDistance    Earth-Sun distance, same unit as moonDistance
     * @return phase angle i, radians, in [0, π]
     */
    public static double phaseAngle(double elongation, double moonDistance, double sunDistance) {
        return Math.atan2(sunDistance * Math.sin(elongation),
                moonDistance - sunDistance * Math.cos(elongation));
    }

    /** Phase angle from the equatorial positions of the Sun and the Moon. */
    public static double phaseAngle(
            EquatorialPoint sun, EquatorialPoint moon, double moonDistance, double sunDistance) {
        return phaseAngle(AngularSeparation.between(sun, moon), moonDistance, sunDistance);
    }

    /**
     * Phase angle from the Moon's ecliptic position and the Sun's longitude.
     */
    public static double phaseAngle(
            EclipticPoint moon, double sunLongitude, double moonDistance, double sunDistance) {
        double cosPsi = Math.cos(moon.latitude()) * Math.cos(moon.longitude() - sunLongitude);
        double psi = Math.acos(Math.max(-1.0, Math.min(1.0, cosPsi)));
        return phaseAngle(psi, moonDistance, sunDistance);
    }

    /**
     * Illuminated fraction of the disk, k = (1 + cos i) / 2.
     *
     * @param phaseAngle phase angle i, radians
     * @return fraction in [0, 1]
     */
    public static double illuminatedFraction(double phaseAngle) {
        return (1.0 + Math.cos(phaseAngle)) / 2.0;
    }

    /**
     * Position angle of the Moon's bright limb, measured eastward from the
     * north point of the disk.
     *
     * @param sun  apparent place of the Sun
     * @param moon apparent place of the Moon
     * @return χ in radians, in [0, 2π)
     */
    public static double brightLimbPositionAngle(EquatorialPoint sun, EquatorialPoint moon) {
        double dAlpha = sun.rightAscension() - moon.rightAscension();
        double y = Math.cos(sun.declination()) * Math.sin(dAlpha);
        double x = Math.sin(sun.declination()) * Math.cos(moon.declination())
                - Math.cos(sun.declination()) * Math.sin(moon.declination()) * Math.cos(dAlpha);
        return Angles.normalizeToTwoPi(Math.atan2(y, x));
    }
}
