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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.EclipticPoint;
import com.github.tinemuz.meeus.coords.EquatorialPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MoonIlluminationTest {

    // Meeus 48.a, 1992 April 12 0h TD
    private final EquatorialPoint sun = new EquatorialPoint(
            Angles.radiansFromHms(1, 22, 37.9), Angles.radiansFromDms(8, 41, 47));
    private final EquatorialPoint moon = new EquatorialPoint(
            Angles.radiansFromHms(8, 58, 45.1), Angles.radiansFromDms(13, 46, 6));
    private static final double SUN_DISTANCE_KM = 149971520.0;
    private static final double MOON_DISTANCE_KM = 368410.0;

    @Test
    @DisplayName("Phase angle and illuminated fraction from equatorial places")
    void fromEquatorial() {
        double i = MoonIllumination.phaseAngle(sun, moon, MOON_DISTANCE_KM, SUN_DISTANCE_KM);
        assertEquals(69.07618, Math.toDegrees(i), 1e-4);
        assertEquals(0.6786, MoonIllumination.illuminatedFraction(i), 1e-4);
    }

    @Test
    @DisplayName("Phase angle from ecliptic positions")
    void fromEcliptic() {
        EclipticPoint moonEcl = EclipticPoint.ofDegrees(133.162655, -3.229126);
        double i = MoonIllumination.phaseAngle(moonEcl, Math.toRadians(22.33978), MOON_DISTANCE_KM, SUN_DISTANCE_KM);
        assertEquals(0.6786, MoonIllumination.illuminatedFraction(i), 2e-4);
    }

    @Test
    @DisplayName("Position angle of the bright limb")
    void brightLimb() {
        assertEquals(285.04, Math.toDegrees(MoonIllumination.brightLimbPositionAngle(sun, moon)), 0.01);
    }

    @Test
    @DisplayName("New and full moon limits")
    void limits() {
        assertEquals(1.0, MoonIllumination.illuminatedFraction(0.0), 1e-15);
        assertEquals(0.0, MoonIllumination.illuminatedFraction(Math.PI), 1e-15);
        assertEquals(Math.PI, MoonIllumination.phaseAngle(0.0, MOON_DISTANCE_KM, SUN_DISTANCE_KM), 1e-12);
    }
}
