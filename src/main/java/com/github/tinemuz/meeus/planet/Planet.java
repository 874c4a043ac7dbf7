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

/**
 * The major planets. Semidiameters are at a distance of 1 AU; for Jupiter
 * and Saturn they are equatorial.
 */
public enum Planet {
    MERCURY(3.36),
    VENUS(8.41),
    EARTH(Double.NaN),
    MARS(4.68),
    JUPITER(98.44),
    SATURN(82.73),
    URANUS(35.02),
    NEPTUNE(33.50);

    private final double semidiameterArcsec;

    Planet(double semidiameterArcsec) {
        this.semidiameterArcsec = semidiameterArcsec;
    }

    /**
     * Semidiameter at 1 AU, in arcseconds.
     *
     * @throws IllegalArgumentException for {@link #EARTH}, which is never
     *                                  seen from the Earth
     */
    public double semidiameterAtUnitDistance() {
        if (this == EARTH) {
            throw new IllegalArgumentException("The Earth has no geocentric semidiameter");
        }
        return semidiameterArcsec;
    }

    /**
     * Apparent semidiameter.
     *
     * @param distance distance from the Earth, AU
     * @return radians
     */
    public double semidiameter(double distance) {
        if (!(distance > 0.0)) {
            throw new IllegalArgumentException("distance must be positive: " + distance);
        }
        return Angles.fromArcsec(semidiameterAtUnitDistance()) / distance;
    }
}
