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

package com.github.tinemuz.meeus.transit;

/**
 * Kind of body whose rising and setting is computed. Each kind has its own
 * standard altitude h<sub>0</sub>: the geometric altitude of the center at
 * the moment of apparent rising or setting.
 */
public enum TransitBody {
    /** Stars and planets: refraction at the horizon only. */
    STAR_OR_PLANET(Math.toRadians(-0.5667)),
    /** The Sun: refraction plus its semidiameter. */
    SUN(Math.toRadians(-0.8333)),
    /** The Moon: h<sub>0</sub> depends on its horizontal parallax. */
    MOON(Double.NaN);

    private static final double MOON_PARALLAX_FACTOR = 0.7275;

    private final double standardAltitude;

    TransitBody(double standardAltitude) {
        this.standardAltitude = standardAltitude;
    }

    /**
     * Standard altitude in radians.
     *
     * @param moonParallax equatorial horizontal parallax of the Moon in
     *                     radians; ignored for other bodies
     */
    public double standardAltitude(double moonParallax) {
        if (this == MOON) {
            return MOON_PARALLAX_FACTOR * moonParallax + STAR_OR_PLANET.standardAltitude;
        }
        return standardAltitude;
    }
}
