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

package com.github.tinemuz.meeus.reduction;

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.EclipticPoint;
import com.github.tinemuz.meeus.coords.EquatorialPoint;
import com.github.tinemuz.meeus.coords.GeographicPoint;
import com.github.tinemuz.meeus.coords.Transforms;
import com.github.tinemuz.meeus.earth.Earth;

/**
 * Correction of geocentric positions for the observer's place on the Earth
 * (Meeus, chapter 40).
 */
public final class Parallax {
    private static final double SOLAR_PARALLAX = Angles.fromArcsec(8.794);

    private Parallax() {}

    /**
     * Equatorial horizontal parallax of a body.
     *
     * @param distance distance from the Earth, AU
     * @return radians
     */
    public static double equatorialHorizontalParallax(double distance) {
        if (!(distance > 0.0)) {
            throw new IllegalArgumentException("distance must be positive: " + distance);
        }
        return Math.asin(Math.sin(SOLAR_PARALLAX) / distance);
    }

    /**
     * Topocentric right ascension and declination.
     *
     * @param point             geocentric place
     * @param parallax          equatorial horizontal parallax π
     * @param observer          observer's position (longitude positive west)
     * @param heightM           observer's height above sea level, meters
     * @param greenwichSidereal apparent sidereal time at Greenwich
     */
    public static EquatorialPoint topocentricEquatorial(EquatorialPoint point, double parallax,
                                                        GeographicPoint observer, double heightM,
                                                        double greenwichSidereal) {
        Earth.GeocentricFactors f = Earth.geocentricFactors(observer.latitude(), heightM);
        double h = Transforms.hourAngle(greenwichSidereal, observer.longitude(), point.rightAscension());
        double sinPi = Math.sin(parallax);
        double denominator = Math.cos(point.declination()) - f.rhoCosPhi() * sinPi * Math.cos(h);
        double dAlpha = Math.atan2(-f.rhoCosPhi() * sinPi * Math.sin(h), denominator);
        double dec = Math.atan2((Math.sin(point.declination()) - f.rhoSinPhi() * sinPi) * Math.cos(dAlpha),
                denominator);
        return new EquatorialPoint(Angles.normalizeToTwoPi(point.rightAscension() + dAlpha), dec);
    }

    /**
     * Topocentric ecliptic position and semidiameter.
     *
     * @param point         geocentric position
     * @param parallax      equatorial horizontal parallax π
     * @param semidiameter  geocentric semidiameter
     * @param observer      observer's position (longitude positive west)
     * @param heightM       observer's height above sea level, meters
     * @param localSidereal local sidereal time
     * @param obliquity     obliquity of the ecliptic
     */
    public static Topocentric topocentricEcliptic(EclipticPoint point, double parallax, double semidiameter,
                                                  GeographicPoint observer, double heightM,
                                                  double localSidereal, double obliquity) {
        Earth.GeocentricFactors f = Earth.geocentricFactors(observer.latitude(), heightM);
        double sinPi = Math.sin(parallax);
        double sinE = Math.sin(obliquity);
        double cosE = Math.cos(obliquity);
        double sinTheta = Math.sin(localSidereal);
        double cosB = Math.cos(point.latitude());
        double n = Math.cos(point.longitude()) * cosB - f.rhoCosPhi() * sinPi * Math.cos(localSidereal);
        double lon = Math.atan2(Math.sin(point.longitude()) * cosB
                - sinPi * (f.rhoSinPhi() * sinE + f.rhoCosPhi() * cosE * sinTheta), n);
        double lat = Math.atan(Math.cos(lon) * (Math.sin(point.latitude())
                - sinPi * (f.rhoSinPhi() * cosE - f.rhoCosPhi() * sinE * sinTheta)) / n);
        double s = Math.asin(Math.cos(lon) * Math.cos(lat) * Math.sin(semidiameter) / n);
        return new Topocentric(new EclipticPoint(Angles.normalizeToTwoPi(lon), lat), s);
    }

    /** Topocentric ecliptic position with the topocentric semidiameter. */
    public static final class Topocentric {
        public final EclipticPoint position;
        /** Topocentric semidiameter, radians. */
        public final double semidiameter;

        Topocentric(EclipticPoint position, double semidiameter) {
            this.position = position;
            this.semidiameter = semidiameter;
        }
    }
}
