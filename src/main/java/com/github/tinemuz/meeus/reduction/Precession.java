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
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Precession of coordinates and orbital elements between two epochs
 * (Meeus, chapters 21 and 24).
 */
public final class Precession {
    /** Julian Day of the Besselian epoch B1900.0 used by the FK4 expressions. */
    private static final double B1900 = 2415020.3135;
    private static final double TROPICAL_CENTURY = 36524.2199;

    private Precession() {}

    /**
     * Annual precession in right ascension and declination, low accuracy.
     *
     * @param point mean place of the star
     * @param jd    epoch, Julian Day
     * @return yearly change of α and δ in radians, packed as an {@link EquatorialPoint}
     */
    public static EquatorialPoint annual(EquatorialPoint point, double jd) {
        double t = JulianDay.julianCentury(jd);
        double m = Angles.fromArcsec(15.0 * (3.07496 + 0.00186 * t));
        double n = Angles.fromArcsec(15.0 * (1.33621 - 0.00057 * t));
        double ra = point.rightAscension();
        return new EquatorialPoint(
                m + n * Math.sin(ra) * Math.tan(point.declination()),
                n * Math.cos(ra));
    }

    /**
     * Rigorous precession of equatorial coordinates in the FK5 system.
     *
     * @param point    mean place at the starting epoch
     * @param jdFrom   starting epoch, Julian Day
     * @param jdTo     final epoch, Julian Day
     */
    public static EquatorialPoint equatorial(EquatorialPoint point, double jdFrom, double jdTo) {
        double tt = JulianDay.julianCentury(jdFrom);
        double t = (jdTo - jdFrom) / JulianDay.DAYS_PER_CENTURY;
        double x = t * (2306.2181 + tt * (1.39656 - 0.000139 * tt));
        double zeta = Angles.fromArcsec(x + t * t * ((0.30188 - 0.000344 * tt) + 0.017998 * t));
        double z = Angles.fromArcsec(x + t * t * ((1.09468 + 0.000066 * tt) + 0.018203 * t));
        double theta = Angles.fromArcsec(t * ((2004.3109 - tt * (0.85330 + 0.000217 * tt))
                - t * ((0.42665 + 0.000217 * tt) + 0.041833 * t)));
        return rotate(point, zeta, z, theta);
    }

    /**
     * Precession of equatorial coordinates in the older FK4 system, with
     * epochs expressed in tropical centuries from B1900.0.
     */
    public static EquatorialPoint equatorialFk4(EquatorialPoint point, double jdFrom, double jdTo) {
        double tt = (jdFrom - B1900) / TROPICAL_CENTURY;
        double t = (jdTo - jdFrom) / TROPICAL_CENTURY;
        double zetaArcsec = t * ((2304.250 + 1.396 * tt) + t * (0.302 + 0.018 * t));
        double zeta = Angles.fromArcsec(zetaArcsec);
        double z = Angles.fromArcsec(zetaArcsec + t * t * (0.791 + 0.001 * t));
        double theta = Angles.fromArcsec(t * ((2004.682 - 0.853 * tt) - t * (0.426 + 0.042 * t)));
        return rotate(point, zeta, z, theta);
    }

    /**
     * Precession of ecliptic coordinates.
     *
     * @param point  position on the ecliptic of the starting epoch
     * @param jdFrom starting epoch
     * @param jdTo   final epoch
     */
    public static EclipticPoint ecliptic(EclipticPoint point, double jdFrom, double jdTo) {
        EclipticAngles k = EclipticAngles.between(jdFrom, jdTo);
        double l = point.longitude();
        double b = point.latitude();
        double a = Math.cos(k.eta) * Math.cos(b) * Math.sin(k.pi - l) - Math.sin(k.eta) * Math.sin(b);
        double bb = Math.cos(b) * Math.cos(k.pi - l);
        double c = Math.cos(k.eta) * Math.sin(b) + Math.sin(k.eta) * Math.cos(b) * Math.sin(k.pi - l);
        return new EclipticPoint(
                Angles.normalizeToTwoPi(k.p + k.pi - Math.atan2(a, bb)),
                Math.asin(c));
    }

    /**
     * Precession of the orientation elements of an orbit. The semimajor
     * axis, eccentricity and perihelion time are unaffected.
     *
     * @param inclination          i0
     * @param argumentOfPerihelion ω0
     * @param ascendingNode        Ω0
     * @param jdFrom               starting epoch
     * @param jdTo                 final epoch
     * @return the elements referred to the final epoch
     */
    public static OrbitOrientation orbitalElements(double inclination, double argumentOfPerihelion,
                                                   double ascendingNode, double jdFrom, double jdTo) {
        EclipticAngles k = EclipticAngles.between(jdFrom, jdTo);
        double psi = k.pi + k.p;
        double sinEta = Math.sin(k.eta);
        double cosEta = Math.cos(k.eta);
        if (inclination == 0.0) {
            // node undefined before, the new one lies 180° from the ecliptic intersection
            return new OrbitOrientation(k.eta, argumentOfPerihelion, Angles.normalizeToTwoPi(psi + Math.PI));
        }
        double d = ascendingNode - k.pi;
        double a = Math.sin(inclination) * Math.sin(d);
        double b = -sinEta * Math.cos(inclination) + cosEta * Math.sin(inclination) * Math.cos(d);
        double c = cosEta * Math.cos(inclination) + sinEta * Math.sin(inclination) * Math.cos(d);
        double i = Math.atan2(Math.hypot(a, b), c);
        double node = Angles.normalizeToTwoPi(psi + Math.atan2(a, b));
        double dOmega = Math.atan2(-sinEta * Math.sin(d),
                Math.sin(inclination) * cosEta - Math.cos(inclination) * sinEta * Math.cos(d));
        return new OrbitOrientation(i, Angles.normalizeToTwoPi(argumentOfPerihelion + dOmega), node);
    }

    private static EquatorialPoint rotate(EquatorialPoint p, double zeta, double z, double theta) {
        double cosDec = Math.cos(p.declination());
        double sinDec = Math.sin(p.declination());
        double a = cosDec * Math.sin(p.rightAscension() + zeta);
        double b = Math.cos(theta) * cosDec * Math.cos(p.rightAscension() + zeta) - Math.sin(theta) * sinDec;
        double c = Math.sin(theta) * cosDec * Math.cos(p.rightAscension() + zeta) + Math.cos(theta) * sinDec;
        double dec = Math.abs(c) > 0.99 ? Math.copySign(Math.acos(Math.hypot(a, b)), c) : Math.asin(c);
        return new EquatorialPoint(Angles.normalizeToTwoPi(Math.atan2(a, b) + z), dec);
    }

    /** Orientation of an orbit: inclination, argument of perihelion and node. */
    public record OrbitOrientation(double inclination, double argumentOfPerihelion, double ascendingNode) {}

    /** η, Π and p of Meeus 21.5, in radians. */
    private static final class EclipticAngles {
        final double eta;
        final double pi;
        final double p;

        private EclipticAngles(double eta, double pi, double p) {
            this.eta = eta;
            this.pi = pi;
            this.p = p;
        }

        static EclipticAngles between(double jdFrom, double jdTo) {
            double tt = JulianDay.julianCentury(jdFrom);
            double t = (jdTo - jdFrom) / JulianDay.DAYS_PER_CENTURY;
            double eta = Angles.fromArcsec(t * ((47.0029 - tt * (0.06603 - 0.000598 * tt))
                    + t * ((-0.03302 + 0.000598 * tt) + 0.000060 * t)));
            double pi = Math.toRadians(174.876384) + Angles.fromArcsec(tt * (3289.4789 + 0.60622 * tt)
                    - t * ((869.8089 + 0.50491 * tt) - 0.03536 * t));
            double p = Angles.fromArcsec(t * ((5029.0966 + tt * (2.22226 - 0.000042 * tt))
                    + t * ((1.11113 - 0.000042 * tt) - 0.000006 * t)));
            return new EclipticAngles(eta, pi, p);
        }
    }
}
