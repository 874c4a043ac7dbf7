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

package com.github.tinemuz.meeus.coords;

import com.github.tinemuz.meeus.angle.Angles;

/**
 * Transformations between the equatorial, ecliptic, horizontal and galactic
 * frames (Meeus, chapter 13).
 *
 * <p>All angles are radians. Longitude-like outputs are reduced to
 * [0, 2π); latitude-like outputs lie in [-π/2, π/2].</p>
 */
public final class Transforms {
    // B1950.0 galactic pole and node
    private static final double POLE_RA = Math.toRadians(192.25);
    private static final double POLE_DEC = Math.toRadians(27.4);
    private static final double NODE_GAL_LON = Math.toRadians(303.0);
    private static final double NODE_LON_OFFSET = Math.toRadians(123.0);
    private static final double NODE_RA_OFFSET = Math.toRadians(12.25);
    private static final double SIN_POLE_DEC = Math.sin(POLE_DEC);
    private static final double COS_POLE_DEC = Math.cos(POLE_DEC);

    private Transforms() {}

    /**
     * Ecliptic coordinates of an equatorial position (Meeus 13.1, 13.2).
     *
     * @param p         equatorial position
     * @param obliquity obliquity of the ecliptic ε; use the mean obliquity
     *                  for mean places and the true obliquity for apparent ones
     */
    public static EclipticPoint eclipticFromEquatorial(EquatorialPoint p, double obliquity) {
        double a = p.rightAscension();
        double d = p.declination();
        double sinE = Math.sin(obliquity);
        double cosE = Math.cos(obliquity);
        double lon = Math.atan2(Math.sin(a) * cosE + Math.tan(d) * sinE, Math.cos(a));
        double lat = Math.asin(Math.sin(d) * cosE - Math.cos(d) * sinE * Math.sin(a));
        return new EclipticPoint(Angles.normalizeToTwoPi(lon), lat);
    }

    /**
     * Equatorial coordinates of an ecliptic position (Meeus 13.3, 13.4).
     */
    public static EquatorialPoint equatorialFromEcliptic(EclipticPoint p, double obliquity) {
        double l = p.longitude();
        double b = p.latitude();
        double sinE = Math.sin(obliquity);
        double cosE = Math.cos(obliquity);
        double ra = Math.atan2(Math.sin(l) * cosE - Math.tan(b) * sinE, Math.cos(l));
        double dec = Math.asin(Math.sin(b) * cosE + Math.cos(b) * sinE * Math.sin(l));
        return new EquatorialPoint(Angles.normalizeToTwoPi(ra), dec);
    }

    /**
     * Local hour angle from Greenwich sidereal time and the observer's
     * longitude (positive west).
     *
     * @return H = θ0 - L - α, radians, not reduced
     */
    public static double hourAngle(double greenwichSidereal, double observerLongitude, double rightAscension) {
        return greenwichSidereal - observerLongitude - rightAscension;
    }

    /** Local hour angle from local sidereal time: H = θ - α. */
    public static double hourAngleFromLocalSidereal(double localSidereal, double rightAscension) {
        return localSidereal - rightAscension;
    }

    /**
     * Horizontal coordinates from hour angle and declination (Meeus 13.5,
     * 13.6). Azimuth is measured westward from the South.
     *
     * @param hourAngle   local hour angle H
     * @param declination declination δ
     * @param latitude    observer's latitude φ
     */
    public static HorizontalPoint horizontalFromEquatorial(double hourAngle, double declination, double latitude) {
        double az = Math.atan2(Math.sin(hourAngle),
                Math.cos(hourAngle) * Math.sin(latitude) - Math.tan(declination) * Math.cos(latitude));
        double alt = Math.asin(Math.sin(latitude) * Math.sin(declination)
                + Math.cos(latitude) * Math.cos(declination) * Math.cos(hourAngle));
        return new HorizontalPoint(Angles.normalizeToTwoPi(az), alt);
    }

    /**
     * Hour angle of a horizontal position.
     *
     * @return H in [0, 2π)
     */
    public static double hourAngleFromHorizontal(HorizontalPoint p, double latitude) {
        double a = p.azimuth();
        double h = p.altitude();
        double hourAngle = Math.atan2(Math.sin(a),
                Math.cos(a) * Math.sin(latitude) + Math.tan(h) * Math.cos(latitude));
        return Angles.normalizeToTwoPi(hourAngle);
    }

    /** Declination of a horizontal position. */
    public static double declinationFromHorizontal(HorizontalPoint p, double latitude) {
        double a = p.azimuth();
        double h = p.altitude();
        return Math.asin(Math.sin(latitude) * Math.sin(h)
                - Math.cos(latitude) * Math.cos(h) * Math.cos(a));
    }

    /**
     * Galactic coordinates of a position referred to the B1950.0 equinox
     * (Meeus 13.7, 13.8).
     */
    public static GalacticPoint galacticFromEquatorial(EquatorialPoint p) {
        double x = POLE_RA - p.rightAscension();
        double d = p.declination();
        double lon = NODE_GAL_LON - Math.atan2(Math.sin(x),
                SIN_POLE_DEC * Math.cos(x) - COS_POLE_DEC * Math.tan(d));
        double lat = Math.asin(Math.sin(d) * SIN_POLE_DEC + Math.cos(d) * COS_POLE_DEC * Math.cos(x));
        return new GalacticPoint(Angles.normalizeToTwoPi(lon), lat);
    }

    /** Equatorial coordinates (B1950.0) of a galactic position. */
    public static EquatorialPoint equatorialFromGalactic(GalacticPoint p) {
        double y = p.longitude() - NODE_LON_OFFSET;
        double b = p.latitude();
        double ra = NODE_RA_OFFSET + Math.atan2(Math.sin(y),
                SIN_POLE_DEC * Math.cos(y) - COS_POLE_DEC * Math.tan(b));
        double dec = Math.asin(Math.sin(b) * SIN_POLE_DEC + Math.cos(b) * COS_POLE_DEC * Math.cos(y));
        return new EquatorialPoint(Angles.normalizeToTwoPi(ra), dec);
    }
}
