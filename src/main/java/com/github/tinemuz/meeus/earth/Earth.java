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

package com.github.tinemuz.meeus.earth;

import com.github.tinemuz.meeus.coords.GeographicPoint;

/**
 * Figure and rotation of the Earth on the WGS-84 ellipsoid (Meeus,
 * chapter 11).
 */
public final class Earth {
    public static final double EQUATORIAL_RADIUS_KM = 6378.137;
    public static final double FLATTENING = 1.0 / 298.257223563;
    public static final double POLAR_RADIUS_KM = EQUATORIAL_RADIUS_KM * (1.0 - FLATTENING);
    /** Eccentricity of a meridian. */
    public static final double ECCENTRICITY = Math.sqrt(2.0 * FLATTENING - FLATTENING * FLATTENING);
    /** Rotation rate, radians per second of time. */
    public static final double ANGULAR_VELOCITY = 7.292114992e-5;

    /** Mean radius used for spherical approximations. */
    public static final double MEAN_RADIUS_KM = 6371.0;

    private static final double AXIS_RATIO = 1.0 - FLATTENING;

    private Earth() {}

    /**
     * ρ sin φ' and ρ cos φ' for an observer, where φ' is the geocentric
     * latitude and ρ the distance from the center in equatorial radii.
     *
     * @param latitude geographic latitude φ, radians
     * @param heightM  height above sea level, meters
     */
    public static GeocentricFactors geocentricFactors(double latitude, double heightM) {
        double u = Math.atan(AXIS_RATIO * Math.tan(latitude));
        double h = heightM / (EQUATORIAL_RADIUS_KM * 1000.0);
        return new GeocentricFactors(
                AXIS_RATIO * Math.sin(u) + h * Math.sin(latitude),
                Math.cos(u) + h * Math.cos(latitude));
    }

    /** ρ sin φ'. */
    public static double rhoSinPhi(double latitude, double heightM) {
        return geocentricFactors(latitude, heightM).rhoSinPhi();
    }

    /** ρ cos φ'. */
    public static double rhoCosPhi(double latitude, double heightM) {
        return geocentricFactors(latitude, heightM).rhoCosPhi();
    }

    /** Distance from the center at sea level, in equatorial radii. */
    public static double rho(double latitude) {
        return 0.9983271 + 0.0016764 * Math.cos(2 * latitude) - 0.0000035 * Math.cos(4 * latitude);
    }

    /** Radius of the parallel of latitude, km. */
    public static double radiusOfParallel(double latitude) {
        double s = Math.sin(latitude);
        return EQUATORIAL_RADIUS_KM * Math.cos(latitude) / Math.sqrt(1.0 - ECCENTRICITY * ECCENTRICITY * s * s);
    }

    /** Linear velocity of a point at sea level due to the rotation, km/s. */
    public static double linearVelocity(double latitude) {
        return ANGULAR_VELOCITY * radiusOfParallel(latitude);
    }

    /** Radius of curvature of the meridian, km. */
    public static double radiusOfCurvatureOfMeridian(double latitude) {
        double e2 = ECCENTRICITY * ECCENTRICITY;
        double s = Math.sin(latitude);
        return EQUATORIAL_RADIUS_KM * (1.0 - e2) / Math.pow(1.0 - e2 * s * s, 1.5);
    }

    /** φ - φ', radians. */
    public static double geographicMinusGeocentricLatitude(double latitude) {
        return Math.toRadians((692.73 * Math.sin(2 * latitude) - 1.16 * Math.sin(4 * latitude)) / 3600.0);
    }

    /**
     * Geodesic distance on the ellipsoid by Andoyer's method, accurate to
     * about 50 m for long lines.
     *
     * @return km
     */
    public static double geodesicDistance(GeographicPoint p1, GeographicPoint p2) {
        double f = (p1.latitude() + p2.latitude()) / 2.0;
        double g = (p1.latitude() - p2.latitude()) / 2.0;
        double lambda = (p1.longitude() - p2.longitude()) / 2.0;
        double sinG = Math.sin(g), cosG = Math.cos(g);
        double sinF = Math.sin(f), cosF = Math.cos(f);
        double sinL = Math.sin(lambda), cosL = Math.cos(lambda);
        double s = sinG * sinG * cosL * cosL + cosF * cosF * sinL * sinL;
        double c = cosG * cosG * cosL * cosL + sinF * sinF * sinL * sinL;
        if (s == 0.0) {
            return 0.0;
        }
        double omega = Math.atan(Math.sqrt(s / c));
        double r = Math.sqrt(s * c) / omega;
        double d = 2.0 * omega * EQUATORIAL_RADIUS_KM;
        double h1 = (3.0 * r - 1.0) / (2.0 * c);
        double h2 = (3.0 * r + 1.0) / (2.0 * s);
        return d * (1.0 + FLATTENING * h1 * sinF * sinF * cosG * cosG
                - FLATTENING * h2 * cosF * cosF * sinG * sinG);
    }

    /** Great-circle distance on a sphere of radius {@link #MEAN_RADIUS_KM}, km. */
    public static double approximateDistance(GeographicPoint p1, GeographicPoint p2) {
        return p1.separation(p2) * MEAN_RADIUS_KM;
    }

    /**
     * Angle between the diurnal path of a body and the horizon at the moment
     * it rises or sets.
     *
     * @param declination δ of the body
     * @param latitude    observer's latitude φ, not on the equator
     * @throws IllegalArgumentException if the body never crosses the horizon
     */
    public static double angleBetweenDiurnalPathAndHorizon(double declination, double latitude) {
        double b = Math.tan(declination) * Math.tan(latitude);
        if (Math.abs(b) > 1.0) {
            throw new IllegalArgumentException("Body is circumpolar or never rises at this latitude");
        }
        double c = Math.sqrt(1.0 - b * b);
        return Math.atan2(c * Math.cos(declination), Math.tan(latitude));
    }

    /**
     * ρ sin φ' and ρ cos φ' of an observer.
     *
     * @param rhoSinPhi ρ sin φ'
     * @param rhoCosPhi ρ cos φ'
     */
    public record GeocentricFactors(double rhoSinPhi, double rhoCosPhi) {}
}
