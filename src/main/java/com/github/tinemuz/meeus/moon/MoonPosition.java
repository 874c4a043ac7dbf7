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
import com.github.tinemuz.meeus.coords.EclipticPoint;
import com.github.tinemuz.meeus.nutation.Nutation;
import com.github.tinemuz.meeus.series.FundamentalArguments;
import com.github.tinemuz.meeus.series.Polynomials;
import com.github.tinemuz.meeus.series.SeriesTable;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Geocentric position of the Moon (Meeus, chapter 47).
 *
 * <p>Sums the principal periodic terms of ELP-2000/82, read from the
 * classpath resources <code>series/moon_longitude_distance.txt</code> and
 * <code>series/moon_latitude.txt</code>. The accuracy is about 10" in
 * longitude and 4" in latitude.</p>
 */
public final class MoonPosition {
    private static final SeriesTable LONGITUDE_DISTANCE =
            new SeriesTable("series/moon_longitude_distance.txt");
    private static final SeriesTable LATITUDE = new SeriesTable("series/moon_latitude.txt");

    /** Earth's equatorial radius used by the lunar parallax, km. */
    private static final double EARTH_RADIUS_KM = 6378.14;
    /** Ratio of the Moon's radius to the Earth's. */
    private static final double MOON_EARTH_RADIUS_RATIO = 0.272481;
    private static final double MEAN_DISTANCE_KM = 385000.56;

    private MoonPosition() {}

    /** Load both coefficient tables now. */
    public static void preload() {
        LONGITUDE_DISTANCE.preload();
        LATITUDE.preload();
    }

    /**
     * Geocentric ecliptic position referred to the mean equinox of the date
     * (no nutation).
     *
     * @param jde Julian Ephemeris Day
     * @return longitude and latitude in radians, distance in km
     * @throws IllegalStateException if a coefficient table cannot be loaded
     */
    public static Result geocentric(double jde) {
        double t = JulianDay.julianCentury(jde);
        FundamentalArguments fa = FundamentalArguments.forMoon(t);
        double[] args = fa.withoutNode();
        double m1 = fa.moonAnomaly();
        double f = fa.argumentOfLatitude();
        double meanLongitude = Angles.normalizedRadians(Polynomials.horner(t,
                218.3164477, 481267.88123421, -0.0015786, 1.0 / 538841.0, -1.0 / 65194000.0));
        double e = eccentricityFactor(t);
        double a1 = Angles.normalizedRadians(119.75 + 131.849 * t);
        double a2 = Angles.normalizedRadians(53.09 + 479264.29 * t);
        double a3 = Angles.normalizedRadians(313.45 + 481266.484 * t);

        double sumL = 0.0;
        double sumR = 0.0;
        for (int row = 0; row < LONGITUDE_DISTANCE.rowCount(); row++) {
            double arg = LONGITUDE_DISTANCE.argument(row, args);
            double scale = eccentricityScale(e, LONGITUDE_DISTANCE.multiplier(row, 1));
            sumL += LONGITUDE_DISTANCE.coefficient(row, 0) * scale * Math.sin(arg);
            sumR += LONGITUDE_DISTANCE.coefficient(row, 1) * scale * Math.cos(arg);
        }
        double sumB = 0.0;
        for (int row = 0; row < LATITUDE.rowCount(); row++) {
            double arg = LATITUDE.argument(row, args);
            double scale = eccentricityScale(e, LATITUDE.multiplier(row, 1));
            sumB += LATITUDE.coefficient(row, 0) * scale * Math.sin(arg);
        }

        // action of Venus, Jupiter and the flattening of the Earth
        sumL += 3958.0 * Math.sin(a1)
                + 1962.0 * Math.sin(meanLongitude - f)
                + 318.0 * Math.sin(a2);
        sumB += -2235.0 * Math.sin(meanLongitude)
                + 382.0 * Math.sin(a3)
                + 175.0 * (Math.sin(a1 - f) + Math.sin(a1 + f))
                + 127.0 * Math.sin(meanLongitude - m1)
                - 115.0 * Math.sin(meanLongitude + m1);

        double longitude = Angles.normalizeToTwoPi(meanLongitude + Math.toRadians(sumL * 1e-6));
        double latitude = Math.toRadians(sumB * 1e-6);
        double distance = MEAN_DISTANCE_KM + sumR / 1000.0;
        return new Result(longitude, latitude, distance);
    }

    /**
     * Apparent geocentric position: {@link #geocentric} with the nutation in
     * longitude added.
     */
    public static Result apparent(double jde) {
        Result r = geocentric(jde);
        double lon = Angles.normalizeToTwoPi(r.longitude + Nutation.of(jde).inLongitude);
        return new Result(lon, r.latitude, r.distanceKm);
    }

    /**
     * Equatorial horizontal parallax of the Moon.
     *
     * @param distanceKm Earth-Moon distance, km
     * @return π in radians
     */
    public static double equatorialHorizontalParallax(double distanceKm) {
        if (!(distanceKm > EARTH_RADIUS_KM)) {
            throw new IllegalArgumentException("distance must exceed the Earth's radius: " + distanceKm);
        }
        return Math.asin(EARTH_RADIUS_KM / distanceKm);
    }

    /**
     * Geocentric semidiameter of the Moon.
     *
     * @param distanceKm Earth-Moon distance, km
     * @return semidiameter in radians
     */
    public static double semidiameter(double distanceKm) {
        return MOON_EARTH_RADIUS_RATIO * Math.sin(equatorialHorizontalParallax(distanceKm));
    }

    /** Factor E for the decreasing eccentricity of the Earth's orbit. */
    static double eccentricityFactor(double t) {
        return 1.0 - t * (0.002516 + t * 0.0000074);
    }

    private static double eccentricityScale(double e, int sunAnomalyMultiplier) {
        switch (Math.abs(sunAnomalyMultiplier)) {
            case 1:
                return e;
            case 2:
                return e * e;
            default:
                return 1.0;
        }
    }

    /**
     * Geocentric position of the Moon.
     */
    public static final class Result {
        /** Ecliptic longitude λ, radians, in [0, 2π). */
        public final double longitude;

        /** Ecliptic latitude β, radians. */
        public final double latitude;

        /** Distance between the centers of the Earth and Moon, km. */
        public final double distanceKm;

        Result(double longitude, double latitude, double distanceKm) {
            this.longitude = longitude;
            this.latitude = latitude;
            this.distanceKm = distanceKm;
        }

        /** Longitude and latitude as an ecliptic point. */
        public EclipticPoint ecliptic() {
            return new EclipticPoint(longitude, latitude);
        }
    }
}
