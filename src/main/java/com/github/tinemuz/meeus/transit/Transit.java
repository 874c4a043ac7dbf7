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

import com.github.tinemuz.meeus.angle.Angles;
import com.github.tinemuz.meeus.coords.EquatorialPoint;
import com.github.tinemuz.meeus.coords.GeographicPoint;
import com.github.tinemuz.meeus.interpolation.Interpolation;
import com.github.tinemuz.meeus.orbit.NonConvergenceException;

/**
 * Times of rising, transit and setting (Meeus, chapter 15).
 *
 * <p>The body's apparent positions at 0h Dynamical Time on the day before,
 * the day itself and the day after are interpolated to refine the
 * approximate times until they stop changing.</p>
 */
public final class Transit {
    /** Mean sidereal rotation in radians per day (360.985647°). */
    private static final double SIDEREAL_RATE = Math.toRadians(360.985647);
    private static final double SECONDS_PER_DAY = 86400.0;
    private static final double TOLERANCE = 1e-7;
    private static final int MAX_ITERATIONS = 20;

    private Transit() {}

    /**
     * Rise, transit and set of a body on one day.
     *
     * @param body               kind of body, selects the standard altitude
     * @param observer           observer's position, longitude positive west
     * @param positions          apparent positions at 0h TD on days D-1, D
     *                           and D+1
     * @param apparentSidereal0h apparent sidereal time at Greenwich at 0h UT
     *                           on day D, radians
     * @param deltaT             TD - UT in seconds
     * @param moonParallax       the Moon's horizontal parallax in radians;
     *                           only used for {@link TransitBody#MOON}
     * @return times as fractions of day D in UT
     * @throws NeverRisesException if the body stays below the horizon
     * @throws NeverSetsException  if the body stays above the horizon
     * @throws IllegalArgumentException if not exactly three positions are given
     */
    public static Times times(TransitBody body, GeographicPoint observer, EquatorialPoint[] positions,
                              double apparentSidereal0h, double deltaT, double moonParallax)
            throws NeverRisesException, NeverSetsException {
        if (positions == null || positions.length != 3) {
            throw new IllegalArgumentException("Exactly three positions are required");
        }
        double h0 = body.standardAltitude(moonParallax);
        double lon = observer.longitude();
        double lat = observer.latitude();

        double[] ra = unwrapRightAscensions(positions);
        double[] dec = {positions[0].declination(), positions[1].declination(), positions[2].declination()};

        double cosH0 = (Math.sin(h0) - Math.sin(lat) * Math.sin(dec[1])) / (Math.cos(lat) * Math.cos(dec[1]));
        if (cosH0 > 1.0) throw new NeverRisesException();
        if (cosH0 < -1.0) throw new NeverSetsException();
        double bigH0 = Math.acos(cosH0);

        double m0 = fraction((ra[1] + lon - apparentSidereal0h) / Angles.TWO_PI);
        double m1 = fraction(m0 - bigH0 / Angles.TWO_PI);
        double m2 = fraction(m0 + bigH0 / Angles.TWO_PI);

        double transit = refine(m0, true, h0, lon, lat, ra, dec, apparentSidereal0h, deltaT);
        double rise = refine(m1, false, h0, lon, lat, ra, dec, apparentSidereal0h, deltaT);
        double set = refine(m2, false, h0, lon, lat, ra, dec, apparentSidereal0h, deltaT);
        return new Times(rise, transit, set);
    }

    private static double refine(double m, boolean transit, double h0, double lon, double lat,
                                 double[] ra, double[] dec, double sidereal0h, double deltaT) {
        double correction = Double.NaN;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double theta = sidereal0h + SIDEREAL_RATE * m;
            double n = m + deltaT / SECONDS_PER_DAY;
            double alpha = Interpolation.threeValues(ra[0], ra[1], ra[2], n);
            double h = Angles.normalizeToPlusMinusPi(theta - lon - alpha);
            if (transit) {
                correction = -h / Angles.TWO_PI;
            } else {
                double delta = Interpolation.threeValues(dec[0], dec[1], dec[2], n);
                double altitude = Math.asin(Math.sin(lat) * Math.sin(delta)
                        + Math.cos(lat) * Math.cos(delta) * Math.cos(h));
                correction = (altitude - h0) / (Angles.TWO_PI * Math.cos(delta) * Math.cos(lat) * Math.sin(h));
            }
            m += correction;
            if (Math.abs(correction) < TOLERANCE) {
                return fraction(m);
            }
        }
        throw new NonConvergenceException("Rise/set time did not converge", MAX_ITERATIONS, Math.abs(correction));
    }

    // right ascension may pass through 0h between the three days
    private static double[] unwrapRightAscensions(EquatorialPoint[] positions) {
        double[] ra = new double[3];
        ra[0] = positions[0].rightAscension();
        for (int i = 1; i < 3; i++) {
            double step = Angles.normalizeToPlusMinusPi(positions[i].rightAscension() - positions[i - 1].rightAscension());
            ra[i] = ra[i - 1] + step;
        }
        return ra;
    }

    private static double fraction(double m) {
        return m - Math.floor(m);
    }

    /**
     * Rise, transit and set times as fractions of the day in UT.
     */
    public static final class Times {
        /** Time of rising, in [0, 1). */
        public final double rise;
        /** Time of upper transit, in [0, 1). */
        public final double transit;
        /** Time of setting, in [0, 1). */
        public final double set;

        Times(double rise, double transit, double set) {
            this.rise = rise;
            this.transit = transit;
            this.set = set;
        }

        public Angles.Hms riseTime() {
            return Angles.toHms(rise * 24.0);
        }

        public Angles.Hms transitTime() {
            return Angles.toHms(transit * 24.0);
        }

        public Angles.Hms setTime() {
            return Angles.toHms(set * 24.0);
        }
    }
}
