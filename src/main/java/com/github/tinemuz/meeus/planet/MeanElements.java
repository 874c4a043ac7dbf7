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
import com.github.tinemuz.meeus.series.Polynomials;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Mean orbital elements of the planets referred to the mean ecliptic and
 * equinox of the date (Meeus, Table 31.A).
 *
 * <p>All angles are radians reduced to [0, 2π). For the Earth the
 * inclination is zero and the node is undefined; it is reported as zero
 * and the argument of perihelion equals the longitude of perihelion.</p>
 */
public final class MeanElements {
    /** Mean longitude L. */
    public final double meanLongitude;
    /** Semimajor axis a, AU. */
    public final double semimajorAxis;
    /** Eccentricity e. */
    public final double eccentricity;
    /** Inclination i on the ecliptic of date. */
    public final double inclination;
    /** Longitude of the ascending node Ω. */
    public final double ascendingNode;
    /** Longitude of the perihelion ϖ. */
    public final double longitudeOfPerihelion;
    /** Mean anomaly M = L - ϖ. */
    public final double meanAnomaly;
    /** Argument of the perihelion ω = ϖ - Ω. */
    public final double argumentOfPerihelion;

    MeanElements(double meanLongitude, double semimajorAxis, double eccentricity, double inclination,
                 double ascendingNode, double longitudeOfPerihelion) {
        this.meanLongitude = Angles.normalizedRadians(meanLongitude);
        this.semimajorAxis = semimajorAxis;
        this.eccentricity = eccentricity;
        this.inclination = Math.toRadians(inclination);
        this.ascendingNode = Angles.normalizedRadians(ascendingNode);
        this.longitudeOfPerihelion = Angles.normalizedRadians(longitudeOfPerihelion);
        this.meanAnomaly = Angles.normalizedRadians(meanLongitude - longitudeOfPerihelion);
        this.argumentOfPerihelion = Angles.normalizedRadians(longitudeOfPerihelion - ascendingNode);
    }

    /**
     * Elements of a planet at the given instant.
     *
     * @param planet the planet
     * @param jde    Julian Ephemeris Day
     */
    public static MeanElements of(Planet planet, double jde) {
        double t = JulianDay.julianCentury(jde);
        switch (planet) {
            case MERCURY:
                return new MeanElements(
                        Polynomials.horner(t, 252.250906, 149474.0722491, 0.00030350, 0.000000018),
                        0.387098310,
                        Polynomials.horner(t, 0.20563175, 0.000020407, -0.0000000283, -0.00000000018),
                        Polynomials.horner(t, 7.004986, 0.0018215, -0.00001810, 0.000000056),
                        Polynomials.horner(t, 48.330893, 1.1861883, 0.00017542, 0.000000215),
                        Polynomials.horner(t, 77.456119, 1.5564776, 0.00029544, 0.000000009));
            case VENUS:
                return new MeanElements(
                        Polynomials.horner(t, 181.979801, 58519.2130302, 0.00031014, 0.000000015),
                        0.723329820,
                        Polynomials.horner(t, 0.00677192, -0.000047765, 0.0000000981, 0.00000000046),
                        Polynomials.horner(t, 3.394662, 0.0010037, -0.00000088, -0.000000007),
                        Polynomials.horner(t, 76.679920, 0.9011206, 0.00040618, -0.000000093),
                        Polynomials.horner(t, 131.563703, 1.4022288, -0.00107618, -0.000005678));
            case EARTH:
                double perihelion = Polynomials.horner(t, 102.937348, 1.7195366, 0.00045688, -0.000000018);
                return new MeanElements(
                        Polynomials.horner(t, 100.466457, 36000.7698278, 0.00030322, 0.000000020),
                        1.000001018,
                        Polynomials.horner(t, 0.01670863, -0.000042037, -0.0000001267, 0.00000000014),
                        0.0,
                        0.0,
                        perihelion);
            case MARS:
                return new MeanElements(
                        Polynomials.horner(t, 355.433000, 19141.6964471, 0.00031052, 0.000000016),
                        1.523679342,
                        Polynomials.horner(t, 0.09340065, 0.000090484, -0.0000000806, -0.00000000025),
                        Polynomials.horner(t, 1.849726, -0.0006011, 0.00001276, -0.000000007),
                        Polynomials.horner(t, 49.558093, 0.7720959, 0.00001557, 0.000002267),
                        Polynomials.horner(t, 336.060234, 1.8410449, 0.00013477, 0.000000536));
            case JUPITER:
                return new MeanElements(
                        Polynomials.horner(t, 34.351519, 3036.3027748, 0.00022330, 0.000000037),
                        Polynomials.horner(t, 5.202603209, 0.0000001913),
                        Polynomials.horner(t, 0.04849793, 0.000163225, -0.0000004714, -0.00000000201),
                        Polynomials.horner(t, 1.303267, -0.0054965, 0.00000466, -0.000000002),
                        Polynomials.horner(t, 100.464407, 1.0209774, 0.00040315, 0.000000404),
                        Polynomials.horner(t, 14.331207, 1.6126352, 0.00103042, -0.000004464));
            case SATURN:
                return new MeanElements(
                        Polynomials.horner(t, 50.077444, 1223.5110686, 0.00051908, -0.000000030),
                        Polynomials.horner(t, 9.554909192, -0.0000021390, 0.000000004),
                        Polynomials.horner(t, 0.05554814, -0.000346641, -0.0000006436, 0.0000000034),
                        Polynomials.horner(t, 2.488879, -0.0037362, -0.00001519, 0.000000087),
                        Polynomials.horner(t, 113.665503, 0.8770880, -0.00012176, -0.000002249),
                        Polynomials.horner(t, 93.057237, 1.9637613, 0.00083753, 0.000004928));
            case URANUS:
                return new MeanElements(
                        Polynomials.horner(t, 314.055005, 429.8640561, 0.00030390, -0.000000026),
                        Polynomials.horner(t, 19.218446062, -0.0000000372, 0.00000000098),
                        Polynomials.horner(t, 0.04638122, -0.000027293, 0.0000000789, 0.00000000024),
                        Polynomials.horner(t, 0.773197, 0.0007744, 0.00003749, -0.000000092),
                        Polynomials.horner(t, 74.005957, 0.5211278, 0.00133947, 0.000018484),
                        Polynomials.horner(t, 173.005291, 1.4863790, 0.00021406, 0.000000434));
            case NEPTUNE:
                return new MeanElements(
                        Polynomials.horner(t, 304.348665, 219.8833092, 0.00030882, 0.000000018),
                        Polynomials.horner(t, 30.110386869, -0.0000001663, 0.00000000069),
                        Polynomials.horner(t, 0.00945575, 0.000006033, 0.0, -0.00000000005),
                        Polynomials.horner(t, 1.769953, -0.0093082, -0.00000708, 0.000000027),
                        Polynomials.horner(t, 131.784057, 1.1022039, 0.00025952, -0.000000637),
                        Polynomials.horner(t, 48.120276, 1.4262957, 0.00038434, 0.000000020));
            default:
                throw new IllegalArgumentException("Unknown planet: " + planet);
        }
    }
}
