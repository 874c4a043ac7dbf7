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
import com.github.tinemuz.meeus.orbit.NodeKind;
import com.github.tinemuz.meeus.series.FundamentalArguments;
import com.github.tinemuz.meeus.series.Polynomials;
import com.github.tinemuz.meeus.time.JulianDay;

/**
 * Node and perigee of the lunar orbit (Meeus, chapters 47 and 51).
 */
public final class MoonOrbit {
    /** Inclination of the mean lunar equator to the ecliptic, I = 1°32'32.7". */
    public static final double INCLINATION_OF_MEAN_EQUATOR = Angles.radiansFromDms(1, 32, 32.7);

    private MoonOrbit() {}

    /**
     * Longitude of the mean ascending node.
     *
     * @param jde Julian Ephemeris Day
     * @return Ω in radians, in [0, 2π)
     */
    public static double meanAscendingNode(double jde) {
        return FundamentalArguments.forMoon(JulianDay.julianCentury(jde)).ascendingNode();
    }

    /**
     * Longitude of the true ascending node: the mean node plus its principal
     * periodic terms.
     *
     * @param jde Julian Ephemeris Day
     * @return radians, in [0, 2π)
     */
    public static double trueAscendingNode(double jde) {
        FundamentalArguments fa = FundamentalArguments.forMoon(JulianDay.julianCentury(jde));
        double d = fa.elongation();
        double m = fa.sunAnomaly();
        double m1 = fa.moonAnomaly();
        double f = fa.argumentOfLatitude();
        double correction = -1.4979 * Math.sin(2.0 * (d - f))
                - 0.1500 * Math.sin(m)
                - 0.1226 * Math.sin(2.0 * d)
                + 0.1176 * Math.sin(2.0 * f)
                - 0.0801 * Math.sin(2.0 * (m1 - f));
        return Angles.normalizeToTwoPi(fa.ascendingNode() + Math.toRadians(correction));
    }

    /**
     * Longitude of the mean perigee.
     *
     * @param jde Julian Ephemeris Day
     * @return radians, in [0, 2π)
     */
    public static double meanPerigee(double jde) {
        double t = JulianDay.julianCentury(jde);
        return Angles.normalizedRadians(Polynomials.horner(t,
                83.3532465, 4069.0137287, -0.0103200, -1.0 / 80053.0, 1.0 / 18999000.0));
    }

    /**
     * Instant of the Moon's passage through the node nearest to the given
     * date (Meeus, chapter 51).
     *
     * @param kind        which node
     * @param decimalYear approximate date, year with decimals
     * @return Julian Ephemeris Day of the passage; error below a few minutes
     */
    public static double passageThroughNode(NodeKind kind, double decimalYear) {
        double approx = 13.4223 * (decimalYear - 2000.05);
        double k = kind == NodeKind.ASCENDING
                ? Math.rint(approx)
                : Math.rint(approx - 0.5) + 0.5;
        return passageThroughNode(k);
    }

    /**
     * Instant of the node passage number {@code k}: integers for ascending,
     * integers plus one half for descending nodes; k = 0 is the ascending
     * node of 2000 January.
     */
    public static double passageThroughNode(double k) {
        double t = k / 1342.23;
        double t2 = t * t;
        double d = Math.toRadians(183.6380 + 331.73735682 * k
                + t2 * (0.0014852 + t * (0.00000209 - t * 0.00000001)));
        double m = Math.toRadians(17.4006 + 26.82037250 * k + t2 * (0.0001186 + t * 0.00000006));
        double m1 = Math.toRadians(38.3776 + 355.52747313 * k
                + t2 * (0.0123499 + t * (0.000014627 - t * 0.000000069)));
        double omega = Math.toRadians(123.9767 - 1.44098956 * k
                + t2 * (0.0020608 + t * (0.00000214 - t * 0.000000016)));
        double p = omega + Math.toRadians(272.75 - 2.3 * t);
        double v = Math.toRadians(299.75 + t * (132.85 - t * 0.009173));
        double d2 = 2.0 * d;
        return 2451565.1619
                + 27.212220817 * k
                + t2 * (0.0002762 + t * (0.000000021 - t * 0.000000000088))
                - 0.4721 * Math.sin(m1)
                - 0.1649 * Math.sin(d2)
                - 0.0868 * Math.sin(d2 - m1)
                + 0.0084 * Math.sin(d2 + m1)
                - 0.0083 * Math.sin(d2 - m)
                - 0.0039 * Math.sin(d2 - m - m1)
                + 0.0034 * Math.sin(2.0 * m1)
                - 0.0031 * Math.sin(2.0 * (d - m1))
                + 0.0030 * Math.sin(d2 + m)
                + 0.0028 * Math.sin(m - m1)
                + 0.0026 * Math.sin(m)
                + 0.0025 * Math.sin(2.0 * d2)
                + 0.0024 * Math.sin(d)
                + 0.0022 * Math.sin(m + m1)
                + 0.0017 * Math.sin(omega)
                + 0.0014 * Math.sin(2.0 * d2 - m1)
                + 0.0005 * Math.sin(d2 + m - m1)
                + 0.0004 * Math.sin(d2 - m + m1)
                + 0.0003 * (Math.sin(2.0 * (m - d)) + Math.sin(2.0 * d2 - m) + Math.sin(v) + Math.sin(p));
    }
}
