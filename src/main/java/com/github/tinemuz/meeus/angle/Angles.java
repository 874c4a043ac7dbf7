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

package com.github.tinemuz.meeus.angle;

/**
 * Angle conversions and normalization.
 *
 * <p>Every other part of the library works in radians; the helpers here
 * convert to and from the sexagesimal forms used in almanacs and catalogues
 * (degrees/arcminutes/arcseconds and hours/minutes/seconds).</p>
 *
 * <p>Sexagesimal triples carry their sign separately. Minutes and seconds
 * are always magnitudes, so an angle such as {@code -0°30'} is expressed
 * with an explicit negative flag instead of a signed zero degree field.</p>
 */
public final class Angles {
    public static final double TWO_PI = 2.0 * Math.PI;

    private static final double ARCSEC_PER_DEGREE = 3600.0;

    private Angles() {}

    /**
     * Degrees from a signed sexagesimal triple.
     *
     * @param negative whether the angle is negative; takes precedence over the
     *                 sign of {@code degrees}
     * @param degrees  whole degrees (its sign is ignored)
     * @param minutes  arcminutes, {@code 0 <= minutes < 60}
     * @param seconds  arcseconds, {@code 0 <= seconds < 60}
     * @return decimal degrees
     * @throws IllegalArgumentException if minutes or seconds are out of range
     */
    public static double degreesFromDms(boolean negative, int degrees, int minutes, double seconds) {
        checkSexagesimal(minutes, seconds);
        double magnitude = Math.abs(degrees) + minutes / 60.0 + seconds / ARCSEC_PER_DEGREE;
        return negative ? -magnitude : magnitude;
    }

    /**
     * Degrees from a sexagesimal triple whose sign lives in {@code degrees}.
     * Use {@link #degreesFromDms(boolean, int, int, double)} for angles
     * between -1° and 0°.
     */
    public static double degreesFromDms(int degrees, int minutes, double seconds) {
        return degreesFromDms(degrees < 0, degrees, minutes, seconds);
    }

    /** Radians from a signed sexagesimal triple. */
    public static double radiansFromDms(boolean negative, int degrees, int minutes, double seconds) {
        return Math.toRadians(degreesFromDms(negative, degrees, minutes, seconds));
    }

    /** Radians from a sexagesimal triple whose sign lives in {@code degrees}. */
    public static double radiansFromDms(int degrees, int minutes, double seconds) {
        return Math.toRadians(degreesFromDms(degrees, minutes, seconds));
    }

    /**
     * Decimal hours from a signed sexagesimal time.
     *
     * @param negative whether the time is negative; takes precedence over the
     *                 sign of {@code hours}
     * @throws IllegalArgumentException if minutes or seconds are out of range
     */
    public static double hoursFromHms(boolean negative, int hours, int minutes, double seconds) {
        checkSexagesimal(minutes, seconds);
        double magnitude = Math.abs(hours) + minutes / 60.0 + seconds / 3600.0;
        return negative ? -magnitude : magnitude;
    }

    /**
     * Decimal hours from hours, minutes and seconds of time, the sign taken
     * from {@code hours}. Use {@link #hoursFromHms(boolean, int, int, double)}
     * between -1h and 0h.
     */
    public static double hoursFromHms(int hours, int minutes, double seconds) {
        return hoursFromHms(hours < 0, hours, minutes, seconds);
    }

    /** Degrees from hours, minutes and seconds of time (1h = 15°). */
    public static double degreesFromHms(int hours, int minutes, double seconds) {
        return 15.0 * hoursFromHms(hours, minutes, seconds);
    }

    /** Radians from hours, minutes and seconds of time. */
    public static double radiansFromHms(int hours, int minutes, double seconds) {
        return Math.toRadians(degreesFromHms(hours, minutes, seconds));
    }

    /** Radians from arcseconds. */
    public static double fromArcsec(double arcsec) {
        return Math.toRadians(arcsec / ARCSEC_PER_DEGREE);
    }

    /** Arcseconds from radians. */
    public static double toArcsec(double radians) {
        return Math.toDegrees(radians) * ARCSEC_PER_DEGREE;
    }

    /**
     * Split decimal degrees into a sexagesimal triple.
     *
     * @param degrees decimal degrees, any sign
     * @return the sign flag plus whole degrees, whole arcminutes and arcseconds
     */
    public static Dms toDms(double degrees) {
        boolean negative = degrees < 0;
        double abs = Math.abs(degrees);
        int d = (int) Math.floor(abs);
        double remMinutes = (abs - d) * 60.0;
        int m = (int) Math.floor(remMinutes);
        double s = (remMinutes - m) * 60.0;
        // absorb representation error that leaves 59.999... seconds or minutes
        if (60.0 - s < 1e-7) {
            s = 0.0;
            m++;
        }
        if (m == 60) {
            m = 0;
            d++;
        }
        return new Dms(negative, d, m, s);
    }

    /**
     * Split decimal hours into hours, minutes and seconds of time.
     */
    public static Hms toHms(double hours) {
        Dms dms = toDms(hours);
        return new Hms(dms.negative(), dms.degrees(), dms.minutes(), dms.seconds());
    }

    /**
     * Reduce an angle in degrees to the range [0, 360).
     *
     * <p>Uses a floor remainder, so negative inputs land in range without a
     * separate correction step.</p>
     */
    public static double normalizeTo360(double degrees) {
        double r = degrees - 360.0 * Math.floor(degrees / 360.0);
        // floor can leave exactly 360 for tiny negative inputs
        return r >= 360.0 ? 0.0 : r;
    }

    /** Reduce an angle in radians to the range [0, 2π). */
    public static double normalizeToTwoPi(double radians) {
        double r = radians - TWO_PI * Math.floor(radians / TWO_PI);
        return r >= TWO_PI ? 0.0 : r;
    }

    /** Reduce an angle in degrees to the range [-180, 180). */
    public static double normalizeToPlusMinus180(double degrees) {
        return normalizeTo360(degrees + 180.0) - 180.0;
    }

    /** Reduce an angle in radians to the range [-π, π). */
    public static double normalizeToPlusMinusPi(double radians) {
        return normalizeToTwoPi(radians + Math.PI) - Math.PI;
    }

    /** Convert degrees to radians after reducing to [0, 360). */
    public static double normalizedRadians(double degrees) {
        return Math.toRadians(normalizeTo360(degrees));
    }

    private static void checkSexagesimal(int minutes, double seconds) {
        if (minutes < 0 || minutes >= 60) {
            throw new IllegalArgumentException("minutes must be in [0, 60): " + minutes);
        }
        if (!(seconds >= 0.0 && seconds < 60.0)) {
            throw new IllegalArgumentException("seconds must be in [0, 60): " + seconds);
        }
    }

    /**
     * Sexagesimal angle. Minutes and seconds are magnitudes; the sign is
     * carried by {@code negative}.
     */
    public record Dms(boolean negative, int degrees, int minutes, double seconds) {
        /** Decimal degrees represented by this triple. */
        public double toDegrees() {
            return degreesFromDms(negative, degrees, minutes, seconds);
        }
    }

    /**
     * Sexagesimal time. Minutes and seconds are magnitudes; the sign is
     * carried by {@code negative}.
     */
    public record Hms(boolean negative, int hours, int minutes, double seconds) {
        /** Decimal hours represented by this triple. */
        public double toHours() {
            return hoursFromHms(negative, hours, minutes, seconds);
        }
    }
}
