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

package com.github.tinemuz.meeus.time;

import java.time.DayOfWeek;

/**
 * Julian Day conversions (Meeus, chapter 7).
 *
 * <p>The Julian Day is a continuous count of days from 4713 BC January 1,
 * Greenwich noon (Julian calendar). All conversions here are valid for
 * positive and negative years; only the inverse conversion is restricted to
 * non-negative Julian Days.</p>
 */
public final class JulianDay {
    /** The standard epoch J2000.0, 2000 January 1.5 TD. */
    public static final double J2000 = 2451545.0;

    /** Days in a Julian century. */
    public static final double DAYS_PER_CENTURY = 36525.0;

    /** First Julian Day number of the Gregorian calendar (1582 October 15). */
    static final int GREGORIAN_REFORM = 2299161;

    private JulianDay() {}

    /**
     * Julian Day of a calendar date.
     *
     * @param date date in either calendar
     * @return Julian Day, a real number
     */
    public static double julianDay(CalendarDate date) {
        int y = date.year();
        int m = date.month();
        if (m <= 2) {
            y -= 1;
            m += 12;
        }
        double b = 0.0;
        if (date.kind() == CalendarKind.GREGORIAN) {
            double a = Math.floor(y / 100.0);
            b = 2.0 - a + Math.floor(a / 4.0);
        }
        return Math.floor(365.25 * (y + 4716))
                + Math.floor(30.6001 * (m + 1))
                + date.day()
                + b
                - 1524.5;
    }

    /** Julian Day of a date and time of day. */
    public static double julianDay(
            int year, int month, int day, int hour, int minute, double second, CalendarKind kind) {
        double decimalDay = CalendarDate.decimalDay(day, hour, minute, second);
        return julianDay(new CalendarDate(year, month, decimalDay, kind));
    }

    /**
     * Calendar date of a Julian Day.
     *
     * <p>Dates on or after 1582 October 15 are returned in the Gregorian
     * calendar, earlier dates in the Julian calendar.</p>
     *
     * @param jd Julian Day, not negative
     * @return the calendar date, with the time of day folded into the day
     * @throws IllegalArgumentException if {@code jd} is negative or not finite
     */
    public static CalendarDate dateFromJulianDay(double jd) {
        if (!(jd >= 0.0) || Double.isInfinite(jd)) {
            throw new IllegalArgumentException("Julian Day must be a non-negative number: " + jd);
        }
        double shifted = jd + 0.5;
        double z = Math.floor(shifted);
        double f = shifted - z;
        double a = z;
        CalendarKind kind = CalendarKind.JULIAN;
        if (z >= GREGORIAN_REFORM) {
            double alpha = Math.floor((z - 1867216.25) / 36524.25);
            a = z + 1 + alpha - Math.floor(alpha / 4.0);
            kind = CalendarKind.GREGORIAN;
        }
        double b = a + 1524;
        double c = Math.floor((b - 122.1) / 365.25);
        double d = Math.floor(365.25 * c);
        double e = Math.floor((b - d) / 30.6001);
        double day = b - d - Math.floor(30.6001 * e) + f;
        int month = (int) (e < 14 ? e - 1 : e - 13);
        int year = (int) (month > 2 ? c - 4716 : c - 4715);
        return new CalendarDate(year, month, day, kind);
    }

    /** Julian centuries of 36525 days since J2000.0. */
    public static double julianCentury(double jd) {
        return (jd - J2000) / DAYS_PER_CENTURY;
    }

    /** Julian millennia of 365250 days since J2000.0. */
    public static double julianMillennium(double jd) {
        return julianCentury(jd) / 10.0;
    }

    /** Julian Day from Julian centuries since J2000.0. */
    public static double fromJulianCentury(double t) {
        return J2000 + t * DAYS_PER_CENTURY;
    }

    /** Day of the week on which the civil day containing {@code jd} falls. */
    public static DayOfWeek dayOfWeek(double jd) {
        // 0 is Sunday in Meeus' convention; DayOfWeek counts Monday as 1
        int index = (int) Math.floorMod((long) Math.floor(jd + 1.5), 7L);
        return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }

    /** Whether {@code year} is a leap year in the given calendar. */
    public static boolean isLeapYear(int year, CalendarKind kind) {
        if (kind == CalendarKind.JULIAN) {
            return Math.floorMod(year, 4) == 0;
        }
        return (Math.floorMod(year, 4) == 0 && Math.floorMod(year, 100) != 0)
                || Math.floorMod(year, 400) == 0;
    }

    /** Ordinal day of the year, 1 for January 1 (Meeus 7.f). */
    public static int dayOfYear(CalendarDate date) {
        int k = isLeapYear(date.year(), date.kind()) ? 1 : 2;
        int m = date.month();
        return (int) Math.floor(275.0 * m / 9.0)
                - k * (int) Math.floor((m + 9.0) / 12.0)
                + date.dayOfMonth()
                - 30;
    }

    /**
     * Year with decimals, e.g. 1987.37 for mid May 1987. Used as input to the
     * lunar phase and node series.
     */
    public static double decimalYear(CalendarDate date) {
        int daysInYear = isLeapYear(date.year(), date.kind()) ? 366 : 365;
        return date.year() + (dayOfYear(date) - 1 + date.fractionOfDay()) / daysInYear;
    }
}
