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

/**
 * A calendar date with a decimal day of the month.
 *
 * <p>The time of day is folded into {@code day}: 1957 October 4 at 19h26m24s
 * is day {@code 4.81}. Astronomical year numbering is used, so 1 BC is year
 * 0 and 2 BC is year -1.</p>
 *
 * @param year  astronomical year
 * @param month month of the year, 1 to 12
 * @param day   decimal day of the month
 * @param kind  calendar the date is expressed in
 */
public record CalendarDate(int year, int month, double day, CalendarKind kind) {

    public CalendarDate {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be in 1..12: " + month);
        }
        if (kind == null) {
            throw new IllegalArgumentException("calendar kind is required");
        }
    }

    /** A date in the Gregorian calendar. */
    public static CalendarDate gregorian(int year, int month, double day) {
        return new CalendarDate(year, month, day, CalendarKind.GREGORIAN);
    }

    /** A date in the Julian calendar. */
    public static CalendarDate julian(int year, int month, double day) {
        return new CalendarDate(year, month, day, CalendarKind.JULIAN);
    }

    /**
     * Fold a time of day into the day of the month.
     *
     * @return {@code day + hour/24 + minute/1440 + second/86400}
     */
    public static double decimalDay(int day, int hour, int minute, double second) {
        return day + hour / 24.0 + minute / 1440.0 + second / 86400.0;
    }

    /** Whole day of the month. */
    public int dayOfMonth() {
        return (int) Math.floor(day);
    }

    /** Fraction of the day elapsed since 0h. */
    public double fractionOfDay() {
        return day - Math.floor(day);
    }
}
