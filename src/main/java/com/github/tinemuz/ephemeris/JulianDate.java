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
package com.github.tinemuz.ephemeris;

/**
 * Julian Day helpers.
 *
 * <p>The series in this library take their time argument either as days or as
 * Julian centuries elapsed since 1900 January 0.5 ({@link #J1900}).</p>
 */
public final class JulianDate {
    /** Julian Day of 1900 January 0.5 (1899 December 31, 12h). */
    public static final double J1900 = 2415020.0;

    /** Julian Day of 2000 January 1.5. */
    public static final double J2000 = 2451545.0;

    /** Days in a Julian century. */
    public static final double DAYS_PER_CENTURY = 36525.0;

    /** Julian Day of the Unix epoch, 1970 January 1.0. */
    private static final double UNIX_EPOCH_JD = 2440587.5;

    private static final double MS_PER_DAY = 86_400_000.0;

    private JulianDate() {}

    /**
     * Julian Day for a Gregorian calendar date.
     *
     * @param year  astronomical year (1 BC is 0)
     * @param month month, 1 to 12
     * @param day   day of month, fraction of the day included
     */
    public static double fromCivil(int year, int month, double day) {
        int y = year;
        int m = month;
        if (m <= 2) {
            y -= 1;
            m += 12;
        }
        int a = Math.floorDiv(y, 100);
        int b = 2 - a + Math.floorDiv(a, 4);
        return Math.floor(365.25 * (y + 4716))
                + Math.floor(30.6001 * (m + 1))
                + day
                + b
                - 1524.5;
    }

    /** Julian Day for a UTC instant given as epoch milliseconds. */
    public static double fromEpochMillis(long epochMillis) {
        return UNIX_EPOCH_JD + epochMillis / MS_PER_DAY;
    }

    /** Days elapsed since {@link #J1900}. */
    public static double daysSince1900(double jd) {
        return jd - J1900;
    }

    /** Julian centuries elapsed since {@link #J1900}. */
    public static double centuriesSince1900(double jd) {
        return (jd - J1900) / DAYS_PER_CENTURY;
    }
}
