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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JulianDateTest {

    @Test
    @DisplayName("Reference epochs")
    void referenceEpochs() {
        assertEquals(JulianDate.J2000, JulianDate.fromCivil(2000, 1, 1.5), 0.0);
        assertEquals(JulianDate.J1900, JulianDate.fromCivil(1900, 1, 0.5), 0.0);
    }

    @Test
    @DisplayName("Sputnik launch, 1957 October 4.81")
    void sputnik() {
        assertEquals(2436116.31, JulianDate.fromCivil(1957, 10, 4.81), 1e-9);
    }

    @Test
    @DisplayName("January and February count as months 13 and 14 of the previous year")
    void earlyMonths() {
        assertEquals(
                JulianDate.fromCivil(2004, 2, 29.0) + 1.0, JulianDate.fromCivil(2004, 3, 1.0), 1e-9);
        assertEquals(
                JulianDate.fromCivil(2003, 12, 31.0) + 1.0, JulianDate.fromCivil(2004, 1, 1.0), 1e-9);
    }

    @Test
    @DisplayName("Epoch milliseconds")
    void epochMillis() {
        assertEquals(2440587.5, JulianDate.fromEpochMillis(0L), 0.0);
        long noon2000 = Instant.parse("2000-01-01T12:00:00Z").toEpochMilli();
        assertEquals(JulianDate.J2000, JulianDate.fromEpochMillis(noon2000), 1e-9);
        long evening2003 = Instant.parse("2003-08-28T18:00:00Z").toEpochMilli();
        assertEquals(
                JulianDate.fromCivil(2003, 8, 28.75), JulianDate.fromEpochMillis(evening2003), 1e-9);
    }

    @Test
    @DisplayName("Elapsed time since 1900")
    void elapsed() {
        assertEquals(36525.0, JulianDate.daysSince1900(JulianDate.J2000), 0.0);
        assertEquals(1.0, JulianDate.centuriesSince1900(JulianDate.J2000), 1e-15);
        assertEquals(0.0, JulianDate.centuriesSince1900(JulianDate.J1900), 0.0);
    }
}
