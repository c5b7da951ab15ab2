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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SunTest {

    private static final double LONGITUDE_TOLERANCE = 1e-6; // degrees
    private static final double DISTANCE_TOLERANCE = 1e-7; // AU

    @Nested
    @DisplayName("Geometric position")
    class TrueGeocentricTests {

        @Test
        @DisplayName("1984 August 24.0")
        void fixture1984() {
            Sun.Geocentric sun = trueAt(30916.5);
            assertEquals(151.0130954, sun.longitude(), LONGITUDE_TOLERANCE);
            assertEquals(1.0109938, sun.distance(), DISTANCE_TOLERANCE);
        }

        @Test
        @DisplayName("1978 November 12.0 and 1992 October 13.0")
        void otherFixtures() {
            Sun.Geocentric nov = trueAt(28804.5);
            assertEquals(229.2517039, nov.longitude(), LONGITUDE_TOLERANCE);
            assertEquals(0.98983734, nov.distance(), DISTANCE_TOLERANCE);

            Sun.Geocentric oct = trueAt(33888.5);
            assertEquals(199.9060062, oct.longitude(), LONGITUDE_TOLERANCE);
            assertEquals(0.99759993, oct.distance(), DISTANCE_TOLERANCE);
        }

        @Test
        @DisplayName("Distance stays between perihelion and aphelion")
        void distanceRange() {
            for (double djd = 36000; djd < 36400; djd += 3.7) {
                Sun.Geocentric sun = trueAt(djd);
                assertTrue(sun.distance() > 0.982 && sun.distance() < 1.018, "djd=" + djd);
                assertTrue(sun.longitude() >= 0.0 && sun.longitude() < 360.0, "djd=" + djd);
            }
        }
    }

    @Nested
    @DisplayName("Apparent longitude")
    class ApparentTests {

        @Test
        @DisplayName("Nutation and aberration are applied")
        void apparent1984() {
            assertEquals(151.0035132, apparentAt(30916.5), LONGITUDE_TOLERANCE);
            assertEquals(229.2450957, apparentAt(28804.5), LONGITUDE_TOLERANCE);
            assertEquals(199.9047665, apparentAt(33888.5), LONGITUDE_TOLERANCE);
            assertEquals(57.8210645, apparentAt(30819.10833333333), LONGITUDE_TOLERANCE);
        }

        @Test
        @DisplayName("Light travel moves the Sun back by about 20 arcseconds")
        void lightTravel() {
            double t = 30916.5 / JulianDate.DAYS_PER_CENTURY;
            double ms = Sun.meanAnomaly(t);
            double ls = Sun.meanLongitude(t);
            double dpsi = Nutation.deltaPsi(t);
            double without = Sun.apparent(t, ms, ls, dpsi, true);
            double with = Sun.apparent(t, ms, ls, dpsi, false);
            double r = Sun.trueGeocentric(t, ms, ls).distance();
            assertEquals(1.365 * r * 15.0 / 3600.0, without - with, 1e-9);
        }
    }

    @Test
    @DisplayName("Mean elements are reduced to [0, 360)")
    void meanElementsReduced() {
        for (double t = -5.0; t <= 5.0; t += 0.37) {
            double l = Sun.meanLongitude(t);
            double m = Sun.meanAnomaly(t);
            assertTrue(l >= 0.0 && l < 360.0, "L at " + t);
            assertTrue(m >= 0.0 && m < 360.0, "M at " + t);
        }
    }

    private static Sun.Geocentric trueAt(double djd) {
        double t = djd / JulianDate.DAYS_PER_CENTURY;
        return Sun.trueGeocentric(t, Sun.meanAnomaly(t), Sun.meanLongitude(t));
    }

    private static double apparentAt(double djd) {
        double t = djd / JulianDate.DAYS_PER_CENTURY;
        return Sun.apparent(t, Sun.meanAnomaly(t), Sun.meanLongitude(t), Nutation.deltaPsi(t), true);
    }
}
