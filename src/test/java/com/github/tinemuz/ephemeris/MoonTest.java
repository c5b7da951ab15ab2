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

class MoonTest {

    private static final double ANGLE_TOLERANCE = 1e-5; // degrees
    private static final double DISTANCE_TOLERANCE = 1e-9; // AU

    @Nested
    @DisplayName("Position series")
    class TruePositionTests {

        @Test
        @DisplayName("1872 August 14.0")
        void fixture1872() {
            Moon.TruePosition moon = atDays(-10000.5);
            assertEquals(253.85478, moon.position().longitude(), ANGLE_TOLERANCE);
            assertEquals(-0.35884, moon.position().latitude(), ANGLE_TOLERANCE);
            assertEquals(0.002475418, moon.position().distance(), DISTANCE_TOLERANCE);
            assertEquals(0.98681, moon.parallax(), ANGLE_TOLERANCE);
            assertEquals(14.073505, moon.dailyMotion(), 1e-6);
        }

        @Test
        @DisplayName("1880 October 31.0")
        void fixture1880() {
            Moon.TruePosition moon = atDays(-7000.5);
            assertEquals(183.03298, moon.position().longitude(), ANGLE_TOLERANCE);
            assertEquals(-5.10613, moon.position().latitude(), ANGLE_TOLERANCE);
            assertEquals(0.0025318452, moon.position().distance(), DISTANCE_TOLERANCE);
            assertEquals(0.96482, moon.parallax(), ANGLE_TOLERANCE);
            assertEquals(13.6149043, moon.dailyMotion(), 1e-6);
        }

        @Test
        @DisplayName("Epochs from 1897 to 2028")
        void laterFixtures() {
            assertPosition(atDays(-1000.5), 46.33259, 5.03904);
            assertPosition(atDays(31999.5), 354.53313, -0.77311);
            assertPosition(atDays(46999.5), 353.93133, 4.49791);
            assertEquals(11.8601646, atDays(-1000.5).dailyMotion(), 1e-6);
            assertEquals(14.3985387, atDays(31999.5).dailyMotion(), 1e-6);
            assertEquals(11.8573872, atDays(46999.5).dailyMotion(), 1e-6);
        }

        @Test
        @DisplayName("Distance is consistent with parallax")
        void distanceFromParallax() {
            Moon.TruePosition moon = atDays(12345.25);
            assertEquals(8.794 / (moon.parallax() * 3600.0), moon.position().distance(), 1e-15);
        }

        @Test
        @DisplayName("Values stay in their physical ranges over a month")
        void ranges() {
            for (double djd = 36000.0; djd < 36030.0; djd += 0.25) {
                Moon.TruePosition moon = atDays(djd);
                double lon = moon.position().longitude();
                assertTrue(lon >= 0.0 && lon < 360.0, "longitude at " + djd);
                assertTrue(Math.abs(moon.position().latitude()) < 5.4, "latitude at " + djd);
                assertTrue(moon.parallax() > 0.89 && moon.parallax() < 1.03, "parallax at " + djd);
                assertTrue(moon.dailyMotion() > 11.5 && moon.dailyMotion() < 15.5, "motion at " + djd);
            }
        }
    }

    @Nested
    @DisplayName("Lunar node")
    class NodeTests {

        private static final double JD_1965 = 2438792.99027777778;

        @Test
        @DisplayName("Mean and true node, 1965 February 1")
        void node1965() {
            assertEquals(80.3117347, Moon.lunarNode(JD_1965, true), 1e-7);
            assertEquals(81.8665288, Moon.lunarNode(JD_1965, false), 1e-7);
            assertEquals(Moon.lunarNode(JD_1965, true), Moon.meanLunarNode(JD_1965), 0.0);
        }

        @Test
        @DisplayName("Mean node at J2000 and its regression rate")
        void meanNodeJ2000() {
            assertEquals(125.0445479, Moon.meanLunarNode(JulianDate.J2000), 1e-9);
            assertEquals(-1934.1362891 / 36525.0, Moon.meanNodeMotion(JulianDate.J2000), 1e-12);
            assertEquals(-0.05295, Moon.meanNodeMotion(JulianDate.J2000), 1e-5);
        }

        @Test
        @DisplayName("True node oscillates within two degrees of the mean node")
        void trueNodeAmplitude() {
            for (double jd = JulianDate.J2000; jd < JulianDate.J2000 + 400; jd += 1.3) {
                double d = AstroMath.longitudeDelta(Moon.lunarNode(jd, true), Moon.lunarNode(jd, false));
                assertTrue(Math.abs(d) < 2.0, "jd=" + jd + " diff=" + d);
            }
        }
    }

    private static Moon.TruePosition atDays(double djd) {
        return Moon.truePosition(JulianDate.J1900 + djd);
    }

    private static void assertPosition(Moon.TruePosition moon, double lon, double lat) {
        assertEquals(lon, moon.position().longitude(), ANGLE_TOLERANCE, "longitude");
        assertEquals(lat, moon.position().latitude(), ANGLE_TOLERANCE, "latitude");
    }
}
