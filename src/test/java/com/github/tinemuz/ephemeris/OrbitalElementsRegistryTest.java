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

class OrbitalElementsRegistryTest {

    private static final double T_J2000 = JulianDate.centuriesSince1900(JulianDate.J2000);

    @Nested
    @DisplayName("Standard table")
    class StandardTests {

        @Test
        @DisplayName("Loads once and covers every planet")
        void loadsAllPlanets() {
            OrbitalElementsRegistry registry = OrbitalElementsRegistry.standard();
            assertSame(registry, OrbitalElementsRegistry.standard());
            assertEquals(OrbitalElementsRegistry.STANDARD_RESOURCE, registry.source());
            for (Planet planet : Planet.values()) {
                OrbitalElements el = registry.elements(planet);
                assertNotNull(el, planet.displayName());
                assertSame(planet, el.planet());
                double e = el.eccentricity(T_J2000);
                assertTrue(e >= 0.0 && e < 1.0, planet + " e=" + e);
            }
        }

        @Test
        @DisplayName("Mercury elements at 1900")
        void mercury1900() {
            OrbitalElements mercury = OrbitalElementsRegistry.standard().elements(Planet.MERCURY);
            assertEquals(0.20561421, mercury.eccentricity(0.0), 0.0);
            assertEquals(0.3870986, mercury.semiAxis(), 0.0);
            assertEquals(178.179078, mercury.meanLongitude(0.0), 0.0);
            assertEquals(178.179078 - 75.899697, mercury.meanAnomaly(0.0), 1e-9);
        }

        @Test
        @DisplayName("Mean daily motion is the anomalistic rate")
        void dailyMotion() {
            OrbitalElements mercury = OrbitalElementsRegistry.standard().elements(Planet.MERCURY);
            assertEquals(4.0923344338, mercury.dailyMotion(), 1e-9);
            OrbitalElements pluto = OrbitalElementsRegistry.standard().elements(Planet.PLUTO);
            // about one revolution in 248 years
            assertEquals(360.0 / (248 * 365.25), pluto.dailyMotion(), 1e-4);
        }

        @Test
        @DisplayName("Mars mean anomaly and eccentricity at J2000")
        void marsJ2000() {
            OrbitalElements mars = OrbitalElementsRegistry.standard().elements(Planet.MARS);
            assertEquals(19.3740658, mars.meanAnomaly(T_J2000), 1e-6);
            assertEquals(0.093404887, mars.eccentricity(T_J2000), 1e-9);
        }

        @Test
        @DisplayName("Snapshot angles are in radians")
        void snapshot() {
            OrbitalElements venus = OrbitalElementsRegistry.standard().elements(Planet.VENUS);
            OrbitalElements.Snapshot s = venus.at(0.0);
            assertEquals(Math.toRadians(130.163833), s.perihelion(), 1e-12);
            assertEquals(Math.toRadians(75.779647), s.node(), 1e-12);
            assertEquals(Math.toRadians(3.393631), s.inclination(), 1e-12);
            assertEquals(6.82069e-3, s.eccentricity(), 0.0);
            assertEquals(0.7233316, s.semiAxis(), 0.0);
        }
    }

    @Nested
    @DisplayName("Invalid tables")
    class InvalidTableTests {

        @Test
        @DisplayName("Missing resource")
        void missingResource() {
            IllegalStateException ex =
                    assertThrows(
                            IllegalStateException.class,
                            () -> OrbitalElementsRegistry.load("no-such-file.txt"));
            assertTrue(ex.getMessage().contains("no-such-file.txt"));
        }

        @Test
        @DisplayName("Planet without rows")
        void missingPlanet() {
            IllegalStateException ex =
                    assertThrows(
                            IllegalStateException.class,
                            () -> OrbitalElementsRegistry.load("elements-missing-pluto.txt"));
            assertTrue(ex.getMessage().contains("Pluto"), ex.getMessage());
        }

        @Test
        @DisplayName("Eccentricity of one or more")
        void hyperbolic() {
            IllegalStateException ex =
                    assertThrows(
                            IllegalStateException.class,
                            () -> OrbitalElementsRegistry.load("elements-hyperbolic-mars.txt"));
            assertTrue(ex.getMessage().contains("Mars"), ex.getMessage());
        }

        @Test
        @DisplayName("Unparseable number")
        void malformed() {
            IllegalStateException ex =
                    assertThrows(
                            IllegalStateException.class,
                            () -> OrbitalElementsRegistry.load("elements-malformed.txt"));
            assertInstanceOf(NumberFormatException.class, ex.getCause());
        }

        @Test
        @DisplayName("Unknown planet name")
        void unknownPlanet() {
            IllegalStateException ex =
                    assertThrows(
                            IllegalStateException.class,
                            () -> OrbitalElementsRegistry.load("elements-unknown-planet.txt"));
            UnknownBodyException cause = assertInstanceOf(UnknownBodyException.class, ex.getCause());
            assertEquals("Vulcan", cause.getName());
        }
    }
}
