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

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PlanetPerturbationsTest {

    /** Centuries since 1900 for 2000 January 1.5. */
    private static final double T = JulianDate.centuriesSince1900(JulianDate.J2000);

    @Nested
    @DisplayName("Which corrections each planet produces")
    class ShapeTests {

        @Test
        @DisplayName("Mercury perturbs only longitude and radius")
        void mercury() {
            Perturbations p = PlanetPerturbations.mercury(input(0.2056));
            assertNotEquals(0.0, p.dl());
            assertNotEquals(0.0, p.dr());
            assertEquals(0.0, p.dml());
            assertEquals(0.0, p.dm());
            assertEquals(0.0, p.ds());
            assertEquals(0.0, p.da());
            assertEquals(0.0, p.dhl());
        }

        @Test
        @DisplayName("Venus and Mars correct mean longitude and anomaly equally")
        void venusAndMars() {
            for (Perturbations p :
                    new Perturbations[] {
                        PlanetPerturbations.venus(input(0.0068)), PlanetPerturbations.mars(input(0.0934))
                    }) {
                assertEquals(p.dml(), p.dm(), 0.0);
                assertNotEquals(0.0, p.dl());
                assertNotEquals(0.0, p.dr());
                assertEquals(0.0, p.dhl());
            }
        }

        @Test
        @DisplayName("Jupiter has no latitude term, Saturn has one")
        void jupiterAndSaturn() {
            Perturbations jupiter = PlanetPerturbations.jupiter(input(0.0484));
            Perturbations saturn = PlanetPerturbations.saturn(input(0.0556));
            assertEquals(0.0, jupiter.dhl());
            assertEquals(0.0, jupiter.dl());
            assertEquals(0.0, jupiter.dr());
            assertNotEquals(0.0, saturn.dhl());
            assertNotEquals(0.0, jupiter.ds());
            assertNotEquals(0.0, saturn.da());
        }

        @Test
        @DisplayName("Uranus and Neptune fill every correction")
        void uranusAndNeptune() {
            for (Perturbations p :
                    new Perturbations[] {
                        PlanetPerturbations.uranus(input(0.0463)), PlanetPerturbations.neptune(input(0.0090))
                    }) {
                assertNotEquals(0.0, p.dl());
                assertNotEquals(0.0, p.dr());
                assertNotEquals(0.0, p.dml());
                assertNotEquals(0.0, p.dm());
                assertNotEquals(0.0, p.ds());
                assertNotEquals(0.0, p.da());
                assertNotEquals(0.0, p.dhl());
            }
        }

        @Test
        @DisplayName("Pluto has no series")
        void pluto() {
            assertSame(Perturbations.NONE, PlanetPerturbations.none(input(0.25)));
            assertSame(Perturbations.NONE, Planet.PLUTO.perturbationModel().compute(input(0.25)));
        }
    }

    @Nested
    @DisplayName("Arguments")
    class ArgumentTests {

        @Test
        @DisplayName("Giant planets divide the perihelion term by the eccentricity")
        void eccentricityOnlyAffectsMeanAnomaly() {
            Perturbations a = PlanetPerturbations.jupiter(input(0.04));
            Perturbations b = PlanetPerturbations.jupiter(input(0.08));
            assertEquals(a.dml(), b.dml(), 0.0);
            assertEquals(a.ds(), b.ds(), 0.0);
            assertNotEquals(a.dm(), b.dm());
            // dm = dml - B/e, so dm - dml scales with 1/e
            assertEquals(2.0 * (b.dm() - b.dml()), a.dm() - a.dml(), 1e-15);
        }

        @Test
        @DisplayName("Inner planets follow the mean anomalies they are given")
        void meanAnomalyDependence() {
            Map<Planet, Double> shifted = anomalies();
            shifted.put(Planet.JUPITER, shifted.get(Planet.JUPITER) + 0.5);
            PerturbationInput moved = new PerturbationInput(T, 0.2056, 6.22, shifted::get);
            assertNotEquals(
                    PlanetPerturbations.mercury(input(0.2056)).dl(), PlanetPerturbations.mercury(moved).dl());
        }

        @Test
        @DisplayName("Each planet is wired to its own series")
        void enumWiring() {
            PerturbationInput in = input(0.05);
            assertEquals(PlanetPerturbations.mercury(in), Planet.MERCURY.perturbationModel().compute(in));
            assertEquals(PlanetPerturbations.venus(in), Planet.VENUS.perturbationModel().compute(in));
            assertEquals(PlanetPerturbations.mars(in), Planet.MARS.perturbationModel().compute(in));
            assertEquals(PlanetPerturbations.jupiter(in), Planet.JUPITER.perturbationModel().compute(in));
            assertEquals(PlanetPerturbations.saturn(in), Planet.SATURN.perturbationModel().compute(in));
            assertEquals(PlanetPerturbations.uranus(in), Planet.URANUS.perturbationModel().compute(in));
            assertEquals(PlanetPerturbations.neptune(in), Planet.NEPTUNE.perturbationModel().compute(in));
        }
    }

    @Test
    @DisplayName("Corrections stay small over two centuries")
    void magnitudes() {
        for (double t = 0.5; t <= 2.5; t += 0.05) {
            for (Planet planet : Planet.values()) {
                double e = OrbitalElementsRegistry.standard().elements(planet).eccentricity(t);
                Perturbations p = planet.perturbationModel().compute(input(t, e));
                String where = planet + " at T=" + t;
                assertTrue(Math.abs(p.dl()) < 0.1, where + " dl=" + p.dl());
                assertTrue(Math.abs(p.dr()) < 0.1, where + " dr=" + p.dr());
                assertTrue(Math.abs(Math.toDegrees(p.dml())) < 1.5, where + " dml=" + p.dml());
                assertTrue(Math.abs(p.ds()) < 0.01, where + " ds=" + p.ds());
                assertTrue(Math.abs(p.da()) < 0.05, where + " da=" + p.da());
                assertTrue(Math.abs(Math.toDegrees(p.dhl())) < 0.01, where + " dhl=" + p.dhl());
            }
        }
    }

    private static PerturbationInput input(double eccentricity) {
        return input(T, eccentricity);
    }

    private static PerturbationInput input(double t, double eccentricity) {
        Map<Planet, Double> m = anomalies();
        return new PerturbationInput(t, eccentricity, 6.22, m::get);
    }

    // rough mean anomalies at J2000, radians
    private static Map<Planet, Double> anomalies() {
        Map<Planet, Double> m = new EnumMap<>(Planet.class);
        m.put(Planet.MERCURY, 2.96);
        m.put(Planet.VENUS, 0.88);
        m.put(Planet.MARS, 0.34);
        m.put(Planet.JUPITER, 0.35);
        m.put(Planet.SATURN, 5.53);
        m.put(Planet.URANUS, 2.46);
        m.put(Planet.NEPTUNE, 4.54);
        m.put(Planet.PLUTO, 0.26);
        return m;
    }
}
