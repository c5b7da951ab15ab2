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

import static java.lang.Math.asin;
import static java.lang.Math.atan;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

/**
 * Planet positions from elements: heliocentric coordinates first, then the
 * projection onto the sky as seen from the Earth.
 *
 * <p>Angles are radians unless stated otherwise. {@code earthLongitude} is
 * the heliocentric longitude of the Earth, that is the Sun's geocentric
 * longitude plus π.</p>
 */
public final class PlanetaryTransform {
    /** Constant of aberration, radians. */
    public static final double ABERRATION = 9.9387e-5;

    /** Light time for one AU, days. */
    public static final double LIGHT_TIME_PER_AU = 5.775518e-3;

    private PlanetaryTransform() {}

    /**
     * Heliocentric position of a planet and its distance from the Earth.
     *
     * @param el             unperturbed elements at the epoch
     * @param meanAnomaly    mean anomaly, radians
     * @param sunDistance    Earth-Sun distance, AU
     * @param earthLongitude heliocentric longitude of the Earth, radians
     * @param p              corrections evaluated for the same mean anomalies
     */
    public static Heliocentric heliocentric(
            OrbitalElements.Snapshot el,
            double meanAnomaly,
            double sunDistance,
            double earthLongitude,
            Perturbations p) {
        double s = el.eccentricity() + p.ds();
        double m = AstroMath.reduceRad(meanAnomaly + p.dm());
        double ea = Kepler.solve(s, m);
        double nu = Kepler.trueAnomaly(s, ea);

        double rp = (el.semiAxis() + p.da()) * (1 - s * s) / (1 + s * cos(nu)) + p.dr();
        double lp = nu + el.perihelion() + (p.dml() - p.dm());
        double lo = lp - el.node();
        double slo = sin(lo);
        double psi = asin(slo * sin(el.inclination())) + p.dhl();
        double lpd = atan2(slo * cos(el.inclination()), cos(lo)) + el.node() + Math.toRadians(p.dl());
        double cpsi = cos(psi);
        double ll = lpd - earthLongitude;
        double rho = sqrt(sunDistance * sunDistance + rp * rp - 2 * sunDistance * rp * cpsi * cos(ll));
        return new Heliocentric(ll, rp * cpsi, lpd, sin(psi), cpsi, rho);
    }

    /**
     * Geocentric ecliptic direction of a planet.
     *
     * @param planet         selects the inferior or superior projection
     * @param h              heliocentric position
     * @param earthLongitude heliocentric longitude of the Earth, radians
     * @param sunDistance    Earth-Sun distance, AU
     * @param apparent       apply nutation and aberration
     * @param dpsi           nutation in longitude, degrees
     * @return longitude in [0, 360) and latitude, degrees
     */
    public static Direction geocentric(
            Planet planet,
            Heliocentric h,
            double earthLongitude,
            double sunDistance,
            boolean apparent,
            double dpsi) {
        double sll = sin(h.ll());
        double cll = cos(h.ll());
        double lam;
        if (planet.isInner()) {
            lam = atan2(-h.rpd() * sll, sunDistance - h.rpd() * cll) + earthLongitude + Math.PI;
        } else {
            lam = atan2(sunDistance * sll, h.rpd() - sunDistance * cll) + h.lpd();
        }
        double bet = atan(h.rpd() * h.sinPsi() * sin(lam - h.lpd()) / (h.cosPsi() * sunDistance * sll));
        if (apparent) {
            lam += Math.toRadians(dpsi);
            double a = earthLongitude + Math.PI - lam;
            lam -= ABERRATION * cos(a) / cos(bet);
            bet -= ABERRATION * sin(a) * sin(bet);
        }
        return new Direction(Math.toDegrees(AstroMath.reduceRad(lam)), Math.toDegrees(bet));
    }

    /**
     * Intermediate heliocentric quantities.
     *
     * @param ll     planet longitude minus the Earth's, radians
     * @param rpd    radius vector projected on the ecliptic, AU
     * @param lpd    heliocentric longitude, radians
     * @param sinPsi sine of the heliocentric latitude
     * @param cosPsi cosine of the heliocentric latitude
     * @param rho    distance from the Earth, AU
     */
    public record Heliocentric(double ll, double rpd, double lpd, double sinPsi, double cosPsi, double rho) {}

    /**
     * @param longitude degrees in [0, 360)
     * @param latitude  degrees
     */
    public record Direction(double longitude, double latitude) {}
}
