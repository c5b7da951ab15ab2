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

import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.toRadians;

/**
 * Geocentric position of the Sun.
 *
 * <p>Time arguments are Julian centuries since 1900 January 0.5. The
 * longitudes are referred to the mean equinox of date.</p>
 */
public final class Sun {
    /** Constant of annual aberration in longitude, degrees. */
    public static final double ABERRATION = 5.69e-3;

    private Sun() {}

    /** Mean longitude of the Sun, degrees in [0, 360). */
    public static double meanLongitude(double t) {
        return AstroMath.reduceDeg(279.69668 + 3.025e-4 * t * t + AstroMath.frac360(100.0021359 * t));
    }

    /** Mean anomaly of the Sun, degrees in [0, 360). */
    public static double meanAnomaly(double t) {
        return AstroMath.reduceDeg(
                358.47583 - (1.5e-4 + 3.3e-6 * t) * t * t + AstroMath.frac360(99.99736042 * t));
    }

    /**
     * True geometric longitude and radius vector of the Sun.
     *
     * @param t  centuries since 1900
     * @param ms mean anomaly, degrees
     * @param ls mean longitude, degrees
     */
    public static Geocentric trueGeocentric(double t, double ms, double ls) {
        double s = AstroMath.polynome(t, 0.01675104, -4.18e-5, -1.26e-7);
        double ea = Kepler.solve(s, toRadians(ms));
        double nu = Kepler.trueAnomaly(s, ea);

        // Venus, Jupiter and the Moon
        double a = toRadians(153.23 + AstroMath.frac360(62.55209472 * t));
        double b = toRadians(216.57 + AstroMath.frac360(125.1041894 * t));
        double c = toRadians(312.69 + AstroMath.frac360(91.56766028 * t));
        double d = toRadians(350.74 - 1.44e-3 * t * t + AstroMath.frac360(1236.853095 * t));
        double h = toRadians(353.4 + AstroMath.frac360(183.1353208 * t));
        double e = toRadians(231.19 + 20.2 * t);
        double dl = 1.34e-3 * cos(a) + 1.54e-3 * cos(b) + 2e-3 * cos(c) + 1.79e-3 * sin(d) + 1.78e-3 * sin(e);
        double dr =
                5.43e-6 * sin(a)
                        + 1.575e-5 * sin(b)
                        + 1.627e-5 * sin(c)
                        + 3.076e-5 * cos(d)
                        + 9.27e-6 * sin(h);

        double longitude = AstroMath.reduceDeg(Math.toDegrees(nu) + ls - ms + dl);
        double distance = 1.0000002 * (1.0 - s * cos(ea)) + dr;
        return new Geocentric(longitude, distance);
    }

    /**
     * Apparent longitude of the Sun, degrees.
     *
     * @param dpsi              nutation in longitude, degrees
     * @param ignoreLightTravel skip the correction for the 1.365*R seconds
     *                          of time light needs to reach the Earth
     */
    public static double apparent(double t, double ms, double ls, double dpsi, boolean ignoreLightTravel) {
        Geocentric g = trueGeocentric(t, ms, ls);
        double l = g.longitude() + dpsi - ABERRATION;
        if (!ignoreLightTravel) {
            l -= 1.365 * g.distance() * 15.0 / 3600.0;
        }
        return AstroMath.reduceDeg(l);
    }

    /**
     * @param longitude true longitude, degrees
     * @param distance  radius vector, AU
     */
    public record Geocentric(double longitude, double distance) {}
}
