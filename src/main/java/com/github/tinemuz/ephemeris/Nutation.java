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
 * Nutation in longitude and obliquity, low precision series of Duffett-Smith.
 */
public final class Nutation {

    private Nutation() {}

    /**
     * Nutation at {@code t} Julian centuries since 1900.
     *
     * @return Δψ and Δε in degrees
     */
    public static Nutation.Angles at(double t) {
        double t2 = t * t;
        double ls = 279.6967 + 3.030e-4 * t2 + AstroMath.frac360(100.0021358 * t);
        double ld = 270.4342 - 1.133e-3 * t2 + AstroMath.frac360(1336.855231 * t);
        double ms = toRadians(358.4758 - 1.5e-4 * t2 + AstroMath.frac360(99.99736056 * t));
        double md = toRadians(296.1046 + 9.192e-3 * t2 + AstroMath.frac360(1325.552359 * t));
        double nmDeg = 259.1833 + 2.078e-3 * t2 - AstroMath.frac360(5.372616667 * t);
        double nm = toRadians(nmDeg);
        double tls = toRadians(2 * ls);
        double tnm = toRadians(2 * nmDeg);
        double tld = toRadians(2 * ld);

        // arcseconds
        double dpsi =
                (-17.2327 - 1.737e-2 * t) * sin(nm)
                        + (-1.2729 - 1.3e-4 * t) * sin(tls)
                        + 0.2088 * sin(tnm)
                        - 0.2037 * sin(tld)
                        + (0.1261 - 3.1e-4 * t) * sin(ms)
                        + 0.0675 * sin(md)
                        - (0.0497 - 1.2e-4 * t) * sin(tls + ms)
                        - 0.0342 * sin(tld - nm)
                        - 0.0261 * sin(tld + md)
                        + 0.0214 * sin(tls - ms)
                        - 0.0149 * sin(tls - tld + md)
                        + 0.0124 * sin(tls - nm)
                        + 0.0114 * sin(tld - md);
        double deps =
                (9.21 + 9.1e-4 * t) * cos(nm)
                        + (0.5522 - 2.9e-4 * t) * cos(tls)
                        - 0.0904 * cos(tnm)
                        + 0.0884 * cos(tld)
                        + 0.0216 * cos(tls + ms)
                        + 0.0183 * cos(tld - nm)
                        + 0.0113 * cos(tld + md)
                        - 0.0093 * cos(tls - ms)
                        - 0.0066 * cos(tls - nm);
        return new Angles(dpsi / 3600.0, deps / 3600.0);
    }

    /** Nutation in longitude Δψ, degrees. */
    public static double deltaPsi(double t) {
        return at(t).deltaPsi();
    }

    /** Nutation in obliquity Δε, degrees. */
    public static double deltaEps(double t) {
        return at(t).deltaEps();
    }

    /**
     * True obliquity of the ecliptic in degrees.
     *
     * @param t    centuries since 1900
     * @param deps nutation in obliquity, degrees
     */
    public static double obliquity(double t, double deps) {
        double c = ((-0.00181 * t + 0.0059) * t + 46.845) * t;
        return 23.45229444 - c / 3600.0 + deps;
    }

    /**
     * @param deltaPsi nutation in longitude, degrees
     * @param deltaEps nutation in obliquity, degrees
     */
    public record Angles(double deltaPsi, double deltaEps) {}
}
