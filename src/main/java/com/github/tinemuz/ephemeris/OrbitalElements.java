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

import java.util.Arrays;

/**
 * Osculating elements of one planet as polynomials in Julian centuries since
 * 1900 January 0.5.
 *
 * <p>Each polynomial has four coefficients {@code c0 + c1*T + c2*T^2 + c3*T^3}.
 * The mean longitude is special: its linear coefficient is in revolutions per
 * century and only its fractional part contributes.</p>
 */
public final class OrbitalElements {
    private final Planet planet;
    private final double[] meanLongitude;
    private final double[] perihelion;
    private final double[] eccentricity;
    private final double[] inclination;
    private final double[] node;
    private final double semiAxis;

    OrbitalElements(
            Planet planet,
            double[] meanLongitude,
            double[] perihelion,
            double[] eccentricity,
            double[] inclination,
            double[] node,
            double semiAxis) {
        this.planet = planet;
        this.meanLongitude = cubic(meanLongitude);
        this.perihelion = cubic(perihelion);
        this.eccentricity = cubic(eccentricity);
        this.inclination = cubic(inclination);
        this.node = cubic(node);
        this.semiAxis = semiAxis;
    }

    public Planet planet() {
        return planet;
    }

    /** Mean longitude in degrees, not reduced. */
    public double meanLongitude(double t) {
        double[] c = meanLongitude;
        return c[0] + AstroMath.frac360(c[1] * t) + c[2] * t * t + c[3] * t * t * t;
    }

    /** Longitude of perihelion in degrees. */
    public double perihelion(double t) {
        return AstroMath.polynome(t, perihelion);
    }

    /** Mean anomaly {@code L - P} in degrees, reduced to [0, 360). */
    public double meanAnomaly(double t) {
        return AstroMath.reduceDeg(meanLongitude(t) - perihelion(t));
    }

    public double eccentricity(double t) {
        return AstroMath.polynome(t, eccentricity);
    }

    /**
     * Mean anomalistic motion in degrees per day. The mean longitude advances
     * by {@code 360*L1} degrees per century and the perihelion by {@code P1}.
     */
    public double dailyMotion() {
        return (360.0 * meanLongitude[1] - perihelion[1]) / JulianDate.DAYS_PER_CENTURY;
    }

    /** Semi-major axis in AU. */
    public double semiAxis() {
        return semiAxis;
    }

    /** Evaluate the angular elements at {@code t} centuries since 1900. */
    public Snapshot at(double t) {
        return at(t, eccentricity(t));
    }

    /** As {@link #at(double)}, with an eccentricity already evaluated for {@code t}. */
    public Snapshot at(double t, double eccentricity) {
        return new Snapshot(
                eccentricity,
                semiAxis,
                Math.toRadians(perihelion(t)),
                Math.toRadians(AstroMath.polynome(t, node)),
                Math.toRadians(AstroMath.polynome(t, inclination)));
    }

    private static double[] cubic(double[] c) {
        return Arrays.copyOf(c, 4);
    }

    @Override
    public String toString() {
        return "OrbitalElements[" + planet + ", a=" + semiAxis + "]";
    }

    /**
     * Elements evaluated at one epoch.
     *
     * @param eccentricity unperturbed eccentricity
     * @param semiAxis     semi-major axis, AU
     * @param perihelion   longitude of perihelion, radians
     * @param node         longitude of the ascending node, radians
     * @param inclination  inclination to the ecliptic, radians
     */
    public record Snapshot(
            double eccentricity, double semiAxis, double perihelion, double node, double inclination) {}
}
