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
 * Solution of Kepler's equation for elliptical orbits.
 *
 * <p>All angles are in radians.</p>
 */
public final class Kepler {
    /** Convergence threshold on the residual {@code E - e*sin(E) - M}. */
    public static final double TOLERANCE = 1e-7;

    /** Default cap on solver steps. */
    public static final int MAX_ITERATIONS = 100;

    private Kepler() {}

    /**
     * Eccentric anomaly for the given eccentricity and mean anomaly.
     *
     * @param eccentricity eccentricity, 0 <= e < 1
     * @param meanAnomaly  mean anomaly, radians
     * @return eccentric anomaly E satisfying {@code |E - e*sin(E) - M| < 1e-7}
     * @throws InvalidEccentricityException if e is outside [0, 1)
     * @throws NumericConvergenceException if the iteration does not converge
     */
    public static double solve(double eccentricity, double meanAnomaly) {
        return solve(eccentricity, meanAnomaly, MAX_ITERATIONS);
    }

    /**
     * Same as {@link #solve(double, double)} with an explicit iteration cap.
     */
    public static double solve(double eccentricity, double meanAnomaly, int maxIterations) {
        checkEccentricity(eccentricity);
        // Newton-Raphson from E0 = M, kept inside [M - e, M + e] where the root lies
        double lo = meanAnomaly - eccentricity;
        double hi = meanAnomaly + eccentricity;
        double ea = meanAnomaly;
        double residual = ea - eccentricity * Math.sin(ea) - meanAnomaly;
        for (int i = 0; i < maxIterations; i++) {
            if (Math.abs(residual) < TOLERANCE) {
                return ea;
            }
            if (residual < 0.0) {
                lo = ea;
            } else {
                hi = ea;
            }
            double next = ea - residual / (1.0 - eccentricity * Math.cos(ea));
            if (!(next >= lo && next <= hi)) {
                // bisect when the Newton step leaves the bracket
                next = 0.5 * (lo + hi);
            }
            ea = next;
            residual = ea - eccentricity * Math.sin(ea) - meanAnomaly;
        }
        if (Math.abs(residual) < TOLERANCE) {
            return ea;
        }
        throw new NumericConvergenceException(eccentricity, meanAnomaly, maxIterations, residual);
    }

    /**
     * True anomaly from the eccentric anomaly.
     *
     * @param eccentricity     eccentricity, 0 <= e < 1
     * @param eccentricAnomaly eccentric anomaly, radians
     * @return true anomaly, radians in (-π, π]
     */
    public static double trueAnomaly(double eccentricity, double eccentricAnomaly) {
        checkEccentricity(eccentricity);
        return 2.0
                * Math.atan(
                        Math.sqrt((1.0 + eccentricity) / (1.0 - eccentricity))
                                * Math.tan(eccentricAnomaly / 2.0));
    }

    private static void checkEccentricity(double eccentricity) {
        // also rejects NaN
        if (!(eccentricity >= 0.0 && eccentricity < 1.0)) {
            throw new InvalidEccentricityException(eccentricity);
        }
    }
}
