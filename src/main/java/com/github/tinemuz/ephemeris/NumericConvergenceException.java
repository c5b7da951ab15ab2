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
 * Thrown when Kepler's equation does not converge within the iteration cap.
 */
public class NumericConvergenceException extends EphemerisException {
    private static final long serialVersionUID = 1L;

    private final double eccentricity;
    private final double meanAnomaly;
    private final int iterations;
    private final double residual;

    public NumericConvergenceException(
            double eccentricity, double meanAnomaly, int iterations, double residual) {
        super(
                String.format(
                        "Kepler equation did not converge after %d iterations "
                                + "(e=%s, M=%s rad, residual=%s)",
                        iterations, eccentricity, meanAnomaly, residual));
        this.eccentricity = eccentricity;
        this.meanAnomaly = meanAnomaly;
        this.iterations = iterations;
        this.residual = residual;
    }

    public double getEccentricity() {
        return eccentricity;
    }

    public double getMeanAnomaly() {
        return meanAnomaly;
    }

    public int getIterations() {
        return iterations;
    }

    /** Value of {@code E - e*sin(E) - M} after the last step. */
    public double getResidual() {
        return residual;
    }
}
