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
 * Angle reduction and polynomial helpers shared by the series evaluators.
 */
public final class AstroMath {
    /** Two pi. */
    public static final double PI2 = Math.PI * 2.0;

    private AstroMath() {}

    /** Reduce an angle in degrees to the range [0, 360). */
    public static double reduceDeg(double deg) {
        double r = deg % 360.0;
        if (r < 0) {
            r += 360.0;
            // a tiny negative remainder rounds up to exactly 360
            if (r >= 360.0) return 0.0;
        }
        return r;
    }

    /** Reduce an angle in radians to the range [0, 2π). */
    public static double reduceRad(double rad) {
        double r = rad % PI2;
        if (r < 0) {
            r += PI2;
            if (r >= PI2) return 0.0;
        }
        return r;
    }

    /** Fractional part of {@code x}, always in [0, 1). */
    public static double frac(double x) {
        return x - Math.floor(x);
    }

    /**
     * Fractional part of a number of revolutions, expressed in degrees.
     * Used for the fast-moving linear terms so that large multiples of 360
     * never reach the trigonometric functions.
     */
    public static double frac360(double revolutions) {
        return frac(revolutions) * 360.0;
    }

    /**
     * Evaluate {@code c[0] + c[1]*t + c[2]*t^2 + ...} with Horner's rule.
     */
    public static double polynome(double t, double... coeffs) {
        double result = 0.0;
        for (int i = coeffs.length - 1; i >= 0; i--) {
            result = result * t + coeffs[i];
        }
        return result;
    }

    /**
     * Signed difference {@code to - from} between two longitudes, wrapped into
     * (-180, 180].
     */
    public static double longitudeDelta(double fromDeg, double toDeg) {
        double d = reduceDeg(toDeg - fromDeg);
        return d > 180.0 ? d - 360.0 : d;
    }
}
