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

import java.util.function.ToDoubleFunction;

/**
 * Arguments available to a {@link PerturbationModel}.
 *
 * <p>Each planet reads only what its series needs. Mercury, Venus and Mars
 * use mean anomalies of other planets. Jupiter to Neptune use the time and
 * the planet's own eccentricity. Pluto uses nothing.</p>
 *
 * @param t              Julian centuries since 1900 January 0.5
 * @param eccentricity   unperturbed eccentricity of the planet
 * @param sunMeanAnomaly mean anomaly of the Sun, radians
 * @param meanAnomalies  mean anomaly of any planet in radians, already shifted
 *                       for light time
 */
public record PerturbationInput(
        double t,
        double eccentricity,
        double sunMeanAnomaly,
        ToDoubleFunction<Planet> meanAnomalies) {

    /** Mean anomaly of {@code planet}, radians. */
    public double meanAnomaly(Planet planet) {
        return meanAnomalies.applyAsDouble(planet);
    }
}
