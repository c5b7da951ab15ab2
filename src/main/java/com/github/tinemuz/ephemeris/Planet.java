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
 * The eight planets handled by the Kepler pipeline.
 *
 * <p>Each constant carries its correction series and whether it is an
 * inferior planet. Inner and outer planets use different geocentric
 * projections.</p>
 */
public enum Planet {
    MERCURY("Mercury", true, PlanetPerturbations::mercury),
    VENUS("Venus", true, PlanetPerturbations::venus),
    MARS("Mars", false, PlanetPerturbations::mars),
    JUPITER("Jupiter", false, PlanetPerturbations::jupiter),
    SATURN("Saturn", false, PlanetPerturbations::saturn),
    URANUS("Uranus", false, PlanetPerturbations::uranus),
    NEPTUNE("Neptune", false, PlanetPerturbations::neptune),
    PLUTO("Pluto", false, PlanetPerturbations::none);

    private final String displayName;
    private final boolean inner;
    private final PerturbationModel perturbationModel;

    Planet(String displayName, boolean inner, PerturbationModel perturbationModel) {
        this.displayName = displayName;
        this.inner = inner;
        this.perturbationModel = perturbationModel;
    }

    /** Name as used in the element table and by {@link CelestialBody#forName}. */
    public String displayName() {
        return displayName;
    }

    /** True for Mercury and Venus. */
    public boolean isInner() {
        return inner;
    }

    public PerturbationModel perturbationModel() {
        return perturbationModel;
    }

    /**
     * Look up a planet by its display name.
     *
     * @throws UnknownBodyException if no planet has that name
     */
    public static Planet forName(String name) {
        for (Planet p : values()) {
            if (p.displayName.equals(name)) return p;
        }
        throw new UnknownBodyException(name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
