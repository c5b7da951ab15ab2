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
 * Every body an {@link EphemerisContext} can be asked about.
 */
public enum CelestialBody {
    SUN("Sun", null),
    MOON("Moon", null),
    MERCURY("Mercury", Planet.MERCURY),
    VENUS("Venus", Planet.VENUS),
    MARS("Mars", Planet.MARS),
    JUPITER("Jupiter", Planet.JUPITER),
    SATURN("Saturn", Planet.SATURN),
    URANUS("Uranus", Planet.URANUS),
    NEPTUNE("Neptune", Planet.NEPTUNE),
    PLUTO("Pluto", Planet.PLUTO),
    /** Ascending node of the lunar orbit, true or mean depending on the context. */
    LUNAR_NODE("LunarNode", null);

    private final String displayName;
    private final Planet planet;

    CelestialBody(String displayName, Planet planet) {
        this.displayName = displayName;
        this.planet = planet;
    }

    public String displayName() {
        return displayName;
    }

    /** The matching planet, or {@code null} for the Sun, the Moon and the lunar node. */
    public Planet planet() {
        return planet;
    }

    /**
     * Look up a body by its display name ("Sun", "Moon", "Mercury", ...,
     * "Pluto", "LunarNode"). Matching is case-sensitive.
     *
     * @throws UnknownBodyException if the name is not supported
     */
    public static CelestialBody forName(String name) {
        for (CelestialBody b : values()) {
            if (b.displayName.equals(name)) return b;
        }
        throw new UnknownBodyException(name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
