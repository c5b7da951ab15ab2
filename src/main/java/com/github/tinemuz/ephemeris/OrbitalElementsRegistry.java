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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Planet element tables loaded from a classpath resource.
 *
 * <p>The standard table ({@value #STANDARD_RESOURCE}) is read on first use and
 * shared. A registry never changes after loading, so it can be read from any
 * number of threads.</p>
 */
public final class OrbitalElementsRegistry {
    private static final Logger log = LoggerFactory.getLogger(OrbitalElementsRegistry.class);

    /** Classpath resource holding the standard element table. */
    public static final String STANDARD_RESOURCE = "orbital-elements.txt";

    private static final String ELEMENT_KEYS = "LPEINA";

    private static volatile OrbitalElementsRegistry standard;

    private final String source;
    private final Map<Planet, OrbitalElements> elements;

    private OrbitalElementsRegistry(String source, Map<Planet, OrbitalElements> elements) {
        this.source = source;
        this.elements = Collections.unmodifiableMap(elements);
    }

    /**
     * The shared registry backed by {@value #STANDARD_RESOURCE}.
     *
     * @throws IllegalStateException if the table cannot be loaded
     */
    public static OrbitalElementsRegistry standard() {
        OrbitalElementsRegistry r = standard;
        if (r == null) {
            r = loadStandard();
        }
        return r;
    }

    private static synchronized OrbitalElementsRegistry loadStandard() {
        if (standard == null) {
            standard = load(STANDARD_RESOURCE);
        }
        return standard;
    }

    /**
     * Read a registry from a classpath resource. Every planet must have all six
     * elements, and the eccentricity at 1900 must lie in [0, 1).
     *
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static OrbitalElementsRegistry load(String resource) {
        InputStream in = OrbitalElementsRegistry.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Orbital elements file '{}' not found on classpath", resource);
            throw new IllegalStateException(
                    "Orbital elements file '" + resource + "' not found on classpath");
        }
        Map<Planet, double[][]> rows = new EnumMap<>(Planet.class);
        try (BufferedReader br =
                new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length < 3 || toks.length > 6 || toks[1].length() != 1) {
                    throw new IllegalArgumentException("Malformed row at line " + lineNo + ": " + line);
                }
                Planet planet = Planet.forName(toks[0]);
                int key = ELEMENT_KEYS.indexOf(toks[1].charAt(0));
                if (key < 0) {
                    throw new IllegalArgumentException(
                            "Unknown element '" + toks[1] + "' at line " + lineNo);
                }
                double[] coeffs = new double[toks.length - 2];
                for (int i = 0; i < coeffs.length; i++) {
                    coeffs[i] = Double.parseDouble(toks[i + 2]);
                }
                double[][] table = rows.computeIfAbsent(planet, p -> new double[ELEMENT_KEYS.length()][]);
                if (table[key] != null) {
                    throw new IllegalArgumentException(
                            "Duplicate element " + toks[1] + " for " + planet + " at line " + lineNo);
                }
                table[key] = coeffs;
            }
        } catch (IOException e) {
            log.error("Failed to read orbital elements file '{}'", resource, e);
            throw new IllegalStateException("Failed to read orbital elements file " + resource, e);
        } catch (Exception e) {
            log.error("Failed to parse orbital elements file '{}'", resource, e);
            throw new IllegalStateException("Failed to parse orbital elements file " + resource, e);
        }

        Map<Planet, OrbitalElements> result = new EnumMap<>(Planet.class);
        for (Planet planet : Planet.values()) {
            double[][] table = rows.get(planet);
            for (int k = 0; k < ELEMENT_KEYS.length(); k++) {
                if (table == null || table[k] == null) {
                    log.error("Orbital elements file '{}' has no {} row for {}",
                            resource, ELEMENT_KEYS.charAt(k), planet);
                    throw new IllegalStateException(
                            "Missing element " + ELEMENT_KEYS.charAt(k) + " for " + planet
                                    + " in " + resource);
                }
            }
            OrbitalElements el =
                    new OrbitalElements(
                            planet, table[0], table[1], table[2], table[3], table[4], table[5][0]);
            double e = el.eccentricity(0.0);
            if (!(e >= 0.0 && e < 1.0)) {
                log.error("Orbital elements file '{}' gives eccentricity {} for {}", resource, e, planet);
                throw new IllegalStateException(
                        "Eccentricity " + e + " of " + planet + " in " + resource + " is not elliptical");
            }
            result.put(planet, el);
        }
        log.debug("Loaded orbital elements for {} planets from {}", result.size(), resource);
        return new OrbitalElementsRegistry(resource, result);
    }

    /** Elements of {@code planet}; never null. */
    public OrbitalElements elements(Planet planet) {
        return elements.get(planet);
    }

    /** Resource this registry was read from. */
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "OrbitalElementsRegistry[" + source + "]";
    }
}
