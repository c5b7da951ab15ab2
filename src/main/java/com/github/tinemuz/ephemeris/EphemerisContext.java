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

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Positions of the Sun, Moon, planets and lunar node at one epoch.
 *
 * <p>The quantities every query needs (solar anomaly, nutation, the Sun's
 * geocentric longitude and distance) are computed when the context is
 * created. Body positions and daily motions are computed on first request
 * and cached, so repeated queries return the same instance. A context may be
 * shared between threads.</p>
 *
 * <p>Planet positions are corrected for light time: the planet is placed
 * where it was when the light left it, using the distance from a first,
 * uncorrected pass.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 * EphemerisContext ctx = EphemerisContext.create(JulianDate.fromCivil(2004, 6, 8.35), true, true);
 * EclipticPosition venus = ctx.position(CelestialBody.VENUS);
 * double motion = ctx.dailyMotion("Venus");
 * }</pre>
 */
public final class EphemerisContext {
    private static final Logger log = LoggerFactory.getLogger(EphemerisContext.class);

    /** Distance from 1900 in centuries beyond which the series lose accuracy. */
    static final double RELIABLE_CENTURIES = 3.0;

    private static volatile boolean warnedOutOfRange = false;

    private final double julianDay;
    private final double daysSince1900;
    private final double centuries;
    private final boolean apparent;
    private final boolean trueNode;
    private final OrbitalElementsRegistry registry;

    private final double sunMeanAnomaly;
    private final double sunMeanLongitude;
    private final double deltaPsi;
    private final double deltaEps;
    private final double obliquity;
    private final double sunLongitude;
    private final double sunDistance;

    private final Map<CelestialBody, EclipticPosition> positions = new ConcurrentHashMap<>();
    private final Map<CelestialBody, Double> motions = new ConcurrentHashMap<>();
    private final Map<Planet, Double> meanAnomalies = new ConcurrentHashMap<>();
    private final Map<Planet, Double> eccentricities = new ConcurrentHashMap<>();

    private volatile Moon.TruePosition moon;

    // guarded by this
    private EphemerisContext previous;
    private EphemerisContext next;

    private EphemerisContext(
            double julianDay, boolean apparent, boolean trueNode, OrbitalElementsRegistry registry) {
        this.julianDay = julianDay;
        this.daysSince1900 = JulianDate.daysSince1900(julianDay);
        this.centuries = daysSince1900 / JulianDate.DAYS_PER_CENTURY;
        this.apparent = apparent;
        this.trueNode = trueNode;
        this.registry = registry;

        warnIfOutOfRange(centuries);

        this.sunMeanAnomaly = Sun.meanAnomaly(centuries);
        this.sunMeanLongitude = Sun.meanLongitude(centuries);
        Nutation.Angles nutation = Nutation.at(centuries);
        this.deltaPsi = nutation.deltaPsi();
        this.deltaEps = nutation.deltaEps();
        this.obliquity = Nutation.obliquity(centuries, deltaEps);
        Sun.Geocentric sun = Sun.trueGeocentric(centuries, sunMeanAnomaly, sunMeanLongitude);
        this.sunLongitude = sun.longitude();
        this.sunDistance = sun.distance();
    }

    /** True positions and the true lunar node at {@code julianDay}. */
    public static EphemerisContext create(double julianDay) {
        return create(julianDay, false, true);
    }

    /**
     * @param apparent include nutation and aberration
     * @param trueNode report the true rather than the mean lunar node
     */
    public static EphemerisContext create(double julianDay, boolean apparent, boolean trueNode) {
        return new EphemerisContext(julianDay, apparent, trueNode, OrbitalElementsRegistry.standard());
    }

    /** As {@link #create(double, boolean, boolean)} with an explicit element table. */
    public static EphemerisContext create(
            double julianDay, boolean apparent, boolean trueNode, OrbitalElementsRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        return new EphemerisContext(julianDay, apparent, trueNode, registry);
    }

    /** Context for a UTC instant. */
    public static EphemerisContext forInstant(Instant instant, boolean apparent, boolean trueNode) {
        return create(JulianDate.fromEpochMillis(instant.toEpochMilli()), apparent, trueNode);
    }

    private static void warnIfOutOfRange(double centuries) {
        if (Math.abs(centuries) > RELIABLE_CENTURIES && !warnedOutOfRange) {
            synchronized (EphemerisContext.class) {
                if (!warnedOutOfRange) {
                    warnedOutOfRange = true;
                    log.warn(
                            "Epoch is {} centuries from 1900; the classical series are "
                                    + "unreliable beyond {} centuries",
                            String.format("%.2f", centuries),
                            RELIABLE_CENTURIES);
                }
            }
        }
    }

    /**
     * Position of a body given by name ("Sun", "Moon", "Mercury", ...,
     * "Pluto", "LunarNode").
     *
     * @throws UnknownBodyException if the name is not supported
     */
    public EclipticPosition position(String name) {
        return position(CelestialBody.forName(name));
    }

    /** Position of {@code body}, computed once per context. */
    public EclipticPosition position(CelestialBody body) {
        return positions.computeIfAbsent(Objects.requireNonNull(body, "body"), this::computePosition);
    }

    /**
     * Rate of change of the longitude of a body, degrees per day. Negative
     * when the body is retrograde.
     *
     * @throws UnknownBodyException if the name is not supported
     */
    public double dailyMotion(String name) {
        return dailyMotion(CelestialBody.forName(name));
    }

    public double dailyMotion(CelestialBody body) {
        return motions.computeIfAbsent(Objects.requireNonNull(body, "body"), this::computeDailyMotion);
    }

    /** Unperturbed mean anomaly of {@code planet} at this epoch, radians. */
    public double meanAnomaly(Planet planet) {
        return meanAnomalies.computeIfAbsent(
                planet, p -> Math.toRadians(registry.elements(p).meanAnomaly(centuries)));
    }

    /**
     * Mean anomaly {@code dt} days before this epoch, radians. Used for the
     * light-time correction; not reduced.
     */
    public double meanAnomaly(Planet planet, double dt) {
        double m = meanAnomaly(planet);
        if (dt == 0.0) return m;
        return m - Math.toRadians(dt * registry.elements(planet).dailyMotion());
    }

    /** Unperturbed eccentricity of {@code planet} at this epoch. */
    public double eccentricity(Planet planet) {
        return eccentricities.computeIfAbsent(planet, p -> registry.elements(p).eccentricity(centuries));
    }

    boolean hasCachedEccentricity(Planet planet) {
        return eccentricities.containsKey(planet);
    }

    /** Position, parallax and speed of the Moon, computed together once. */
    public Moon.TruePosition moon() {
        Moon.TruePosition m = moon;
        if (m == null) {
            synchronized (this) {
                m = moon;
                if (m == null) {
                    m = Moon.truePosition(julianDay);
                    moon = m;
                }
            }
        }
        return m;
    }

    private EclipticPosition computePosition(CelestialBody body) {
        switch (body) {
            case SUN:
                double lon = sunLongitude;
                if (apparent) lon = AstroMath.reduceDeg(lon + deltaPsi - Sun.ABERRATION);
                return new EclipticPosition(lon, 0.0, sunDistance);
            case MOON:
                EclipticPosition p = moon().position();
                if (!apparent) return p;
                return new EclipticPosition(
                        AstroMath.reduceDeg(p.longitude() + deltaPsi), p.latitude(), p.distance());
            case LUNAR_NODE:
                return new EclipticPosition(Moon.lunarNode(julianDay, !trueNode), 0.0, 0.0);
            default:
                return planetPosition(body.planet());
        }
    }

    private EclipticPosition planetPosition(Planet planet) {
        OrbitalElements.Snapshot el = registry.elements(planet).at(centuries, eccentricity(planet));
        double earthLongitude = Math.toRadians(sunLongitude) + Math.PI;

        PlanetaryTransform.Heliocentric first = heliocentric(planet, el, earthLongitude, 0.0);
        double lightTime = first.rho() * PlanetaryTransform.LIGHT_TIME_PER_AU;
        PlanetaryTransform.Heliocentric retarded = heliocentric(planet, el, earthLongitude, lightTime);

        PlanetaryTransform.Direction dir =
                PlanetaryTransform.geocentric(
                        planet, retarded, earthLongitude, sunDistance, apparent, deltaPsi);
        return new EclipticPosition(dir.longitude(), dir.latitude(), first.rho());
    }

    private PlanetaryTransform.Heliocentric heliocentric(
            Planet planet, OrbitalElements.Snapshot el, double earthLongitude, double dt) {
        PerturbationInput in =
                new PerturbationInput(
                        centuries,
                        el.eccentricity(),
                        Math.toRadians(sunMeanAnomaly),
                        q -> meanAnomaly(q, dt));
        Perturbations corrections = planet.perturbationModel().compute(in);
        return PlanetaryTransform.heliocentric(
                el, meanAnomaly(planet, dt), sunDistance, earthLongitude, corrections);
    }

    private double computeDailyMotion(CelestialBody body) {
        if (body == CelestialBody.MOON) {
            return moon().dailyMotion();
        }
        double before = previous().position(body).longitude();
        double after = next().position(body).longitude();
        return AstroMath.longitudeDelta(before, after);
    }

    private synchronized EphemerisContext previous() {
        if (previous == null) {
            previous = new EphemerisContext(julianDay - 0.5, apparent, trueNode, registry);
        }
        return previous;
    }

    private synchronized EphemerisContext next() {
        if (next == null) {
            next = new EphemerisContext(julianDay + 0.5, apparent, trueNode, registry);
        }
        return next;
    }

    public double julianDay() {
        return julianDay;
    }

    /** Days since 1900 January 0.5. */
    public double daysSince1900() {
        return daysSince1900;
    }

    /** Julian centuries since 1900 January 0.5. */
    public double centuries() {
        return centuries;
    }

    public boolean isApparent() {
        return apparent;
    }

    public boolean isTrueNode() {
        return trueNode;
    }

    public OrbitalElementsRegistry registry() {
        return registry;
    }

    /** Mean anomaly of the Sun, degrees. */
    public double sunMeanAnomaly() {
        return sunMeanAnomaly;
    }

    /** Mean longitude of the Sun, degrees. */
    public double sunMeanLongitude() {
        return sunMeanLongitude;
    }

    /** True geometric longitude of the Sun, degrees. */
    public double sunLongitude() {
        return sunLongitude;
    }

    /** Earth-Sun distance, AU. */
    public double sunDistance() {
        return sunDistance;
    }

    /** Nutation in longitude, degrees. */
    public double deltaPsi() {
        return deltaPsi;
    }

    /** Nutation in obliquity, degrees. */
    public double deltaEps() {
        return deltaEps;
    }

    /** True obliquity of the ecliptic, degrees. */
    public double obliquity() {
        return obliquity;
    }

    @Override
    public String toString() {
        return "EphemerisContext[jd=" + julianDay + ", apparent=" + apparent + ", trueNode=" + trueNode + "]";
    }
}
