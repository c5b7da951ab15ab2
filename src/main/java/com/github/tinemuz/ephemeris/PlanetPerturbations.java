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
 * Periodic corrections to the planetary elements.
 *
 * <p>The series follow Duffett-Smith and Meeus (Astronomical Formulae for
 * Calculators). Coefficients are published constants. Mercury, Venus and Mars
 * are perturbed mainly by the Earth, Venus and Jupiter. The giant planets use
 * the long-period arguments of the Jupiter/Saturn/Uranus/Neptune system.</p>
 *
 * <p>Units of the returned {@link Perturbations} are documented on that record.
 * Mean-longitude and mean-anomaly corrections are returned in radians. The
 * series themselves are in degrees.</p>
 */
public final class PlanetPerturbations {

    private PlanetPerturbations() {}

    /** No corrections, for bodies without a published series (Pluto). */
    public static Perturbations none(PerturbationInput in) {
        return Perturbations.NONE;
    }

    /** Mercury: arguments are its own, Venus' and Jupiter's mean anomalies. */
    public static Perturbations mercury(PerturbationInput in) {
        double m = in.meanAnomaly(Planet.MERCURY);
        double ve = in.meanAnomaly(Planet.VENUS);
        double ju = in.meanAnomaly(Planet.JUPITER);

        double dl =
                2.04e-3 * cos(5 * ve - 2 * m + 0.21328)
                        + 1.03e-3 * cos(2 * ve - m - 2.8046)
                        + 9.1e-4 * cos(2 * ju - m - 0.64582)
                        + 7.8e-4 * cos(5 * ve - 3 * m + 0.17692);
        double dr =
                7.525e-6 * cos(2 * ju - m + 0.925251)
                        + 6.802e-6 * cos(5 * ve - 3 * m - 4.53642)
                        + 5.457e-6 * cos(2 * ve - 2 * m - 1.24246)
                        + 3.569e-6 * cos(5 * ve - m - 1.35699);
        return new Perturbations(dl, dr, 0, 0, 0, 0, 0);
    }

    /** Venus: arguments are time, the Sun's, its own and Jupiter's mean anomalies. */
    public static Perturbations venus(PerturbationInput in) {
        double t = in.t();
        double sm = in.sunMeanAnomaly();
        double m = in.meanAnomaly(Planet.VENUS);
        double ju = in.meanAnomaly(Planet.JUPITER);

        double dml = toRadians(7.7e-4 * sin(4.1406 + t * 2.6227));
        double dl =
                3.13e-3 * cos(2 * sm - 2 * m - 2.587)
                        + 1.98e-3 * cos(3 * sm - 3 * m + 0.044768)
                        + 1.36e-3 * cos(sm - m - 2.0788)
                        + 9.6e-4 * cos(3 * sm - 2 * m - 2.3721)
                        + 8.2e-4 * cos(ju - m - 3.6318);
        double dr =
                2.2501e-5 * cos(2 * sm - 2 * m - 1.01592)
                        + 1.9045e-5 * cos(3 * sm - 3 * m + 1.61577)
                        + 6.887e-6 * cos(ju - m - 2.06106)
                        + 5.172e-6 * cos(sm - m - 0.508065)
                        + 3.62e-6 * cos(5 * sm - 4 * m - 1.81877)
                        + 3.283e-6 * cos(4 * sm - 4 * m + 1.10851)
                        + 3.074e-6 * cos(2 * ju - 2 * m - 0.962846);
        return new Perturbations(dl, dr, dml, 0, dml, 0, 0);
    }

    /** Mars: arguments are the Sun's, Venus', its own and Jupiter's mean anomalies. */
    public static Perturbations mars(PerturbationInput in) {
        double sm = in.sunMeanAnomaly();
        double ve = in.meanAnomaly(Planet.VENUS);
        double m = in.meanAnomaly(Planet.MARS);
        double ju = in.meanAnomaly(Planet.JUPITER);

        double a = 3 * ju - 8 * m + 4 * sm;
        double dml = toRadians(-(1.133e-2 * sin(a) + 9.33e-3 * cos(a)));
        double dl =
                7.05e-3 * cos(ju - m - 0.85448)
                        + 6.07e-3 * cos(2 * ju - m - 3.2873)
                        + 4.45e-3 * cos(2 * ju - 2 * m - 3.3492)
                        + 3.88e-3 * cos(sm - 2 * m + 0.35771)
                        + 2.38e-3 * cos(sm - m + 0.61256)
                        + 2.04e-3 * cos(2 * sm - 3 * m + 2.7688)
                        + 1.77e-3 * cos(3 * m - ve - 1.0053)
                        + 1.36e-3 * cos(2 * sm - 4 * m + 2.6894)
                        + 1.04e-3 * cos(ju + 0.30749);
        double dr =
                5.3227e-5 * cos(ju - m + 0.717864)
                        + 5.0989e-5 * cos(2 * ju - 2 * m - 1.77997)
                        + 3.8278e-5 * cos(2 * ju - m - 1.71617)
                        + 1.5996e-5 * cos(sm - m - 0.969618)
                        + 1.4764e-5 * cos(2 * sm - 3 * m + 1.19768)
                        + 8.966e-6 * cos(ju - 2 * m + 0.761225)
                        + 7.914e-6 * cos(3 * ju - 2 * m - 2.43887)
                        + 7.004e-6 * cos(2 * ju - 3 * m - 1.79573)
                        + 6.62e-6 * cos(sm - 2 * m + 1.97575)
                        + 4.93e-6 * cos(3 * ju - 3 * m - 1.33069)
                        + 4.693e-6 * cos(3 * sm - 5 * m + 3.32665)
                        + 4.571e-6 * cos(2 * sm - 4 * m + 4.27086)
                        + 4.409e-6 * cos(3 * ju - m - 2.02158);
        return new Perturbations(dl, dr, dml, 0, dml, 0, 0);
    }

    /** Jupiter: arguments are time and the unperturbed eccentricity. */
    public static Perturbations jupiter(PerturbationInput in) {
        Aux x = Aux.at(in.t());
        double nu = x.nu;
        double z = x.q - x.p;
        double sq = sin(x.q), cq = cos(x.q), s2q = sin(2 * x.q), c2q = cos(2 * x.q);
        double sv = sin(x.v), cv = cos(x.v), s2v = sin(2 * x.v), sw = sin(x.w);
        double sz = sin(z), cz = cos(z), s2z = sin(2 * z), c2z = cos(2 * z);
        double s3z = sin(3 * z), c3z = cos(3 * z), s4z = sin(4 * z), c4z = cos(4 * z);
        double c5z = cos(5 * z);

        // mean longitude, degrees
        double a =
                (0.331364 - (0.010281 + 0.004692 * nu) * nu) * sv
                        + (0.003228 - (0.064436 - 0.002075 * nu) * nu) * cv
                        - (0.003083 + (0.000275 - 0.000489 * nu) * nu) * s2v
                        + 0.002472 * sw
                        + 0.013619 * sz
                        + 0.018472 * s2z
                        + 0.006717 * s3z
                        + 0.002775 * s4z
                        + 0.006417 * s2z * sq
                        + (0.007275 - 0.001253 * nu) * sz * sq
                        + 0.002439 * s3z * sq
                        - (0.035681 + 0.001208 * nu) * sz * cq
                        - 0.003767 * c2z * sq
                        - 0.033839 * cz * cq
                        - 0.004261 * s2z * cq;
        // perihelion, degrees
        double b =
                (0.007192 - 0.003147 * nu) * sv
                        - 0.004344 * sq
                        + (nu * (0.000197 * nu - 0.000675) - 0.020428) * cv
                        + 0.034036 * cz * sq
                        + (0.007269 + 0.000672 * nu) * sz * sq
                        + 0.005614 * c2z * sq
                        + 0.002964 * c3z * sq
                        + 0.037761 * sz * cq
                        + 0.006158 * s2z * cq
                        - 0.006603 * cz * cq
                        - 0.005356 * sz * c2q
                        + 0.002722 * s2z * c2q
                        + 0.004483 * cz * c2q
                        - 0.002642 * c2z * c2q
                        + 0.004403 * sz * s2q
                        - 0.002536 * s2z * s2q
                        + 0.005547 * cz * s2q
                        - 0.002689 * c2z * s2q;
        double ds =
                ((3606 + (130 - 43 * nu) * nu) * sv
                                + (1289 - 580 * nu) * cv
                                - 6764 * sz * sq
                                - 1110 * s2z * sq
                                - 224 * s3z * sq
                                - 204 * sq
                                + (1284 + 116 * nu) * cz * sq
                                + 188 * c2z * sq
                                + (1460 + 130 * nu) * sz * cq
                                + 224 * s2z * cq
                                - 817 * cq
                                + 6074 * cz * cq
                                + 992 * c2z * cq
                                + 508 * c3z * cq
                                + 230 * c4z * cq
                                + 108 * c5z * cq
                                - (956 + 73 * nu) * sz * s2q
                                + 448 * s2z * s2q
                                + 137 * s3z * s2q
                                + (-997 + 108 * nu) * cz * s2q
                                + 480 * c2z * s2q
                                + 148 * c3z * s2q
                                + (-956 + 99 * nu) * sz * c2q
                                + 490 * s2z * c2q
                                + 158 * s3z * c2q
                                + 179 * c2q
                                + (1024 + 75 * nu) * cz * c2q
                                - 437 * c2z * c2q
                                - 132 * c3z * c2q)
                        * 1e-7;
        double da =
                (-263 * cv
                                + 205 * cz
                                + 693 * c2z
                                + 312 * c3z
                                + 147 * c4z
                                + 299 * sz * sq
                                + 181 * c2z * sq
                                + 204 * s2z * cq
                                + 111 * s3z * cq
                                - 337 * cz * cq
                                - 111 * c2z * cq)
                        * 1e-6;
        return new Perturbations(
                0, 0, toRadians(a), ds, toRadians(a - b / in.eccentricity()), da, 0);
    }

    /** Saturn: arguments are time and the unperturbed eccentricity. */
    public static Perturbations saturn(PerturbationInput in) {
        Aux x = Aux.at(in.t());
        double nu = x.nu;
        double z = x.q - x.p;
        double sq = sin(x.q), cq = cos(x.q), s2q = sin(2 * x.q), c2q = cos(2 * x.q);
        double s3q = sin(3 * x.q), c3q = cos(3 * x.q);
        double sv = sin(x.v), cv = cos(x.v), s2v = sin(2 * x.v), c2v = cos(2 * x.v);
        double sw = sin(x.w);
        double sz = sin(z), cz = cos(z), s2z = sin(2 * z), c2z = cos(2 * z);
        double s3z = sin(3 * z), c3z = cos(3 * z), s4z = sin(4 * z), c4z = cos(4 * z);
        double s5z = sin(5 * z), c5z = cos(5 * z);

        double a =
                (-0.814181 + (0.01815 + 0.016714 * nu) * nu) * sv
                        + (-0.010497 + (0.160906 - 0.0041 * nu) * nu) * cv
                        + 0.007581 * s2v
                        - 0.007986 * sw
                        - 0.148811 * sz
                        - 0.040786 * s2z
                        - 0.015208 * s3z
                        - 0.006339 * s4z
                        - 0.006244 * sq
                        + (0.008931 + 0.002728 * nu) * sz * sq
                        - 0.0165 * s2z * sq
                        - 0.005775 * s3z * sq
                        + (0.081344 + 0.003206 * nu) * cz * sq
                        + 0.015019 * c2z * sq
                        + (0.085581 + 0.002494 * nu) * sz * cq
                        + (0.025328 - 0.003117 * nu) * cz * cq
                        + 0.014394 * c2z * cq
                        + 0.006319 * c3z * cq
                        + 0.006369 * sz * s2q
                        + 0.009156 * s2z * s2q
                        + 0.007525 * s3z * s2q
                        - 0.005236 * cz * c2q
                        - 0.007736 * c2z * c2q
                        - 0.007528 * c3z * c2q;
        double b =
                (0.077108 + (0.007186 - 0.001533 * nu) * nu) * sv
                        + (0.045803 - (0.014766 + 0.000536 * nu) * nu) * cv
                        - 0.007075 * sz
                        - 0.075825 * sz * sq
                        - 0.024839 * s2z * sq
                        - 0.008631 * s3z * sq
                        - 0.072586 * cq
                        - 0.150383 * cz * cq
                        + 0.026897 * c2z * cq
                        + 0.010053 * c3z * cq
                        - (0.013597 + 0.001719 * nu) * sz * s2q
                        + (-0.007742 + 0.001517 * nu) * cz * s2q
                        + (0.013586 - 0.001375 * nu) * c2z * s2q
                        + (-0.013667 + 0.001239 * nu) * sz * c2q
                        + 0.011981 * s2z * c2q
                        + (0.014861 + 0.001136 * nu) * cz * c2q
                        - (0.013064 + 0.001628 * nu) * c2z * c2q;
        double ds =
                ((-7927 + (2548 + 91 * nu) * nu) * sv
                                + (13381 + (1226 - 253 * nu) * nu) * cv
                                + (248 - 121 * nu) * s2v
                                - (305 + 91 * nu) * c2v
                                + 412 * s2z
                                + 12415 * sq
                                + (390 - 617 * nu) * sz * sq
                                + (165 - 204 * nu) * s2z * sq
                                + 26599 * cz * sq
                                - 4687 * c2z * sq
                                - 1870 * c3z * sq
                                - 821 * c4z * sq
                                - 377 * c5z * sq
                                + (163 - 611 * nu) * cq
                                - 12696 * sz * cq
                                - 4200 * s2z * cq
                                - 1503 * s3z * cq
                                - 619 * s4z * cq
                                - 268 * s5z * cq
                                - (282 + 1306 * nu) * cz * cq
                                + (-86 + 230 * nu) * c2z * cq
                                + 461 * sz * s2q
                                - 350 * s2q
                                + (2211 - 286 * nu) * cz * s2q
                                - 2208 * c2z * s2q
                                - 568 * c3z * s2q
                                - 346 * c4z * s2q
                                - (2780 + 222 * nu) * sz * c2q
                                + (2022 + 263 * nu) * s2z * c2q
                                + 248 * s3z * c2q
                                + 242 * s4z * c2q
                                + 467 * c2q
                                - 490 * c2z * c2q)
                        * 1e-7;
        double da =
                (572 * sv
                                - 1590 * s2z * cq
                                + 2933 * cv
                                - 647 * s3z * cq
                                + 33629 * cz
                                - 344 * s4z * cq
                                - 3081 * c2z
                                + 2885 * cz * cq
                                - 1423 * c3z
                                + (2172 + 102 * nu) * c2z * cq
                                - 671 * c4z
                                + 296 * c3z * cq
                                - 320 * c5z
                                - 267 * s2z * s2q
                                + 1098 * sq
                                - 778 * cz * s2q
                                - 2812 * sz * sq
                                + 495 * c2z * s2q
                                + 688 * s2z * sq
                                + 250 * c3z * s2q
                                - 393 * s3z * sq
                                - 856 * sz * c2q
                                - 228 * s4z * sq
                                + 441 * s2z * c2q
                                + 2138 * cz * sq
                                + 296 * c2z * c2q
                                - 999 * c2z * sq
                                + 211 * c3z * c2q
                                - 642 * c3z * sq
                                - 427 * sz * s3q
                                - 325 * c4z * sq
                                + 398 * s3z * s3q
                                - 890 * cq
                                + 344 * cz * c3q
                                + 2206 * sz * cq
                                - 427 * c3z * c3q)
                        * 1e-6;
        double hl =
                0.000747 * cz * sq
                        + 0.001069 * cz * cq
                        + 0.002108 * s2z * s2q
                        + 0.001261 * c2z * s2q
                        + 0.001236 * s2z * c2q
                        - 0.002075 * c2z * c2q;
        return new Perturbations(
                0,
                0,
                toRadians(a),
                ds,
                toRadians(a - b / in.eccentricity()),
                da,
                toRadians(hl));
    }

    /** Uranus: arguments are time and the unperturbed eccentricity. */
    public static Perturbations uranus(PerturbationInput in) {
        Aux x = Aux.at(in.t());
        double nu = x.nu;
        double g = AstroMath.reduceRad(1.46205 + 3.81337 * in.t());
        double h = 2 * g - x.s;
        double zeta = x.s - x.p;
        double eta = x.s - x.q;
        double theta = g - x.s;
        double sh = sin(h), ch = cos(h), s2h = sin(2 * h), c2h = cos(2 * h);
        double ss = sin(x.s), cs = cos(x.s);
        double se = sin(eta), ce = cos(eta);

        double a =
                (0.864319 - 0.001583 * nu) * sh
                        + (0.082222 - 0.006833 * nu) * ch
                        + 0.036017 * s2h
                        - 0.003019 * c2h
                        + 0.008122 * sin(x.w);
        double b =
                0.120303 * sin(zeta)
                        + 0.006197 * sin(2 * zeta)
                        + (0.019472 - 0.000947 * nu) * se;
        double ds = ((-3349 + 163 * nu) * sh + 20981 * ch + 1311 * c2h) * 1e-7;
        double da = -0.003825 * ch;
        double dl =
                (0.010122 - 0.000988 * nu) * sin(x.s + eta)
                        + (-0.038581 + (0.002031 - 0.00191 * nu) * nu) * cos(x.s + eta)
                        + (0.034964 - (0.001038 - 0.000868 * nu) * nu) * cos(2 * x.s + eta)
                        + 0.005594 * sin(x.s + 3 * theta)
                        - 0.014808 * sin(zeta)
                        - 0.005794 * se
                        + 0.002347 * ce
                        + 0.009872 * sin(theta)
                        + 0.008803 * sin(2 * theta)
                        - 0.004308 * sin(3 * theta);
        double hl =
                (0.000458 * se - 0.000642 * ce - 0.000517 * cos(4 * theta)) * ss
                        - (0.000347 * se + 0.000853 * ce + 0.000517 * sin(4 * eta)) * cs
                        + 0.000403 * (cos(2 * theta) * sin(2 * x.s) + sin(2 * theta) * cos(2 * x.s));
        double dr =
                (-25948
                                + 4985 * cos(zeta)
                                - 1230 * cs
                                + 3354 * ce
                                + 904 * cos(2 * theta)
                                + 894 * (cos(theta) - cos(3 * theta))
                                + (5795 * cs - 1165 * ss + 1388 * cos(2 * x.s)) * se
                                + (1351 * cs + 5702 * ss + 1388 * sin(2 * x.s)) * ce)
                        * 1e-6;
        return new Perturbations(
                dl,
                dr,
                toRadians(a),
                ds,
                toRadians(a - b / in.eccentricity()),
                da,
                toRadians(hl));
    }

    /** Neptune: arguments are time and the unperturbed eccentricity. */
    public static Perturbations neptune(PerturbationInput in) {
        Aux x = Aux.at(in.t());
        double nu = x.nu;
        double g = AstroMath.reduceRad(1.46205 + 3.81337 * in.t());
        double h = 2 * g - x.s;
        double zeta = g - x.p;
        double eta = g - x.q;
        double theta = g - x.s;
        double sh = sin(h), ch = cos(h), s2h = sin(2 * h), c2h = cos(2 * h);
        double sg = sin(g), cg = cos(g);

        double a = (-0.589833 + 0.001089 * nu) * sh + (-0.056094 + 0.004658 * nu) * ch - 0.024286 * s2h;
        double b =
                0.024039 * sin(zeta)
                        - 0.025303 * cos(zeta)
                        + 0.006206 * sin(2 * zeta)
                        - 0.005992 * cos(2 * zeta);
        double ds = (4389 * sh + 4262 * ch + 1129 * s2h + 1089 * c2h) * 1e-7;
        double da = (8189 * ch - 817 * sh + 781 * c2h) * 1e-6;
        double dl =
                -0.009556 * sin(zeta)
                        - 0.005178 * sin(eta)
                        + 0.002572 * sin(2 * theta)
                        - 0.002972 * cos(2 * theta) * sg
                        - 0.002833 * sin(2 * theta) * cg;
        double hl = 0.000336 * cos(2 * theta) * sg + 0.000364 * sin(2 * theta) * cg;
        double dr =
                (-40596
                                + 4992 * cos(zeta)
                                + 2744 * cos(eta)
                                + 2044 * cos(theta)
                                + 1051 * cos(2 * theta))
                        * 1e-6;
        return new Perturbations(
                dl,
                dr,
                toRadians(a),
                ds,
                toRadians(a - b / in.eccentricity()),
                da,
                toRadians(hl));
    }

    /**
     * Long-period arguments shared by the giant planets, radians except
     * {@code nu}, which is time in units of five centuries offset by 0.1.
     */
    private record Aux(double nu, double p, double q, double s, double v, double w) {
        static Aux at(double t) {
            double p = AstroMath.reduceRad(4.14473 + 5.29691e1 * t);
            double q = AstroMath.reduceRad(4.641118 + 2.132991e1 * t);
            double s = AstroMath.reduceRad(4.250177 + 7.478172 * t);
            return new Aux(t / 5 + 0.1, p, q, s, 5 * q - 2 * p, 2 * p - 6 * q + 3 * s);
        }
    }
}
