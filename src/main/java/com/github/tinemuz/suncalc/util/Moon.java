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

package com.github.tinemuz.suncalc.util;

import static com.github.tinemuz.suncalc.util.ExtendedMath.ARCS;
import static com.github.tinemuz.suncalc.util.ExtendedMath.PI2;
import static com.github.tinemuz.suncalc.util.ExtendedMath.equatorialToEcliptical;
import static com.github.tinemuz.suncalc.util.ExtendedMath.equatorialToHorizontal;
import static com.github.tinemuz.suncalc.util.ExtendedMath.frac;
import static java.lang.Math.asin;
import static java.lang.Math.cos;
import static java.lang.Math.sin;

/**
 * Low precision position of the moon, from the main periodic terms of its
 * longitude, latitude and distance.
 */
public final class Moon {

    private static final double MOON_MEAN_RADIUS = 1737.1;

    private Moon() {
        // utility class
    }

    /**
     * Ecliptic position of the moon.
     *
     * @param date time
     * @return polar vector of ecliptic longitude, latitude and distance in km
     */
    public static Vector positionEquatorial(JulianDate date) {
        final double T = date.getJulianCentury();
        final double L0 =       frac(0.606433 + 1336.855225 * T);
        final double l  = PI2 * frac(0.374897 + 1325.552410 * T);
        final double ls = PI2 * frac(0.993133 +   99.997361 * T);
        final double D  = PI2 * frac(0.827361 + 1236.853086 * T);
        final double F  = PI2 * frac(0.259086 + 1342.227825 * T);
        final double D2 = 2.0 * D;
        final double l2 = 2.0 * l;
        final double F2 = 2.0 * F;

        final double dL = 22640.0 * sin(l)
                        -  4586.0 * sin(l - D2)
                        +  2370.0 * sin(D2)
                        +   769.0 * sin(l2)
                        -   668.0 * sin(ls)
                        -   412.0 * sin(F2)
                        -   212.0 * sin(l2 - D2)
                        -   206.0 * sin(l + ls - D2)
                        +   192.0 * sin(l + D2)
                        -   165.0 * sin(ls - D2)
                        -   125.0 * sin(D)
                        -   110.0 * sin(l + ls)
                        +   148.0 * sin(l - ls)
                        -    55.0 * sin(F2 - D2);

        final double S = F + (dL + 412.0 * sin(F2) + 541.0 * sin(ls)) / ARCS;
        final double h = F - D2;
        final double N = -526.0 * sin(h)
                       +   44.0 * sin(l + h)
                       -   31.0 * sin(-l + h)
                       -   23.0 * sin(ls + h)
                       +   11.0 * sin(-ls + h)
                       -   25.0 * sin(-l2 + F)
                       +   21.0 * sin(-l + F);

        final double lMoon = PI2 * frac(L0 + dL / 1296.0e3);
        final double bMoon = (18520.0 * sin(S) + N) / ARCS;

        final double dt = 385000.5584
                        -  20905.3550 * cos(l)
                        -   3699.1109 * cos(D2 - l)
                        -   2955.9676 * cos(D2)
                        -    569.9251 * cos(l2);

        return Vector.ofPolar(lMoon, bMoon, dt);
    }

    /**
     * Geocentric equatorial position of the moon.
     */
    public static Vector position(JulianDate date) {
        Matrix rotateMatrix = equatorialToEcliptical(date).transpose();
        return rotateMatrix.multiply(positionEquatorial(date));
    }

    /**
     * Horizontal position of the moon as seen from the given place.
     *
     * @param date time
     * @param lat  latitude, radians
     * @param lng  longitude, radians
     */
    public static Vector positionHorizontal(JulianDate date, double lat, double lng) {
        Vector mc = position(date);
        double h = date.getGreenwichMeanSiderealTime() + lng - mc.getPhi();
        return equatorialToHorizontal(h, mc.getTheta(), mc.getR(), lat);
    }

    /**
     * Angular radius of the moon disc.
     *
     * @param distance distance of the moon, km
     * @return angular radius, radians
     */
    public static double angularRadius(double distance) {
        return asin(MOON_MEAN_RADIUS / distance);
    }
}
