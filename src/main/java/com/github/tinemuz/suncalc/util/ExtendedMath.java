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

import static java.lang.Math.PI;
import static java.lang.Math.abs;
import static java.lang.Math.acos;
import static java.lang.Math.asin;
import static java.lang.Math.tan;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

import java.util.function.DoubleUnaryOperator;

/**
 * Numeric helpers shared by the sun and moon calculations.
 *
 * <p>Angles are in radians unless noted otherwise.</p>
 */
public final class ExtendedMath {

    /** 2π. */
    public static final double PI2 = PI * 2.0;

    /** Arc-seconds per radian. */
    public static final double ARCS = toDegrees(3600.0);

    /** Mean earth radius, km. */
    public static final double EARTH_MEAN_RADIUS = 6371.0;

    /** Apparent refraction at the horizon, radians. */
    public static final double REFRACTION_AT_HORIZON = PI / (tan(toRadians(7.31 / 4.4)) * 10800.0);

    private ExtendedMath() {
        // utility class
    }

    /**
     * Returns the fractional part of a value. The sign of the input is kept,
     * so {@code frac(-1.25) == -0.25}.
     */
    public static double frac(double a) {
        return a % 1.0;
    }

    /**
     * Tests for an exact zero, positive or negative. This is not a tolerance
     * check: {@code 1e-300} is not zero, and neither is NaN.
     */
    public static boolean isZero(double d) {
        return d == 0.0;
    }

    /**
     * Converts equatorial coordinates to horizontal coordinates.
     *
     * @param tau  hour angle, radians
     * @param dec  declination, radians
     * @param dist distance of the object
     * @param lat  latitude of the observer, radians
     * @return horizontal coordinates as a vector
     */
    public static Vector equatorialToHorizontal(double tau, double dec, double dist, double lat) {
        return Matrix.rotateY(PI / 2.0 - lat).multiply(Vector.ofPolar(tau, dec, dist));
    }

    /**
     * Creates a rotation matrix for converting equatorial to ecliptical
     * coordinates at the given time, using the mean obliquity of the ecliptic.
     */
    public static Matrix equatorialToEcliptical(JulianDate t) {
        double jc = t.getJulianCentury();
        double eps = toRadians(23.43929111 - (46.8150 + (0.00059 - 0.001813 * jc) * jc) * jc / 3600.0);
        return Matrix.rotateX(eps);
    }

    /**
     * Geocentric parallax corrected by the dip of the horizon for the given height.
     *
     * @param height   height of the observer above sea level, meters
     * @param distance distance of the object, km
     * @return parallax, radians
     */
    public static double parallax(double height, double distance) {
        return asin(EARTH_MEAN_RADIUS / distance)
                - acos(EARTH_MEAN_RADIUS / (EARTH_MEAN_RADIUS + (height / 1000.0)));
    }

    /**
     * Atmospheric refraction for a given apparent altitude (Bennett).
     *
     * @param ha apparent altitude, radians
     * @return refraction, radians; 0 below the horizon
     */
    public static double apparentRefraction(double ha) {
        if (ha < 0.0) {
            return 0.0;
        }

        if (isZero(ha)) {
            return REFRACTION_AT_HORIZON;
        }

        double hd = toDegrees(ha);
        return PI / (tan(toRadians(hd + (7.31 / (hd + 4.4)))) * 10800.0);
    }

    /**
     * Atmospheric refraction for a given true altitude (Saemundsson).
     *
     * @param h true altitude, radians
     * @return refraction, radians; 0 below the horizon
     */
    public static double refraction(double h) {
        if (h < 0.0) {
            return 0.0;
        }

        return 0.000296706 / tan(h + 0.00312537 / (h + 0.0890118));
    }

    /**
     * Converts degrees, minutes and seconds to decimal degrees. The sign is
     * taken from {@code d} alone.
     */
    public static double dms(double d, double m, double s) {
        double sig = d < 0 ? -1.0 : 1.0;
        return sig * ((abs(s) / 60.0 + abs(m)) / 60.0 + abs(d));
    }

    /**
     * Locates the true maximum near an estimated one.
     *
     * @param time  estimated time of the maximum
     * @param frame half width of the interval to search
     * @param depth number of bisection steps
     * @param f     function to maximize
     * @return refined time of the maximum
     */
    public static double readjustMax(double time, double frame, int depth, DoubleUnaryOperator f) {
        return readjustExtremum(time, frame, depth, f, true);
    }

    /**
     * Locates the true minimum near an estimated one.
     *
     * @see #readjustMax(double, double, int, DoubleUnaryOperator)
     */
    public static double readjustMin(double time, double frame, int depth, DoubleUnaryOperator f) {
        return readjustExtremum(time, frame, depth, f, false);
    }

    private static double readjustExtremum(
            double time, double frame, int depth, DoubleUnaryOperator f, boolean max) {
        double left = time - frame;
        double right = time + frame;
        return readjustInterval(left, right, f.applyAsDouble(left), f.applyAsDouble(right), depth, f, max);
    }

    private static double readjustInterval(
            double left, double right, double yl, double yr, int depth,
            DoubleUnaryOperator f, boolean max) {
        boolean towardsRight = max ? yl < yr : yr < yl;
        if (depth <= 0) {
            return towardsRight ? right : left;
        }

        double middle = (left + right) / 2.0;
        double ym = f.applyAsDouble(middle);
        if (towardsRight) {
            return readjustInterval(middle, right, ym, yr, depth - 1, f, max);
        }
        return readjustInterval(left, middle, yl, ym, depth - 1, f, max);
    }
}
