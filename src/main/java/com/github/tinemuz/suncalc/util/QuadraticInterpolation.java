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

/**
 * Fits a parabola through three equally spaced samples at x = -1, 0 and +1
 * and reports its extremum and roots.
 */
public final class QuadraticInterpolation {

    private final double xe;
    private final double ye;
    private final double root1;
    private final double root2;
    private final int nRoot;
    private final boolean maximum;

    /**
     * @param yMinus Y at x == -1
     * @param y0     Y at x == 0
     * @param yPlus  Y at x == +1
     */
    public QuadraticInterpolation(double yMinus, double y0, double yPlus) {
        double a = 0.5 * (yPlus + yMinus) - y0;
        double b = 0.5 * (yPlus - yMinus);
        double c = y0;

        xe = -b / (2.0 * a);
        ye = (a * xe + b) * xe + c;
        maximum = a < 0.0;
        double dis = b * b - 4.0 * a * c;

        int rootCount = 0;

        if (dis >= 0.0) {
            double dx = 0.5 * Math.sqrt(dis) / Math.abs(a);
            double r1 = xe - dx;
            double r2 = xe + dx;

            if (Math.abs(r1) <= 1.0) {
                rootCount++;
            }
            if (Math.abs(r2) <= 1.0) {
                rootCount++;
            }

            // first root may lie left of the interval while the second does not
            root1 = r1 < -1.0 ? r2 : r1;
            root2 = r2;
        } else {
            root1 = Double.NaN;
            root2 = Double.NaN;
        }

        nRoot = rootCount;
    }

    /**
     * X of the extremum. May lie outside [-1, 1].
     */
    public double getXe() {
        return xe;
    }

    /**
     * Y of the extremum.
     */
    public double getYe() {
        return ye;
    }

    public double getRoot1() {
        return root1;
    }

    public double getRoot2() {
        return root2;
    }

    /**
     * Number of roots found within [-1, 1].
     */
    public int getNumberOfRoots() {
        return nRoot;
    }

    /**
     * {@code true} if the extremum is a maximum.
     */
    public boolean isMaximum() {
        return maximum;
    }
}
