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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.DoubleUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the root of a function with the Pegasus method, a false position
 * variant that scales down the retained end point when it stagnates.
 */
public final class Pegasus {
    private static final Logger log = LoggerFactory.getLogger(Pegasus.class);
    private static final int MAX_ITERATIONS = 30;

    private Pegasus() {
        // utility class
    }

    /**
     * Finds the root of a function within the given boundaries.
     *
     * @param lower    lower boundary
     * @param upper    upper boundary
     * @param accuracy required width of the final bracket
     * @param f        function to find the root of
     * @return the bracket end with the smaller absolute function value
     * @throws ArithmeticException if {@code f} has the same sign at both
     *     boundaries, or if the bracket does not converge within 30 iterations
     */
    public static double calculate(double lower, double upper, double accuracy, DoubleUnaryOperator f) {
        checkNotNull(f, "f");
        double x1 = lower;
        double x2 = upper;

        double f1 = f.applyAsDouble(x1);
        double f2 = f.applyAsDouble(x2);

        if (f1 * f2 >= 0.0) {
            throw new ArithmeticException("No root within the given boundaries");
        }

        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double x3 = x2 - f2 / ((f2 - f1) / (x2 - x1));
            double f3 = f.applyAsDouble(x3);

            if (f3 * f2 <= 0.0) {
                x1 = x2;
                f1 = f2;
            } else {
                f1 = f1 * f2 / (f2 + f3);
            }
            x2 = x3;
            f2 = f3;

            if (Math.abs(x2 - x1) <= accuracy) {
                return Math.abs(f1) < Math.abs(f2) ? x1 : x2;
            }
        }

        log.error("Root search in [{}, {}] did not converge to {} after {} iterations",
                lower, upper, accuracy, MAX_ITERATIONS);
        throw new ArithmeticException("Maximum number of iterations exceeded");
    }
}
