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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;

/**
 * Immutable 3x3 matrix, used for coordinate frame rotations.
 */
public final class Matrix {

    private final double[] mx; // row-major

    private Matrix() {
        mx = new double[9];
    }

    /**
     * Creates a matrix from nine values in row-major order.
     *
     * @throws IllegalArgumentException unless exactly nine values are given
     */
    public Matrix(double... values) {
        checkNotNull(values, "values");
        checkArgument(values.length == 9, "requires 9 values, got %s", values.length);
        mx = values.clone();
    }

    public static Matrix identity() {
        Matrix result = new Matrix();
        result.mx[0] = 1.0;
        result.mx[4] = 1.0;
        result.mx[8] = 1.0;
        return result;
    }

    /**
     * Rotation about the X axis.
     *
     * @param angle rotation angle, radians
     */
    public static Matrix rotateX(double angle) {
        double s = Math.sin(angle);
        double c = Math.cos(angle);
        return new Matrix(
                1.0, 0.0, 0.0,
                0.0, c, s,
                0.0, -s, c);
    }

    /**
     * Rotation about the Y axis.
     *
     * @param angle rotation angle, radians
     */
    public static Matrix rotateY(double angle) {
        double s = Math.sin(angle);
        double c = Math.cos(angle);
        return new Matrix(
                c, 0.0, -s,
                0.0, 1.0, 0.0,
                s, 0.0, c);
    }

    /**
     * Rotation about the Z axis.
     *
     * @param angle rotation angle, radians
     */
    public static Matrix rotateZ(double angle) {
        double s = Math.sin(angle);
        double c = Math.cos(angle);
        return new Matrix(
                c, s, 0.0,
                -s, c, 0.0,
                0.0, 0.0, 1.0);
    }

    public Matrix transpose() {
        Matrix result = new Matrix();
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                result.mx[i * 3 + j] = mx[j * 3 + i];
            }
        }
        return result;
    }

    public Matrix negate() {
        Matrix result = new Matrix();
        for (int i = 0; i < 9; i++) {
            result.mx[i] = -mx[i];
        }
        return result;
    }

    public Matrix add(Matrix right) {
        Matrix result = new Matrix();
        for (int i = 0; i < 9; i++) {
            result.mx[i] = mx[i] + right.mx[i];
        }
        return result;
    }

    public Matrix subtract(Matrix right) {
        Matrix result = new Matrix();
        for (int i = 0; i < 9; i++) {
            result.mx[i] = mx[i] - right.mx[i];
        }
        return result;
    }

    public Matrix multiply(Matrix right) {
        Matrix result = new Matrix();
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                double scalp = 0.0;
                for (int k = 0; k < 3; k++) {
                    scalp += mx[i * 3 + k] * right.mx[k * 3 + j];
                }
                result.mx[i * 3 + j] = scalp;
            }
        }
        return result;
    }

    public Matrix multiply(double scalar) {
        Matrix result = new Matrix();
        for (int i = 0; i < 9; i++) {
            result.mx[i] = mx[i] * scalar;
        }
        return result;
    }

    public Vector multiply(Vector right) {
        double[] vec = right.toArray();
        double[] result = new double[3];
        for (int i = 0; i < 3; i++) {
            double scalp = 0.0;
            for (int j = 0; j < 3; j++) {
                scalp += mx[i * 3 + j] * vec[j];
            }
            result[i] = scalp;
        }
        return Vector.of(result);
    }

    /**
     * Returns a single element.
     *
     * @param row    row index, 0..2
     * @param column column index, 0..2
     * @throws IndexOutOfBoundsException if an index is out of range
     */
    public double get(int row, int column) {
        checkElementIndex(row, 3, "row");
        checkElementIndex(column, 3, "column");
        return mx[row * 3 + column];
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix)) return false;
        return Arrays.equals(mx, ((Matrix) obj).mx);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(mx);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < 9; i++) {
            if (i % 3 == 0) {
                sb.append('[');
            }
            sb.append(mx[i]);
            if (i % 3 == 2) {
                sb.append(']');
            } else {
                sb.append(", ");
            }
        }
        return sb.append(']').toString();
    }
}
