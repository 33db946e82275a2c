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
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;

/**
 * Immutable three dimensional vector.
 *
 * <p>A vector carries both its cartesian coordinates (x, y, z) and its polar
 * coordinates (φ, θ, r). φ is the azimuthal angle in radians, normalized to
 * [0, 2π). θ is the elevation above the x-y plane in radians, in [-π/2, π/2].
 * r is the length.</p>
 *
 * <p>Vectors created by {@link #ofPolar(double, double, double)} keep the polar
 * values they were created with, so round trips through the cartesian form do
 * not lose precision.</p>
 */
public final class Vector {

    private final double x;
    private final double y;
    private final double z;
    private final double phi;
    private final double theta;
    private final double r;

    /**
     * Creates a vector from its cartesian coordinates.
     *
     * @param x X coordinate
     * @param y Y coordinate
     * @param z Z coordinate
     */
    public Vector(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;

        double rxy2 = x * x + y * y;
        double p = (ExtendedMath.isZero(x) && ExtendedMath.isZero(y)) ? 0.0 : Math.atan2(y, x);
        if (p < 0.0) {
            p += ExtendedMath.PI2;
        }
        this.phi = p;
        this.theta = (ExtendedMath.isZero(z) && ExtendedMath.isZero(rxy2))
                ? 0.0
                : Math.atan2(z, Math.sqrt(rxy2));
        this.r = Math.sqrt(rxy2 + z * z);
    }

    private Vector(double x, double y, double z, double phi, double theta, double r) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.phi = phi;
        this.theta = theta;
        this.r = r;
    }

    /**
     * Creates a vector from an array of exactly three cartesian coordinates.
     *
     * @throws IllegalArgumentException if the array does not have three elements
     */
    public static Vector of(double[] d) {
        checkNotNull(d, "coordinates");
        checkArgument(d.length == 3, "invalid vector length %s, expected 3", d.length);
        return new Vector(d[0], d[1], d[2]);
    }

    /**
     * Creates a unit vector from polar coordinates.
     */
    public static Vector ofPolar(double phi, double theta) {
        return ofPolar(phi, theta, 1.0);
    }

    /**
     * Creates a vector from polar coordinates.
     *
     * @param phi   azimuthal angle, radians
     * @param theta elevation angle, radians
     * @param r     length
     */
    public static Vector ofPolar(double phi, double theta, double r) {
        double cosTheta = Math.cos(theta);
        return new Vector(
                r * Math.cos(phi) * cosTheta,
                r * Math.sin(phi) * cosTheta,
                r * Math.sin(theta),
                phi, theta, r);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZ() {
        return z;
    }

    public double getPhi() {
        return phi;
    }

    public double getTheta() {
        return theta;
    }

    public double getR() {
        return r;
    }

    public Vector add(Vector vec) {
        return new Vector(x + vec.x, y + vec.y, z + vec.z);
    }

    public Vector subtract(Vector vec) {
        return new Vector(x - vec.x, y - vec.y, z - vec.z);
    }

    /**
     * Element-wise product.
     */
    public Vector multiply(Vector vec) {
        return new Vector(x * vec.x, y * vec.y, z * vec.z);
    }

    public Vector multiply(double scalar) {
        return new Vector(x * scalar, y * scalar, z * scalar);
    }

    public Vector negate() {
        return new Vector(-x, -y, -z);
    }

    public Vector cross(Vector vec) {
        return new Vector(
                y * vec.z - z * vec.y,
                z * vec.x - x * vec.z,
                x * vec.y - y * vec.x);
    }

    public double dot(Vector vec) {
        return x * vec.x + y * vec.y + z * vec.z;
    }

    public double norm() {
        return Math.sqrt(dot(this));
    }

    /**
     * Returns the cartesian coordinates as a new array.
     */
    public double[] toArray() {
        return new double[] {x, y, z};
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Vector)) return false;
        Vector other = (Vector) obj;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(z, other.z) == 0;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    @Override
    public String toString() {
        return "(x=" + x + ", y=" + y + ", z=" + z + ")";
    }
}
