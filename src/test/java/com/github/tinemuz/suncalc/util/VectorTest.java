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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VectorTest {

    private static final double ERROR = 1.0e-11;
    private static final double PI_HALF = Math.PI / 2.0;

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Cartesian constructor keeps coordinates")
        void cartesian() {
            Vector v = new Vector(20.0, 10.0, 5.0);
            assertEquals(20.0, v.getX(), ERROR);
            assertEquals(10.0, v.getY(), ERROR);
            assertEquals(5.0, v.getZ(), ERROR);
        }

        @Test
        @DisplayName("Array factory requires three elements")
        void arrayLength() {
            Vector v = Vector.of(new double[] {20.0, 10.0, 5.0});
            assertEquals(new Vector(20.0, 10.0, 5.0), v);

            assertThrows(IllegalArgumentException.class, () -> Vector.of(new double[] {1.0, 2.0}));
            assertThrows(IllegalArgumentException.class, () -> Vector.of(new double[] {1.0, 2.0, 3.0, 4.0}));
        }

        @Test
        @DisplayName("Polar factory pins polar values")
        void polar() {
            Vector v = Vector.ofPolar(0.5, 0.25, 50.0);
            assertEquals(0.5, v.getPhi(), ERROR);
            assertEquals(0.25, v.getTheta(), ERROR);
            assertEquals(50.0, v.getR(), ERROR);

            Vector unit = Vector.ofPolar(0.5, 0.25);
            assertEquals(1.0, unit.getR(), ERROR);
            assertEquals(1.0, unit.norm(), ERROR);
        }
    }

    @Nested
    @DisplayName("Polar coordinates")
    class PolarTests {

        @Test
        @DisplayName("Axis vectors")
        void axes() {
            assertPolar(new Vector(1.0, 0.0, 0.0), 0.0, 0.0, 1.0);
            assertPolar(new Vector(0.0, 1.0, 0.0), PI_HALF, 0.0, 1.0);
            assertPolar(new Vector(0.0, 0.0, 1.0), 0.0, PI_HALF, 1.0);
            assertPolar(new Vector(-1.0, 0.0, 0.0), Math.PI, 0.0, 1.0);
            assertPolar(new Vector(0.0, -1.0, 0.0), Math.PI + PI_HALF, 0.0, 1.0);
            assertPolar(new Vector(0.0, 0.0, -1.0), 0.0, -PI_HALF, 1.0);
        }

        @Test
        @DisplayName("Null vector has all polar values zero")
        void nullVector() {
            assertPolar(new Vector(0.0, 0.0, 0.0), 0.0, 0.0, 0.0);
            assertPolar(new Vector(-0.0, -0.0, -0.0), 0.0, 0.0, 0.0);
        }

        @Test
        @DisplayName("Azimuth is normalized to [0, 2π)")
        void azimuthRange() {
            Vector v = new Vector(1.0, -1.0, 0.0);
            assertEquals(2.0 * Math.PI - Math.PI / 4.0, v.getPhi(), ERROR);
            assertTrue(v.getPhi() >= 0.0 && v.getPhi() < ExtendedMath.PI2);
        }

        @Test
        @DisplayName("Cartesian values of a polar vector")
        void polarToCartesian() {
            Vector v = Vector.ofPolar(PI_HALF, 0.0, 2.0);
            assertEquals(0.0, v.getX(), ERROR);
            assertEquals(2.0, v.getY(), ERROR);
            assertEquals(0.0, v.getZ(), ERROR);

            Vector w = Vector.ofPolar(Math.PI / 4.0, Math.PI / 4.0, Math.sqrt(2.0));
            assertEquals(Math.sqrt(0.5), w.getX(), ERROR);
            assertEquals(Math.sqrt(0.5), w.getY(), ERROR);
            assertEquals(1.0, w.getZ(), ERROR);
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class ArithmeticTests {
        private final Vector a = new Vector(1.0, 2.0, 3.0);
        private final Vector b = new Vector(4.0, 5.0, 6.0);

        @Test
        @DisplayName("Add, subtract, multiply and negate")
        void basicOperations() {
            assertEquals(new Vector(5.0, 7.0, 9.0), a.add(b));
            assertEquals(new Vector(-3.0, -3.0, -3.0), a.subtract(b));
            assertEquals(new Vector(4.0, 10.0, 18.0), a.multiply(b));
            assertEquals(new Vector(2.0, 4.0, 6.0), a.multiply(2.0));
            assertEquals(new Vector(-1.0, -2.0, -3.0), a.negate());
        }

        @Test
        @DisplayName("Cross product is orthogonal to both operands")
        void cross() {
            Vector c = a.cross(b);
            assertEquals(new Vector(-3.0, 6.0, -3.0), c);
            assertEquals(0.0, c.dot(a), ERROR);
            assertEquals(0.0, c.dot(b), ERROR);
        }

        @Test
        @DisplayName("Dot product and norm")
        void dotAndNorm() {
            assertEquals(32.0, a.dot(b), ERROR);
            assertEquals(Math.sqrt(14.0), a.norm(), ERROR);
            assertEquals(a.norm(), a.getR(), ERROR);
        }

        @Test
        @DisplayName("Operands are not modified")
        void immutable() {
            a.add(b);
            a.negate();
            assertEquals(new Vector(1.0, 2.0, 3.0), a);
        }

        @Test
        @DisplayName("Equality and hash code")
        void equality() {
            Vector same = new Vector(1.0, 2.0, 3.0);
            assertEquals(a, same);
            assertEquals(a.hashCode(), same.hashCode());
            assertNotEquals(a, b);
            assertNotEquals(a, "(1, 2, 3)");
        }
    }

    // Helper methods

    private static void assertPolar(Vector v, double phi, double theta, double r) {
        assertEquals(phi, v.getPhi(), ERROR, "phi of " + v);
        assertEquals(theta, v.getTheta(), ERROR, "theta of " + v);
        assertEquals(r, v.getR(), ERROR, "r of " + v);
    }
}
