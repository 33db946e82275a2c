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

package com.github.tinemuz.suncalc;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PhaseTest {

    @Nested
    @DisplayName("Angle to phase mapping")
    class ToPhaseTests {

        @Test
        @DisplayName("Named phases map to themselves")
        void namedAngles() {
            for (Phase phase : Phase.values()) {
                assertSame(phase, Phase.toPhase(phase.getAngle()));
            }
        }

        @Test
        @DisplayName("Boundaries belong to the later phase")
        void boundaries() {
            assertSame(Phase.NEW_MOON, Phase.toPhase(22.4));
            assertSame(Phase.WAXING_CRESCENT, Phase.toPhase(22.5));
            assertSame(Phase.FIRST_QUARTER, Phase.toPhase(112.4));
            assertSame(Phase.WAXING_GIBBOUS, Phase.toPhase(112.5));
            assertSame(Phase.WANING_CRESCENT, Phase.toPhase(337.4));
            assertSame(Phase.NEW_MOON, Phase.toPhase(337.5));
        }

        @Test
        @DisplayName("Angles outside 0..360 wrap around")
        void wrapping() {
            assertSame(Phase.NEW_MOON, Phase.toPhase(360.0));
            assertSame(Phase.FULL_MOON, Phase.toPhase(540.0));
            assertSame(Phase.LAST_QUARTER, Phase.toPhase(-90.0));
            assertSame(Phase.WANING_CRESCENT, Phase.toPhase(-45.0));
            assertSame(Phase.FIRST_QUARTER, Phase.toPhase(-270.0));
            assertSame(Phase.NEW_MOON, Phase.toPhase(-720.0));
            assertSame(Phase.WAXING_GIBBOUS, Phase.toPhase(855.0));
            assertSame(Phase.WAXING_GIBBOUS, Phase.toPhase(-585.0));
            assertSame(Phase.WAXING_GIBBOUS, Phase.toPhase(-945.0));
            assertSame(Phase.NEW_MOON, Phase.toPhase(382.4));
        }
    }

    @Nested
    @DisplayName("Values")
    class ValueTests {

        @Test
        @DisplayName("Eight phases in order of their angle")
        void values() {
            assertEquals(8, Phase.values().size());
            double expected = 0.0;
            for (Phase phase : Phase.values()) {
                assertEquals(expected, phase.getAngle(), 0.0);
                expected += 45.0;
            }
        }

        @Test
        @DisplayName("Free angles compare by angle")
        void freeAngle() {
            assertEquals(Phase.FULL_MOON, Phase.of(180.0));
            assertEquals(Phase.FULL_MOON.hashCode(), Phase.of(180.0).hashCode());
            assertNotEquals(Phase.FULL_MOON, Phase.of(181.0));
            assertEquals(Math.PI, Phase.of(180.0).getAngleRad(), 1.0e-12);
            assertEquals("FULL_MOON", Phase.FULL_MOON.toString());
        }

        @Test
        @DisplayName("Free angles are wrapped into 0..360")
        void freeAngleWrapped() {
            assertEquals(40.0, Phase.of(400.0).getAngle(), 1.0e-9);
            assertEquals(315.0, Phase.of(-45.0).getAngle(), 1.0e-9);
            assertEquals(Phase.NEW_MOON, Phase.of(360.0));
            assertEquals(Phase.NEW_MOON, Phase.of(-0.0));
            assertEquals(Phase.FULL_MOON, Phase.of(-180.0));
            assertEquals(0.0, Phase.of(-1.0e-20).getAngle(), 0.0);
        }
    }
}
