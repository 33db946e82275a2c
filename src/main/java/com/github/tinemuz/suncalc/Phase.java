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

import java.util.List;

/**
 * Moon phase, as the angle between sun and moon seen from the earth.
 */
public final class Phase {

    public static final Phase NEW_MOON = new Phase("NEW_MOON", 0.0);
    public static final Phase WAXING_CRESCENT = new Phase("WAXING_CRESCENT", 45.0);
    public static final Phase FIRST_QUARTER = new Phase("FIRST_QUARTER", 90.0);
    public static final Phase WAXING_GIBBOUS = new Phase("WAXING_GIBBOUS", 135.0);
    public static final Phase FULL_MOON = new Phase("FULL_MOON", 180.0);
    public static final Phase WANING_GIBBOUS = new Phase("WANING_GIBBOUS", 225.0);
    public static final Phase LAST_QUARTER = new Phase("LAST_QUARTER", 270.0);
    public static final Phase WANING_CRESCENT = new Phase("WANING_CRESCENT", 315.0);

    private static final List<Phase> VALUES = List.of(
            NEW_MOON, WAXING_CRESCENT, FIRST_QUARTER, WAXING_GIBBOUS,
            FULL_MOON, WANING_GIBBOUS, LAST_QUARTER, WANING_CRESCENT);

    private final String name;
    private final double angle;

    private Phase(String name, double angle) {
        this.name = name;
        this.angle = angle;
    }

    /**
     * The eight named phases, in order of their angle.
     */
    public static List<Phase> values() {
        return VALUES;
    }

    /**
     * A free phase angle. The angle is wrapped into [0, 360), so
     * {@code of(-45)} is the same phase as {@code of(315)}.
     *
     * @param angle angle in degrees, 0 is new moon and 180 is full moon
     */
    public static Phase of(double angle) {
        return new Phase(null, normalize(angle));
    }

    /**
     * Maps an angle to the nearest named phase. Each phase covers 45°
     * centered on its own angle; a boundary belongs to the later phase.
     *
     * @param angle angle in degrees, any range
     */
    public static Phase toPhase(double angle) {
        double normalized = normalize(angle);

        if (normalized < 22.5) {
            return NEW_MOON;
        }
        if (normalized < 67.5) {
            return WAXING_CRESCENT;
        }
        if (normalized < 112.5) {
            return FIRST_QUARTER;
        }
        if (normalized < 157.5) {
            return WAXING_GIBBOUS;
        }
        if (normalized < 202.5) {
            return FULL_MOON;
        }
        if (normalized < 247.5) {
            return WANING_GIBBOUS;
        }
        if (normalized < 292.5) {
            return LAST_QUARTER;
        }
        if (normalized < 337.5) {
            return WANING_CRESCENT;
        }
        return NEW_MOON;
    }

    static double normalize(double angle) {
        double normalized = angle % 360.0;
        if (normalized < 0.0) {
            normalized += 360.0;
        }
        // tiny negative angles round up to 360, and -0.0 must equal 0.0
        return normalized >= 360.0 ? 0.0 : normalized + 0.0;
    }

    public double getAngle() {
        return angle;
    }

    public double getAngleRad() {
        return Math.toRadians(angle);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Phase)) return false;
        return Double.compare(angle, ((Phase) obj).angle) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(angle);
    }

    @Override
    public String toString() {
        return name != null ? name : "Phase[angle=" + angle + "°]";
    }
}
