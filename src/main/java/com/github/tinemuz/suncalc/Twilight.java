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
import java.util.Objects;

/**
 * Sun altitude that counts as sunrise or sunset.
 *
 * <p>A twilight is either geocentric, where the sun center has to cross a
 * fixed angle, or topocentric, where refraction, parallax and the visible
 * disc edge are taken into account.</p>
 */
public final class Twilight {

    /** Upper edge of the sun disc touches the horizon. Default. */
    public static final Twilight VISUAL = new Twilight("VISUAL", 0.0, 1.0);

    /** Lower edge of the sun disc touches the horizon. */
    public static final Twilight VISUAL_LOWER = new Twilight("VISUAL_LOWER", 0.0, -1.0);

    /** Center of the sun is at the horizon, no corrections. */
    public static final Twilight HORIZON = new Twilight("HORIZON", 0.0, null);

    public static final Twilight CIVIL = new Twilight("CIVIL", -6.0, null);

    public static final Twilight NAUTICAL = new Twilight("NAUTICAL", -12.0, null);

    public static final Twilight ASTRONOMICAL = new Twilight("ASTRONOMICAL", -18.0, null);

    /** Sun is 6° above the horizon. Golden hour lies between this and {@link #BLUE_HOUR}. */
    public static final Twilight GOLDEN_HOUR = new Twilight("GOLDEN_HOUR", 6.0, null);

    /** Sun is 4° below the horizon. */
    public static final Twilight BLUE_HOUR = new Twilight("BLUE_HOUR", -4.0, null);

    /** Sun is 8° below the horizon, the end of the blue hour. */
    public static final Twilight NIGHT_HOUR = new Twilight("NIGHT_HOUR", -8.0, null);

    private static final List<Twilight> VALUES = List.of(
            VISUAL, VISUAL_LOWER, HORIZON, CIVIL, NAUTICAL, ASTRONOMICAL,
            GOLDEN_HOUR, BLUE_HOUR, NIGHT_HOUR);

    private final String name;
    private final double angle;
    private final Double position;

    private Twilight(String name, double angle, Double position) {
        this.name = name;
        this.angle = angle;
        this.position = position;
    }

    /**
     * All predefined twilights.
     */
    public static List<Twilight> values() {
        return VALUES;
    }

    /**
     * Geocentric twilight at a free angle.
     *
     * @param angle sun altitude in degrees, negative below the horizon
     */
    public static Twilight of(double angle) {
        return new Twilight(null, angle, null);
    }

    /**
     * Topocentric twilight at a free angle.
     *
     * @param angle    sun altitude in degrees
     * @param position disc edge, 1 for the upper edge, 0 for the center,
     *                 -1 for the lower edge
     */
    public static Twilight of(double angle, double position) {
        return new Twilight(null, angle, position);
    }

    /**
     * Angle in degrees.
     */
    public double getAngle() {
        return angle;
    }

    /**
     * Angle in radians.
     */
    public double getAngleRad() {
        return Math.toRadians(angle);
    }

    /**
     * Disc edge position, or {@code null} for a geocentric twilight.
     */
    public Double getPosition() {
        return position;
    }

    public boolean isTopocentric() {
        return position != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Twilight)) return false;
        Twilight other = (Twilight) obj;
        return Double.compare(angle, other.angle) == 0 && Objects.equals(position, other.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(angle, position);
    }

    @Override
    public String toString() {
        if (name != null) {
            return name;
        }
        return "Twilight[angle=" + angle + "°" + (position != null ? ", position=" + position : "") + "]";
    }
}
