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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Geographic position of an observer.
 *
 * @param latitude  latitude in degrees, -90 (south) to 90 (north)
 * @param longitude longitude in degrees, -180 (west) to 180 (east)
 * @param height    height above sea level in meters, never negative
 */
public record GeoPosition(double latitude, double longitude, double height) {

    /**
     * Validates latitude and longitude. A negative height is clamped to 0,
     * so inaccurate GPS readings below sea level still work.
     *
     * @throws IllegalArgumentException if latitude or longitude is out of range
     */
    public GeoPosition {
        checkLatitude(latitude);
        checkLongitude(longitude);
        height = Math.max(height, 0.0);
    }

    public static GeoPosition of(double latitude, double longitude) {
        return new GeoPosition(latitude, longitude, 0.0);
    }

    public static GeoPosition of(double latitude, double longitude, double height) {
        return new GeoPosition(latitude, longitude, height);
    }

    /**
     * Creates a position from {@code {latitude, longitude}} or
     * {@code {latitude, longitude, height}}.
     *
     * @throws IllegalArgumentException if the array has neither 2 nor 3 elements
     */
    public static GeoPosition of(double[] coords) {
        checkNotNull(coords, "coords");
        checkArgument(coords.length == 2 || coords.length == 3,
                "Array must contain 2 or 3 doubles, got %s", coords.length);
        return new GeoPosition(coords[0], coords[1], coords.length == 3 ? coords[2] : 0.0);
    }

    /**
     * Latitude in radians.
     */
    public double latitudeRad() {
        return Math.toRadians(latitude);
    }

    /**
     * Longitude in radians.
     */
    public double longitudeRad() {
        return Math.toRadians(longitude);
    }

    static double checkLatitude(double lat) {
        checkArgument(lat >= -90.0 && lat <= 90.0, "Latitude out of range, -90 <= %s <= 90", lat);
        return lat;
    }

    static double checkLongitude(double lng) {
        checkArgument(lng >= -180.0 && lng <= 180.0, "Longitude out of range, -180 <= %s <= 180", lng);
        return lng;
    }
}
