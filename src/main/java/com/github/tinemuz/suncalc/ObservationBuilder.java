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

import static com.google.common.base.Preconditions.checkNotNull;

import com.github.tinemuz.suncalc.util.ExtendedMath;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Fluent builder for the place and time of an observation. Each calculation
 * extends it with its own options.
 *
 * <p>Times given as calendar fields ({@code on(2017, 8, 10)}, a
 * {@link LocalDateTime}, {@link #midnight()}) are wall-clock times in the
 * builder's zone, which is resolved when the request is built. So
 * {@code on(2017, 8, 10).timezone("Europe/Berlin")} is midnight in Berlin.
 * Absolute times ({@link Instant}, {@link ZonedDateTime}, {@link #now()})
 * keep their instant when the zone is changed afterwards.</p>
 *
 * <p>Builders are plain value holders and not thread-safe. The requests they
 * build are immutable.</p>
 *
 * @param <B> concrete builder type
 */
public abstract class ObservationBuilder<B extends ObservationBuilder<B>> {

    private double latitude = 0.0;
    private double longitude = 0.0;
    private double height = 0.0;

    // exactly one of these is set
    private LocalDateTime localDateTime;
    private Instant instant = Instant.now();

    private ZoneId zone = ZoneId.systemDefault();

    protected ObservationBuilder() {
    }

    protected abstract B self();

    /**
     * Sets latitude and longitude, in degrees.
     *
     * @throws IllegalArgumentException if a coordinate is out of range
     */
    public B at(double lat, double lng) {
        latitude(lat);
        longitude(lng);
        return self();
    }

    /**
     * Sets the position from {@code {latitude, longitude}} or
     * {@code {latitude, longitude, height}}.
     *
     * @throws IllegalArgumentException if the array has neither 2 nor 3
     *     elements, or a coordinate is out of range
     */
    public B at(double[] coords) {
        GeoPosition position = GeoPosition.of(coords);
        latitude = position.latitude();
        longitude = position.longitude();
        if (coords.length == 3) {
            height = position.height();
        }
        return self();
    }

    /**
     * Sets the position.
     */
    public B at(GeoPosition position) {
        checkNotNull(position, "position");
        latitude = position.latitude();
        longitude = position.longitude();
        height = position.height();
        return self();
    }

    /**
     * Sets the latitude in degrees, positive north.
     *
     * @throws IllegalArgumentException if not within -90..90
     */
    public B latitude(double lat) {
        latitude = GeoPosition.checkLatitude(lat);
        return self();
    }

    /**
     * Sets the latitude in degrees, minutes and seconds. The sign is taken
     * from {@code d}.
     */
    public B latitude(int d, int m, double s) {
        return latitude(ExtendedMath.dms(d, m, s));
    }

    /**
     * Sets the longitude in degrees, positive east.
     *
     * @throws IllegalArgumentException if not within -180..180
     */
    public B longitude(double lng) {
        longitude = GeoPosition.checkLongitude(lng);
        return self();
    }

    /**
     * Sets the longitude in degrees, minutes and seconds. The sign is taken
     * from {@code d}.
     */
    public B longitude(int d, int m, double s) {
        return longitude(ExtendedMath.dms(d, m, s));
    }

    /**
     * Sets the height above sea level in meters. Negative values are
     * treated as 0.
     */
    public B height(double h) {
        height = Math.max(h, 0.0);
        return self();
    }

    /**
     * Midnight of the given date, in the builder's zone.
     *
     * @throws java.time.DateTimeException if the date is invalid
     */
    public B on(int year, int month, int day) {
        return on(year, month, day, 0, 0, 0);
    }

    /**
     * The given wall-clock time, in the builder's zone.
     *
     * @throws java.time.DateTimeException if a field is invalid
     */
    public B on(int year, int month, int day, int hour, int minute, int second) {
        return on(LocalDateTime.of(year, month, day, hour, minute, second));
    }

    /**
     * The given wall-clock time, in the builder's zone.
     */
    public B on(LocalDateTime dateTime) {
        localDateTime = checkNotNull(dateTime, "dateTime");
        instant = null;
        return self();
    }

    /**
     * Midnight of the given date, in the builder's zone.
     */
    public B on(LocalDate date) {
        checkNotNull(date, "date");
        return on(date.atStartOfDay());
    }

    /**
     * The given instant. The builder's zone becomes the zone of
     * {@code dateTime}.
     */
    public B on(ZonedDateTime dateTime) {
        checkNotNull(dateTime, "dateTime");
        on(dateTime.toInstant());
        zone = dateTime.getZone();
        return self();
    }

    /**
     * The given instant. The builder's zone is kept.
     */
    public B on(Instant instant) {
        this.instant = checkNotNull(instant, "instant");
        localDateTime = null;
        return self();
    }

    /**
     * The current instant.
     */
    public B now() {
        return on(Instant.now());
    }

    /**
     * Last midnight, in the builder's zone.
     */
    public B midnight() {
        return on(LocalDate.now(zone));
    }

    /**
     * Same as {@link #midnight()}.
     */
    public B today() {
        return midnight();
    }

    /**
     * Next midnight, in the builder's zone.
     */
    public B tomorrow() {
        return today().plusDays(1);
    }

    /**
     * Moves the time by whole days. Wall-clock times keep their time of day.
     */
    public B plusDays(long days) {
        if (localDateTime != null) {
            localDateTime = localDateTime.plusDays(days);
        } else {
            instant = instant.plus(Duration.ofDays(days));
        }
        return self();
    }

    /**
     * Moves the time by a fractional number of 24-hour days, rounded to
     * milliseconds.
     */
    public B plusDays(double days) {
        long millis = Math.round(days * 86_400_000.0);
        if (localDateTime != null) {
            localDateTime = localDateTime.plusNanos(millis * 1_000_000L);
        } else {
            instant = instant.plusMillis(millis);
        }
        return self();
    }

    /**
     * Sets the zone that wall-clock times are interpreted in, and that result
     * times are projected into.
     */
    public B timezone(ZoneId tz) {
        zone = checkNotNull(tz, "tz");
        return self();
    }

    /**
     * Sets the zone by its id, e.g. {@code "Europe/Berlin"}.
     *
     * @throws java.time.DateTimeException if the id is unknown
     */
    public B timezone(String id) {
        checkNotNull(id, "id");
        return timezone(ZoneId.of(id));
    }

    public B utc() {
        return timezone(ZoneOffset.UTC);
    }

    /**
     * Uses the system default zone.
     */
    public B localTime() {
        return timezone(ZoneId.systemDefault());
    }

    /**
     * Copies the position of another builder.
     */
    public B sameLocationAs(ObservationBuilder<?> other) {
        checkNotNull(other, "other");
        latitude = other.latitude;
        longitude = other.longitude;
        height = other.height;
        return self();
    }

    /**
     * Copies the time and zone of another builder.
     */
    public B sameTimeAs(ObservationBuilder<?> other) {
        checkNotNull(other, "other");
        localDateTime = other.localDateTime;
        instant = other.instant;
        zone = other.zone;
        return self();
    }

    /**
     * Resolves the time currently set.
     */
    protected ZonedDateTime dateTime() {
        return localDateTime != null
                ? localDateTime.atZone(zone)
                : instant.atZone(zone);
    }

    /**
     * Resolves the observation currently set.
     */
    protected Observation observation() {
        return new Observation(new GeoPosition(latitude, longitude, height), dateTime());
    }
}
