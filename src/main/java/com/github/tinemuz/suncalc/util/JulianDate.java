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

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * A point in time expressed as a modified Julian date.
 *
 * <p>The wrapped {@link ZonedDateTime} only supplies the zone that derived
 * dates are projected into. All calculations use its absolute instant.</p>
 */
public final class JulianDate {

    private static final double MILLIS_PER_DAY = 86_400_000.0;
    private static final double UNIX_EPOCH_MJD = 40587.0;
    private static final double J2000_MJD = 51544.5;
    private static final double DAYS_PER_CENTURY = 36525.0;

    private final ZonedDateTime dateTime;
    private final double mjd;

    /**
     * Creates a new {@link JulianDate}.
     *
     * @param time date and time of the new instance
     */
    public JulianDate(ZonedDateTime time) {
        this.dateTime = checkNotNull(time, "time");
        this.mjd = time.toInstant().toEpochMilli() / MILLIS_PER_DAY + UNIX_EPOCH_MJD;
    }

    /**
     * Returns a new {@link JulianDate} shifted by the given number of hours.
     * The shift is rounded to whole milliseconds.
     */
    public JulianDate atHour(double hour) {
        return new JulianDate(dateTime.plusNanos(Math.round(hour * 3_600_000.0) * 1_000_000L));
    }

    /**
     * Returns a new {@link JulianDate} of the given modified Julian date, in
     * the zone of this instance. The instant is rounded to whole seconds.
     */
    public JulianDate atModifiedJulianDate(double mjd) {
        long seconds = Math.round((mjd - UNIX_EPOCH_MJD) * 86400.0);
        return new JulianDate(ZonedDateTime.ofInstant(Instant.ofEpochSecond(seconds), dateTime.getZone()));
    }

    /**
     * Returns a new {@link JulianDate} of the given Julian century, in the
     * zone of this instance.
     */
    public JulianDate atJulianCentury(double jc) {
        return atModifiedJulianDate(jc * DAYS_PER_CENTURY + J2000_MJD);
    }

    public ZonedDateTime getDateTime() {
        return dateTime;
    }

    public double getModifiedJulianDate() {
        return mjd;
    }

    /**
     * Julian centuries since J2000.0.
     */
    public double getJulianCentury() {
        return (mjd - J2000_MJD) / DAYS_PER_CENTURY;
    }

    /**
     * Greenwich Mean Sidereal Time, in radians within [0, 2π).
     */
    public double getGreenwichMeanSiderealTime() {
        final double secs = 86400.0;

        double mjd0 = Math.floor(mjd);
        double ut = (mjd - mjd0) * secs;
        double t0 = (mjd0 - J2000_MJD) / DAYS_PER_CENTURY;
        double t = (mjd - J2000_MJD) / DAYS_PER_CENTURY;

        double gmst = 24110.54841
                + 8640184.812866 * t0
                + 1.0027379093 * ut
                + (0.093104 - 6.2e-6 * t) * t * t;

        return (ExtendedMath.PI2 / secs) * (gmst % secs);
    }

    /**
     * Approximate true anomaly of the earth, derived from the day of year.
     */
    public double getTrueAnomaly() {
        return ExtendedMath.PI2 * ExtendedMath.frac((dateTime.getDayOfYear() - 5.0) / 365.256363);
    }

    @Override
    public String toString() {
        return String.format("%dd %02dh %02dm %02ds",
                (long) mjd,
                (long) (mjd * 24 % 24),
                (long) (mjd * 24 * 60 % 60),
                (long) (mjd * 24 * 60 * 60 % 60));
    }
}
